package choreo.model.role;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named participant of a choreography. Roles have no structure beyond their name.
 */
public final class Role implements Comparable<Role> {
	private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_\\-]*");

	private final String name;

	private Role(String name) {
		this.name = name;
	}

	public static Role of(String name) {
		Objects.requireNonNull(name, "role name");
		return new Role(name);
	}

	/**
	 * @return whether name can name a role, i.e. is a non-empty unqualified identifier
	 */
	public static boolean isValidName(String name) {
		return name != null && VALID_NAME.matcher(name).matches();
	}

	public String getName() {
		return name;
	}

	@Override
	public int compareTo(Role other) {
		return name.compareTo(other.name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return name.equals(((Role) obj).name);
	}

	@Override
	public String toString() {
		return name;
	}
}
