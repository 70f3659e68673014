package choreo.model.role;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 
 * The set of roles recognized by one expansion or analysis run. Whether a form
 * is a role form is decided only by membership in this set.
 * 
 * Instances are immutable and may be shared between concurrent analyses.
 *
 */
public final class RoleSet implements Iterable<Role> {
	private static final RoleSet EMPTY = new RoleSet(Collections.emptySet());

	private final Set<Role> roles;

	private RoleSet(Set<Role> roles) {
		this.roles = roles;
	}

	public static RoleSet empty() {
		return EMPTY;
	}

	public static RoleSet of(Collection<Role> roles) {
		return new RoleSet(Collections.unmodifiableSet(new LinkedHashSet<>(roles)));
	}

	public static RoleSet of(String... names) {
		return of(Arrays.stream(names).map(Role::of).collect(Collectors.toList()));
	}

	public boolean contains(Role role) {
		return roles.contains(role);
	}

	public boolean contains(String name) {
		return roles.contains(Role.of(name));
	}

	/**
	 * @return the role called name, if name is a recognized role
	 */
	public Optional<Role> lookup(String name) {
		Role role = Role.of(name);
		return roles.contains(role) ? Optional.of(role) : Optional.empty();
	}

	public Set<Role> getRoles() {
		return roles;
	}

	public int size() {
		return roles.size();
	}

	public boolean isEmpty() {
		return roles.isEmpty();
	}

	@Override
	public Iterator<Role> iterator() {
		return roles.iterator();
	}

	@Override
	public int hashCode() {
		return roles.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return roles.equals(((RoleSet) obj).roles);
	}

	@Override
	public String toString() {
		return roles.stream().sorted().map(Role::getName).collect(Collectors.joining(", ", "#{", "}"));
	}
}
