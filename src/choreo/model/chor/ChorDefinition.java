package choreo.model.chor;

import choreo.formatters.ChorNodeFormattingVisitor;
import choreo.util.SourceLocation;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * 
 * A named top-level choreography together with the roles it declares:
 * 
 * (defchor name [Role ...] body)
 *
 */
public class ChorDefinition extends ChorNode {

	private final String name;
	private final List<String> roles;
	private final ChorExpression body;

	public ChorDefinition(SourceLocation location, String name, List<String> roles, ChorExpression body) {
		super(location);
		this.name = name;
		this.roles = roles;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<String> getRoles() {
		return roles;
	}

	public ChorExpression getBody() {
		return body;
	}

	@Override
	protected void format(ChorNodeFormattingVisitor formatter) throws IOException {
		formatter.format(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, roles, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ChorDefinition other = (ChorDefinition) obj;
		return Objects.equals(name, other.name) && Objects.equals(roles, other.roles) &&
				Objects.equals(body, other.body);
	}

}
