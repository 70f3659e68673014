package choreo.model.chor;

import choreo.util.SourceLocation;

/**
 * 
 * A plain, unqualified name: x
 *
 */
public class ChorIdentifier extends ChorExpression {

	private final String name;

	public ChorIdentifier(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ChorExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return (name == null) ? 0 : name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ChorIdentifier other = (ChorIdentifier) obj;
		if (name == null) {
			return other.name == null;
		}
		return name.equals(other.name);
	}

}
