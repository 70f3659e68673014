package choreo.model.chor;

import choreo.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * A name qualified by another name: Ana/x
 * 
 * When the qualifier is a recognized role this is shorthand for (Ana x). Otherwise it
 * is an ordinary reference and is left alone.
 *
 */
public class ChorQualifiedIdentifier extends ChorExpression {

	private final String qualifier;
	private final String name;

	public ChorQualifiedIdentifier(SourceLocation location, String qualifier, String name) {
		super(location);
		this.qualifier = qualifier;
		this.name = name;
	}

	public String getQualifier() {
		return qualifier;
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
		return Objects.hash(qualifier, name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ChorQualifiedIdentifier other = (ChorQualifiedIdentifier) obj;
		return Objects.equals(qualifier, other.qualifier) && Objects.equals(name, other.name);
	}

}
