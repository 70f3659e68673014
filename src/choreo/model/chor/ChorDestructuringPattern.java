package choreo.model.chor;

import choreo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * 
 * A nested binder structure: [x [y z]]
 *
 */
public class ChorDestructuringPattern extends ChorExpression {

	private final List<ChorExpression> elements;

	public ChorDestructuringPattern(SourceLocation location, List<ChorExpression> elements) {
		super(location);
		this.elements = elements;
	}

	public List<ChorExpression> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(ChorExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(elements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return Objects.equals(elements, ((ChorDestructuringPattern) obj).elements);
	}

}
