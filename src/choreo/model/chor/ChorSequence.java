package choreo.model.chor;

import choreo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * 
 * (do expr ...)
 *
 */
public class ChorSequence extends ChorExpression {

	private final List<ChorExpression> exprs;

	public ChorSequence(SourceLocation location, List<ChorExpression> exprs) {
		super(location);
		this.exprs = exprs;
	}

	public List<ChorExpression> getExprs() {
		return exprs;
	}

	@Override
	public <T, E extends Throwable> T accept(ChorExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(exprs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return Objects.equals(exprs, ((ChorSequence) obj).exprs);
	}

}
