package choreo.model.chor;

import choreo.util.SourceLocation;

/**
 * 
 * (if cond then else)
 *
 */
public class ChorIf extends ChorExpression {

	private final ChorExpression cond;
	private final ChorExpression thenExpr;
	private final ChorExpression elseExpr;

	public ChorIf(SourceLocation location, ChorExpression cond, ChorExpression thenExpr, ChorExpression elseExpr) {
		super(location);
		this.cond = cond;
		this.thenExpr = thenExpr;
		this.elseExpr = elseExpr;
	}

	public ChorExpression getCond() {
		return cond;
	}

	public ChorExpression getThen() {
		return thenExpr;
	}

	public ChorExpression getElse() {
		return elseExpr;
	}

	@Override
	public <T, E extends Throwable> T accept(ChorExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((cond == null) ? 0 : cond.hashCode());
		result = prime * result + ((elseExpr == null) ? 0 : elseExpr.hashCode());
		result = prime * result + ((thenExpr == null) ? 0 : thenExpr.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ChorIf other = (ChorIf) obj;
		if (cond == null) {
			if (other.cond != null)
				return false;
		} else if (!cond.equals(other.cond))
			return false;
		if (elseExpr == null) {
			if (other.elseExpr != null)
				return false;
		} else if (!elseExpr.equals(other.elseExpr))
			return false;
		if (thenExpr == null) {
			if (other.thenExpr != null)
				return false;
		} else if (!thenExpr.equals(other.thenExpr))
			return false;
		return true;
	}

}
