package choreo.model.chor;

import choreo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * 
 * (select [chooser ...] body ...)
 * 
 * The choosers name the branch being taken and the roles that are told about it.
 * The body is the reaction to that choice.
 *
 */
public class ChorSelect extends ChorExpression {

	private final List<ChorExpression> choosers;
	private final List<ChorExpression> body;

	public ChorSelect(SourceLocation location, List<ChorExpression> choosers, List<ChorExpression> body) {
		super(location);
		this.choosers = choosers;
		this.body = body;
	}

	public List<ChorExpression> getChoosers() {
		return choosers;
	}

	public List<ChorExpression> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(ChorExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(choosers, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ChorSelect other = (ChorSelect) obj;
		return Objects.equals(choosers, other.choosers) && Objects.equals(body, other.body);
	}

}
