package choreo.model.chor;

import choreo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * 
 * Any compound form outside the choreographic core, e.g. a function application
 * (f a b). Role expansion and role analysis never look inside it.
 *
 */
public class ChorOpaqueForm extends ChorExpression {

	private final String head;
	private final List<ChorExpression> operands;

	public ChorOpaqueForm(SourceLocation location, String head, List<ChorExpression> operands) {
		super(location);
		this.head = head;
		this.operands = operands;
	}

	public String getHead() {
		return head;
	}

	public List<ChorExpression> getOperands() {
		return operands;
	}

	@Override
	public <T, E extends Throwable> T accept(ChorExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(head, operands);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ChorOpaqueForm other = (ChorOpaqueForm) obj;
		return Objects.equals(head, other.head) && Objects.equals(operands, other.operands);
	}

}
