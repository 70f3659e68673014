package choreo.trans.passes.roles;

import choreo.errors.Issue;
import choreo.errors.IssueVisitor;
import choreo.model.chor.ChorExpression;

public class UnlocatedFormIssue extends Issue {

	private final ChorExpression node;

	public UnlocatedFormIssue(ChorExpression node) {
		this.node = node;
	}

	public ChorExpression getNode() {
		return node;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
