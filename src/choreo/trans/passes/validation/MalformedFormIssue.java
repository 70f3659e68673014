package choreo.trans.passes.validation;

import choreo.errors.Issue;
import choreo.errors.IssueVisitor;
import choreo.model.chor.ChorNode;

public class MalformedFormIssue extends Issue {

	private final ChorNode node;
	private final String reason;

	public MalformedFormIssue(ChorNode node, String reason) {
		this.node = node;
		this.reason = reason;
	}

	public ChorNode getNode() {
		return node;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
