package choreo.trans.passes.validation;

import choreo.errors.Issue;
import choreo.errors.IssueVisitor;
import choreo.model.chor.ChorNode;

public class NestingTooDeepIssue extends Issue {

	private final ChorNode node;
	private final int maxDepth;

	public NestingTooDeepIssue(ChorNode node, int maxDepth) {
		this.node = node;
		this.maxDepth = maxDepth;
	}

	public ChorNode getNode() {
		return node;
	}

	public int getMaxDepth() {
		return maxDepth;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
