package choreo.trans.passes.roles;

import choreo.errors.Issue;
import choreo.errors.IssueVisitor;
import choreo.model.chor.ChorIf;
import choreo.model.role.Role;

public class DifferingResultRolesIssue extends Issue {

	private final ChorIf node;
	private final Role thenOwner;
	private final Role elseOwner;

	public DifferingResultRolesIssue(ChorIf node, Role thenOwner, Role elseOwner) {
		this.node = node;
		this.thenOwner = thenOwner;
		this.elseOwner = elseOwner;
	}

	public ChorIf getNode() {
		return node;
	}

	public Role getThenOwner() {
		return thenOwner;
	}

	public Role getElseOwner() {
		return elseOwner;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
