package choreo.trans.passes.roles;

import choreo.errors.Issue;
import choreo.errors.IssueVisitor;
import choreo.model.chor.ChorRoleForm;
import choreo.model.role.RoleSet;

public class UndeclaredRoleIssue extends Issue {

	private final ChorRoleForm roleForm;
	private final RoleSet activeRoles;

	public UndeclaredRoleIssue(ChorRoleForm roleForm, RoleSet activeRoles) {
		this.roleForm = roleForm;
		this.activeRoles = activeRoles;
	}

	public ChorRoleForm getRoleForm() {
		return roleForm;
	}

	public RoleSet getActiveRoles() {
		return activeRoles;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
