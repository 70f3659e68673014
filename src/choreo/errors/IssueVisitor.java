package choreo.errors;

import choreo.trans.passes.roles.DifferingResultRolesIssue;
import choreo.trans.passes.roles.UndeclaredRoleIssue;
import choreo.trans.passes.roles.UnlocatedFormIssue;
import choreo.trans.passes.validation.DuplicateRoleIssue;
import choreo.trans.passes.validation.InvalidRoleNameIssue;
import choreo.trans.passes.validation.MalformedFormIssue;
import choreo.trans.passes.validation.NestingTooDeepIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(MalformedFormIssue malformedFormIssue) throws E;
	public abstract T visit(UndeclaredRoleIssue undeclaredRoleIssue) throws E;
	public abstract T visit(NestingTooDeepIssue nestingTooDeepIssue) throws E;
	public abstract T visit(DifferingResultRolesIssue differingResultRolesIssue) throws E;
	public abstract T visit(UnlocatedFormIssue unlocatedFormIssue) throws E;
	public abstract T visit(DuplicateRoleIssue duplicateRoleIssue) throws E;
	public abstract T visit(InvalidRoleNameIssue invalidRoleNameIssue) throws E;
}
