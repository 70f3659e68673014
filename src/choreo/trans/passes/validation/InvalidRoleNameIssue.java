package choreo.trans.passes.validation;

import choreo.errors.Issue;
import choreo.errors.IssueVisitor;
import choreo.model.chor.ChorDefinition;

public class InvalidRoleNameIssue extends Issue {

	private final ChorDefinition definition;
	private final String role;

	public InvalidRoleNameIssue(ChorDefinition definition, String role) {
		this.definition = definition;
		this.role = role;
	}

	public ChorDefinition getDefinition() {
		return definition;
	}

	public String getRole() {
		return role;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
