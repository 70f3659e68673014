package choreo.trans.intermediate;

import choreo.model.annotated.AnnotatedNode;
import choreo.model.chor.ChorExpression;
import choreo.model.role.RoleSet;

/**
 * What the front end hands to projection: the role-expanded tree and its
 * annotation, together with the roles they were computed for.
 */
public class RoleAnalysisResult {

	private final String name;
	private final RoleSet roles;
	private final ChorExpression expanded;
	private final AnnotatedNode annotated;

	public RoleAnalysisResult(String name, RoleSet roles, ChorExpression expanded, AnnotatedNode annotated) {
		this.name = name;
		this.roles = roles;
		this.expanded = expanded;
		this.annotated = annotated;
	}

	public String getName() {
		return name;
	}

	public RoleSet getRoles() {
		return roles;
	}

	public ChorExpression getExpanded() {
		return expanded;
	}

	public AnnotatedNode getAnnotated() {
		return annotated;
	}
}
