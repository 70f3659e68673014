package choreo.trans.passes.validation;

import choreo.errors.IssueContext;
import choreo.model.chor.ChorDefinition;
import choreo.model.role.Role;
import choreo.model.role.RoleSet;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the roles a choreography declares: each must be an unqualified name and
 * none may be declared twice. Unlike the expansion and analysis passes this pass
 * reports every problem it finds.
 */
public class RoleDeclarationValidationPass {
	private RoleDeclarationValidationPass() {}

	public static void perform(IssueContext ctx, ChorDefinition definition) {
		Set<String> seen = new HashSet<>();
		for (String role : definition.getRoles()) {
			if (!Role.isValidName(role)) {
				ctx.error(new InvalidRoleNameIssue(definition, role));
				continue;
			}
			if (!seen.add(role)) {
				ctx.error(new DuplicateRoleIssue(definition, role));
			}
		}
	}

	/**
	 * @return the active role set of a definition that passed {@link #perform}
	 */
	public static RoleSet declaredRoles(ChorDefinition definition) {
		List<Role> roles = new ArrayList<>();
		for (String role : definition.getRoles()) {
			roles.add(Role.of(role));
		}
		return RoleSet.of(roles);
	}
}
