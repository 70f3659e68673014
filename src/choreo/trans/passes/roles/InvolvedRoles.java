package choreo.trans.passes.roles;

import choreo.model.annotated.AnnotatedNode;
import choreo.model.chor.ChorExpression;
import choreo.model.chor.ChorIdentifier;
import choreo.model.role.Role;
import choreo.model.role.RoleSet;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the involved roles of annotated nodes. The rule is the union of the roles
 * of all descendants, plus the roles a node names explicitly. All of it is kept here
 * so that the rule can change without touching the traversal.
 */
public final class InvolvedRoles {
	private InvolvedRoles() {}

	/**
	 * Roles of a leaf analyzed under context.
	 */
	public static Set<Role> ofLeaf(Optional<Role> context) {
		return context.map(Collections::singleton).orElse(Collections.emptySet());
	}

	/**
	 * Roles of a compound node whose children are children.
	 */
	public static Set<Role> ofChildren(Collection<AnnotatedNode> children) {
		Set<Role> result = new LinkedHashSet<>();
		for (AnnotatedNode child : children) {
			result.addAll(child.getRoles());
		}
		return result;
	}

	/**
	 * Roles of a destructuring pattern analyzed under context that contains role
	 * forms for nestedRoles.
	 */
	public static Set<Role> ofPattern(Optional<Role> context, Set<Role> nestedRoles) {
		Set<Role> result = new LinkedHashSet<>(ofLeaf(context));
		result.addAll(nestedRoles);
		return result;
	}

	/**
	 * Roles of a selection: its children, plus every chooser that directly names an
	 * active role, as those roles are told about the choice.
	 */
	public static Set<Role> ofSelect(RoleSet activeRoles, Collection<ChorExpression> choosers,
	                                 Collection<AnnotatedNode> children) {
		Set<Role> result = ofChildren(children);
		for (ChorExpression chooser : choosers) {
			if (chooser instanceof ChorIdentifier) {
				activeRoles.lookup(((ChorIdentifier) chooser).getName()).ifPresent(result::add);
			}
		}
		return result;
	}

	/**
	 * Roles of the result of a role form for role whose body has bodyRoles.
	 */
	public static Set<Role> ofRoleForm(Role role, Set<Role> bodyRoles) {
		Set<Role> result = new LinkedHashSet<>(bodyRoles);
		result.add(role);
		return result;
	}
}
