package choreo.trans.passes.roles;

import choreo.model.annotated.AnnotatedNode;
import choreo.model.chor.ChorExpression;
import choreo.model.role.Role;
import choreo.model.role.RoleSet;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Determines, for every node of an expanded choreography, its owner (the role that
 * holds its value, if any is established) and its involved roles.
 * 
 * Role forms are consumed: (Ana e) becomes the annotation of e with Ana forced as its
 * owner.
 */
public class RoleAnalysisPass {
	private static final Logger logger = Logger.getLogger(RoleAnalysisPass.class.getName());

	private RoleAnalysisPass() {}

	public static AnnotatedNode perform(RoleSet roles, ChorExpression expr) {
		return perform(roles, expr, RoleAnalysisOptions.defaults());
	}

	public static AnnotatedNode perform(RoleSet roles, ChorExpression expr, RoleAnalysisOptions options) {
		return perform(roles, Optional.empty(), expr, options);
	}

	public static AnnotatedNode perform(RoleSet roles, Optional<Role> context, ChorExpression expr,
	                                    RoleAnalysisOptions options) {
		if (context.isPresent() && !roles.contains(context.get())) {
			throw new IllegalArgumentException("context role " + context.get() + " is not one of " + roles);
		}
		logger.fine("analyzing roles for " + roles + " under context " + context.map(Role::getName).orElse("none"));
		return expr.accept(new ChorExpressionRoleAnalysisVisitor(roles, context, options, 0));
	}
}
