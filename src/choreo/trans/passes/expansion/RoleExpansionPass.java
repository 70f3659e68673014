package choreo.trans.passes.expansion;

import choreo.model.chor.ChorExpression;
import choreo.model.role.RoleSet;
import choreo.trans.passes.roles.RoleAnalysisOptions;

import java.util.logging.Logger;

/**
 * Rewrites role-qualified identifiers into explicit role forms, i.e. Ana/x into
 * (Ana x). Qualified identifiers whose qualifier is not an active role are kept as
 * they are.
 */
public class RoleExpansionPass {
	private static final Logger logger = Logger.getLogger(RoleExpansionPass.class.getName());

	private RoleExpansionPass() {}

	public static ChorExpression perform(RoleSet roles, ChorExpression expr) {
		return perform(roles, expr, RoleAnalysisOptions.DEFAULT_MAX_NESTING_DEPTH);
	}

	public static ChorExpression perform(RoleSet roles, ChorExpression expr, int maxNestingDepth) {
		logger.fine("expanding role-qualified identifiers for roles " + roles);
		return expr.accept(new ChorExpressionRoleExpansionVisitor(roles, 0, maxNestingDepth));
	}
}
