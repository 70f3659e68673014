package choreo.trans.passes.expansion;

import choreo.model.chor.*;
import choreo.model.role.Role;
import choreo.model.role.RoleSet;
import choreo.trans.passes.validation.FormShapes;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Expands one expression. Only do, let, if, select, role forms and destructuring
 * patterns are descended into; opaque forms are returned as they are.
 */
public class ChorExpressionRoleExpansionVisitor extends ChorExpressionVisitor<ChorExpression, RuntimeException> {

	private final RoleSet roles;
	private final int depth;
	private final int maxDepth;

	public ChorExpressionRoleExpansionVisitor(RoleSet roles, int depth, int maxDepth) {
		this.roles = roles;
		this.depth = depth;
		this.maxDepth = maxDepth;
	}

	private ChorExpression expand(ChorExpression expr) {
		FormShapes.checkDepth(expr, depth + 1, maxDepth);
		return expr.accept(new ChorExpressionRoleExpansionVisitor(roles, depth + 1, maxDepth));
	}

	private List<ChorExpression> expandAll(List<ChorExpression> exprs) {
		List<ChorExpression> result = new ArrayList<>(exprs.size());
		for (ChorExpression expr : exprs) {
			result.add(expand(expr));
		}
		return result;
	}

	@Override
	public ChorExpression visit(ChorIdentifier identifier) {
		return identifier;
	}

	@Override
	public ChorExpression visit(ChorQualifiedIdentifier qualifiedIdentifier) {
		FormShapes.checkQualifiedIdentifier(qualifiedIdentifier);
		Optional<Role> role = roles.lookup(qualifiedIdentifier.getQualifier());
		if (!role.isPresent()) {
			return qualifiedIdentifier;
		}
		return new ChorRoleForm(
				qualifiedIdentifier.getLocation(),
				role.get(),
				new ChorIdentifier(qualifiedIdentifier.getLocation(), qualifiedIdentifier.getName()));
	}

	@Override
	public ChorExpression visit(ChorLiteral literal) {
		return literal;
	}

	@Override
	public ChorExpression visit(ChorSequence sequence) {
		FormShapes.checkSequence(sequence);
		return new ChorSequence(sequence.getLocation(), expandAll(sequence.getExprs()));
	}

	@Override
	public ChorExpression visit(ChorLet let) {
		FormShapes.checkLet(let);
		List<ChorLetBinding> bindings = new ArrayList<>(let.getBindings().size());
		for (ChorLetBinding binding : let.getBindings()) {
			// binders are expanded like any expression, so Ana/x binds x at Ana
			bindings.add(new ChorLetBinding(
					binding.getLocation(),
					expand(binding.getPattern()),
					expand(binding.getValue())));
		}
		return new ChorLet(let.getLocation(), bindings, expandAll(let.getBody()));
	}

	@Override
	public ChorExpression visit(ChorIf chorIf) {
		FormShapes.checkIf(chorIf);
		return new ChorIf(
				chorIf.getLocation(),
				expand(chorIf.getCond()),
				expand(chorIf.getThen()),
				expand(chorIf.getElse()));
	}

	@Override
	public ChorExpression visit(ChorSelect select) {
		FormShapes.checkSelect(select);
		return new ChorSelect(select.getLocation(), expandAll(select.getChoosers()), expandAll(select.getBody()));
	}

	@Override
	public ChorExpression visit(ChorRoleForm roleForm) {
		FormShapes.checkRoleForm(roleForm);
		if (!roles.contains(roleForm.getRole())) {
			// not a role form in this run; role analysis reports it
			return roleForm;
		}
		return new ChorRoleForm(roleForm.getLocation(), roleForm.getRole(), expand(roleForm.getExpr()));
	}

	@Override
	public ChorExpression visit(ChorDestructuringPattern pattern) {
		FormShapes.checkPattern(pattern);
		return new ChorDestructuringPattern(pattern.getLocation(), expandAll(pattern.getElements()));
	}

	@Override
	public ChorExpression visit(ChorOpaqueForm opaqueForm) {
		return opaqueForm;
	}
}
