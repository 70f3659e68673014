package choreo.trans.passes.roles;

import choreo.model.annotated.*;
import choreo.model.chor.*;
import choreo.model.role.Role;
import choreo.model.role.RoleSet;
import choreo.trans.passes.validation.FormShapes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Annotates one expression under a fixed context, the owner inherited from the
 * nearest enclosing role form.
 * 
 * Every child of a compound is analyzed under the same context as its parent, and a
 * compound is owned by its context only. Owners never flow upwards or sideways.
 */
public class ChorExpressionRoleAnalysisVisitor extends ChorExpressionVisitor<AnnotatedNode, RuntimeException> {

	private final RoleSet roles;
	private final Optional<Role> context;
	private final RoleAnalysisOptions options;
	private final int depth;

	public ChorExpressionRoleAnalysisVisitor(RoleSet roles, Optional<Role> context, RoleAnalysisOptions options,
	                                         int depth) {
		this.roles = roles;
		this.context = context;
		this.options = options;
		this.depth = depth;
	}

	private AnnotatedNode analyze(Optional<Role> childContext, ChorExpression expr, int childDepth) {
		FormShapes.checkDepth(expr, childDepth, options.getMaxNestingDepth());
		return expr.accept(new ChorExpressionRoleAnalysisVisitor(roles, childContext, options, childDepth));
	}

	private AnnotatedNode analyze(Optional<Role> childContext, ChorExpression expr) {
		return analyze(childContext, expr, depth + 1);
	}

	/**
	 * (Ana x) is what Ana/x expands to, so a role form around a bare identifier
	 * occupies a single nesting level, as the qualified identifier did.
	 */
	private static int bodyDepth(ChorRoleForm roleForm, int roleFormDepth) {
		return roleForm.getExpr() instanceof ChorIdentifier ? roleFormDepth : roleFormDepth + 1;
	}

	private AnnotatedNode analyze(ChorExpression expr) {
		return analyze(context, expr);
	}

	private List<AnnotatedNode> analyzeAll(List<ChorExpression> exprs) {
		List<AnnotatedNode> result = new ArrayList<>(exprs.size());
		for (ChorExpression expr : exprs) {
			result.add(analyze(expr));
		}
		return result;
	}

	private void checkActive(ChorRoleForm roleForm) {
		if (!roles.contains(roleForm.getRole())) {
			throw new UndeclaredRoleIssue(roleForm, roles);
		}
	}

	private AnnotatedNode leaf(ChorExpression leaf) {
		if (!context.isPresent() && options.rejectsUnlocatedLeaves()) {
			throw new UnlocatedFormIssue(leaf);
		}
		return new AnnotatedLiteral(leaf, context, InvolvedRoles.ofLeaf(context));
	}

	/**
	 * Validates the role forms nested inside a pattern element and collects their roles
	 * without annotating the element itself.
	 */
	private void collectPatternRoles(ChorExpression element, Set<Role> into, int elementDepth) {
		FormShapes.checkDepth(element, elementDepth, options.getMaxNestingDepth());
		if (element instanceof ChorRoleForm) {
			ChorRoleForm roleForm = (ChorRoleForm) element;
			FormShapes.checkRoleForm(roleForm);
			checkActive(roleForm);
			into.add(roleForm.getRole());
			collectPatternRoles(roleForm.getExpr(), into, bodyDepth(roleForm, elementDepth));
		} else if (element instanceof ChorDestructuringPattern) {
			ChorDestructuringPattern pattern = (ChorDestructuringPattern) element;
			FormShapes.checkPattern(pattern);
			for (ChorExpression nested : pattern.getElements()) {
				collectPatternRoles(nested, into, elementDepth + 1);
			}
		}
	}

	@Override
	public AnnotatedNode visit(ChorIdentifier identifier) {
		return leaf(identifier);
	}

	@Override
	public AnnotatedNode visit(ChorQualifiedIdentifier qualifiedIdentifier) {
		FormShapes.checkQualifiedIdentifier(qualifiedIdentifier);
		// only inactive qualifiers survive expansion; they are plain references
		return leaf(qualifiedIdentifier);
	}

	@Override
	public AnnotatedNode visit(ChorLiteral literal) {
		return leaf(literal);
	}

	@Override
	public AnnotatedNode visit(ChorSequence sequence) {
		FormShapes.checkSequence(sequence);
		List<AnnotatedNode> exprs = analyzeAll(sequence.getExprs());
		return new AnnotatedSequence(sequence, exprs, context, InvolvedRoles.ofChildren(exprs));
	}

	@Override
	public AnnotatedNode visit(ChorLet let) {
		FormShapes.checkLet(let);
		List<AnnotatedLetBinding> bindings = new ArrayList<>(let.getBindings().size());
		List<AnnotatedNode> children = new ArrayList<>();
		for (ChorLetBinding binding : let.getBindings()) {
			AnnotatedNode pattern = analyze(binding.getPattern());
			AnnotatedNode value = analyze(binding.getValue());
			bindings.add(new AnnotatedLetBinding(binding, pattern, value));
			children.add(pattern);
			children.add(value);
		}
		List<AnnotatedNode> body = analyzeAll(let.getBody());
		children.addAll(body);
		return new AnnotatedLet(let, bindings, body, context, InvolvedRoles.ofChildren(children));
	}

	@Override
	public AnnotatedNode visit(ChorIf chorIf) {
		FormShapes.checkIf(chorIf);
		AnnotatedNode cond = analyze(chorIf.getCond());
		AnnotatedNode thenExpr = analyze(chorIf.getThen());
		AnnotatedNode elseExpr = analyze(chorIf.getElse());
		options.getBranchOwnershipPolicy().check(chorIf, context, thenExpr, elseExpr);
		return new AnnotatedIf(chorIf, cond, thenExpr, elseExpr, context,
				InvolvedRoles.ofChildren(Arrays.asList(cond, thenExpr, elseExpr)));
	}

	@Override
	public AnnotatedNode visit(ChorSelect select) {
		FormShapes.checkSelect(select);
		List<AnnotatedNode> choosers = analyzeAll(select.getChoosers());
		List<AnnotatedNode> body = analyzeAll(select.getBody());
		List<AnnotatedNode> children = new ArrayList<>(choosers);
		children.addAll(body);
		return new AnnotatedSelect(select, choosers, body, context,
				InvolvedRoles.ofSelect(roles, select.getChoosers(), children));
	}

	@Override
	public AnnotatedNode visit(ChorRoleForm roleForm) {
		FormShapes.checkRoleForm(roleForm);
		checkActive(roleForm);
		Role role = roleForm.getRole();
		AnnotatedNode body = analyze(Optional.of(role), roleForm.getExpr(), bodyDepth(roleForm, depth));
		Set<Role> involved = InvolvedRoles.ofRoleForm(role, body.getRoles());
		if (body.getOwner().isPresent() && !body.getOwner().get().equals(role)) {
			// (Ana (Bob x)): x stays at Bob, inside a sequence at Ana
			ChorSequence wrapper = new ChorSequence(roleForm.getLocation(),
					Collections.singletonList(roleForm.getExpr()));
			return new AnnotatedSequence(wrapper, Collections.singletonList(body), Optional.of(role), involved);
		}
		return body.reannotate(Optional.of(role), involved);
	}

	@Override
	public AnnotatedNode visit(ChorDestructuringPattern pattern) {
		FormShapes.checkPattern(pattern);
		Set<Role> nestedRoles = new LinkedHashSet<>();
		for (ChorExpression element : pattern.getElements()) {
			collectPatternRoles(element, nestedRoles, depth + 1);
		}
		return new AnnotatedPattern(pattern, context, InvolvedRoles.ofPattern(context, nestedRoles));
	}

	@Override
	public AnnotatedNode visit(ChorOpaqueForm opaqueForm) {
		return new AnnotatedOpaque(opaqueForm, Optional.empty(), Collections.emptySet());
	}
}
