package choreo.trans.passes.validation;

import choreo.model.chor.*;

import java.util.List;

/**
 * Structural checks shared by role expansion and role analysis. Each check throws a
 * {@link MalformedFormIssue} pointing at the offending node.
 */
public class FormShapes {
	private FormShapes() {}

	private static void checkParts(ChorNode node, String what, List<? extends ChorNode> parts) {
		if (parts == null) {
			throw new MalformedFormIssue(node, "missing " + what);
		}
		for (int i = 0; i < parts.size(); ++i) {
			if (parts.get(i) == null) {
				throw new MalformedFormIssue(node, "missing " + what + " at position " + i);
			}
		}
	}

	private static void checkPart(ChorNode node, String what, ChorNode part) {
		if (part == null) {
			throw new MalformedFormIssue(node, "missing " + what);
		}
	}

	public static void checkQualifiedIdentifier(ChorQualifiedIdentifier qualifiedIdentifier) {
		if (qualifiedIdentifier.getQualifier() == null) {
			throw new MalformedFormIssue(qualifiedIdentifier, "missing qualifier");
		}
		if (qualifiedIdentifier.getName() == null) {
			throw new MalformedFormIssue(qualifiedIdentifier, "missing name");
		}
	}

	public static void checkSequence(ChorSequence sequence) {
		checkParts(sequence, "expression", sequence.getExprs());
		if (sequence.getExprs().isEmpty()) {
			throw new MalformedFormIssue(sequence, "`do` needs at least 1 expression");
		}
	}

	public static void checkLet(ChorLet let) {
		checkParts(let, "binding", let.getBindings());
		for (ChorLetBinding binding : let.getBindings()) {
			checkPart(binding, "binding pattern", binding.getPattern());
			checkPart(binding, "binding value", binding.getValue());
		}
		checkParts(let, "body expression", let.getBody());
	}

	public static void checkIf(ChorIf chorIf) {
		checkPart(chorIf, "condition", chorIf.getCond());
		checkPart(chorIf, "then branch", chorIf.getThen());
		checkPart(chorIf, "else branch", chorIf.getElse());
	}

	public static void checkSelect(ChorSelect select) {
		checkParts(select, "chooser", select.getChoosers());
		if (select.getChoosers().isEmpty()) {
			throw new MalformedFormIssue(select, "`select` needs a non-empty chooser list");
		}
		checkParts(select, "body expression", select.getBody());
	}

	public static void checkRoleForm(ChorRoleForm roleForm) {
		if (roleForm.getRole() == null) {
			throw new MalformedFormIssue(roleForm, "missing role");
		}
		checkPart(roleForm, "role form body", roleForm.getExpr());
	}

	public static void checkPattern(ChorDestructuringPattern pattern) {
		checkParts(pattern, "pattern element", pattern.getElements());
	}

	public static void checkDepth(ChorNode node, int depth, int maxDepth) {
		if (depth > maxDepth) {
			throw new NestingTooDeepIssue(node, maxDepth);
		}
	}
}
