package choreo.model.chor;

import choreo.model.role.Role;
import choreo.util.SourceLocation;

import java.util.Arrays;
import java.util.List;

/**
 * Static factories for choreography trees with unknown source locations.
 */
public class ChorBuilder {

	private ChorBuilder() {}

	public static ChorIdentifier id(String name) {
		return new ChorIdentifier(SourceLocation.unknown(), name);
	}

	public static ChorQualifiedIdentifier qid(String qualifier, String name) {
		return new ChorQualifiedIdentifier(SourceLocation.unknown(), qualifier, name);
	}

	public static ChorLiteral num(int value) {
		return new ChorLiteral(SourceLocation.unknown(), ChorLiteral.Kind.NUMBER, Integer.toString(value));
	}

	public static ChorLiteral str(String contents) {
		return new ChorLiteral(SourceLocation.unknown(), ChorLiteral.Kind.STRING, contents);
	}

	public static ChorLiteral bool(boolean value) {
		return new ChorLiteral(SourceLocation.unknown(), ChorLiteral.Kind.BOOLEAN, Boolean.toString(value));
	}

	public static ChorLiteral keyword(String name) {
		return new ChorLiteral(SourceLocation.unknown(), ChorLiteral.Kind.KEYWORD, name);
	}

	public static ChorSequence seq(ChorExpression... exprs) {
		return new ChorSequence(SourceLocation.unknown(), Arrays.asList(exprs));
	}

	public static ChorLetBinding binding(ChorExpression pattern, ChorExpression value) {
		return new ChorLetBinding(SourceLocation.unknown(), pattern, value);
	}

	public static List<ChorLetBinding> bindings(ChorLetBinding... bindings) {
		return Arrays.asList(bindings);
	}

	public static ChorLet let(List<ChorLetBinding> bindings, ChorExpression... body) {
		return new ChorLet(SourceLocation.unknown(), bindings, Arrays.asList(body));
	}

	public static ChorIf ifexp(ChorExpression cond, ChorExpression thenExpr, ChorExpression elseExpr) {
		return new ChorIf(SourceLocation.unknown(), cond, thenExpr, elseExpr);
	}

	public static List<ChorExpression> choosers(ChorExpression... choosers) {
		return Arrays.asList(choosers);
	}

	public static ChorSelect select(List<ChorExpression> choosers, ChorExpression... body) {
		return new ChorSelect(SourceLocation.unknown(), choosers, Arrays.asList(body));
	}

	public static ChorRoleForm at(String role, ChorExpression expr) {
		return new ChorRoleForm(SourceLocation.unknown(), Role.of(role), expr);
	}

	public static ChorDestructuringPattern pattern(ChorExpression... elements) {
		return new ChorDestructuringPattern(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static ChorOpaqueForm opaque(String head, ChorExpression... operands) {
		return new ChorOpaqueForm(SourceLocation.unknown(), head, Arrays.asList(operands));
	}

	public static ChorDefinition defchor(String name, List<String> roles, ChorExpression body) {
		return new ChorDefinition(SourceLocation.unknown(), name, roles, body);
	}

	public static List<String> roles(String... names) {
		return Arrays.asList(names);
	}
}
