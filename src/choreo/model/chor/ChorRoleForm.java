package choreo.model.chor;

import choreo.model.role.Role;
import choreo.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * An explicit ownership marker: (Role expr)
 * 
 * The role is only meaningful if it belongs to the active role set of the run
 * that analyzes this node.
 *
 */
public class ChorRoleForm extends ChorExpression {

	private final Role role;
	private final ChorExpression expr;

	public ChorRoleForm(SourceLocation location, Role role, ChorExpression expr) {
		super(location);
		this.role = role;
		this.expr = expr;
	}

	public Role getRole() {
		return role;
	}

	public ChorExpression getExpr() {
		return expr;
	}

	@Override
	public <T, E extends Throwable> T accept(ChorExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(role, expr);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ChorRoleForm other = (ChorRoleForm) obj;
		return Objects.equals(role, other.role) && Objects.equals(expr, other.expr);
	}

}
