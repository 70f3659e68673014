package choreo.model.annotated;

import choreo.model.chor.ChorIf;
import choreo.model.role.Role;

import java.util.Optional;
import java.util.Set;

public class AnnotatedIf extends AnnotatedNode {

	private final ChorIf node;
	private final AnnotatedNode cond;
	private final AnnotatedNode thenExpr;
	private final AnnotatedNode elseExpr;

	public AnnotatedIf(ChorIf node, AnnotatedNode cond, AnnotatedNode thenExpr, AnnotatedNode elseExpr,
	                   Optional<Role> owner, Set<Role> roles) {
		super(owner, roles);
		this.node = node;
		this.cond = cond;
		this.thenExpr = thenExpr;
		this.elseExpr = elseExpr;
	}

	public AnnotatedNode getCond() {
		return cond;
	}

	public AnnotatedNode getThen() {
		return thenExpr;
	}

	public AnnotatedNode getElse() {
		return elseExpr;
	}

	@Override
	public ChorIf getNode() {
		return node;
	}

	@Override
	public AnnotatedIf reannotate(Optional<Role> owner, Set<Role> roles) {
		return new AnnotatedIf(node, cond, thenExpr, elseExpr, owner, roles);
	}

	@Override
	public <T, E extends Throwable> T accept(AnnotatedNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		AnnotatedIf other = (AnnotatedIf) obj;
		return sameAnnotations(other) && node.equals(other.node) && cond.equals(other.cond) &&
				thenExpr.equals(other.thenExpr) && elseExpr.equals(other.elseExpr);
	}
}
