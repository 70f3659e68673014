package choreo.model.annotated;

import choreo.model.chor.ChorSequence;
import choreo.model.role.Role;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class AnnotatedSequence extends AnnotatedNode {

	private final ChorSequence node;
	private final List<AnnotatedNode> exprs;

	public AnnotatedSequence(ChorSequence node, List<AnnotatedNode> exprs, Optional<Role> owner, Set<Role> roles) {
		super(owner, roles);
		this.node = node;
		this.exprs = exprs;
	}

	public List<AnnotatedNode> getExprs() {
		return exprs;
	}

	@Override
	public ChorSequence getNode() {
		return node;
	}

	@Override
	public AnnotatedSequence reannotate(Optional<Role> owner, Set<Role> roles) {
		return new AnnotatedSequence(node, exprs, owner, roles);
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
		AnnotatedSequence other = (AnnotatedSequence) obj;
		return sameAnnotations(other) && node.equals(other.node) && exprs.equals(other.exprs);
	}
}
