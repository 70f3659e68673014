package choreo.model.annotated;

import choreo.model.chor.ChorLet;
import choreo.model.role.Role;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class AnnotatedLet extends AnnotatedNode {

	private final ChorLet node;
	private final List<AnnotatedLetBinding> bindings;
	private final List<AnnotatedNode> body;

	public AnnotatedLet(ChorLet node, List<AnnotatedLetBinding> bindings, List<AnnotatedNode> body,
	                    Optional<Role> owner, Set<Role> roles) {
		super(owner, roles);
		this.node = node;
		this.bindings = bindings;
		this.body = body;
	}

	public List<AnnotatedLetBinding> getBindings() {
		return bindings;
	}

	public List<AnnotatedNode> getBody() {
		return body;
	}

	@Override
	public ChorLet getNode() {
		return node;
	}

	@Override
	public AnnotatedLet reannotate(Optional<Role> owner, Set<Role> roles) {
		return new AnnotatedLet(node, bindings, body, owner, roles);
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
		AnnotatedLet other = (AnnotatedLet) obj;
		return sameAnnotations(other) && node.equals(other.node) && bindings.equals(other.bindings) &&
				body.equals(other.body);
	}
}
