package choreo.model.annotated;

import choreo.model.chor.ChorSelect;
import choreo.model.role.Role;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class AnnotatedSelect extends AnnotatedNode {

	private final ChorSelect node;
	private final List<AnnotatedNode> choosers;
	private final List<AnnotatedNode> body;

	public AnnotatedSelect(ChorSelect node, List<AnnotatedNode> choosers, List<AnnotatedNode> body,
	                       Optional<Role> owner, Set<Role> roles) {
		super(owner, roles);
		this.node = node;
		this.choosers = choosers;
		this.body = body;
	}

	public List<AnnotatedNode> getChoosers() {
		return choosers;
	}

	public List<AnnotatedNode> getBody() {
		return body;
	}

	@Override
	public ChorSelect getNode() {
		return node;
	}

	@Override
	public AnnotatedSelect reannotate(Optional<Role> owner, Set<Role> roles) {
		return new AnnotatedSelect(node, choosers, body, owner, roles);
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
		AnnotatedSelect other = (AnnotatedSelect) obj;
		return sameAnnotations(other) && node.equals(other.node) && choosers.equals(other.choosers) &&
				body.equals(other.body);
	}
}
