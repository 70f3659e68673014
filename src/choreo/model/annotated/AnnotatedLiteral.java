package choreo.model.annotated;

import choreo.model.chor.ChorExpression;
import choreo.model.role.Role;

import java.util.Optional;
import java.util.Set;

/**
 * 
 * A box around a leaf (an identifier or a literal) so that it carries annotations
 * like any other node.
 *
 */
public class AnnotatedLiteral extends AnnotatedNode {

	private final ChorExpression value;

	public AnnotatedLiteral(ChorExpression value, Optional<Role> owner, Set<Role> roles) {
		super(owner, roles);
		this.value = value;
	}

	public ChorExpression getValue() {
		return value;
	}

	@Override
	public ChorExpression getNode() {
		return value;
	}

	@Override
	public AnnotatedLiteral reannotate(Optional<Role> owner, Set<Role> roles) {
		return new AnnotatedLiteral(value, owner, roles);
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
		AnnotatedLiteral other = (AnnotatedLiteral) obj;
		return sameAnnotations(other) && value.equals(other.value);
	}
}
