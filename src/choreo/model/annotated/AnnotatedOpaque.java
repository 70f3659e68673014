package choreo.model.annotated;

import choreo.model.chor.ChorExpression;
import choreo.model.role.Role;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/**
 * 
 * A form outside the choreographic core, carried through unchanged. It is ownerless
 * unless an enclosing role form places it explicitly.
 *
 */
public class AnnotatedOpaque extends AnnotatedNode {

	private final ChorExpression form;

	public AnnotatedOpaque(ChorExpression form) {
		this(form, Optional.empty(), Collections.emptySet());
	}

	public AnnotatedOpaque(ChorExpression form, Optional<Role> owner, Set<Role> roles) {
		super(owner, roles);
		this.form = form;
	}

	public ChorExpression getForm() {
		return form;
	}

	@Override
	public ChorExpression getNode() {
		return form;
	}

	@Override
	public AnnotatedOpaque reannotate(Optional<Role> owner, Set<Role> roles) {
		return new AnnotatedOpaque(form, owner, roles);
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
		AnnotatedOpaque other = (AnnotatedOpaque) obj;
		return sameAnnotations(other) && form.equals(other.form);
	}
}
