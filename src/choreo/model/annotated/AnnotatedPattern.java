package choreo.model.annotated;

import choreo.model.chor.ChorDestructuringPattern;
import choreo.model.role.Role;

import java.util.Optional;
import java.util.Set;

/**
 * 
 * A destructuring pattern annotated as a whole. The names bound inside it carry no
 * annotation of their own; distributing the owner onto them is left to projection.
 *
 */
public class AnnotatedPattern extends AnnotatedNode {

	private final ChorDestructuringPattern pattern;

	public AnnotatedPattern(ChorDestructuringPattern pattern, Optional<Role> owner, Set<Role> roles) {
		super(owner, roles);
		this.pattern = pattern;
	}

	public ChorDestructuringPattern getPattern() {
		return pattern;
	}

	@Override
	public ChorDestructuringPattern getNode() {
		return pattern;
	}

	@Override
	public AnnotatedPattern reannotate(Optional<Role> owner, Set<Role> roles) {
		return new AnnotatedPattern(pattern, owner, roles);
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
		AnnotatedPattern other = (AnnotatedPattern) obj;
		return sameAnnotations(other) && pattern.equals(other.pattern);
	}
}
