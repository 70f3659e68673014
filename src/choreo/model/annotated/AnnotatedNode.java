package choreo.model.annotated;

import choreo.formatters.AnnotatedNodeFormattingVisitor;
import choreo.formatters.IndentingWriter;
import choreo.model.chor.ChorExpression;
import choreo.model.role.Role;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 
 * The base class of the role-annotated tree. Every node, including boxed identifiers
 * and literals, carries:
 * <ul>
 *     <li>an owner, the single role that holds the node's value, if one was
 *     established at its position</li>
 *     <li>the involved roles, the roles that take part in evaluating the node</li>
 * </ul>
 *
 */
public abstract class AnnotatedNode {
	private final Optional<Role> owner;
	private final Set<Role> roles;

	public AnnotatedNode(Optional<Role> owner, Set<Role> roles) {
		this.owner = owner;
		this.roles = Collections.unmodifiableSet(new LinkedHashSet<>(roles));
	}

	public Optional<Role> getOwner() {
		return owner;
	}

	public Set<Role> getRoles() {
		return roles;
	}

	/**
	 * @return the expanded expression this node annotates
	 */
	public abstract ChorExpression getNode();

	/**
	 * @return a node with the same structure but the given owner and involved roles
	 */
	public abstract AnnotatedNode reannotate(Optional<Role> owner, Set<Role> roles);

	public abstract <T, E extends Throwable> T accept(AnnotatedNodeVisitor<T, E> v) throws E;

	protected boolean sameAnnotations(AnnotatedNode other) {
		return owner.equals(other.owner) && roles.equals(other.roles);
	}

	@Override
	public int hashCode() {
		return Objects.hash(owner, roles, getNode());
	}

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new AnnotatedNodeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}
}
