package choreo.model.annotated;

import choreo.model.chor.ChorLetBinding;

import java.util.Objects;

/**
 * A pattern/value pair of an {@link AnnotatedLet}. The pattern and the value are
 * annotated independently of each other.
 */
public class AnnotatedLetBinding {

	private final ChorLetBinding node;
	private final AnnotatedNode pattern;
	private final AnnotatedNode value;

	public AnnotatedLetBinding(ChorLetBinding node, AnnotatedNode pattern, AnnotatedNode value) {
		this.node = node;
		this.pattern = pattern;
		this.value = value;
	}

	public ChorLetBinding getNode() {
		return node;
	}

	public AnnotatedNode getPattern() {
		return pattern;
	}

	public AnnotatedNode getValue() {
		return value;
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		AnnotatedLetBinding other = (AnnotatedLetBinding) obj;
		return pattern.equals(other.pattern) && value.equals(other.value);
	}
}
