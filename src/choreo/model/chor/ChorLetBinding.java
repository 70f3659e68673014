package choreo.model.chor;

import choreo.formatters.ChorNodeFormattingVisitor;
import choreo.util.SourceLocation;

import java.io.IOException;
import java.util.Objects;

/**
 * 
 * One pattern/value pair of a let form. The pattern is either a name, a role form
 * around a pattern or a {@link ChorDestructuringPattern}.
 *
 */
public class ChorLetBinding extends ChorNode {

	private final ChorExpression pattern;
	private final ChorExpression value;

	public ChorLetBinding(SourceLocation location, ChorExpression pattern, ChorExpression value) {
		super(location);
		this.pattern = pattern;
		this.value = value;
	}

	public ChorExpression getPattern() {
		return pattern;
	}

	public ChorExpression getValue() {
		return value;
	}

	@Override
	protected void format(ChorNodeFormattingVisitor formatter) throws IOException {
		formatter.format(this);
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
		ChorLetBinding other = (ChorLetBinding) obj;
		return Objects.equals(pattern, other.pattern) && Objects.equals(value, other.value);
	}

}
