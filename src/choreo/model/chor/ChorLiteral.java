package choreo.model.chor;

import choreo.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * An atomic value, kept in its source spelling.
 *
 */
public class ChorLiteral extends ChorExpression {

	public enum Kind {
		NUMBER,
		STRING,
		BOOLEAN,
		KEYWORD,
		NIL,
	}

	private final Kind kind;
	private final String text;

	public ChorLiteral(SourceLocation location, Kind kind, String text) {
		super(location);
		this.kind = kind;
		this.text = text;
	}

	public Kind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(ChorExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ChorLiteral other = (ChorLiteral) obj;
		return kind == other.kind && Objects.equals(text, other.text);
	}

}
