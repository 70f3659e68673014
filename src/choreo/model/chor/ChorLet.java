package choreo.model.chor;

import choreo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * 
 * (let [pattern value ...] body ...)
 *
 */
public class ChorLet extends ChorExpression {

	private final List<ChorLetBinding> bindings;
	private final List<ChorExpression> body;

	public ChorLet(SourceLocation location, List<ChorLetBinding> bindings, List<ChorExpression> body) {
		super(location);
		this.bindings = bindings;
		this.body = body;
	}

	public List<ChorLetBinding> getBindings() {
		return bindings;
	}

	public List<ChorExpression> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(ChorExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(bindings, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		ChorLet other = (ChorLet) obj;
		return Objects.equals(bindings, other.bindings) && Objects.equals(body, other.body);
	}

}
