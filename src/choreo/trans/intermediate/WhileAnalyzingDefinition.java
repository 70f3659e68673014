package choreo.trans.intermediate;

import choreo.errors.Context;
import choreo.errors.ContextVisitor;
import choreo.model.chor.ChorDefinition;

public class WhileAnalyzingDefinition extends Context {

	private final ChorDefinition definition;

	public WhileAnalyzingDefinition(ChorDefinition definition) {
		this.definition = definition;
	}

	public ChorDefinition getDefinition() {
		return definition;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
