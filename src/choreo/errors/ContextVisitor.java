package choreo.errors;

import choreo.trans.intermediate.WhileAnalyzingDefinition;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileAnalyzingDefinition whileAnalyzingDefinition) throws E;

}
