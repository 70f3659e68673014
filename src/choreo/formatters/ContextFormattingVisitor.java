package choreo.formatters;

import choreo.errors.ContextVisitor;
import choreo.trans.intermediate.WhileAnalyzingDefinition;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileAnalyzingDefinition whileAnalyzingDefinition) throws IOException {
		out.write("while analyzing choreography ");
		out.write(whileAnalyzingDefinition.getDefinition().getName());
		out.write(" ");
		out.write(whileAnalyzingDefinition.getDefinition().getLocation().prettyString());
		return null;
	}

}
