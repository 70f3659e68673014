package choreo.formatters;

import choreo.model.chor.*;

import java.io.IOException;
import java.util.List;

/**
 * Writes choreography syntax back in its surface notation.
 */
public class ChorNodeFormattingVisitor extends ChorExpressionVisitor<Void, IOException> {
	private final IndentingWriter out;

	public ChorNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeSpaced(List<? extends ChorExpression> exprs) throws IOException {
		for (ChorExpression expr : exprs) {
			out.write(" ");
			writeOrMissing(expr);
		}
	}

	private void writeList(List<? extends ChorExpression> exprs) throws IOException {
		boolean first = true;
		for (ChorExpression expr : exprs) {
			if (first) {
				first = false;
			} else {
				out.write(" ");
			}
			writeOrMissing(expr);
		}
	}

	// malformed trees are formatted too, as they show up in issue messages
	private void writeOrMissing(ChorNode node) throws IOException {
		if (node == null) {
			out.write("<missing>");
		} else if (node instanceof ChorExpression) {
			((ChorExpression) node).accept(this);
		} else if (node instanceof ChorLetBinding) {
			format((ChorLetBinding) node);
		} else {
			format((ChorDefinition) node);
		}
	}

	public void format(ChorLetBinding binding) throws IOException {
		writeOrMissing(binding.getPattern());
		out.write(" ");
		writeOrMissing(binding.getValue());
	}

	public void format(ChorDefinition definition) throws IOException {
		out.write("(defchor ");
		out.write(definition.getName());
		out.write(" [");
		out.write(String.join(" ", definition.getRoles()));
		out.write("]");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			writeOrMissing(definition.getBody());
		}
		out.write(")");
	}

	private void writeName(String name) throws IOException {
		out.write(name == null ? "<missing>" : name);
	}

	@Override
	public Void visit(ChorIdentifier identifier) throws IOException {
		writeName(identifier.getName());
		return null;
	}

	@Override
	public Void visit(ChorQualifiedIdentifier qualifiedIdentifier) throws IOException {
		writeName(qualifiedIdentifier.getQualifier());
		out.write("/");
		writeName(qualifiedIdentifier.getName());
		return null;
	}

	@Override
	public Void visit(ChorLiteral literal) throws IOException {
		switch (literal.getKind()) {
			case STRING:
				out.write("\"");
				out.write(literal.getText().replace("\\", "\\\\").replace("\"", "\\\""));
				out.write("\"");
				break;
			case KEYWORD:
				out.write(":");
				out.write(literal.getText());
				break;
			case NIL:
				out.write("nil");
				break;
			default:
				out.write(literal.getText());
		}
		return null;
	}

	@Override
	public Void visit(ChorSequence sequence) throws IOException {
		out.write("(do");
		if (sequence.getExprs() != null) {
			writeSpaced(sequence.getExprs());
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ChorLet let) throws IOException {
		out.write("(let [");
		if (let.getBindings() != null) {
			boolean first = true;
			for (ChorLetBinding binding : let.getBindings()) {
				if (first) {
					first = false;
				} else {
					out.write(" ");
				}
				writeOrMissing(binding);
			}
		}
		out.write("]");
		if (let.getBody() != null) {
			writeSpaced(let.getBody());
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ChorIf chorIf) throws IOException {
		out.write("(if ");
		writeOrMissing(chorIf.getCond());
		out.write(" ");
		writeOrMissing(chorIf.getThen());
		out.write(" ");
		writeOrMissing(chorIf.getElse());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ChorSelect select) throws IOException {
		out.write("(select [");
		if (select.getChoosers() != null) {
			writeList(select.getChoosers());
		}
		out.write("]");
		if (select.getBody() != null) {
			writeSpaced(select.getBody());
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ChorRoleForm roleForm) throws IOException {
		out.write("(");
		out.write(roleForm.getRole().getName());
		out.write(" ");
		writeOrMissing(roleForm.getExpr());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ChorDestructuringPattern pattern) throws IOException {
		out.write("[");
		if (pattern.getElements() != null) {
			writeList(pattern.getElements());
		}
		out.write("]");
		return null;
	}

	@Override
	public Void visit(ChorOpaqueForm opaqueForm) throws IOException {
		out.write("(");
		out.write(opaqueForm.getHead());
		if (opaqueForm.getOperands() != null) {
			writeSpaced(opaqueForm.getOperands());
		}
		out.write(")");
		return null;
	}
}
