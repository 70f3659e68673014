package choreo.formatters;

import choreo.model.annotated.*;

import java.io.IOException;
import java.util.List;

/**
 * Writes an annotated tree in surface notation, suffixing every node that has an
 * owner with @Owner.
 */
public class AnnotatedNodeFormattingVisitor extends AnnotatedNodeVisitor<Void, IOException> {
	private final IndentingWriter out;

	public AnnotatedNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeOwner(AnnotatedNode node) throws IOException {
		if (node.getOwner().isPresent()) {
			out.write("@");
			out.write(node.getOwner().get().getName());
		}
	}

	private void writeSpaced(List<AnnotatedNode> nodes) throws IOException {
		for (AnnotatedNode node : nodes) {
			out.write(" ");
			node.accept(this);
		}
	}

	@Override
	public Void visit(AnnotatedLiteral literal) throws IOException {
		literal.getValue().accept(new ChorNodeFormattingVisitor(out));
		writeOwner(literal);
		return null;
	}

	@Override
	public Void visit(AnnotatedPattern pattern) throws IOException {
		pattern.getPattern().accept(new ChorNodeFormattingVisitor(out));
		writeOwner(pattern);
		return null;
	}

	@Override
	public Void visit(AnnotatedSequence sequence) throws IOException {
		out.write("(do");
		writeSpaced(sequence.getExprs());
		out.write(")");
		writeOwner(sequence);
		return null;
	}

	@Override
	public Void visit(AnnotatedLet let) throws IOException {
		out.write("(let [");
		boolean first = true;
		for (AnnotatedLetBinding binding : let.getBindings()) {
			if (first) {
				first = false;
			} else {
				out.write(" ");
			}
			binding.getPattern().accept(this);
			out.write(" ");
			binding.getValue().accept(this);
		}
		out.write("]");
		writeSpaced(let.getBody());
		out.write(")");
		writeOwner(let);
		return null;
	}

	@Override
	public Void visit(AnnotatedIf annotatedIf) throws IOException {
		out.write("(if ");
		annotatedIf.getCond().accept(this);
		out.write(" ");
		annotatedIf.getThen().accept(this);
		out.write(" ");
		annotatedIf.getElse().accept(this);
		out.write(")");
		writeOwner(annotatedIf);
		return null;
	}

	@Override
	public Void visit(AnnotatedSelect select) throws IOException {
		out.write("(select [");
		boolean first = true;
		for (AnnotatedNode chooser : select.getChoosers()) {
			if (first) {
				first = false;
			} else {
				out.write(" ");
			}
			chooser.accept(this);
		}
		out.write("]");
		writeSpaced(select.getBody());
		out.write(")");
		writeOwner(select);
		return null;
	}

	@Override
	public Void visit(AnnotatedOpaque opaque) throws IOException {
		opaque.getForm().accept(new ChorNodeFormattingVisitor(out));
		writeOwner(opaque);
		return null;
	}
}
