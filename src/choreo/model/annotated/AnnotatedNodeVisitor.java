package choreo.model.annotated;

public abstract class AnnotatedNodeVisitor<T, E extends Throwable> {
	public abstract T visit(AnnotatedLiteral literal) throws E;
	public abstract T visit(AnnotatedPattern pattern) throws E;
	public abstract T visit(AnnotatedSequence sequence) throws E;
	public abstract T visit(AnnotatedLet let) throws E;
	public abstract T visit(AnnotatedIf annotatedIf) throws E;
	public abstract T visit(AnnotatedSelect select) throws E;
	public abstract T visit(AnnotatedOpaque opaque) throws E;
}
