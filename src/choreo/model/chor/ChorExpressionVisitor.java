package choreo.model.chor;

public abstract class ChorExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(ChorIdentifier identifier) throws E;
	public abstract T visit(ChorQualifiedIdentifier qualifiedIdentifier) throws E;
	public abstract T visit(ChorLiteral literal) throws E;
	public abstract T visit(ChorSequence sequence) throws E;
	public abstract T visit(ChorLet let) throws E;
	public abstract T visit(ChorIf chorIf) throws E;
	public abstract T visit(ChorSelect select) throws E;
	public abstract T visit(ChorRoleForm roleForm) throws E;
	public abstract T visit(ChorDestructuringPattern pattern) throws E;
	public abstract T visit(ChorOpaqueForm opaqueForm) throws E;
}
