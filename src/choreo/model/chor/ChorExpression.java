package choreo.model.chor;

import choreo.formatters.ChorNodeFormattingVisitor;
import choreo.util.SourceLocation;

import java.io.IOException;

public abstract class ChorExpression extends ChorNode {

	public ChorExpression(SourceLocation location) {
		super(location);
	}

	@Override
	protected void format(ChorNodeFormattingVisitor formatter) throws IOException {
		accept(formatter);
	}

	public abstract <T, E extends Throwable> T accept(ChorExpressionVisitor<T, E> v) throws E;

}
