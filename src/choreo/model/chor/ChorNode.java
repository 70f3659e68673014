package choreo.model.chor;

import choreo.formatters.ChorNodeFormattingVisitor;
import choreo.formatters.IndentingWriter;
import choreo.util.SourceLocatable;
import choreo.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * 
 * The base class for any choreography syntax node. Nodes are immutable; equality is
 * structural and ignores source locations.
 *
 */
public abstract class ChorNode extends SourceLocatable {
	private final SourceLocation location;

	public ChorNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			format(new ChorNodeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	protected abstract void format(ChorNodeFormattingVisitor formatter) throws IOException;

}
