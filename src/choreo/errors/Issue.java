package choreo.errors;

import choreo.formatters.IndentingWriter;
import choreo.formatters.IssueFormattingVisitor;
import choreo.trans.ChoreoTransException;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A diagnostic about a choreography. Issues are exceptions so that a pass can abort
 * as soon as it finds one, and can also be collected by an {@link IssueContext}.
 */
public abstract class Issue extends ChoreoTransException {
	public Issue() {
		super("");
	}
	public Issue(String msg) {
		super(msg);
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new IllegalStateException("StringWriter should not throw IOException", e);
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}
	
	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
	
}
