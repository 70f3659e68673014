package choreo.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line after a line break with the current indentation.
 */
public class IndentingWriter extends Writer {
	
	private final Writer out;
	private int indent = 0;
	private boolean shouldIndent = false;
	private int defaultIndent = 2;
	
	public static class Indent implements AutoCloseable {
		
		private final IndentingWriter writer;
		private final int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}
	
	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}
	
	public Indent indent() {
		return indent(defaultIndent);
	}
	
	public void unindent(int spaces) {
		if(spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}
	
	public IndentingWriter(Writer out) {
		this.out = out;
	}
	
	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}
	
	public void newLine() throws IOException {
		write(System.lineSeparator());
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String lf = System.lineSeparator();
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while(start < data.length()) {
			if(shouldIndent) {
				for(int i = 0; i < indent; ++i) {
					out.write(' ');
				}
				shouldIndent = false;
			}
			int next = data.indexOf(lf, start);
			if(next == -1) {
				out.write(data, start, data.length() - start);
				break;
			}
			out.write(data, start, next + lf.length() - start);
			start = next + lf.length();
			shouldIndent = true;
		}
	}

}
