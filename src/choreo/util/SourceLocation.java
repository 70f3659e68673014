package choreo.util;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A region of a source file. Lines and columns are 0-based and printed 1-based.
 */
public class SourceLocation {
	private final Path file;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;
	
	public SourceLocation(Path file, int startLine, int endLine, int startColumn, int endColumn) {
		this.file = file;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1);
	}
	
	public boolean isUnknown() {
		return file == null;
	}

	public String prettyString() {
		if(isUnknown()) {
			return "at unknown source location";
		}
		StringBuilder b = new StringBuilder("at ");
		if(startLine != endLine) {
			b.append(startLine + 1).append(':').append(startColumn + 1)
					.append('-').append(endLine + 1).append(':').append(endColumn);
		} else if(startColumn != endColumn) {
			b.append(startLine + 1).append(':').append(startColumn + 1).append('-').append(endColumn);
		} else {
			b.append(startLine + 1).append(':').append(startColumn + 1);
		}
		b.append(" in file ").append(file);
		return b.toString();
	}

	public Path getFile() {
		return file;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		SourceLocation other = (SourceLocation) obj;
		return startLine == other.startLine && endLine == other.endLine &&
				startColumn == other.startColumn && endColumn == other.endColumn &&
				Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		return prettyString();
	}
}
