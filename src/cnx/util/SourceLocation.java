package cnx.util;

import cnx.Unreachable;
import cnx.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A position inside the program export handed to us by the front-end. Lines and columns
 * are 1-based, as the front-end reports them.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int line;
	private final int column;

	public SourceLocation(Path file, int line, int column) {
		this.file = file;
		this.line = line;
		this.column = column;
	}

	public String prettyString() {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw));
		return sw.getBuffer().toString();
	}

	public void writePretty(IndentingWriter out) {
		try {
			if (isUnknown()) {
				out.write("at unknown source location");
				return;
			}
			out.write("at " + line);
			if (column > 0) {
				out.write(":" + column);
			}
			if (file != null) {
				out.write(" in file " + file);
			}
		} catch (IOException e) {
			throw new Unreachable(e); // string ops shouldn't throw IO exceptions
		}
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1);
	}

	public boolean isUnknown() {
		return line < 0;
	}

	public Path getFile() {
		return file;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, line, column);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return line == other.line && column == other.column && Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [file=" + file + ", line=" + line + ", column=" + column + "]";
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		if (file != null && o.file != null) {
			int comparedFile = file.compareTo(o.file);
			if (comparedFile != 0) {
				return comparedFile;
			}
		}
		int comparedLine = Integer.compare(line, o.line);
		if (comparedLine != 0) {
			return comparedLine;
		}
		return Integer.compare(column, o.column);
	}

}
