package org.orchestration.migrator.odx;

/**
 * The file does not contain a usable designer XML segment: the declaration or the
 * sentinel is missing, or the segment is not well-formed XML.
 * Line and column are only known for XML syntax errors, otherwise they are -1.
 */
public class OdxFormatException extends OdxParseException {
    private final int line;
    private final int column;

    public OdxFormatException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public OdxFormatException(String message, int line, int column, Throwable cause) {
        super(String.format("%s (line %d, column %d)", message, line, column), cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasPosition() {
        return line >= 0;
    }
}
