package org.tlin.minilogic;

public class IrTranslationException extends MiniLogicException {

    private final String snippet;
    private final int line;
    private final int column;

    public IrTranslationException(String message, String snippet, int line, int column) {
        super(message);
        this.snippet = snippet;
        this.line = line;
        this.column = column;
    }

    public IrTranslationException(String message, String snippet, int line, int column, Throwable cause) {
        super(message, cause);
        this.snippet = snippet;
        this.line = line;
        this.column = column;
    }

    public String getSnippet() {
        return snippet;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
