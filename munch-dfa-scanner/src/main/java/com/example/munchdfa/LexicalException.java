package com.example.munchdfa;

/**
 * Thrown when no accepting path of the DFA starts at the current scan
 * position.
 */
public class LexicalException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;
    private final int offset;
    private final int codePoint;

    public LexicalException(int line, int column, int offset, int codePoint) {
        super("Unexpected character '" + new String(Character.toChars(codePoint)) + "' at line " + line
                + ", column " + column);
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.codePoint = codePoint;
    }

    /** 1-based line of the offending character. */
    public int getLine() {
        return line;
    }

    /** 1-based column of the offending character, counted in code points. */
    public int getColumn() {
        return column;
    }

    /** 0-based char index of the offending character in the input. */
    public int getOffset() {
        return offset;
    }

    public int getCodePoint() {
        return codePoint;
    }

    public String getCharacter() {
        return new String(Character.toChars(codePoint));
    }
}
