package com.raditha.cpptokens.lexer;

/**
 * The lexer could not tokenize its input.
 */
public class LexerException extends Exception {

    private final String file;
    private final int line;

    public LexerException(String message, String file, int line) {
        super(file + ":" + line + ": " + message);
        this.file = file;
        this.line = line;
    }

    public LexerException(String message, Throwable cause) {
        super(message, cause);
        this.file = "";
        this.line = 0;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }
}
