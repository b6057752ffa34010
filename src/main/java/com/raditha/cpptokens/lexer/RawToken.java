package com.raditha.cpptokens.lexer;

/**
 * A lexical atom as produced by a {@link Lexer}.
 *
 * @param str       Token text
 * @param fileIndex Index into the lexer's file table
 * @param line      1-based line
 * @param column    1-based column
 * @param macro     Name of the macro this token was expanded from, or ""
 */
public record RawToken(String str, int fileIndex, int line, int column, String macro) {

    public RawToken {
        if (str == null || str.isEmpty()) {
            throw new IllegalArgumentException("token text cannot be empty");
        }
        if (fileIndex < 0) {
            throw new IllegalArgumentException("fileIndex must be >= 0");
        }
        if (macro == null) {
            macro = "";
        }
    }

    public RawToken(String str, int fileIndex, int line, int column) {
        this(str, fileIndex, line, column, "");
    }
}
