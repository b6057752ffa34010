package com.raditha.cpptokens.lexer;

import java.io.Reader;
import java.util.List;

/**
 * Turns preprocessed source text into lexical atoms.
 */
public interface Lexer {

    /**
     * Tokenize preprocessed code.
     *
     * @param code  preprocessed ASCII code without comments or multi-line literals
     * @param files file table; {@code file0} is registered if absent and new files
     *              seen in line markers are appended
     * @param file0 name of the main source file
     * @return the lexed tokens; problems that did not stop lexing are reported as
     *         diagnostics of the result
     * @throws LexerException if the code cannot be tokenized at all
     */
    LexedTokens lex(Reader code, List<String> files, String file0) throws LexerException;
}
