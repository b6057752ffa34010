package com.raditha.cpptokens.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Output of a {@link Lexer}: tokens in order, the file table they index into and
 * any diagnostics.
 * <p>
 * The token queue is consumed by the token list that adopts it; once adopted the
 * instance is empty.
 */
public final class LexedTokens {

    private final Deque<RawToken> tokens;
    private final List<String> files;
    private final List<String> diagnostics;

    public LexedTokens(List<RawToken> tokens, List<String> files, List<String> diagnostics) {
        this.tokens = new ArrayDeque<>(tokens);
        this.files = new ArrayList<>(files);
        this.diagnostics = new ArrayList<>(diagnostics);
    }

    public LexedTokens(List<RawToken> tokens, List<String> files) {
        this(tokens, files, List.of());
    }

    /**
     * @return the next token, removing it, or null when all tokens were consumed
     */
    public RawToken poll() {
        return tokens.pollFirst();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }

    public List<String> files() {
        return Collections.unmodifiableList(files);
    }

    public List<String> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
