package com.raditha.cpptokens.scan;

import com.raditha.cpptokens.match.TokenMatcher;
import com.raditha.cpptokens.model.Token;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a parenthesis closes a function declarator, looking only at the
 * tokens that follow it.
 */
public final class FunctionHeadScanner {

    private static final Set<String> QUALIFIERS = Set.of(
            "const", "volatile", "&", "&&", "override", "final", "mutable", "noexcept", "throw");

    private FunctionHeadScanner() {
    }

    /**
     * Check the tail of a function declarator.
     * <p>
     * Starting after the closing parenthesis, qualifiers ({@code const},
     * {@code noexcept(...)}, {@code override}, attributes, a trailing return type,
     * {@code = 0}, a constructor initializer list) are skipped one at a time. Before
     * each is skipped the current token is compared with the {@code |} separated
     * alternatives in {@code endsWith}; the first hit succeeds.
     *
     * @param tok      the opening or closing parenthesis of the parameter list
     * @param endsWith alternatives such as {@code "{"}, {@code "{|;"} or {@code "const"}
     * @return the closing parenthesis on success, otherwise null
     */
    public static @Nullable Token isFunctionHead(@Nullable Token tok, String endsWith) {
        if (tok == null) {
            return null;
        }
        Token close;
        if (tok.str().equals("(")) {
            close = BracketMatcher.findClosing(tok);
        } else if (tok.str().equals(")")) {
            close = tok;
        } else {
            return null;
        }
        if (close == null) {
            return null;
        }
        Set<String> ends = Arrays.stream(endsWith.split("\\|"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());

        Token t = close.next();
        while (t != null) {
            if (ends.contains(t.str())) {
                return close;
            }
            t = skipQualifier(t);
        }
        return null;
    }

    /**
     * Skip the qualifiers, trailing return type and initializer list after a
     * parameter list.
     *
     * @param close the closing parenthesis of the parameter list
     * @return the first token that is none of these, typically {@code {} or
     *         {@code ;}, or null at the end of the list
     */
    public static @Nullable Token functionTailEnd(Token close) {
        Token t = close.next();
        while (t != null) {
            Token after = skipQualifier(t);
            if (after == null) {
                return t;
            }
            t = after;
        }
        return null;
    }

    /**
     * @return the token after the qualifier at {@code t}, or null if {@code t} is not one
     */
    private static @Nullable Token skipQualifier(Token t) {
        if (TokenMatcher.match(t, "noexcept|throw|alignas (")) {
            Token close = BracketMatcher.findClosing(t.next());
            return close == null ? null : close.next();
        }
        if (QUALIFIERS.contains(t.str())) {
            return t.next();
        }
        if (TokenMatcher.simpleMatch(t, "[ [")) {
            Token close = BracketMatcher.findClosing(t);
            return close == null ? null : close.next();
        }
        if (t.str().equals("->")) {
            return skipTrailingReturnType(t.next());
        }
        if (TokenMatcher.match(t, "= 0|default|delete")) {
            return t.tokAt(2);
        }
        if (t.isUpperCaseName() && TokenMatcher.simpleMatch(t.next(), "(")) {
            Token close = BracketMatcher.findClosing(t.next());
            return close == null ? null : close.next();
        }
        if (t.str().equals(":") && TokenMatcher.match(t.next(), "%name%|::")) {
            return skipInitializerList(t.next());
        }
        return null;
    }

    private static @Nullable Token skipTrailingReturnType(@Nullable Token t) {
        while (t != null && TokenMatcher.match(t, "%name%|::|*|&|&&|<|>|,|(")) {
            if (t.str().equals("(")) {
                Token close = BracketMatcher.findClosing(t);
                t = close == null ? null : close.next();
            } else if (QUALIFIERS.contains(t.str()) && !t.str().equals("const") && !t.str().equals("volatile")) {
                return t;
            } else {
                t = t.next();
            }
        }
        return t;
    }

    private static @Nullable Token skipInitializerList(@Nullable Token t) {
        while (t != null) {
            while (TokenMatcher.match(t, "%name%|::|<|>")) {
                t = t.next();
            }
            if (!TokenMatcher.match(t, "(|{")) {
                return t;
            }
            Token close = BracketMatcher.findClosing(t);
            t = close == null ? null : close.next();
            if (!TokenMatcher.simpleMatch(t, ",")) {
                return t;
            }
            t = t.next();
        }
        return null;
    }
}
