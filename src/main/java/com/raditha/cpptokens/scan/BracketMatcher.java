package com.raditha.cpptokens.scan;

import com.raditha.cpptokens.model.InternalAnalysisError;
import com.raditha.cpptokens.model.Token;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Links matching {@code ( )}, {@code [ ]} and {@code { }} tokens.
 */
public final class BracketMatcher {

    private BracketMatcher() {
    }

    /**
     * Link every bracket in the list starting at {@code front}.
     *
     * @return the number of bracket pairs linked
     * @throws InternalAnalysisError of kind SYNTAX if the brackets are unbalanced
     */
    public static int createLinks(Token front) {
        Deque<Token> open = new ArrayDeque<>();
        int pairs = 0;
        for (Token tok = front; tok != null; tok = tok.next()) {
            String s = tok.str();
            if (isOpening(s)) {
                open.push(tok);
            } else if (isClosing(s)) {
                if (open.isEmpty()) {
                    throw unmatched(tok);
                }
                Token start = open.pop();
                if (!closingFor(start.str()).equals(s)) {
                    throw unmatched(start);
                }
                Token.createMutualLinks(start, tok);
                pairs++;
            } else {
                tok.link(null);
            }
        }
        if (!open.isEmpty()) {
            throw unmatched(open.peek());
        }
        return pairs;
    }

    private static InternalAnalysisError unmatched(Token tok) {
        return new InternalAnalysisError(tok, "Syntax error. Unmatched '" + tok.str() + "'.",
                InternalAnalysisError.Kind.SYNTAX);
    }

    public static boolean isOpening(String s) {
        return s.equals("(") || s.equals("[") || s.equals("{");
    }

    public static boolean isClosing(String s) {
        return s.equals(")") || s.equals("]") || s.equals("}");
    }

    static String closingFor(String s) {
        return switch (s) {
            case "(" -> ")";
            case "[" -> "]";
            case "{" -> "}";
            default -> throw new IllegalArgumentException("Not an opening bracket: " + s);
        };
    }

    /**
     * The bracket closing {@code open}: its link when linked, otherwise found by
     * counting nesting depth.
     *
     * @return the closing token or null if there is none before the end of the list
     */
    public static @Nullable Token findClosing(@Nullable Token open) {
        if (open == null || !isOpening(open.str())) {
            return null;
        }
        if (open.link() != null) {
            return open.link();
        }
        String opening = open.str();
        String closing = closingFor(opening);
        int depth = 0;
        for (Token tok = open; tok != null; tok = tok.next()) {
            if (tok.str().equals(opening)) {
                depth++;
            } else if (tok.str().equals(closing) && --depth == 0) {
                return tok;
            }
        }
        return null;
    }
}
