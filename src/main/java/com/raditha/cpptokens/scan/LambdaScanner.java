package com.raditha.cpptokens.scan;

import com.raditha.cpptokens.match.TokenMatcher;
import com.raditha.cpptokens.model.Token;
import org.jspecify.annotations.Nullable;

/**
 * Recognizes lambda expressions from their tokens.
 * <p>
 * Both scanners work before the AST exists; when it does,
 * {@link #isLambdaCaptureList(Token)} uses the lambda shape the AST builder creates:
 * the {@code [} has the body {@code {} as operand1, or a parameter {@code (} whose
 * operand1 is the body.
 */
public final class LambdaScanner {

    private LambdaScanner() {
    }

    /**
     * @param tok a {@code [} token
     * @return the {@code {} that opens the lambda body if {@code tok} starts a lambda
     *         capture list, otherwise null
     */
    public static @Nullable Token isLambdaCaptureList(@Nullable Token tok) {
        if (tok == null || !tok.str().equals("[")) {
            return null;
        }
        Token close = BracketMatcher.findClosing(tok);
        if (close == null || !TokenMatcher.match(close.next(), "(|{|mutable|->")) {
            return null;
        }
        Token op1 = tok.astOperand1();
        if (op1 != null) {
            if (op1.str().equals("{") && op1 == close.next()) {
                return op1;
            }
            if (op1.str().equals("(") && op1.astOperand1() != null && op1.astOperand1().str().equals("{")) {
                return op1.astOperand1();
            }
            return null;
        }
        if (!isCaptureSyntax(tok.next(), close)) {
            return null;
        }
        Token body = findBody(tok);
        return body != null && BracketMatcher.findClosing(body) != null ? body : null;
    }

    /**
     * Scan over a lambda by bracket depth alone.
     *
     * @param tok the {@code [} that starts the lambda
     * @return the {@code }} that ends the lambda body, or null if no balanced end is found
     */
    public static @Nullable Token findLambdaEndTokenWithoutAST(@Nullable Token tok) {
        Token body = findBody(tok);
        return body == null ? null : BracketMatcher.findClosing(body);
    }

    private static @Nullable Token findBody(@Nullable Token tok) {
        if (tok == null || !tok.str().equals("[")) {
            return null;
        }
        Token close = BracketMatcher.findClosing(tok);
        if (close == null) {
            return null;
        }
        Token t = close.next();
        if (TokenMatcher.simpleMatch(t, "(")) {
            t = next(BracketMatcher.findClosing(t));
        }
        while (TokenMatcher.match(t, "mutable|constexpr|consteval|static|noexcept")) {
            t = TokenMatcher.simpleMatch(t.next(), "(") ? next(BracketMatcher.findClosing(t.next())) : t.next();
        }
        if (TokenMatcher.simpleMatch(t, "->")) {
            t = t.next();
            while (TokenMatcher.match(t, "%name%|::|&|&&|*|<|>|,|(")) {
                t = t.str().equals("(") ? next(BracketMatcher.findClosing(t)) : t.next();
            }
        }
        if (!TokenMatcher.simpleMatch(t, "{")) {
            return null;
        }
        return t;
    }

    private static @Nullable Token next(@Nullable Token tok) {
        return tok == null ? null : tok.next();
    }

    /**
     * {@code []}, {@code [=]}, {@code [&]}, {@code [this]}, {@code [*this]},
     * {@code [a, &b]}, {@code [x = expr]} and packs {@code [args...]}.
     */
    private static boolean isCaptureSyntax(Token first, Token close) {
        Token t = first;
        while (t != close) {
            if (TokenMatcher.match(t, "=|& ,|]")) {
                t = t.next();
            } else if (TokenMatcher.simpleMatch(t, "* this")) {
                t = t.tokAt(2);
            } else {
                if (t.str().equals("&") || t.str().equals("...")) {
                    t = t.next();
                }
                if (t == close || !t.isName() || (t.isKeyword() && !t.str().equals("this"))) {
                    return false;
                }
                t = t.next();
                if (t.str().equals("...")) {
                    t = t.next();
                }
                if (t.str().equals("=") || t.str().equals("{") || t.str().equals("(")) {
                    t = skipInitializer(t, close);
                    if (t == null) {
                        return false;
                    }
                }
            }
            if (t == close) {
                return true;
            }
            if (!t.str().equals(",")) {
                return false;
            }
            t = t.next();
        }
        return true;
    }

    private static @Nullable Token skipInitializer(Token t, Token close) {
        while (t != null && t != close && !t.str().equals(",")) {
            if (BracketMatcher.isOpening(t.str())) {
                Token end = BracketMatcher.findClosing(t);
                if (end == null) {
                    return null;
                }
                t = end;
            }
            t = t.next();
        }
        return t;
    }
}
