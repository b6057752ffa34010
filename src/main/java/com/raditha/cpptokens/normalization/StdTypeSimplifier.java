package com.raditha.cpptokens.normalization;

import com.raditha.cpptokens.match.TokenMatcher;
import com.raditha.cpptokens.model.Token;
import com.raditha.cpptokens.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Collapses runs of standard type specifiers into a single token.
 * <p>
 * {@code unsigned long long int} becomes one {@code long} token flagged unsigned,
 * long and long-long at the location of {@code unsigned}. {@code long double}
 * becomes {@code double} flagged long, a lone {@code signed} or {@code unsigned}
 * becomes {@code int}. Flags already present on the run are kept, so a second pass
 * changes nothing.
 * <p>
 * For C code a declaration with a storage class or qualifier but no type
 * ({@code static x = 1;}) gets an {@code int} token flagged implicit-int.
 */
public class StdTypeSimplifier {

    private static final Logger logger = LoggerFactory.getLogger(StdTypeSimplifier.class);

    private static final Set<String> SPECIFIERS = Set.of(
            "char", "short", "int", "long", "unsigned", "signed", "double", "float", "_Complex");
    private static final Set<String> IMPLICIT_INT_QUALIFIERS = Set.of(
            "const", "volatile", "static", "extern", "register", "auto");

    private final boolean c;

    /**
     * @param c true for C code, which knows {@code complex} and implicit int
     */
    public StdTypeSimplifier(boolean c) {
        this.c = c;
    }

    /**
     * @return the number of runs rewritten
     */
    public int simplify(Token front) {
        int changed = 0;
        if (c) {
            changed += insertImplicitInt(front);
        }
        for (Token tok = front; tok != null; tok = tok.next()) {
            if (isSpecifier(tok) && collapse(tok)) {
                changed++;
            }
        }
        logger.debug("Collapsed {} standard type runs", changed);
        return changed;
    }

    private boolean isSpecifier(Token tok) {
        if (SPECIFIERS.contains(tok.str())) {
            return true;
        }
        // "complex" is only a specifier when a declarator follows
        return c && tok.str().equals("complex") && TokenMatcher.match(tok.next(), "%name%|*|&");
    }

    private boolean collapse(Token first) {
        boolean isFloat = false;
        boolean isSigned = false;
        boolean isUnsigned = false;
        boolean isComplex = false;
        boolean isLongLong = false;
        int countLong = 0;
        boolean seenShort = false;
        boolean seenChar = false;
        String floatType = null;
        int length = 0;

        for (Token t = first; t != null && isSpecifier(t); t = t.next()) {
            length++;
            isSigned |= t.isSigned();
            isUnsigned |= t.isUnsigned();
            isComplex |= t.isComplex();
            isLongLong |= t.isLongLong();
            switch (t.str()) {
                case "long" -> countLong++;
                case "short" -> seenShort = true;
                case "char" -> seenChar = true;
                case "unsigned" -> isUnsigned = true;
                case "signed" -> isSigned = true;
                case "float", "double" -> {
                    isFloat = true;
                    floatType = t.str();
                    if (t.isLong()) {
                        countLong++;
                    }
                }
                case "complex", "_Complex" -> isComplex = true;
                default -> {
                    // int adds nothing
                }
            }
        }

        String result;
        if (isFloat) {
            result = floatType;
        } else if (seenShort) {
            result = "short";
        } else if (seenChar) {
            result = "char";
        } else if (countLong > 0) {
            result = "long";
        } else {
            result = "int";
        }
        if (countLong >= 2 && !isFloat) {
            isLongLong = true;
        }
        boolean isLong = countLong > 0 && !seenShort && !seenChar;
        isLongLong &= isLong && !isFloat;

        if (length == 1 && first.str().equals(result) && first.isLong() == isLong
                && first.isLongLong() == isLongLong && first.isSigned() == isSigned
                && first.isUnsigned() == isUnsigned && first.isComplex() == isComplex) {
            return false;
        }

        first.deleteNext(length - 1);
        first.str(result);
        first.flags(first.flags() & ~Token.TYPE_FLAGS);
        first.isSigned(isSigned);
        first.isUnsigned(isUnsigned);
        first.isComplex(isComplex);
        first.isLong(isLong);
        first.isLongLong(isLongLong);
        return true;
    }

    /**
     * {@code static x;} becomes {@code static int x;} in C.
     */
    private int insertImplicitInt(Token front) {
        int count = 0;
        for (Token tok = front; tok != null; tok = tok.next()) {
            Token prev = tok.previous();
            if (prev != null && !TokenMatcher.match(prev, "[;{}]")) {
                continue;
            }
            Token t = tok;
            while (t != null && IMPLICIT_INT_QUALIFIERS.contains(t.str())) {
                t = t.next();
            }
            if (t == tok || t == null) {
                continue;
            }
            if (t.tokType() == TokenType.NAME
                    && TokenMatcher.match(t.next(), ";|=|,|[")) {
                Token inserted = t.insertTokenBefore("int");
                inserted.isImplicitInt(true);
                count++;
            }
            tok = t;
        }
        return count;
    }
}
