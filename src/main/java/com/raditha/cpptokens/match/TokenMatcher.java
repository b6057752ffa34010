package com.raditha.cpptokens.match;

import com.raditha.cpptokens.model.Token;
import com.raditha.cpptokens.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Matches a run of tokens against a space separated pattern.
 * <p>
 * Each word of the pattern matches one token:
 * <ul>
 * <li>{@code abc} the literal value</li>
 * <li>{@code a|b|c} one of the alternatives; an empty alternative ({@code a|})
 * makes the word optional</li>
 * <li>{@code !!else} any token other than {@code else}, or the end of the list</li>
 * <li>{@code [;{}]} any single character token from the set</li>
 * <li>{@code %any% %name% %type% %num% %str% %char% %bool% %lit% %op% %cop%
 * %or% %oror% %assign% %comp% %var%}</li>
 * </ul>
 * Literal {@code |} and {@code ||} are written {@code %or%} and {@code %oror%}.
 */
public final class TokenMatcher {

    private static final Map<String, List<Word>> CACHE = new ConcurrentHashMap<>();

    private TokenMatcher() {
    }

    /**
     * Match literal words only; no alternatives, classes or negations.
     */
    public static boolean simpleMatch(Token tok, String pattern) {
        if (tok == null) {
            return false;
        }
        int start = 0;
        int length = pattern.length();
        while (start < length) {
            int end = pattern.indexOf(' ', start);
            if (end < 0) {
                end = length;
            }
            if (end > start) {
                if (tok == null || !tok.str().equals(pattern.substring(start, end))) {
                    return false;
                }
                tok = tok.next();
            }
            start = end + 1;
        }
        return true;
    }

    public static boolean match(Token tok, String pattern) {
        List<Word> words = CACHE.computeIfAbsent(pattern, TokenMatcher::compile);
        for (Word word : words) {
            if (tok == null) {
                if (word.negated != null) {
                    continue;
                }
                return word.optional && allOptional(words, word);
            }
            if (word.negated != null) {
                if (tok.str().equals(word.negated)) {
                    return false;
                }
                tok = tok.next();
                continue;
            }
            if (word.matches(tok)) {
                tok = tok.next();
            } else if (!word.optional) {
                return false;
            }
        }
        return true;
    }

    private static boolean allOptional(List<Word> words, Word from) {
        boolean seen = false;
        for (Word w : words) {
            seen |= w == from;
            if (seen && !w.optional && w.negated == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the first token at or after {@code start} that matches, or null
     */
    public static Token findMatch(Token start, String pattern) {
        for (Token tok = start; tok != null; tok = tok.next()) {
            if (match(tok, pattern)) {
                return tok;
            }
        }
        return null;
    }

    /**
     * @return the first token in {@code [start, end)} that matches, or null
     */
    public static Token findMatch(Token start, String pattern, Token end) {
        for (Token tok = start; tok != null && tok != end; tok = tok.next()) {
            if (match(tok, pattern)) {
                return tok;
            }
        }
        return null;
    }

    private static List<Word> compile(String pattern) {
        List<Word> words = new ArrayList<>();
        for (String w : pattern.trim().split(" +")) {
            if (!w.isEmpty()) {
                words.add(Word.parse(w));
            }
        }
        return words;
    }

    private static final class Word {
        private final List<String> alternatives;
        private final boolean optional;
        private final String negated;
        private final String charSet;

        private Word(List<String> alternatives, boolean optional, String negated, String charSet) {
            this.alternatives = alternatives;
            this.optional = optional;
            this.negated = negated;
            this.charSet = charSet;
        }

        static Word parse(String w) {
            if (w.startsWith("!!") && w.length() > 2) {
                return new Word(List.of(), false, w.substring(2), null);
            }
            if (w.length() > 2 && w.charAt(0) == '[' && w.charAt(w.length() - 1) == ']') {
                return new Word(List.of(), false, null, w.substring(1, w.length() - 1));
            }
            List<String> alternatives = new ArrayList<>();
            boolean optional = false;
            int start = 0;
            while (start <= w.length()) {
                int end = w.indexOf('|', start);
                if (end < 0) {
                    end = w.length();
                }
                String alt = w.substring(start, end);
                if (alt.isEmpty()) {
                    optional = true;
                } else {
                    alternatives.add(alt);
                }
                start = end + 1;
            }
            return new Word(alternatives, optional, null, null);
        }

        boolean matches(Token tok) {
            if (charSet != null) {
                return tok.str().length() == 1 && charSet.indexOf(tok.str().charAt(0)) >= 0;
            }
            for (String alt : alternatives) {
                if (matchesAlternative(tok, alt)) {
                    return true;
                }
            }
            return false;
        }

        private static boolean matchesAlternative(Token tok, String alt) {
            if (alt.length() > 2 && alt.charAt(0) == '%' && alt.charAt(alt.length() - 1) == '%') {
                return switch (alt) {
                    case "%any%" -> true;
                    case "%name%" -> tok.isName();
                    case "%type%" -> tok.isName() && !tok.isKeyword() && !tok.isBoolean();
                    case "%var%" -> tok.isName() && !tok.isKeyword() && !tok.isStandardType() && !tok.isBoolean();
                    case "%num%" -> tok.isNumber();
                    case "%str%" -> tok.tokType() == TokenType.STRING;
                    case "%char%" -> tok.tokType() == TokenType.CHAR;
                    case "%bool%" -> tok.isBoolean();
                    case "%lit%" -> tok.isLiteral();
                    case "%op%" -> tok.isOp();
                    case "%cop%" -> tok.isConstOp();
                    case "%or%" -> tok.str().equals("|");
                    case "%oror%" -> tok.str().equals("||");
                    case "%assign%" -> tok.isAssignmentOp();
                    case "%comp%" -> tok.isComparisonOp();
                    default -> throw new IllegalArgumentException("Unknown pattern class: " + alt);
                };
            }
            return tok.str().equals(alt);
        }
    }
}
