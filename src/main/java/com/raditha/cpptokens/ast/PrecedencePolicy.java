package com.raditha.cpptokens.ast;

import com.raditha.cpptokens.config.Language;

/**
 * Operator table driving expression tree construction.
 * <p>
 * Binary precedences are positive, higher binds tighter; 0 means the token is not a
 * binary operator in that language. Assignment, the conditional operator and the
 * comma are handled by the builder itself and are not part of the table.
 */
public interface PrecedencePolicy {

    int LOGICAL_OR = 4;

    /**
     * @return the binary precedence of {@code op}, or 0 if it is not a binary operator
     */
    int binaryPrecedence(String op);

    /**
     * @return true if C++ only constructs ({@code ::}, lambdas, templates,
     *         {@code new}/{@code delete}) are recognized
     */
    boolean cpp();

    static PrecedencePolicy forLanguage(Language language) {
        return language == Language.CPP ? StandardPrecedence.CPP : StandardPrecedence.C;
    }

    enum StandardPrecedence implements PrecedencePolicy {
        C(false),
        CPP(true);

        private final boolean cpp;

        StandardPrecedence(boolean cpp) {
            this.cpp = cpp;
        }

        @Override
        public int binaryPrecedence(String op) {
            return switch (op) {
                case "||" -> LOGICAL_OR;
                case "&&" -> 5;
                case "|" -> 6;
                case "^" -> 7;
                case "&" -> 8;
                case "==", "!=" -> 9;
                case "<", "<=", ">", ">=" -> 10;
                case "<=>" -> cpp ? 11 : 0;
                case "<<", ">>" -> 12;
                case "+", "-" -> 13;
                case "*", "/", "%" -> 14;
                case ".*", "->*" -> cpp ? 15 : 0;
                default -> 0;
            };
        }

        @Override
        public boolean cpp() {
            return cpp;
        }
    }
}
