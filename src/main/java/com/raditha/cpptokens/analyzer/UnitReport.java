package com.raditha.cpptokens.analyzer;

import java.util.List;

/**
 * Result of running the token list pipeline over one translation unit.
 *
 * @param file        path of the unit as given
 * @param language    detected or configured language
 * @param tokenCount  tokens after normalization
 * @param hash        structural hash of the normalized list
 * @param astRoots    number of expression trees
 * @param expressions postfix rendering of every expression tree, in list order
 * @param status      outcome
 * @param error       failure message, null when the unit is OK
 */
public record UnitReport(
        String file,
        String language,
        int tokenCount,
        long hash,
        int astRoots,
        List<String> expressions,
        Status status,
        String error) {

    public enum Status {
        OK,
        /** The lexer failed or reported problems. */
        LEXER_ERROR,
        /** Bracket linking or AST validation failed. */
        AST_ERROR
    }

    public UnitReport {
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
    }

    public static UnitReport failed(String file, String language, int tokenCount, Status status, String error) {
        return new UnitReport(file, language, tokenCount, 0L, 0, List.of(), status, error);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * One line summary for text output.
     */
    public String getSummary() {
        if (!isOk()) {
            return String.format("%s: %s (%s)", file, status, error);
        }
        return String.format("%s: %s, %d tokens, %d expressions, hash %016x",
                file, language, tokenCount, astRoots, hash);
    }
}
