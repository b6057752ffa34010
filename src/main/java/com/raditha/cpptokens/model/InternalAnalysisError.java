package com.raditha.cpptokens.model;

/**
 * Fatal error for the current translation unit.
 * <p>
 * Thrown when the token list or its AST is found in a state that later passes
 * cannot work with. Drivers catch it per translation unit, skip that unit and
 * continue with the next one. It is never used for ordinary "not found" results.
 */
public class InternalAnalysisError extends RuntimeException {

    public enum Kind {
        /** The AST layered on the token list is inconsistent */
        AST,
        /** The token list is not valid code, e.g. unbalanced brackets */
        SYNTAX,
        /** Any other broken invariant */
        INTERNAL,
        /** A configured limit was exceeded */
        LIMIT
    }

    private final transient Token token;
    private final Kind kind;
    private final String details;

    public InternalAnalysisError(Token token, String message, Kind kind) {
        this(token, message, "", kind);
    }

    public InternalAnalysisError(Token token, String message, String details, Kind kind) {
        super(message);
        this.token = token;
        this.kind = kind;
        this.details = details == null ? "" : details;
    }

    /**
     * @return the offending token, may be null
     */
    public Token getToken() {
        return token;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return a human readable dump accompanying the failure, or an empty string
     */
    public String getDetails() {
        return details;
    }
}
