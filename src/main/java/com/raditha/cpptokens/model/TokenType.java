package com.raditha.cpptokens.model;

/**
 * Lexical category of a token, derived from its value.
 */
public enum TokenType {
    /** Empty token */
    NONE,

    /** Identifier that is not a keyword or standard type */
    NAME,

    /** Language keyword (if, return, const, ...) */
    KEYWORD,

    /** Standard type name (int, char, void, ...) */
    TYPE,

    NUMBER,

    /** String literal, including prefixed forms such as L"x" */
    STRING,

    /** Character literal */
    CHAR,

    /** true / false */
    BOOLEAN,

    /** = += -= *= /= %= &= |= ^= &lt;&lt;= &gt;&gt;= */
    ASSIGNMENT_OP,

    /** + - * / % &lt;&lt; &gt;&gt; */
    ARITHMETICAL_OP,

    /** == != &lt; &lt;= &gt; &gt;= &lt;=&gt; */
    COMPARISON_OP,

    /** &amp;&amp; || ! */
    LOGICAL_OP,

    /** &amp; | ^ ~ */
    BIT_OP,

    /** ++ -- */
    INC_DEC_OP,

    /** , ( ) [ ] ? : */
    EXTENDED_OP,

    ELLIPSIS,

    /** ; { } :: . -&gt; and anything else */
    OTHER
}
