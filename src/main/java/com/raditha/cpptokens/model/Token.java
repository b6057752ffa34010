package com.raditha.cpptokens.model;

import java.util.Set;

/**
 * A token in a doubly linked token list.
 * <p>
 * Besides its value and source location, a token carries a bracket link (between
 * matching brackets) and the AST links of the expression tree that is layered
 * over the list. Tokens are created and destroyed by their list; a token must not
 * be used after the list deleted it.
 */
public final class Token {

    public static final int FLAG_KEYWORD = 1;
    public static final int FLAG_UNSIGNED = 1 << 1;
    public static final int FLAG_SIGNED = 1 << 2;
    public static final int FLAG_LONG = 1 << 3;
    public static final int FLAG_LONG_LONG = 1 << 4;
    public static final int FLAG_COMPLEX = 1 << 5;
    public static final int FLAG_IMPLICIT_INT = 1 << 6;
    public static final int FLAG_STANDARD_TYPE = 1 << 7;
    public static final int FLAG_CAST = 1 << 8;
    public static final int FLAG_SPLIT = 1 << 9;

    /** Flags that change the meaning of a type token */
    public static final int TYPE_FLAGS = FLAG_UNSIGNED | FLAG_SIGNED | FLAG_LONG | FLAG_LONG_LONG | FLAG_COMPLEX;

    private static final Set<String> STANDARD_TYPES = Set.of(
            "bool", "_Bool", "char", "char8_t", "char16_t", "char32_t", "double", "float",
            "int", "long", "short", "size_t", "void", "wchar_t");

    private final TokensFrontBack frontBack;

    private String str = "";
    private TokenType tokType = TokenType.NONE;
    private int flags;
    private String originalName = "";
    private String macroName = "";

    private int lineNumber;
    private int column;
    private int fileIndex;
    private int progressValue;
    private int index;

    private Token next;
    private Token previous;
    private Token link;

    private Token astParent;
    private Token astOperand1;
    private Token astOperand2;

    public Token(TokensFrontBack frontBack) {
        this.frontBack = frontBack;
    }

    // ---------------------------------------------------------------- value

    public String str() {
        return str;
    }

    /**
     * Set the value and reclassify the token.
     */
    public void str(String s) {
        this.str = s;
        updatePropertyInfo();
    }

    public TokenType tokType() {
        return tokType;
    }

    public void tokType(TokenType type) {
        this.tokType = type;
    }

    /**
     * Spelling that a normalization pass replaced, empty if the token is unchanged.
     */
    public String originalName() {
        return originalName;
    }

    public void originalName(String name) {
        this.originalName = name == null ? "" : name;
    }

    public String macroName() {
        return macroName;
    }

    public void macroName(String name) {
        this.macroName = name == null ? "" : name;
    }

    private void updatePropertyInfo() {
        flags &= ~(FLAG_KEYWORD | FLAG_STANDARD_TYPE);
        if (str.isEmpty()) {
            tokType = TokenType.NONE;
            return;
        }
        char c0 = str.charAt(0);
        if (Character.isDigit(c0) || (c0 == '.' && str.length() > 1 && Character.isDigit(str.charAt(1)))) {
            tokType = TokenType.NUMBER;
        } else if (isQuoted('"')) {
            tokType = TokenType.STRING;
        } else if (isQuoted('\'')) {
            tokType = TokenType.CHAR;
        } else if (Character.isLetter(c0) || c0 == '_' || c0 == '$') {
            if (str.equals("true") || str.equals("false")) {
                tokType = TokenType.BOOLEAN;
            } else if (STANDARD_TYPES.contains(str)) {
                tokType = TokenType.TYPE;
                flags |= FLAG_STANDARD_TYPE;
            } else if (frontBack != null && frontBack.owner() != null && frontBack.owner().isKeyword(str)) {
                tokType = TokenType.KEYWORD;
                flags |= FLAG_KEYWORD;
            } else {
                tokType = TokenType.NAME;
            }
        } else {
            tokType = classifyPunctuator(str);
        }
    }

    private boolean isQuoted(char quote) {
        int first = str.indexOf(quote);
        if (first < 0 || str.length() < first + 2 || str.charAt(str.length() - 1) != quote) {
            return false;
        }
        for (int i = 0; i < first; i++) {
            char c = str.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                return false;
            }
        }
        return true;
    }

    private static TokenType classifyPunctuator(String s) {
        return switch (s) {
            case "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=" -> TokenType.ASSIGNMENT_OP;
            case "+", "-", "*", "/", "%", "<<", ">>" -> TokenType.ARITHMETICAL_OP;
            case "==", "!=", "<", "<=", ">", ">=", "<=>" -> TokenType.COMPARISON_OP;
            case "&&", "||", "!" -> TokenType.LOGICAL_OP;
            case "&", "|", "^", "~" -> TokenType.BIT_OP;
            case "++", "--" -> TokenType.INC_DEC_OP;
            case ",", "(", ")", "[", "]", "?", ":" -> TokenType.EXTENDED_OP;
            case "..." -> TokenType.ELLIPSIS;
            default -> TokenType.OTHER;
        };
    }

    // ---------------------------------------------------------------- classification

    /**
     * Names include keywords, standard types and booleans.
     */
    public boolean isName() {
        return tokType == TokenType.NAME || tokType == TokenType.KEYWORD
                || tokType == TokenType.TYPE || tokType == TokenType.BOOLEAN;
    }

    public boolean isNumber() {
        return tokType == TokenType.NUMBER;
    }

    public boolean isLiteral() {
        return tokType == TokenType.NUMBER || tokType == TokenType.STRING
                || tokType == TokenType.CHAR || tokType == TokenType.BOOLEAN;
    }

    public boolean isBoolean() {
        return tokType == TokenType.BOOLEAN;
    }

    public boolean isArithmeticalOp() {
        return tokType == TokenType.ARITHMETICAL_OP;
    }

    public boolean isComparisonOp() {
        return tokType == TokenType.COMPARISON_OP;
    }

    public boolean isAssignmentOp() {
        return tokType == TokenType.ASSIGNMENT_OP;
    }

    public boolean isIncDecOp() {
        return tokType == TokenType.INC_DEC_OP;
    }

    /**
     * Operators that do not modify their operands.
     */
    public boolean isConstOp() {
        return isArithmeticalOp() || isComparisonOp()
                || tokType == TokenType.LOGICAL_OP || tokType == TokenType.BIT_OP;
    }

    public boolean isOp() {
        return isConstOp() || isAssignmentOp() || isIncDecOp();
    }

    public boolean isExtendedOp() {
        return isOp() || tokType == TokenType.EXTENDED_OP;
    }

    /**
     * A name with at least one letter and no lower case letters, e.g. a macro.
     */
    public boolean isUpperCaseName() {
        if (!isName()) {
            return false;
        }
        boolean letter = false;
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            letter |= Character.isLetter(c);
        }
        return letter;
    }

    // ---------------------------------------------------------------- flags

    public int flags() {
        return flags;
    }

    public void flags(int newFlags) {
        this.flags = newFlags;
    }

    private boolean flag(int mask) {
        return (flags & mask) != 0;
    }

    private void flag(int mask, boolean value) {
        flags = value ? (flags | mask) : (flags & ~mask);
    }

    public boolean isKeyword() {
        return flag(FLAG_KEYWORD);
    }

    public void isKeyword(boolean value) {
        flag(FLAG_KEYWORD, value);
    }

    public boolean isUnsigned() {
        return flag(FLAG_UNSIGNED);
    }

    public void isUnsigned(boolean value) {
        flag(FLAG_UNSIGNED, value);
    }

    public boolean isSigned() {
        return flag(FLAG_SIGNED);
    }

    public void isSigned(boolean value) {
        flag(FLAG_SIGNED, value);
    }

    public boolean isLong() {
        return flag(FLAG_LONG);
    }

    public void isLong(boolean value) {
        flag(FLAG_LONG, value);
    }

    public boolean isLongLong() {
        return flag(FLAG_LONG_LONG);
    }

    public void isLongLong(boolean value) {
        flag(FLAG_LONG_LONG, value);
    }

    public boolean isComplex() {
        return flag(FLAG_COMPLEX);
    }

    public void isComplex(boolean value) {
        flag(FLAG_COMPLEX, value);
    }

    public boolean isImplicitInt() {
        return flag(FLAG_IMPLICIT_INT);
    }

    public void isImplicitInt(boolean value) {
        flag(FLAG_IMPLICIT_INT, value);
    }

    public boolean isStandardType() {
        return flag(FLAG_STANDARD_TYPE);
    }

    public boolean isCast() {
        return flag(FLAG_CAST);
    }

    public void isCast(boolean value) {
        flag(FLAG_CAST, value);
    }

    public boolean isSplit() {
        return flag(FLAG_SPLIT);
    }

    public void isSplit(boolean value) {
        flag(FLAG_SPLIT, value);
    }

    // ---------------------------------------------------------------- location

    public int lineNumber() {
        return lineNumber;
    }

    public void lineNumber(int line) {
        this.lineNumber = line;
    }

    public int column() {
        return column;
    }

    public void column(int col) {
        this.column = col;
    }

    public int fileIndex() {
        return fileIndex;
    }

    public void fileIndex(int index) {
        this.fileIndex = index;
    }

    /**
     * Position of this token in the list as a percentage, see {@link #assignProgressValues}.
     */
    public int progressValue() {
        return progressValue;
    }

    public int index() {
        return index;
    }

    // ---------------------------------------------------------------- navigation

    public Token next() {
        return next;
    }

    public Token previous() {
        return previous;
    }

    /**
     * @return the token {@code offset} steps away (negative goes backwards), or null
     */
    public Token tokAt(int offset) {
        Token tok = this;
        while (offset > 0 && tok != null) {
            tok = tok.next;
            offset--;
        }
        while (offset < 0 && tok != null) {
            tok = tok.previous;
            offset++;
        }
        return tok;
    }

    /**
     * @return the value of the token {@code offset} steps away, or "" if there is none
     */
    public String strAt(int offset) {
        Token tok = tokAt(offset);
        return tok == null ? "" : tok.str;
    }

    /**
     * @throws InternalAnalysisError if there is no linked token at that offset
     */
    public Token linkAt(int offset) {
        Token tok = tokAt(offset);
        if (tok == null || tok.link == null) {
            throw new InternalAnalysisError(this, "Internal error. Token::linkAt called for a token without link.",
                    InternalAnalysisError.Kind.INTERNAL);
        }
        return tok.link;
    }

    /**
     * Matching bracket for ( ) [ ] { }, or null.
     */
    public Token link() {
        return link;
    }

    public void link(Token other) {
        this.link = other;
    }

    public static void createMutualLinks(Token begin, Token end) {
        begin.link = end;
        end.link = begin;
    }

    // ---------------------------------------------------------------- editing

    /**
     * Insert a new token after this one. The new token takes this token's location.
     *
     * @return the inserted token
     */
    public Token insertToken(String value) {
        Token t = newTokenAtThisLocation(value);
        t.previous = this;
        t.next = next;
        if (next != null) {
            next.previous = t;
        } else if (frontBack != null) {
            frontBack.back(t);
        }
        next = t;
        return t;
    }

    /**
     * Insert a new token before this one. The new token takes this token's location.
     *
     * @return the inserted token
     */
    public Token insertTokenBefore(String value) {
        Token t = newTokenAtThisLocation(value);
        t.next = this;
        t.previous = previous;
        if (previous != null) {
            previous.next = t;
        } else if (frontBack != null) {
            frontBack.front(t);
        }
        previous = t;
        return t;
    }

    private Token newTokenAtThisLocation(String value) {
        Token t = new Token(frontBack);
        t.str(value);
        t.lineNumber = lineNumber;
        t.column = column;
        t.fileIndex = fileIndex;
        t.progressValue = progressValue;
        return t;
    }

    /**
     * Delete up to {@code count} tokens following this one.
     */
    public void deleteNext(int count) {
        while (next != null && count > 0) {
            Token n = next;
            if (n.link != null && n.link.link == n) {
                n.link.link = null;
            }
            n.unlinkAst();
            next = n.next;
            n.next = null;
            n.previous = null;
            count--;
        }
        if (next != null) {
            next.previous = this;
        } else if (frontBack != null) {
            frontBack.back(this);
        }
    }

    public void deleteNext() {
        deleteNext(1);
    }

    /**
     * Remove this token from the list.
     * <p>
     * The token object survives by taking over the data of its successor (or of its
     * predecessor at the end of the list); references to the token stay valid. A
     * token that is alone in its list becomes ";".
     */
    public void deleteThis() {
        unlinkAst();
        if (next != null) {
            Token n = next;
            takeData(n);
            n.link = null;
            deleteNext(1);
        } else if (previous != null) {
            Token p = previous;
            takeData(p);
            p.link = null;
            p.unlinkAst();
            previous = p.previous;
            if (previous != null) {
                previous.next = this;
            } else if (frontBack != null) {
                frontBack.front(this);
            }
            p.next = null;
            p.previous = null;
        } else {
            str(";");
        }
    }

    private void takeData(Token from) {
        str = from.str;
        tokType = from.tokType;
        flags = from.flags;
        originalName = from.originalName;
        macroName = from.macroName;
        lineNumber = from.lineNumber;
        column = from.column;
        fileIndex = from.fileIndex;
        progressValue = from.progressValue;
        link = from.link;
        if (link != null) {
            link.link = this;
        }
    }

    /**
     * Delete the tokens strictly between {@code begin} and {@code end}.
     */
    public static void eraseTokens(Token begin, Token end) {
        if (begin == null || begin == end) {
            return;
        }
        while (begin.next != null && begin.next != end) {
            begin.deleteNext(1);
        }
    }

    // ---------------------------------------------------------------- AST

    public Token astParent() {
        return astParent;
    }

    /**
     * Raw parent link. Does not update the parent's operands; use
     * {@link #astOperand1(Token)} or {@link #astOperand2(Token)} to build trees.
     */
    public void astParent(Token parent) {
        this.astParent = parent;
    }

    public Token astOperand1() {
        return astOperand1;
    }

    public Token astOperand2() {
        return astOperand2;
    }

    public void astOperand1(Token tok) {
        if (astOperand1 != null && astOperand1.astParent == this) {
            astOperand1.astParent = null;
        }
        astOperand1 = adopt(tok);
    }

    public void astOperand2(Token tok) {
        if (astOperand2 != null && astOperand2.astParent == this) {
            astOperand2.astParent = null;
        }
        astOperand2 = adopt(tok);
    }

    private Token adopt(Token tok) {
        if (tok == null) {
            return null;
        }
        if (tok == this) {
            throw new InternalAnalysisError(this, "Internal error. AST cyclic dependency.",
                    InternalAnalysisError.Kind.AST);
        }
        tok.detachFromParent();
        tok.astParent = this;
        return tok;
    }

    private void detachFromParent() {
        if (astParent != null) {
            if (astParent.astOperand1 == this) {
                astParent.astOperand1 = null;
            }
            if (astParent.astOperand2 == this) {
                astParent.astOperand2 = null;
            }
            astParent = null;
        }
    }

    /**
     * Remove every AST link to and from this token.
     */
    public void unlinkAst() {
        detachFromParent();
        if (astOperand1 != null && astOperand1.astParent == this) {
            astOperand1.astParent = null;
        }
        if (astOperand2 != null && astOperand2.astParent == this) {
            astOperand2.astParent = null;
        }
        astOperand1 = null;
        astOperand2 = null;
    }

    /**
     * @return true if the token takes part in an expression tree
     */
    public boolean isInAst() {
        return astParent != null || astOperand1 != null || astOperand2 != null;
    }

    public Token astTop() {
        Token tok = this;
        while (tok.astParent != null) {
            tok = tok.astParent;
        }
        return tok;
    }

    /**
     * Postfix rendering of the tree below this token: operand1, operand2, value.
     * {@code x = 1 + 2} renders as {@code x12+=}.
     */
    public String astString() {
        return astString("");
    }

    /**
     * Postfix rendering with a separator after every token.
     */
    public String astString(String sep) {
        StringBuilder sb = new StringBuilder();
        appendAstString(sb, sep);
        return sb.toString();
    }

    private void appendAstString(StringBuilder sb, String sep) {
        if (astOperand1 != null) {
            astOperand1.appendAstString(sb, sep);
        }
        if (astOperand2 != null) {
            astOperand2.appendAstString(sb, sep);
        }
        sb.append(str).append(sep);
    }

    /**
     * Indented tree dump of the expression below this token.
     */
    public String astTree() {
        StringBuilder sb = new StringBuilder();
        sb.append(str).append(' ').append('(').append(lineNumber).append(':').append(column).append(')').append('\n');
        appendAstChildren(sb, "");
        return sb.toString();
    }

    private void appendAstChildren(StringBuilder sb, String indent) {
        if (astOperand1 != null) {
            boolean last = astOperand2 == null;
            sb.append(indent).append(last ? "`-" : "|-").append(astOperand1.str).append('\n');
            astOperand1.appendAstChildren(sb, indent + (last ? "  " : "| "));
        }
        if (astOperand2 != null) {
            sb.append(indent).append("`-").append(astOperand2.str).append('\n');
            astOperand2.appendAstChildren(sb, indent + "  ");
        }
    }

    /**
     * Source text of the expression below this token. Requires indexes, see
     * {@link #assignIndexes(Token)}.
     */
    public String expressionString() {
        Token[] bounds = {this, this};
        collectBounds(this, bounds);
        Token start = bounds[0];
        Token end = bounds[1];
        if (end.link != null && (end.str.equals("(") || end.str.equals("[") || end.str.equals("{"))) {
            end = end.link;
        }
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        for (Token tok = start; tok != null; tok = tok.next) {
            if (prev != null && (prev.isName() || prev.isLiteral()) && (tok.isName() || tok.isLiteral())) {
                sb.append(' ');
            }
            sb.append(tok.str);
            prev = tok;
            if (tok == end) {
                break;
            }
        }
        return sb.toString();
    }

    private static void collectBounds(Token tok, Token[] bounds) {
        if (tok.index < bounds[0].index) {
            bounds[0] = tok;
        }
        if (tok.index > bounds[1].index) {
            bounds[1] = tok;
        }
        if (tok.astOperand1 != null) {
            collectBounds(tok.astOperand1, bounds);
        }
        if (tok.astOperand2 != null) {
            collectBounds(tok.astOperand2, bounds);
        }
    }

    // ---------------------------------------------------------------- whole list helpers

    /**
     * Give each token its position in the list as a percentage.
     */
    public static void assignProgressValues(Token front) {
        int total = 0;
        for (Token tok = front; tok != null; tok = tok.next) {
            total++;
        }
        int count = 0;
        for (Token tok = front; tok != null; tok = tok.next) {
            tok.progressValue = total == 0 ? 0 : (int) (100L * count++ / total);
        }
    }

    /**
     * Number the tokens in list order, starting at 1.
     */
    public static void assignIndexes(Token front) {
        int i = 1;
        for (Token tok = front; tok != null; tok = tok.next) {
            tok.index = i++;
        }
    }

    /**
     * @return true if {@code first} comes before {@code second} in the list.
     *         Requires indexes, see {@link #assignIndexes(Token)}.
     */
    public static boolean precedes(Token first, Token second) {
        if (first == null) {
            return false;
        }
        if (second == null) {
            return true;
        }
        return first.index < second.index;
    }

    @Override
    public String toString() {
        return str;
    }
}
