package com.raditha.cpptokens.ast;

import com.raditha.cpptokens.match.TokenMatcher;
import com.raditha.cpptokens.model.Token;
import com.raditha.cpptokens.model.TokenType;
import com.raditha.cpptokens.scan.BracketMatcher;
import com.raditha.cpptokens.scan.FunctionHeadScanner;
import com.raditha.cpptokens.scan.LambdaScanner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds the expression trees of a linked token list.
 * <p>
 * The list is walked statement by statement. Statement boundaries come from the
 * tokens themselves ({@code ;}, braces, control keywords); declaration prefixes and
 * function heads are recognized and left out of the AST. Each expression is
 * compiled by precedence climbing with the operator table of a
 * {@link PrecedencePolicy}. Brackets must already be linked.
 * <p>
 * Tree shapes:
 * <ul>
 * <li>binary operator: operand1 left, operand2 right; assignment and {@code ?:}
 * associate to the right, {@code ?} has the {@code :} as operand2</li>
 * <li>prefix and postfix operators, {@code return}, {@code throw}, {@code case}:
 * operand1</li>
 * <li>call {@code f(a, b)}: the {@code (} with operand1 {@code f} and operand2 the
 * argument tree; subscripts and {@code T{...}} likewise</li>
 * <li>cast {@code (T)x}: the {@code (} flagged cast with operand1 {@code x};
 * {@code static_cast<T>(x)}: the {@code (} with operand1 the keyword and operand2
 * {@code x}</li>
 * <li>{@code if|while|switch (c)}: the {@code (} with operand1 the keyword and
 * operand2 {@code c}, or {@code ;(init, c)} for {@code if (init; c)};
 * {@code for (a; b; c)}: operand2 is {@code ;(a, ;(b, c))}, a range for uses the
 * {@code :}</li>
 * <li>designated initializer {@code .a = 1}: the {@code =} with operand1 {@code a};
 * {@code [i] = 1}: operand1 is the {@code [} with operand1 {@code i}</li>
 * <li>constructor initializer list {@code : a(x), b{y}}: the calls joined by their
 * commas; the parameter list stays out of the AST</li>
 * <li>lambda: the {@code [} with operand1 the parameter {@code (} (whose operand1
 * is the body {@code {}) or the body itself</li>
 * </ul>
 */
public class AstBuilder {

    private static final Logger logger = LoggerFactory.getLogger(AstBuilder.class);

    private static final Set<String> DECL_SPECIFIERS = Set.of(
            "const", "volatile", "static", "extern", "inline", "register", "mutable", "constexpr",
            "consteval", "constinit", "thread_local", "_Thread_local", "virtual", "explicit", "friend",
            "typename", "restrict", "__restrict", "_Atomic", "_Noreturn", "unsigned", "signed", "auto");
    private static final Set<String> TYPE_ID_KEYWORDS = Set.of(
            "const", "volatile", "struct", "union", "enum", "class", "typename", "unsigned", "signed");
    private static final Set<String> PREFIX_OPERATORS = Set.of("!", "~", "-", "+", "*", "&", "++", "--");
    private static final String DECLARATOR_PREFIX = "*|&|&&|const|volatile|restrict|__restrict";

    private final PrecedencePolicy policy;
    private Token cur;

    public AstBuilder(PrecedencePolicy policy) {
        this.policy = policy;
    }

    /**
     * Compile every statement of the list.
     *
     * @return the number of AST roots in the list afterwards
     */
    public int build(Token front) {
        compileStatements(front, null);
        int roots = 0;
        for (Token tok = front; tok != null; tok = tok.next()) {
            if (tok.astParent() == null && (tok.astOperand1() != null || tok.astOperand2() != null)) {
                roots++;
            }
        }
        logger.debug("Built {} AST roots", roots);
        return roots;
    }

    private void compileStatements(Token from, @Nullable Token end) {
        Token tok = from;
        while (tok != null && tok != end) {
            Token next = statement(tok);
            tok = next == tok ? tok.next() : next;
        }
    }

    /**
     * Compile the statement starting at {@code tok}.
     *
     * @return where the next statement starts
     */
    private @Nullable Token statement(Token tok) {
        if (tok.isInAst()) {
            return tok.next();
        }
        String s = tok.str();
        if (TokenMatcher.match(tok, ";|{|}|else|do|try")) {
            return tok.next();
        }
        if (TokenMatcher.match(tok, "if|while|switch (")) {
            return compileCondition(tok, tok.next());
        }
        if (TokenMatcher.simpleMatch(tok, "if constexpr (")) {
            return compileCondition(tok, tok.tokAt(2));
        }
        if (TokenMatcher.simpleMatch(tok, "for (")) {
            return compileFor(tok);
        }
        if (TokenMatcher.simpleMatch(tok, "catch (")) {
            return next(tok.next().link());
        }
        if (TokenMatcher.match(tok, "return|throw|co_return|co_yield")) {
            cur = tok.next();
            if (cur != null && !cur.str().equals(";")) {
                tok.astOperand1(parseExpression());
            }
            return skipToStatementEnd(cur);
        }
        if (s.equals("case")) {
            cur = tok.next();
            tok.astOperand1(parseExpression());
            if (cur != null && cur.str().equals(":")) {
                return cur.next();
            }
            return skipToStatementEnd(cur);
        }
        if (TokenMatcher.match(tok, "default|public|private|protected :")) {
            return tok.tokAt(2);
        }
        if (tok.tokType() == TokenType.NAME && TokenMatcher.simpleMatch(tok.next(), ":")) {
            // label
            return tok.tokAt(2);
        }
        if (TokenMatcher.match(tok, "goto|using|typedef|break|continue")) {
            return skipToStatementEnd(tok);
        }
        if (TokenMatcher.simpleMatch(tok, "[ [") && tok.link() != null) {
            return tok.link().next();
        }
        if (TokenMatcher.simpleMatch(tok, "template <")) {
            Token close = templateClose(tok.next(), true);
            return close == null ? tok.tokAt(2) : close.next();
        }
        if (TokenMatcher.match(tok, "extern %str% {")) {
            return tok.tokAt(3);
        }
        if (TokenMatcher.match(tok, "class|struct|union|enum|namespace")) {
            Token body = findTypeBody(tok);
            if (body != null) {
                return body.next();
            }
        }
        Token constructorParen = constructorParen(tok);
        if (constructorParen != null) {
            return constructorTail(constructorParen);
        }
        Token typeEnd = declarationTypeEnd(tok);
        if (typeEnd != null) {
            Declarators declarators = compileDeclarators(typeEnd);
            if (declarators.functionParen() != null) {
                return functionTail(declarators.functionParen());
            }
            return skipToStatementEnd(cur);
        }
        cur = tok;
        parseExpression();
        return skipToStatementEnd(cur);
    }

    private @Nullable Token compileCondition(Token keyword, Token paren) {
        Token close = paren.link();
        if (close == null) {
            return paren.next();
        }
        Token semicolon = null;
        for (Token t = paren.next(); t != close && semicolon == null; t = t.next()) {
            if (BracketMatcher.isOpening(t.str()) && t.link() != null) {
                t = t.link();
            } else if (t.str().equals(";")) {
                semicolon = t;
            }
        }
        Token condition;
        if (semicolon == null) {
            condition = compileInitOrExpression(paren.next(), close);
        } else {
            // if (init; condition)
            Token init = compileInitOrExpression(paren.next(), semicolon);
            semicolon.astOperand1(init);
            semicolon.astOperand2(compileInitOrExpression(semicolon.next(), close));
            condition = semicolon;
        }
        paren.astOperand1(keyword);
        paren.astOperand2(condition);
        return close.next();
    }

    private @Nullable Token compileFor(Token forTok) {
        Token paren = forTok.next();
        Token close = paren.link();
        if (close == null) {
            return paren.next();
        }
        Token semi1 = null;
        Token semi2 = null;
        Token colon = null;
        for (Token t = paren.next(); t != close; t = t.next()) {
            if (BracketMatcher.isOpening(t.str()) && t.link() != null) {
                t = t.link();
            } else if (t.str().equals(";")) {
                if (semi1 == null) {
                    semi1 = t;
                } else if (semi2 == null) {
                    semi2 = t;
                }
            } else if (t.str().equals(":") && colon == null) {
                colon = t;
            }
        }
        paren.astOperand1(forTok);
        if (semi1 == null && colon != null && policy.cpp()) {
            Token variable = colon.previous();
            if (variable.str().equals("]") && variable.link() != null) {
                variable = variable.link();
            }
            cur = colon.next();
            Token range = parseExpression();
            colon.astOperand1(variable);
            colon.astOperand2(range);
            paren.astOperand2(colon);
            return close.next();
        }
        if (semi1 == null || semi2 == null) {
            cur = paren.next();
            paren.astOperand2(cur == close ? null : parseExpression());
            return close.next();
        }
        Token init = compileInitOrExpression(paren.next(), semi1);
        cur = semi1.next();
        Token condition = cur == semi2 ? null : parseExpression();
        cur = semi2.next();
        Token increment = cur == close ? null : parseExpression();
        semi2.astOperand1(condition);
        semi2.astOperand2(increment);
        semi1.astOperand1(init);
        semi1.astOperand2(semi2);
        paren.astOperand2(semi1);
        return close.next();
    }

    /**
     * A declaration or an expression inside a control statement's parentheses.
     * Several declarators are joined by their commas.
     */
    private @Nullable Token compileInitOrExpression(Token start, Token end) {
        if (start == end) {
            return null;
        }
        Token typeEnd = declarationTypeEnd(start);
        if (typeEnd == null) {
            cur = start;
            return parseExpression();
        }
        Declarators declarators = compileDeclarators(typeEnd);
        Token result = null;
        for (int i = 0; i < declarators.roots().size(); i++) {
            Token root = declarators.roots().get(i);
            Token comma = declarators.separators().get(i);
            if (result == null) {
                result = root;
            } else if (comma != null) {
                comma.astOperand1(result);
                comma.astOperand2(root);
                result = comma;
            }
        }
        return result;
    }

    // ---------------------------------------------------------------- declarations

    private record Declarators(List<Token> roots, List<Token> separators, @Nullable Token functionParen) {
    }

    /**
     * Compile the declarators following a declaration's type. Plain declarators
     * without initializer produce no tree. Leaves {@link #cur} after the last one.
     */
    private Declarators compileDeclarators(Token typeEnd) {
        List<Token> roots = new ArrayList<>();
        List<Token> separators = new ArrayList<>();
        Token t = typeEnd;
        Token separator = null;
        boolean first = true;
        while (true) {
            while (TokenMatcher.match(t, DECLARATOR_PREFIX)) {
                t = t.next();
            }
            if (t == null || !t.isName()) {
                cur = t;
                break;
            }
            Token name = t;
            while (policy.cpp() && TokenMatcher.match(name.next(), ":: %name%|~")) {
                name = name.tokAt(name.strAt(2).equals("~") ? 3 : 2);
            }
            if (name.str().equals("operator")) {
                cur = name;
                return new Declarators(roots, separators, operatorParen(name));
            }
            Token after = name.next();
            if (first && TokenMatcher.simpleMatch(after, "(") && looksLikeParameterList(after)) {
                cur = after;
                return new Declarators(roots, separators, after);
            }
            if (TokenMatcher.match(after, "=|(|[") || (policy.cpp() && TokenMatcher.simpleMatch(after, "{"))) {
                cur = name;
                Token root = parseAssign();
                if (root != null && root.isInAst()) {
                    roots.add(root);
                    separators.add(separator);
                }
            } else {
                cur = after;
            }
            if (TokenMatcher.match(cur, ": %num%")) {
                cur = cur.tokAt(2);
            }
            if (cur == null || !cur.str().equals(",")) {
                break;
            }
            separator = cur;
            t = cur.next();
            first = false;
        }
        return new Declarators(roots, separators, null);
    }

    private @Nullable Token functionTail(Token paren) {
        Token close = paren.link();
        if (close == null) {
            return paren.next();
        }
        Token end = FunctionHeadScanner.functionTailEnd(close);
        if (TokenMatcher.match(end, "{|;")) {
            return end.next();
        }
        return skipToStatementEnd(close.next());
    }

    /**
     * The parameter list of a definition without return type: a constructor or
     * destructor, possibly qualified ({@code A::A(...)}), followed by its body or by
     * an initializer list.
     */
    private @Nullable Token constructorParen(Token tok) {
        Token name = tok.str().equals("~") ? tok.next() : tok;
        if (name == null || name.tokType() != TokenType.NAME) {
            return null;
        }
        while (policy.cpp() && TokenMatcher.match(name.next(), ":: %name%|~")) {
            name = name.tokAt(name.strAt(2).equals("~") ? 3 : 2);
        }
        Token paren = name.next();
        if (!TokenMatcher.simpleMatch(paren, "(") || paren.link() == null) {
            return null;
        }
        if (!looksLikeParameterList(paren) && !TokenMatcher.simpleMatch(paren.link().next(), ":")) {
            return null;
        }
        Token end = FunctionHeadScanner.functionTailEnd(paren.link());
        return TokenMatcher.simpleMatch(end, "{") ? paren : null;
    }

    /**
     * Compile the member initializers of a constructor as one expression.
     *
     * @return the first token of the body
     */
    private @Nullable Token constructorTail(Token paren) {
        Token close = paren.link();
        Token body = FunctionHeadScanner.functionTailEnd(close);
        for (Token t = close.next(); t != null && t != body; t = t.next()) {
            if (BracketMatcher.isOpening(t.str()) && t.link() != null) {
                t = t.link();
            } else if (t.str().equals(":")) {
                cur = t.next();
                parseExpression();
                break;
            }
        }
        return next(body);
    }

    /**
     * The parenthesis opening the parameters of {@code operator+(...)},
     * {@code operator()(...)} and the like.
     */
    private static @Nullable Token operatorParen(Token operatorTok) {
        Token t = operatorTok.next();
        if (TokenMatcher.simpleMatch(t, "( ) (")) {
            return t.tokAt(2);
        }
        while (t != null && !t.str().equals("(") && !TokenMatcher.match(t, ";|{|}")) {
            t = t.next();
        }
        return TokenMatcher.simpleMatch(t, "(") ? t : null;
    }

    private boolean looksLikeParameterList(Token paren) {
        Token t = paren.next();
        if (t == paren.link()) {
            return true;
        }
        if (t.isStandardType() || TokenMatcher.match(t, "void|...|const|volatile|struct|class|enum|union|typename|unsigned|signed|register|auto")) {
            return true;
        }
        if (t.tokType() != TokenType.NAME) {
            return false;
        }
        Token n = skipQualifiedAndTemplate(t.next());
        return n != t.next() || TokenMatcher.match(n, "%name%|*|&|&&");
    }

    /**
     * Find the end of the type at the start of a declaration.
     *
     * @return the first token after the type (the first declarator, possibly a
     *         pointer), or null if {@code tok} does not start a declaration
     */
    private @Nullable Token declarationTypeEnd(Token tok) {
        Token t = tok;
        boolean sawType = false;
        while (t != null) {
            String s = t.str();
            if (DECL_SPECIFIERS.contains(s)) {
                if (s.equals("unsigned") || s.equals("signed") || (s.equals("auto") && policy.cpp())) {
                    sawType = true;
                }
                t = t.next();
            } else if (t.isStandardType()) {
                sawType = true;
                t = t.next();
            } else if (TokenMatcher.match(t, "struct|class|union|enum %name%")) {
                sawType = true;
                t = skipQualifiedAndTemplate(t.tokAt(2));
            } else if (TokenMatcher.match(t, "decltype|typeof|__typeof__ (") && t.next().link() != null) {
                sawType = true;
                t = t.next().link().next();
            } else if (!sawType && t.tokType() == TokenType.NAME) {
                sawType = true;
                t = skipQualifiedAndTemplate(t.next());
            } else if (!sawType && policy.cpp() && TokenMatcher.match(t, ":: %name%")) {
                t = t.next();
            } else {
                break;
            }
        }
        if (!sawType) {
            return null;
        }
        Token d = t;
        while (TokenMatcher.match(d, DECLARATOR_PREFIX)) {
            d = d.next();
        }
        if (d == null) {
            return null;
        }
        if (d.str().equals("operator")) {
            return t;
        }
        if (d.tokType() != TokenType.NAME) {
            return null;
        }
        Token after = d.next();
        while (policy.cpp() && TokenMatcher.match(after, ":: %name%|~")) {
            after = after.tokAt(after.strAt(1).equals("~") ? 3 : 2);
        }
        if (after == null || TokenMatcher.match(after, "=|;|,|(|[|{|:")) {
            return t;
        }
        return null;
    }

    private @Nullable Token skipQualifiedAndTemplate(@Nullable Token t) {
        while (policy.cpp() && t != null) {
            if (t.str().equals("<")) {
                Token close = templateClose(t, false);
                if (close == null) {
                    break;
                }
                t = close.next();
            } else if (TokenMatcher.match(t, ":: %name%")) {
                t = t.tokAt(2);
            } else {
                break;
            }
        }
        return t;
    }

    /**
     * The brace opening the body of a class, struct, union, enum or namespace
     * definition, or null if {@code tok} does not start one.
     */
    private @Nullable Token findTypeBody(Token tok) {
        Token t = tok.next();
        while (t != null) {
            String s = t.str();
            if (s.equals("{")) {
                return t;
            }
            if (TokenMatcher.match(t, ";|=|(|)|,|}")) {
                return null;
            }
            if (s.equals("[") && t.link() != null) {
                t = t.link().next();
            } else if (s.equals("<") && policy.cpp()) {
                Token close = templateClose(t, true);
                t = close == null ? t.next() : close.next();
            } else {
                t = t.next();
            }
        }
        return null;
    }

    /**
     * The {@code >} closing a template argument or parameter list.
     *
     * @param parameters true for {@code template <...>} where default arguments may appear
     * @return the closing token, or null if {@code lt} does not open a template list
     */
    private @Nullable Token templateClose(Token lt, boolean parameters) {
        int depth = 0;
        for (Token t = lt; t != null; t = t.next()) {
            String s = t.str();
            if (s.equals("<")) {
                depth++;
            } else if (s.equals(">")) {
                if (--depth == 0) {
                    return t;
                }
            } else if (s.equals(">>")) {
                depth -= 2;
                if (depth <= 0) {
                    return t;
                }
            } else if ((s.equals("(") || s.equals("[")) && t.link() != null) {
                t = t.link();
            } else if (TokenMatcher.match(t, ";|{|}|)|]|&&|%oror%|?|==|!=|<=|>=")
                    || (!parameters && s.equals("="))) {
                return null;
            }
        }
        return null;
    }

    private static @Nullable Token skipToStatementEnd(@Nullable Token t) {
        while (t != null) {
            String s = t.str();
            if (s.equals(";")) {
                return t.next();
            }
            if (s.equals("{") || s.equals("}")) {
                return t;
            }
            if ((s.equals("(") || s.equals("[")) && t.link() != null) {
                t = t.link();
            }
            t = t.next();
        }
        return null;
    }

    private static @Nullable Token next(@Nullable Token tok) {
        return tok == null ? null : tok.next();
    }

    // ---------------------------------------------------------------- expressions

    private @Nullable Token parseExpression() {
        Token lhs = parseAssign();
        while (cur != null && cur.str().equals(",") && lhs != null) {
            Token comma = cur;
            cur = cur.next();
            Token rhs = parseAssign();
            comma.astOperand1(lhs);
            comma.astOperand2(rhs);
            lhs = comma;
        }
        return lhs;
    }

    private @Nullable Token parseAssign() {
        Token lhs = parseBinary(PrecedencePolicy.LOGICAL_OR);
        if (cur == null || lhs == null) {
            return lhs;
        }
        if (cur.str().equals("?")) {
            Token question = cur;
            cur = cur.next();
            Token whenTrue = TokenMatcher.simpleMatch(cur, ":") ? null : parseExpression();
            question.astOperand1(lhs);
            if (!TokenMatcher.simpleMatch(cur, ":")) {
                question.astOperand2(whenTrue);
                return question;
            }
            Token colon = cur;
            cur = cur.next();
            Token whenFalse = parseAssign();
            colon.astOperand1(whenTrue);
            colon.astOperand2(whenFalse);
            question.astOperand2(colon);
            return question;
        }
        if (cur.isAssignmentOp()) {
            Token op = cur;
            cur = cur.next();
            Token rhs = parseAssign();
            op.astOperand1(lhs);
            op.astOperand2(rhs);
            return op;
        }
        return lhs;
    }

    private @Nullable Token parseBinary(int minPrecedence) {
        Token lhs = parseUnary();
        while (cur != null && lhs != null) {
            int precedence = policy.binaryPrecedence(cur.str());
            if (precedence == 0 || precedence < minPrecedence) {
                break;
            }
            Token op = cur;
            cur = cur.next();
            Token rhs = parseBinary(precedence + 1);
            op.astOperand1(lhs);
            op.astOperand2(rhs);
            lhs = op;
        }
        return lhs;
    }

    private @Nullable Token parseUnary() {
        if (cur == null) {
            return null;
        }
        String s = cur.str();
        if (PREFIX_OPERATORS.contains(s)) {
            Token op = cur;
            cur = cur.next();
            op.astOperand1(parseUnary());
            return op;
        }
        if (TokenMatcher.match(cur, "sizeof|alignof|_Alignof|typeid|decltype|noexcept")) {
            return parseSizeof();
        }
        if (TokenMatcher.match(cur, "throw|co_await")) {
            Token op = cur;
            cur = cur.next();
            if (!TokenMatcher.match(cur, ";|)|]|}|,|:")) {
                op.astOperand1(parseAssign());
            }
            return op;
        }
        if (policy.cpp() && s.equals("new")) {
            return parseNew();
        }
        if (policy.cpp() && s.equals("delete")) {
            Token op = cur;
            cur = cur.next();
            if (TokenMatcher.simpleMatch(cur, "[ ]")) {
                cur = cur.tokAt(2);
            }
            op.astOperand1(parseUnary());
            return op;
        }
        if (policy.cpp() && TokenMatcher.match(cur, "static_cast|reinterpret_cast|dynamic_cast|const_cast <")) {
            Token named = parseNamedCast();
            if (named != null) {
                return parsePostfix(named);
            }
        }
        if (s.equals("(") && isCast(cur)) {
            Token cast = cur;
            cast.isCast(true);
            cur = cast.link().next();
            cast.astOperand1(parseUnary());
            return cast;
        }
        return parsePostfix(parsePrimary());
    }

    /**
     * {@code static_cast<T>(e)}: the {@code (} with operand1 the keyword and operand2
     * {@code e}. The template arguments stay out of the AST.
     */
    private @Nullable Token parseNamedCast() {
        Token keyword = cur;
        Token close = templateClose(keyword.next(), false);
        if (close == null || !TokenMatcher.simpleMatch(close.next(), "(") || close.next().link() == null) {
            return null;
        }
        Token paren = close.next();
        cur = paren.next();
        Token argument = cur == paren.link() ? null : parseExpression();
        cur = paren.link().next();
        paren.astOperand1(keyword);
        paren.astOperand2(argument);
        return paren;
    }

    private Token parseSizeof() {
        Token op = cur;
        cur = cur.next();
        if (TokenMatcher.simpleMatch(cur, "(") && cur.link() != null) {
            Token paren = cur;
            Token close = paren.link();
            Token inner;
            if (paren.next() == close) {
                inner = null;
            } else if (isTypeId(paren.next(), close)) {
                inner = lastName(paren.next(), close);
            } else {
                cur = paren.next();
                inner = parseExpression();
            }
            cur = close.next();
            paren.astOperand1(op);
            paren.astOperand2(inner);
            return paren;
        }
        op.astOperand1(parseUnary());
        return op;
    }

    private Token parseNew() {
        Token op = cur;
        cur = cur.next();
        if (TokenMatcher.simpleMatch(cur, "(") && cur.link() != null && !isTypeId(cur.next(), cur.link())) {
            // placement arguments
            cur = cur.link().next();
        }
        Token type = null;
        if (TokenMatcher.simpleMatch(cur, "(") && cur.link() != null) {
            type = lastName(cur.next(), cur.link());
            cur = cur.link().next();
        } else {
            while (cur != null && (cur.isName() || cur.str().equals("::"))) {
                if (cur.isName()) {
                    type = cur;
                }
                cur = skipQualifiedAndTemplate(cur.next());
            }
            while (TokenMatcher.match(cur, "*|&")) {
                cur = cur.next();
            }
        }
        Token result = type;
        if (TokenMatcher.match(cur, "(|{|[") && cur.link() != null) {
            Token bracket = cur;
            Token close = bracket.link();
            cur = bracket.next();
            Token args = cur == close ? null : parseExpression();
            cur = close.next();
            bracket.astOperand1(type);
            bracket.astOperand2(args);
            result = bracket;
        }
        op.astOperand1(result);
        return op;
    }

    private @Nullable Token parsePrimary() {
        if (cur == null) {
            return null;
        }
        Token t = cur;
        if (t.isLiteral() || t.isNumber()) {
            cur = t.next();
            // adjacent string literals are one literal
            while (t.tokType() == TokenType.STRING && cur != null && cur.tokType() == TokenType.STRING) {
                cur = cur.next();
            }
            return t;
        }
        if (t.isName()) {
            cur = t.next();
            return t;
        }
        if (policy.cpp() && t.str().equals("::") && TokenMatcher.match(t.next(), "%name%|~")) {
            cur = t.next();
            if (cur.str().equals("~")) {
                cur = cur.next();
            }
            t.astOperand1(parsePrimary());
            return t;
        }
        if (t.str().equals("(") && t.link() != null) {
            Token close = t.link();
            cur = t.next();
            Token inner = cur == close ? null : parseExpression();
            cur = close.next();
            return inner;
        }
        if (t.str().equals("{") && t.link() != null) {
            return parseBraced(t, null);
        }
        if (policy.cpp() && t.str().equals("[")) {
            Token lambda = parseLambda(t);
            if (lambda != null || !isDesignator(t)) {
                return lambda;
            }
        }
        if (isDesignator(t)) {
            return parseDesignator(t);
        }
        return null;
    }

    /**
     * {@code .name} or {@code [index]} at the start of an element of a braced list,
     * followed by {@code =} or by another designator.
     */
    private static boolean isDesignator(Token t) {
        if (!TokenMatcher.match(t.previous(), "{|,")) {
            return false;
        }
        Token after;
        if (TokenMatcher.match(t, ". %name%")) {
            after = t.tokAt(2);
        } else if (t.str().equals("[") && t.link() != null) {
            after = t.link().next();
        } else {
            return false;
        }
        return TokenMatcher.match(after, "=|.|[");
    }

    /**
     * {@code .a} becomes the member name {@code a}; {@code [i]} becomes the
     * {@code [} with operand1 {@code i}.
     */
    private Token parseDesignator(Token t) {
        if (t.str().equals(".")) {
            cur = t.tokAt(2);
            return t.next();
        }
        Token close = t.link();
        cur = t.next();
        t.astOperand1(cur == close ? null : parseExpression());
        cur = close.next();
        return t;
    }

    private Token parseBraced(Token brace, @Nullable Token type) {
        Token close = brace.link();
        cur = brace.next();
        Token inner = cur == close ? null : parseExpression();
        cur = close.next();
        if (type != null) {
            brace.astOperand1(type);
            brace.astOperand2(inner);
        } else {
            brace.astOperand1(inner);
        }
        return brace;
    }

    private @Nullable Token parseLambda(Token bracket) {
        Token end = LambdaScanner.findLambdaEndTokenWithoutAST(bracket);
        if (end == null || end.link() == null) {
            return null;
        }
        Token body = end.link();
        compileStatements(body.next(), end);
        Token params = bracket.link().next();
        if (params.str().equals("(")) {
            params.astOperand1(body);
            bracket.astOperand1(params);
        } else {
            bracket.astOperand1(body);
        }
        cur = end.next();
        return bracket;
    }

    private @Nullable Token parsePostfix(@Nullable Token operand) {
        Token lhs = operand;
        while (cur != null && lhs != null) {
            String s = cur.str();
            if ((s.equals("(") || s.equals("[")) && cur.link() != null) {
                if (s.equals("[") && TokenMatcher.simpleMatch(cur.next(), "[")) {
                    break;
                }
                Token bracket = cur;
                Token close = bracket.link();
                cur = bracket.next();
                Token args = cur == close ? null : parseExpression();
                cur = close.next();
                bracket.astOperand1(lhs);
                bracket.astOperand2(args);
                lhs = bracket;
            } else if (s.equals(".") || s.equals("->") || (policy.cpp() && s.equals("::"))) {
                Token op = cur;
                cur = cur.next();
                boolean templateMember = TokenMatcher.simpleMatch(cur, "template");
                if (TokenMatcher.match(cur, "template|~")) {
                    cur = cur.next();
                }
                Token member = null;
                if (cur != null && cur.isName()) {
                    member = cur;
                    cur = cur.next();
                    if (policy.cpp() && TokenMatcher.simpleMatch(cur, "<")) {
                        Token close = templateClose(cur, false);
                        if (close != null && (templateMember || TokenMatcher.match(close.next(), "(|::|{"))) {
                            cur = close.next();
                        }
                    }
                }
                op.astOperand1(lhs);
                op.astOperand2(member);
                lhs = op;
            } else if (s.equals("++") || s.equals("--")) {
                Token op = cur;
                cur = cur.next();
                op.astOperand1(lhs);
                lhs = op;
            } else if (policy.cpp() && s.equals("<") && isTypeName(lhs)) {
                Token close = templateClose(cur, false);
                if (close == null || !TokenMatcher.match(close.next(), "(|::|{")) {
                    break;
                }
                cur = close.next();
            } else if (policy.cpp() && s.equals("{") && cur.link() != null && isTypeName(lhs)) {
                lhs = parseBraced(cur, lhs);
            } else {
                break;
            }
        }
        return lhs;
    }

    private static boolean isTypeName(Token tok) {
        return tok.tokType() == TokenType.NAME || tok.tokType() == TokenType.TYPE
                || (tok.str().equals("::") && tok.astOperand2() != null);
    }

    /**
     * {@code (T)x}, {@code (const char *)p}, {@code (struct S){...}}
     */
    private boolean isCast(Token paren) {
        Token close = paren.link();
        if (close == null || paren.next() == close || !isTypeId(paren.next(), close)) {
            return false;
        }
        Token after = close.next();
        if (after == null) {
            return false;
        }
        boolean explicitType = false;
        for (Token t = paren.next(); t != close; t = t.next()) {
            if (t.isStandardType() || TYPE_ID_KEYWORDS.contains(t.str()) || TokenMatcher.match(t, "*|&")) {
                explicitType = true;
            }
        }
        if (after.isName() || after.isLiteral() || after.isNumber()) {
            return true;
        }
        return explicitType && TokenMatcher.match(after, "(|{|!|~|-|+|*|&|++|--");
    }

    private boolean isTypeId(Token first, Token end) {
        Token prev = null;
        int templateDepth = 0;
        for (Token t = first; t != end; t = t.next()) {
            String s = t.str();
            boolean typePart = t.isStandardType() || TYPE_ID_KEYWORDS.contains(s) || s.equals("::");
            if (typePart) {
                prev = t;
                continue;
            }
            if (t.tokType() == TokenType.NAME) {
                if (prev != null && templateDepth == 0
                        && (prev.tokType() == TokenType.NAME || TokenMatcher.match(prev, "*|&|&&"))) {
                    return false;
                }
            } else if (TokenMatcher.match(t, "*|&|&&")) {
                if (prev == null) {
                    return false;
                }
            } else if (policy.cpp() && s.equals("<")) {
                templateDepth++;
            } else if (policy.cpp() && s.equals(">") && templateDepth > 0) {
                templateDepth--;
            } else if (templateDepth == 0 || !(s.equals(",") || t.isNumber())) {
                return false;
            }
            prev = t;
        }
        return prev != null && templateDepth == 0 && !prev.str().equals("::");
    }

    private static Token lastName(Token first, Token end) {
        Token result = first;
        for (Token t = first; t != end; t = t.next()) {
            if (t.isName() && !TYPE_ID_KEYWORDS.contains(t.str())) {
                result = t;
            }
        }
        return result;
    }
}
