package com.raditha.cpptokens.ast;

import com.raditha.cpptokens.match.TokenMatcher;
import com.raditha.cpptokens.model.InternalAnalysisError;
import com.raditha.cpptokens.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.function.Function;

/**
 * Checks the AST layered over a token list.
 * <p>
 * Structural checks come first: every AST link points into the list, parent and
 * operand links agree, and no token is its own ancestor. Then the shape rules for
 * tokens that take part in the AST: binary operators have two operands, {@code ?}
 * has a {@code :} as operand2, {@code ++}/{@code --} and {@code case} have an
 * operand, control statement parentheses have both the keyword and the condition
 * and member access has both sides.
 */
public class AstValidator {

    private static final Logger logger = LoggerFactory.getLogger(AstValidator.class);

    private final Function<Token, String> locationOf;

    /**
     * @param locationOf renders a token's location for messages, e.g. {@code file.c:12}
     */
    public AstValidator(Function<Token, String> locationOf) {
        this.locationOf = locationOf;
    }

    /**
     * @param print attach (and log) a dump of the offending expression tree
     * @throws InternalAnalysisError of kind AST on the first violation
     */
    public void validate(Token front, boolean print) {
        Set<Token> members = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Token tok = front; tok != null; tok = tok.next()) {
            members.add(tok);
        }
        for (Token tok = front; tok != null; tok = tok.next()) {
            checkLinks(tok, members);
        }
        checkCycles(front);
        for (Token tok = front; tok != null; tok = tok.next()) {
            if (tok.isInAst()) {
                checkShape(tok, print);
            }
        }
    }

    private void checkLinks(Token tok, Set<Token> members) {
        Token parent = tok.astParent();
        if (parent != null) {
            if (!members.contains(parent)) {
                throw error(tok, "AST parent is not part of the token list");
            }
            if (parent.astOperand1() != tok && parent.astOperand2() != tok) {
                throw error(tok, "AST broken: '" + parent.str() + "' is the parent of '" + tok.str()
                        + "' but has no such operand");
            }
        }
        checkOperand(tok, tok.astOperand1(), members);
        checkOperand(tok, tok.astOperand2(), members);
    }

    private void checkOperand(Token tok, Token operand, Set<Token> members) {
        if (operand == null) {
            return;
        }
        if (!members.contains(operand)) {
            throw error(tok, "AST operand of '" + tok.str() + "' is not part of the token list");
        }
        if (operand.astParent() != tok) {
            throw error(tok, "AST broken: operand '" + operand.str() + "' of '" + tok.str()
                    + "' does not point back to it");
        }
    }

    private void checkCycles(Token front) {
        Set<Token> safe = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Token tok = front; tok != null; tok = tok.next()) {
            Set<Token> path = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Token t = tok; t != null && !safe.contains(t); t = t.astParent()) {
                if (!path.add(t)) {
                    throw error(t, "AST broken: cyclic dependency");
                }
            }
            safe.addAll(path);
        }
    }

    private void checkShape(Token tok, boolean print) {
        Token op1 = tok.astOperand1();
        Token op2 = tok.astOperand2();
        if (TokenMatcher.match(tok, "%or%|%oror%|%assign%|%comp%|^|/|%") && (op1 == null || op2 == null)) {
            boolean exempt = TokenMatcher.simpleMatch(tok.previous(), ") = 0")
                    || TokenMatcher.simpleMatch(tok.previous(), "operator")
                    || TokenMatcher.match(tok, "= {|[")
                    || TokenMatcher.match(tok.previous(), "%name% = %name%");
            if (!exempt) {
                throw error(tok, "Syntax Error: AST broken, binary operator '" + tok.str()
                        + "' doesn't have two operands.", print);
            }
        }
        if (tok.str().equals("?") && (op1 == null || op2 == null || !op2.str().equals(":"))) {
            throw error(tok, "Syntax Error: AST broken, ternary operator missing operand(s)", print);
        }
        if (TokenMatcher.match(tok, "++|--") && op1 == null && !TokenMatcher.simpleMatch(tok.previous(), "operator")) {
            throw error(tok, "Syntax Error: AST broken, operator '" + tok.str() + "' doesn't have an operand.", print);
        }
        if (tok.str().equals("(") && TokenMatcher.match(tok.previous(), "if|while|for|switch")
                && (op1 == null || op2 == null)) {
            throw error(tok, "Syntax Error: AST broken, '" + tok.strAt(-1) + "' doesn't have two operands.", print);
        }
        if (tok.str().equals("case") && op1 == null) {
            throw error(tok, "Syntax Error: AST broken, 'case' doesn't have an operand.", print);
        }
        if (TokenMatcher.match(tok, ".|->") && (op1 == null || op2 == null)) {
            throw error(tok, "Syntax Error: AST broken, member access '" + tok.str()
                    + "' doesn't have two operands.", print);
        }
    }

    private InternalAnalysisError error(Token tok, String message) {
        return new InternalAnalysisError(tok, message, "'" + tok.str() + "' at " + locationOf.apply(tok),
                InternalAnalysisError.Kind.AST);
    }

    private InternalAnalysisError error(Token tok, String message, boolean print) {
        String details = "";
        if (print) {
            details = tok.astTop().astTree();
            logger.error("{}: {}\n{}", locationOf.apply(tok), message, details);
        }
        return new InternalAnalysisError(tok, message, details, InternalAnalysisError.Kind.AST);
    }
}
