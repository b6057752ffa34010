package com.raditha.cpptokens.ast;

import com.raditha.cpptokens.config.Language;
import com.raditha.cpptokens.config.Settings;
import com.raditha.cpptokens.model.Token;
import com.raditha.cpptokens.scan.LambdaScanner;
import com.raditha.cpptokens.tokenlist.TokenList;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstBuilderTest {

    private static TokenList build(String code, Language language) {
        TokenList list = new TokenList(Settings.defaults(), language);
        assertTrue(list.createTokens(new StringReader(code), language == Language.C ? "a.c" : "a.cpp"));
        list.createAst();
        return list;
    }

    private static TokenList build(String code) {
        return build(code, Language.CPP);
    }

    private static List<String> roots(TokenList list) {
        List<String> result = new ArrayList<>();
        for (Token tok = list.front(); tok != null; tok = tok.next()) {
            if (tok.astParent() == null && (tok.astOperand1() != null || tok.astOperand2() != null)) {
                result.add(tok.astString());
            }
        }
        return result;
    }

    private static Token find(TokenList list, String str) {
        for (Token tok = list.front(); tok != null; tok = tok.next()) {
            if (tok.str().equals(str)) {
                return tok;
            }
        }
        fail("No token " + str);
        return null;
    }

    @Test
    void testPrecedence() {
        assertEquals(List.of("abc*d+="), roots(build("a = b * c + d;")));
        assertEquals(List.of("ab+c+"), roots(build("a + b + c;")), "Binary operators associate to the left");
        assertEquals(List.of("abc=="), roots(build("a = b = c;")), "Assignment associates to the right");
    }

    @Test
    void testCall() {
        TokenList list = build("f(a, b);");

        Token paren = list.front().next();
        assertEquals("fab,(", paren.astString());
        assertSame(list.front(), paren.astOperand1());
    }

    @Test
    void testFor() {
        TokenList list = build("for (int i = 0; i < n; i++) {}");

        assertEquals(List.of("fori0=in<i++;;("), roots(list));
    }

    @Test
    void testRangeFor() {
        TokenList list = build("for (auto x : v) {}");

        Token colon = find(list, ":");
        assertEquals("xv:", colon.astString());
        assertSame(colon, list.front().next().astOperand2());
    }

    @Test
    void testTernary() {
        TokenList list = build("r = c ? a : b;");

        Token question = find(list, "?");
        assertEquals("rcab:?=", list.front().next().astString());
        assertEquals(":", question.astOperand2().str());
    }

    @Test
    void testCast() {
        TokenList list = build("x = (int)y;");

        Token paren = find(list, "(");
        assertTrue(paren.isCast());
        assertEquals("xy(=", roots(list).get(0));
    }

    @Test
    void testParenthesizedExpressionIsNotCast() {
        TokenList list = build("x = (a) + b;");

        assertFalse(find(list, "(").isCast(), "A name followed by a binary operator is not a cast");
        assertEquals(List.of("xab+="), roots(list));
    }

    @Test
    void testSizeofType() {
        assertEquals(List.of("nsizeofint(="), roots(build("n = sizeof(int);")));
        assertEquals(List.of("nsizeofS(="), roots(build("n = sizeof(struct S);", Language.C)));
    }

    @Test
    void testCondition() {
        TokenList list = build("if (a == b) { x = 1; }");

        assertEquals(List.of("ifab==(", "x1="), roots(list));
    }

    @Test
    void testMemberAccess() {
        assertEquals(List.of("pq->st.="), roots(build("p->q = s.t;")));
    }

    @Test
    void testFunctionHeadStaysOutOfAst() {
        TokenList list = build("int f(int a) { return a + 1; }");

        assertFalse(list.front().tokAt(2).isInAst(), "Parameter list is not an expression");
        assertEquals(List.of("a1+return"), roots(list));
    }

    @Test
    void testSeparateDeclarators() {
        TokenList list = build("int a = 1, b = 2;");

        assertEquals(List.of("a1=", "b2="), roots(list));
        assertFalse(find(list, ",").isInAst());
    }

    @Test
    void testDeclaratorsJoinedInForInit() {
        TokenList list = build("for (int a = 0, b = 1; a < b; ) {}");

        Token comma = find(list, ",");
        assertEquals("a0=b1=,", comma.astString());
    }

    @Test
    void testLambda() {
        TokenList list = build("auto f = [](int a){ return a; };");

        Token bracket = find(list, "[");
        assertEquals(List.of("f{([="), roots(list).subList(0, 1));
        Token body = LambdaScanner.isLambdaCaptureList(bracket);
        assertNotNull(body);
        assertEquals("{", body.str());
        assertEquals("areturn", find(list, "return").astString(), "Lambda body statements are compiled");
    }

    @Test
    void testNew() {
        assertEquals(List.of("pint5(new="), roots(build("p = new int(5);")));
    }

    @Test
    void testBuildReturnsRootCount() {
        TokenList list = new TokenList(Settings.defaults(), Language.CPP);
        list.createTokens(new StringReader("a = 1; b = 2; c;"), "a.cpp");
        list.createLinks();
        Token.assignIndexes(list.front());

        int roots = new AstBuilder(PrecedencePolicy.forLanguage(Language.CPP)).build(list.front());

        assertEquals(2, roots);
    }

    @Test
    void testCaseAndReturn() {
        TokenList list = build("switch (x) { case 1 + 1: return; }");

        assertEquals("11+case", find(list, "case").astString());
        assertFalse(find(list, "return").isInAst(), "A bare return has no operand");
    }

    @Test
    void testTemplateMemberCall() {
        TokenList list = build("x = y.template get<int>();");

        assertEquals(List.of("xyget.(="), roots(list));
        assertFalse(find(list, ">").isInAst(), "Template arguments are not operands");
        assertDoesNotThrow(() -> list.validateAst(false));
    }

    @Test
    void testMemberTemplateCallWithoutKeyword() {
        TokenList list = build("n = v.size<int>();");

        assertEquals(List.of("nvsize.(="), roots(list));
        assertDoesNotThrow(() -> list.validateAst(false));
    }

    @Test
    void testNamedCasts() {
        for (String cast : List.of("static_cast", "reinterpret_cast", "dynamic_cast", "const_cast")) {
            TokenList list = build("x = " + cast + "<int>(y);");

            Token paren = find(list, "(");
            assertEquals(List.of("x" + cast + "y(="), roots(list), cast);
            assertSame(list.front().tokAt(2), paren.astOperand1(), cast + " is operand1 of the parenthesis");
            assertEquals("y", paren.astOperand2().str());
            assertFalse(find(list, "<").isInAst(), cast);
            assertDoesNotThrow(() -> list.validateAst(false));
        }
    }

    @Test
    void testNamedCastFollowedByMemberAccess() {
        TokenList list = build("p = static_cast<B*>(a)->m;");

        assertEquals(List.of("pstatic_casta(m->="), roots(list));
    }

    @Test
    void testDesignatedInitializers() {
        TokenList list = build("struct S s = { .a = 1, .b = 2 };", Language.C);

        assertEquals(List.of("sa1=b2=,{="), roots(list));
        assertFalse(find(list, ".").isInAst());
        assertDoesNotThrow(() -> list.validateAst(false));
    }

    @Test
    void testArrayDesignator() {
        TokenList list = build("int a[2] = { [0] = 1 };", Language.C);

        assertEquals(List.of("a2[0[1={="), roots(list));
        assertDoesNotThrow(() -> list.validateAst(false));
    }

    @Test
    void testIfWithInitStatement() {
        TokenList list = build("if (auto p = get(); p) {}");

        Token semicolon = find(list, ";");
        assertEquals(List.of("ifpget(=p;("), roots(list));
        assertSame(semicolon, list.front().next().astOperand2());
        assertEquals("p", semicolon.astOperand2().str(), "The condition follows the init statement");
        assertDoesNotThrow(() -> list.validateAst(false));
    }

    @Test
    void testSwitchWithInitStatement() {
        TokenList list = build("switch (int v = f(); v) { case 1: break; }");

        assertEquals("switchvf(=v;(", find(list, "(").astString());
        assertDoesNotThrow(() -> list.validateAst(false));
    }

    @Test
    void testConstructorInitializerList() {
        TokenList list = build("class A { A() : m(0) {} int m; };");

        assertEquals(List.of("m0("), roots(list), "The parameter list is not a call");
        assertFalse(list.front().tokAt(4).isInAst());
        assertDoesNotThrow(() -> list.validateAst(false));
    }

    @Test
    void testQualifiedConstructorDefinition() {
        TokenList list = build("A::A(int x) : m(x), n{x} { f(); }");

        assertEquals(List.of("mx(nx{,", "f("), roots(list));
        assertDoesNotThrow(() -> list.validateAst(false));
    }

    @Test
    void testBuiltTreesValidate() {
        TokenList list = build("int main() { int n = sizeof(int) * 2; for (int i = 0; i < n; ++i) { s.v[i] = i ? -i : i; } return 0; }");

        assertDoesNotThrow(() -> list.validateAst(false));
    }
}
