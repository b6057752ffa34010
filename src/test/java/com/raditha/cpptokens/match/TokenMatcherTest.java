package com.raditha.cpptokens.match;

import com.raditha.cpptokens.config.Language;
import com.raditha.cpptokens.config.Settings;
import com.raditha.cpptokens.model.Token;
import com.raditha.cpptokens.tokenlist.TokenList;
import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class TokenMatcherTest {

    private static Token tokenize(String code) {
        TokenList list = new TokenList(Settings.defaults(), Language.CPP);
        assertTrue(list.createTokens(new StringReader(code), "test.cpp"));
        return list.front();
    }

    @Test
    void testSimpleMatch() {
        Token tok = tokenize("int x = 1 ;");

        assertTrue(TokenMatcher.simpleMatch(tok, "int x ="));
        assertFalse(TokenMatcher.simpleMatch(tok, "int y"));
        assertFalse(TokenMatcher.simpleMatch(tok, "int x = 1 ; extra"), "Pattern longer than the list");
        assertFalse(TokenMatcher.simpleMatch(null, "x"));
    }

    @Test
    void testAlternatives() {
        Token tok = tokenize("int x = 1 ;");

        assertTrue(TokenMatcher.match(tok, "char|int %name% ="));
        assertFalse(TokenMatcher.match(tok, "char|long %name%"));
    }

    @Test
    void testOptionalWord() {
        Token tok = tokenize("int x ;");

        assertTrue(TokenMatcher.match(tok, "const| int %name%"));
        assertTrue(TokenMatcher.match(tok.next(), "x ; %any%|"), "Optional words may run past the end");
        assertFalse(TokenMatcher.match(tok.next(), "x ; %any%"));
    }

    @Test
    void testNegation() {
        Token tok = tokenize("if ( a ) x ; else y ;");

        assertTrue(TokenMatcher.match(tok.tokAt(3), ") !!else"));
        assertFalse(TokenMatcher.match(tok.tokAt(5), "; !!else"));
        assertTrue(TokenMatcher.match(tok.tokAt(8), "; !!else"), "End of list satisfies a negation");
    }

    @Test
    void testCharacterSet() {
        Token tok = tokenize("{ ; }");

        assertTrue(TokenMatcher.match(tok, "[{};] [{};] [{};]"));
        assertFalse(TokenMatcher.match(tok, "[()]"));
    }

    @Test
    void testClasses() {
        Token tok = tokenize("x = 3 + \"s\" | y || true == 'c' ;");

        assertTrue(TokenMatcher.match(tok, "%var% %assign% %num% %op% %str% %or% %name% %oror% %bool% %comp% %char%"));
        assertTrue(TokenMatcher.match(tok.tokAt(3), "%cop%"));
        assertFalse(TokenMatcher.match(tok.next(), "%cop%"), "Assignment does not count as a const operator");
        assertTrue(TokenMatcher.match(tok.tokAt(2), "%lit%"));
    }

    @Test
    void testTypeAndVarClasses() {
        Token tok = tokenize("int value return");

        assertTrue(TokenMatcher.match(tok, "%type%"));
        assertFalse(TokenMatcher.match(tok, "%var%"), "Standard types are not variables");
        assertTrue(TokenMatcher.match(tok.next(), "%var%"));
        assertFalse(TokenMatcher.match(tok.tokAt(2), "%type%"), "Keywords are not types");
    }

    @Test
    void testFindMatch() {
        Token tok = tokenize("a = b ; c = 2 ;");

        Token found = TokenMatcher.findMatch(tok, "= %num%");
        assertNotNull(found);
        assertEquals(5, indexOf(tok, found));

        assertNull(TokenMatcher.findMatch(tok, "= %num%", found));
    }

    @Test
    void testUnknownClass() {
        Token tok = tokenize("x");

        assertThrows(IllegalArgumentException.class, () -> TokenMatcher.match(tok, "%nonsense%"));
    }

    private static int indexOf(Token front, Token target) {
        int i = 0;
        for (Token tok = front; tok != null; tok = tok.next(), i++) {
            if (tok == target) {
                return i;
            }
        }
        return -1;
    }
}
