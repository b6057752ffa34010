package com.raditha.cpptokens.scan;

import com.raditha.cpptokens.config.Language;
import com.raditha.cpptokens.config.Settings;
import com.raditha.cpptokens.model.Token;
import com.raditha.cpptokens.tokenlist.TokenList;
import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class LambdaScannerTest {

    private static TokenList tokenize(String code) {
        TokenList list = new TokenList(Settings.defaults(), Language.CPP);
        assertTrue(list.createTokens(new StringReader(code), "a.cpp"));
        return list;
    }

    private static Token first(TokenList list, String str) {
        for (Token tok = list.front(); tok != null; tok = tok.next()) {
            if (tok.str().equals(str)) {
                return tok;
            }
        }
        fail("No token " + str);
        return null;
    }

    @Test
    void testCaptureListWithoutAst() {
        TokenList list = tokenize("[ ] ( int a ) { return a ; }");

        Token body = LambdaScanner.isLambdaCaptureList(list.front());
        assertNotNull(body);
        assertEquals("{", body.str());
        assertEquals("(", body.previous().previous().previous().previous().str());
    }

    @Test
    void testCaptureForms() {
        assertNotNull(LambdaScanner.isLambdaCaptureList(tokenize("[ = , & x ] { }").front()));
        assertNotNull(LambdaScanner.isLambdaCaptureList(tokenize("[ & ] { }").front()));
        assertNotNull(LambdaScanner.isLambdaCaptureList(tokenize("[ this , * this ] { }").front()));
        assertNotNull(LambdaScanner.isLambdaCaptureList(tokenize("[ n = f ( 1 , 2 ) ] { }").front()));
        assertNotNull(LambdaScanner.isLambdaCaptureList(tokenize("[ args ... ] { }").front()));
    }

    @Test
    void testSubscriptIsNotCaptureList() {
        TokenList list = tokenize("a [ 0 ] ;");

        assertNull(LambdaScanner.isLambdaCaptureList(first(list, "[")));
        assertNull(LambdaScanner.isLambdaCaptureList(list.front()), "Only [ qualifies");
    }

    @Test
    void testLiteralInBracketsIsNotCaptureList() {
        TokenList list = tokenize("x [ 1 ] { } ;");

        assertNull(LambdaScanner.isLambdaCaptureList(first(list, "[")));
    }

    @Test
    void testCaptureListWithAst() {
        TokenList list = tokenize("auto g = [ & ] ( int v ) { return v ; } ;");
        list.createAst();

        Token body = LambdaScanner.isLambdaCaptureList(first(list, "["));
        assertSame(first(list, "{"), body);
    }

    @Test
    void testFindLambdaEnd() {
        TokenList list = tokenize("[ x ] ( ) mutable -> int { return x ; } ( ) ;");

        Token end = LambdaScanner.findLambdaEndTokenWithoutAST(list.front());
        assertNotNull(end);
        assertEquals("}", end.str());
        assertEquals("(", end.next().str());
    }

    @Test
    void testFindLambdaEndUnbalanced() {
        assertNull(LambdaScanner.findLambdaEndTokenWithoutAST(tokenize("[ ] { return ;").front()));
        assertNull(LambdaScanner.findLambdaEndTokenWithoutAST(tokenize("x").front()));
        assertNull(LambdaScanner.findLambdaEndTokenWithoutAST(null));
    }
}
