package com.raditha.cpptokens.normalization;

import com.raditha.cpptokens.config.Language;
import com.raditha.cpptokens.config.Settings;
import com.raditha.cpptokens.model.Token;
import com.raditha.cpptokens.tokenlist.TokenList;
import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class StdTypeSimplifierTest {

    private static TokenList tokenize(String code, Language language) {
        TokenList list = new TokenList(Settings.defaults(), language);
        assertTrue(list.createTokens(new StringReader(code), language == Language.C ? "a.c" : "a.cpp"));
        return list;
    }

    private static String text(TokenList list) {
        StringBuilder sb = new StringBuilder();
        for (Token tok = list.front(); tok != null; tok = tok.next()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(tok.str());
        }
        return sb.toString();
    }

    @Test
    void testUnsignedLongLongInt() {
        TokenList list = tokenize("unsigned long long int x;", Language.CPP);

        list.simplifyStdType();

        assertEquals("long x ;", text(list));
        Token type = list.front();
        assertTrue(type.isUnsigned());
        assertTrue(type.isLong());
        assertTrue(type.isLongLong());
        assertFalse(type.isSigned());
    }

    @Test
    void testCollapseIsIdempotent() {
        TokenList list = tokenize("unsigned long long int x; long double d; signed s;", Language.CPP);
        list.simplifyStdType();
        String once = text(list);
        long hash = list.calculateHash();

        int changed = new StdTypeSimplifier(false).simplify(list.front());

        assertEquals(0, changed, "A second pass must not find anything to collapse");
        assertEquals(once, text(list));
        assertEquals(hash, list.calculateHash(), "Flags must survive a second pass");
    }

    @Test
    void testLongDouble() {
        TokenList list = tokenize("long double d;", Language.CPP);

        list.simplifyStdType();

        Token type = list.front();
        assertEquals("double", type.str());
        assertTrue(type.isLong());
        assertFalse(type.isLongLong());
    }

    @Test
    void testLoneSignedness() {
        TokenList list = tokenize("unsigned u; signed char c; short int s;", Language.CPP);

        list.simplifyStdType();

        assertEquals("int u ; char c ; short s ;", text(list));
        assertTrue(list.front().isUnsigned());
        assertTrue(list.front().tokAt(3).isSigned());
    }

    @Test
    void testPlainIntUnchanged() {
        TokenList list = tokenize("int x;", Language.CPP);

        assertEquals(0, new StdTypeSimplifier(false).simplify(list.front()));
    }

    @Test
    void testImplicitIntInC() {
        TokenList list = tokenize("static x = 1; const y;", Language.C);

        list.simplifyStdType();

        assertEquals("static int x = 1 ; const int y ;", text(list));
        Token inserted = list.front().next();
        assertTrue(inserted.isImplicitInt());
        assertEquals(1, inserted.lineNumber());
    }

    @Test
    void testNoImplicitIntInCpp() {
        TokenList list = tokenize("static x = 1;", Language.CPP);

        list.simplifyStdType();

        assertEquals("static x = 1 ;", text(list));
    }

    @Test
    void testComplexInC() {
        TokenList list = tokenize("double complex z; complex = 1;", Language.C);

        list.simplifyStdType();

        assertEquals("double z ; complex = 1 ;", text(list));
        assertTrue(list.front().isComplex());
    }
}
