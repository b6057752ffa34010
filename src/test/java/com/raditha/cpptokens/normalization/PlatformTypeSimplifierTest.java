package com.raditha.cpptokens.normalization;

import com.raditha.cpptokens.config.Language;
import com.raditha.cpptokens.config.Platform;
import com.raditha.cpptokens.config.PlatformType;
import com.raditha.cpptokens.config.PlatformTypes;
import com.raditha.cpptokens.config.Settings;
import com.raditha.cpptokens.config.Standards;
import com.raditha.cpptokens.model.Token;
import com.raditha.cpptokens.tokenlist.TokenList;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlatformTypeSimplifierTest {

    private static TokenList tokenize(String code, Settings settings) {
        TokenList list = new TokenList(settings, Language.CPP);
        assertTrue(list.createTokens(new StringReader(code), "a.cpp"));
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
    void testSizeTOnLp64() {
        TokenList list = tokenize("size_t n; ptrdiff_t d;", Settings.defaults());

        list.simplifyPlatformTypes();

        assertEquals("long n ; long d ;", text(list));
        Token n = list.front();
        assertTrue(n.isUnsigned());
        assertTrue(n.isLong());
        assertFalse(n.isLongLong());
        assertEquals("size_t", n.originalName());
        assertFalse(list.front().tokAt(3).isUnsigned(), "ptrdiff_t is signed");
    }

    @Test
    void testQualifiedSizeT() {
        TokenList list = tokenize("std :: size_t a; :: size_t b;", Settings.defaults());

        list.simplifyPlatformTypes();

        assertEquals("long a ; long b ;", text(list));
        assertEquals("std::size_t", list.front().originalName());
        assertEquals("size_t", list.front().tokAt(3).originalName());
    }

    @Test
    void testSizeTOnWin64() {
        TokenList list = tokenize("size_t n;", Settings.defaults().withPlatform(Platform.win64()));

        list.simplifyPlatformTypes();

        Token n = list.front();
        assertEquals("long", n.str());
        assertTrue(n.isLongLong(), "size_t is long long on LLP64");
    }

    @Test
    void testMemberSizeTAndAliasDeclarationUntouched() {
        TokenList list = tokenize("using size_t = unsigned long; foo :: size_t x;", Settings.defaults());

        list.simplifyPlatformTypes();

        assertEquals("using size_t = unsigned long ; foo :: size_t x ;", text(list));
    }

    @Test
    void testAliasDeclarationBeforeCpp11IsRewritten() {
        Settings settings = Settings.defaults().withStandards(
                new Standards(Standards.CStandard.C11, Standards.CppStandard.CPP03));
        TokenList list = tokenize("using size_t = x;", settings);

        list.simplifyPlatformTypes();

        assertEquals("using long = x ;", text(list));
    }

    @Test
    void testWindowsAliases() {
        Settings settings = Settings.defaults().withPlatform(Platform.win32A());
        TokenList list = tokenize("DWORD a; LPCSTR s; LPSTR p;", settings);

        list.simplifyPlatformTypes();

        assertEquals("long a ; const char * s ; char * p ;", text(list));
        Token dword = list.front();
        assertTrue(dword.isUnsigned());
        assertTrue(dword.isLong());
        assertEquals("DWORD", dword.originalName());
        assertEquals("LPCSTR", list.front().tokAt(4).originalName());
    }

    @Test
    void testWindowsAliasesIgnoredOnUnix() {
        TokenList list = tokenize("DWORD a;", Settings.defaults().withPlatform(Platform.unix64()));

        list.simplifyPlatformTypes();

        assertEquals("DWORD a ;", text(list));
    }

    @Test
    void testConfiguredPointerToPointer() {
        PlatformTypes types = PlatformTypes.builder()
                .add("PPCHAR", new PlatformType("char", false, false, false, false, true, false), List.of("unix64"))
                .build();
        Settings settings = Settings.defaults().withPlatform(Platform.unix64()).withPlatformTypes(types);
        TokenList list = tokenize("PPCHAR argv;", settings);

        list.simplifyPlatformTypes();

        assertEquals("char * * argv ;", text(list));
        assertEquals("PPCHAR", list.front().originalName());
    }

    @Test
    void testGlobalScopeAlias() {
        Settings settings = Settings.defaults().withPlatform(Platform.win64());
        TokenList list = tokenize(":: BOOL ok;", settings);

        list.simplifyPlatformTypes();

        assertEquals("int ok ;", text(list));
    }
}
