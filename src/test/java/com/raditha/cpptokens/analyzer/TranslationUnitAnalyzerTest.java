package com.raditha.cpptokens.analyzer;

import com.raditha.cpptokens.config.Language;
import com.raditha.cpptokens.config.Platform;
import com.raditha.cpptokens.config.Settings;
import com.raditha.cpptokens.lexer.Lexer;
import com.raditha.cpptokens.lexer.LexerException;
import com.raditha.cpptokens.lexer.SimpleLexer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TranslationUnitAnalyzerTest {

    @TempDir
    Path tempDir;

    private TranslationUnitAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new TranslationUnitAnalyzer(Settings.defaults());
    }

    @Test
    void testAnalyzeOk() {
        UnitReport report = analyzer.analyze(new StringReader("int main() { size_t n = 1 + 2; return n; }"), "main.c");

        assertTrue(report.isOk());
        assertEquals("C", report.language());
        assertEquals(List.of("n 1 2 + =", "n return"), report.expressions());
        assertEquals(2, report.astRoots());
        assertNull(report.error());
        assertTrue(report.getSummary().startsWith("main.c: C, "), report.getSummary());
    }

    @Test
    void testNormalizationRunsBeforeHashing() {
        UnitReport sizeT = analyzer.analyze(new StringReader("size_t n;"), "a.c");
        UnitReport unsignedLong = analyzer.analyze(new StringReader("unsigned long n;"), "a.c");

        assertEquals(unsignedLong.tokenCount(), sizeT.tokenCount());
        assertEquals(unsignedLong.hash(), sizeT.hash(), "size_t is unsigned long on an LP64 platform");
    }

    @Test
    void testPlatformChangesResult() {
        TranslationUnitAnalyzer win64 = new TranslationUnitAnalyzer(
                Settings.defaults().withPlatform(Platform.win64()), Language.NONE, new SimpleLexer(), false);

        UnitReport lp64 = analyzer.analyze(new StringReader("size_t n;"), "a.c");
        UnitReport llp64 = win64.analyze(new StringReader("size_t n;"), "a.c");

        assertNotEquals(lp64.hash(), llp64.hash());
    }

    @Test
    void testUnbalancedBracketsFailUnit() {
        UnitReport report = analyzer.analyze(new StringReader("f ( a ;"), "bad.c");

        assertEquals(UnitReport.Status.AST_ERROR, report.status());
        assertFalse(report.isOk());
        assertTrue(report.error().contains("Unmatched"), report.error());
        assertTrue(report.getSummary().contains("AST_ERROR"));
    }

    @Test
    void testLexerFailure() throws LexerException {
        Lexer lexer = mock(Lexer.class);
        when(lexer.lex(any(), anyList(), anyString())).thenThrow(new LexerException("boom", "a.c", 1));
        TranslationUnitAnalyzer failing = new TranslationUnitAnalyzer(Settings.defaults(), Language.C, lexer, false);

        UnitReport report = failing.analyze(new StringReader("x;"), "a.c");

        assertEquals(UnitReport.Status.LEXER_ERROR, report.status());
        assertEquals(0, report.tokenCount());
    }

    @Test
    void testForcedLanguage() {
        TranslationUnitAnalyzer cpp = new TranslationUnitAnalyzer(Settings.defaults(), Language.CPP, new SimpleLexer(), false);

        assertEquals("CPP", cpp.analyze(new StringReader("x = 1;"), "a.c").language());
    }

    @Test
    void testAnalyzeFile() throws IOException {
        Path file = tempDir.resolve("unit.cpp");
        Files.writeString(file, "auto f = [](int a) { return a * 2; };\n");

        UnitReport report = analyzer.analyze(file);

        assertTrue(report.isOk(), report.getSummary());
        assertEquals("CPP", report.language());
        assertEquals(file.toString(), report.file());
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> analyzer.analyze(tempDir.resolve("absent.c")));
    }
}
