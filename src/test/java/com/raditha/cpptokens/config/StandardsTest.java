package com.raditha.cpptokens.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StandardsTest {

    @Test
    void testCStandardNames() {
        assertEquals(Standards.CStandard.C89, Standards.CStandard.fromString("ansi"));
        assertEquals(Standards.CStandard.C99, Standards.CStandard.fromString("gnu99"));
        assertEquals(Standards.CStandard.C17, Standards.CStandard.fromString(" C18 "));
        assertThrows(IllegalArgumentException.class, () -> Standards.CStandard.fromString("c++11"));
    }

    @Test
    void testCppStandardNames() {
        assertEquals(Standards.CppStandard.CPP03, Standards.CppStandard.fromString("c++98"));
        assertEquals(Standards.CppStandard.CPP11, Standards.CppStandard.fromString("cpp11"));
        assertEquals(Standards.CppStandard.CPP17, Standards.CppStandard.fromString("gnu++17"));
        assertEquals(Standards.CppStandard.CPP20, Standards.CppStandard.fromString("c++2a"));
        assertThrows(IllegalArgumentException.class, () -> Standards.CppStandard.fromString("c99"));
    }

    @Test
    void testAtLeast() {
        assertTrue(Standards.CppStandard.CPP17.atLeast(Standards.CppStandard.CPP11));
        assertTrue(Standards.CppStandard.CPP11.atLeast(Standards.CppStandard.CPP11));
        assertFalse(Standards.CppStandard.CPP03.atLeast(Standards.CppStandard.CPP11));
    }

    @Test
    void testPlatformLookup() {
        assertEquals(Platform.win32A(), Platform.fromName("win32"));
        assertEquals(Platform.win32W(), Platform.fromName("WIN32W"));
        assertTrue(Platform.win64().isWindows());
        assertFalse(Platform.unix64().isWindows());
        assertThrows(IllegalArgumentException.class, () -> Platform.fromName("vax"));
    }
}
