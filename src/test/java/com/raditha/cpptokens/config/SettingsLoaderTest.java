package com.raditha.cpptokens.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SettingsLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadFromFile() throws IOException {
        Path config = tempDir.resolve("cpptokens.yml");
        Files.writeString(config, """
                cpptokens:
                  platform: win64
                  standards:
                    c: c99
                    cpp: c++11
                  relative_paths: true
                  base_paths:
                    - /src/project
                  cpp_header_probe: true
                """);

        Settings settings = SettingsLoader.load(config.toFile());

        assertEquals(Platform.win64(), settings.platform());
        assertEquals(Standards.CStandard.C99, settings.standards().c());
        assertEquals(Standards.CppStandard.CPP11, settings.standards().cpp());
        assertTrue(settings.relativePaths());
        assertEquals(List.of("/src/project"), settings.basePaths());
        assertTrue(settings.cppHeaderProbe());
        assertNotNull(settings.platformTypes().find("DWORD", Platform.WIN64), "Built-in aliases are kept");
    }

    @Test
    void testPlatformOverrides() {
        Settings settings = SettingsLoader.load(new StringReader("""
                cpptokens:
                  platform:
                    base: unix32
                    name: avr
                    sizeof_int: 2
                    sizeof_size_t: 2
                """));

        Platform platform = settings.platform();
        assertEquals("avr", platform.name());
        assertEquals(2, platform.sizeofInt());
        assertEquals(2, platform.sizeofSizeT());
        assertEquals(4, platform.sizeofLong(), "Unset sizes come from the base platform");
    }

    @Test
    void testPlatformTypes() {
        Settings settings = SettingsLoader.load(new StringReader("""
                cpptokens:
                  platform: unix32
                  platform_types:
                    - name: U64
                      value: long
                      unsigned: true
                      long_long: true
                      platforms: [unix32, unix64]
                    - name: PPCHAR
                      value: char
                      ptr_ptr: true
                      platforms: [unix32]
                """));

        PlatformType u64 = settings.platformTypes().find("U64", Platform.UNIX32);
        assertNotNull(u64);
        assertTrue(u64.unsigned());
        assertTrue(u64.longLong());
        assertNotNull(settings.platformTypes().find("U64", Platform.UNIX64));
        assertTrue(settings.platformTypes().find("PPCHAR", Platform.UNIX32).ptrPtr());
        assertNull(settings.platformTypes().find("PPCHAR", Platform.UNIX64));
    }

    @Test
    void testPlatformTypeWithoutValue() {
        StringReader reader = new StringReader("""
                cpptokens:
                  platform_types:
                    - name: X
                      platforms: [unix32]
                """);

        assertThrows(IllegalArgumentException.class, () -> SettingsLoader.load(reader));
    }

    @Test
    void testPlatformTypeWithoutPlatforms() {
        StringReader reader = new StringReader("""
                cpptokens:
                  platform_types:
                    - name: X
                      value: int
                """);

        assertThrows(IllegalArgumentException.class, () -> SettingsLoader.load(reader));
    }

    @Test
    void testInvalidYaml() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SettingsLoader.load(new StringReader("cpptokens: [unclosed")));
        assertTrue(e.getMessage().startsWith("Invalid YAML configuration"), e.getMessage());
    }

    @Test
    void testUnknownValues() {
        assertThrows(IllegalArgumentException.class,
                () -> SettingsLoader.load(new StringReader("cpptokens:\n  platform: vax\n")));
        assertThrows(IllegalArgumentException.class,
                () -> SettingsLoader.load(new StringReader("cpptokens:\n  standards:\n    cpp: c++42\n")));
    }

    @Test
    void testEmptyDocumentGivesDefaults() {
        for (String yaml : List.of("", "other: 1\n")) {
            Settings settings = SettingsLoader.load(new StringReader(yaml));
            assertEquals(Platform.nativePlatform(), settings.platform());
            assertEquals(Standards.defaults(), settings.standards());
            assertFalse(settings.relativePaths());
        }
    }

    @Test
    void testMissingFile() {
        File missing = tempDir.resolve("absent.yml").toFile();

        assertThrows(IOException.class, () -> SettingsLoader.load(missing));
    }

    @Test
    void testLoadDefaultResource() {
        Settings settings = SettingsLoader.loadDefault();

        assertEquals(Platform.UNIX64, settings.platform().name());
        assertEquals(Standards.CppStandard.CPP17, settings.standards().cpp());
    }
}
