package com.raditha.cpptokens.tokenlist;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileRegistryTest {

    @Test
    void testAppendIfNew() {
        FileRegistry registry = new FileRegistry();

        assertEquals(0, registry.appendIfNew("a.c"));
        assertEquals(1, registry.appendIfNew("b.h"));
        assertEquals(0, registry.appendIfNew("a.c"));
        assertEquals(2, registry.size());
        assertEquals("b.h", registry.get(1));
    }

    @Test
    void testInvalidIndex() {
        FileRegistry registry = new FileRegistry();
        registry.appendIfNew("a.c");

        assertFalse(registry.isValidIndex(1));
        assertThrows(IndexOutOfBoundsException.class, () -> registry.get(1));
        assertThrows(IndexOutOfBoundsException.class, () -> registry.get(-1));
    }

    @Test
    void testOriginalNames() {
        FileRegistry registry = new FileRegistry();
        registry.reset(List.of("/src/a.c", "/src/b.h"));

        registry.rename(path -> path.substring(5));

        assertEquals("a.c", registry.get(0));
        assertEquals("/src/a.c", registry.getOriginal(0));

        registry.snapshotOriginals();
        assertEquals("a.c", registry.getOriginal(0));
    }

    @Test
    void testOriginalFallsBackToCurrentName() {
        FileRegistry registry = new FileRegistry();
        registry.appendIfNew("a.c");

        assertEquals("a.c", registry.getOriginal(0));
        assertTrue(registry.originalFiles().isEmpty());
    }

    @Test
    void testCopyFromAndClear() {
        FileRegistry source = new FileRegistry();
        source.reset(List.of("a.c"));
        FileRegistry copy = new FileRegistry();

        copy.copyFrom(source);
        source.clear();

        assertTrue(source.isEmpty());
        assertEquals(List.of("a.c"), copy.files());
        assertEquals(List.of("a.c"), copy.originalFiles());
    }

    @Property(tries = 100)
    void appendIsIdempotent(@ForAll @Size(min = 1, max = 20) List<@AlphaChars @StringLength(min = 1, max = 8) String> names) {
        FileRegistry registry = new FileRegistry();
        for (String name : names) {
            registry.appendIfNew(name);
        }
        int size = registry.size();

        for (String name : names) {
            int index = registry.appendIfNew(name);
            assertEquals(name, registry.get(index), "Index must resolve to the same name");
        }
        assertEquals(size, registry.size(), "Re-registering known files must not grow the table");
        assertEquals(names.stream().distinct().count(), size);
    }
}
