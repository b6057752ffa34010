package com.raditha.cpptokens.hash;

import com.raditha.cpptokens.config.Language;
import com.raditha.cpptokens.config.Settings;
import com.raditha.cpptokens.tokenlist.TokenList;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenListHasherTest {

    private static TokenList tokenize(String code) {
        TokenList list = new TokenList(Settings.defaults(), Language.C);
        assertTrue(list.createTokens(new StringReader(code), "a.c"));
        return list;
    }

    @Test
    void testEqualListsHashEqual() {
        assertEquals(tokenize("int x = 1;").calculateHash(), tokenize("int x = 1;").calculateHash());
    }

    @Test
    void testValueChangesHash() {
        assertNotEquals(tokenize("int x = 1;").calculateHash(), tokenize("int x = 2;").calculateHash());
    }

    @Test
    void testOrderChangesHash() {
        assertNotEquals(tokenize("a b").calculateHash(), tokenize("b a").calculateHash());
    }

    @Test
    void testTypeFlagChangesHash() {
        TokenList plain = tokenize("long x;");
        TokenList flagged = tokenize("long x;");
        flagged.front().isUnsigned(true);

        assertNotEquals(plain.calculateHash(), flagged.calculateHash());
    }

    @Test
    void testLocationIgnored() {
        TokenList oneLine = tokenize("a = b;");
        TokenList spread = tokenize("\n\n  a\n=\n    b ;");

        assertEquals(oneLine.calculateHash(), spread.calculateHash());
    }

    @Test
    void testEmptyList() {
        TokenList list = new TokenList(Settings.defaults(), Language.C);

        assertEquals(TokenListHasher.hash(null), list.calculateHash());
    }

    @Property(tries = 100)
    void hashIsDeterministic(@ForAll @Size(min = 1, max = 20) List<@AlphaChars @StringLength(min = 1, max = 8) String> names) {
        String code = String.join(" ", names);

        assertEquals(tokenize(code).calculateHash(), tokenize(code).calculateHash());
    }
}
