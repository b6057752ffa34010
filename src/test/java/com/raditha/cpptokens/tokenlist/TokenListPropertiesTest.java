package com.raditha.cpptokens.tokenlist;

import com.raditha.cpptokens.config.Language;
import com.raditha.cpptokens.config.Settings;
import com.raditha.cpptokens.model.Token;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Random edit sequences must keep the list bounds and neighbour links consistent.
 */
class TokenListPropertiesTest {

    enum Edit { INSERT_AFTER, INSERT_BEFORE, DELETE_NEXT, DELETE_THIS }

    @Property(tries = 100)
    void boundsSurviveEdits(
            @ForAll @Size(min = 1, max = 10) List<@IntRange(min = 0, max = 9) Integer> values,
            @ForAll @Size(max = 30) List<@IntRange(min = 0, max = 50) Integer> positions,
            @ForAll @Size(max = 30) List<Edit> edits) {
        TokenList list = new TokenList(Settings.defaults(), Language.C);
        for (Integer value : values) {
            list.addtoken("t" + value, 1, 1, 0);
        }

        for (int i = 0; i < Math.min(edits.size(), positions.size()); i++) {
            int size = list.size();
            if (size == 0) {
                break;
            }
            Token tok = list.front().tokAt(positions.get(i) % size);
            switch (edits.get(i)) {
                case INSERT_AFTER -> tok.insertToken("a");
                case INSERT_BEFORE -> tok.insertTokenBefore("b");
                case DELETE_NEXT -> tok.deleteNext();
                case DELETE_THIS -> tok.deleteThis();
            }
            assertConsistent(list);
        }
    }

    private static void assertConsistent(TokenList list) {
        Token front = list.front();
        Token back = list.back();
        assertNotNull(front);
        assertNotNull(back);
        assertNull(front.previous(), "front must have no predecessor");
        assertNull(back.next(), "back must have no successor");

        Token last = null;
        for (Token tok = front; tok != null; tok = tok.next()) {
            assertSame(last, tok.previous(), "previous must mirror next");
            last = tok;
        }
        assertSame(back, last, "walking from front must end at back");
    }
}
