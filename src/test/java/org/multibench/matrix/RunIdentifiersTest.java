package org.multibench.matrix;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RunIdentifiersTest {
    @Test
    void encodesBenchAxisValuesAndRerun() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("nodes", "2");
        values.put("size", "1024");

        assertEquals("bench__nodes=2,size=1024__r3", RunIdentifiers.of("bench", values, 3));
        assertEquals("bench__base__r0", RunIdentifiers.of("bench", Map.of(), 0));
    }

    @Test
    void unsafeCharactersAreReplacedAndDisambiguated() {
        String slashed = RunIdentifiers.of("b", Map.of("input", "data/a b"), 0);
        String underscored = RunIdentifiers.of("b", Map.of("input", "data_a_b"), 0);

        assertTrue(slashed.startsWith("b__input=data_a_b~"), slashed);
        assertTrue(slashed.endsWith("__r0"), slashed);
        assertTrue(!slashed.contains("/") && !slashed.contains(" "), slashed);
        assertEquals("b__input=data_a_b__r0", underscored);
        assertNotEquals(slashed, underscored);
    }

    @Test
    void valuesThatSanitizeAlikeStayDistinct() {
        String first = RunIdentifiers.of("b", Map.of("path", "a/b"), 0);
        String second = RunIdentifiers.of("b", Map.of("path", "a:b"), 0);

        assertNotEquals(first, second);
        assertEquals(first, RunIdentifiers.of("b", Map.of("path", "a/b"), 0));
    }

    @Test
    void rerunsShareTheGroupSegment() {
        Map<String, String> values = Map.of("threads", "8");

        String segment = RunIdentifiers.groupSegment("b", values);

        assertEquals(segment + "__r0", RunIdentifiers.of("b", values, 0));
        assertEquals(segment + "__r1", RunIdentifiers.of("b", values, 1));
    }

    @Test
    void negativeRerunIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> RunIdentifiers.of("b", Map.of(), -1));
    }
}
