package com.github.salilvnair.advisorengine.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.github.salilvnair.advisorengine.model.SourceRef;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonUtilTest {

    @Test
    void parseOrNullReturnsNullNodeForInvalidJson() {
        assertEquals(NullNode.getInstance(), JsonUtil.parseOrNull("{bad json"));
        assertEquals(NullNode.getInstance(), JsonUtil.parseOrNull("   "));
        assertEquals(NullNode.getInstance(), JsonUtil.parseOrNull(null));
    }

    @Test
    void textOrNullIgnoresBlankAndNonTextualValues() {
        JsonNode node = JsonUtil.parseOrNull("{\"a\":\"x\",\"b\":\"  \",\"c\":12}");

        assertEquals("x", JsonUtil.textOrNull(node, "a"));
        assertNull(JsonUtil.textOrNull(node, "b"));
        assertNull(JsonUtil.textOrNull(node, "c"));
        assertNull(JsonUtil.textOrNull(node, "missing"));
        assertNull(JsonUtil.textOrNull(null, "a"));
    }

    @Test
    void textListKeepsOnlyNonBlankStrings() {
        JsonNode node = JsonUtil.parseOrNull("[\"one\", 2, \"\", null, \"two\", {}]");

        assertEquals(List.of("one", "two"), JsonUtil.textList(node));
        assertEquals(List.of(), JsonUtil.textList(JsonUtil.parseOrNull("\"one\"")));
        assertEquals(List.of(), JsonUtil.textList(null));
    }

    @Test
    void toJsonSortsMapKeysAndUsesWireNames() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("b", 1);
        map.put("a", 2);

        assertEquals("{\"a\":2,\"b\":1}", JsonUtil.toJson(map));
        assertEquals("{\"canonical_id\":\"BG_2_47\",\"paraphrase\":\"p\",\"relevance\":0.5}",
                JsonUtil.toJson(new SourceRef("BG_2_47", "p", 0.5)));
    }

    @Test
    void fromJsonWrapsFailures() {
        assertEquals(new SourceRef("BG_2_47", "p", 0.5),
                JsonUtil.fromJson("{\"canonical_id\":\"BG_2_47\",\"paraphrase\":\"p\",\"relevance\":0.5}", SourceRef.class));
        assertThrows(IllegalStateException.class, () -> JsonUtil.fromJson("{nope", SourceRef.class));
    }

    @Test
    void truncateCutsAtLimit() {
        assertEquals("abc", JsonUtil.truncate("abcdef", 3));
        assertEquals("ab", JsonUtil.truncate("ab", 3));
        assertNull(JsonUtil.truncate(null, 3));
    }
}
