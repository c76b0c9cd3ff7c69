package com.vidnyan.slate.domain.rule;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleParametersTest {

    @Test
    void constructor_ShouldDropNullValues() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("max", 80);
        raw.put("unset", null);

        RuleParameters params = new RuleParameters(raw);

        assertEquals(80, params.getInt("max", 0));
        assertTrue(params.get("unset").isEmpty());
    }

    @Test
    void getInt_ShouldAcceptNumbersAndNumericStrings() {
        RuleParameters params = new RuleParameters(Map.of("a", 4L, "b", " 12 ", "c", "twelve"));

        assertEquals(4, params.getInt("a", 0));
        assertEquals(12, params.getInt("b", 0));
        assertEquals(7, params.getInt("missing", 7));
        assertThrows(InvalidConfigurationException.class, () -> params.getInt("c", 0));
    }

    @Test
    void getInt_ShouldRejectFractionalAndOutOfRangeNumbers() {
        RuleParameters params = new RuleParameters(Map.of("half", 1.5, "huge", 3_000_000_000L, "whole", 2.0));

        assertThrows(InvalidConfigurationException.class, () -> params.getInt("half", 0));
        assertThrows(InvalidConfigurationException.class, () -> params.getInt("huge", 0));
        assertEquals(2, params.getInt("whole", 0));
    }

    @Test
    void getBooleanAndGetString_ShouldFallBackToDefaults() {
        RuleParameters params = new RuleParameters(Map.of("strict", "true", "style", "camel"));

        assertTrue(params.getBoolean("strict", false));
        assertTrue(params.getBoolean("missing", true));
        assertEquals("camel", params.getString("style", "snake"));
        assertEquals("snake", params.getString("missing", "snake"));
        assertSame(RuleParameters.empty(), RuleParameters.empty());
    }
}
