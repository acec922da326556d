package com.facthistory.reconstruction;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MapOverlayTest {

    @Test
    void overlayValuesWin_andOtherBaseKeysSurvive() {
        Map<String, Integer> merged = MapOverlay.mergeInto(
            Map.of("a", 1, "b", 2),
            Map.of("b", 20, "c", 30));

        assertEquals(Map.of("a", 1, "b", 20, "c", 30), merged);
    }

    @Test
    void argumentsAreNotMutated() {
        Map<String, Integer> base = new HashMap<>(Map.of("a", 1));
        Map<String, Integer> overlay = new HashMap<>(Map.of("a", 2, "b", 3));

        MapOverlay.mergeInto(base, overlay);

        assertEquals(Map.of("a", 1), base);
        assertEquals(Map.of("a", 2, "b", 3), overlay);
    }

    @Test
    void emptyOverlay_copiesBase() {
        Map<String, Integer> base = Map.of("a", 1);
        Map<String, Integer> merged = MapOverlay.mergeInto(base, Map.of());

        assertEquals(base, merged);
        assertNotSame(base, merged);
    }

    @Test
    void withoutKeys_dropsOnlyTheNamedKeys() {
        assertEquals(Map.of("b", 2),
            MapOverlay.withoutKeys(Map.of("a", 1, "b", 2), List.of("a", "missing")));
    }
}
