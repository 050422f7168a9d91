package com.cairn.plugging.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DeepMergeTest {

    @Test
    @DisplayName("Nested maps merge recursively while scalars replace")
    void mergesNestedMaps() {
        Map<String, Object> base = Map.of("requirements", Map.of("a", 1, "b", 2));
        Map<String, Object> overlay = Map.of("requirements", Map.of("b", 3, "c", 4));

        Map<String, Object> merged = DeepMerge.merge(base, overlay);

        assertThat(merged).containsEntry("requirements", Map.of("a", 1, "b", 3, "c", 4));
    }

    @Test
    @DisplayName("Lists from the overlay replace lists in the base")
    void listsReplace() {
        Map<String, Object> base = Map.of("tops", List.of("San Andres", "Clear Fork"));
        Map<String, Object> overlay = Map.of("tops", List.of("Devonian"));

        assertThat(DeepMerge.merge(base, overlay)).containsEntry("tops", List.of("Devonian"));
    }

    @Test
    @DisplayName("Skipped keys are not merged and inputs stay untouched")
    void skipsKeysWithoutMutatingInputs() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("x", 1);
        Map<String, Object> base = new LinkedHashMap<>();
        base.put("section", inner);
        Map<String, Object> overlay = Map.of("section", Map.of("x", 2), "counties", Map.of("Andrews", Map.of()));

        Map<String, Object> merged = DeepMerge.merge(base, overlay, Set.of("counties"));

        assertThat(merged).doesNotContainKey("counties");
        assertThat(merged).containsEntry("section", Map.of("x", 2));
        assertThat(inner).containsEntry("x", 1);
    }

    @Test
    @DisplayName("A null overlay returns a copy of the base")
    void nullOverlay() {
        Map<String, Object> base = Map.of("k", "v");
        Map<String, Object> merged = DeepMerge.merge(base, null);

        assertThat(merged).isEqualTo(base).isNotSameAs(base);
    }
}
