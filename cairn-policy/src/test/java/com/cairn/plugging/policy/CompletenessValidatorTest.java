package com.cairn.plugging.policy;

import com.cairn.plugging.api.model.EffectivePolicy;
import com.cairn.plugging.api.model.PolicyBundle;
import com.cairn.plugging.policy.store.PolicyStores;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CompletenessValidatorTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("Missing knobs are reported per scope with the district suffix")
    void reportsMissingKnobs() {
        Map<String, Object> base = Map.of(
            "citations", Map.of(),
            "requirements", Map.of("casing_shoe_coverage_ft", 50, "duqw_coverage_ft", 50),
            "cement_class", Map.of("cutoff_ft", 4000, "shallow_class", "C", "deep_class", "H"));
        Map<String, Object> effective = Map.of("requirements", Map.of("tag_wait_hours", Map.of("value", 4)));

        assertThat(CompletenessValidator.validate(base, effective, "08a")).containsExactly(
            "base.requirements.tag_wait_hours",
            "effective.citations [district:08a]",
            "effective.cement_class [district:08a]",
            "effective.requirements.casing_shoe_coverage_ft [district:08a]",
            "effective.requirements.duqw_coverage_ft [district:08a]",
            "effective.cement_class.cutoff_ft [district:08a]",
            "effective.cement_class.shallow_class [district:08a]",
            "effective.cement_class.deep_class [district:08a]");
    }

    @Test
    @DisplayName("Effective scope is skipped when no district resolved")
    void baseOnlyWithoutDistrict() {
        assertThat(CompletenessValidator.validate(Map.of(), Map.of(), null))
            .allMatch(reason -> reason.startsWith("base."))
            .hasSize(9);
    }

    @Test
    @DisplayName("Field overlay beats county overlay and a district can null out a required knob")
    void precedenceAndCompletion() throws IOException {
        Files.createDirectories(root.resolve("district_overlays"));
        Files.writeString(root.resolve("p.yaml"), """
            policy_id: p
            version: "1"
            base:
              citations: {shoe: "cite-shoe"}
              requirements:
                casing_shoe_coverage_ft: {value: 50, citation_keys: [shoe]}
                duqw_coverage_ft: 50
                tag_wait_hours: 4
              cement_class: {cutoff_ft: 4000, shallow_class: C, deep_class: H}
            """);
        Files.writeString(root.resolve("district_overlays/09a__auto.yml"), """
            requirements:
              tag_wait_hours: 8
            counties:
              Archer County:
                requirements:
                  casing_shoe_coverage_ft: 70
                fields:
                  Archer:
                    requirements:
                      casing_shoe_coverage_ft: 90
            """);
        Files.writeString(root.resolve("district_overlays/10a__auto.yml"), """
            cement_class:
              deep_class: null
            """);
        PolicyResolver resolver = new PolicyResolver(OpenTelemetry.noop().getTracer("test"));
        PolicyBundle bundle = PolicyStores.directory(root, "p").load();

        EffectivePolicy county = resolver.resolve(bundle, "9", "Archer", null);
        EffectivePolicy field = resolver.resolve(bundle, "9", "Archer", "Archer");
        EffectivePolicy otherDistrict = resolver.resolve(bundle, "10", "Archer", null);

        assertThat(county.knobs().casingShoeCoverageFt()).isEqualTo(70.0);
        assertThat(field.knobs().casingShoeCoverageFt()).isEqualTo(90.0);
        assertThat(county.complete()).isTrue();
        assertThat(otherDistrict.complete()).isFalse();
        assertThat(county.knobs().tagWaitHours()).isEqualTo(8.0);
        assertThat(otherDistrict.incompleteReasons()).containsExactly(
            "effective.cement_class.deep_class [district:10a]");
    }
}
