package com.cairn.plugging.policy.store;

import com.cairn.plugging.api.exceptions.PolicyLoadException;
import com.cairn.plugging.api.model.PolicyBundle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyBundleLoaderTest {

    @TempDir
    Path root;

    private PolicyBundleLoader loader;

    @BeforeEach
    void setUp() throws IOException {
        loader = new PolicyBundleLoader();
        Files.createDirectories(root.resolve(PolicyBundleLoader.OVERLAY_DIR));
        Files.writeString(root.resolve("demo.yaml"), """
            policy_id: demo
            version: "3"
            jurisdiction: TX
            base:
              requirements:
                casing_shoe_coverage_ft: 50
            district_overlays:
              "8":
                requirements:
                  tag_wait_hours: 4
            """);
    }

    @Test
    @DisplayName("Overlay files are keyed by normalized district and county")
    void loadsOverlays() throws IOException {
        Files.writeString(root.resolve("district_overlays/8A__auto.yml"), "requirements:\n  duqw_coverage_ft: 50\n");
        Files.writeString(root.resolve("district_overlays/08a__Tom_Green.yml"), "overrides: {}\n");
        Files.writeString(root.resolve(PolicyBundleLoader.CENTROIDS_FILE),
            "[{\"county\": \"Tom Green\", \"latitude\": 31.4, \"longitude\": -100.46}]");

        PolicyBundle bundle = loader.load(root, "demo");

        assertThat(bundle.policyId()).isEqualTo("demo");
        assertThat(bundle.version()).isEqualTo("3");
        assertThat(bundle.pack().districtOverlays()).containsKey("08a");
        assertThat(bundle.districtFiles()).containsOnlyKeys("08a");
        assertThat(bundle.countyFiles()).containsOnlyKeys("08a__tom_green");
        assertThat(bundle.centroids()).hasSize(1);
    }

    @Test
    @DisplayName("A missing centroid table loads with an empty list")
    void missingCentroids() {
        PolicyBundle bundle = loader.load(root, "demo");

        assertThat(bundle.centroids()).isEmpty();
        assertThat(bundle.districtFiles()).isEmpty();
    }

    @Test
    @DisplayName("Malformed overlay YAML fails the whole load")
    void malformedOverlay() throws IOException {
        Files.writeString(root.resolve("district_overlays/08a__auto.yml"), "requirements: [unclosed\n");

        assertThatThrownBy(() -> loader.load(root, "demo"))
            .isInstanceOf(PolicyLoadException.class)
            .hasMessageContaining("Malformed policy file");
    }

    @Test
    @DisplayName("A missing base pack is reported by path")
    void missingBasePack() {
        assertThatThrownBy(() -> loader.load(root, "absent"))
            .isInstanceOf(PolicyLoadException.class)
            .hasMessageContaining("absent.yaml");
    }

    @Test
    @DisplayName("Version can be read without loading overlays")
    void peekVersion() throws IOException {
        Files.writeString(root.resolve("district_overlays/08a__auto.yml"), "requirements: [unclosed\n");

        assertThat(loader.peekVersion(root, "demo")).isEqualTo("3");
        assertThat(PolicyStores.directory(root, "demo").currentVersion()).isEqualTo("3");
    }
}
