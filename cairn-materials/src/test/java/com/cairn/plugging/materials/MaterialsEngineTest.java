package com.cairn.plugging.materials;

import com.cairn.plugging.api.model.DepthInterval;
import com.cairn.plugging.api.model.Geometry;
import com.cairn.plugging.api.model.MaterialsResult;
import com.cairn.plugging.api.model.SlurryRecipe;
import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MaterialsEngineTest {

    private static final SlurryRecipe CLASS_C = new SlurryRecipe("class_c_test", "C", 14.8, 1.19, 6.3);
    private static final SlurryRecipe CLASS_H = new SlurryRecipe("class_h_neat_15_8", "H", 15.8, 1.18, 5.2);

    private MaterialsEngine engine;

    @BeforeEach
    void setUp() {
        engine = new MaterialsEngine(0.4);
    }

    @Test
    @DisplayName("100 ft cased squeeze with 50 ft cap yields 3.75 + 1.75 bbl and 26 sacks")
    void casedSqueezeScenario() {
        MaterialsResult result = engine.compound(100, 50, 0.025, SqueezeFactors.CASED, CLASS_C);

        assertThat(result.squeezeBbl()).isCloseTo(3.75, within(1e-9));
        assertThat(result.capBbl()).isCloseTo(1.75, within(1e-9));
        assertThat(result.totalBbl()).isCloseTo(5.5, within(1e-9));
        assertThat(result.sacks()).isEqualTo(26);
    }

    @Test
    @DisplayName("Sacks always round up and cover the requested volume")
    void sackRoundingCoversVolume() {
        double[] yields = {1.06, 1.18, 1.19, 1.32, 1.5};
        for (double yield : yields) {
            for (int i = 1; i <= 400; i++) {
                double totalBbl = i * 0.137;
                int sacks = MaterialsEngine.sacksFor(totalBbl, yield);
                assertThat(sacks).isEqualTo((int) Math.ceil(totalBbl * 5.615 / yield - 1e-9));
                assertThat(sacks * yield / 5.615).isGreaterThanOrEqualTo(totalBbl - 1e-9);
                assertThat((sacks - 1) * yield / 5.615).isLessThan(totalBbl);
            }
        }
    }

    @Test
    @DisplayName("Zero volume needs no sacks")
    void zeroVolume() {
        assertThat(MaterialsEngine.sacksFor(0.0, 1.18)).isZero();
    }

    @Test
    @DisplayName("Annular capacity follows pi/4 * (Do^2 - Di^2) / 1029.4")
    void annularCapacity() {
        assertThat(Capacities.annularBblPerFt(4.778, 2.375)).isCloseTo(0.0131144, within(1e-6));
        assertThatThrownBy(() -> Capacities.annularBblPerFt(2.0, 2.375))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Squeeze factor is 2.0 only below the production shoe and outside liners")
    void squeezeFactorRule() {
        List<DepthInterval> noLiners = List.of();
        List<DepthInterval> liner = List.of(new DepthInterval(6700, 7200));

        assertThat(SqueezeFactors.forPerforation(6900, 6815.0, noLiners)).isEqualTo(2.0);
        assertThat(SqueezeFactors.forPerforation(6900, 6815.0, liner)).isEqualTo(1.5);
        assertThat(SqueezeFactors.forPerforation(6815, 6815.0, noLiners)).isEqualTo(1.5);
        assertThat(SqueezeFactors.forPerforation(5000, 6815.0, noLiners)).isEqualTo(1.5);
        assertThat(SqueezeFactors.forPerforation(9000, null, noLiners)).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Depth scaling multiplies the excess fraction, not the volume")
    void depthScaledExcess() {
        MaterialsResult result = engine.plug(100, 5000, 0.02, CLASS_H);

        assertThat(DepthExcess.scaled(0.4, 5000)).isCloseTo(0.6, within(1e-12));
        assertThat(result.totalBbl()).isCloseTo(3.2, within(1e-9));
        assertThat(result.sacks()).isEqualTo(16);
        assertThat(result.waterBbl()).isCloseTo(16 * 5.2 / 42.0, within(0.01));
    }

    @Test
    @DisplayName("Squeeze steps read perforation and cap intervals from details")
    void squeezeStepUsesDetails() {
        Step step = Step.interval(StepType.PERFORATE_AND_SQUEEZE_PLUG, 4950, 5100)
            .detail("perforation_interval", Map.of("top_ft", 5000.0, "bottom_ft", 5100.0))
            .detail("cement_cap_inside_casing", Map.of("top_ft", 4950.0, "bottom_ft", 5000.0));
        Geometry geometry = Geometry.cased(4.778, 2.375).withSqueezeFactor(SqueezeFactors.CASED);

        MaterialsResult result = engine.computeSacks(step, geometry, CLASS_C);

        double capacity = Capacities.annularBblPerFt(4.778, 2.375);
        assertThat(result.squeezeBbl()).isCloseTo(100 * capacity * 1.5, within(1e-3));
        assertThat(result.capBbl()).isCloseTo(50 * capacity * 1.4, within(1e-3));
        assertThat(result.isComputed()).isTrue();
    }

    @Test
    @DisplayName("Missing stinger OD yields null sacks instead of a guess")
    void missingGeometryYieldsNullSacks() {
        Step step = Step.interval(StepType.CEMENT_PLUG, 3000, 3100);

        MaterialsResult result = engine.computeSacks(step, Geometry.cased(4.778, null), CLASS_C);

        assertThat(result.sacks()).isNull();
        assertThat(result.explain()).containsEntry("missing", "stinger_od_in");
    }

    @Test
    @DisplayName("Open-hole plug without a hole size reports the hole size as missing")
    void missingHoleSize() {
        Step step = Step.interval(StepType.CEMENT_PLUG, 7000, 7100);
        Geometry geometry = new Geometry(null, 2.375, Geometry.OPEN_HOLE, null);

        MaterialsResult result = engine.computeSacks(step, geometry, CLASS_C);

        assertThat(result.sacks()).isNull();
        assertThat(result.explain()).containsEntry("missing", "hole_size_in");
    }

    @Test
    @DisplayName("Negative excess is rejected")
    void rejectsNegativeExcess() {
        assertThatThrownBy(() -> new MaterialsEngine(-0.1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
