package com.cairn.plugging.kernel.materials;

import com.cairn.plugging.api.model.Fact;
import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.api.model.Violation;
import com.cairn.plugging.api.model.ViolationCodes;
import com.cairn.plugging.kernel.KernelFixtures;
import com.cairn.plugging.kernel.PlanningContext;
import com.cairn.plugging.kernel.generation.rules.AnnularGapSqueezeRule;
import com.cairn.plugging.materials.MaterialsEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.cairn.plugging.kernel.KernelFixtures.facts;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MaterialsApplicatorTest {

    private final MaterialsApplicator applicator = new MaterialsApplicator();

    private static PlanningContext context(Map<String, Fact> facts) {
        return new PlanningContext(facts, KernelFixtures.policy());
    }

    private static Map<String, Fact> casedWell() {
        return facts(
            "surface_shoe_ft", 500,
            "production_shoe_ft", 6815,
            "casing_id_in", 4.778,
            "stinger_od_in", 2.375);
    }

    @Nested
    @DisplayName("Minimum sack floor")
    class Floor {

        @Test
        void shallowShoePlugIsRaisedToTwentyFive() {
            Step shoe = Step.interval(StepType.SURFACE_CASING_SHOE_PLUG, 450, 550);
            shoe.setCementClass("C");

            applicator.apply(context(casedWell()), List.of(shoe));

            assertThat(shoe.getSacks()).isEqualTo(25);
            assertThat(shoe.getDetails())
                .containsEntry(SackFloor.APPLIED, true)
                .containsEntry(SackFloor.ORIGINAL, 8);
            assertThat((Double) shoe.getMaterials().get("total_bbl")).isCloseTo(1.865, within(0.01));
        }

        @Test
        void pinnedSacksAreLeftAlone() {
            Step plug = Step.interval(StepType.CEMENT_PLUG, 3000, 3100)
                .detail(MaterialsApplicator.MATERIALS_OVERRIDE, true);
            plug.setSacks(10);

            int computed = applicator.apply(context(casedWell()), List.of(plug));

            assertThat(computed).isZero();
            assertThat(plug.getSacks()).isEqualTo(10);
            assertThat(plug.getDetails()).doesNotContainKey(SackFloor.APPLIED);
            assertThat(plug.getMaterials()).isEmpty();
        }

        @Test
        void cibpCapIsExempt() {
            Step cap = Step.interval(StepType.BRIDGE_PLUG_CAP, 6738, 6758);
            cap.setCementClass("H");

            applicator.apply(context(casedWell()), List.of(cap));

            assertThat(cap.getSacks()).isEqualTo(3);
            assertThat(cap.getDetails()).doesNotContainKey(SackFloor.APPLIED);
        }
    }

    @Nested
    @DisplayName("Squeeze geometry")
    class Squeeze {

        private Step squeeze(PlanningContext context) {
            List<Step> steps = new AnnularGapSqueezeRule().apply(context, new ArrayList<>());
            assertThat(steps).hasSize(1);
            Step step = steps.get(0);
            step.setCementClass("H");
            return step;
        }

        @Test
        @DisplayName("Below the shoe without a hole size the hole is estimated at casing OD plus 2 in")
        void openHoleEstimated() {
            PlanningContext context = context(facts(
                "production_shoe_ft", 5000,
                "casing_od_in", 5.5,
                "annular_gaps", List.of(Map.of("top_ft", 5200, "bottom_ft", 5400,
                    "requires_isolation", true, "cement_present", false))));
            Step step = squeeze(context);

            applicator.apply(context, List.of(step));

            assertThat(step.getTopFt()).isEqualTo(5200.0);
            assertThat(step.getBottomFt()).isEqualTo(5350.0);
            assertThat(step.getDetails())
                .containsEntry(AnnularGapSqueezeRule.PERFORATION_INTERVAL, List.of(5250.0, 5350.0))
                .containsEntry(AnnularGapSqueezeRule.CAP_INTERVAL, List.of(5200.0, 5250.0));
            @SuppressWarnings("unchecked")
            Map<String, Object> geometry = (Map<String, Object>) step.getDetails().get(MaterialsApplicator.GEOMETRY_FOR_SQUEEZE);
            assertThat(geometry)
                .containsEntry("context", "open_hole_estimated")
                .containsEntry("outer_diameter_in", 7.5)
                .containsEntry("inner_diameter_in", 5.5)
                .containsEntry("squeeze_factor", 2.0);
            assertThat((Double) step.getMaterials().get("squeeze_bbl")).isCloseTo(3.967, within(0.01));
            assertThat((Double) step.getMaterials().get("cap_bbl")).isCloseTo(1.389, within(0.01));
            assertThat(step.getSacks()).isEqualTo(26);
            assertThat(step.getDetails()).doesNotContainKey(SackFloor.APPLIED);
        }

        @Test
        @DisplayName("A liner below the shoe makes the squeeze cased")
        void linerMakesItCased() {
            PlanningContext context = context(facts(
                "production_shoe_ft", 5000,
                "casing_id_in", 4.778,
                "stinger_od_in", 2.375,
                "liner_intervals", List.of(List.of(4900, 5600)),
                "annular_gaps", List.of(Map.of("top_ft", 5200, "bottom_ft", 5400,
                    "requires_isolation", true, "cement_present", false))));
            Step step = squeeze(context);

            applicator.apply(context, List.of(step));

            assertThat(step.getDetails()).containsEntry(AnnularGapSqueezeRule.SQUEEZE_CONTEXT, "cased");
            @SuppressWarnings("unchecked")
            Map<String, Object> geometry = (Map<String, Object>) step.getDetails().get(MaterialsApplicator.GEOMETRY_FOR_SQUEEZE);
            assertThat(geometry).containsEntry("squeeze_factor", 1.5).containsEntry("context", "cased");
            assertThat((Double) step.getMaterials().get("total_bbl")).isCloseTo(2.885, within(0.01));
            assertThat(step.getSacks()).isEqualTo(25);
            assertThat(step.getDetails()).containsEntry(SackFloor.ORIGINAL, 14);
        }
    }

    @Test
    @DisplayName("Unknown geometry leaves sacks empty and warns")
    void missingGeometry() {
        PlanningContext context = context(facts("surface_shoe_ft", 500));
        Step top = Step.interval(StepType.TOP_PLUG, 0, 10);
        top.setCementClass("C");

        int computed = applicator.apply(context, List.of(top));

        assertThat(computed).isZero();
        assertThat(top.getSacks()).isNull();
        assertThat(top.getMaterials()).containsKey("missing");
        assertThat(context.violations())
            .extracting(Violation::ruleId)
            .containsExactly(ViolationCodes.MATERIALS_GEOMETRY_MISSING);
    }

    @Test
    void engineIsBuiltForThePolicyExcess() {
        AtomicReference<Double> excess = new AtomicReference<>();
        MaterialsApplicator custom = new MaterialsApplicator(value -> {
            excess.set(value);
            return new MaterialsEngine(value);
        });
        Step plug = Step.point(StepType.BRIDGE_PLUG, 6738);

        int computed = custom.apply(context(casedWell()), List.of(plug));

        assertThat(excess.get()).isEqualTo(0.4);
        assertThat(computed).isZero();
        assertThat(plug.getSacks()).isNull();
        assertThat(plug.getMaterials()).isEmpty();
    }
}
