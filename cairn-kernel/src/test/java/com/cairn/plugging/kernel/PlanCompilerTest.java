package com.cairn.plugging.kernel;

import com.cairn.plugging.api.PlanningListener;
import com.cairn.plugging.api.model.EffectivePolicy;
import com.cairn.plugging.api.model.Fact;
import com.cairn.plugging.api.model.Plan;
import com.cairn.plugging.api.model.PlanOptions;
import com.cairn.plugging.api.model.PlanStep;
import com.cairn.plugging.api.model.Severity;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.api.model.ViolationCodes;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.cairn.plugging.kernel.KernelFixtures.cibpWell;
import static com.cairn.plugging.kernel.KernelFixtures.facts;
import static com.cairn.plugging.kernel.KernelFixtures.policy;
import static com.cairn.plugging.kernel.KernelFixtures.requirement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PlanCompilerTest {

    @Mock
    private PlanningListener listener;

    private PlanCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new PlanCompiler(OpenTelemetry.noop().getTracer("test"));
    }

    @Test
    @DisplayName("Exposed completion gets a CIBP 10 ft above the producing top with a 20 ft cap")
    void cibpScenario() {
        Plan plan = compiler.compile(cibpWell(), policy(requirement("cement_above_cibp_min_ft", 20)));

        PlanStep plug = plan.steps().get(0);
        PlanStep cap = plan.steps().get(1);
        assertThat(plug.type()).isEqualTo(StepType.BRIDGE_PLUG);
        assertThat(plug.stepId()).isEqualTo(1);
        assertThat(plug.topFt()).isEqualTo(6738.0);
        assertThat(plug.bottomFt()).isNull();
        assertThat(plug.details()).containsEntry("recommended_cibp_size_in", 4.528);

        assertThat(cap.type()).isEqualTo(StepType.BRIDGE_PLUG_CAP);
        assertThat(cap.topFt()).isEqualTo(6738.0);
        assertThat(cap.bottomFt()).isEqualTo(6758.0);
        assertThat(cap.cementClass()).isEqualTo("H");
        assertThat(cap.sacks()).isEqualTo(3);
        assertThat(cap.details()).doesNotContainKey("texas_25_sack_minimum_applied");

        assertThat(plan.rrcExport().get(0).type()).isEqualTo("CIBP");
        assertThat(plan.rrcExport().get(1).type()).isEqualTo("CIBP cap");
        assertThat(plan.stepsOfType(StepType.PRODUCTIVE_HORIZON_ISOLATION_PLUG)).isEmpty();
    }

    @Test
    @DisplayName("Shallowest of perforation and kick-off depths wins")
    void shallowestWins() {
        Plan kopShallower = compiler.compile(cibpWell("kop", Map.of("kop_md_ft", 6500)), policy());
        Plan kopDeeper = compiler.compile(cibpWell("kop", Map.of("kop_md_ft", 7200)), policy());

        PlanStep plug = kopShallower.stepsOfType(StepType.BRIDGE_PLUG).get(0);
        assertThat(plug.topFt()).isEqualTo(6450.0);
        assertThat(plug.details()).containsEntry("placement", "kop");
        assertThat(kopShallower.stepsOfType(StepType.BRIDGE_PLUG_CAP).get(0).topFt()).isEqualTo(6450.0);

        assertThat(kopDeeper.stepsOfType(StepType.BRIDGE_PLUG).get(0).topFt()).isEqualTo(6738.0);
    }

    @Test
    @DisplayName("No new CIBP when an existing CIBP already sits above the producing top")
    void existingCibpSuppressesNewPlug() {
        Plan plan = compiler.compile(cibpWell(
            "existing_mechanical_barriers", List.of("cibp"),
            "existing_cibp_ft", 6700), policy());

        assertThat(plan.stepsOfType(StepType.BRIDGE_PLUG)).isEmpty();
        List<PlanStep> caps = plan.stepsOfType(StepType.BRIDGE_PLUG_CAP);
        assertThat(caps).hasSize(1);
        assertThat(caps.get(0).topFt()).isEqualTo(6700.0);
        assertThat(caps.get(0).details()).containsEntry("existing_cibp", true);
        assertThat(plan.hasViolation(ViolationCodes.CIBP_CAP_SYNTHESIZED)).isTrue();
        assertThat(plan.notes()).anyMatch(note -> note.contains("Existing CIBP at 6700 ft"));
    }

    @Test
    @DisplayName("Unknown surface shoe degrades to a scaffold with an error violation")
    void missingSurfaceShoe() {
        Plan plan = compiler.compile(facts("api14", "42003012340000"), policy());

        assertThat(plan.hasViolation(ViolationCodes.SURFACE_SHOE_DEPTH_UNKNOWN)).isTrue();
        assertThat(plan.violations())
            .filteredOn(v -> v.ruleId().equals(ViolationCodes.SURFACE_SHOE_DEPTH_UNKNOWN))
            .allMatch(v -> v.severity() == Severity.ERROR);
        assertThat(plan.steps()).extracting(PlanStep::type).containsExactly(StepType.TOP_PLUG);
        assertThat(plan.steps().get(0).sacks()).isNull();
        assertThat(plan.hasViolation(ViolationCodes.MATERIALS_GEOMETRY_MISSING)).isTrue();
    }

    @Test
    @DisplayName("Incomplete policy still compiles and reports POLICY_INCOMPLETE first")
    void incompletePolicy() {
        EffectivePolicy complete = policy();
        EffectivePolicy incomplete = new EffectivePolicy(complete.policyId(), complete.version(), complete.jurisdiction(),
            complete.base(), complete.effective(), "08a", "Andrews", null, null, false,
            List.of("effective.requirements.tag_wait_hours [district:08a]"), complete.knobs());

        Plan plan = compiler.compile(cibpWell(), incomplete);

        assertThat(plan.policyComplete()).isFalse();
        assertThat(plan.violations().get(0).ruleId()).isEqualTo(ViolationCodes.POLICY_INCOMPLETE);
        assertThat(plan.violations().get(0).severity()).isEqualTo(Severity.ERROR);
        assertThat(plan.steps()).isNotEmpty();
    }

    @Test
    @DisplayName("Identical inputs serialize to byte-identical plans")
    void idempotent() throws Exception {
        Map<String, Fact> facts = cibpWell(
            "has_uqw", true,
            "uqw_base_ft", 350,
            "formation_tops_map", Map.of("San Andres", 4280),
            "annular_gaps", List.of(Map.of("top_ft", 3000, "bottom_ft", 3200,
                "requires_isolation", true, "cement_present", false)));
        EffectivePolicy resolved = KernelFixtures.resolved("08A", "Andrews", "Spraberry");
        ObjectMapper mapper = new ObjectMapper();

        String first = mapper.writeValueAsString(compiler.compile(facts, resolved));
        String second = mapper.writeValueAsString(new PlanCompiler(OpenTelemetry.noop().getTracer("other"))
            .compile(facts, resolved));

        assertThat(first).isEqualTo(second);
        assertThat(first).contains("\"field_resolution\"").contains("\"nearest_county\"");
    }

    @Test
    @DisplayName("Listener sees all four stages in order")
    void listenerStages() {
        compiler.setPlanningListener(listener);

        compiler.compile(cibpWell(), policy());

        InOrder order = inOrder(listener);
        order.verify(listener).onStageStart("GENERATION", 1, 4);
        order.verify(listener).onStageComplete(eq("GENERATION"), any());
        order.verify(listener).onStageStart("MATERIALS", 2, 4);
        order.verify(listener).onStageStart("MERGE", 3, 4);
        order.verify(listener).onStageStart("ASSEMBLY", 4, 4);
        ArgumentCaptor<PlanningListener.StageResult> results = ArgumentCaptor.forClass(PlanningListener.StageResult.class);
        verify(listener, times(4)).onStageComplete(any(), results.capture());
        assertThat(results.getAllValues().get(0).metrics()).containsKey("stepCount");
        verify(listener, never()).onError(any(), any());
        verify(listener, times(4)).onStageStart(any(), anyInt(), eq(4));
    }

    @Test
    @DisplayName("Merge option coalesces neighbouring formation-top plugs")
    void mergeOption() {
        Map<String, Object> overlay = Map.of("overrides", Map.of("formation_tops", List.of(
            Map.of("formation", "San Andres", "top_ft", 4300, "plug_required", true, "tag_required", true),
            Map.of("formation", "Glorieta", "top_ft", 4450, "plug_required", true, "tag_required", false))));
        EffectivePolicy policy = policy(overlay);

        Plan separate = compiler.compile(cibpWell(), policy);
        Plan merged = compiler.compile(cibpWell(), policy, PlanOptions.mergeWithin(60));

        assertThat(separate.stepsOfType(StepType.FORMATION_TOP_PLUG)).hasSize(2);
        List<PlanStep> plugs = merged.stepsOfType(StepType.FORMATION_TOP_PLUG);
        assertThat(plugs).hasSize(1);
        PlanStep plug = plugs.get(0);
        assertThat(plug.topFt()).isEqualTo(4250.0);
        assertThat(plug.bottomFt()).isEqualTo(4500.0);
        assertThat(plug.tagRequired()).isTrue();
        assertThat(plug.details()).containsEntry("merged", true);
        assertThat((List<?>) plug.details().get("merged_steps")).hasSize(2);
        assertThat(plug.cementClass()).isEqualTo("H");
        assertThat(plug.sacks()).isNotNull().isGreaterThanOrEqualTo(25);
        assertThat(plug.materials()).containsKey("total_bbl");
    }

    @Test
    @DisplayName("Plugs with pinned sacks survive long-plug merging with their sacks intact")
    void mergeKeepsOverrideSacks() {
        Map<String, Object> overlay = Map.of("steps_overrides", Map.of("cement_plugs", List.of(
            Map.of("top_ft", 3000, "bottom_ft", 3100, "sacks_override", 40),
            Map.of("top_ft", 3120, "bottom_ft", 3220, "sacks_override", 35))));
        EffectivePolicy policy = policy(overlay);

        Plan separate = compiler.compile(cibpWell(), policy);
        Plan merged = compiler.compile(cibpWell(), policy, new PlanOptions(true, 50.0, List.of("cement_plug")));

        assertThat(merged.stepsOfType(StepType.CEMENT_PLUG))
            .extracting(PlanStep::sacks)
            .containsExactlyInAnyOrder(40, 35);
        assertThat(merged.stepsOfType(StepType.CEMENT_PLUG))
            .allSatisfy(step -> assertThat(step.details()).containsEntry("materials_override", true));
        assertThat(merged.materialsTotals().totalSacks()).isEqualTo(separate.materialsTotals().totalSacks());
    }
}
