package com.cairn.plugging.kernel.merge;

import com.cairn.plugging.api.model.Step;
import com.cairn.plugging.api.model.StepType;
import com.cairn.plugging.kernel.materials.MaterialsApplicator;
import com.cairn.plugging.kernel.materials.SackFloor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MergePostProcessorTest {

    private final MergePostProcessor merger = new MergePostProcessor();

    private static Step top(String formation, double topFt, boolean tag, String cite) {
        return Step.interval(StepType.FORMATION_TOP_PLUG, topFt - 50, topFt + 50)
            .setFormation(formation)
            .setTagRequired(tag)
            .cite(cite);
    }

    @Test
    void mergesNeighboursWithinThreshold() {
        List<Step> steps = List.of(
            top("San Andres", 4300, true, "a"),
            top("Glorieta", 4450, false, "b"));

        List<Step> merged = merger.mergeAdjacent(steps, 60, Set.of(StepType.FORMATION_TOP_PLUG));

        assertThat(merged).hasSize(1);
        Step step = merged.get(0);
        assertThat(step.getTopFt()).isEqualTo(4250.0);
        assertThat(step.getBottomFt()).isEqualTo(4500.0);
        assertThat(step.getFormation()).isEqualTo("San Andres / Glorieta");
        assertThat(step.isTagRequired()).isTrue();
        assertThat(step.getRegulatoryBasis()).containsExactly("a", "b");
        assertThat(step.getDetails()).containsEntry(MergePostProcessor.MERGED, true);
        assertThat(step.getCementClass()).isNull();
        assertThat(step.getSacks()).isNull();
    }

    @Test
    void keepsStepsApartBeyondThreshold() {
        List<Step> steps = List.of(
            top("San Andres", 4300, true, "a"),
            top("Glorieta", 4450, false, "b"));

        List<Step> merged = merger.mergeAdjacent(steps, 40, Set.of(StepType.FORMATION_TOP_PLUG));

        assertThat(merged).hasSize(2);
        assertThat(merged).noneMatch(s -> s.hasDetailFlag(MergePostProcessor.MERGED));
    }

    @Test
    void ignoresIneligibleTypes() {
        Step cement = Step.interval(StepType.CEMENT_PLUG, 4350, 4400);
        List<Step> steps = List.of(top("San Andres", 4300, false, "a"), cement, top("Glorieta", 4450, false, "b"));

        List<Step> merged = merger.mergeAdjacent(steps, 60, Set.of(StepType.FORMATION_TOP_PLUG));

        assertThat(merged).hasSize(2).contains(cement);
    }

    @Test
    void flattensSourcesAcrossChainedMerges() {
        Step first = top("San Andres", 4300, false, "a");
        first.detail(SackFloor.APPLIED, true).detail(SackFloor.ORIGINAL, 12);
        List<Step> steps = List.of(first, top("Glorieta", 4450, false, "b"), top("Clear Fork", 4600, false, "c"));

        List<Step> once = merger.mergeAdjacent(steps.subList(0, 2), 60, Set.of(StepType.FORMATION_TOP_PLUG));
        List<Step> twice = merger.mergeAdjacent(List.of(once.get(0), steps.get(2)), 60, Set.of(StepType.FORMATION_TOP_PLUG));

        assertThat(twice).hasSize(1);
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> sources = (List<Map<String, Object>>) twice.get(0).getDetails().get(MergePostProcessor.MERGED_STEPS);
        assertThat(sources).extracting(source -> source.get("formation"))
            .containsExactly("San Andres", "Glorieta", "Clear Fork");
        assertThat(twice.get(0).getDetails()).doesNotContainKeys(SackFloor.APPLIED, SackFloor.ORIGINAL);
        assertThat(twice.get(0).getFormation()).isEqualTo("San Andres / Glorieta / Clear Fork");
    }

    @Test
    void leavesInputUntouched() {
        List<Step> steps = List.of(top("San Andres", 4300, false, "a"), top("Glorieta", 4450, false, "b"));

        merger.mergeAdjacent(steps, 60, Set.of(StepType.FORMATION_TOP_PLUG));

        assertThat(steps.get(0).getBottomFt()).isEqualTo(4350.0);
        assertThat(steps.get(0).getDetails()).doesNotContainKey(MergePostProcessor.MERGED);
    }

    @Test
    void measuresGapFromTheRunEnvelope() {
        Step longPlug = Step.interval(StepType.CEMENT_PLUG, 100, 400);
        Step inside = Step.interval(StepType.CEMENT_PLUG, 150, 200);
        Step below = Step.interval(StepType.CEMENT_PLUG, 420, 470);

        List<Step> merged = merger.mergeAdjacent(List.of(longPlug, inside, below), 30, Set.of(StepType.CEMENT_PLUG));

        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).getTopFt()).isEqualTo(100.0);
        assertThat(merged.get(0).getBottomFt()).isEqualTo(470.0);
        assertThat((List<?>) merged.get(0).getDetails().get(MergePostProcessor.MERGED_STEPS)).hasSize(3);
    }

    @Test
    void pinnedSacksAreNeverMerged() {
        Step first = Step.interval(StepType.CEMENT_PLUG, 3000, 3100).detail(MaterialsApplicator.MATERIALS_OVERRIDE, true);
        first.setSacks(40);
        Step second = Step.interval(StepType.CEMENT_PLUG, 3120, 3220).detail(MaterialsApplicator.MATERIALS_OVERRIDE, true);
        second.setSacks(35);

        List<Step> merged = merger.mergeAdjacent(List.of(first, second), 50, Set.of(StepType.CEMENT_PLUG));

        assertThat(merged).containsExactlyInAnyOrder(first, second);
        assertThat(merged).extracting(Step::getSacks).containsExactlyInAnyOrder(40, 35);
    }

    @Test
    void keepsOnlyDetailsSharedByEverySource() {
        Step upper = top("San Andres", 4300, true, "a")
            .detail("formation_top_ft", 4300.0)
            .detail("top_source", "well")
            .detail("special_instructions", List.of("Notify the district office"))
            .detail("verification", Map.of("action", "TAG", "required_wait_hr", 4.0));
        Step lower = top("Glorieta", 4450, false, "b")
            .detail("formation_top_ft", 4450.0)
            .detail("top_source", "district_anchor")
            .detail("special_instructions", List.of("Notify the district office"));

        Step merged = merger.mergeAdjacent(List.of(upper, lower), 60, Set.of(StepType.FORMATION_TOP_PLUG)).get(0);

        assertThat(merged.getDetails())
            .doesNotContainKeys("formation_top_ft", "top_source")
            .containsEntry("special_instructions", List.of("Notify the district office"))
            .containsEntry("verification", Map.of("action", "TAG", "required_wait_hr", 4.0));
    }
}
