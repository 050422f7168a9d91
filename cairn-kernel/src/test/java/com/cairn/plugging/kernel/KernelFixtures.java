package com.cairn.plugging.kernel;

import com.cairn.plugging.api.model.EffectivePolicy;
import com.cairn.plugging.api.model.Fact;
import com.cairn.plugging.api.model.PolicyBundle;
import com.cairn.plugging.policy.DeepMerge;
import com.cairn.plugging.policy.KnobReader;
import com.cairn.plugging.policy.PolicyResolver;
import com.cairn.plugging.policy.store.PolicyStores;
import io.opentelemetry.api.OpenTelemetry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared facts and policies for kernel tests.
 */
public final class KernelFixtures {

    private static PolicyBundle bundle;

    private KernelFixtures() {
    }

    public static synchronized PolicyBundle bundle() {
        if (bundle == null) {
            bundle = PolicyStores.bundled().load();
        }
        return bundle;
    }

    /**
     * Bundled base policy with {@code overlay} merged on top, as if resolved for 08a/Andrews.
     */
    public static EffectivePolicy policy(Map<String, Object> overlay) {
        Map<String, Object> base = bundle().pack().base();
        Map<String, Object> merged = DeepMerge.merge(base, overlay);
        return new EffectivePolicy("tx.w3a", "test", "TX", base, merged, "08a", "Andrews", null, null,
            true, List.of(), KnobReader.materialize(merged));
    }

    public static EffectivePolicy policy() {
        return policy(Map.of());
    }

    public static EffectivePolicy resolved(String district, String county, String field) {
        return new PolicyResolver(OpenTelemetry.noop().getTracer("test")).resolve(bundle(), district, county, field);
    }

    public static Map<String, Object> requirement(String knob, Object value) {
        return Map.of("requirements", Map.of(knob, value));
    }

    /**
     * Facts from alternating key/value arguments.
     */
    public static Map<String, Fact> facts(Object... keyValues) {
        Map<String, Fact> facts = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            String key = (String) keyValues[i];
            facts.put(key, Fact.of(key, keyValues[i + 1]));
        }
        return facts;
    }

    /**
     * The exposed-completion well: perforations straddle the production shoe.
     */
    public static Map<String, Fact> cibpWell(Object... extra) {
        Map<String, Fact> facts = facts(
            "api14", "42003012340000",
            "surface_shoe_ft", 500,
            "production_shoe_ft", 6815,
            "perf_interval", List.of(6748, 6865),
            "casing_id_in", 4.778,
            "stinger_od_in", 2.375);
        facts.putAll(facts(extra));
        return facts;
    }
}
