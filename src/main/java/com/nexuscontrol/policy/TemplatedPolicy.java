package com.nexuscontrol.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A policy instantiated from a template, with the provenance needed to
 * reconcile it: the effective policy equals the snapshot with the applied
 * overrides merged in.
 */
public record TemplatedPolicy(
    Policy effective,
    String templateName,
    Map<String, Object> snapshot,
    String templateDigest,
    Map<String, Object> overridesApplied
) {

    public TemplatedPolicy {
        snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(snapshot));
        overridesApplied = Collections.unmodifiableMap(new LinkedHashMap<>(overridesApplied));
    }

    public static TemplatedPolicy instantiate(Template template, PolicyOverrides overrides) {
        PolicyOverrides applied = overrides == null ? PolicyOverrides.none() : overrides;
        return new TemplatedPolicy(
            applied.applyTo(template.policy()),
            template.name(),
            template.toSnapshot(),
            template.digest(),
            applied.toMap()
        );
    }

    /** Re-derives the policy from snapshot and overrides and compares. */
    public boolean reconciles() {
        Policy fromSnapshot = PolicyReader.fromMap(snapshot);
        Policy merged = PolicyReader.overridesFromMap(overridesApplied).applyTo(fromSnapshot);
        return merged.equals(effective);
    }
}
