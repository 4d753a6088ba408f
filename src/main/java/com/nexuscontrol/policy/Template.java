package com.nexuscontrol.policy;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.integrity.ContentDigest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named, immutable policy bundle that decisions can be created from.
 */
public record Template(
    String name,
    String description,
    Policy policy,
    Instant createdAt,
    Actor createdBy
) {

    public Template {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Template name cannot be empty");
        }
        Objects.requireNonNull(policy, "policy");
        description = description == null ? "" : description;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("description", description);
        map.putAll(policy.toMap());
        map.put("created_at", createdAt != null ? createdAt.toString() : null);
        map.put("created_by", createdBy != null
            ? Map.of("type", createdBy.type().getValue(), "id", createdBy.id())
            : null);
        return map;
    }

    /**
     * Policy values as captured into a decision at creation time, without
     * template bookkeeping fields.
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("template_name", name);
        snapshot.put("template_description", description);
        snapshot.putAll(policy.toMap());
        return snapshot;
    }

    public String digest() {
        return ContentDigest.of(toMap());
    }
}
