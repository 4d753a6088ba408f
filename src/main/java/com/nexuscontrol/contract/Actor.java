package com.nexuscontrol.contract;

import java.util.Objects;

/**
 * Who performed an action recorded in the event log.
 */
public record Actor(ActorType type, String id) {

    public Actor {
        Objects.requireNonNull(type, "actor type is required");
        if (id == null || id.isBlank()) {
            throw new ContractViolationException("actor.id is required");
        }
    }

    public static Actor human(String id) {
        return new Actor(ActorType.HUMAN, id);
    }

    public static Actor system(String id) {
        return new Actor(ActorType.SYSTEM, id);
    }

    /** Display form used in timelines, e.g. {@code system:nexus-router}. */
    public String displayName() {
        return type == ActorType.SYSTEM ? "system:" + id : id;
    }
}
