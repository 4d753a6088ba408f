package com.nexuscontrol.api;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.ActorType;
import com.nexuscontrol.contract.ContractViolationException;
import com.nexuscontrol.contract.ExecutionMode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Field extraction for loosely-typed JSON request bodies.
 */
final class RequestFields {

    private RequestFields() {
    }

    static String requireString(Map<String, Object> body, String field) {
        if (!(body.get(field) instanceof String text) || text.isBlank()) {
            throw new ContractViolationException(field + " is required");
        }
        return text;
    }

    static String optionalString(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new ContractViolationException(field + " must be a string");
        }
        return text;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> optionalObject(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ContractViolationException(field + " must be an object");
        }
        return (Map<String, Object>) value;
    }

    static Instant optionalInstant(Map<String, Object> body, String field) {
        String raw = optionalString(body, field);
        if (raw == null) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException ex) {
            throw new ContractViolationException(field + " must be an ISO-8601 instant (got " + raw + ")");
        }
    }

    static ExecutionMode optionalMode(Map<String, Object> body, String field) {
        String raw = optionalString(body, field);
        if (raw == null) {
            return null;
        }
        if (!ExecutionMode.isKnown(raw)) {
            throw new ContractViolationException(field + " must be one of: dry_run, apply (got " + raw + ")");
        }
        return ExecutionMode.fromValue(raw);
    }

    /**
     * Reads {@code actor: {type, id}}; type defaults to human.
     */
    static Actor actor(Map<String, Object> body) {
        Map<String, Object> raw = optionalObject(body, "actor");
        if (raw == null) {
            throw new ContractViolationException("actor is required");
        }
        ActorType type = ActorType.HUMAN;
        if (raw.get("type") != null) {
            try {
                type = ActorType.fromValue(String.valueOf(raw.get("type")));
            } catch (IllegalArgumentException ex) {
                throw new ContractViolationException("actor.type must be one of: human, system");
            }
        }
        Object id = raw.get("id");
        return new Actor(type, id instanceof String text ? text : null);
    }
}
