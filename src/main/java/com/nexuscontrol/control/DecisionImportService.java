package com.nexuscontrol.control;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventPayload;
import com.nexuscontrol.contract.EventType;
import com.nexuscontrol.integrity.CanonicalJson;
import com.nexuscontrol.integrity.ContentDigest;
import com.nexuscontrol.integrity.EventIntegrityVerifier;
import com.nexuscontrol.integrity.EventIntegrityVerifier.IntegrityReport;
import com.nexuscontrol.projection.Decision;
import com.nexuscontrol.projection.DecisionLifecycle;
import com.nexuscontrol.store.EventLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Restores a decision from an exported {@link AuditRecord}.
 *
 * Checks run in order, and the first failure rejects the import with nothing
 * written: record digest, schema version, event parsing, per-event digests and
 * sequence continuity, replay. Only then is the log installed, verbatim, under
 * the original id or a fresh one.
 */
@Service
public class DecisionImportService {

    private static final Logger log = LoggerFactory.getLogger(DecisionImportService.class);

    private final EventLogService eventLog;
    private final Clock clock;

    public DecisionImportService(EventLogService eventLog, Clock clock) {
        this.eventLog = eventLog;
        this.clock = clock;
    }

    /**
     * @param exported     the exported record as parsed JSON: {@code {audit_record, record_digest}}
     * @param mode         null for {@link ConflictMode#REJECT_ON_CONFLICT}
     * @param verifyDigest whether to check {@code record_digest}; event digests are always checked
     * @throws ImportRejectedException if any check fails
     */
    public ImportResult importRecord(Map<String, Object> exported, ConflictMode mode, boolean verifyDigest) {
        ConflictMode conflictMode = mode != null ? mode : ConflictMode.REJECT_ON_CONFLICT;
        Map<String, Object> body = object(exported, "audit_record");
        if (verifyDigest) {
            Object recordDigest = exported.get("record_digest");
            if (!(recordDigest instanceof String expected) || !ContentDigest.verify(body, expected)) {
                throw new ImportRejectedException(ImportRejectedException.INTEGRITY_MISMATCH,
                    "record_digest does not match the audit record");
            }
        }
        if (!AuditRecord.SCHEMA_VERSION.equals(body.get("schema_version"))) {
            throw new ImportRejectedException(ImportRejectedException.BUNDLE_INVALID,
                "Unsupported schema_version: " + body.get("schema_version"));
        }

        List<Map<String, Object>> rawEvents = events(body);
        String originalId = string(rawEvents.get(0), "decision_id");
        String targetId = originalId;
        if (eventLog.exists(originalId)) {
            if (conflictMode == ConflictMode.REJECT_ON_CONFLICT) {
                throw new ImportRejectedException(ImportRejectedException.DECISION_EXISTS,
                    "Decision already exists: " + originalId);
            }
            targetId = UUID.randomUUID().toString();
        }

        List<EventEnvelope> events = new ArrayList<>();
        for (Map<String, Object> raw : rawEvents) {
            if (!originalId.equals(raw.get("decision_id"))) {
                throw new ImportRejectedException(ImportRejectedException.BUNDLE_INVALID,
                    "Event " + raw.get("event_id") + " does not belong to " + originalId);
            }
            events.add(toEnvelope(targetId, raw));
        }
        events.sort(Comparator.comparingLong(EventEnvelope::sequenceNumber));

        IntegrityReport integrity = EventIntegrityVerifier.verify(targetId, events);
        if (!integrity.valid()) {
            throw new ImportRejectedException(ImportRejectedException.INTEGRITY_MISMATCH,
                "Event log failed verification: " + String.join("; ", integrity.problems()));
        }

        Decision replayed = replay(targetId, events);

        String installedId = targetId;
        try {
            eventLog.withDecisionLock(installedId, () -> {
                eventLog.importDecision(installedId, events);
                return null;
            });
        } catch (IllegalStateException ex) {
            throw new ImportRejectedException(ImportRejectedException.DECISION_EXISTS, ex.getMessage(), ex);
        }
        DecisionLifecycle lifecycle = DecisionLifecycle.of(replayed, DecisionLifecycle.DEFAULT_TIMELINE_LIMIT);
        log.info("Decision imported decision={} original={} events={} state={}",
            targetId, originalId, events.size(), replayed.getState().getValue());
        return new ImportResult(targetId, originalId, events.size(), verifyDigest, conflictMode,
            replayed.getState(), lifecycle.blockingReasons());
    }

    private Decision replay(String decisionId, List<EventEnvelope> events) {
        Decision decision;
        try {
            decision = Decision.replay(decisionId, events, clock.instant());
        } catch (RuntimeException ex) {
            throw new ImportRejectedException(ImportRejectedException.REPLAY_INVALID,
                "Replay failed: " + ex.getMessage(), ex);
        }
        if (!decision.exists() || events.get(0).eventType() != EventType.DECISION_CREATED) {
            throw new ImportRejectedException(ImportRejectedException.REPLAY_INVALID,
                "Log does not start with DECISION_CREATED");
        }
        return decision;
    }

    private static EventEnvelope toEnvelope(String decisionId, Map<String, Object> raw) {
        try {
            EventType type = EventType.valueOf(string(raw, "event_type"));
            Object sequence = raw.get("sequence_number");
            if (!(sequence instanceof Number number)) {
                throw new IllegalArgumentException("sequence_number is required");
            }
            return new EventEnvelope(
                decisionId,
                number.longValue(),
                type,
                Instant.parse(string(raw, "occurred_at")),
                CanonicalJson.read(object(raw, "actor"), Actor.class),
                CanonicalJson.read(object(raw, "payload"), EventPayload.payloadType(type)),
                string(raw, "digest")
            );
        } catch (ImportRejectedException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ImportRejectedException(ImportRejectedException.BUNDLE_INVALID,
                "Malformed event " + raw.get("event_id") + ": " + ex.getMessage(), ex);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> events(Map<String, Object> body) {
        if (!(body.get("events") instanceof List<?> list) || list.isEmpty()) {
            throw new ImportRejectedException(ImportRejectedException.BUNDLE_INVALID, "events must be a non-empty list");
        }
        for (Object entry : list) {
            if (!(entry instanceof Map)) {
                throw new ImportRejectedException(ImportRejectedException.BUNDLE_INVALID, "events must contain objects");
            }
        }
        return (List<Map<String, Object>>) list;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> object(Map<String, Object> source, String field) {
        if (source == null || !(source.get(field) instanceof Map)) {
            throw new ImportRejectedException(ImportRejectedException.BUNDLE_INVALID, field + " must be an object");
        }
        return (Map<String, Object>) source.get(field);
    }

    private static String string(Map<String, Object> source, String field) {
        if (!(source.get(field) instanceof String text) || text.isBlank()) {
            throw new ImportRejectedException(ImportRejectedException.BUNDLE_INVALID, field + " is required");
        }
        return text;
    }
}
