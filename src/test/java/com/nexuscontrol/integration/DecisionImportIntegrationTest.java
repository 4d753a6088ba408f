package com.nexuscontrol.integration;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.control.AuditRecord;
import com.nexuscontrol.control.ConflictMode;
import com.nexuscontrol.control.CreateDecisionCommand;
import com.nexuscontrol.control.DecisionImportService;
import com.nexuscontrol.control.DecisionService;
import com.nexuscontrol.control.ImportRejectedException;
import com.nexuscontrol.control.ImportResult;
import com.nexuscontrol.policy.PolicyOverrides;
import com.nexuscontrol.projection.DecisionState;
import com.nexuscontrol.projection.DecisionView;
import com.nexuscontrol.projection.ProjectionService;
import com.nexuscontrol.store.EventLogService;
import com.nexuscontrol.store.InMemoryEventStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Export, then import: the record goes through real JSON both ways, and the
 * restored decision must project to the same view with the same digests.
 */
@SpringBootTest
class DecisionImportIntegrationTest {

    @Autowired DecisionService decisions;
    @Autowired DecisionImportService importService;
    @Autowired ProjectionService projectionService;
    @Autowired EventLogService liveLog;
    @Autowired ObjectMapper mapper;

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @Test
        @DisplayName("Import into a fresh store reproduces the exported view")
        void importIntoFreshStore_reproducesView() throws Exception {
            String id = runFullCycle();
            Map<String, Object> exported = exportAsJson(id);

            InMemoryEventStore freshStore = new InMemoryEventStore();
            EventLogService freshLog = new EventLogService(freshStore);
            DecisionImportService freshImport = new DecisionImportService(freshLog, Clock.systemUTC());
            ImportResult result = freshImport.importRecord(exported, null, true);

            assertEquals(id, result.decisionId());
            assertFalse(result.remapped());
            assertEquals(7, result.eventsImported());
            assertTrue(result.digestVerified());
            assertEquals(DecisionState.COMPLETED, result.state());
            assertTrue(result.blockingReasons().isEmpty());

            ProjectionService freshProjection = new ProjectionService(freshStore, Clock.systemUTC());
            assertEquals(projectionService.view(id, 0), freshProjection.view(id, 0));

            List<EventEnvelope> live = liveLog.read(id);
            List<EventEnvelope> restored = freshLog.read(id);
            assertEquals(live, restored);
        }

        @Test
        @DisplayName("Import under a new id keeps every event digest")
        void importWithNewId_keepsDigests() throws Exception {
            String id = runFullCycle();
            ImportResult result = importService.importRecord(exportAsJson(id), ConflictMode.NEW_DECISION_ID, true);

            assertTrue(result.remapped());
            assertEquals(id, result.originalDecisionId());
            assertNotEquals(id, result.decisionId());

            List<EventEnvelope> live = liveLog.read(id);
            List<EventEnvelope> restored = liveLog.read(result.decisionId());
            assertEquals(live.size(), restored.size());
            for (int i = 0; i < live.size(); i++) {
                assertEquals(live.get(i).digest(), restored.get(i).digest(), "digest at seq " + i);
                assertEquals(live.get(i).occurredAt(), restored.get(i).occurredAt());
                assertEquals(result.decisionId(), restored.get(i).decisionId());
            }

            DecisionView original = projectionService.view(id, 0);
            DecisionView imported = projectionService.view(result.decisionId(), 0);
            assertEquals(original.state(), imported.state());
            assertEquals(original.policy(), imported.policy());
            assertTrue(decisions.verifyIntegrity(result.decisionId()).valid());
        }

        @Test
        void existingId_isRejectedByDefault() throws Exception {
            String id = runFullCycle();
            ImportRejectedException ex = assertThrows(ImportRejectedException.class,
                () -> importService.importRecord(exportAsJson(id), ConflictMode.REJECT_ON_CONFLICT, true));
            assertEquals(ImportRejectedException.DECISION_EXISTS, ex.getErrorCode());
            assertEquals(7, liveLog.read(id).size());
        }

        @Test
        void importedDecision_acceptsFurtherEvents() throws Exception {
            String id = decisions.create(CreateDecisionCommand.of("pending",
                new PolicyOverrides(2, null, null, null, null), Actor.human("alice"))).decisionId();
            decisions.approve(id, Actor.human("bob"), null, null);

            ImportResult result = importService.importRecord(exportAsJson(id), ConflictMode.NEW_DECISION_ID, true);
            assertEquals(DecisionState.PENDING_APPROVAL, result.state());
            assertFalse(result.blockingReasons().isEmpty());

            decisions.approve(result.decisionId(), Actor.human("carol"), null, null);
            assertEquals(4, liveLog.read(result.decisionId()).size());
            assertEquals(3, liveLog.read(result.decisionId()).get(3).sequenceNumber());
        }
    }

    @Nested
    @DisplayName("Tampered records are rejected before anything is written")
    class Tampering {

        @Test
        void alteredPayload_failsEventDigest() throws Exception {
            String id = runFullCycle();
            Map<String, Object> exported = exportAsJson(id);
            payloadOf(exported, 0).put("goal", "something else");

            assertRejected(ImportRejectedException.INTEGRITY_MISMATCH,
                () -> importService.importRecord(exported, ConflictMode.NEW_DECISION_ID, false));
        }

        @Test
        void alteredPayload_failsRecordDigestWhenVerified() throws Exception {
            String id = runFullCycle();
            Map<String, Object> exported = exportAsJson(id);
            payloadOf(exported, 0).put("goal", "something else");

            ImportRejectedException ex = assertRejected(ImportRejectedException.INTEGRITY_MISMATCH,
                () -> importService.importRecord(exported, ConflictMode.NEW_DECISION_ID, true));
            assertTrue(ex.getMessage().contains("record_digest"));
        }

        @Test
        void droppedEvent_breaksSequence() throws Exception {
            String id = runFullCycle();
            Map<String, Object> exported = exportAsJson(id);
            eventsOf(exported).remove(2);

            ImportRejectedException ex = assertRejected(ImportRejectedException.INTEGRITY_MISMATCH,
                () -> importService.importRecord(exported, ConflictMode.NEW_DECISION_ID, false));
            assertTrue(ex.getMessage().contains("expected sequence 2"));
        }

        @Test
        void wrongRecordDigest_isRejected() throws Exception {
            String id = runFullCycle();
            Map<String, Object> exported = exportAsJson(id);
            exported.put("record_digest", "0".repeat(64));

            assertRejected(ImportRejectedException.INTEGRITY_MISMATCH,
                () -> importService.importRecord(exported, ConflictMode.NEW_DECISION_ID, true));
        }

        @Test
        void wrongRecordDigest_isIgnoredWhenVerificationIsOff() throws Exception {
            String id = runFullCycle();
            Map<String, Object> exported = exportAsJson(id);
            exported.put("record_digest", "0".repeat(64));

            ImportResult result = importService.importRecord(exported, ConflictMode.NEW_DECISION_ID, false);
            assertFalse(result.digestVerified());
            assertEquals(DecisionState.COMPLETED, result.state());
        }

        @Test
        void unknownSchemaVersion_isRejected() throws Exception {
            String id = runFullCycle();
            Map<String, Object> exported = exportAsJson(id);
            bodyOf(exported).put("schema_version", "9.9.9");

            assertRejected(ImportRejectedException.BUNDLE_INVALID,
                () -> importService.importRecord(exported, ConflictMode.NEW_DECISION_ID, false));
        }

        @Test
        void emptyEventList_isRejected() throws Exception {
            String id = runFullCycle();
            Map<String, Object> exported = exportAsJson(id);
            eventsOf(exported).clear();

            assertRejected(ImportRejectedException.BUNDLE_INVALID,
                () -> importService.importRecord(exported, ConflictMode.NEW_DECISION_ID, false));
        }

        @Test
        void unknownEventType_isRejected() throws Exception {
            String id = runFullCycle();
            Map<String, Object> exported = exportAsJson(id);
            eventsOf(exported).get(1).put("event_type", "POLICY_DELETED");

            assertRejected(ImportRejectedException.BUNDLE_INVALID,
                () -> importService.importRecord(exported, ConflictMode.NEW_DECISION_ID, false));
        }

        @Test
        void reorderedLog_failsReplay() throws Exception {
            String id = runFullCycle();
            Map<String, Object> exported = exportAsJson(id);
            // digests cover type and payload only, so swapping sequence numbers keeps them valid
            List<Map<String, Object>> events = eventsOf(exported);
            events.get(0).put("sequence_number", 1);
            events.get(1).put("sequence_number", 0);

            assertRejected(ImportRejectedException.REPLAY_INVALID,
                () -> importService.importRecord(exported, ConflictMode.NEW_DECISION_ID, false));
        }

        private ImportRejectedException assertRejected(String errorCode, Executable call) {
            long before = liveLog.listDecisions(Integer.MAX_VALUE, 0).size();
            ImportRejectedException ex = assertThrows(ImportRejectedException.class, call);
            assertEquals(errorCode, ex.getErrorCode());
            assertEquals(before, liveLog.listDecisions(Integer.MAX_VALUE, 0).size());
            return ex;
        }
    }

    private String runFullCycle() {
        Actor alice = Actor.human("alice");
        String id = decisions.create(CreateDecisionCommand.of("restore me",
            new PolicyOverrides(2, null, null, null, null), alice)).decisionId();
        decisions.approve(id, Actor.human("bob"), "ok", null);
        decisions.approve(id, Actor.human("carol"), null, null);
        decisions.execute(id, Map.of("goal", "restore me"), alice);
        return id;
    }

    private Map<String, Object> exportAsJson(String id) throws Exception {
        AuditRecord record = decisions.exportAudit(id);
        String json = mapper.writeValueAsString(record);
        return mapper.readValue(json, new TypeReference<Map<String, Object>>() {});
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> bodyOf(Map<String, Object> exported) {
        return (Map<String, Object>) exported.get("audit_record");
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> eventsOf(Map<String, Object> exported) {
        return (List<Map<String, Object>>) bodyOf(exported).get("events");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> payloadOf(Map<String, Object> exported, int index) {
        return (Map<String, Object>) eventsOf(exported).get(index).get("payload");
    }
}
