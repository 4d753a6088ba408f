package com.nexuscontrol.control;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.integrity.ContentDigest;
import com.nexuscontrol.integrity.EventIntegrityVerifier.IntegrityReport;
import com.nexuscontrol.projection.DecisionView;

import java.util.List;

/**
 * Archival export of one decision: its projected state, the full event log and
 * the integrity check of that log. {@code recordDigest} covers the record body.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditRecord(Body auditRecord, String recordDigest) {

    public static final String SCHEMA_VERSION = "0.1.0";

    public static AuditRecord of(Body body) {
        return new AuditRecord(body, ContentDigest.of(body));
    }

    public boolean verify() {
        return ContentDigest.verify(auditRecord, recordDigest);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Body(
        String schemaVersion,
        String exportedAt,
        DecisionView decision,
        List<EventEnvelope> events,
        IntegrityReport integrity
    ) {}
}
