package com.nexuscontrol.projection;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexuscontrol.contract.Actor;

import java.time.Instant;

/**
 * One approver's standing on a decision. Revocation keeps the record and
 * marks it, so the audit trail still shows the original grant.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Approval(
    Actor actor,
    Instant grantedAt,
    Instant expiresAt,
    String comment,
    boolean revoked,
    Instant revokedAt,
    String revokeReason
) {

    public static Approval granted(Actor actor, Instant grantedAt, Instant expiresAt, String comment) {
        return new Approval(actor, grantedAt, expiresAt, comment, false, null, null);
    }

    public Approval revoke(Instant at, String reason) {
        return new Approval(actor, grantedAt, expiresAt, comment, true, at, reason);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /** Counts toward the approval threshold: neither revoked nor expired. */
    public boolean isActive(Instant now) {
        return !revoked && !isExpired(now);
    }
}
