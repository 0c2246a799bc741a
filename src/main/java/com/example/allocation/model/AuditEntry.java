package com.example.allocation.model;

/** Content of a ledger record before it is sequenced and hash-chained. */
public record AuditEntry(
        AuditDecision decision,
        String candidateId,
        String slotId,
        PairScore score,
        UnmatchedReason unmatchedReason,
        SlotQuota quotaState,
        String note,
        String supersedes
) {
    public static AuditEntry assigned(AllocationEntry entry, SlotQuota quotaState) {
        return new AuditEntry(AuditDecision.ASSIGNED, entry.candidateId(), entry.slotId(),
                entry.score(), null, quotaState, entry.phase().name(), null);
    }

    /**
     * An unmatched candidate holds no seat, so there is no slot whose quota state applies; the
     * reason code carries the decision instead.
     */
    public static AuditEntry unmatched(UnmatchedCandidate unmatched) {
        return new AuditEntry(AuditDecision.UNMATCHED, unmatched.candidateId(), null,
                null, unmatched.reason(), null, unmatched.reason().description(), null);
    }

    public static AuditEntry waiver(QuotaWaiver waiver, SlotQuota quotaState) {
        return new AuditEntry(AuditDecision.QUOTA_WAIVED, null, waiver.slotId(),
                null, null, quotaState,
                "categories=" + waiver.categories() + " reason=" + waiver.reason(), null);
    }

    public static AuditEntry fairness(FairnessViolation violation) {
        return new AuditEntry(AuditDecision.FAIRNESS_VIOLATION, null, violation.slotId(),
                null, null, null, violation.message(), null);
    }
}
