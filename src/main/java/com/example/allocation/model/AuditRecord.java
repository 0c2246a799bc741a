package com.example.allocation.model;

import java.time.Instant;

public record AuditRecord(
        long sequence,
        String recordId,
        String roundId,
        AuditDecision decision,
        String candidateId,
        String slotId,
        PairScore score,
        UnmatchedReason unmatchedReason,
        SlotQuota quotaState,
        String note,
        String supersedes,
        Instant recordedAt,
        String previousHash,
        String hash
) {
    public AuditRecord withHash(String sealedHash) {
        return new AuditRecord(sequence, recordId, roundId, decision, candidateId, slotId, score,
                unmatchedReason, quotaState, note, supersedes, recordedAt, previousHash, sealedHash);
    }

    public boolean concerns(String entityId) {
        return entityId.equals(candidateId) || entityId.equals(slotId);
    }
}
