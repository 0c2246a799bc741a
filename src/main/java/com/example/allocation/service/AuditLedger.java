package com.example.allocation.service;

import com.example.allocation.model.AuditDecision;
import com.example.allocation.model.AuditEntry;
import com.example.allocation.model.AuditRecord;
import com.example.allocation.model.ChainVerification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only, hash-chained record of every allocation decision.
 *
 * <p>There is no update or delete. An administrator override is a new {@link AuditDecision#CORRECTION}
 * record that names the record it supersedes. A round's records are appended contiguously under
 * the write lock, and readers always work on a snapshot, so a partially appended round is never
 * observable.
 */
@Service
public class AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    private final List<AuditRecord> records = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public AuditLedger() {
        this(Clock.systemUTC());
    }

    AuditLedger(Clock clock) {
        this.clock = clock;
    }

    /** Appends one round's decisions atomically and returns the sealed records. */
    public List<AuditRecord> appendRound(String roundId, List<AuditEntry> entries) {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            List<AuditRecord> sealed = new ArrayList<>(entries.size());
            String previous = lastHash();
            for (AuditEntry entry : entries) {
                AuditRecord record = seal(records.size() + sealed.size(), roundId, entry, now, previous);
                sealed.add(record);
                previous = record.hash();
            }
            records.addAll(sealed);
            log.info("round={} audit records appended: {} (ledger size {})", roundId, sealed.size(), records.size());
            return List.copyOf(sealed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records an override of an earlier decision. The superseded record stays in the chain.
     *
     * @throws IllegalArgumentException if no record has the given id or the note is blank
     */
    public AuditRecord appendCorrection(String supersededRecordId, String note) {
        if (note == null || note.isBlank()) {
            throw new IllegalArgumentException("A correction needs a note");
        }
        lock.writeLock().lock();
        try {
            AuditRecord superseded = records.stream()
                    .filter(r -> r.recordId().equals(supersededRecordId))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown audit record: " + supersededRecordId));
            AuditEntry correction = new AuditEntry(AuditDecision.CORRECTION, superseded.candidateId(),
                    superseded.slotId(), null, null, null, note, superseded.recordId());
            AuditRecord record = seal(records.size(), superseded.roundId(), correction, clock.instant(), lastHash());
            records.add(record);
            log.warn("audit record {} superseded by correction {}: {}", supersededRecordId, record.recordId(), note);
            return record;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Records whose candidate or slot is the entity, in append order. */
    public List<AuditRecord> history(String entityId) {
        return snapshot().stream().filter(r -> r.concerns(entityId)).toList();
    }

    public List<AuditRecord> roundRecords(String roundId) {
        return snapshot().stream().filter(r -> roundId.equals(r.roundId())).toList();
    }

    public List<AuditRecord> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public ChainVerification verifyChain() {
        return verify(snapshot());
    }

    /** Recomputes every hash and link; reports the first record that does not match. */
    public static ChainVerification verify(List<AuditRecord> chain) {
        String previous = AuditHasher.GENESIS;
        for (int i = 0; i < chain.size(); i++) {
            AuditRecord record = chain.get(i);
            boolean linked = record.sequence() == i && previous.equals(record.previousHash());
            if (!linked || !AuditHasher.hash(record).equals(record.hash())) {
                return new ChainVerification(false, i, record.sequence());
            }
            previous = record.hash();
        }
        return new ChainVerification(true, chain.size(), null);
    }

    private String lastHash() {
        return records.isEmpty() ? AuditHasher.GENESIS : records.get(records.size() - 1).hash();
    }

    private static AuditRecord seal(long sequence, String roundId, AuditEntry entry, Instant at, String previousHash) {
        AuditRecord unsealed = new AuditRecord(sequence, String.format(Locale.ROOT, "AR-%06d", sequence), roundId,
                entry.decision(), entry.candidateId(), entry.slotId(), entry.score(), entry.unmatchedReason(),
                entry.quotaState(), entry.note(), entry.supersedes(), at, previousHash, null);
        return unsealed.withHash(AuditHasher.hash(unsealed));
    }
}
