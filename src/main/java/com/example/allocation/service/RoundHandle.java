package com.example.allocation.service;

import com.example.allocation.model.RoundResult;

import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/** A submitted round: its id, its eventual result, and a pre-commit cancel switch. */
public final class RoundHandle {

    private final String roundId;
    private final CompletableFuture<RoundResult> result;
    private final BooleanSupplier canceller;

    RoundHandle(String roundId, CompletableFuture<RoundResult> result, BooleanSupplier canceller) {
        this.roundId = roundId;
        this.result = result;
        this.canceller = canceller;
    }

    public String roundId() {
        return roundId;
    }

    public CompletableFuture<RoundResult> result() {
        return result;
    }

    /**
     * Requests cancellation. Only honoured while the round has not committed.
     *
     * @return true if the round will end as CANCELLED
     */
    public boolean cancel() {
        return canceller.getAsBoolean();
    }
}
