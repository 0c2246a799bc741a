package com.example.allocation.service.port;

import com.example.allocation.model.RoundResult;

import java.util.List;
import java.util.Optional;

/** Storage of completed rounds. A saved round is visible to the next read. */
public interface RoundRepository {

    void save(RoundResult result);

    Optional<RoundResult> findById(String roundId);

    /** Most recent first. */
    List<RoundResult> findAll();

    Optional<RoundResult> latestCommitted();
}
