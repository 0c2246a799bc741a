package com.example.allocation.service.port;

import com.example.allocation.model.RoundResult;

/** Downstream consumer of committed rounds (notifications, dashboards). Called after commit only. */
public interface AllocationPublisher {

    void publish(RoundResult result);
}
