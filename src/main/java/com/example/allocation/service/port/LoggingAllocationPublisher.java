package com.example.allocation.service.port;

import com.example.allocation.model.FairnessViolation;
import com.example.allocation.model.RoundResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingAllocationPublisher implements AllocationPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingAllocationPublisher.class);

    @Override
    public void publish(RoundResult result) {
        log.info("round={} published: assigned={} unmatched={} waivers={} fairnessPassed={}",
                result.roundId(),
                result.allocation().entries().size(),
                result.allocation().unmatched().size(),
                result.allocation().waivers().size(),
                result.fairness().passed());
        for (FairnessViolation violation : result.fairness().violations()) {
            log.info("round={} published fairness violation: {}", result.roundId(), violation.message());
        }
    }
}
