package com.example.allocation.model;

import java.util.List;

public record QuotaWaiver(
        String slotId,
        List<String> categories,
        String reason
) {
    public QuotaWaiver {
        categories = List.copyOf(categories);
    }
}
