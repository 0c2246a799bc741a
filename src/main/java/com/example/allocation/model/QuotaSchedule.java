package com.example.allocation.model;

import java.util.List;
import java.util.Map;

public record QuotaSchedule(
        Map<String, SlotQuota> slots,
        List<QuotaWaiver> waivers
) {
    public static final QuotaSchedule EMPTY = new QuotaSchedule(Map.of(), List.of());

    public QuotaSchedule {
        slots = Map.copyOf(slots);
        waivers = List.copyOf(waivers);
    }

    public SlotQuota forSlot(String slotId, int capacity) {
        SlotQuota quota = slots.get(slotId);
        return quota != null ? quota : new SlotQuota(slotId, capacity, Map.of(), false);
    }
}
