package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.constraint.Elimination;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The first slot no member could take, with every reason each member was eliminated.
 * Keys are in name order.
 */
public record UnfilledSlot(DutySlot slot, Map<String, List<Elimination>> eliminations) {

    public UnfilledSlot {
        Map<String, List<Elimination>> copy = new LinkedHashMap<>();
        eliminations.forEach((name, reasons) -> copy.put(name, List.copyOf(reasons)));
        eliminations = Collections.unmodifiableMap(copy);
    }

    public String digest() {
        return eliminations.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
