package com.ttennebkram.schematic.netlist;

import com.ttennebkram.schematic.model.DeviceKind;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Hands out unique SPICE device names for one netlist.
 *
 * A usable designation ("R1", "u3") is kept, uppercased and prefixed with the
 * device letter when it lacks it. Otherwise the name is the device letter plus
 * a per-letter counter, skipping names that are already taken.
 */
public class SpiceNameAllocator {

    private final Map<DeviceKind, Integer> counters = new EnumMap<>(DeviceKind.class);
    private final Set<String> taken = new HashSet<>();

    public String allocate(DeviceKind kind, String designation) {
        String fromDesignation = fromDesignation(kind, designation);
        if (fromDesignation != null && taken.add(fromDesignation)) {
            return fromDesignation;
        }

        String name;
        do {
            int next = counters.getOrDefault(kind, 0) + 1;
            counters.put(kind, next);
            name = String.valueOf(kind.letter()) + next;
        } while (!taken.add(name));
        return name;
    }

    public boolean isTaken(String name) {
        return taken.contains(name);
    }

    private static String fromDesignation(DeviceKind kind, String designation) {
        if (designation == null) return null;
        String cleaned = designation.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        if (cleaned.length() <= 1) return null;

        if (cleaned.charAt(0) != kind.letter()) {
            cleaned = kind.letter() + cleaned;
        }
        return cleaned;
    }
}
