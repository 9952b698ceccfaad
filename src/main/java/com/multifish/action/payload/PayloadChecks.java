package com.multifish.action.payload;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Shared entry-list rules: at least one entry, required identifiers present,
 * and each identifier key used once.
 */
final class PayloadChecks {

    private PayloadChecks() {}

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static <E> List<String> checkEntries(List<E> entries, String what,
                                         Function<E, List<String>> entryErrors,
                                         Function<E, String> key) {
        List<String> errors = new ArrayList<>();
        if (entries == null || entries.isEmpty()) {
            errors.add("at least one " + what + " payload is required");
            return errors;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            E entry = entries.get(i);
            if (entry == null) {
                errors.add("payload[" + i + "] is null");
                continue;
            }
            List<String> own = entryErrors.apply(entry);
            for (String error : own) {
                errors.add("payload[" + i + "]: " + error);
            }
            if (own.isEmpty() && !seen.add(key.apply(entry))) {
                errors.add("payload[" + i + "]: duplicate entry for " + key.apply(entry)
                        + ". Each " + what + " can only appear once");
            }
        }
        return errors;
    }
}
