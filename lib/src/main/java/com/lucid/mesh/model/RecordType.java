package com.lucid.mesh.model;

import java.util.Locale;
import java.util.Optional;

/**
 * DNS record types the resolver understands.
 */
public enum RecordType {
    A,
    AAAA,
    SRV;
    
    /**
     * Parses a record type name case-insensitively.
     *
     * @return the record type, or empty for anything other than A, AAAA or SRV
     */
    public static Optional<RecordType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
