package com.binauditor.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A dynamic dependency declared by the binary.
 *
 * @param name library name as recorded ({@code libc.so.6}, {@code KERNEL32.dll}, {@code /usr/lib/libSystem.B.dylib})
 * @param versionHint encoded version pin, or null when the format records none
 * @param versionRequirements symbol-version requirements ({@code GLIBC_2.34}), empty if none
 */
public record ImportedLibrary(
    String name,
    String versionHint,
    List<String> versionRequirements
) {
    /**
     * Compact constructor with validation.
     */
    public ImportedLibrary {
        Objects.requireNonNull(name, "name must not be null");
        versionRequirements = versionRequirements == null ? List.of() : List.copyOf(versionRequirements);
    }

    public boolean hasVersionPin() {
        return (versionHint != null && !versionHint.isBlank()) || !versionRequirements.isEmpty();
    }
}
