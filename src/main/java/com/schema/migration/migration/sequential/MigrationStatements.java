package com.schema.migration.migration.sequential;

import java.util.List;

/**
 * Raw TypeQL statements of a migration, kept for checksums and dry-run output.
 *
 * @param up   statements of the up step
 * @param down statements of the down step, empty if none
 */
public record MigrationStatements(List<String> up, List<String> down) {

    public MigrationStatements {
        up = up == null ? List.of() : List.copyOf(up);
        down = down == null ? List.of() : List.copyOf(down);
    }
}
