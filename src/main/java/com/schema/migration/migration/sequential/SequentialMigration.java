package com.schema.migration.migration.sequential;

import com.schema.migration.graph.CancellationToken;
import com.schema.migration.graph.Database;
import com.schema.migration.migration.MigrationLedger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, caller-authored migration. The name is its identity; migrations run in
 * lexicographic name order, so names usually start with a sortable prefix such as
 * {@code 20240101_create_users}.
 *
 * <p>Migrations built from statements ({@link #ofStatements}) carry their raw statements,
 * which makes them checksummed and visible in dry-run output. Migrations with custom
 * actions have an empty checksum and are never verified.</p>
 */
public final class SequentialMigration {

    private final String name;
    private final MigrationAction up;
    private final MigrationAction down;
    private final MigrationStatements statements;

    private SequentialMigration(String name, MigrationAction up, MigrationAction down,
                                MigrationStatements statements) {
        this.name = name;
        this.up = up;
        this.down = down;
        this.statements = statements;
    }

    /**
     * Creates a migration from TypeQL statements. Each statement runs in its own
     * transaction, schema or write depending on its leading keyword.
     *
     * @param up   up statements; an empty list leaves the migration without an up step
     * @param down down statements; empty if the migration cannot be rolled back
     */
    public static SequentialMigration ofStatements(String name, List<String> up, List<String> down) {
        MigrationStatements statements = new MigrationStatements(up, down);
        boolean hasStatements = !statements.up().isEmpty() || !statements.down().isEmpty();
        return new SequentialMigration(name,
                statements.up().isEmpty() ? null : executing(statements.up()),
                statements.down().isEmpty() ? null : executing(statements.down()),
                hasStatements ? statements : null);
    }

    public static SequentialMigration ofStatements(String name, List<String> up) {
        return ofStatements(name, up, List.of());
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static MigrationAction executing(List<String> statements) {
        return (CancellationToken token, Database database) -> {
            for (String statement : statements) {
                database.execute(token, statement);
            }
        };
    }

    public String getName() {
        return name;
    }

    /**
     * The up step, null when missing (which fails validation).
     */
    public MigrationAction getUp() {
        return up;
    }

    public Optional<MigrationAction> getDown() {
        return Optional.ofNullable(down);
    }

    public Optional<MigrationStatements> getStatements() {
        return Optional.ofNullable(statements);
    }

    /**
     * SHA-256 hex digest of the up statements, a {@code |} separator and the down statements.
     * Empty when the migration has no known statements.
     *
     * <p>Statements within one direction are hashed back to back with no delimiter, so the
     * digest tracks the concatenated text and not how it is split into statements:
     * {@code ["ab"]} and {@code ["a", "b"]} share a checksum. Checksums already stored in
     * ledgers use this layout, and changing it would flag every recorded migration as
     * modified.</p>
     */
    public String checksum() {
        if (statements == null) {
            return "";
        }
        MessageDigest digest = MigrationLedger.sha256();
        for (String statement : statements.up()) {
            digest.update(statement.getBytes(StandardCharsets.UTF_8));
        }
        digest.update((byte) '|');
        for (String statement : statements.down()) {
            digest.update(statement.getBytes(StandardCharsets.UTF_8));
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SequentialMigration other)) return false;
        return Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public String toString() {
        return "SequentialMigration{" + name + "}";
    }

    /**
     * Builder for migrations with custom actions.
     */
    public static final class Builder {
        private final String name;
        private MigrationAction up;
        private MigrationAction down;
        private MigrationStatements statements;

        private Builder(String name) {
            this.name = name;
        }

        public Builder up(MigrationAction up) {
            this.up = up;
            return this;
        }

        public Builder down(MigrationAction down) {
            this.down = down;
            return this;
        }

        /**
         * Attaches the statements the actions execute, enabling checksums and dry-run output.
         */
        public Builder statements(MigrationStatements statements) {
            this.statements = statements;
            return this;
        }

        public SequentialMigration build() {
            return new SequentialMigration(name, up, down, statements);
        }
    }
}
