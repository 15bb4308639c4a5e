package com.schema.migration.migration.sequential;

import com.schema.migration.lock.DistributedLock;

import java.util.Optional;

/**
 * Options for {@link SequentialMigrationRunner#run} and {@link SequentialMigrationRunner#stamp}.
 *
 * <p>Usage:</p>
 * <pre>
 * RunOptions options = RunOptions.builder()
 *     .target("20240301_add_orders")
 *     .listener(event -&gt; System.out.println(event.message()))
 *     .build();
 * </pre>
 */
public final class RunOptions {

    private static final RunOptions DEFAULTS = builder().build();

    private final boolean dryRun;
    private final String target;
    private final MigrationListener listener;
    private final DistributedLock lock;

    private RunOptions(Builder builder) {
        this.dryRun = builder.dryRun;
        this.target = builder.target;
        this.listener = builder.listener;
        this.lock = builder.lock;
    }

    public static RunOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * Inclusive upper bound on the names to apply.
     */
    public Optional<String> getTarget() {
        return Optional.ofNullable(target);
    }

    public MigrationListener getListener() {
        return listener;
    }

    public Optional<DistributedLock> getLock() {
        return Optional.ofNullable(lock);
    }

    public static final class Builder {
        private boolean dryRun;
        private String target;
        private MigrationListener listener = MigrationListener.NONE;
        private DistributedLock lock;

        private Builder() {
        }

        /**
         * Report the pending migrations without executing or recording anything.
         */
        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        /**
         * Stop after the named migration. Pending migrations sorting after it are left pending.
         */
        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder listener(MigrationListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Lock held for the duration of the run.
         */
        public Builder lock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        public RunOptions build() {
            if (target != null && target.isBlank()) {
                throw new IllegalArgumentException("target must not be blank");
            }
            if (listener == null) {
                throw new IllegalArgumentException("listener must not be null");
            }
            return new RunOptions(this);
        }
    }
}
