/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/RuntimeConfig.java
 description: Immutable runtime configuration with builder and system-property overrides.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 tags: [robokeytags,v1]
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 * Licensed under the Apache License, Version 2.0 (the "License");
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package tech.robd.jparallel;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.pool.AssignmentPolicy;
import tech.robd.jparallel.pool.ContextSpawner;
import tech.robd.jparallel.task.TaskIdSequence;
import tech.robd.jparallel.worker.ClassModuleResolver;
import tech.robd.jparallel.worker.ModuleResolver;
import tech.robd.jparallel.worker.ProcessContextSpawner;
import tech.robd.jparallel.worker.ThreadContextSpawner;
import tech.robd.jparallel.worker.WorkerMain;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Immutable settings of a {@link ParallelRuntime}, read once when the runtime is built.
 *
 * <p>System properties understood by {@link #fromSystemProperties()}:</p>
 * <ul>
 *   <li>{@value #PROP_MAX_WORKERS}: context cap, default the processor count</li>
 *   <li>{@value #PROP_CONTEXT_KIND}: {@code thread} (default) or {@code process}</li>
 *   <li>{@value #PROP_WORKER_ENTRY}: main class of process contexts</li>
 * </ul>
 */
public final class RuntimeConfig {

    public static final String PROP_MAX_WORKERS = "jparallel.maxWorkers";
    public static final String PROP_CONTEXT_KIND = "jparallel.contextKind";
    public static final String PROP_WORKER_ENTRY = "jparallel.workerEntry";

    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(1);

    // 🧩 Section: settings
    private final int maxWorkers;
    private final ContextKind contextKind;
    private final String workerEntry;
    private final Duration idleTimeout;
    private final Duration sweepInterval;
    private final AssignmentPolicy assignmentPolicy;
    private final long taskIdCeiling;
    private final ModuleResolver moduleResolver;
    private final @Nullable ContextSpawner spawner;
    private final String classpath;
    private final List<String> jvmArgs;
    // [/🧩 Section: settings]

    private RuntimeConfig(Builder b) {
        this.maxWorkers = b.maxWorkers;
        this.contextKind = b.contextKind;
        this.workerEntry = b.workerEntry;
        this.idleTimeout = b.idleTimeout;
        this.sweepInterval = b.sweepInterval;
        this.assignmentPolicy = b.assignmentPolicy;
        this.taskIdCeiling = b.taskIdCeiling;
        this.moduleResolver = b.moduleResolver;
        this.spawner = b.spawner;
        this.classpath = b.classpath;
        this.jvmArgs = List.copyOf(b.jvmArgs);
    }

    // 🧩 Section: factories
    public static @NonNull Builder builder() {
        return new Builder();
    }

    public static @NonNull RuntimeConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by the {@code jparallel.*} system properties.
     *
     * @throws IllegalArgumentException if a property holds an invalid value
     */
    public static @NonNull RuntimeConfig fromSystemProperties() {
        Builder b = builder();
        String max = System.getProperty(PROP_MAX_WORKERS);
        if (max != null && !max.isBlank()) {
            try {
                b.maxWorkers(Integer.parseInt(max.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + PROP_MAX_WORKERS + ": " + max, e);
            }
        }
        String kind = System.getProperty(PROP_CONTEXT_KIND);
        if (kind != null && !kind.isBlank()) {
            try {
                b.contextKind(ContextKind.valueOf(kind.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid " + PROP_CONTEXT_KIND + ": " + kind, e);
            }
        }
        String entry = System.getProperty(PROP_WORKER_ENTRY);
        if (entry != null && !entry.isBlank()) b.workerEntry(entry.trim());
        return b.build();
    }

    public @NonNull Builder toBuilder() {
        return new Builder()
                .maxWorkers(maxWorkers)
                .contextKind(contextKind)
                .workerEntry(workerEntry)
                .idleTimeout(idleTimeout)
                .sweepInterval(sweepInterval)
                .assignmentPolicy(assignmentPolicy)
                .taskIdCeiling(taskIdCeiling)
                .moduleResolver(moduleResolver)
                .spawner(spawner)
                .classpath(classpath)
                .jvmArgs(jvmArgs);
    }
    // [/🧩 Section: factories]

    /**
     * @return the configured spawner, or the one {@link #contextKind()} calls for
     */
    public @NonNull ContextSpawner spawner() {
        if (spawner != null) return spawner;
        if (contextKind == ContextKind.PROCESS) return new ProcessContextSpawner(classpath, workerEntry, jvmArgs);
        return new ThreadContextSpawner(moduleResolver);
    }

    // 🧩 Section: accessors
    public int maxWorkers() {
        return maxWorkers;
    }

    public @NonNull ContextKind contextKind() {
        return contextKind;
    }

    public @NonNull String workerEntry() {
        return workerEntry;
    }

    public @NonNull Duration idleTimeout() {
        return idleTimeout;
    }

    public @NonNull Duration sweepInterval() {
        return sweepInterval;
    }

    public @NonNull AssignmentPolicy assignmentPolicy() {
        return assignmentPolicy;
    }

    public long taskIdCeiling() {
        return taskIdCeiling;
    }

    public @NonNull ModuleResolver moduleResolver() {
        return moduleResolver;
    }

    public @NonNull String classpath() {
        return classpath;
    }

    public @NonNull List<String> jvmArgs() {
        return jvmArgs;
    }
    // [/🧩 Section: accessors]

    @Override
    public String toString() {
        return "RuntimeConfig{maxWorkers=" + maxWorkers + ", contextKind=" + contextKind
                + ", idleTimeout=" + idleTimeout.toMillis() + "ms, policy=" + assignmentPolicy + "}";
    }

    // 🧩 Section: builder
    public static final class Builder {
        private int maxWorkers = Runtime.getRuntime().availableProcessors();
        private ContextKind contextKind = ContextKind.THREAD;
        private String workerEntry = WorkerMain.class.getName();
        private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;
        private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
        private AssignmentPolicy assignmentPolicy = AssignmentPolicy.LEAST_LOADED;
        private long taskIdCeiling = TaskIdSequence.DEFAULT_CEILING;
        private ModuleResolver moduleResolver = new ClassModuleResolver();
        private @Nullable ContextSpawner spawner;
        private String classpath = System.getProperty("java.class.path");
        private List<String> jvmArgs = List.of();

        private Builder() {
        }

        public Builder maxWorkers(int value) {
            if (value < 1) throw new IllegalArgumentException("maxWorkers must be at least 1");
            this.maxWorkers = value;
            return this;
        }

        public Builder contextKind(@NonNull ContextKind value) {
            if (value == null) throw new IllegalArgumentException("Context kind cannot be null");
            this.contextKind = value;
            return this;
        }

        /**
         * Main class of process contexts. Not used by thread contexts.
         */
        public Builder workerEntry(@NonNull String value) {
            if (value == null || value.isBlank()) throw new IllegalArgumentException("Worker entry cannot be blank");
            this.workerEntry = value;
            return this;
        }

        public Builder idleTimeout(@NonNull Duration value) {
            if (value == null || value.isNegative()) throw new IllegalArgumentException("Idle timeout must not be negative");
            this.idleTimeout = value;
            return this;
        }

        public Builder sweepInterval(@NonNull Duration value) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException("Sweep interval must be positive");
            }
            this.sweepInterval = value;
            return this;
        }

        public Builder assignmentPolicy(@NonNull AssignmentPolicy value) {
            if (value == null) throw new IllegalArgumentException("Assignment policy cannot be null");
            this.assignmentPolicy = value;
            return this;
        }

        public Builder taskIdCeiling(long value) {
            if (value < 1) throw new IllegalArgumentException("Task id ceiling must be positive");
            this.taskIdCeiling = value;
            return this;
        }

        /**
         * Resolver used by thread contexts. Process contexts always resolve classes.
         */
        public Builder moduleResolver(@NonNull ModuleResolver value) {
            if (value == null) throw new IllegalArgumentException("Module resolver cannot be null");
            this.moduleResolver = value;
            return this;
        }

        /**
         * Replace the spawner derived from the context kind.
         */
        public Builder spawner(@Nullable ContextSpawner value) {
            this.spawner = value;
            return this;
        }

        public Builder classpath(@NonNull String value) {
            if (value == null) throw new IllegalArgumentException("Classpath cannot be null");
            this.classpath = value;
            return this;
        }

        public Builder jvmArgs(@NonNull List<String> value) {
            if (value == null) throw new IllegalArgumentException("JVM arguments cannot be null");
            this.jvmArgs = List.copyOf(value);
            return this;
        }

        public @NonNull RuntimeConfig build() {
            return new RuntimeConfig(this);
        }
    }
    // [/🧩 Section: builder]
}
