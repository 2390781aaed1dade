/*
 [File Info]
 path: src/test/java/tech/robd/jparallel/RuntimeConfigTest.java
 description: Configuration and run option tests.
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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jparallel.pool.AssignmentPolicy;
import tech.robd.jparallel.worker.ProcessContextSpawner;
import tech.robd.jparallel.worker.ThreadContextSpawner;
import tech.robd.jparallel.worker.WorkerMain;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class RuntimeConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(RuntimeConfig.PROP_MAX_WORKERS);
        System.clearProperty(RuntimeConfig.PROP_CONTEXT_KIND);
        System.clearProperty(RuntimeConfig.PROP_WORKER_ENTRY);
    }

    @Test
    @Timeout(2)
    void defaults() {
        RuntimeConfig config = RuntimeConfig.defaults();
        assertEquals(Runtime.getRuntime().availableProcessors(), config.maxWorkers());
        assertEquals(ContextKind.THREAD, config.contextKind());
        assertEquals(WorkerMain.class.getName(), config.workerEntry());
        assertEquals(RuntimeConfig.DEFAULT_IDLE_TIMEOUT, config.idleTimeout());
        assertEquals(AssignmentPolicy.LEAST_LOADED, config.assignmentPolicy());
        assertInstanceOf(ThreadContextSpawner.class, config.spawner());
    }

    @Test
    @Timeout(2)
    void systemPropertiesOverrideDefaults() {
        System.setProperty(RuntimeConfig.PROP_MAX_WORKERS, " 3 ");
        System.setProperty(RuntimeConfig.PROP_CONTEXT_KIND, "process");
        System.setProperty(RuntimeConfig.PROP_WORKER_ENTRY, "com.example.Entry");

        RuntimeConfig config = RuntimeConfig.fromSystemProperties();
        assertEquals(3, config.maxWorkers());
        assertEquals(ContextKind.PROCESS, config.contextKind());
        assertEquals("com.example.Entry", config.workerEntry());
        assertInstanceOf(ProcessContextSpawner.class, config.spawner());
    }

    @Test
    @Timeout(2)
    void invalidPropertiesAreReported() {
        System.setProperty(RuntimeConfig.PROP_MAX_WORKERS, "many");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, RuntimeConfig::fromSystemProperties);
        assertTrue(e.getMessage().contains(RuntimeConfig.PROP_MAX_WORKERS));

        System.clearProperty(RuntimeConfig.PROP_MAX_WORKERS);
        System.setProperty(RuntimeConfig.PROP_CONTEXT_KIND, "fiber");
        assertThrows(IllegalArgumentException.class, RuntimeConfig::fromSystemProperties);
    }

    @Test
    @Timeout(2)
    void builderValidates() {
        RuntimeConfig.Builder b = RuntimeConfig.builder();
        assertThrows(IllegalArgumentException.class, () -> b.maxWorkers(0));
        assertThrows(IllegalArgumentException.class, () -> b.idleTimeout(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> b.sweepInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> b.taskIdCeiling(0));
        assertThrows(IllegalArgumentException.class, () -> b.workerEntry(" "));
        assertThrows(IllegalArgumentException.class, () -> b.jvmArgs(null));
    }

    @Test
    @Timeout(2)
    void toBuilderCopiesSettings() {
        RuntimeConfig config = RuntimeConfig.builder()
                .maxWorkers(2)
                .assignmentPolicy(AssignmentPolicy.MODULO)
                .idleTimeout(Duration.ofSeconds(3))
                .jvmArgs(List.of("-Xmx64m"))
                .build();
        RuntimeConfig copy = config.toBuilder().maxWorkers(5).build();

        assertEquals(5, copy.maxWorkers());
        assertEquals(AssignmentPolicy.MODULO, copy.assignmentPolicy());
        assertEquals(Duration.ofSeconds(3), copy.idleTimeout());
        assertEquals(List.of("-Xmx64m"), copy.jvmArgs());
        assertEquals(2, config.maxWorkers());
    }

    @Test
    @Timeout(2)
    void runOptions() {
        RunOptions none = RunOptions.none();
        assertNull(none.timeout());
        assertFalse(none.keepAlive());

        assertTrue(RunOptions.reusingContext().keepAlive());
        assertEquals(Duration.ofMillis(50), RunOptions.timeout(Duration.ofMillis(50)).timeout());

        RunOptions both = RunOptions.reusingContext().withTimeout(Duration.ofSeconds(1));
        assertTrue(both.keepAlive());
        assertEquals(Duration.ofSeconds(1), both.timeout());
        assertFalse(both.withKeepAlive(false).keepAlive());
    }
}
