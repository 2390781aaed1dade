/*
 [File Info]
 path: src/test/java/tech/robd/jparallel/worker/ModuleRegistryTest.java
 description: Module registry tests: registration, fallback and thread-context resolution.
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
package tech.robd.jparallel.worker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jparallel.ParallelRuntime;
import tech.robd.jparallel.RuntimeConfig;
import tech.robd.jparallel.error.ModuleResolutionException;
import tech.robd.jparallel.examples.WorkerFunctions;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class ModuleRegistryTest {

    @Test
    @Timeout(2)
    void registeredFunctionsFormAModule() throws Exception {
        ModuleRegistry registry = new ModuleRegistry()
                .register("math", "square", args -> {
                    int n = ((Number) args.get(0)).intValue();
                    return n * n;
                })
                .register("math", "negate", args -> -((Number) args.get(0)).intValue());

        RemoteModule math = registry.resolve("math");
        assertEquals(Set.of("square", "negate"), math.functionNames());
        assertEquals(16, registry.function("math", "square").invoke(List.of(4)));
        assertThrows(ModuleResolutionException.class, () -> registry.function("math", "cube"));
    }

    @Test
    @Timeout(2)
        // Ids without registrations go to the fallback resolver.
    void unknownIdsFallBackToClasses() throws Exception {
        ModuleRegistry registry = new ModuleRegistry();
        assertEquals("Hi, Ann", registry.function(WorkerFunctions.MODULE, "greet").invoke(List.of("Ann")));
    }

    @Test
    @Timeout(2)
    void laterRegistrationReplacesEarlier() throws Exception {
        ModuleRegistry registry = new ModuleRegistry()
                .register("m", "f", args -> "first")
                .register("m", "f", args -> "second");
        assertEquals("second", registry.function("m", "f").invoke(List.of()));
    }

    @Test
    @Timeout(5)
        // Thread contexts resolve through the configured registry.
    void threadContextsUseRegistry() {
        ModuleRegistry registry = new ModuleRegistry()
                .register("math", "square", args -> {
                    int n = ((Number) args.get(0)).intValue();
                    return n * n;
                });
        RuntimeConfig config = RuntimeConfig.builder().maxWorkers(1).moduleResolver(registry).build();
        try (ParallelRuntime rt = new ParallelRuntime(config)) {
            assertEquals(49, rt.<Integer>run("math", "square", 7).join());
        }
    }

    @Test
    @Timeout(2)
    void nullArgumentsRejected() {
        ModuleRegistry registry = new ModuleRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.register(null, "f", args -> null));
        assertThrows(IllegalArgumentException.class, () -> registry.register("m", "f", null));
        assertThrows(IllegalArgumentException.class, () -> new ModuleRegistry(null));
    }
}
