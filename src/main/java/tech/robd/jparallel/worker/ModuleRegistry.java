/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/ModuleRegistry.java
 description: Modules assembled from functions registered in code.
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.diagnostics.Diagnostics;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Modules assembled from functions registered in code. Ids without registered functions are
 * passed to a fallback resolver (by default {@link ClassModuleResolver}).
 *
 * <p>Registered functions live in the host JVM, so they are only visible to thread contexts.</p>
 */
public final class ModuleRegistry implements ModuleResolver {
    private static final Diagnostics DIAG = Diagnostics.of(ModuleRegistry.class);

    private final ConcurrentMap<String, ConcurrentMap<String, RemoteFunction>> modules = new ConcurrentHashMap<>();
    private final ModuleResolver fallback;

    public ModuleRegistry() {
        this(new ClassModuleResolver());
    }

    public ModuleRegistry(@NonNull ModuleResolver fallback) {
        if (fallback == null) throw new IllegalArgumentException("Fallback resolver cannot be null");
        this.fallback = fallback;
    }

    /**
     * Export {@code function} as {@code moduleId.fn}, replacing an earlier registration.
     */
    public @NonNull ModuleRegistry register(@NonNull String moduleId, @NonNull String fn, @NonNull RemoteFunction function) {
        if (moduleId == null || fn == null) throw new IllegalArgumentException("Module id and fn cannot be null");
        if (function == null) throw new IllegalArgumentException("Function cannot be null");
        modules.computeIfAbsent(moduleId, k -> new ConcurrentHashMap<>()).put(fn, function);
        DIAG.debug("registered {}.{}", moduleId, fn);
        return this;
    }

    @Override
    public @NonNull RemoteModule resolve(@NonNull String moduleId) {
        Map<String, RemoteFunction> functions = modules.get(moduleId);
        if (functions == null) return fallback.resolve(moduleId);
        return new RemoteModule() {
            @Override
            public @NonNull String id() {
                return moduleId;
            }

            @Override
            public @Nullable RemoteFunction function(@NonNull String name) {
                return functions.get(name);
            }

            @Override
            public @NonNull Set<String> functionNames() {
                return Set.copyOf(functions.keySet());
            }
        };
    }
}
