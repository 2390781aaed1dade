/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/ModuleResolver.java
 description: Maps module ids to modules inside a worker context.
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
import tech.robd.jparallel.error.ModuleResolutionException;

/**
 * Maps module ids to modules inside a worker context.
 */
@FunctionalInterface
public interface ModuleResolver {

    /**
     * @throws ModuleResolutionException if no module has that id
     */
    @NonNull RemoteModule resolve(@NonNull String moduleId);

    /**
     * Resolve {@code fn} of {@code moduleId}.
     *
     * @throws ModuleResolutionException if the module or the function does not exist
     */
    default @NonNull RemoteFunction function(@NonNull String moduleId, @NonNull String fn) {
        RemoteFunction f = resolve(moduleId).function(fn);
        if (f == null) {
            throw new ModuleResolutionException(
                    "Function '" + fn + "' is not exported by module '" + moduleId + "'");
        }
        return f;
    }
}
