/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/RemoteModule.java
 description: Exported functions of one module.
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

import java.util.Set;

/**
 * Exported functions of one module.
 */
public interface RemoteModule {

    String DEFAULT_FUNCTION = "default";

    @NonNull String id();

    /**
     * @return the function, or {@code null} if the module does not export {@code name}
     */
    @Nullable RemoteFunction function(@NonNull String name);

    @NonNull Set<String> functionNames();
}
