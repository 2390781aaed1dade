/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/RemoteFunction.java
 description: A function exported by a module.
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

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A function exported by a module. May return a plain value, a
 * {@link java.util.concurrent.CompletionStage} or a {@link Generator}.
 */
@FunctionalInterface
public interface RemoteFunction {
    @Nullable Object invoke(List<@Nullable Object> args) throws Exception;
}
