/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/pool/PoolHandler.java
 description: Runtime callbacks for pool messages and lost contexts.
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
package tech.robd.jparallel.pool;

import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.protocol.ProtocolMessage;

import java.util.Set;

/**
 * Receives what the pool does not handle itself.
 */
public interface PoolHandler {

    /**
     * A message other than {@code ready} from a live context.
     */
    void onMessage(PoolRecord record, ProtocolMessage message);

    /**
     * A context exited or failed while tasks were attached. {@code error} is {@code null} for a
     * clean exit.
     */
    void onContextLost(PoolRecord record, Set<Long> taskIds, @Nullable Throwable error);
}
