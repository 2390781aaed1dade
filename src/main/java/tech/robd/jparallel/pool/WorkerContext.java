/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/pool/WorkerContext.java
 description: A running worker context the pool sends messages to.
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

import tech.robd.jparallel.protocol.ProtocolMessage;

/**
 * Handle of a spawned worker context.
 */
public interface WorkerContext {

    /**
     * Post a message to the context. Messages to a terminated context are dropped.
     */
    void send(ProtocolMessage message);

    /**
     * Stop the context without waiting for running work. Best effort and idempotent.
     */
    void terminate();

    /**
     * @return a short description for logs, such as the thread name or process id
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
