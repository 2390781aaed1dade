/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/pool/ContextListener.java
 description: Callbacks a worker context reports readiness, messages, errors and exit through.
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
 * Events of one worker context, delivered on a single thread per context in the order the
 * context produced them.
 */
public interface ContextListener {

    void onMessage(ProtocolMessage message);

    /**
     * Fatal error of the context; an {@link #onExit(int)} may or may not follow.
     */
    void onError(Throwable error);

    void onExit(int exitCode);
}
