/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/protocol/ProtocolMessage.java
 description: Base type of the host/worker protocol messages.
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
package tech.robd.jparallel.protocol;

import org.jspecify.annotations.NonNull;

/**
 * Every message exchanged between the host and a worker context.
 *
 * <p>Host to worker: {@link CallMessage}, {@link GeneratorRequest}, {@link ChannelMessage}.
 * Worker to host: {@link Ready}, {@link ReturnMessage}, {@link YieldMessage},
 * {@link ErrorMessage}, {@link GeneratorAck}, {@link ChannelMessage}.</p>
 *
 * <p>Dispatch goes through {@link #accept(MessageVisitor)}; adding a message type breaks every
 * visitor at compile time.</p>
 */
public sealed interface ProtocolMessage
        permits Ready, CallMessage, GeneratorRequest, ReturnMessage, YieldMessage, ErrorMessage,
        GeneratorAck, ChannelMessage {

    /**
     * @return the {@code type} tag written on the wire
     */
    @NonNull String type();

    <R> R accept(@NonNull MessageVisitor<R> visitor);
}
