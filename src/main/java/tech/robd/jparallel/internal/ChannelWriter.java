/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/internal/ChannelWriter.java
 description: Sink for channel operations bound for the other side.
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
package tech.robd.jparallel.internal;

import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.protocol.ChannelMessage;

/**
 * Forwards operations on a channel that has been handed to a worker context to the other side.
 */
@FunctionalInterface
public interface ChannelWriter {

    /**
     * @param op        push or close
     * @param channelId id of the channel on both sides
     * @param value     pushed value, or the close error (may be {@code null})
     */
    void write(ChannelMessage.Op op, long channelId, @Nullable Object value);
}
