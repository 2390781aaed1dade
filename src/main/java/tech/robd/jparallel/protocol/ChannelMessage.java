/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/protocol/ChannelMessage.java
 description: Protocol message carrying a channel operation.
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
import org.jspecify.annotations.Nullable;

/**
 * Operation on a channel that was passed as an argument:
 * {@code {type: push|close, channelId, value?}}. For {@code close} the value is the encoded close
 * error, or {@code null}.
 */
public record ChannelMessage(@NonNull Op op, long channelId, @Nullable Object value) implements ProtocolMessage {

    public enum Op {
        PUSH("push"),
        CLOSE("close");

        private final String wire;

        Op(String wire) {
            this.wire = wire;
        }

        public String wire() {
            return wire;
        }

        public static @Nullable Op fromWire(String type) {
            for (Op op : values()) {
                if (op.wire.equals(type)) return op;
            }
            return null;
        }
    }

    public ChannelMessage {
        if (op == null) throw new IllegalArgumentException("Op cannot be null");
    }

    @Override
    public String type() {
        return op.wire();
    }

    @Override
    public <R> R accept(MessageVisitor<R> visitor) {
        return visitor.visitChannel(this);
    }
}
