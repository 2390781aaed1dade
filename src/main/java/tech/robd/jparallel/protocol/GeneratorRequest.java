/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/protocol/GeneratorRequest.java
 description: Protocol message driving a generator: next, return or throw.
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
 * Drives a remote generator one step: {@code {type: next|return|throw, taskId, value}}.
 */
public record GeneratorRequest(long taskId, @NonNull Kind kind, @Nullable Object value)
        implements ProtocolMessage, TaskMessage {

    public enum Kind {
        NEXT("next"),
        RETURN("return"),
        THROW("throw");

        private final String wire;

        Kind(String wire) {
            this.wire = wire;
        }

        public String wire() {
            return wire;
        }

        public static @Nullable Kind fromWire(String type) {
            for (Kind k : values()) {
                if (k.wire.equals(type)) return k;
            }
            return null;
        }
    }

    public GeneratorRequest {
        if (kind == null) throw new IllegalArgumentException("Kind cannot be null");
    }

    @Override
    public String type() {
        return kind.wire();
    }

    @Override
    public <R> R accept(MessageVisitor<R> visitor) {
        return visitor.visitGeneratorRequest(this);
    }
}
