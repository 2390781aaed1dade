/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/protocol/YieldMessage.java
 description: Protocol message carrying one generator step.
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

import org.jspecify.annotations.Nullable;

/**
 * {@code {type:"yield", taskId, value, done}}. A {@code done} yield carries the generator's
 * return value and ends the task.
 */
public record YieldMessage(long taskId, @Nullable Object value, boolean done) implements ProtocolMessage, TaskMessage {
    public static final String TYPE = "yield";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public <R> R accept(MessageVisitor<R> visitor) {
        return visitor.visitYield(this);
    }
}
