/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/protocol/ErrorMessage.java
 description: Protocol message failing a call.
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
import tech.robd.jparallel.error.ErrorRecord;

/**
 * {@code {type:"error", taskId, error}}.
 */
public record ErrorMessage(long taskId, @NonNull ErrorRecord error) implements ProtocolMessage, TaskMessage {
    public static final String TYPE = "error";

    public ErrorMessage {
        if (error == null) throw new IllegalArgumentException("Error cannot be null");
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public <R> R accept(MessageVisitor<R> visitor) {
        return visitor.visitError(this);
    }
}
