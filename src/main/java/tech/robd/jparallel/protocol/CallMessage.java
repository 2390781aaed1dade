/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/protocol/CallMessage.java
 description: Protocol message starting a call.
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

import java.util.List;

/**
 * {@code {type:"call", taskId, module, fn, args}}.
 *
 * @param taskId   correlation id
 * @param module   module id, resolved by the worker's module resolver
 * @param fn       exported function name
 * @param args     encoded arguments ({@link WireValues#encode})
 * @param transfer binary buffers among {@code args} handed over without copying
 */
public record CallMessage(long taskId,
                          @NonNull String module,
                          @NonNull String fn,
                          @NonNull List<@Nullable Object> args,
                          @NonNull List<Object> transfer) implements ProtocolMessage, TaskMessage {
    public static final String TYPE = "call";

    public CallMessage {
        if (module == null || fn == null) throw new IllegalArgumentException("Module and fn cannot be null");
        args = args == null ? List.of() : args;
        transfer = transfer == null ? List.of() : transfer;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public <R> R accept(MessageVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
