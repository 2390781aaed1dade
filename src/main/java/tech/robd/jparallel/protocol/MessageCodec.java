/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/protocol/MessageCodec.java
 description: One-line JSON codec for protocol messages exchanged with process contexts.
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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.error.ErrorRecord;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One-line JSON form of {@link ProtocolMessage}s, used between the host and worker processes.
 *
 * <p>Wire values that JSON cannot express are written as tagged objects:
 * {@code {"@@type":"Error", ...}} for {@link ErrorRecord}s,
 * {@code {"@@type":"Channel","@@id":n,"capacity":c}} for {@link ChannelRef}s and
 * {@code {"@@type":"Bytes","base64":"..."}} for binary buffers. Records and other beans are
 * written through Jackson and arrive as maps.</p>
 *
 * <p>{@code return} and {@code throw} name both a generator request and a reply, so decoding
 * needs the {@link Direction} the line travelled in.</p>
 */
public final class MessageCodec {

    public enum Direction {
        TO_WORKER,
        TO_HOST
    }

    private static final String TAG = "@@type";
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private MessageCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    // 🧩 Section: write

    public static @NonNull String encode(@NonNull ProtocolMessage message) {
        ObjectNode node = NODES.objectNode();
        node.put("type", message.type());
        message.accept(new MessageVisitor<Void>() {
            @Override
            public Void visitReady(Ready m) {
                return null;
            }

            @Override
            public Void visitCall(CallMessage m) {
                node.put("taskId", m.taskId());
                node.put("module", m.module());
                node.put("fn", m.fn());
                ArrayNode args = node.putArray("args");
                for (Object a : m.args()) args.add(toNode(a));
                return null;
            }

            @Override
            public Void visitGeneratorRequest(GeneratorRequest m) {
                node.put("taskId", m.taskId());
                node.set("value", toNode(m.value()));
                return null;
            }

            @Override
            public Void visitReturn(ReturnMessage m) {
                node.put("taskId", m.taskId());
                node.set("value", toNode(m.value()));
                return null;
            }

            @Override
            public Void visitYield(YieldMessage m) {
                node.put("taskId", m.taskId());
                node.set("value", toNode(m.value()));
                node.put("done", m.done());
                return null;
            }

            @Override
            public Void visitError(ErrorMessage m) {
                node.put("taskId", m.taskId());
                node.set("error", toNode(m.error()));
                return null;
            }

            @Override
            public Void visitGeneratorAck(GeneratorAck m) {
                node.put("taskId", m.taskId());
                return null;
            }

            @Override
            public Void visitChannel(ChannelMessage m) {
                node.put("channelId", m.channelId());
                node.set("value", toNode(m.value()));
                return null;
            }
        });
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + message.type() + " message", e);
        }
    }

    static JsonNode toNode(@Nullable Object value) {
        if (value == null) return NODES.nullNode();
        if (value instanceof ErrorRecord record) {
            ObjectNode n = MAPPER.valueToTree(record);
            n.put(TAG, "Error");
            return n;
        }
        if (value instanceof ChannelRef ref) {
            ObjectNode n = NODES.objectNode();
            n.put(TAG, "Channel");
            n.put("@@id", ref.id());
            n.put("capacity", ref.capacity());
            return n;
        }
        if (value instanceof byte[] bytes) return bytesNode(bytes);
        if (value instanceof ByteBuffer buf) {
            ByteBuffer view = buf.duplicate();
            byte[] bytes = new byte[view.remaining()];
            view.get(bytes);
            return bytesNode(bytes);
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode n = NODES.objectNode();
            map.forEach((k, v) -> n.set(String.valueOf(k), toNode(v)));
            return n;
        }
        if (value instanceof Collection<?> c) {
            ArrayNode n = NODES.arrayNode();
            for (Object o : c) n.add(toNode(o));
            return n;
        }
        if (value instanceof Enum<?> e) return NODES.textNode(e.name());
        return MAPPER.valueToTree(value);
    }

    private static JsonNode bytesNode(byte[] bytes) {
        ObjectNode n = NODES.objectNode();
        n.put(TAG, "Bytes");
        n.put("base64", Base64.getEncoder().encodeToString(bytes));
        return n;
    }
    // [/🧩 Section: write]

    // 🧩 Section: read

    /**
     * @throws IllegalArgumentException if the line is not a protocol message
     */
    public static @NonNull ProtocolMessage decode(@NonNull String line, @NonNull Direction direction) {
        JsonNode node;
        try {
            node = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed protocol line", e);
        }
        if (node == null || !node.isObject() || !node.hasNonNull("type")) {
            throw new IllegalArgumentException("Not a protocol message: " + line);
        }
        String type = node.get("type").asText();
        long taskId = node.path("taskId").asLong();

        ChannelMessage.Op op = ChannelMessage.Op.fromWire(type);
        if (op != null) return new ChannelMessage(op, node.path("channelId").asLong(), fromNode(node.get("value")));

        if (direction == Direction.TO_WORKER) {
            if (CallMessage.TYPE.equals(type)) {
                List<@Nullable Object> args = new ArrayList<>();
                for (JsonNode a : node.path("args")) args.add(fromNode(a));
                return new CallMessage(taskId, node.path("module").asText(), node.path("fn").asText(), args, List.of());
            }
            GeneratorRequest.Kind kind = GeneratorRequest.Kind.fromWire(type);
            if (kind != null) return new GeneratorRequest(taskId, kind, fromNode(node.get("value")));
        } else {
            switch (type) {
                case Ready.TYPE:
                    return new Ready();
                case ReturnMessage.TYPE:
                    return new ReturnMessage(taskId, fromNode(node.get("value")));
                case YieldMessage.TYPE:
                    return new YieldMessage(taskId, fromNode(node.get("value")), node.path("done").asBoolean());
                case ErrorMessage.TYPE:
                    return new ErrorMessage(taskId, toErrorRecord(node.get("error")));
                case GeneratorAck.TYPE:
                    return new GeneratorAck(taskId);
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Unknown " + direction + " message type: " + type);
    }

    static @Nullable Object fromNode(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isTextual()) return node.textValue();
        if (node.isBoolean()) return node.booleanValue();
        if (node.isNumber()) return node.numberValue();
        if (node.isArray()) {
            List<@Nullable Object> list = new ArrayList<>(node.size());
            for (JsonNode n : node) list.add(fromNode(n));
            return list;
        }
        if (node.isObject()) {
            String tag = node.path(TAG).asText(null);
            if ("Error".equals(tag)) return toErrorRecord(node);
            if ("Channel".equals(tag)) return new ChannelRef(node.path("@@id").asLong(), node.path("capacity").asInt());
            if ("Bytes".equals(tag)) return Base64.getDecoder().decode(node.path("base64").asText());
            Map<String, @Nullable Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                map.put(f.getKey(), fromNode(f.getValue()));
            }
            return map;
        }
        if (node.isBinary()) return MAPPER.convertValue(node, byte[].class);
        return node.asText();
    }

    private static ErrorRecord toErrorRecord(@Nullable JsonNode node) {
        if (node == null || !node.isObject()) {
            return new ErrorRecord(RuntimeException.class.getName(), "Error", "Malformed error payload",
                    List.of(), null, Map.of(), List.of());
        }
        try {
            return MAPPER.treeToValue(node, ErrorRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed error record", e);
        }
    }
    // [/🧩 Section: read]
}
