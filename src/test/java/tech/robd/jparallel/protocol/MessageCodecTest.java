/*
 [File Info]
 path: src/test/java/tech/robd/jparallel/protocol/MessageCodecTest.java
 description: JSON protocol codec tests.
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

import org.junit.jupiter.api.Test;
import tech.robd.jparallel.error.ErrorCodec;
import tech.robd.jparallel.error.ErrorRecord;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tech.robd.jparallel.protocol.MessageCodec.Direction.TO_HOST;
import static tech.robd.jparallel.protocol.MessageCodec.Direction.TO_WORKER;

final class MessageCodecTest {

    @Test
        // One line per message, type tag first-class.
    void callIsSingleLineJson() {
        String line = MessageCodec.encode(new CallMessage(7, "com.example.Words", "greet", List.of("World"), List.of()));
        assertFalse(line.contains("\n"));
        assertTrue(line.contains("\"type\":\"call\""));

        CallMessage decoded = assertInstanceOf(CallMessage.class, MessageCodec.decode(line, TO_WORKER));
        assertEquals(7, decoded.taskId());
        assertEquals("com.example.Words", decoded.module());
        assertEquals("greet", decoded.fn());
        assertEquals(List.of("World"), decoded.args());
        assertTrue(decoded.transfer().isEmpty());
    }

    @Test
        // "return" and "throw" are both requests and replies; the direction decides.
    void directionDisambiguatesReturn() {
        String request = MessageCodec.encode(new GeneratorRequest(3, GeneratorRequest.Kind.RETURN, "early"));
        GeneratorRequest req = assertInstanceOf(GeneratorRequest.class, MessageCodec.decode(request, TO_WORKER));
        assertEquals(GeneratorRequest.Kind.RETURN, req.kind());
        assertEquals("early", req.value());

        String reply = MessageCodec.encode(new ReturnMessage(3, "value"));
        ReturnMessage ret = assertInstanceOf(ReturnMessage.class, MessageCodec.decode(reply, TO_HOST));
        assertEquals(3, ret.taskId());
        assertEquals("value", ret.value());
    }

    @Test
    void hostBoundMessagesDecode() {
        assertInstanceOf(Ready.class, MessageCodec.decode(MessageCodec.encode(new Ready()), TO_HOST));

        YieldMessage y = assertInstanceOf(YieldMessage.class,
                MessageCodec.decode(MessageCodec.encode(new YieldMessage(5, 42, true)), TO_HOST));
        assertEquals(42, y.value());
        assertTrue(y.done());

        GeneratorAck ack = assertInstanceOf(GeneratorAck.class,
                MessageCodec.decode(MessageCodec.encode(new GeneratorAck(9)), TO_HOST));
        assertEquals(9, ack.taskId());
    }

    @Test
        // Errors travel as tagged records and decode to the registered exception type.
    void errorMessageCarriesRecord() {
        ErrorRecord record = ErrorCodec.toObject(new IllegalStateException("broken", new ArithmeticException("/ by zero")));
        String line = MessageCodec.encode(new ErrorMessage(11, record));

        ErrorMessage decoded = assertInstanceOf(ErrorMessage.class, MessageCodec.decode(line, TO_HOST));
        assertEquals(record.kind(), decoded.error().kind());
        assertEquals("broken", decoded.error().message());
        assertEquals(record.stack().size(), decoded.error().stack().size());

        Throwable error = ErrorCodec.fromObject(decoded.error());
        assertInstanceOf(IllegalStateException.class, error);
        assertInstanceOf(ArithmeticException.class, error.getCause());
    }

    @Test
        // Error values nested in a return value are tagged and rebuilt as records.
    void nestedErrorValueIsTagged() {
        ErrorRecord record = ErrorCodec.toObject(new IllegalArgumentException("inner"));
        String line = MessageCodec.encode(new ReturnMessage(1, List.of("ok", record)));
        assertTrue(line.contains("\"@@type\":\"Error\""));

        ReturnMessage decoded = (ReturnMessage) MessageCodec.decode(line, TO_HOST);
        List<?> values = assertInstanceOf(List.class, decoded.value());
        assertEquals("ok", values.get(0));
        ErrorRecord back = assertInstanceOf(ErrorRecord.class, values.get(1));
        assertEquals("inner", back.message());
    }

    @Test
    void channelReferencesAndMessages() {
        String call = MessageCodec.encode(new CallMessage(2, "m", "f", List.of(new ChannelRef(17, 4)), List.of()));
        CallMessage decoded = (CallMessage) MessageCodec.decode(call, TO_WORKER);
        assertEquals(new ChannelRef(17, 4), decoded.args().get(0));

        String push = MessageCodec.encode(new ChannelMessage(ChannelMessage.Op.PUSH, 17, Map.of("value", 2)));
        ChannelMessage p = assertInstanceOf(ChannelMessage.class, MessageCodec.decode(push, TO_HOST));
        assertEquals(ChannelMessage.Op.PUSH, p.op());
        assertEquals(17, p.channelId());
        assertEquals(Map.of("value", 2), p.value());

        String close = MessageCodec.encode(new ChannelMessage(ChannelMessage.Op.CLOSE, 17, null));
        ChannelMessage c = assertInstanceOf(ChannelMessage.class, MessageCodec.decode(close, TO_WORKER));
        assertEquals(ChannelMessage.Op.CLOSE, c.op());
        assertNull(c.value());
    }

    @Test
        // Binary buffers are base64-tagged and come back as byte arrays.
    void bytesAreTagged() {
        byte[] data = {0, 1, 2, 3, (byte) 255};
        String line = MessageCodec.encode(new CallMessage(4, "m", "f",
                Arrays.asList(data, ByteBuffer.wrap(new byte[]{9, 8})), List.of()));
        assertTrue(line.contains("\"@@type\":\"Bytes\""));

        CallMessage decoded = (CallMessage) MessageCodec.decode(line, TO_WORKER);
        assertArrayEquals(data, (byte[]) decoded.args().get(0));
        assertArrayEquals(new byte[]{9, 8}, (byte[]) decoded.args().get(1));
    }

    record Point(int x, int y) {
    }

    @Test
        // Records have no JSON form of their own and arrive as maps.
    void recordsArriveAsMaps() {
        String line = MessageCodec.encode(new ReturnMessage(6, new Point(1, 2)));
        ReturnMessage decoded = (ReturnMessage) MessageCodec.decode(line, TO_HOST);
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("x", 1);
        expected.put("y", 2);
        assertEquals(expected, decoded.value());
    }

    @Test
    void malformedLinesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> MessageCodec.decode("{not json", TO_HOST));
        assertThrows(IllegalArgumentException.class, () -> MessageCodec.decode("[1,2]", TO_HOST));
        assertThrows(IllegalArgumentException.class, () -> MessageCodec.decode("{\"type\":\"bogus\"}", TO_HOST));
        // a call is never sent to the host
        assertThrows(IllegalArgumentException.class, () -> MessageCodec.decode(
                MessageCodec.encode(new CallMessage(1, "m", "f", List.of(), List.of())), TO_HOST));
    }
}
