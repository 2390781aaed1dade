/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/internal/ChannelHub.java
 description: Per-side table of shared channels, mapping channel ids to local channels and writers.
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

import org.jspecify.annotations.NonNull;
import tech.robd.jparallel.Channel;
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.protocol.ChannelMessage;
import tech.robd.jparallel.protocol.ChannelRef;
import tech.robd.jparallel.protocol.WireValues;
import tech.robd.jparallel.task.MessageSink;

import java.util.ArrayList;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Channels shared across a worker boundary, by id.
 *
 * <p>On the host a channel passed as an argument gets one writer per call it was passed to.
 * In a context the channel is a proxy with a single writer back to the host. Inbound
 * {@code push} messages land in the local buffer; an inbound {@code close} closes the local
 * side and, on the host, is passed on to the other contexts sharing the channel.</p>
 */
public final class ChannelHub {
    private static final Diagnostics DIAG = Diagnostics.of(ChannelHub.class);

    private final boolean host;
    private final ConcurrentMap<Long, Channel<Object>> channels = new ConcurrentHashMap<>();

    public ChannelHub(boolean host) {
        this.host = host;
    }

    /**
     * Host side: register {@code channel} and route its later sends and close through {@code sink}.
     */
    @SuppressWarnings("unchecked")
    public @NonNull ChannelRef share(@NonNull Channel<?> channel, @NonNull MessageSink sink) {
        if (channel == null || sink == null) throw new IllegalArgumentException("Channel and sink cannot be null");
        if (channel.isClosed()) throw new IllegalStateException("Channel is closed");
        Channel<Object> ch = (Channel<Object>) channel;
        channels.putIfAbsent(ch.id(), ch);
        ch.attachWriter(writerTo(sink));
        DIAG.debug("ch#{} shared (hub size={})", ch.id(), channels.size());
        return new ChannelRef(ch.id(), ch.capacity());
    }

    /**
     * Context side: the local proxy for {@code ref}, created on first use with a writer to the host.
     */
    public @NonNull Channel<?> resolve(@NonNull ChannelRef ref, @NonNull MessageSink toHost) {
        return channels.computeIfAbsent(ref.id(), id -> {
            Channel<Object> proxy = Channel.proxy(id, ref.capacity());
            proxy.attachWriter(writerTo(toHost));
            return proxy;
        });
    }

    private ChannelWriter writerTo(MessageSink sink) {
        return (op, channelId, value) -> {
            if (op == ChannelMessage.Op.CLOSE) channels.remove(channelId);
            Object wire = WireValues.encode(value, WireValues.NO_CHANNELS, new ArrayList<>());
            sink.send(new ChannelMessage(op, channelId, wire));
        };
    }

    /**
     * Apply a channel message from the other side. Messages for unknown channels are dropped.
     */
    public void handle(@NonNull ChannelMessage message) {
        Channel<Object> ch = channels.get(message.channelId());
        if (ch == null) {
            DIAG.debug("ch#{} unknown, dropping {}", message.channelId(), message.type());
            return;
        }
        Object value = WireValues.decode(message.value(), WireValues.NO_CHANNEL_REFS);
        if (message.op() == ChannelMessage.Op.PUSH) {
            ch.deliver(value);
        } else {
            channels.remove(message.channelId(), ch);
            ch.closeFromRemote(value instanceof Throwable t ? t : null, host);
        }
    }

    public int size() {
        return channels.size();
    }
}
