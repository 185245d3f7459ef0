package com.phillippitts.spoofstream.testutil;

import com.phillippitts.spoofstream.exception.TransportFailureException;
import com.phillippitts.spoofstream.service.session.MessageSink;
import org.json.JSONObject;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MessageSink that keeps every outbound frame in memory.
 */
public class RecordingMessageSink implements MessageSink {

    public final List<String> frames = new CopyOnWriteArrayList<>();
    public final AtomicInteger closeCount = new AtomicInteger();
    public volatile String closeReason;
    public volatile boolean failSends = false;
    private volatile boolean open = true;

    @Override
    public void send(String text) {
        if (failSends) {
            throw new TransportFailureException(null, "Simulated write failure", null);
        }
        frames.add(text);
    }

    @Override
    public void close(String reason) {
        closeCount.incrementAndGet();
        closeReason = reason;
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public List<JSONObject> messages() {
        return frames.stream().map(JSONObject::new).toList();
    }

    public List<JSONObject> messagesOfType(String type) {
        return messages().stream().filter(m -> type.equals(m.optString("type"))).toList();
    }

    public JSONObject last() {
        return new JSONObject(frames.get(frames.size() - 1));
    }

    public void clear() {
        frames.clear();
    }
}
