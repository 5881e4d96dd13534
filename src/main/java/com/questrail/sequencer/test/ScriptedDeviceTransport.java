package com.questrail.sequencer.test;

import com.questrail.sequencer.time.MonotonicClock;
import com.questrail.sequencer.time.SystemMonotonicClock;
import com.questrail.sequencer.transport.LineBufferedDeviceTransport;
import com.questrail.sequencer.transport.ResponseKeywords;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ScriptedDeviceTransport
 * -----------------------
 *
 * In-memory device for tests and demos. Records every command it is sent and
 * answers from a script.
 *
 * Replies are looked up by exact command text. Each command has a queue of
 * scripted replies; once the queue is empty the default reply applies. Replies
 * are delivered synchronously, before {@code send} returns.
 *
 * This class contains no timing of its own: a {@link Reply#silence()} simply
 * produces no line, and the caller's acknowledgement timeout decides.
 */
public final class ScriptedDeviceTransport extends LineBufferedDeviceTransport
{
    public enum ReplyKind { LINE, SILENCE, REFUSE }

    /**
     * One scripted reaction to a command.
     */
    public record Reply(ReplyKind kind, String line)
    {
        public Reply {
            Objects.requireNonNull(kind, "kind");
            if (kind == ReplyKind.LINE) {
                Objects.requireNonNull(line, "line");
            }
        }

        public static Reply ack() {
            return new Reply(ReplyKind.LINE, "complete");
        }

        public static Reply line(String line) {
            return new Reply(ReplyKind.LINE, line);
        }

        public static Reply error(String line) {
            return new Reply(ReplyKind.LINE, line);
        }

        public static Reply silence() {
            return new Reply(ReplyKind.SILENCE, null);
        }

        /**
         * The link rejects the write; {@code send} returns {@code false}.
         */
        public static Reply refuse() {
            return new Reply(ReplyKind.REFUSE, null);
        }
    }

    private final Object lock = new Object();
    private final List<String> sent = new ArrayList<>();
    private final Map<String, Deque<Reply>> script = new HashMap<>();
    private Reply defaultReply = Reply.ack();

    public ScriptedDeviceTransport() {
        this(ResponseKeywords.defaults(), SystemMonotonicClock.INSTANCE);
    }

    public ScriptedDeviceTransport(ResponseKeywords keywords, MonotonicClock clock) {
        super(keywords, clock);
    }

    /**
     * Queues replies for a command, used in order on successive sends.
     */
    public ScriptedDeviceTransport script(String command, Reply... replies) {
        Objects.requireNonNull(command, "command");
        synchronized (lock) {
            Deque<Reply> queue = script.computeIfAbsent(command, k -> new ArrayDeque<>());
            for (Reply r : replies) {
                queue.add(Objects.requireNonNull(r, "reply"));
            }
        }
        return this;
    }

    public ScriptedDeviceTransport defaultReply(Reply reply) {
        synchronized (lock) {
            this.defaultReply = Objects.requireNonNull(reply, "reply");
        }
        return this;
    }

    public List<String> sent() {
        synchronized (lock) {
            return List.copyOf(sent);
        }
    }

    @Override
    protected boolean write(String command) {
        Reply reply;
        synchronized (lock) {
            Deque<Reply> queue = script.get(command);
            reply = queue == null || queue.isEmpty() ? defaultReply : queue.poll();
            if (reply.kind() == ReplyKind.REFUSE) {
                return false;
            }
            sent.add(command);
        }
        if (reply.kind() == ReplyKind.LINE) {
            onLine(reply.line());
        }
        return true;
    }
}
