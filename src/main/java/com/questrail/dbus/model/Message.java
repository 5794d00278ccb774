package com.questrail.dbus.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Message
 * =============================================================================
 * Immutable bus message: a method call, method return, error or signal.
 *
 * <h2>Construction</h2>
 * Messages are assembled with the kind-specific builders
 * ({@link #methodCall}, {@link #methodReturn}, {@link #error}, {@link #signal}).
 * Arguments are validated against their signature when set on the builder,
 * so a built message always carries a payload consistent with
 * {@link #signature()}.
 *
 * <h2>Correlation</h2>
 * The transport stamps {@link #serial()} when the message is sent. Replies
 * carry the serial of the call they answer in {@link #replySerial()}; zero
 * means "not set" for both.
 *
 * <p>The argument list is unmodifiable; nested containers are shared with
 * the producer and must be treated as read-only.</p>
 */
public final class Message
{
    private final MessageType type;
    private final String path;
    private final String interfaceName;
    private final String member;
    private final String sender;
    private final String destination;
    private final String errorName;
    private final long serial;
    private final long replySerial;
    private final boolean noReply;
    private final Signature signature;
    private final List<Object> args;

    private Message(Builder b) {
        this.type = b.type;
        this.path = b.path;
        this.interfaceName = b.interfaceName;
        this.member = b.member;
        this.sender = b.sender;
        this.destination = b.destination;
        this.errorName = b.errorName;
        this.serial = b.serial;
        this.replySerial = b.replySerial;
        this.noReply = b.noReply;
        this.signature = b.signature;
        this.args = b.args;
    }

    // -------------------------------------------------------------------------
    // Builders
    // -------------------------------------------------------------------------

    public static Builder methodCall(String path, String member) {
        Builder b = new Builder(MessageType.METHOD_CALL);
        b.path = requirePath(path);
        b.member = Objects.requireNonNull(member, "member");
        return b;
    }

    public static Builder signal(String path, String interfaceName, String member) {
        Builder b = new Builder(MessageType.SIGNAL);
        b.path = requirePath(path);
        b.interfaceName = Objects.requireNonNull(interfaceName, "interfaceName");
        b.member = Objects.requireNonNull(member, "member");
        return b;
    }

    /**
     * Start a method return answering {@code call}; addressed to its sender.
     */
    public static Builder methodReturn(Message call) {
        return replyTo(MessageType.METHOD_RETURN, call);
    }

    /**
     * Start an error reply answering {@code call}; addressed to its sender.
     */
    public static Builder error(Message call, String errorName) {
        Builder b = replyTo(MessageType.ERROR, call);
        b.errorName = Objects.requireNonNull(errorName, "errorName");
        return b;
    }

    /**
     * Start an error that correlates to {@code replySerial} without the
     * original call at hand (used for synthesized timeouts and bus errors).
     */
    public static Builder error(long replySerial, String errorName) {
        Builder b = new Builder(MessageType.ERROR);
        b.replySerial = replySerial;
        b.errorName = Objects.requireNonNull(errorName, "errorName");
        return b;
    }

    private static Builder replyTo(MessageType type, Message call) {
        Objects.requireNonNull(call, "call");
        if (call.type != MessageType.METHOD_CALL) {
            throw new IllegalArgumentException("can only reply to a method call, not " + call.type);
        }
        Builder b = new Builder(type);
        b.replySerial = call.serial;
        b.destination = call.sender;
        return b;
    }

    private static String requirePath(String path) {
        Objects.requireNonNull(path, "path");
        Signature.parse("o").validate(List.of(path));
        return path;
    }

    // -------------------------------------------------------------------------
    // Transport stamping
    // -------------------------------------------------------------------------

    public Message withSerial(long newSerial) {
        Builder b = toBuilder();
        b.serial = newSerial;
        return new Message(b);
    }

    public Message withSender(String newSender) {
        Builder b = toBuilder();
        b.sender = newSender;
        return new Message(b);
    }

    private Builder toBuilder() {
        Builder b = new Builder(type);
        b.path = path;
        b.interfaceName = interfaceName;
        b.member = member;
        b.sender = sender;
        b.destination = destination;
        b.errorName = errorName;
        b.serial = serial;
        b.replySerial = replySerial;
        b.noReply = noReply;
        b.signature = signature;
        b.args = args;
        return b;
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public MessageType type() {
        return type;
    }

    public String path() {
        return path;
    }

    public String interfaceName() {
        return interfaceName;
    }

    public String member() {
        return member;
    }

    public String sender() {
        return sender;
    }

    public String destination() {
        return destination;
    }

    /**
     * @return the symbolic error name, or {@code null} unless this is an
     *         {@link MessageType#ERROR} message
     */
    public String errorName() {
        return errorName;
    }

    public long serial() {
        return serial;
    }

    public long replySerial() {
        return replySerial;
    }

    /**
     * @return {@code true} if the caller asked for no reply (fire-and-forget)
     */
    public boolean isNoReply() {
        return noReply;
    }

    public String signature() {
        return signature.text();
    }

    public List<Object> args() {
        return args;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Message{").append(type);
        if (serial != 0) {
            sb.append(" serial=").append(serial);
        }
        if (replySerial != 0) {
            sb.append(" replySerial=").append(replySerial);
        }
        if (path != null) {
            sb.append(" path=").append(path);
        }
        if (interfaceName != null) {
            sb.append(" interface=").append(interfaceName);
        }
        if (member != null) {
            sb.append(" member=").append(member);
        }
        if (errorName != null) {
            sb.append(" error=").append(errorName);
        }
        if (sender != null) {
            sb.append(" sender=").append(sender);
        }
        if (destination != null) {
            sb.append(" destination=").append(destination);
        }
        if (!signature.isEmpty()) {
            sb.append(" signature=").append(signature);
        }
        return sb.append('}').toString();
    }

    /**
     * Builder
     * -------------------------------------------------------------------------
     * Mutable assembly stage for a {@link Message}. Obtained from the static
     * factories on {@code Message}.
     */
    public static final class Builder
    {
        private final MessageType type;
        private String path;
        private String interfaceName;
        private String member;
        private String sender;
        private String destination;
        private String errorName;
        private long serial;
        private long replySerial;
        private boolean noReply;
        private Signature signature = Signature.EMPTY;
        private List<Object> args = List.of();

        private Builder(MessageType type) {
            this.type = type;
        }

        public Builder interfaceName(String interfaceName) {
            this.interfaceName = interfaceName;
            return this;
        }

        public Builder destination(String destination) {
            this.destination = destination;
            return this;
        }

        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        public Builder noReply(boolean noReply) {
            this.noReply = noReply;
            return this;
        }

        /**
         * Set the argument payload.
         *
         * @throws DBusException if the signature is malformed or the values do
         *         not match it
         */
        public Builder args(String signature, List<?> args) {
            Signature parsed = Signature.parse(signature);
            List<?> values = args == null ? List.of() : args;
            parsed.validate(values);
            this.signature = parsed;
            this.args = List.copyOf(values);
            return this;
        }

        public Builder args(String signature, Object... args) {
            return args(signature, Arrays.asList(args));
        }

        public Message build() {
            return new Message(this);
        }
    }
}
