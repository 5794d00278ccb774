package com.questrail.dbus.handler;

import com.questrail.dbus.model.Message;
import com.questrail.dbus.model.MessageType;
import com.questrail.dbus.model.Signature;

import java.util.Objects;

/**
 * One entry in a {@link DBusHandler} table.
 *
 * <p>{@code interfaceName}, {@code path} and {@code replySignature} are
 * optional; an absent interface or path matches anything.</p>
 *
 * @param kind           whether this answers method calls or observes signals
 * @param member         member name, looked up exactly
 * @param interfaceName  required interface, or {@code null}
 * @param path           object-path pattern, or {@code null}
 * @param replySignature signature of the method return, or {@code null} for
 *                       an empty return; unused for signals
 * @param handler        callback
 */
public record HandlerRegistration(
        Kind kind,
        String member,
        String interfaceName,
        PathPattern path,
        String replySignature,
        MessageHandler handler
) {
    public enum Kind { METHOD, SIGNAL }

    public HandlerRegistration {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(member, "member");
        Objects.requireNonNull(handler, "handler");
        if (member.isEmpty()) {
            throw new IllegalArgumentException("member must not be empty");
        }
        if (replySignature != null) {
            if (kind == Kind.SIGNAL) {
                throw new IllegalArgumentException("signal handlers have no reply signature");
            }
            Signature.parse(replySignature);
        }
    }

    /**
     * @return whether this registration accepts {@code message}; the member
     *         is assumed to have matched already
     */
    public boolean matches(Message message) {
        MessageType expected = kind == Kind.METHOD ? MessageType.METHOD_CALL : MessageType.SIGNAL;
        if (message.type() != expected) {
            return false;
        }
        if (interfaceName != null && !interfaceName.equals(message.interfaceName())) {
            return false;
        }
        return path == null || path.matches(message.path());
    }

    public static Builder method(String member) {
        return new Builder(Kind.METHOD, member);
    }

    public static Builder signal(String member) {
        return new Builder(Kind.SIGNAL, member);
    }

    public static final class Builder {
        private final Kind kind;
        private final String member;
        private String interfaceName;
        private PathPattern path;
        private String replySignature;

        private Builder(Kind kind, String member) {
            this.kind = kind;
            this.member = member;
        }

        public Builder interfaceName(String interfaceName) {
            this.interfaceName = interfaceName;
            return this;
        }

        /**
         * @param glob exact object path or glob, see {@link PathPattern}
         */
        public Builder path(String glob) {
            this.path = glob == null ? null : PathPattern.compile(glob);
            return this;
        }

        public Builder replySignature(String replySignature) {
            this.replySignature = replySignature;
            return this;
        }

        public HandlerRegistration handledBy(MessageHandler handler) {
            return new HandlerRegistration(kind, member, interfaceName, path, replySignature, handler);
        }
    }
}
