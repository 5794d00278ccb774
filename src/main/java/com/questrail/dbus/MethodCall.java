package com.questrail.dbus;

import com.questrail.dbus.model.Message;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An outgoing method call, described independently of how it is sent.
 *
 * @param destination   bus name of the callee
 * @param path          object path
 * @param member        method name
 * @param interfaceName interface, or {@code null}
 * @param signature     argument signature, empty for none
 * @param args          argument values matching {@code signature}
 * @param timeout       reply timeout, or {@code null} for the connection default
 */
public record MethodCall(
        String destination,
        String path,
        String member,
        String interfaceName,
        String signature,
        List<Object> args,
        Duration timeout
) {
    public MethodCall {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(member, "member");
        signature = signature == null ? "" : signature;
        args = args == null ? List.of() : List.copyOf(args);
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static Builder to(String destination, String path, String member) {
        return new Builder(destination, path, member);
    }

    /**
     * @throws com.questrail.dbus.model.DBusException if the arguments do not
     *         match the signature
     */
    public Message toMessage(boolean noReply) {
        return Message.methodCall(path, member)
                .interfaceName(interfaceName)
                .destination(destination)
                .noReply(noReply)
                .args(signature, args)
                .build();
    }

    public static final class Builder {
        private final String destination;
        private final String path;
        private final String member;
        private String interfaceName;
        private String signature = "";
        private List<Object> args = List.of();
        private Duration timeout;

        private Builder(String destination, String path, String member) {
            this.destination = destination;
            this.path = path;
            this.member = member;
        }

        public Builder interfaceName(String interfaceName) {
            this.interfaceName = interfaceName;
            return this;
        }

        public Builder args(String signature, Object... args) {
            return args(signature, Arrays.asList(args));
        }

        public Builder args(String signature, List<?> args) {
            this.signature = signature;
            this.args = List.copyOf(args);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public MethodCall build() {
            return new MethodCall(destination, path, member, interfaceName, signature, args, timeout);
        }
    }
}
