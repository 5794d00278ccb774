package com.questrail.dbus.model;

import java.util.Objects;

/**
 * A value tagged with its own single complete type signature ({@code v}).
 */
public record Variant(String signature, Object value) {
    public Variant {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(value, "value");
    }
}
