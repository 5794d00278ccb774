package com.questrail.dbus.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Signature
 * =============================================================================
 * A parsed bus type signature and the validator that checks Java argument
 * values against it.
 *
 * <h2>Java value mapping</h2>
 * <ul>
 *   <li>{@code y n q i u x t}: {@code Byte}, {@code Short}, {@code Integer},
 *       {@code Long} or {@code BigInteger}, range-checked per type</li>
 *   <li>{@code b}: {@code Boolean}; {@code d}: {@code Double} or {@code Float}</li>
 *   <li>{@code s o g}: {@code String} (object paths and signatures are
 *       syntax-checked)</li>
 *   <li>{@code v}: {@link Variant}</li>
 *   <li>{@code a...}: {@code List}; {@code ay} also accepts {@code byte[]};
 *       {@code a{..}}: {@code Map}</li>
 *   <li>{@code (...)}: {@code List} with one element per member type</li>
 * </ul>
 *
 * <p>Values are checked, never converted: a valid argument list is carried by
 * the message exactly as given.</p>
 */
public final class Signature
{
    public static final int MAX_LENGTH = 255;
    public static final int MAX_DEPTH = 32;

    public static final Signature EMPTY = new Signature("", List.of());

    private static final String BASIC_TYPES = "ybnqiuxtdsog";
    private static final Pattern OBJECT_PATH = Pattern.compile("/|(/[A-Za-z0-9_]+)+");

    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final String text;
    private final List<String> types;

    private Signature(String text, List<String> types) {
        this.text = text;
        this.types = types;
    }

    /**
     * Parse a signature string into its complete types.
     *
     * @throws DBusException {@link ErrorNames#INVALID_SIGNATURE} if the text is
     *         not a valid signature
     */
    public static Signature parse(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        if (text.length() > MAX_LENGTH) {
            throw invalidSignature(text, "longer than " + MAX_LENGTH + " characters");
        }

        List<String> types = new ArrayList<>();
        int pos = 0;
        while (pos < text.length()) {
            int end = completeTypeEnd(text, pos, 0, 0);
            types.add(text.substring(pos, end));
            pos = end;
        }
        return new Signature(text, List.copyOf(types));
    }

    public String text() {
        return text;
    }

    /**
     * The single complete types in order, e.g. {@code "ia{sv}(ii)"} gives
     * {@code [i, a{sv}, (ii)]}.
     */
    public List<String> completeTypes() {
        return types;
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }

    /**
     * Check an argument list against this signature.
     *
     * @throws DBusException {@link ErrorNames#INVALID_ARGS} on an arity,
     *         type or range mismatch
     */
    public void validate(List<?> args) {
        Objects.requireNonNull(args, "args");
        if (args.size() != types.size()) {
            throw invalidArgs("signature '" + text + "' expects " + types.size()
                    + " argument(s), got " + args.size());
        }
        for (int i = 0; i < types.size(); i++) {
            validateValue(types.get(i), args.get(i));
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Signature && ((Signature) o).text.equals(text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }

    // -------------------------------------------------------------------------
    // Parsing
    // -------------------------------------------------------------------------

    private static int completeTypeEnd(String text, int pos, int arrayDepth, int structDepth) {
        if (pos >= text.length()) {
            throw invalidSignature(text, "truncated type");
        }

        char c = text.charAt(pos);
        if (BASIC_TYPES.indexOf(c) >= 0 || c == 'v') {
            return pos + 1;
        }

        switch (c) {
            case 'a': {
                if (arrayDepth + 1 > MAX_DEPTH) {
                    throw invalidSignature(text, "arrays nested deeper than " + MAX_DEPTH);
                }
                if (pos + 1 < text.length() && text.charAt(pos + 1) == '{') {
                    int keyPos = pos + 2;
                    if (keyPos >= text.length() || BASIC_TYPES.indexOf(text.charAt(keyPos)) < 0) {
                        throw invalidSignature(text, "dict entry key must be a basic type");
                    }
                    int valueEnd = completeTypeEnd(text, keyPos + 1, arrayDepth + 1, structDepth);
                    if (valueEnd >= text.length() || text.charAt(valueEnd) != '}') {
                        throw invalidSignature(text, "unterminated dict entry");
                    }
                    return valueEnd + 1;
                }
                return completeTypeEnd(text, pos + 1, arrayDepth + 1, structDepth);
            }
            case '(': {
                if (structDepth + 1 > MAX_DEPTH) {
                    throw invalidSignature(text, "structs nested deeper than " + MAX_DEPTH);
                }
                int p = pos + 1;
                if (p < text.length() && text.charAt(p) == ')') {
                    throw invalidSignature(text, "empty struct");
                }
                while (true) {
                    if (p >= text.length()) {
                        throw invalidSignature(text, "unterminated struct");
                    }
                    if (text.charAt(p) == ')') {
                        return p + 1;
                    }
                    p = completeTypeEnd(text, p, arrayDepth, structDepth + 1);
                }
            }
            default:
                throw invalidSignature(text, "unexpected '" + c + "' at position " + pos);
        }
    }

    // -------------------------------------------------------------------------
    // Value validation
    // -------------------------------------------------------------------------

    private static void validateValue(String type, Object value) {
        if (value == null) {
            throw invalidArgs("null value for type '" + type + "'");
        }

        switch (type.charAt(0)) {
            case 'y':
                checkRange(type, value, BigInteger.ZERO, BigInteger.valueOf(0xFF));
                break;
            case 'b':
                requireType(type, value, value instanceof Boolean);
                break;
            case 'n':
                checkRange(type, value, BigInteger.valueOf(Short.MIN_VALUE), BigInteger.valueOf(Short.MAX_VALUE));
                break;
            case 'q':
                checkRange(type, value, BigInteger.ZERO, BigInteger.valueOf(0xFFFF));
                break;
            case 'i':
                checkRange(type, value, BigInteger.valueOf(Integer.MIN_VALUE), BigInteger.valueOf(Integer.MAX_VALUE));
                break;
            case 'u':
                checkRange(type, value, BigInteger.ZERO, BigInteger.valueOf(0xFFFFFFFFL));
                break;
            case 'x':
                checkRange(type, value, BigInteger.valueOf(Long.MIN_VALUE), BigInteger.valueOf(Long.MAX_VALUE));
                break;
            case 't':
                checkRange(type, value, BigInteger.ZERO, UINT64_MAX);
                break;
            case 'd':
                requireType(type, value, value instanceof Double || value instanceof Float);
                break;
            case 's':
                requireType(type, value, value instanceof String);
                if (((String) value).indexOf('\0') >= 0) {
                    throw invalidArgs("string contains NUL");
                }
                break;
            case 'o':
                requireType(type, value, value instanceof String);
                if (!OBJECT_PATH.matcher((String) value).matches()) {
                    throw invalidArgs("invalid object path '" + value + "'");
                }
                break;
            case 'g':
                requireType(type, value, value instanceof String);
                try {
                    parse((String) value);
                } catch (DBusException e) {
                    throw new DBusException(ErrorNames.INVALID_ARGS, "invalid signature value '" + value + "'", e);
                }
                break;
            case 'v':
                validateVariant(value);
                break;
            case 'a':
                validateArray(type, value);
                break;
            case '(':
                validateStruct(type, value);
                break;
            default:
                throw new IllegalStateException("unparsed type '" + type + "'");
        }
    }

    private static void validateVariant(Object value) {
        requireType("v", value, value instanceof Variant);
        Variant variant = (Variant) value;
        Signature inner;
        try {
            inner = parse(variant.signature());
        } catch (DBusException e) {
            throw new DBusException(ErrorNames.INVALID_ARGS, "invalid variant signature '" + variant.signature() + "'", e);
        }
        if (inner.types.size() != 1) {
            throw invalidArgs("variant signature '" + variant.signature() + "' is not a single complete type");
        }
        validateValue(inner.types.get(0), variant.value());
    }

    private static void validateArray(String type, Object value) {
        if (type.charAt(1) == '{') {
            requireType(type, value, value instanceof Map);
            String keyType = type.substring(2, 3);
            String valueType = type.substring(3, type.length() - 1);
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                validateValue(keyType, entry.getKey());
                validateValue(valueType, entry.getValue());
            }
            return;
        }

        String elementType = type.substring(1);
        if (elementType.equals("y") && value instanceof byte[]) {
            return;
        }
        requireType(type, value, value instanceof List);
        for (Object element : (List<?>) value) {
            validateValue(elementType, element);
        }
    }

    private static void validateStruct(String type, Object value) {
        requireType(type, value, value instanceof List);
        List<String> memberTypes = parse(type.substring(1, type.length() - 1)).types;
        List<?> members = (List<?>) value;
        if (members.size() != memberTypes.size()) {
            throw invalidArgs("struct '" + type + "' expects " + memberTypes.size()
                    + " member(s), got " + members.size());
        }
        for (int i = 0; i < memberTypes.size(); i++) {
            validateValue(memberTypes.get(i), members.get(i));
        }
    }

    private static void checkRange(String type, Object value, BigInteger min, BigInteger max) {
        BigInteger v;
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            v = BigInteger.valueOf(((Number) value).longValue());
        } else if (value instanceof BigInteger) {
            v = (BigInteger) value;
        } else {
            throw mismatch(type, value);
        }
        if (v.compareTo(min) < 0 || v.compareTo(max) > 0) {
            throw invalidArgs("value " + v + " out of range for type '" + type + "'");
        }
    }

    private static void requireType(String type, Object value, boolean ok) {
        if (!ok) {
            throw mismatch(type, value);
        }
    }

    private static DBusException mismatch(String type, Object value) {
        return invalidArgs("type '" + type + "' cannot carry " + value.getClass().getSimpleName());
    }

    private static DBusException invalidArgs(String detail) {
        return new DBusException(ErrorNames.INVALID_ARGS, detail);
    }

    private static DBusException invalidSignature(String text, String detail) {
        return new DBusException(ErrorNames.INVALID_SIGNATURE, "'" + text + "': " + detail);
    }
}
