package com.example.downloaders.utils.xmlrpc;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One XML-RPC value, tagged with its wire type.
 * <p>
 * Accessors are lenient: asking a value for a representation it does not have
 * yields an empty/zero result instead of an exception, because download clients
 * are inconsistent about i4 vs i8 vs string for the same field.
 */
public final class XmlRpcValue {

    public enum Type {
        STRING, INT, I8, BOOLEAN, DOUBLE, BASE64, ARRAY, STRUCT, NIL
    }

    private static final XmlRpcValue NIL = new XmlRpcValue(Type.NIL, null);

    private final Type type;
    /** Scalar payload; null for arrays and structs. */
    private final Object value;
    private final List<XmlRpcValue> items;
    private final Map<String, XmlRpcValue> members;

    private XmlRpcValue(Type type, Object value) {
        this(type, value, List.of(), Map.of());
    }

    private XmlRpcValue(Type type, Object value, List<XmlRpcValue> items, Map<String, XmlRpcValue> members) {
        this.type = type;
        this.value = value;
        this.items = items;
        this.members = members;
    }

    public static XmlRpcValue string(String value) {
        return new XmlRpcValue(Type.STRING, value == null ? "" : value);
    }

    public static XmlRpcValue integer(int value) {
        return new XmlRpcValue(Type.INT, (long) value);
    }

    public static XmlRpcValue i8(long value) {
        return new XmlRpcValue(Type.I8, value);
    }

    public static XmlRpcValue bool(boolean value) {
        return new XmlRpcValue(Type.BOOLEAN, value);
    }

    public static XmlRpcValue dbl(double value) {
        return new XmlRpcValue(Type.DOUBLE, value);
    }

    public static XmlRpcValue base64(byte[] value) {
        return new XmlRpcValue(Type.BASE64, value.clone());
    }

    public static XmlRpcValue array(List<XmlRpcValue> values) {
        return new XmlRpcValue(Type.ARRAY, null, Collections.unmodifiableList(new ArrayList<>(values)), Map.of());
    }

    public static XmlRpcValue struct(Map<String, XmlRpcValue> members) {
        return new XmlRpcValue(Type.STRUCT, null, List.of(), Collections.unmodifiableMap(new LinkedHashMap<>(members)));
    }

    public static XmlRpcValue nil() {
        return NIL;
    }

    /**
     * Converts a plain Java value: String, Integer, Long (i8 only when it does not fit
     * in 32 bits), Boolean, Double/Float, byte[], List, Map with String keys, or null.
     */
    public static XmlRpcValue of(Object value) {
        if (value == null) {
            return NIL;
        }
        if (value instanceof XmlRpcValue) {
            return (XmlRpcValue) value;
        }
        if (value instanceof String) {
            return string((String) value);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return integer(((Number) value).intValue());
        }
        if (value instanceof Long) {
            long l = (Long) value;
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? integer((int) l) : i8(l);
        }
        if (value instanceof Double || value instanceof Float) {
            return dbl(((Number) value).doubleValue());
        }
        if (value instanceof Boolean) {
            return bool((Boolean) value);
        }
        if (value instanceof byte[]) {
            return base64((byte[]) value);
        }
        if (value instanceof List<?>) {
            List<XmlRpcValue> items = new ArrayList<>();
            for (Object item : (List<?>) value) {
                items.add(of(item));
            }
            return array(items);
        }
        if (value instanceof Map<?, ?>) {
            Map<String, XmlRpcValue> members = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                members.put(String.valueOf(entry.getKey()), of(entry.getValue()));
            }
            return struct(members);
        }
        throw new IllegalArgumentException("Cannot encode " + value.getClass().getName() + " as XML-RPC");
    }

    public Type getType() {
        return type;
    }

    public boolean isNil() {
        return type == Type.NIL;
    }

    public String asString() {
        switch (type) {
            case STRING:
                return (String) value;
            case INT:
            case I8:
            case DOUBLE:
            case BOOLEAN:
                return String.valueOf(value);
            case BASE64:
                return new String((byte[]) value, StandardCharsets.UTF_8);
            default:
                return "";
        }
    }

    public long asLong() {
        switch (type) {
            case INT:
            case I8:
                return (Long) value;
            case DOUBLE:
                return (long) (double) (Double) value;
            case BOOLEAN:
                return (Boolean) value ? 1 : 0;
            case STRING:
                try {
                    return Long.parseLong(((String) value).trim());
                } catch (NumberFormatException e) {
                    return 0;
                }
            default:
                return 0;
        }
    }

    public int asInt() {
        return (int) asLong();
    }

    public double asDouble() {
        switch (type) {
            case DOUBLE:
                return (Double) value;
            case STRING:
                try {
                    return Double.parseDouble(((String) value).trim());
                } catch (NumberFormatException e) {
                    return 0;
                }
            default:
                return asLong();
        }
    }

    public boolean asBoolean() {
        if (type == Type.BOOLEAN) {
            return (Boolean) value;
        }
        return asLong() != 0;
    }

    public byte[] asBytes() {
        if (type == Type.BASE64) {
            return ((byte[]) value).clone();
        }
        return asString().getBytes(StandardCharsets.UTF_8);
    }

    /** Array elements; empty for any other type. */
    public List<XmlRpcValue> asList() {
        return items;
    }

    /** Struct members in wire order; empty for any other type. */
    public Map<String, XmlRpcValue> asMap() {
        return members;
    }

    /** Struct member, or nil when absent. */
    public XmlRpcValue get(String member) {
        XmlRpcValue found = asMap().get(member);
        return found == null ? NIL : found;
    }

    /** Array element, or nil when out of range. */
    public XmlRpcValue get(int index) {
        List<XmlRpcValue> list = asList();
        return index >= 0 && index < list.size() ? list.get(index) : NIL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof XmlRpcValue)) return false;
        XmlRpcValue other = (XmlRpcValue) o;
        if (type != other.type) return false;
        if (type == Type.BASE64) {
            return Arrays.equals((byte[]) value, (byte[]) other.value);
        }
        return Objects.equals(value, other.value) && items.equals(other.items) && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return type == Type.BASE64 ? Arrays.hashCode((byte[]) value) : Objects.hash(type, value, items, members);
    }

    @Override
    public String toString() {
        switch (type) {
            case BASE64:
                return "base64[" + ((byte[]) value).length + "]";
            case ARRAY:
                return type + ":" + items;
            case STRUCT:
                return type + ":" + members;
            default:
                return type + ":" + value;
        }
    }
}
