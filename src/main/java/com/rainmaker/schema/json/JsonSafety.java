package com.rainmaker.schema.json;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;

/**
 * Runtime checks and conversions for realized values (not schema definitions).
 *
 * A JSON-safe value is built only from {@code null}, {@link String},
 * {@link Boolean}, finite numbers of the boxed JDK types, lists or arrays,
 * and maps with {@link String} keys.
 */
public final class JsonSafety {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonSafety() {
        // Utility class
    }

    public static <T> T assertJsonSerializable(T value) {
        return assertJsonSerializable(value, "root");
    }

    /**
     * Walks the value and fails on the first non-JSON element or reference cycle.
     *
     * @return the same value, unchanged
     * @throws JsonSafetyException naming the offending path
     */
    public static <T> T assertJsonSerializable(T value, String path) {
        check(value, path, newIdentitySet());
        return value;
    }

    private static void check(Object value, String path, Set<Object> seen) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return;
        }
        if (value instanceof Number number) {
            checkNumber(number, path);
            return;
        }
        String violation = describeViolation(value);
        if (violation != null) {
            throw new JsonSafetyException(
                    "Value contains non-JSON-serializable type at " + path + ": " + violation, path);
        }
        if (value instanceof Map<?, ?> || value instanceof List<?> || value.getClass().isArray()) {
            if (!seen.add(value)) {
                throw new JsonSafetyException("Value contains circular reference at " + path, path);
            }
            if (value instanceof Map<?, ?> map) {
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    check(entry.getValue(), path + "." + entry.getKey(), seen);
                }
            } else if (value instanceof List<?> list) {
                for (int i = 0; i < list.size(); i++) {
                    check(list.get(i), path + "[" + i + "]", seen);
                }
            } else {
                int length = Array.getLength(value);
                for (int i = 0; i < length; i++) {
                    check(Array.get(value, i), path + "[" + i + "]", seen);
                }
            }
            seen.remove(value);
            return;
        }
        throw new JsonSafetyException(
                "Value contains non-JSON-serializable type at " + path + ": " + value.getClass().getName(), path);
    }

    private static void checkNumber(Number number, String path) {
        if (number instanceof BigInteger || number instanceof BigDecimal) {
            throw new JsonSafetyException(
                    "Value contains non-JSON-serializable type at " + path + ": bigint (use a number or string)",
                    path);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new JsonSafetyException(
                        "Value contains non-JSON-serializable type at " + path + ": " + d, path);
            }
            return;
        }
        if (!(number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte)) {
            throw new JsonSafetyException(
                    "Value contains non-JSON-serializable type at " + path + ": " + number.getClass().getName(),
                    path);
        }
    }

    private static String describeViolation(Object value) {
        if (isFunction(value)) {
            return "function";
        }
        if (value instanceof Date || value instanceof TemporalAccessor) {
            return "Date (use ISO string instead)";
        }
        if (value instanceof Pattern) {
            return "RegExp";
        }
        if (value instanceof Set<?>) {
            return "Set (use array instead)";
        }
        if (value instanceof Map<?, ?> map) {
            for (Object key : map.keySet()) {
                if (!(key instanceof String)) {
                    return "Map with non-string keys (use object instead)";
                }
            }
        }
        return null;
    }

    /**
     * Best-effort structural conversion into a JSON-safe value.
     *
     * Dates and temporals become ISO-8601 strings, big numbers become strings,
     * maps get string keys, sets and arrays become lists, patterns become their
     * source text and empty {@link Optional} entries are dropped. Shared and
     * cyclic references are preserved in the output graph.
     *
     * @throws JsonSafetyException for functional objects and bean properties
     *         that cannot be read
     */
    public static Object makeJsonSafe(Object value) {
        return convert(value, "root", new IdentityHashMap<>());
    }

    private static Object convert(Object value, String path, IdentityHashMap<Object, Object> converted) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return convertNumber(number);
        }
        if (value instanceof Character c) {
            return String.valueOf(c);
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (isFunction(value)) {
            throw new JsonSafetyException("Cannot convert function to JSON at " + path, path);
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof TemporalAccessor temporal) {
            return temporal.toString();
        }
        if (value instanceof Pattern pattern) {
            return pattern.pattern();
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? convert(optional.get(), path, converted) : null;
        }
        if (converted.containsKey(value)) {
            return converted.get(value);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            converted.put(value, result);
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getValue() instanceof Optional<?> optional && optional.isEmpty()) {
                    continue;
                }
                String key = String.valueOf(entry.getKey());
                result.put(key, convert(entry.getValue(), path + "." + key, converted));
            }
            return result;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            converted.put(value, result);
            int i = 0;
            for (Object item : collection) {
                result.add(convert(item, path + "[" + i++ + "]", converted));
            }
            return result;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> result = new ArrayList<>(length);
            converted.put(value, result);
            for (int i = 0; i < length; i++) {
                result.add(convert(Array.get(value, i), path + "[" + i + "]", converted));
            }
            return result;
        }
        return convertBean(value, path, converted);
    }

    /**
     * Plain Java objects become a map of their bean properties. Jackson only
     * finds the properties; every property value is converted like any other.
     */
    private static Object convertBean(Object bean, String path, IdentityHashMap<Object, Object> converted) {
        Map<String, Object> result = new LinkedHashMap<>();
        converted.put(bean, result);
        BeanDescription description = MAPPER.getSerializationConfig()
                .introspect(MAPPER.constructType(bean.getClass()));
        for (BeanPropertyDefinition property : description.findProperties()) {
            AnnotatedMember accessor = property.getAccessor();
            if (accessor == null) {
                continue;
            }
            String propertyPath = path + "." + property.getName();
            Object propertyValue;
            try {
                accessor.fixAccess(false);
                propertyValue = accessor.getValue(bean);
            } catch (RuntimeException e) {
                throw new JsonSafetyException("Cannot read property at " + propertyPath + ": " + e.getMessage(),
                        propertyPath, e);
            }
            if (propertyValue instanceof Optional<?> optional && optional.isEmpty()) {
                continue;
            }
            result.put(property.getName(), convert(propertyValue, propertyPath, converted));
        }
        return result;
    }

    private static Object convertNumber(Number number) {
        if (number instanceof BigInteger || number instanceof BigDecimal) {
            return number.toString();
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number instanceof Float f ? Double.parseDouble(f.toString()) : number.doubleValue();
            // Non-finite numbers have no JSON form.
            return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
        }
        long asLong = number.longValue();
        if (asLong >= Integer.MIN_VALUE && asLong <= Integer.MAX_VALUE) {
            return (int) asLong;
        }
        return asLong;
    }

    private static boolean isFunction(Object value) {
        return value instanceof Function<?, ?>
                || value instanceof Supplier<?>
                || value instanceof Runnable
                || value instanceof Callable<?>
                || value.getClass().isSynthetic();
    }

    private static Set<Object> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
