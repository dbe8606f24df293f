package com.rainmaker.schema.json;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JsonSafety.
 */
class JsonSafetyTest {

    @Test
    void testPlainJsonValuePassesUnchanged() {
        Map<String, Object> value = Map.of("name", "a", "tags", List.of("x", "y"), "count", 3, "ok", true);

        assertThat(JsonSafety.assertJsonSerializable(value)).isSameAs(value);
    }

    @Test
    void testDateIsRejectedWithPath() {
        Map<String, Object> value = Map.of("a", List.of(1, new Date()));

        assertThatThrownBy(() -> JsonSafety.assertJsonSerializable(value))
                .isInstanceOf(JsonSafetyException.class)
                .hasMessageContaining("non-JSON-serializable type at root.a[1]")
                .hasMessageContaining("Date")
                .extracting(e -> ((JsonSafetyException) e).getPath()).isEqualTo("root.a[1]");
    }

    @Test
    void testBigIntegerSetPatternAndFunctionAreRejected() {
        assertThatThrownBy(() -> JsonSafety.assertJsonSerializable(BigInteger.TEN))
                .hasMessageContaining("bigint");
        assertThatThrownBy(() -> JsonSafety.assertJsonSerializable(Set.of(1)))
                .hasMessageContaining("Set");
        assertThatThrownBy(() -> JsonSafety.assertJsonSerializable(Pattern.compile("a+")))
                .hasMessageContaining("RegExp");
        Supplier<String> fn = () -> "x";
        assertThatThrownBy(() -> JsonSafety.assertJsonSerializable(fn))
                .hasMessageContaining("function");
    }

    @Test
    void testNonStringKeysAreRejected() {
        Map<Integer, String> value = Map.of(1, "a");

        assertThatThrownBy(() -> JsonSafety.assertJsonSerializable(value))
                .hasMessageContaining("non-string keys");
    }

    @Test
    void testNonFiniteNumberIsRejected() {
        assertThatThrownBy(() -> JsonSafety.assertJsonSerializable(List.of(Double.POSITIVE_INFINITY)))
                .hasMessageContaining("root[0]");
    }

    @Test
    void testCycleIsRejected() {
        Map<String, Object> node = new HashMap<>();
        node.put("self", node);

        assertThatThrownBy(() -> JsonSafety.assertJsonSerializable(node))
                .isInstanceOf(JsonSafetyException.class)
                .hasMessage("Value contains circular reference at root.self");
    }

    @Test
    void testSharedReferenceIsNotACycle() {
        List<String> shared = List.of("x");
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("a", shared);
        value.put("b", shared);

        assertThatCode(() -> JsonSafety.assertJsonSerializable(value)).doesNotThrowAnyException();
    }

    @Test
    void testMakeJsonSafeConvertsCommonTypes() {
        Map<Object, Object> value = new LinkedHashMap<>();
        value.put("when", Date.from(Instant.parse("2024-01-02T03:04:05Z")));
        value.put("big", new BigInteger("123456789012345678901234567890"));
        value.put("set", Set.of("only"));
        value.put("pattern", Pattern.compile("^a$"));
        value.put("missing", Optional.empty());
        value.put("present", Optional.of(5L));
        value.put(7, "numeric key");
        value.put("nan", Double.NaN);

        Object safe = JsonSafety.makeJsonSafe(value);

        assertThat(safe).isInstanceOf(Map.class);
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) safe;
        assertThat(map).containsEntry("when", "2024-01-02T03:04:05Z")
                .containsEntry("big", "123456789012345678901234567890")
                .containsEntry("set", List.of("only"))
                .containsEntry("pattern", "^a$")
                .containsEntry("present", 5)
                .containsEntry("7", "numeric key")
                .containsEntry("nan", null)
                .doesNotContainKey("missing");
        assertThatCode(() -> JsonSafety.assertJsonSerializable(map)).doesNotThrowAnyException();
    }

    @Test
    void testMakeJsonSafeConvertsBeans() {
        Object safe = JsonSafety.makeJsonSafe(new Point(1, 2));

        assertThat(safe).isEqualTo(Map.of("x", 1, "y", 2));
    }

    @Test
    void testMakeJsonSafePreservesCycles() {
        List<Object> list = new ArrayList<>();
        list.add(list);

        Object safe = JsonSafety.makeJsonSafe(list);

        assertThat(safe).isInstanceOf(List.class);
        assertThat(((List<?>) safe).get(0)).isSameAs(safe);
    }

    @Test
    void testMakeJsonSafeRejectsFunctions() {
        Supplier<String> fn = () -> "x";

        assertThatThrownBy(() -> JsonSafety.makeJsonSafe(Map.of("fn", fn)))
                .isInstanceOf(JsonSafetyException.class)
                .hasMessageContaining("root.fn");
    }

    @Test
    void testMakeJsonSafeConvertsTemporalBeanProperties() {
        Instant at = Instant.parse("2024-01-02T03:04:05Z");

        assertThat(JsonSafety.makeJsonSafe(new Event(at, Date.from(at))))
                .isEqualTo(Map.of("at", "2024-01-02T03:04:05Z", "legacy", "2024-01-02T03:04:05Z"));
    }

    @Test
    void testMakeJsonSafeConvertsEmptyBean() {
        assertThat(JsonSafety.makeJsonSafe(new Empty())).isEqualTo(Map.of());
    }

    @Test
    void testMakeJsonSafePreservesBeanCycles() {
        Link link = new Link("a");
        link.setNext(link);

        Object safe = JsonSafety.makeJsonSafe(link);

        assertThat(safe).isInstanceOf(Map.class);
        Map<?, ?> map = (Map<?, ?>) safe;
        assertThat(map.get("name")).isEqualTo("a");
        assertThat(map.get("next")).isSameAs(safe);
    }

    @Test
    void testMakeJsonSafeRejectsFunctionBeanProperty() {
        Holder holder = new Holder(() -> "x");

        assertThatThrownBy(() -> JsonSafety.makeJsonSafe(holder))
                .isInstanceOf(JsonSafetyException.class)
                .hasMessageContaining("root.task");
    }

    @Test
    void testMakeJsonSafeSurvivesJsonRoundTrip() throws Exception {
        Map<Object, Object> nested = new LinkedHashMap<>();
        nested.put(1, "one");
        nested.put("ratio", 0.25f);
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("float", 1.5f);
        value.put("long", 5_000_000_000L);
        value.put("small", 7L);
        value.put("decimal", new BigDecimal("12.50"));
        value.put("set", Set.of("only"));
        value.put("nested", nested);
        value.put("when", Date.from(Instant.parse("2024-01-02T03:04:05Z")));
        value.put("point", new Point(3, 4));
        ObjectMapper mapper = new ObjectMapper();

        Object safe = JsonSafety.makeJsonSafe(value);
        Object parsed = mapper.readValue(mapper.writeValueAsString(safe), Object.class);

        assertThat(parsed).isEqualTo(safe);
    }

    public static class Event {
        private final Instant at;
        private final Date legacy;

        Event(Instant at, Date legacy) {
            this.at = at;
            this.legacy = legacy;
        }

        public Instant getAt() {
            return at;
        }

        public Date getLegacy() {
            return legacy;
        }
    }

    public static class Empty {
    }

    public static class Link {
        private final String name;
        private Link next;

        Link(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public Link getNext() {
            return next;
        }

        public void setNext(Link next) {
            this.next = next;
        }
    }

    public static class Holder {
        private final Supplier<String> task;

        Holder(Supplier<String> task) {
            this.task = task;
        }

        public Supplier<String> getTask() {
            return task;
        }
    }

    public static class Point {
        private final int x;
        private final int y;

        Point(int x, int y) {
            this.x = x;
            this.y = y;
        }

        public int getX() {
            return x;
        }

        public int getY() {
            return y;
        }
    }
}
