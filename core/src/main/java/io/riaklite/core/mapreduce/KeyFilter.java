package io.riaklite.core.mapreduce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.List;
import java.util.Objects;

/**
 * A Riak key filter: a transform or predicate applied to object keys before
 * any phase runs. Serialized as a JSON array, operator first:
 * <pre>
 *   ["tokenize", "-", 1]
 *   ["string_to_int"]
 *   ["between", 10, 20]
 *   ["and", [[...], [...]], [[...]]]
 * </pre>
 * Only the operators used below get factory methods; {@link #of} covers the rest.
 */
public record KeyFilter(String operator, List<JsonNode> args) {

    private static final JsonNodeFactory F = JsonNodeFactory.instance;

    public KeyFilter {
        Objects.requireNonNull(operator, "operator");
        if (operator.isBlank()) throw new IllegalArgumentException("operator must not be blank");
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static KeyFilter of(String operator, JsonNode... args) {
        return new KeyFilter(operator, List.of(args));
    }

    // ----- transforms -----

    public static KeyFilter tokenize(String separator, int position) {
        return of("tokenize", F.textNode(separator), F.numberNode(position));
    }

    public static KeyFilter stringToInt() {
        return of("string_to_int");
    }

    public static KeyFilter toLower() {
        return of("to_lower");
    }

    // ----- predicates -----

    public static KeyFilter eq(String value) {
        return of("eq", F.textNode(value));
    }

    public static KeyFilter eq(long value) {
        return of("eq", F.numberNode(value));
    }

    public static KeyFilter startsWith(String prefix) {
        return of("starts_with", F.textNode(prefix));
    }

    public static KeyFilter endsWith(String suffix) {
        return of("ends_with", F.textNode(suffix));
    }

    public static KeyFilter matches(String regex) {
        return of("matches", F.textNode(regex));
    }

    public static KeyFilter lessThan(long value) {
        return of("less_than", F.numberNode(value));
    }

    public static KeyFilter greaterThan(long value) {
        return of("greater_than", F.numberNode(value));
    }

    public static KeyFilter between(long low, long high) {
        return of("between", F.numberNode(low), F.numberNode(high));
    }

    public static KeyFilter setMember(String... members) {
        JsonNode[] nodes = new JsonNode[members.length];
        for (int i = 0; i < members.length; i++) {
            nodes[i] = F.textNode(members[i]);
        }
        return of("set_member", nodes);
    }

    /** Combine two filter chains with a logical operator ({@code and}, {@code or}). */
    public static KeyFilter combine(String operator, List<KeyFilter> left, List<KeyFilter> right) {
        return of(operator, toJson(left), toJson(right));
    }

    public static KeyFilter not(List<KeyFilter> filters) {
        return of("not", toJson(filters));
    }

    public ArrayNode toJson() {
        ArrayNode a = F.arrayNode();
        a.add(operator);
        args.forEach(a::add);
        return a;
    }

    public static ArrayNode toJson(List<KeyFilter> filters) {
        ArrayNode a = F.arrayNode();
        for (KeyFilter f : filters) {
            a.add(f.toJson());
        }
        return a;
    }
}
