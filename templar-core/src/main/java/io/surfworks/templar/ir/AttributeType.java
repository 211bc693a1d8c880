package io.surfworks.templar.ir;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The kinds of value an attribute can hold.
 *
 * <p>Each kind has a short textual tag ({@code float}, {@code ints}, ...) used by
 * the {@code $name:type} forward-reference syntax in function bodies.
 */
public enum AttributeType {
    FLOAT("float"),
    INT("int"),
    STRING("string"),
    TENSOR("tensor"),
    GRAPH("graph"),
    FLOATS("floats"),
    INTS("ints"),
    STRINGS("strings"),
    TENSORS("tensors"),
    GRAPHS("graphs");

    private static final Map<String, AttributeType> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(AttributeType::tag, Function.identity()));

    private final String tag;

    AttributeType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Returns true for the list kinds ({@code floats}, {@code ints}, ...).
     */
    public boolean isRepeated() {
        return tag.endsWith("s");
    }

    /**
     * Looks up a kind by its textual tag.
     *
     * @param tag the tag, e.g. "float" or "tensors"
     * @return the matching kind, or empty if the tag is not known
     */
    public static Optional<AttributeType> fromTag(String tag) {
        return Optional.ofNullable(BY_TAG.get(tag));
    }
}
