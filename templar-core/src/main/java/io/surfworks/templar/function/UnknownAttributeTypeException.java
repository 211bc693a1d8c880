package io.surfworks.templar.function;

/**
 * Thrown when a {@code $name:type} attribute reference names a type tag that is
 * not one of the known attribute kinds.
 */
public class UnknownAttributeTypeException extends RuntimeException {

    private final String spec;
    private final String typeTag;

    public UnknownAttributeTypeException(String spec, String typeTag) {
        super(String.format("Unknown attribute type '%s' in reference '%s'", typeTag, spec));
        this.spec = spec;
        this.typeTag = typeTag;
    }

    /**
     * Returns the full reference text, e.g. {@code "$alpha:double"}.
     */
    public String getSpec() {
        return spec;
    }

    public String getTypeTag() {
        return typeTag;
    }
}
