package io.surfworks.templar.function;

import io.surfworks.templar.ir.AttributeType;
import io.surfworks.templar.ir.Attributes;

/**
 * Parses the textual attribute syntax used in function bodies.
 *
 * <p>A string of the form {@code $name:type} forwards the enclosing function's
 * formal attribute {@code name}; {@code type} is one of the tags of
 * {@link AttributeType}. Any other string is a literal string attribute.
 *
 * <pre>{@code
 * AttributeRefs.resolve("$alpha:float");  // Forward("alpha", FLOAT)
 * AttributeRefs.resolve("NOTSET");        // Literal(StringValue("NOTSET"))
 * }</pre>
 */
public final class AttributeRefs {

    private static final char REF_SIGIL = '$';
    private static final char TYPE_SEPARATOR = ':';

    private AttributeRefs() {}

    /**
     * Resolves attribute text into a spec.
     *
     * @param text the attribute text
     * @return a {@link AttributeSpec.Forward} for references, a string
     *         {@link AttributeSpec.Literal} otherwise
     * @throws UnknownAttributeTypeException if a reference carries an unknown type tag
     */
    public static AttributeSpec resolve(String text) {
        if (!isReference(text)) {
            return new AttributeSpec.Literal(Attributes.of(text));
        }

        int sep = text.indexOf(TYPE_SEPARATOR);
        // Without a separator the whole text is taken as the tag, which never matches
        String name = sep < 0 ? text.substring(1) : text.substring(1, sep);
        String tag = sep < 0 ? text : text.substring(sep + 1);

        AttributeType type = AttributeType.fromTag(tag)
                .orElseThrow(() -> new UnknownAttributeTypeException(text, tag));
        return new AttributeSpec.Forward(name, type);
    }

    /**
     * Returns true if the text uses the {@code $} reference form.
     */
    public static boolean isReference(String text) {
        return text != null && text.length() >= 2 && text.charAt(0) == REF_SIGIL;
    }
}
