package io.surfworks.templar.function;

import java.util.Objects;

import io.surfworks.templar.ir.AttributeType;
import io.surfworks.templar.ir.GraphIr.AttributeValue;

/**
 * An attribute of a function body node: either a fixed value or a reference to
 * one of the enclosing function's formal attributes.
 */
public sealed interface AttributeSpec permits AttributeSpec.Literal, AttributeSpec.Forward {

    AttributeType type();

    /**
     * A value copied unchanged into every expansion.
     */
    record Literal(AttributeValue value) implements AttributeSpec {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public AttributeType type() {
            return value.type();
        }

        @Override
        public String toString() {
            return value.toText();
        }
    }

    /**
     * Takes its value from the call site's attribute named {@code refAttrName}.
     *
     * <p>{@code declaredType} records the kind the function author expects. It is
     * not checked against the call site's value.
     */
    record Forward(String refAttrName, AttributeType declaredType) implements AttributeSpec {
        public Forward {
            Objects.requireNonNull(refAttrName, "refAttrName");
            Objects.requireNonNull(declaredType, "declaredType");
        }

        @Override
        public AttributeType type() {
            return declaredType;
        }

        @Override
        public String toString() {
            return "$" + refAttrName + ":" + declaredType.tag();
        }
    }
}
