package io.surfworks.templar.function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.surfworks.templar.ir.AttributeType;
import io.surfworks.templar.ir.GraphIr.StringValue;

@DisplayName("Attribute references")
class AttributeRefsTest {

    @Nested
    @DisplayName("references")
    class References {

        @Test
        void resolvesFloatReference() {
            AttributeSpec spec = AttributeRefs.resolve("$alpha:float");

            AttributeSpec.Forward forward = assertInstanceOf(AttributeSpec.Forward.class, spec);
            assertEquals("alpha", forward.refAttrName());
            assertEquals(AttributeType.FLOAT, forward.declaredType());
        }

        @ParameterizedTest
        @ValueSource(strings = {"float", "int", "string", "tensor", "graph",
                "floats", "ints", "strings", "tensors", "graphs"})
        void resolvesEveryKnownTag(String tag) {
            AttributeSpec spec = AttributeRefs.resolve("$attr:" + tag);

            AttributeSpec.Forward forward = assertInstanceOf(AttributeSpec.Forward.class, spec);
            assertEquals("attr", forward.refAttrName());
            assertEquals(tag, forward.declaredType().tag());
        }

        @Test
        void nameStopsAtFirstColon() {
            AttributeSpec.Forward forward =
                    (AttributeSpec.Forward) AttributeRefs.resolve("$epsilon_value:ints");

            assertEquals("epsilon_value", forward.refAttrName());
            assertEquals(AttributeType.INTS, forward.declaredType());
        }

        @Test
        void forwardPrintsInSourceSyntax() {
            assertEquals("$beta:floats", AttributeRefs.resolve("$beta:floats").toString());
        }
    }

    @Nested
    @DisplayName("unknown types")
    class UnknownTypes {

        @ParameterizedTest
        @ValueSource(strings = {"$alpha:double", "$alpha:", "$alpha:Float", "$a:b:float"})
        void rejectsUnknownTag(String text) {
            assertThrows(UnknownAttributeTypeException.class, () -> AttributeRefs.resolve(text));
        }

        @Test
        void referenceWithoutSeparatorIsRejected() {
            UnknownAttributeTypeException e = assertThrows(UnknownAttributeTypeException.class,
                    () -> AttributeRefs.resolve("$alpha"));

            assertEquals("$alpha", e.getSpec());
            assertEquals("$alpha", e.getTypeTag());
        }

        @Test
        void exceptionNamesTagAndSpec() {
            UnknownAttributeTypeException e = assertThrows(UnknownAttributeTypeException.class,
                    () -> AttributeRefs.resolve("$alpha:double"));

            assertEquals("double", e.getTypeTag());
            assertTrue(e.getMessage().contains("$alpha:double"));
        }
    }

    @Nested
    @DisplayName("literals")
    class Literals {

        @ParameterizedTest
        @ValueSource(strings = {"NOTSET", "alpha:float", "", "$", "a$b:float"})
        void plainTextIsStringLiteral(String text) {
            AttributeSpec spec = AttributeRefs.resolve(text);

            AttributeSpec.Literal literal = assertInstanceOf(AttributeSpec.Literal.class, spec);
            assertEquals(new StringValue(text), literal.value());
            assertEquals(AttributeType.STRING, literal.type());
        }

        @Test
        void detectsReferenceForm() {
            assertTrue(AttributeRefs.isReference("$x:int"));
            assertFalse(AttributeRefs.isReference("$"));
            assertFalse(AttributeRefs.isReference("x"));
            assertFalse(AttributeRefs.isReference(null));
        }
    }
}
