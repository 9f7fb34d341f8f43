package com.vidnyan.flowc.domain.ir;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ParameterValueTest {

    private IrNode nodeWith(Parameter... parameters) {
        return new IrNode("n", "test", "utility", null, null, List.of(parameters), List.of(), List.of());
    }

    @Test
    void parameter_ShouldDistinguishPresentDefaultedAndMissing() {
        // Arrange
        IrNode node = nodeWith(
                Parameter.of("set", "value"),
                new Parameter("fallback", 3, "number", true));

        // Act & Assert
        assertEquals(ParameterValue.Status.PRESENT, node.stringParam("set").status());
        assertTrue(node.intParam("fallback").isDefaulted());
        assertEquals(3, node.intParam("fallback").get());
        assertFalse(node.stringParam("absent").hasValue());
        assertEquals("x", node.stringParam("absent").orElse("x"));
    }

    @Test
    void parameter_ShouldCoerceNumericStrings() {
        // Arrange
        IrNode node = nodeWith(Parameter.of("temperature", "0.5"), Parameter.of("k", 4.0));

        // Act & Assert
        assertEquals(0.5, node.numberParam("temperature").get());
        assertEquals(4, node.intParam("k").get());
    }

    @Test
    void parameter_ShouldTreatBlankStringAsMissing() {
        // Arrange
        IrNode node = nodeWith(Parameter.of("name", "  "));

        // Act & Assert
        assertFalse(node.stringParam("name").hasValue());
    }

    @Test
    void withDefault_ShouldOnlyApplyWhenMissing() {
        // Arrange
        ParameterValue<Double> missing = ParameterValue.missing("t");
        ParameterValue<Double> present = ParameterValue.present("t", 0.1);

        // Act & Assert
        assertTrue(missing.withDefault(0.7).isDefaulted());
        assertEquals(0.7, missing.withDefault(0.7).get());
        assertEquals(0.1, present.withDefault(0.7).get());
        assertEquals(ParameterValue.Status.PRESENT, present.withDefault(0.7).status());
    }

    @Test
    void get_ShouldFailWhenMissing() {
        // Arrange
        ParameterValue<String> missing = ParameterValue.missing("absent");

        // Act & Assert
        assertThrows(NoSuchElementException.class, missing::get);
        assertTrue(missing.toOptional().isEmpty());
    }
}
