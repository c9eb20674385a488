package com.datapatch.interpret;

import com.datapatch.ast.BinaryOperator;
import com.datapatch.ast.Coordinate;
import com.datapatch.ast.UnaryOperator;
import com.datapatch.diagnostics.PatchTypeException;
import com.datapatch.value.DataValue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestValueOperations {

    private static final Coordinate AT = Coordinate.UNKNOWN;

    private static DataValue apply(BinaryOperator operator, DataValue lhs, DataValue rhs) {
        return ValueOperations.binary(operator, lhs, rhs, AT);
    }

    @Test
    void testComparisons() {
        assertEquals(DataValue.TRUE, apply(BinaryOperator.LESS, DataValue.of(1L), DataValue.of(1.5)));
        assertEquals(DataValue.TRUE, apply(BinaryOperator.GREATER_EQUAL, DataValue.of("b"), DataValue.of("a")));
        assertEquals(DataValue.FALSE, apply(BinaryOperator.EQUAL, DataValue.of("1"), DataValue.of(1L)));
        assertEquals(DataValue.TRUE, apply(BinaryOperator.NOT_EQUAL, DataValue.NONE, DataValue.FALSE));
        assertThrows(PatchTypeException.class, () -> apply(BinaryOperator.LESS, DataValue.of("a"), DataValue.of(1L)));
    }

    @Test
    void testArithmetic() {
        assertEquals(DataValue.of(-1L), apply(BinaryOperator.REMAINDER, DataValue.of(-7L), DataValue.of(2L)));
        assertEquals(DataValue.of(3.5), apply(BinaryOperator.DIVIDE, DataValue.of(7L), DataValue.of(2.0)));
        assertEquals(DataValue.list(DataValue.of(1L), DataValue.of(2L)),
            apply(BinaryOperator.ADD, DataValue.list(DataValue.of(1L)), DataValue.list(DataValue.of(2L))));
        assertThrows(PatchTypeException.class, () -> apply(BinaryOperator.REMAINDER, DataValue.of(1L), DataValue.of(0L)));
        assertThrows(PatchTypeException.class, () -> apply(BinaryOperator.MULTIPLY, DataValue.of("a"), DataValue.of(3L)));
    }

    @Test
    void testUnary() {
        assertEquals(DataValue.of(-2.5), ValueOperations.unary(UnaryOperator.NEGATE, DataValue.of(2.5), AT));
        assertEquals(DataValue.TRUE, ValueOperations.unary(UnaryOperator.NOT, DataValue.of(""), AT));
        assertThrows(PatchTypeException.class, () -> ValueOperations.unary(UnaryOperator.POSITIVE, DataValue.of("x"), AT));
    }
}
