package com.datapatch.interpret;

import com.datapatch.ast.BinaryOperator;
import com.datapatch.ast.Coordinate;
import com.datapatch.ast.UnaryOperator;
import com.datapatch.diagnostics.PatchTypeException;
import com.datapatch.value.DataValue;
import com.datapatch.value.DataValues;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator semantics over {@link DataValue}s. {@code and} and {@code or} short-circuit and are
 * evaluated by the interpreter itself.
 */
public final class ValueOperations {

    private ValueOperations() {
        // Utility class
    }

    public static DataValue unary(UnaryOperator operator, DataValue operand, Coordinate at) {
        switch (operator) {
            case NOT:
                return DataValue.of(!DataValues.isTruthy(operand));
            case POSITIVE:
                if (operand.isNumeric()) {
                    return operand;
                }
                break;
            case NEGATE:
                if (operand instanceof DataValue.IntValue i) {
                    return DataValue.of(-i.value());
                }
                if (operand instanceof DataValue.FloatValue f) {
                    return DataValue.of(-f.value());
                }
                break;
        }
        throw new PatchTypeException(at, "Cannot apply unary '" + operator.symbol() + "' to a "
            + operand.kind().displayName());
    }

    public static DataValue binary(BinaryOperator operator, DataValue lhs, DataValue rhs, Coordinate at) {
        switch (operator) {
            case EQUAL:
                return DataValue.of(valuesEqual(lhs, rhs));
            case NOT_EQUAL:
                return DataValue.of(!valuesEqual(lhs, rhs));
            case LESS:
                return DataValue.of(compare(operator, lhs, rhs, at) < 0);
            case LESS_EQUAL:
                return DataValue.of(compare(operator, lhs, rhs, at) <= 0);
            case GREATER:
                return DataValue.of(compare(operator, lhs, rhs, at) > 0);
            case GREATER_EQUAL:
                return DataValue.of(compare(operator, lhs, rhs, at) >= 0);
            case AND:
                return DataValue.of(DataValues.isTruthy(lhs) && DataValues.isTruthy(rhs));
            case OR:
                return DataValue.of(DataValues.isTruthy(lhs) || DataValues.isTruthy(rhs));
            case ADD:
                if (lhs instanceof DataValue.StringValue l && rhs instanceof DataValue.StringValue r) {
                    return DataValue.of(l.value() + r.value());
                }
                if (lhs instanceof DataValue.ListValue l && rhs instanceof DataValue.ListValue r) {
                    List<DataValue> items = new ArrayList<>(l.items());
                    items.addAll(r.items());
                    return DataValue.list(items);
                }
                return arithmetic(operator, lhs, rhs, at);
            default:
                return arithmetic(operator, lhs, rhs, at);
        }
    }

    /**
     * Numbers compare numerically across int and float; everything else compares structurally.
     */
    public static boolean valuesEqual(DataValue lhs, DataValue rhs) {
        if (lhs.isNumeric() && rhs.isNumeric()) {
            if (lhs instanceof DataValue.IntValue l && rhs instanceof DataValue.IntValue r) {
                return l.value() == r.value();
            }
            return DataValues.toDouble(lhs) == DataValues.toDouble(rhs);
        }
        return lhs.equals(rhs);
    }

    private static DataValue arithmetic(BinaryOperator operator, DataValue lhs, DataValue rhs, Coordinate at) {
        if (!lhs.isNumeric() || !rhs.isNumeric()) {
            throw mismatch(operator, lhs, rhs, at);
        }
        if (lhs instanceof DataValue.IntValue l && rhs instanceof DataValue.IntValue r) {
            long a = l.value();
            long b = r.value();
            switch (operator) {
                case ADD:
                    return DataValue.of(a + b);
                case SUBTRACT:
                    return DataValue.of(a - b);
                case MULTIPLY:
                    return DataValue.of(a * b);
                case DIVIDE:
                    requireNonZero(b, at);
                    return DataValue.of(a / b);
                case REMAINDER:
                    requireNonZero(b, at);
                    return DataValue.of(a % b);
                default:
                    throw mismatch(operator, lhs, rhs, at);
            }
        }
        double a = DataValues.toDouble(lhs);
        double b = DataValues.toDouble(rhs);
        switch (operator) {
            case ADD:
                return DataValue.of(a + b);
            case SUBTRACT:
                return DataValue.of(a - b);
            case MULTIPLY:
                return DataValue.of(a * b);
            case DIVIDE:
                return DataValue.of(a / b);
            case REMAINDER:
                return DataValue.of(a % b);
            default:
                throw mismatch(operator, lhs, rhs, at);
        }
    }

    private static int compare(BinaryOperator operator, DataValue lhs, DataValue rhs, Coordinate at) {
        if (lhs instanceof DataValue.IntValue l && rhs instanceof DataValue.IntValue r) {
            return Long.compare(l.value(), r.value());
        }
        if (lhs.isNumeric() && rhs.isNumeric()) {
            return Double.compare(DataValues.toDouble(lhs), DataValues.toDouble(rhs));
        }
        if (lhs instanceof DataValue.StringValue l && rhs instanceof DataValue.StringValue r) {
            return l.value().compareTo(r.value());
        }
        throw mismatch(operator, lhs, rhs, at);
    }

    private static void requireNonZero(long divisor, Coordinate at) {
        if (divisor == 0) {
            throw new PatchTypeException(at, "Integer division by zero");
        }
    }

    private static PatchTypeException mismatch(BinaryOperator operator, DataValue lhs, DataValue rhs, Coordinate at) {
        return new PatchTypeException(at, "Cannot apply '" + operator.symbol() + "' to a "
            + lhs.kind().displayName() + " and a " + rhs.kind().displayName());
    }
}
