package com.lazyframe.expression;

import com.lazyframe.data.ValueOps;
import com.lazyframe.types.DataType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.StringType;
import java.util.List;
import java.util.Objects;

/**
 * A constant value.
 *
 * <p>Examples:
 * <pre>
 *   lit(42)          -- i32
 *   lit(3.14)        -- f64
 *   lit("hello")     -- str
 *   lit(null)        -- null
 * </pre>
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal with an explicit type.
     *
     * @param value the value (may be null)
     * @param dataType the type of the value
     */
    public Literal(Object value, DataType dataType) {
        this.value = ValueOps.canonical(value);
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        if (!ValueOps.conforms(this.value, dataType)) {
            throw new IllegalArgumentException("literal " + value + " does not conform to " + dataType);
        }
    }

    /**
     * Creates a literal, inferring its type from the Java value.
     *
     * @param value the value (may be null)
     * @return the literal
     */
    public static Literal of(Object value) {
        return new Literal(value, ValueOps.typeOf(value));
    }

    /**
     * Creates a typed null literal.
     *
     * @param dataType the type
     * @return the null literal
     */
    public static Literal nullOf(DataType dataType) {
        return new Literal(null, dataType);
    }

    /**
     * Wraps a Java value as a literal unless it already is an expression.
     *
     * @param value an expression or a plain value
     * @return the expression
     */
    public static Expression lift(Object value) {
        if (value instanceof Expression expression) {
            return expression;
        }
        return of(value);
    }

    /**
     * Turns a string into a column reference; other expressions pass through.
     *
     * @param value a column name or an expression
     * @return the expression
     */
    public static Expression liftColumn(Object value) {
        if (value instanceof String name) {
            return new UnresolvedColumn(name);
        }
        if (value instanceof Expression expression) {
            return expression;
        }
        throw new IllegalArgumentException("expected a column name or an expression, got: " + value);
    }

    public Object value() {
        return value;
    }

    public boolean isNullValue() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return this;
    }

    @Override
    public String outputName() {
        return "literal";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) && dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    @Override
    public String toString() {
        if (value == null) {
            return dataType instanceof NullType ? "null" : "null::" + dataType;
        }
        if (dataType instanceof StringType) {
            return "\"" + value + "\"";
        }
        return ValueOps.format(value);
    }
}
