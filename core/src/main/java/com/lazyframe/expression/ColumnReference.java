package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * A resolved reference to a column of the input schema.
 */
public final class ColumnReference implements Expression {

    private final String name;
    private final DataType dataType;

    /**
     * Creates a column reference.
     *
     * @param name the column name
     * @param dataType the column data type
     */
    public ColumnReference(String name, DataType dataType) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns the column name.
     *
     * @return the column name
     */
    public String name() {
        return name;
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
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return name.equals(that.name) && dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataType);
    }

    @Override
    public String toString() {
        return "col(\"" + name + "\")";
    }
}
