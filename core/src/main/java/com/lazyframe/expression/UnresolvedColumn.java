package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import com.lazyframe.types.UnresolvedType;
import java.util.List;
import java.util.Objects;

/**
 * A column referenced by name before it has been resolved against an input schema.
 *
 * <p>Resolution turns it into a {@link ColumnReference}, or fails with a schema error if
 * the input has no such column.
 */
public final class UnresolvedColumn implements Expression {

    private final String name;

    public UnresolvedColumn(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public DataType dataType() {
        return UnresolvedType.get();
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
        if (!(obj instanceof UnresolvedColumn)) return false;
        return name.equals(((UnresolvedColumn) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("unresolved", name);
    }

    @Override
    public String toString() {
        return "col(\"" + name + "\")";
    }
}
