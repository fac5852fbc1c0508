package com.lazyframe.logical;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.types.ListType;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node that explodes list columns into one row per element.
 *
 * <p>Other columns are repeated for each element. When several columns are exploded
 * together their lists must have equal lengths in every row. An empty or null list
 * produces a single row with a null element.
 */
public final class Explode extends LogicalPlan {

    private final List<String> columns;

    /**
     * Creates an explode node.
     *
     * @param child the child node
     * @param columns the list columns to explode
     */
    public Explode(LogicalPlan child, List<String> columns) {
        super(child);
        Objects.requireNonNull(columns, "columns must not be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("explode requires at least one column");
        }
        this.columns = List.copyOf(columns);
        for (String name : this.columns) {
            StructField field = child.schema().field(name);
            if (!(field.dataType() instanceof ListType)) {
                throw new SchemaException("explode requires a list column, '" + name + "' is "
                    + field.dataType(), null, nodeName(), name);
            }
        }
    }

    public List<String> columns() {
        return columns;
    }

    @Override
    protected StructType inferSchema() {
        List<StructField> fields = new ArrayList<>();
        for (StructField field : child().schema().fields()) {
            if (columns.contains(field.name())) {
                fields.add(new StructField(field.name(), ((ListType) field.dataType()).elementType()));
            } else {
                fields.add(field);
            }
        }
        return new StructType(fields);
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Explode(newChildren.get(0), columns);
    }

    @Override
    protected List<Object> parameters() {
        return List.of(columns);
    }

    @Override
    public String toString() {
        return String.format("Explode(%s)", columns);
    }
}
