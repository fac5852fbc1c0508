package com.lazyframe.logical;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.types.DataType;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeCoercion;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Logical plan node that concatenates its inputs vertically.
 *
 * <p>All inputs must have the same column names in the same order. Column types are
 * widened to their common supertype. Rows of the first input come first, then the rows of
 * the second, and so on.
 */
public final class Union extends LogicalPlan {

    /**
     * Creates a union node.
     *
     * @param inputs the inputs (at least one)
     */
    public Union(List<LogicalPlan> inputs) {
        super(inputs);
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("union requires at least one input");
        }
        // Validate eagerly
        schema();
    }

    public List<LogicalPlan> inputs() {
        return children;
    }

    @Override
    protected StructType inferSchema() {
        StructType first = children.get(0).schema();
        List<DataType> types = new ArrayList<>();
        for (StructField field : first.fields()) {
            types.add(field.dataType());
        }
        for (int c = 1; c < children.size(); c++) {
            StructType other = children.get(c).schema();
            if (!other.names().equals(first.names())) {
                throw new SchemaException("union inputs must have the same columns in the same order: "
                    + first.names() + " vs " + other.names(), null, nodeName(), null);
            }
            for (int i = 0; i < types.size(); i++) {
                DataType next = other.fieldAt(i).dataType();
                DataType current = types.get(i);
                String name = first.fieldAt(i).name();
                types.set(i, TypeCoercion.commonSupertype(current, next).orElseThrow(() ->
                    new SchemaException("union column '" + name + "' has incompatible types "
                        + current + " and " + next, null, nodeName(), name)));
            }
        }
        List<StructField> fields = new ArrayList<>(types.size());
        for (int i = 0; i < types.size(); i++) {
            fields.add(new StructField(first.fieldAt(i).name(), types.get(i)));
        }
        return new StructType(fields);
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Union(newChildren);
    }

    @Override
    public OptionalLong estimatedRowCount() {
        long total = 0;
        for (LogicalPlan child : children) {
            OptionalLong estimate = child.estimatedRowCount();
            if (estimate.isEmpty()) {
                return OptionalLong.empty();
            }
            total += estimate.getAsLong();
        }
        return OptionalLong.of(total);
    }

    @Override
    protected List<Object> parameters() {
        return List.of();
    }

    @Override
    public String toString() {
        return String.format("Union(%d inputs)", children.size());
    }
}
