package com.lazyframe.logical;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.types.DataType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeCoercion;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Logical plan node that unpivots (melts) columns from wide to long format.
 *
 * <p>For every value column, every input row produces one output row holding the index
 * columns, the value column's name and its value. Rows are ordered by value column first,
 * then by input row. Values are widened to their common type.
 */
public final class Unpivot extends LogicalPlan {

    private final List<String> index;
    private final List<String> on;
    private final String variableName;
    private final String valueName;

    /**
     * Creates an unpivot node.
     *
     * @param child the child node
     * @param index the columns kept as identifiers
     * @param on the value columns; empty means every non-index column
     * @param variableName the name of the column holding value column names
     * @param valueName the name of the column holding the values
     */
    public Unpivot(LogicalPlan child, List<String> index, List<String> on,
                   String variableName, String valueName) {
        super(child);
        this.index = List.copyOf(Objects.requireNonNull(index, "index must not be null"));
        this.variableName = Objects.requireNonNull(variableName, "variableName must not be null");
        this.valueName = Objects.requireNonNull(valueName, "valueName must not be null");
        StructType input = child.schema();
        input.select(this.index);
        Objects.requireNonNull(on, "on must not be null");
        if (on.isEmpty()) {
            List<String> rest = new ArrayList<>();
            for (String name : input.names()) {
                if (!this.index.contains(name)) {
                    rest.add(name);
                }
            }
            this.on = List.copyOf(rest);
        } else {
            input.select(on);
            this.on = List.copyOf(on);
        }
        // Validate eagerly
        schema();
    }

    public List<String> index() {
        return index;
    }

    public List<String> on() {
        return on;
    }

    public String variableName() {
        return variableName;
    }

    public String valueName() {
        return valueName;
    }

    /**
     * Returns the common type of the value columns.
     *
     * @return the value type
     */
    public DataType valueType() {
        StructType input = child().schema();
        List<DataType> types = new ArrayList<>();
        for (String name : on) {
            types.add(input.field(name).dataType());
        }
        if (types.isEmpty()) {
            return NullType.get();
        }
        return TypeCoercion.commonSupertype(types).orElseThrow(() ->
            new SchemaException("unpivot value columns " + on + " have no common type: " + types,
                null, nodeName(), null));
    }

    @Override
    protected StructType inferSchema() {
        StructType input = child().schema();
        List<StructField> fields = new ArrayList<>();
        for (String name : index) {
            fields.add(input.field(name));
        }
        fields.add(new StructField(variableName, StringType.get()));
        fields.add(new StructField(valueName, valueType()));
        return new StructType(fields);
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Unpivot(newChildren.get(0), index, on, variableName, valueName);
    }

    @Override
    public OptionalLong estimatedRowCount() {
        OptionalLong estimate = child().estimatedRowCount();
        return estimate.isPresent() ? OptionalLong.of(estimate.getAsLong() * on.size()) : estimate;
    }

    @Override
    protected List<Object> parameters() {
        return List.of(index, on, variableName, valueName);
    }

    @Override
    public String toString() {
        return String.format("Unpivot(index=%s, on=%s, variable=%s, value=%s)", index, on, variableName, valueName);
    }
}
