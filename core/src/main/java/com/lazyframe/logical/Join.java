package com.lazyframe.logical;

import com.lazyframe.exception.InvalidOperationException;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.eval.ExpressionResolver;
import com.lazyframe.temporal.Duration;
import com.lazyframe.types.DataType;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeCoercion;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a join between two plans.
 *
 * <p>Keys are evaluated on each side separately and compared with equality (or, for as-of
 * joins, by order). Null keys never match.
 *
 * <p>Output columns are the left columns followed by the right columns. A right key column
 * with the same name as its left key is not repeated; in a full join the left key column
 * holds the coalesced key of both sides. Other right columns whose names collide with an
 * output name get the configured suffix (default {@code _right}). Semi and anti joins
 * return the left columns only.
 *
 * <p>Row order: matches appear in left row order, and within one left row in right row
 * order; right rows without a match (full join) follow at the end in right row order.
 */
public final class Join extends LogicalPlan {

    /**
     * A right column carried to the output, possibly renamed.
     *
     * @param source the right-side column name
     * @param name the output column name
     */
    public record RightOutput(String source, String name) {
    }

    private final JoinType joinType;
    private final List<Expression> leftKeys;
    private final List<Expression> rightKeys;
    private final JoinOptions options;
    private final List<RightOutput> rightOutputs;
    private final List<Integer> coalescedKeys;

    /**
     * Creates an equi-join (or cross join) with default options.
     *
     * @param left the left input
     * @param right the right input
     * @param joinType the join kind
     * @param leftKeys key expressions over the left input
     * @param rightKeys key expressions over the right input
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType,
                List<Expression> leftKeys, List<Expression> rightKeys) {
        this(left, right, joinType, leftKeys, rightKeys, JoinOptions.DEFAULT);
    }

    /**
     * Creates a join.
     *
     * @param left the left input
     * @param right the right input
     * @param joinType the join kind
     * @param leftKeys key expressions over the left input
     * @param rightKeys key expressions over the right input
     * @param options suffix, as-of and build-side options
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType,
                List<Expression> leftKeys, List<Expression> rightKeys, JoinOptions options) {
        super(List.of(Objects.requireNonNull(left, "left must not be null"),
                      Objects.requireNonNull(right, "right must not be null")));
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(leftKeys, "leftKeys must not be null");
        Objects.requireNonNull(rightKeys, "rightKeys must not be null");
        this.leftKeys = List.copyOf(ExpressionResolver.resolveAll(leftKeys, left.schema()));
        this.rightKeys = List.copyOf(ExpressionResolver.resolveAll(rightKeys, right.schema()));
        validateKeys();

        this.coalescedKeys = new ArrayList<>();
        Set<String> dropped = new HashSet<>();
        if (joinType.outputsRight() && joinType != JoinType.CROSS) {
            for (int i = 0; i < this.leftKeys.size(); i++) {
                if (this.leftKeys.get(i) instanceof ColumnReference l
                        && this.rightKeys.get(i) instanceof ColumnReference r
                        && l.name().equals(r.name())) {
                    dropped.add(r.name());
                    if (joinType == JoinType.FULL) {
                        coalescedKeys.add(i);
                    }
                }
            }
            if (joinType == JoinType.ASOF) {
                for (int i = 0; i < options.leftBy().size(); i++) {
                    if (options.leftBy().get(i).equals(options.rightBy().get(i))) {
                        dropped.add(options.rightBy().get(i));
                    }
                }
            }
        }
        this.rightOutputs = joinType.outputsRight() ? computeRightOutputs(dropped) : List.of();
    }

    private void validateKeys() {
        LogicalPlan left = children.get(0);
        LogicalPlan right = children.get(1);
        if (joinType == JoinType.CROSS) {
            if (!leftKeys.isEmpty() || !rightKeys.isEmpty()) {
                throw new InvalidOperationException("cross join does not take join keys", null, nodeName(), null);
            }
            return;
        }
        if (leftKeys.isEmpty()) {
            throw new InvalidOperationException(joinType.joinName() + " join requires at least one key",
                null, nodeName(), null);
        }
        if (leftKeys.size() != rightKeys.size()) {
            throw new InvalidOperationException(String.format(
                "join has %d left keys but %d right keys", leftKeys.size(), rightKeys.size()),
                null, nodeName(), null);
        }
        for (int i = 0; i < leftKeys.size(); i++) {
            DataType l = leftKeys.get(i).dataType();
            DataType r = rightKeys.get(i).dataType();
            if (TypeCoercion.commonSupertype(l, r).isEmpty()) {
                throw new SchemaException(String.format("join key types differ: %s (%s) vs %s (%s)",
                    leftKeys.get(i), l, rightKeys.get(i), r), null, nodeName(), leftKeys.get(i).outputName());
            }
        }

        if (joinType == JoinType.ASOF) {
            if (leftKeys.size() != 1) {
                throw new InvalidOperationException("asof join takes exactly one key", null, nodeName(), null);
            }
            DataType keyType = leftKeys.get(0).dataType();
            boolean numeric = TypeCoercion.isNumeric(keyType);
            boolean temporal = TypeCoercion.isTemporal(keyType);
            if (!numeric && !temporal) {
                throw new SchemaException("asof join key must be numeric or temporal, got " + keyType,
                    null, nodeName(), leftKeys.get(0).outputName());
            }
            Object tolerance = options.tolerance();
            if (tolerance != null && numeric && !(tolerance instanceof Number)) {
                throw new InvalidOperationException("asof tolerance for numeric keys must be a number, got "
                    + tolerance, null, nodeName(), null);
            }
            if (tolerance != null && temporal && !(tolerance instanceof Duration)) {
                throw new InvalidOperationException("asof tolerance for temporal keys must be a duration, got "
                    + tolerance, null, nodeName(), null);
            }
            if (options.leftBy().size() != options.rightBy().size()) {
                throw new InvalidOperationException("asof join needs the same number of left and right 'by' columns",
                    null, nodeName(), null);
            }
            for (int i = 0; i < options.leftBy().size(); i++) {
                DataType l = left.schema().field(options.leftBy().get(i)).dataType();
                DataType r = right.schema().field(options.rightBy().get(i)).dataType();
                if (TypeCoercion.commonSupertype(l, r).isEmpty()) {
                    throw new SchemaException("asof 'by' column types differ: " + l + " vs " + r,
                        null, nodeName(), options.leftBy().get(i));
                }
            }
        } else if (!options.leftBy().isEmpty() || !options.rightBy().isEmpty()) {
            throw new InvalidOperationException("'by' columns are only valid for asof joins", null, nodeName(), null);
        }
    }

    private List<RightOutput> computeRightOutputs(Set<String> dropped) {
        Set<String> taken = new HashSet<>(left().schema().names());
        List<RightOutput> outputs = new ArrayList<>();
        for (StructField field : right().schema().fields()) {
            String source = field.name();
            if (dropped.contains(source)) {
                continue;
            }
            String name = source;
            if (taken.contains(name)) {
                name = source + options.suffix();
                if (taken.contains(name)) {
                    throw new SchemaException("column '" + name + "' already exists; choose another suffix",
                        null, nodeName(), name);
                }
            }
            taken.add(name);
            outputs.add(new RightOutput(source, name));
        }
        return List.copyOf(outputs);
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }

    public JoinType joinType() {
        return joinType;
    }

    public List<Expression> leftKeys() {
        return leftKeys;
    }

    public List<Expression> rightKeys() {
        return rightKeys;
    }

    public JoinOptions options() {
        return options;
    }

    /**
     * Returns the right columns carried to the output, in output order.
     *
     * @return the right outputs
     */
    public List<RightOutput> rightOutputs() {
        return rightOutputs;
    }

    /**
     * Returns the indexes of the keys whose left column holds the coalesced key of both
     * sides (full joins on same-named key columns).
     *
     * @return key indexes
     */
    public List<Integer> coalescedKeys() {
        return coalescedKeys;
    }

    /**
     * Returns the common type in which the keys at the given index are compared.
     *
     * @param index the key index
     * @return the comparison type
     */
    public DataType keyType(int index) {
        return TypeCoercion.commonSupertype(leftKeys.get(index).dataType(), rightKeys.get(index).dataType())
            .orElseThrow();
    }

    public Join withJoinType(JoinType type) {
        return new Join(left(), right(), type, leftKeys, rightKeys, options);
    }

    public Join withKeys(List<Expression> newLeftKeys, List<Expression> newRightKeys) {
        return new Join(left(), right(), joinType, newLeftKeys, newRightKeys, options);
    }

    public Join withOptions(JoinOptions newOptions) {
        return new Join(left(), right(), joinType, leftKeys, rightKeys, newOptions);
    }

    @Override
    protected StructType inferSchema() {
        List<StructField> fields = new ArrayList<>();
        StructType leftSchema = left().schema();
        for (StructField field : leftSchema.fields()) {
            fields.add(field);
        }
        for (int index : coalescedKeys) {
            ColumnReference key = (ColumnReference) leftKeys.get(index);
            int position = leftSchema.fieldIndex(key.name());
            fields.set(position, new StructField(key.name(), keyType(index)));
        }
        StructType rightSchema = right().schema();
        for (RightOutput output : rightOutputs) {
            fields.add(new StructField(output.name(), rightSchema.field(output.source()).dataType()));
        }
        return new StructType(fields);
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Join(newChildren.get(0), newChildren.get(1), joinType, leftKeys, rightKeys, options);
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(leftKeys);
        all.addAll(rightKeys);
        return all;
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        List<Expression> l = mapAll(leftKeys, fn);
        List<Expression> r = mapAll(rightKeys, fn);
        if (sameExpressions(l, leftKeys) && sameExpressions(r, rightKeys)) {
            return this;
        }
        return withKeys(l, r);
    }

    @Override
    public OptionalLong estimatedRowCount() {
        OptionalLong left = left().estimatedRowCount();
        OptionalLong right = right().estimatedRowCount();
        switch (joinType) {
            case SEMI:
            case ANTI:
            case ASOF:
                return left;
            case CROSS:
                if (left.isPresent() && right.isPresent()) {
                    return OptionalLong.of(left.getAsLong() * right.getAsLong());
                }
                return OptionalLong.empty();
            default:
                return OptionalLong.empty();
        }
    }

    @Override
    protected List<Object> parameters() {
        return List.of(joinType, leftKeys, rightKeys, options);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Join(").append(joinType.joinName());
        if (joinType != JoinType.CROSS) {
            sb.append(", left_on=").append(leftKeys).append(", right_on=").append(rightKeys);
        }
        if (joinType == JoinType.ASOF) {
            sb.append(", strategy=").append(options.asofStrategy().name().toLowerCase());
            if (options.tolerance() != null) {
                sb.append(", tolerance=").append(options.tolerance());
            }
            if (!options.leftBy().isEmpty()) {
                sb.append(", by=").append(options.leftBy());
            }
        }
        if (options.buildSide() != JoinOptions.BuildSide.AUTO) {
            sb.append(", build=").append(options.buildSide().name().toLowerCase());
        }
        return sb.append(')').toString();
    }
}
