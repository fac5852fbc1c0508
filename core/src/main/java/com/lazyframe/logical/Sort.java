package com.lazyframe.logical;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.SortOrder;
import com.lazyframe.expression.eval.ExpressionResolver;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeCoercion;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a multi-key sort.
 *
 * <p>The sort is stable: rows with equal keys keep their input order. Each key carries its
 * own direction and null placement; NaN sorts after every other floating point value.
 *
 * <p>A sort may carry a top-k hint, set by slice pushdown when only the first rows of the
 * sorted output are needed. The hint never changes the result: a top-k sort returns the
 * same leading rows as a full sort.
 */
public final class Sort extends LogicalPlan {

    private final List<SortOrder> sortOrders;
    private final long topK;

    /**
     * Creates a sort node.
     *
     * @param child the child node
     * @param sortOrders the sort keys, most significant first
     */
    public Sort(LogicalPlan child, List<SortOrder> sortOrders) {
        this(child, sortOrders, -1);
    }

    /**
     * Creates a sort node with a top-k hint.
     *
     * @param child the child node
     * @param sortOrders the sort keys, most significant first
     * @param topK the number of leading rows needed, or -1 for all
     */
    public Sort(LogicalPlan child, List<SortOrder> sortOrders, long topK) {
        super(child);
        Objects.requireNonNull(sortOrders, "sortOrders must not be null");
        if (sortOrders.isEmpty()) {
            throw new IllegalArgumentException("sort requires at least one key");
        }
        List<SortOrder> resolved = new ArrayList<>(sortOrders.size());
        for (SortOrder order : sortOrders) {
            SortOrder r = (SortOrder) ExpressionResolver.resolve(order, child.schema());
            if (!TypeCoercion.isOrderable(r.expression().dataType())) {
                throw new SchemaException("cannot sort by " + r.expression() + " of type "
                    + r.expression().dataType(), null, nodeName(), r.expression().outputName());
            }
            resolved.add(r);
        }
        this.sortOrders = List.copyOf(resolved);
        this.topK = topK < 0 ? -1 : topK;
    }

    public List<SortOrder> sortOrders() {
        return sortOrders;
    }

    public long topK() {
        return topK;
    }

    public Sort withTopK(long k) {
        return new Sort(child(), sortOrders, k);
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Sort(newChildren.get(0), sortOrders, topK);
    }

    @Override
    public List<Expression> expressions() {
        return new ArrayList<>(sortOrders);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        List<SortOrder> mapped = new ArrayList<>(sortOrders.size());
        boolean changed = false;
        for (SortOrder order : sortOrders) {
            Expression next = fn.apply(order);
            changed |= next != order;
            mapped.add(next instanceof SortOrder s ? s : new SortOrder(next, order.descending(), order.nullsLast()));
        }
        return changed ? new Sort(child(), mapped, topK) : this;
    }

    @Override
    public OptionalLong estimatedRowCount() {
        OptionalLong estimate = child().estimatedRowCount();
        if (topK < 0) {
            return estimate;
        }
        return OptionalLong.of(estimate.isPresent() ? Math.min(estimate.getAsLong(), topK) : topK);
    }

    @Override
    protected List<Object> parameters() {
        return List.of(sortOrders, topK);
    }

    @Override
    public String toString() {
        return topK < 0
            ? String.format("Sort(%s)", sortOrders)
            : String.format("Sort(%s, topK=%d)", sortOrders, topK);
    }
}
