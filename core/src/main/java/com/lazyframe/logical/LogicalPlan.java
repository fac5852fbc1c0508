package com.lazyframe.logical;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.expression.Expression;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Base class for all logical plan nodes.
 *
 * <p>This represents a node in the logical query plan graph. Each node has zero or more
 * children and defines a schema (output columns and types). Plans are immutable: every
 * constructor resolves its expressions against the children's schemas and validates them,
 * so an invalid plan cannot be built. Rewrites produce new nodes through
 * {@link #withChildren(List)} and {@link #mapExpressions(UnaryOperator)}, sharing
 * unchanged subtrees.
 *
 * <p>The set of node kinds is closed; optimizer passes and the physical planner handle
 * every kind explicitly.
 *
 * <p>Equality is structural: two plans are equal when they are nodes of the same kind with
 * equal parameters over equal children. Scans compare their data sources by identity.
 *
 * @see PlanPrinter
 */
public abstract sealed class LogicalPlan
    permits Scan, Filter, Project, WithColumns, Aggregate, Join, Sort, Window, Union,
            Distinct, Explode, Unpivot, Slice, Cache, Upsample {

    /** Child nodes in the plan graph */
    protected final List<LogicalPlan> children;

    /** Output schema of this node, computed on first access */
    private StructType schema;

    private int hash;

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(Objects.requireNonNull(child, "child must not be null"));
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        Objects.requireNonNull(children, "children must not be null");
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    /**
     * Infers the output schema for this logical plan node from its parameters and the
     * children's schemas.
     *
     * @return the output schema
     */
    protected abstract StructType inferSchema();

    /**
     * Returns a copy of this node over new children.
     *
     * @param newChildren the children, in the order of {@link #children()}
     * @return the rebuilt node
     */
    public abstract LogicalPlan withChildren(List<LogicalPlan> newChildren);

    /**
     * Returns the operator-specific parameters that, together with the children, define
     * this node's identity.
     *
     * @return the parameters
     */
    protected abstract List<Object> parameters();

    /**
     * Returns the expressions this node evaluates, in a node-specific order.
     *
     * @return the expressions (empty for nodes without expressions)
     */
    public List<Expression> expressions() {
        return Collections.emptyList();
    }

    /**
     * Returns a copy of this node with every top-level expression transformed. The result
     * is resolved again against the children's schemas.
     *
     * @param fn the transformation
     * @return the rewritten node, or this node if nothing changed
     */
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        return this;
    }

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return children;
    }

    /**
     * Returns the only child of a unary node.
     *
     * @return the child
     */
    public LogicalPlan child() {
        if (children.size() != 1) {
            throw new IllegalStateException(nodeName() + " has " + children.size() + " children");
        }
        return children.get(0);
    }

    /**
     * Returns the output schema of this plan node.
     *
     * <p>If the schema hasn't been computed yet, this calls {@link #inferSchema()}
     * to compute it.
     *
     * @return the output schema
     */
    public StructType schema() {
        if (schema == null) {
            schema = inferSchema();
        }
        return schema;
    }

    /**
     * Returns an upper bound or estimate of the number of output rows, if one is known.
     *
     * @return the estimate, or empty
     */
    public OptionalLong estimatedRowCount() {
        return OptionalLong.empty();
    }

    /**
     * Returns the operator name used in plan renderings and error context.
     *
     * @return the node name
     */
    public String nodeName() {
        return getClass().getSimpleName();
    }

    /**
     * Applies a rewrite to every node, children first.
     *
     * @param rule the rewrite
     * @return the rewritten plan
     */
    public LogicalPlan transformUp(UnaryOperator<LogicalPlan> rule) {
        LogicalPlan node = this;
        if (!children.isEmpty()) {
            List<LogicalPlan> rewritten = new ArrayList<>(children.size());
            boolean changed = false;
            for (LogicalPlan child : children) {
                LogicalPlan next = child.transformUp(rule);
                changed |= next != child;
                rewritten.add(next);
            }
            if (changed) {
                node = withChildren(rewritten);
            }
        }
        return rule.apply(node);
    }

    /**
     * Counts the nodes of this plan.
     *
     * @return the node count
     */
    public int size() {
        int count = 1;
        for (LogicalPlan child : children) {
            count += child.size();
        }
        return count;
    }

    protected static StructType schemaOf(List<Expression> exprs, String operator) {
        List<StructField> fields = new ArrayList<>(exprs.size());
        Set<String> seen = new HashSet<>();
        for (Expression expr : exprs) {
            String name = expr.outputName();
            if (!seen.add(name)) {
                throw new SchemaException("duplicate output column '" + name
                    + "'; use alias() to give it a distinct name", null, operator, name);
            }
            fields.add(new StructField(name, expr.dataType()));
        }
        return new StructType(fields);
    }

    protected static boolean sameExpressions(List<Expression> a, List<Expression> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) {
                return false;
            }
        }
        return true;
    }

    protected static List<Expression> mapAll(List<Expression> exprs, UnaryOperator<Expression> fn) {
        List<Expression> result = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            result.add(fn.apply(expr));
        }
        return result;
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || obj.getClass() != getClass()) return false;
        LogicalPlan that = (LogicalPlan) obj;
        return hashCode() == that.hashCode()
            && parameters().equals(that.parameters())
            && children.equals(that.children);
    }

    @Override
    public final int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(getClass(), parameters(), children);
            hash = h;
        }
        return h;
    }

    /**
     * Returns a one-line description of this node (without children).
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();
}
