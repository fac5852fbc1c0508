package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import com.lazyframe.types.TypeCoercion;
import com.lazyframe.types.UnresolvedType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conditional expression: {@code when(c1).then(v1).when(c2).then(v2).otherwise(v)}.
 *
 * <p>Each row takes the value of the first branch whose condition is true; a null
 * condition counts as false. A branch value is only evaluated for the rows that select
 * it, so an expression that would fail on other rows is safe inside a branch.
 */
public final class CaseWhenExpression implements Expression {

    /**
     * One {@code when/then} pair.
     */
    public record Branch(Expression condition, Expression value) {
        public Branch {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    private final List<Branch> branches;
    private final Expression otherwise;

    /**
     * Creates a conditional expression.
     *
     * @param branches the branches, at least one
     * @param otherwise the value when no branch matches
     */
    public CaseWhenExpression(List<Branch> branches, Expression otherwise) {
        this.branches = List.copyOf(Objects.requireNonNull(branches, "branches must not be null"));
        this.otherwise = Objects.requireNonNull(otherwise, "otherwise must not be null");
        if (this.branches.isEmpty()) {
            throw new IllegalArgumentException("at least one when/then branch is required");
        }
    }

    public List<Branch> branches() {
        return branches;
    }

    public Expression otherwise() {
        return otherwise;
    }

    /**
     * Returns the value expressions of all branches followed by the otherwise value.
     *
     * @return the value expressions
     */
    public List<Expression> values() {
        List<Expression> values = new ArrayList<>(branches.size() + 1);
        for (Branch branch : branches) {
            values.add(branch.value());
        }
        values.add(otherwise);
        return values;
    }

    @Override
    public DataType dataType() {
        List<DataType> types = new ArrayList<>();
        for (Expression value : values()) {
            DataType type = value.dataType();
            if (type instanceof UnresolvedType) {
                return type;
            }
            types.add(type);
        }
        return TypeCoercion.commonSupertype(types).orElse(UnresolvedType.get());
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>(branches.size() * 2 + 1);
        for (Branch branch : branches) {
            children.add(branch.condition());
            children.add(branch.value());
        }
        children.add(otherwise);
        return children;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        List<Branch> newBranches = new ArrayList<>(branches.size());
        for (int i = 0; i < branches.size(); i++) {
            newBranches.add(new Branch(children.get(2 * i), children.get(2 * i + 1)));
        }
        return new CaseWhenExpression(newBranches, children.get(children.size() - 1));
    }

    @Override
    public String outputName() {
        return branches.get(0).value().outputName();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CaseWhenExpression)) return false;
        CaseWhenExpression that = (CaseWhenExpression) obj;
        return branches.equals(that.branches) && otherwise.equals(that.otherwise);
    }

    @Override
    public int hashCode() {
        return Objects.hash(branches, otherwise);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Branch branch : branches) {
            sb.append(sb.length() == 0 ? "when(" : ".when(").append(branch.condition())
              .append(").then(").append(branch.value()).append(')');
        }
        return sb.append(".otherwise(").append(otherwise).append(')').toString();
    }
}
