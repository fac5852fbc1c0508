package com.lazyframe.types;

/**
 * Placeholder type of an expression whose column references have not been bound to
 * a schema yet.
 *
 * <p>Expressions built through the fluent API start out unresolved. The
 * {@link com.lazyframe.expression.eval.ExpressionResolver} replaces every unresolved
 * column with a typed reference when the expression is attached to a plan node, so no
 * plan node ever carries an unresolved type in its output schema.
 */
public final class UnresolvedType implements DataType {

    private static final UnresolvedType INSTANCE = new UnresolvedType();

    private UnresolvedType() {}

    public static UnresolvedType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "unresolved";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof UnresolvedType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
