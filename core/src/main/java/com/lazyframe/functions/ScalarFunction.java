package com.lazyframe.functions;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.types.DataType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.TypeCoercion;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Metadata and implementation of one scalar function: arity, return-type rule, argument
 * coercion, determinism and the row-wise implementation.
 *
 * <p>Instances are created with {@link #builder(String)} and registered once in
 * {@link FunctionRegistry}.
 */
public final class ScalarFunction {

    /**
     * Computes the result type from the argument types.
     */
    @FunctionalInterface
    public interface ReturnTypeRule {
        /**
         * @param argTypes the resolved argument types
         * @return the result type
         * @throws SchemaException if the arguments have unsupported types
         */
        DataType resolve(List<DataType> argTypes);
    }

    /**
     * Computes the types the arguments are cast to before invocation.
     */
    @FunctionalInterface
    public interface ArgumentCoercion {
        List<DataType> coerce(List<DataType> argTypes);
    }

    /**
     * Row-wise implementation.
     */
    @FunctionalInterface
    public interface Invoker {
        /**
         * @param args the argument values of one row, already cast to the coerced types
         * @param resultType the statically resolved result type
         * @return the result value (may be null)
         */
        Object invoke(Object[] args, DataType resultType);
    }

    private final String name;
    private final int minArgs;
    private final int maxArgs;
    private final boolean deterministic;
    private final boolean nullPropagating;
    private final ReturnTypeRule returnType;
    private final ArgumentCoercion argumentCoercion;
    private final Invoker invoker;

    private ScalarFunction(Builder builder) {
        this.name = builder.name;
        this.minArgs = builder.minArgs;
        this.maxArgs = builder.maxArgs;
        this.deterministic = builder.deterministic;
        this.nullPropagating = builder.nullPropagating;
        this.returnType = Objects.requireNonNull(builder.returnType, "returnType must not be null");
        this.argumentCoercion = builder.argumentCoercion;
        this.invoker = Objects.requireNonNull(builder.invoker, "invoker must not be null");
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public int minArgs() {
        return minArgs;
    }

    /**
     * @return the maximum argument count, or {@link Integer#MAX_VALUE} for variadic functions
     */
    public int maxArgs() {
        return maxArgs;
    }

    public boolean isDeterministic() {
        return deterministic;
    }

    /**
     * Whether a null in any argument makes the result null without invoking the function.
     *
     * @return true if nulls propagate
     */
    public boolean isNullPropagating() {
        return nullPropagating;
    }

    public boolean acceptsArgumentCount(int count) {
        return count >= minArgs && count <= maxArgs;
    }

    /**
     * Resolves the result type.
     *
     * @param argTypes the argument types
     * @return the result type
     * @throws SchemaException if the argument types are not supported
     */
    public DataType returnType(List<DataType> argTypes) {
        return returnType.resolve(argTypes);
    }

    /**
     * Returns the types arguments are cast to before invocation.
     *
     * @param argTypes the argument types
     * @return the coerced argument types
     */
    public List<DataType> coerceArguments(List<DataType> argTypes) {
        return argumentCoercion == null ? argTypes : argumentCoercion.coerce(argTypes);
    }

    /**
     * Invokes the function on one row.
     *
     * @param args the argument values
     * @param resultType the result type
     * @return the result
     */
    public Object invoke(Object[] args, DataType resultType) {
        if (nullPropagating) {
            for (Object arg : args) {
                if (arg == null) {
                    return null;
                }
            }
        }
        return invoker.invoke(args, resultType);
    }

    @Override
    public String toString() {
        return name + "/" + (maxArgs == Integer.MAX_VALUE ? minArgs + "+" : minArgs == maxArgs
            ? String.valueOf(minArgs) : minArgs + ".." + maxArgs);
    }

    // ==================== Common type rules ====================

    /**
     * The result has the type of the first argument.
     *
     * @return the rule
     */
    public static ReturnTypeRule firstArgTypePreserving() {
        return argTypes -> argTypes.get(0);
    }

    /**
     * The result has a fixed type.
     *
     * @param type the result type
     * @return the rule
     */
    public static ReturnTypeRule fixed(DataType type) {
        return argTypes -> type;
    }

    /**
     * The result is the common supertype of all arguments.
     *
     * @param functionName the function name, for error messages
     * @return the rule
     */
    public static ReturnTypeRule supertypeOfArguments(String functionName) {
        return argTypes -> TypeCoercion.commonSupertype(argTypes).orElseThrow(() ->
            new SchemaException(functionName + "() arguments have no common type: " + argTypes));
    }

    /**
     * Casts every argument to one type.
     *
     * @param type the target type
     * @return the coercion
     */
    public static ArgumentCoercion allTo(DataType type) {
        return argTypes -> Collections.nCopies(argTypes.size(), type);
    }

    /**
     * Casts every argument to the common supertype of all arguments.
     *
     * @return the coercion
     */
    public static ArgumentCoercion allToSupertype() {
        return argTypes -> {
            DataType common = TypeCoercion.commonSupertype(argTypes).orElse(NullType.get());
            return new ArrayList<>(Collections.nCopies(argTypes.size(), common));
        };
    }

    /**
     * Builder for {@link ScalarFunction}.
     */
    public static final class Builder {
        private final String name;
        private int minArgs = 1;
        private int maxArgs = 1;
        private boolean deterministic = true;
        private boolean nullPropagating = true;
        private ReturnTypeRule returnType;
        private ArgumentCoercion argumentCoercion;
        private Invoker invoker;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null").toLowerCase();
        }

        public Builder arity(int count) {
            return arity(count, count);
        }

        public Builder arity(int min, int max) {
            if (min < 0 || max < min) {
                throw new IllegalArgumentException("invalid arity " + min + ".." + max + " for " + name);
            }
            this.minArgs = min;
            this.maxArgs = max;
            return this;
        }

        public Builder variadic(int min) {
            return arity(min, Integer.MAX_VALUE);
        }

        public Builder nondeterministic() {
            this.deterministic = false;
            return this;
        }

        /**
         * Marks the function as handling null arguments itself.
         *
         * @return this builder
         */
        public Builder handlesNulls() {
            this.nullPropagating = false;
            return this;
        }

        public Builder returnType(ReturnTypeRule rule) {
            this.returnType = rule;
            return this;
        }

        public Builder coerceArguments(ArgumentCoercion coercion) {
            this.argumentCoercion = coercion;
            return this;
        }

        public Builder invoker(Invoker invoker) {
            this.invoker = invoker;
            return this;
        }

        public ScalarFunction build() {
            return new ScalarFunction(this);
        }
    }
}
