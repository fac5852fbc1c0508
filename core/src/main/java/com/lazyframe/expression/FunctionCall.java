package com.lazyframe.expression;

import com.lazyframe.functions.FunctionRegistry;
import com.lazyframe.functions.ScalarFunction;
import com.lazyframe.types.DataType;
import com.lazyframe.types.UnresolvedType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A call of a scalar function from the {@link FunctionRegistry}.
 *
 * <p>Examples:
 * <pre>
 *   upper(name)
 *   round(price, 2)
 *   coalesce(a, b, 0)
 * </pre>
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;

    /**
     * Creates a function call.
     *
     * @param functionName the function name (case-insensitive)
     * @param arguments the arguments
     */
    public FunctionCall(String functionName, List<Expression> arguments) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null")
            .toLowerCase(Locale.ROOT);
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    /**
     * Returns the registered function.
     *
     * @return the function, or empty if the name is unknown
     */
    public Optional<ScalarFunction> function() {
        return FunctionRegistry.lookup(functionName);
    }

    /**
     * Returns the argument types.
     *
     * @return the types, in argument order
     */
    public List<DataType> argumentTypes() {
        List<DataType> types = new ArrayList<>(arguments.size());
        for (Expression argument : arguments) {
            types.add(argument.dataType());
        }
        return types;
    }

    @Override
    public DataType dataType() {
        Optional<ScalarFunction> function = function();
        if (function.isEmpty() || !function.get().acceptsArgumentCount(arguments.size())) {
            return UnresolvedType.get();
        }
        List<DataType> types = argumentTypes();
        if (types.contains(UnresolvedType.get())) {
            return UnresolvedType.get();
        }
        return function.get().returnType(types);
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new FunctionCall(functionName, children);
    }

    @Override
    public String outputName() {
        return arguments.isEmpty() ? functionName : arguments.get(0).outputName();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return functionName.equals(that.functionName) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments);
    }

    @Override
    public String toString() {
        List<String> args = new ArrayList<>(arguments.size());
        for (Expression argument : arguments) {
            args.add(argument.toString());
        }
        return functionName + "(" + String.join(", ", args) + ")";
    }
}
