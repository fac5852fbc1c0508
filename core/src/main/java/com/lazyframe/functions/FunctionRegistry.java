package com.lazyframe.functions;

import com.lazyframe.data.ValueOps;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.TimestampType;
import com.lazyframe.types.TypeCoercion;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Process-wide registry of scalar functions.
 *
 * <p>The registry is populated once, when the class initializes, and is read-only
 * afterwards. Registering two functions under the same name fails initialization, so a
 * broken registry is detected before any query runs. Function calls are resolved
 * against it when an expression is attached to a plan; unknown names fail immediately.
 *
 * <p>Function categories:
 * <ul>
 *   <li>String functions: upper, lower, length, concat, contains, starts_with,
 *       ends_with, replace, substring</li>
 *   <li>Math functions: abs, sqrt, round, floor, ceil, pow, is_nan, fill_nan, random</li>
 *   <li>Temporal functions: year, month, day, hour</li>
 *   <li>Conditional functions: coalesce</li>
 * </ul>
 */
public final class FunctionRegistry {

    private static final Map<String, ScalarFunction> FUNCTIONS;

    static {
        Registrar registrar = new Registrar();
        initializeStringFunctions(registrar);
        initializeMathFunctions(registrar);
        initializeTemporalFunctions(registrar);
        initializeConditionalFunctions(registrar);
        FUNCTIONS = registrar.build();
    }

    private FunctionRegistry() {
        // Static registry - prevent instantiation
    }

    /**
     * Looks up a function by name (case-insensitive).
     *
     * @param functionName the function name
     * @return the function, or empty if not registered
     */
    public static Optional<ScalarFunction> lookup(String functionName) {
        if (functionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(FUNCTIONS.get(functionName.toLowerCase(Locale.ROOT)));
    }

    /**
     * Checks if a function is supported.
     *
     * @param functionName the function name
     * @return true if registered
     */
    public static boolean isSupported(String functionName) {
        return lookup(functionName).isPresent();
    }

    /**
     * Gets the total number of registered functions.
     *
     * @return the count of registered functions
     */
    public static int registeredFunctionCount() {
        return FUNCTIONS.size();
    }

    /**
     * Returns the registered function names.
     *
     * @return the names, in registration order
     */
    public static Set<String> functionNames() {
        return FUNCTIONS.keySet();
    }

    /**
     * Collects function definitions and rejects duplicate names.
     */
    public static final class Registrar {
        private final Map<String, ScalarFunction> functions = new LinkedHashMap<>();

        /**
         * Registers a function.
         *
         * @param function the function
         * @throws IllegalStateException if a function of the same name is registered
         */
        public void register(ScalarFunction function) {
            ScalarFunction previous = functions.putIfAbsent(function.name(), function);
            if (previous != null) {
                throw new IllegalStateException("Duplicate function registration: " + function.name());
            }
        }

        public Map<String, ScalarFunction> build() {
            return Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        }
    }

    // ==================== String Functions ====================

    private static void initializeStringFunctions(Registrar registrar) {
        registrar.register(ScalarFunction.builder("upper")
            .returnType(stringArgs("upper", StringType.get()))
            .invoker((args, type) -> ((String) args[0]).toUpperCase(Locale.ROOT))
            .build());

        registrar.register(ScalarFunction.builder("lower")
            .returnType(stringArgs("lower", StringType.get()))
            .invoker((args, type) -> ((String) args[0]).toLowerCase(Locale.ROOT))
            .build());

        registrar.register(ScalarFunction.builder("length")
            .returnType(stringArgs("length", LongType.get()))
            .invoker((args, type) -> {
                String s = (String) args[0];
                return (long) s.codePointCount(0, s.length());
            })
            .build());

        registrar.register(ScalarFunction.builder("concat")
            .variadic(1)
            .returnType(stringArgs("concat", StringType.get()))
            .invoker((args, type) -> {
                StringBuilder sb = new StringBuilder();
                for (Object arg : args) {
                    sb.append((String) arg);
                }
                return sb.toString();
            })
            .build());

        registrar.register(ScalarFunction.builder("contains")
            .arity(2)
            .returnType(stringArgs("contains", BooleanType.get()))
            .invoker((args, type) -> ((String) args[0]).contains((String) args[1]))
            .build());

        registrar.register(ScalarFunction.builder("starts_with")
            .arity(2)
            .returnType(stringArgs("starts_with", BooleanType.get()))
            .invoker((args, type) -> ((String) args[0]).startsWith((String) args[1]))
            .build());

        registrar.register(ScalarFunction.builder("ends_with")
            .arity(2)
            .returnType(stringArgs("ends_with", BooleanType.get()))
            .invoker((args, type) -> ((String) args[0]).endsWith((String) args[1]))
            .build());

        registrar.register(ScalarFunction.builder("replace")
            .arity(3)
            .returnType(stringArgs("replace", StringType.get()))
            .invoker((args, type) -> ((String) args[0]).replace((String) args[1], (String) args[2]))
            .build());

        // substring(s, start[, length]); start is 0-based, negative counts from the end
        registrar.register(ScalarFunction.builder("substring")
            .arity(2, 3)
            .returnType(argTypes -> {
                requireType("substring", argTypes, 0, StringType.get());
                for (int i = 1; i < argTypes.size(); i++) {
                    requireIntegral("substring", argTypes, i);
                }
                return StringType.get();
            })
            .coerceArguments(argTypes -> argTypes.size() == 2
                ? List.of(StringType.get(), LongType.get())
                : List.of(StringType.get(), LongType.get(), LongType.get()))
            .invoker((args, type) -> {
                String s = (String) args[0];
                long start = (Long) args[1];
                if (start < 0) {
                    start = Math.max(0, s.length() + start);
                }
                int begin = (int) Math.min(start, s.length());
                long length = args.length > 2 ? Math.max(0, (Long) args[2]) : s.length();
                int end = (int) Math.min(s.length(), begin + length);
                return s.substring(begin, end);
            })
            .build());
    }

    // ==================== Math Functions ====================

    private static void initializeMathFunctions(Registrar registrar) {
        registrar.register(ScalarFunction.builder("abs")
            .returnType(numericPreserving("abs"))
            .invoker((args, type) -> {
                Object v = args[0];
                if (v instanceof Integer i) return Math.abs(i);
                if (v instanceof Long l) return Math.abs(l);
                if (v instanceof Float f) return Math.abs(f);
                return Math.abs((Double) v);
            })
            .build());

        registrar.register(ScalarFunction.builder("sqrt")
            .returnType(numericResult("sqrt", DoubleType.get()))
            .coerceArguments(ScalarFunction.allTo(DoubleType.get()))
            .invoker((args, type) -> Math.sqrt((Double) args[0]))
            .build());

        // round(x[, decimals]); half away from zero, integers are returned unchanged
        registrar.register(ScalarFunction.builder("round")
            .arity(1, 2)
            .returnType(argTypes -> {
                if (argTypes.size() > 1) {
                    requireIntegral("round", argTypes, 1);
                }
                return numericPreserving("round").resolve(argTypes.subList(0, 1));
            })
            .coerceArguments(argTypes -> argTypes.size() == 1
                ? argTypes : List.of(argTypes.get(0), IntegerType.get()))
            .invoker((args, type) -> {
                int decimals = args.length > 1 ? (Integer) args[1] : 0;
                return roundHalfAwayFromZero(args[0], decimals);
            })
            .build());

        registrar.register(ScalarFunction.builder("floor")
            .returnType(numericPreserving("floor"))
            .invoker((args, type) -> {
                Object v = args[0];
                if (v instanceof Float f) return (float) Math.floor(f);
                if (v instanceof Double d) return Math.floor(d);
                return v;
            })
            .build());

        registrar.register(ScalarFunction.builder("ceil")
            .returnType(numericPreserving("ceil"))
            .invoker((args, type) -> {
                Object v = args[0];
                if (v instanceof Float f) return (float) Math.ceil(f);
                if (v instanceof Double d) return Math.ceil(d);
                return v;
            })
            .build());

        registrar.register(ScalarFunction.builder("pow")
            .arity(2)
            .returnType(numericResult("pow", DoubleType.get()))
            .coerceArguments(ScalarFunction.allTo(DoubleType.get()))
            .invoker((args, type) -> Math.pow((Double) args[0], (Double) args[1]))
            .build());

        registrar.register(ScalarFunction.builder("is_nan")
            .returnType(numericResult("is_nan", BooleanType.get()))
            .invoker((args, type) -> {
                Object v = args[0];
                if (v instanceof Double d) return d.isNaN();
                if (v instanceof Float f) return f.isNaN();
                return false;
            })
            .build());

        // fill_nan(x, value); null stays null, NaN becomes value
        registrar.register(ScalarFunction.builder("fill_nan")
            .arity(2)
            .handlesNulls()
            .returnType(argTypes -> {
                requireNumeric("fill_nan", argTypes, 0);
                return ScalarFunction.supertypeOfArguments("fill_nan").resolve(argTypes);
            })
            .coerceArguments(ScalarFunction.allToSupertype())
            .invoker((args, type) -> {
                Object v = args[0];
                if (v == null) {
                    return null;
                }
                boolean nan = (v instanceof Double d && d.isNaN()) || (v instanceof Float f && f.isNaN());
                return nan ? args[1] : v;
            })
            .build());

        registrar.register(ScalarFunction.builder("random")
            .arity(0)
            .nondeterministic()
            .returnType(ScalarFunction.fixed(DoubleType.get()))
            .invoker((args, type) -> ThreadLocalRandom.current().nextDouble())
            .build());
    }

    // ==================== Temporal Functions ====================

    private static void initializeTemporalFunctions(Registrar registrar) {
        registrar.register(ScalarFunction.builder("year")
            .returnType(temporalArg("year"))
            .invoker((args, type) -> toDateTime(args[0]).getYear())
            .build());

        registrar.register(ScalarFunction.builder("month")
            .returnType(temporalArg("month"))
            .invoker((args, type) -> toDateTime(args[0]).getMonthValue())
            .build());

        registrar.register(ScalarFunction.builder("day")
            .returnType(temporalArg("day"))
            .invoker((args, type) -> toDateTime(args[0]).getDayOfMonth())
            .build());

        registrar.register(ScalarFunction.builder("hour")
            .returnType(argTypes -> {
                requireType("hour", argTypes, 0, TimestampType.get());
                return IntegerType.get();
            })
            .invoker((args, type) -> ((LocalDateTime) args[0]).getHour())
            .build());
    }

    // ==================== Conditional Functions ====================

    private static void initializeConditionalFunctions(Registrar registrar) {
        registrar.register(ScalarFunction.builder("coalesce")
            .variadic(1)
            .handlesNulls()
            .returnType(ScalarFunction.supertypeOfArguments("coalesce"))
            .coerceArguments(ScalarFunction.allToSupertype())
            .invoker((args, type) -> {
                for (Object arg : args) {
                    if (arg != null) {
                        return arg;
                    }
                }
                return null;
            })
            .build());
    }

    // ==================== Helpers ====================

    private static ScalarFunction.ReturnTypeRule stringArgs(String name, DataType result) {
        return argTypes -> {
            for (int i = 0; i < argTypes.size(); i++) {
                requireType(name, argTypes, i, StringType.get());
            }
            return result;
        };
    }

    private static ScalarFunction.ReturnTypeRule numericPreserving(String name) {
        return argTypes -> {
            requireNumeric(name, argTypes, 0);
            return argTypes.get(0) instanceof NullType ? DoubleType.get() : argTypes.get(0);
        };
    }

    private static ScalarFunction.ReturnTypeRule numericResult(String name, DataType result) {
        return argTypes -> {
            for (int i = 0; i < argTypes.size(); i++) {
                requireNumeric(name, argTypes, i);
            }
            return result;
        };
    }

    private static ScalarFunction.ReturnTypeRule temporalArg(String name) {
        return argTypes -> {
            DataType type = argTypes.get(0);
            if (!TypeCoercion.isTemporal(type) && !(type instanceof NullType)) {
                throw argumentError(name, 0, "date or datetime", type);
            }
            return IntegerType.get();
        };
    }

    private static void requireType(String name, List<DataType> argTypes, int index, DataType expected) {
        DataType actual = argTypes.get(index);
        if (!actual.equals(expected) && !(actual instanceof NullType)) {
            throw argumentError(name, index, expected.typeName(), actual);
        }
    }

    private static void requireNumeric(String name, List<DataType> argTypes, int index) {
        DataType actual = argTypes.get(index);
        if (!TypeCoercion.isNumeric(actual) && !(actual instanceof NullType)) {
            throw argumentError(name, index, "numeric", actual);
        }
    }

    private static void requireIntegral(String name, List<DataType> argTypes, int index) {
        DataType actual = argTypes.get(index);
        if (!TypeCoercion.isIntegral(actual) && !(actual instanceof NullType)) {
            throw argumentError(name, index, "integer", actual);
        }
    }

    private static SchemaException argumentError(String name, int index, String expected, DataType actual) {
        return new SchemaException(String.format(
            "%s() argument %d must be %s, got %s", name, index + 1, expected, actual));
    }

    private static LocalDateTime toDateTime(Object value) {
        if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        return (LocalDateTime) value;
    }

    private static Object roundHalfAwayFromZero(Object value, int decimals) {
        if (value instanceof Integer || value instanceof Long) {
            return value;
        }
        double d = ValueOps.toDouble(value);
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return value;
        }
        double rounded = BigDecimal.valueOf(d).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
        return value instanceof Float ? (Object) (float) rounded : (Object) rounded;
    }
}
