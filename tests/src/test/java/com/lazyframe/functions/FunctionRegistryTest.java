package com.lazyframe.functions;

import static com.lazyframe.api.Functions.abs;
import static com.lazyframe.api.Functions.call;
import static com.lazyframe.api.Functions.col;
import static com.lazyframe.api.Functions.round;
import static com.lazyframe.api.Functions.upper;
import static com.lazyframe.api.Functions.year;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lazyframe.api.LazyFrame;
import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.exception.InvalidOperationException;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.expression.Expression;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.test.TestData;
import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.ListType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for {@link FunctionRegistry} and the registered scalar functions.
 */
@TestCategories.Tier1
@TestCategories.Expression
@DisplayName("FunctionRegistry")
public class FunctionRegistryTest extends TestBase {

    private static final ColumnarBatch INPUT = ColumnarBatch.of(
        Column.of("s", StringType.get(), "Hello", "wörld", null),
        Column.of("d", DoubleType.get(), 2.5, -2.5, Double.NaN),
        Column.of("i", IntegerType.get(), -4, 9, null),
        TestData.timestamps("t", TestData.ts(3, 4), TestData.ts(5, 6), null));

    private static List<Object> evaluate(Expression expr) {
        return LazyFrame.fromBatch("t", INPUT)
            .select(expr.alias("out"))
            .collect()
            .column("out")
            .toList();
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"upper", "UPPER", "Starts_With", "coalesce", "fill_nan", "random"})
        @DisplayName("Names are matched case-insensitively")
        void testLookup(String name) {
            assertThat(FunctionRegistry.isSupported(name)).isTrue();
            assertThat(FunctionRegistry.lookup(name)).isPresent();
        }

        @Test
        @DisplayName("Unknown names are not found")
        void testUnknown() {
            assertThat(FunctionRegistry.lookup("soundex")).isEmpty();
            assertThat(FunctionRegistry.lookup(null)).isEmpty();
            assertThatThrownBy(() -> call("soundex", col("s")))
                .isInstanceOf(InvalidOperationException.class)
                .hasMessageContaining("soundex");
        }

        @Test
        @DisplayName("The registry lists every function once")
        void testListing() {
            assertThat(FunctionRegistry.functionNames())
                .contains("upper", "substring", "round", "year", "coalesce")
                .hasSize(FunctionRegistry.registeredFunctionCount());
        }

        @Test
        @DisplayName("Only random is nondeterministic")
        void testDeterminism() {
            assertThat(FunctionRegistry.lookup("random").orElseThrow().isDeterministic()).isFalse();
            assertThat(FunctionRegistry.lookup("sqrt").orElseThrow().isDeterministic()).isTrue();
        }

        @Test
        @DisplayName("A duplicate registration is rejected")
        void testDuplicateRegistration() {
            FunctionRegistry.Registrar registrar = new FunctionRegistry.Registrar();
            ScalarFunction twice = ScalarFunction.builder("twice")
                .returnType(ScalarFunction.firstArgTypePreserving())
                .invoker((args, type) -> args[0])
                .build();
            registrar.register(twice);

            assertThatThrownBy(() -> registrar.register(twice)).isInstanceOf(IllegalStateException.class);
            assertThat(registrar.build()).containsOnlyKeys("twice");
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("A wrong argument count fails when the frame is built")
        void testArity() {
            LazyFrame frame = LazyFrame.fromBatch("t", INPUT);

            assertThatThrownBy(() -> frame.select(call("upper", col("s"), col("s"))))
                .isInstanceOf(InvalidOperationException.class)
                .hasMessageContaining("upper");
            assertThatThrownBy(() -> frame.select(call("substring", col("s"))))
                .isInstanceOf(InvalidOperationException.class);
        }

        @Test
        @DisplayName("A wrong argument type fails when the frame is built")
        void testArgumentType() {
            LazyFrame frame = LazyFrame.fromBatch("t", INPUT);

            assertThatThrownBy(() -> frame.select(upper(col("d"))))
                .isInstanceOf(SchemaException.class);
        }

        @Test
        @DisplayName("A cast with no conversion fails when the frame is built")
        void testUnsupportedCast() {
            LazyFrame frame = LazyFrame.fromBatch("t",
                ColumnarBatch.of(Column.of("l", new ListType(LongType.get()), (Object) List.of(1L))));

            assertThatThrownBy(() -> frame.select(col("l").cast(BooleanType.get())))
                .isInstanceOf(ComputeException.class)
                .hasMessageContaining("cannot cast");
        }
    }

    static Stream<Arguments> results() {
        return Stream.of(
            Arguments.of("upper", upper(col("s")), Arrays.asList("HELLO", "WÖRLD", null)),
            Arguments.of("length", call("length", col("s")), Arrays.asList(5L, 5L, null)),
            Arguments.of("concat", call("concat", col("s"), "!"), Arrays.asList("Hello!", "wörld!", null)),
            Arguments.of("substring", call("substring", col("s"), 1, 3), Arrays.asList("ell", "örl", null)),
            Arguments.of("substring negative start", call("substring", col("s"), -2),
                Arrays.asList("lo", "ld", null)),
            Arguments.of("replace", call("replace", col("s"), "l", "L"), Arrays.asList("HeLLo", "wörLd", null)),
            Arguments.of("contains", call("contains", col("s"), "ll"), Arrays.asList(true, false, null)),
            Arguments.of("round half away from zero", round(col("d"), 0), Arrays.asList(3.0, -3.0, Double.NaN)),
            Arguments.of("abs keeps the type", abs(col("i")), Arrays.asList(4, 9, null)),
            Arguments.of("is_nan", call("is_nan", col("d")), Arrays.asList(false, false, true)),
            Arguments.of("fill_nan", call("fill_nan", col("d"), 0.0), Arrays.asList(2.5, -2.5, 0.0)),
            Arguments.of("coalesce", call("coalesce", col("i"), 0), Arrays.asList(-4, 9, 0)),
            Arguments.of("year", year(col("t")), Arrays.asList(2024, 2024, null)),
            Arguments.of("day", call("day", col("t")), Arrays.asList(3, 5, null))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("results")
    @DisplayName("Function results")
    void testFunctionResults(String description, Expression expr, List<Object> expected) {
        List<Object> actual = evaluate(expr);
        logData(description, actual);

        assertThat(actual).isEqualTo(expected);
    }

    @Test
    @DisplayName("Random values lie in the unit interval")
    void testRandom() {
        List<Object> values = evaluate(call("random"));

        assertThat(values).hasSize(3).allSatisfy(v -> assertThat((Double) v).isBetween(0.0, 1.0));
    }
}
