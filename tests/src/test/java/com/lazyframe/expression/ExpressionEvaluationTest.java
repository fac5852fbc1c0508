package com.lazyframe.expression;

import static com.lazyframe.api.Functions.coalesce;
import static com.lazyframe.api.Functions.col;
import static com.lazyframe.api.Functions.lit;
import static com.lazyframe.api.Functions.when;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lazyframe.api.LazyFrame;
import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.data.ValueOps;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.test.TestData;
import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Row-wise evaluation of expressions, checked with and without optimization.
 */
@TestCategories.Tier1
@TestCategories.Expression
@DisplayName("Expression evaluation")
public class ExpressionEvaluationTest extends TestBase {

    private static final ColumnarBatch INPUT = ColumnarBatch.of(
        Column.of("b", BooleanType.get(), true, false, null),
        Column.of("x", LongType.get(), 1L, null, 3L),
        Column.of("s", StringType.get(), "1", "x", null),
        Column.of("d", DoubleType.get(), 2.5, -2.5, Double.NaN));

    /**
     * Evaluates one expression over {@link #INPUT}, asserting that the optimized and the
     * unoptimized query agree.
     */
    private List<Object> evaluate(Expression expr) {
        LazyFrame frame = LazyFrame.fromBatch("t", INPUT).select(expr.alias("out"));
        List<Object> optimized = frame.withConfig(TestData.inMemory()).collect().column("out").toList();
        List<Object> plain = frame.withConfig(TestData.unoptimized()).collect().column("out").toList();
        logData(expr.toString(), optimized);
        assertThat(optimized).isEqualTo(plain);
        return optimized;
    }

    private static List<Object> values(Object... values) {
        return Arrays.asList(values);
    }

    @Nested
    @DisplayName("Three-valued logic")
    class LogicTests {

        @Test
        @DisplayName("A known operand can decide the result when the other is null")
        void testDominatingOperands() {
            assertThat(evaluate(col("b").or(true))).isEqualTo(values(true, true, true));
            assertThat(evaluate(col("b").and(false))).isEqualTo(values(false, false, false));
        }

        @Test
        @DisplayName("Otherwise null stays null")
        void testUnknownStaysUnknown() {
            assertThat(evaluate(col("b").and(true))).isEqualTo(values(true, false, null));
            assertThat(evaluate(col("b").or(false))).isEqualTo(values(true, false, null));
            assertThat(evaluate(col("b").not())).isEqualTo(values(false, true, null));
        }

        @Test
        @DisplayName("Null tests are never null")
        void testNullTests() {
            assertThat(evaluate(col("x").isNull())).isEqualTo(values(false, true, false));
            assertThat(evaluate(col("s").isNotNull())).isEqualTo(values(true, true, false));
        }

        @Test
        @DisplayName("Null tests on literals build expressions")
        void testLiteralNullTests() {
            Literal missing = Literal.nullOf(LongType.get());
            assertThat(missing.isNullValue()).isTrue();
            assertThat(Literal.of(5L).isNullValue()).isFalse();
            assertThat(evaluate(missing.isNull())).isEqualTo(values(true, true, true));
            assertThat(evaluate(Literal.of(5L).isNotNull())).isEqualTo(values(true, true, true));
        }
    }

    @Nested
    @DisplayName("Arithmetic and comparison")
    class ArithmeticTests {

        @Test
        @DisplayName("Null operands produce null")
        void testNullPropagation() {
            assertThat(evaluate(col("x").plus(1L))).isEqualTo(values(2L, null, 4L));
            assertThat(evaluate(col("x").gt(1L))).isEqualTo(values(false, null, true));
        }

        @Test
        @DisplayName("True division always yields a float")
        void testTrueDivision() {
            assertThat(evaluate(col("x").div(2L))).isEqualTo(values(0.5, null, 1.5));
            assertThat(evaluate(col("x").div(0L))).isEqualTo(
                values(Double.POSITIVE_INFINITY, null, Double.POSITIVE_INFINITY));
        }

        @Test
        @DisplayName("Integer floor division and modulo by zero give null")
        void testIntegralByZero() {
            assertThat(evaluate(col("x").floorDiv(0L))).isEqualTo(values(null, null, null));
            assertThat(evaluate(col("x").mod(0L))).isEqualTo(values(null, null, null));
            assertThat(evaluate(col("x").mod(-2L))).isEqualTo(values(-1L, null, -1L));
        }

        @Test
        @DisplayName("Column arithmetic matches per-value arithmetic at the edges")
        void testColumnArithmeticMatchesValueOps() {
            ColumnarBatch edges = ColumnarBatch.of(
                Column.of("a", IntegerType.get(), Integer.MAX_VALUE, Integer.MIN_VALUE, 7, null, -7),
                Column.of("b", IntegerType.get(), 1, -1, -2, 3, 0),
                Column.of("p", LongType.get(), Long.MAX_VALUE, Long.MIN_VALUE, -9L, 4L, null),
                Column.of("q", LongType.get(), 1L, -1L, 4L, 0L, 2L),
                Column.of("f", DoubleType.get(), -0.0, Double.NaN, 7.5, -7.5, null),
                Column.of("g", DoubleType.get(), 0.0, 1.0, -2.0, 2.0, 1.0));

            ColumnarBatch result = LazyFrame.fromBatch("edges", edges)
                .select(
                    col("a").plus(col("b")).alias("int_add"),
                    col("a").floorDiv(col("b")).alias("int_floor_div"),
                    col("a").mod(col("b")).alias("int_mod"),
                    col("p").minus(col("q")).alias("long_sub"),
                    col("p").floorDiv(col("q")).alias("long_floor_div"),
                    col("p").ltEq(col("q")).alias("long_le"),
                    col("f").mod(col("g")).alias("double_mod"),
                    col("f").eq(col("g")).alias("double_eq"),
                    col("f").gt(col("g")).alias("double_gt"))
                .withConfig(TestData.inMemory())
                .collect();

            for (int row = 0; row < edges.rowCount(); row++) {
                Object a = edges.column("a").get(row);
                Object b = edges.column("b").get(row);
                Object p = edges.column("p").get(row);
                Object q = edges.column("q").get(row);
                Object f = edges.column("f").get(row);
                Object g = edges.column("g").get(row);
                boolean ints = a != null && b != null;
                boolean longs = p != null && q != null;
                boolean doubles = f != null && g != null;

                assertThat(result.column("int_add").get(row))
                    .isEqualTo(ints ? ValueOps.add(a, b, IntegerType.get()) : null);
                assertThat(result.column("int_floor_div").get(row))
                    .isEqualTo(ints ? ValueOps.floorDivide(a, b, IntegerType.get()) : null);
                assertThat(result.column("int_mod").get(row))
                    .isEqualTo(ints ? ValueOps.modulo(a, b, IntegerType.get()) : null);
                assertThat(result.column("long_sub").get(row))
                    .isEqualTo(longs ? ValueOps.subtract(p, q, LongType.get()) : null);
                assertThat(result.column("long_floor_div").get(row))
                    .isEqualTo(longs ? ValueOps.floorDivide(p, q, LongType.get()) : null);
                assertThat(result.column("long_le").get(row))
                    .isEqualTo(longs ? ValueOps.compare(p, q) <= 0 : null);
                assertThat(result.column("double_mod").get(row))
                    .isEqualTo(doubles ? ValueOps.modulo(f, g, DoubleType.get()) : null);
                assertThat(result.column("double_eq").get(row))
                    .isEqualTo(doubles ? ValueOps.compare(f, g) == 0 : null);
                assertThat(result.column("double_gt").get(row))
                    .isEqualTo(doubles ? ValueOps.compare(f, g) > 0 : null);
            }
            assertThat(result.column("int_add").get(0)).isEqualTo(Integer.MIN_VALUE);
            assertThat(result.column("double_eq").get(0)).isEqualTo(true);
        }

        @Test
        @DisplayName("Comparisons with NaN treat it as the greatest value")
        void testNaNComparison() {
            assertThat(evaluate(col("d").gt(1000.0))).isEqualTo(values(false, false, true));
        }

        @Test
        @DisplayName("Mismatched operand types fail when the frame is built")
        void testInvalidOperands() {
            LazyFrame frame = LazyFrame.fromBatch("t", INPUT);

            assertThatThrownBy(() -> frame.select(col("s").minus(col("x"))))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("cannot apply");
        }
    }

    @Nested
    @DisplayName("Membership, conditionals and casts")
    class ConditionalTests {

        @Test
        @DisplayName("A null option turns a miss into null")
        void testIsIn() {
            assertThat(evaluate(col("x").isIn(1L, 2L))).isEqualTo(values(true, null, false));
            assertThat(evaluate(col("x").isIn(1L, null))).isEqualTo(values(true, null, null));
        }

        @Test
        @DisplayName("A null condition falls through to the default")
        void testWhenNullCondition() {
            Expression label = when(col("x").gt(1L)).then("big").otherwiseNull();

            assertThat(evaluate(label)).isEqualTo(values(null, null, "big"));
        }

        @Test
        @DisplayName("The first matching branch wins")
        void testChainedWhen() {
            Expression bucket = when(col("x").ltEq(1L)).then("low")
                .when(col("x").ltEq(5L)).then("mid")
                .otherwise("none");

            assertThat(evaluate(bucket)).isEqualTo(values("low", "none", "mid"));
        }

        @Test
        @DisplayName("Coalesce returns the first non-null argument")
        void testCoalesce() {
            assertThat(evaluate(coalesce(col("x"), 0L))).isEqualTo(values(1L, 0L, 3L));
        }

        @Test
        @DisplayName("A lenient cast turns unparseable values into null")
        void testLenientCast() {
            assertThat(evaluate(col("s").cast(LongType.get(), false))).isEqualTo(values(1L, null, null));
        }

        @Test
        @DisplayName("A strict cast of an unparseable value fails the query")
        void testStrictCast() {
            LazyFrame frame = LazyFrame.fromBatch("t", INPUT).select(col("s").cast(LongType.get()).alias("n"));

            assertThatThrownBy(frame::collect)
                .isInstanceOf(ComputeException.class)
                .hasMessageContaining("'x'");
        }

        @Test
        @DisplayName("Literals are broadcast to the row count")
        void testLiteralBroadcast() {
            assertThat(evaluate(lit("k"))).isEqualTo(values("k", "k", "k"));
        }
    }
}
