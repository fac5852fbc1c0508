package com.lazyframe.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lazyframe.exception.ComputeException;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DateType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.ListType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.TimestampType;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ValueOps}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ValueOps")
public class ValueOpsTest extends TestBase {

    @Nested
    @DisplayName("Comparison")
    class ComparisonTests {

        @Test
        @DisplayName("NaN orders after positive infinity")
        void testNaNIsGreatest() {
            assertThat(ValueOps.compare(Double.NaN, Double.POSITIVE_INFINITY)).isPositive();
            assertThat(ValueOps.compare(Double.NaN, Double.NaN)).isZero();

            List<Object> values = new ArrayList<>(Arrays.asList(3.0, Double.NaN, -1.0, null, Double.POSITIVE_INFINITY));
            values.sort((a, b) -> ValueOps.compareNullable(a, b, false));
            logData("Sorted", values);

            assertThat(values).containsExactly(null, -1.0, 3.0, Double.POSITIVE_INFINITY, Double.NaN);
        }

        @Test
        @DisplayName("Negative zero equals positive zero")
        void testNegativeZero() {
            assertThat(ValueOps.compare(-0.0, 0.0)).isZero();
            assertThat(ValueOps.valuesEqual(-0.0f, 0.0)).isTrue();
            assertThat(ValueOps.normalizeKey(-0.0)).isEqualTo(ValueOps.normalizeKey(0.0));
        }

        @Test
        @DisplayName("Integers of different widths compare by value")
        void testMixedWidths() {
            assertThat(ValueOps.compare(5, 5L)).isZero();
            assertThat(ValueOps.compare(Long.MAX_VALUE, 1)).isPositive();
            assertThat(ValueOps.compare(2, 2.5)).isNegative();
            assertThat(ValueOps.normalizeKey(7)).isEqualTo(7L);
        }

        @Test
        @DisplayName("Nulls order first unless nulls last is requested")
        void testNullOrdering() {
            assertThat(ValueOps.compareNullable(null, 1, false)).isNegative();
            assertThat(ValueOps.compareNullable(null, 1, true)).isPositive();
            assertThat(ValueOps.compareNullable(null, null, true)).isZero();
        }

        @Test
        @DisplayName("Dates compare with timestamps at midnight")
        void testDateAgainstTimestamp() {
            LocalDate day = LocalDate.of(2024, 3, 1);
            assertThat(ValueOps.compare(day, day.atStartOfDay())).isZero();
            assertThat(ValueOps.compare(day, LocalDateTime.of(2024, 3, 1, 0, 1))).isNegative();
        }

        @Test
        @DisplayName("Strings, booleans, dates and timestamps use their natural order")
        void testNaturalOrder() {
            assertThat(ValueOps.compare("apple", "banana")).isNegative();
            assertThat(ValueOps.compare(false, true)).isNegative();
            assertThat(ValueOps.compare(true, true)).isZero();
            assertThat(ValueOps.compare(LocalDate.of(2024, 3, 2), LocalDate.of(2024, 3, 1))).isPositive();
            assertThat(ValueOps.compare(LocalDateTime.of(2024, 3, 1, 9, 0), LocalDateTime.of(2024, 3, 1, 10, 0)))
                .isNegative();
        }

        @Test
        @DisplayName("Incomparable values raise a compute error")
        void testIncomparable() {
            assertThatThrownBy(() -> ValueOps.compare("a", 1))
                .isInstanceOf(ComputeException.class)
                .hasMessageContaining("cannot compare");
            assertThatThrownBy(() -> ValueOps.compare(true, "true"))
                .isInstanceOf(ComputeException.class)
                .hasMessageContaining("cannot compare");
        }
    }

    @Nested
    @DisplayName("Arithmetic")
    class ArithmeticTests {

        @Test
        @DisplayName("Integer floor division and modulo by zero are null")
        void testIntegralByZero() {
            assertThat(ValueOps.floorDivide(7L, 0L, LongType.get())).isNull();
            assertThat(ValueOps.modulo(7, 0, IntegerType.get())).isNull();
        }

        @Test
        @DisplayName("Floating division by zero follows IEEE")
        void testFloatingByZero() {
            assertThat(ValueOps.divide(1.0, 0.0, DoubleType.get())).isEqualTo(Double.POSITIVE_INFINITY);
            assertThat((Double) ValueOps.divide(0.0, 0.0, DoubleType.get())).isNaN();
        }

        @Test
        @DisplayName("Floor division rounds toward negative infinity")
        void testFloorDivision() {
            assertThat(ValueOps.floorDivide(-7L, 2L, LongType.get())).isEqualTo(-4L);
            assertThat(ValueOps.floorDivide(7, -2, IntegerType.get())).isEqualTo(-4);
        }

        @Test
        @DisplayName("Modulo takes the sign of the divisor")
        void testModuloSign() {
            assertThat(ValueOps.modulo(-7L, 3L, LongType.get())).isEqualTo(2L);
            assertThat(ValueOps.modulo(7L, -3L, LongType.get())).isEqualTo(-2L);
            assertThat(ValueOps.modulo(-7.5, 2.0, DoubleType.get())).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Results take the requested type")
        void testResultType() {
            assertThat(ValueOps.add(1, 2L, LongType.get())).isEqualTo(3L);
            assertThat(ValueOps.multiply(3, 0.5, DoubleType.get())).isEqualTo(1.5);
            assertThat(ValueOps.add("ab", "c", StringType.get())).isEqualTo("abc");
        }
    }

    @Nested
    @DisplayName("Casts")
    class CastTests {

        @Test
        @DisplayName("Strings parse to numbers, booleans and temporals")
        void testParse() {
            assertThat(ValueOps.cast(" 42 ", LongType.get(), true)).isEqualTo(42L);
            assertThat(ValueOps.cast("TRUE", BooleanType.get(), true)).isEqualTo(true);
            assertThat(ValueOps.cast("2024-02-29", DateType.get(), true)).isEqualTo(LocalDate.of(2024, 2, 29));
            assertThat(ValueOps.cast("2024-02-29 13:30", TimestampType.get(), true))
                .isEqualTo(LocalDateTime.of(2024, 2, 29, 13, 30));
            assertThat(ValueOps.cast("2024-13-01", DateType.get(), false)).isNull();
        }

        @Test
        @DisplayName("A failed strict cast raises and a failed lenient cast is null")
        void testStrictness() {
            assertThat(ValueOps.cast("x1", IntegerType.get(), false)).isNull();
            assertThatThrownBy(() -> ValueOps.cast("x1", IntegerType.get(), true))
                .isInstanceOf(ComputeException.class)
                .hasMessageContaining("x1");
        }

        @Test
        @DisplayName("Floats truncate toward zero and NaN does not convert")
        void testFloatToInteger() {
            assertThat(ValueOps.cast(-2.7, LongType.get(), true)).isEqualTo(-2L);
            assertThat(ValueOps.cast(Double.NaN, IntegerType.get(), false)).isNull();
            assertThat(ValueOps.cast(1e20, IntegerType.get(), false)).isNull();
            assertThatThrownBy(() -> ValueOps.cast(Double.NaN, LongType.get(), true))
                .isInstanceOf(ComputeException.class);
        }

        @Test
        @DisplayName("Narrowing a long that does not fit fails")
        void testLongOverflow() {
            assertThat(ValueOps.cast(5L, IntegerType.get(), true)).isEqualTo(5);
            assertThat(ValueOps.cast(Long.MAX_VALUE, IntegerType.get(), false)).isNull();
        }

        @Test
        @DisplayName("Null casts to null under any strictness")
        void testNull() {
            assertThat(ValueOps.cast(null, LongType.get(), true)).isNull();
        }

        @Test
        @DisplayName("Values format as strings")
        void testFormat() {
            assertThat(ValueOps.cast(1.5, StringType.get(), true)).isEqualTo("1.5");
            assertThat(ValueOps.format(Arrays.asList(1L, null))).isEqualTo("[1, null]");
        }
    }

    @Test
    @DisplayName("Java values map to data types")
    void testTypeOf() {
        assertThat(ValueOps.typeOf(1)).isEqualTo(IntegerType.get());
        assertThat(ValueOps.typeOf((short) 1)).isEqualTo(IntegerType.get());
        assertThat(ValueOps.typeOf(List.of("a"))).isEqualTo(new ListType(StringType.get()));
        assertThatThrownBy(() -> ValueOps.typeOf(new Object())).isInstanceOf(IllegalArgumentException.class);
    }
}
