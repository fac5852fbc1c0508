package com.lazyframe.api;

import static com.lazyframe.api.Functions.col;
import static com.lazyframe.api.Functions.cumSum;
import static com.lazyframe.api.Functions.lag;
import static com.lazyframe.api.Functions.len;
import static com.lazyframe.api.Functions.rowNumber;
import static com.lazyframe.api.Functions.when;
import static com.lazyframe.test.BatchAssertions.row;
import static com.lazyframe.test.BatchAssertions.sortedRows;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.exception.InvalidOperationException;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.logical.Distinct;
import com.lazyframe.logical.JoinOptions;
import com.lazyframe.logical.JoinType;
import com.lazyframe.logical.Window;
import com.lazyframe.runtime.EngineConfig;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.test.TestData;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.ListType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.TimestampType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * End-to-end tests of the fluent query surface.
 *
 * <p>Every query runs on both executors; results must not depend on which one runs.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("LazyFrame Tests")
public class LazyFrameTest extends TestBase {

    private static final EngineConfig IN_MEMORY = TestData.inMemory();
    private static final EngineConfig STREAMING = TestData.streaming();

    private static ColumnarBatch collectBoth(LazyFrame frame) {
        ColumnarBatch inMemory = frame.withConfig(IN_MEMORY).collect();
        ColumnarBatch streaming = frame.withConfig(STREAMING).collect();
        assertThat(streaming.schema().names()).isEqualTo(inMemory.schema().names());
        assertThat(streaming.rows()).isEqualTo(inMemory.rows());
        return inMemory;
    }

    // ==================== Joins ====================

    @Nested
    @DisplayName("Join Tests")
    class JoinTests {

        private final LazyFrame a = LazyFrame.fromBatch("A", TestData.joinLeft());
        private final LazyFrame b = LazyFrame.fromBatch("B", TestData.joinRight());

        @Test
        @DisplayName("Inner join keeps matching rows only")
        void testInnerJoin() {
            logStep("When: A inner join B on id");
            ColumnarBatch result = collectBoth(a.join(b, "id", JoinType.INNER));
            logData("Result", result);

            assertThat(result.schema().names()).containsExactly("id", "x", "y");
            assertThat(result.rows()).containsExactly(row(1L, "a", 10L));
        }

        @Test
        @DisplayName("Left join null-extends unmatched left rows")
        void testLeftJoin() {
            ColumnarBatch result = collectBoth(a.join(b, "id", JoinType.LEFT));

            assertThat(result.schema().names()).containsExactly("id", "x", "y");
            assertThat(result.rows()).containsExactly(row(1L, "a", 10L), row(2L, "b", null));
        }

        @Test
        @DisplayName("Full join coalesces keys and appends unmatched right rows")
        void testFullJoin() {
            ColumnarBatch result = collectBoth(a.join(b, "id", JoinType.FULL));

            assertThat(result.schema().names()).containsExactly("id", "x", "y");
            assertThat(result.rows()).containsExactly(
                row(1L, "a", 10L), row(2L, "b", null), row(3L, null, 30L));
        }

        @Test
        @DisplayName("Semi and anti joins return left columns only")
        void testSemiAntiJoin() {
            ColumnarBatch semi = collectBoth(a.join(b, "id", JoinType.SEMI));
            ColumnarBatch anti = collectBoth(a.join(b, "id", JoinType.ANTI));

            assertThat(semi.schema().names()).containsExactly("id", "x");
            assertThat(semi.rows()).containsExactly(row(1L, "a"));
            assertThat(anti.rows()).containsExactly(row(2L, "b"));
        }

        @Test
        @DisplayName("Cross join suffixes colliding right columns")
        void testCrossJoin() {
            ColumnarBatch result = collectBoth(a.crossJoin(b));

            assertThat(result.schema().names()).containsExactly("id", "x", "id_right", "y");
            assertThat(result.rows()).containsExactly(
                row(1L, "a", 1L, 10L), row(1L, "a", 3L, 30L),
                row(2L, "b", 1L, 10L), row(2L, "b", 3L, 30L));
        }

        @Test
        @DisplayName("Null keys never match")
        void testNullKeysNeverMatch() {
            LazyFrame left = LazyFrame.fromBatch("L", ColumnarBatch.of(
                Column.of("k", LongType.get(), 1L, null),
                Column.of("v", StringType.get(), "one", "none")));
            LazyFrame right = LazyFrame.fromBatch("R", ColumnarBatch.of(
                Column.of("k", LongType.get(), null, 1L),
                Column.of("w", StringType.get(), "null-right", "one-right")));

            ColumnarBatch result = collectBoth(left.join(right, "k", JoinType.LEFT));

            assertThat(result.rows()).containsExactly(row(1L, "one", "one-right"), row(null, "none", null));
        }

        @Test
        @DisplayName("Join keys of different integer widths are compared by value")
        void testMixedWidthKeys() {
            LazyFrame left = LazyFrame.fromBatch("L", ColumnarBatch.of(
                Column.of("k", IntegerType.get(), 1, 2)));
            LazyFrame right = LazyFrame.fromBatch("R", ColumnarBatch.of(
                Column.of("k2", LongType.get(), 2L, 3L)));

            ColumnarBatch result = collectBoth(left.join(right, List.of("k"), List.of("k2"), JoinType.INNER));

            assertThat(result.rows()).containsExactly(row(2, 2L));
        }

        @Test
        @DisplayName("As-of join searches backward, forward and nearest")
        void testAsofJoin() {
            LazyFrame quotes = LazyFrame.fromBatch("quotes", ColumnarBatch.of(
                Column.of("t", LongType.get(), 1L, 5L, 10L)));
            LazyFrame trades = LazyFrame.fromBatch("trades", ColumnarBatch.of(
                Column.of("t", LongType.get(), 2L, 4L, 9L),
                Column.of("p", StringType.get(), "a", "b", "c")));

            ColumnarBatch backward = collectBoth(
                quotes.joinAsof(trades, "t", "t", JoinOptions.AsofStrategy.BACKWARD, null));
            ColumnarBatch forward = collectBoth(
                quotes.joinAsof(trades, "t", "t", JoinOptions.AsofStrategy.FORWARD, null));
            ColumnarBatch nearest = collectBoth(
                quotes.joinAsof(trades, "t", "t", JoinOptions.AsofStrategy.NEAREST, null));
            ColumnarBatch tolerant = collectBoth(
                quotes.joinAsof(trades, "t", "t", JoinOptions.AsofStrategy.FORWARD, 1L));

            assertThat(backward.schema().names()).containsExactly("t", "p");
            assertThat(backward.column("p").toList()).containsExactly(null, "b", "c");
            assertThat(forward.column("p").toList()).containsExactly("a", "c", null);
            assertThat(nearest.column("p").toList()).containsExactly("a", "b", "c");
            assertThat(tolerant.column("p").toList()).containsExactly("a", null, null);
        }

        @Test
        @DisplayName("As-of distances on large integer keys are exact")
        void testAsofLargeIntegerKeys() {
            long base = 1L << 60;
            LazyFrame quotes = LazyFrame.fromBatch("quotes", ColumnarBatch.of(
                Column.of("t", LongType.get(), base + 130)));
            LazyFrame trades = LazyFrame.fromBatch("trades", ColumnarBatch.of(
                Column.of("t", LongType.get(), base + 120, base + 380),
                Column.of("p", StringType.get(), "near", "far")));

            ColumnarBatch nearest = collectBoth(
                quotes.joinAsof(trades, "t", "t", JoinOptions.AsofStrategy.NEAREST, null));
            ColumnarBatch tolerant = collectBoth(
                quotes.joinAsof(trades, "t", "t", JoinOptions.AsofStrategy.BACKWARD, 10L));
            ColumnarBatch tooFar = collectBoth(
                quotes.joinAsof(trades, "t", "t", JoinOptions.AsofStrategy.BACKWARD, 9L));

            assertThat(nearest.column("p").toList()).containsExactly("near");
            assertThat(tolerant.column("p").toList()).containsExactly("near");
            assertThat(tooFar.column("p").toList()).containsExactly((Object) null);
        }

        @Test
        @DisplayName("As-of nearest across the whole long range")
        void testAsofExtremeKeys() {
            LazyFrame quotes = LazyFrame.fromBatch("quotes", ColumnarBatch.of(
                Column.of("t", LongType.get(), 0L)));
            LazyFrame trades = LazyFrame.fromBatch("trades", ColumnarBatch.of(
                Column.of("t", LongType.get(), Long.MIN_VALUE, Long.MAX_VALUE),
                Column.of("p", StringType.get(), "min", "max")));

            ColumnarBatch nearest = collectBoth(
                quotes.joinAsof(trades, "t", "t", JoinOptions.AsofStrategy.NEAREST, null));
            ColumnarBatch tolerant = collectBoth(
                quotes.joinAsof(trades, "t", "t", JoinOptions.AsofStrategy.FORWARD, Long.MAX_VALUE));

            assertThat(nearest.column("p").toList()).containsExactly("max");
            assertThat(tolerant.column("p").toList()).containsExactly("max");
        }

        @Test
        @DisplayName("As-of join matches within by groups and duration tolerance")
        void testAsofJoinByGroups() {
            LazyFrame left = LazyFrame.fromBatch("left", ColumnarBatch.of(
                TestData.timestamps("ts", TestData.ts(1, 10), TestData.ts(1, 10), TestData.ts(1, 20)),
                Column.of("sym", StringType.get(), "x", "y", "x")));
            LazyFrame right = LazyFrame.fromBatch("right", ColumnarBatch.of(
                TestData.timestamps("ts", TestData.ts(1, 9), TestData.ts(1, 5), TestData.ts(1, 12)),
                Column.of("sym", StringType.get(), "x", "y", "x"),
                Column.of("px", DoubleType.get(), 1.0, 2.0, 3.0)));

            ColumnarBatch result = collectBoth(left.joinAsof(right, "ts", "ts",
                JoinOptions.AsofStrategy.BACKWARD, "2h", List.of("sym"), List.of("sym")));

            assertThat(result.schema().names()).containsExactly("ts", "sym", "px");
            assertThat(result.column("px").toList()).containsExactly(1.0, null, null);
        }

        @Test
        @DisplayName("Unsorted as-of keys fail at execution")
        void testAsofUnsorted() {
            LazyFrame left = LazyFrame.fromBatch("left", ColumnarBatch.of(Column.of("t", LongType.get(), 5L, 1L)));
            LazyFrame right = LazyFrame.fromBatch("right", ColumnarBatch.of(Column.of("t", LongType.get(), 1L, 2L)));

            LazyFrame joined = left.joinAsof(right, "t", "t", JoinOptions.AsofStrategy.BACKWARD, null)
                .withConfig(IN_MEMORY);

            assertThatThrownBy(joined::collect)
                .isInstanceOf(ComputeException.class)
                .hasMessageContaining("sorted");
        }
    }

    // ==================== Aggregation ====================

    @Nested
    @DisplayName("Group By Tests")
    class GroupByTests {

        @Test
        @DisplayName("Sum per key is independent of input order")
        void testSumPerKey() {
            ColumnarBatch groups = TestData.groups();
            ColumnarBatch reversed = groups.take(new int[] {2, 1, 0});

            ColumnarBatch forward = collectBoth(LazyFrame.fromBatch("t", groups).groupBy("k").agg(col("v").sum()));
            ColumnarBatch backward = collectBoth(LazyFrame.fromBatch("t", reversed).groupBy("k").agg(col("v").sum()));

            assertThat(forward.schema().names()).containsExactly("k", "v");
            assertThat(forward.rows()).containsExactly(row(1L, 6L), row(2L, 5L));
            assertThat(sortedRows(backward)).isEqualTo(sortedRows(forward));
        }

        @Test
        @DisplayName("Groups appear in first-seen order")
        void testFirstSeenOrder() {
            ColumnarBatch reversed = TestData.groups().take(new int[] {2, 1, 0});

            ColumnarBatch result = collectBoth(LazyFrame.fromBatch("t", reversed).groupBy("k").len());

            assertThat(result.rows()).containsExactly(row(2L, 1L), row(1L, 2L));
        }

        @Test
        @DisplayName("Aggregation outputs may combine aggregates")
        void testCombinedAggregates() {
            LazyFrame frame = LazyFrame.fromBatch("t", TestData.groups());

            ColumnarBatch result = collectBoth(frame.groupBy("k").agg(
                col("v").sum().div(col("v").count()).alias("avg"),
                col("v").max().minus(col("v").min()).alias("range"),
                len()));

            assertThat(result.schema().names()).containsExactly("k", "avg", "range", "len");
            assertThat(result.rows()).containsExactly(row(1L, 3.0, 2L, 2L), row(2L, 5.0, 0L, 1L));
        }

        @Test
        @DisplayName("Global aggregation of an empty input yields one row")
        void testEmptyGlobalAggregation() {
            LazyFrame frame = LazyFrame.fromBatch("t", TestData.groups()).filter(col("v").gt(100L));

            ColumnarBatch result = collectBoth(frame.agg(col("v").sum().alias("s"), col("v").mean().alias("m"), len()));

            assertThat(result.rows()).containsExactly(row(0L, null, 0L));
        }

        @Test
        @DisplayName("Statistical aggregates use one delta degree of freedom")
        void testStatistics() {
            LazyFrame frame = LazyFrame.fromBatch("t", ColumnarBatch.of(
                Column.of("v", DoubleType.get(), 1.0, 2.0, 3.0, 4.0, null)));

            ColumnarBatch result = collectBoth(frame.agg(
                Functions.var("v").alias("var"),
                Functions.median("v").alias("median"),
                Functions.nUnique("v").alias("distinct"),
                Functions.count("v").alias("count")));

            assertThat((Double) result.column("var").get(0)).isCloseTo(5.0 / 3.0, within(1e-12));
            assertThat(result.column("median").get(0)).isEqualTo(2.5);
            assertThat(result.column("distinct").get(0)).isEqualTo(5L);
            assertThat(result.column("count").get(0)).isEqualTo(4L);
        }

        @Test
        @DisplayName("Columns outside aggregates must be grouping keys")
        void testNonKeyColumnRejected() {
            LazyFrame frame = LazyFrame.fromBatch("t", TestData.groups());

            assertThatThrownBy(() -> frame.groupBy("k").agg(col("v")))
                .isInstanceOf(InvalidOperationException.class);
        }
    }

    // ==================== Row-wise operations ====================

    @Nested
    @DisplayName("Projection Tests")
    class ProjectionTests {

        private final LazyFrame orders = LazyFrame.fromBatch("orders", TestData.orders(100));

        @Test
        @DisplayName("Filter then select keeps order and values")
        void testFilterSelect() {
            ColumnarBatch result = collectBoth(orders
                .filter(col("qty").gtEq(45))
                .select("id", "qty"));

            assertThat(result.schema().names()).containsExactly("id", "qty");
            assertThat(result.column("qty").toList()).allSatisfy(q -> assertThat((Integer) q).isGreaterThanOrEqualTo(45));
            List<Object> ids = result.column("id").toList();
            assertThat(ids).isSortedAccordingTo((x, y) -> Long.compare((Long) x, (Long) y));
        }

        @Test
        @DisplayName("With-columns replaces in place and appends new columns")
        void testWithColumns() {
            ColumnarBatch result = collectBoth(orders
                .withColumns(col("qty").times(2).alias("qty"), col("id").plus(1L).alias("next"))
                .head(3));

            assertThat(result.schema().names()).containsExactly("id", "region", "amount", "qty", "note", "next");
            assertThat(result.column("next").toList()).containsExactly(1L, 2L, 3L);
            assertThat(result.column("qty").toList()).containsExactly(null, 26, 52);
        }

        @Test
        @DisplayName("When/then/otherwise evaluates branches per row")
        void testConditional() {
            ColumnarBatch result = collectBoth(orders
                .select(col("id"), when(col("qty").gt(25)).then("big").when(col("qty").isNull()).then("none")
                    .otherwise("small").alias("size"))
                .head(3));

            assertThat(result.column("size").toList()).containsExactly("none", "small", "big");
        }

        @Test
        @DisplayName("Unknown columns fail when the transformation is applied")
        void testUnknownColumn() {
            assertThatThrownBy(() -> orders.filter(col("missing").gt(1)))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("Unknown functions fail when the call is built")
        void testUnknownFunction() {
            assertThatThrownBy(() -> Functions.call("no_such_function", col("id")))
                .isInstanceOf(InvalidOperationException.class);
        }

        @Test
        @DisplayName("Rename and drop keep column positions")
        void testRenameDrop() {
            LazyFrame renamed = orders.rename(Map.of("qty", "quantity")).drop("note", "amount");

            assertThat(renamed.columns()).containsExactly("id", "region", "quantity");
            assertThat(collectBoth(renamed.head(2)).column("quantity").toList()).containsExactly(null, 13);
        }
    }

    // ==================== Windows ====================

    @Nested
    @DisplayName("Window Tests")
    class WindowTests {

        private final LazyFrame frame = LazyFrame.fromBatch("w", ColumnarBatch.of(
            Column.of("k", StringType.get(), "a", "a", "b", "a"),
            Column.of("v", LongType.get(), 3L, 1L, 2L, 5L)));

        @Test
        @DisplayName("Window functions are evaluated in a dedicated plan node")
        void testWindowExtraction() {
            LazyFrame result = frame.withColumns(rowNumber().over("k").orderBy(col("v").asc()).alias("rn"));

            assertThat(result.columns()).containsExactly("k", "v", "rn");
            assertThat(result.logicalPlan().child().child()).isInstanceOf(Window.class);
        }

        @Test
        @DisplayName("Ranking, offset, cumulative and broadcast aggregates")
        void testWindowValues() {
            ColumnarBatch result = collectBoth(frame.withColumns(
                rowNumber().over("k").orderBy(col("v").asc()).alias("rn"),
                col("v").sum().over("k").alias("total"),
                cumSum("v").over("k").alias("running"),
                lag("v", 1).over("k").alias("prev")));

            assertThat(result.column("rn").toList()).containsExactly(2L, 1L, 1L, 3L);
            assertThat(result.column("total").toList()).containsExactly(9L, 9L, 2L, 9L);
            assertThat(result.column("running").toList()).containsExactly(3L, 4L, 2L, 9L);
            assertThat(result.column("prev").toList()).containsExactly(null, 3L, null, 1L);
        }

        @Test
        @DisplayName("Window results can feed further expressions in a select")
        void testWindowInsideExpression() {
            ColumnarBatch result = collectBoth(frame.select(
                col("k"), col("v").minus(col("v").mean().over("k")).alias("delta")));

            assertThat(result.schema().names()).containsExactly("k", "delta");
            assertThat(result.column("delta").toList()).containsExactly(0.0, -2.0, 0.0, 2.0);
        }
    }

    // ==================== Ordering and slicing ====================

    @Nested
    @DisplayName("Sort and Slice Tests")
    class SortSliceTests {

        private final LazyFrame frame = LazyFrame.fromBatch("s", ColumnarBatch.of(
            Column.of("x", DoubleType.get(), 3.0, null, Double.NaN, 1.0, Double.NEGATIVE_INFINITY),
            Column.of("i", LongType.get(), 0L, 1L, 2L, 3L, 4L)));

        @Test
        @DisplayName("Nulls sort first and NaN sorts greatest")
        void testSortDefaults() {
            ColumnarBatch result = collectBoth(frame.sort("x"));

            assertThat(result.column("i").toList()).containsExactly(1L, 4L, 3L, 0L, 2L);
        }

        @Test
        @DisplayName("Descending with nulls last")
        void testSortDescendingNullsLast() {
            ColumnarBatch result = collectBoth(frame.sort(List.of("x"), true, true));

            assertThat(result.column("i").toList()).containsExactly(2L, 0L, 3L, 4L, 1L);
        }

        @Test
        @DisplayName("Sort is stable for equal keys")
        void testStableSort() {
            LazyFrame ties = LazyFrame.fromBatch("t", ColumnarBatch.of(
                Column.of("k", LongType.get(), 2L, 1L, 2L, 1L),
                Column.of("pos", LongType.get(), 0L, 1L, 2L, 3L)));

            ColumnarBatch result = collectBoth(ties.sort(col("k").desc()));

            assertThat(result.column("pos").toList()).containsExactly(0L, 2L, 1L, 3L);
        }

        @Test
        @DisplayName("Head of a sort returns the top rows")
        void testTopK() {
            ColumnarBatch result = collectBoth(frame.sort(col("i").desc()).head(2));

            assertThat(result.column("i").toList()).containsExactly(4L, 3L);
        }

        @ParameterizedTest(name = "tail({0})")
        @ValueSource(longs = {0, 1, 3, 5, 10})
        @DisplayName("Tail returns the last rows")
        void testTail(long n) {
            ColumnarBatch result = collectBoth(frame.tail(n));

            assertThat(result.rowCount()).isEqualTo((int) Math.min(n, 5));
            if (n > 0) {
                assertThat(result.column("i").get(result.rowCount() - 1)).isEqualTo(4L);
            }
        }

        @Test
        @DisplayName("Slice with a negative offset counts from the end")
        void testNegativeSlice() {
            ColumnarBatch result = collectBoth(frame.slice(-3, 2));

            assertThat(result.column("i").toList()).containsExactly(2L, 3L);
        }
    }

    // ==================== Reshaping ====================

    @Nested
    @DisplayName("Reshaping Tests")
    class ReshapingTests {

        @Test
        @DisplayName("Unique keeps first, last or no duplicate")
        void testUnique() {
            LazyFrame frame = LazyFrame.fromBatch("d", ColumnarBatch.of(
                Column.of("k", LongType.get(), 1L, 2L, 1L, 3L),
                Column.of("pos", LongType.get(), 0L, 1L, 2L, 3L)));

            ColumnarBatch first = collectBoth(frame.unique(List.of("k"), Distinct.Keep.FIRST));
            ColumnarBatch last = collectBoth(frame.unique(List.of("k"), Distinct.Keep.LAST));
            ColumnarBatch none = collectBoth(frame.unique(List.of("k"), Distinct.Keep.NONE));

            assertThat(first.column("pos").toList()).containsExactly(0L, 1L, 3L);
            assertThat(last.column("pos").toList()).containsExactly(1L, 2L, 3L);
            assertThat(none.column("pos").toList()).containsExactly(1L, 3L);
        }

        @Test
        @DisplayName("Explode produces one row per element and a null row for empty lists")
        void testExplode() {
            LazyFrame frame = LazyFrame.fromBatch("e", ColumnarBatch.of(
                Column.of("id", LongType.get(), 1L, 2L, 3L),
                Column.of("xs", new ListType(LongType.get()), List.of(1L, 2L), List.of(), null)));

            ColumnarBatch result = collectBoth(frame.explode("xs"));

            assertThat(result.typeOf("xs")).isEqualTo(LongType.get());
            assertThat(result.rows()).containsExactly(row(1L, 1L), row(1L, 2L), row(2L, null), row(3L, null));
        }

        @Test
        @DisplayName("Unpivot turns value columns into variable/value rows")
        void testUnpivot() {
            LazyFrame frame = LazyFrame.fromBatch("u", ColumnarBatch.of(
                Column.of("id", LongType.get(), 1L, 2L),
                Column.of("a", LongType.get(), 10L, 20L),
                Column.of("b", LongType.get(), 30L, 40L)));

            ColumnarBatch result = collectBoth(frame.unpivot(List.of("id"), List.of()));

            assertThat(result.schema().names()).containsExactly("id", "variable", "value");
            assertThat(result.rows()).containsExactly(
                row(1L, "a", 10L), row(2L, "a", 20L), row(1L, "b", 30L), row(2L, "b", 40L));
        }

        @Test
        @DisplayName("Union appends inputs in order")
        void testUnion() {
            LazyFrame a = LazyFrame.fromBatch("a", TestData.joinLeft());
            LazyFrame b = LazyFrame.fromBatch("b", TestData.joinLeft()).filter(col("id").eq(2L));

            ColumnarBatch result = collectBoth(LazyFrame.concat(List.of(a, b)));

            assertThat(result.column("x").toList()).containsExactly("a", "b", "b");
        }

        @Test
        @DisplayName("Upsample fills gaps and forward fills group columns")
        void testUpsample() {
            LazyFrame frame = LazyFrame.fromBatch("ts", ColumnarBatch.of(
                TestData.timestamps("time", TestData.ts(1, 0), TestData.ts(1, 3), TestData.ts(1, 1)),
                Column.of("g", StringType.get(), "a", "a", "b"),
                Column.of("v", LongType.get(), 1L, 2L, 3L)));

            ColumnarBatch result = collectBoth(frame.sort("time").upsample("time", "1h", "0ns", "g"));

            assertThat(result.typeOf("time")).isEqualTo(TimestampType.get());
            assertThat(result.rows()).containsExactly(
                row(TestData.ts(1, 0), "a", 1L),
                row(TestData.ts(1, 1), "a", null),
                row(TestData.ts(1, 2), "a", null),
                row(TestData.ts(1, 3), "a", 2L),
                row(TestData.ts(1, 1), "b", 3L));
        }

        @Test
        @DisplayName("Upsample rejects an unsorted time column")
        void testUpsampleUnsorted() {
            LazyFrame frame = LazyFrame.fromBatch("ts", ColumnarBatch.of(
                TestData.timestamps("time", TestData.ts(2, 0), TestData.ts(1, 0))));

            assertThatThrownBy(() -> frame.upsample("time", "1d", "0ns").withConfig(IN_MEMORY).collect())
                .isInstanceOf(ComputeException.class)
                .hasMessageContaining("sorted");
        }
    }

    // ==================== Explain ====================

    @Test
    @DisplayName("Explain renders the optimized logical and physical plans")
    void testExplain() {
        LazyFrame frame = LazyFrame.fromBatch("orders", TestData.orders(10))
            .filter(col("qty").gt(10))
            .select("id");

        String logical = frame.explain();
        String physical = frame.withConfig(STREAMING).explainPhysical();
        logData("Logical plan", logical);
        logData("Physical plan", physical);

        assertThat(logical).contains("Scan(orders").contains("predicate=");
        assertThat(frame.explainUnoptimized()).contains("Filter(");
        assertThat(physical).contains("PipelineExec");
    }
}
