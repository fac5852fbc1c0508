package com.lazyframe.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.ListType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.TimestampType;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampMilliVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Column} over Arrow vectors.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Column")
public class ColumnTest extends TestBase {

    @Nested
    @DisplayName("Storage")
    class StorageTests {

        @Test
        @DisplayName("Nulls live in the validity buffer")
        void testValidityNulls() {
            Column column = Column.of("v", LongType.get(), 1L, null, 3L);

            assertThat(column.size()).isEqualTo(3);
            assertThat(column.nullCount()).isEqualTo(1);
            assertThat(column.isNull(1)).isTrue();
            assertThat(column.get(1)).isNull();
            assertThat(column.getLong(2)).isEqualTo(3L);
            assertThat(column.values()).containsExactly(1L, null, 3L);
        }

        @Test
        @DisplayName("Builder writes primitives and leaves unset slots null")
        void testBuilderPrimitives() {
            Column ints = Column.builder("i", IntegerType.get(), 3)
                .setLong(0, 5L)
                .setLong(2, -1L)
                .build();
            Column doubles = Column.builder("d", DoubleType.get(), 2)
                .setDouble(0, 2.5)
                .setNull(1)
                .build();
            Column flags = Column.builder("b", BooleanType.get(), 3)
                .setBoolean(0, true)
                .setBoolean(1, false)
                .build();

            assertThat(ints.values()).containsExactly(5, null, -1);
            assertThat(ints.getLong(0)).isEqualTo(5L);
            assertThat(doubles.getDouble(0)).isEqualTo(2.5);
            assertThat(doubles.isNull(1)).isTrue();
            assertThat(flags.isTrue(0)).isTrue();
            assertThat(flags.isTrue(1)).isFalse();
            assertThat(flags.isTrue(2)).isFalse();
        }

        @Test
        @DisplayName("A value of the wrong kind is rejected")
        void testRejectsMismatchedValue() {
            assertThatThrownBy(() -> Column.of("v", LongType.get(), "seven"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Strings and lists read back as written")
        void testStringsAndLists() {
            Column strings = Column.of("s", StringType.get(), "a", null, "héllo");
            Column lists = Column.of("l", new ListType(LongType.get()),
                Arrays.asList(1L, null), null, List.of());

            assertThat(strings.values()).containsExactly("a", null, "héllo");
            assertThat(lists.get(0)).isEqualTo(Arrays.asList(1L, null));
            assertThat(lists.isNull(1)).isTrue();
            assertThat(lists.get(2)).isEqualTo(List.of());
        }

        @Test
        @DisplayName("Null-typed columns report every row null")
        void testNullType() {
            Column column = Column.nulls("n", NullType.get(), 4);

            assertThat(column.size()).isEqualTo(4);
            assertThat(column.nullCount()).isEqualTo(4);
            assertThat(Column.selectedRows(column)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Row operations")
    class RowOperationTests {

        @Test
        @DisplayName("take fills -1 indices with null")
        void testTake() {
            Column column = Column.of("s", StringType.get(), "a", "b", "c");

            Column taken = column.take(new int[] {2, -1, 0, 2});

            assertThat(taken.values()).containsExactly("c", null, "a", "c");
        }

        @Test
        @DisplayName("slice clamps to the column end")
        void testSlice() {
            Column column = Column.of("v", LongType.get(), 1L, 2L, 3L, 4L);

            assertThat(column.slice(1, 2).values()).containsExactly(2L, 3L);
            assertThat(column.slice(3, 10).values()).containsExactly(4L);
            assertThat(column.slice(0, 4)).isSameAs(column);
        }

        @Test
        @DisplayName("filter drops false and null mask entries")
        void testFilter() {
            Column column = Column.of("v", LongType.get(), 1L, 2L, 3L);
            Column mask = Column.of("m", BooleanType.get(), true, null, true);

            assertThat(column.filter(mask).values()).containsExactly(1L, 3L);
        }

        @Test
        @DisplayName("concat casts parts to the first column's type")
        void testConcat() {
            Column longs = Column.of("v", LongType.get(), 1L, null);
            Column ints = Column.of("other", IntegerType.get(), 7);

            Column joined = Column.concat(List.of(longs, ints));

            assertThat(joined.name()).isEqualTo("v");
            assertThat(joined.dataType()).isEqualTo(LongType.get());
            assertThat(joined.values()).containsExactly(1L, null, 7L);
        }

        @Test
        @DisplayName("cast converts each value and keeps nulls")
        void testCast() {
            Column column = Column.of("v", StringType.get(), "12", null, "x");

            Column lenient = column.cast(LongType.get(), false);

            assertThat(lenient.values()).containsExactly(12L, null, null);
        }

        @Test
        @DisplayName("rename shares values under a new name")
        void testRename() {
            Column column = Column.of("v", DoubleType.get(), 1.5, null);

            Column renamed = column.rename("w");

            assertThat(renamed.name()).isEqualTo("w");
            assertThat(renamed.values()).isEqualTo(column.values());
            assertThat(column.rename("v")).isSameAs(column);
        }
    }

    @Nested
    @DisplayName("Foreign vectors")
    class ForeignVectorTests {

        @Test
        @DisplayName("Int(16) vectors widen to int32")
        void testSmallIntCopy() {
            try (SmallIntVector source = new SmallIntVector("n", ColumnVectors.allocator())) {
                source.allocateNew(3);
                source.set(0, (short) 4);
                source.setNull(1);
                source.set(2, (short) -7);
                source.setValueCount(3);

                Column column = Column.copyOf("n", IntegerType.get(), source);

                assertThat(column.values()).containsExactly(4, null, -7);
            }
        }

        @Test
        @DisplayName("Millisecond timestamps convert to microseconds")
        void testMillisecondTimestampCopy() {
            try (TimeStampMilliVector source = new TimeStampMilliVector("t", ColumnVectors.allocator())) {
                source.allocateNew(2);
                source.set(0, 1_500L);
                source.setNull(1);
                source.setValueCount(2);

                Column column = Column.copyOf("t", TimestampType.get(), source);

                assertThat(column.get(0)).isEqualTo(LocalDateTime.of(1970, 1, 1, 0, 0, 1, 500_000_000));
                assertThat(column.isNull(1)).isTrue();
            }
        }
    }
}
