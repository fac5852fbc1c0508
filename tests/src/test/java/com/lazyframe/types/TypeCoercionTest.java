package com.lazyframe.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Tests for {@link TypeCoercion}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("TypeCoercion")
public class TypeCoercionTest extends TestBase {

    static Stream<Arguments> supertypes() {
        return Stream.of(
            Arguments.of(IntegerType.get(), LongType.get(), LongType.get()),
            Arguments.of(IntegerType.get(), FloatType.get(), DoubleType.get()),
            Arguments.of(LongType.get(), FloatType.get(), DoubleType.get()),
            Arguments.of(FloatType.get(), DoubleType.get(), DoubleType.get()),
            Arguments.of(DateType.get(), TimestampType.get(), TimestampType.get()),
            Arguments.of(NullType.get(), StringType.get(), StringType.get()),
            Arguments.of(BooleanType.get(), NullType.get(), BooleanType.get()),
            Arguments.of(new ListType(IntegerType.get()), new ListType(LongType.get()), new ListType(LongType.get()))
        );
    }

    @ParameterizedTest(name = "{0} + {1} = {2}")
    @MethodSource("supertypes")
    @DisplayName("Common supertypes widen without loss")
    void testCommonSupertype(DataType left, DataType right, DataType expected) {
        assertThat(TypeCoercion.commonSupertype(left, right)).contains(expected);
        assertThat(TypeCoercion.commonSupertype(right, left)).contains(expected);
    }

    @Test
    @DisplayName("Unrelated types have no supertype")
    void testNoSupertype() {
        assertThat(TypeCoercion.commonSupertype(StringType.get(), IntegerType.get())).isEmpty();
        assertThat(TypeCoercion.commonSupertype(BooleanType.get(), LongType.get())).isEmpty();
        assertThat(TypeCoercion.commonSupertype(
            List.of(IntegerType.get(), LongType.get(), StringType.get()))).isEmpty();
    }

    @Test
    @DisplayName("A list of types reduces left to right")
    void testSupertypeOfList() {
        Optional<DataType> common = TypeCoercion.commonSupertype(
            List.of(NullType.get(), IntegerType.get(), LongType.get(), NullType.get()));

        assertThat(common).contains(LongType.get());
        assertThat(TypeCoercion.commonSupertype(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Numeric promotion rejects non-numeric types")
    void testPromoteNumeric() {
        assertThat(TypeCoercion.promoteNumeric(LongType.get(), IntegerType.get())).isEqualTo(LongType.get());
        assertThatThrownBy(() -> TypeCoercion.promoteNumeric(StringType.get(), IntegerType.get()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    static Stream<Arguments> casts() {
        return Stream.of(
            Arguments.of(StringType.get(), LongType.get(), true),
            Arguments.of(StringType.get(), TimestampType.get(), true),
            Arguments.of(StringType.get(), BooleanType.get(), true),
            Arguments.of(DoubleType.get(), IntegerType.get(), true),
            Arguments.of(BooleanType.get(), DoubleType.get(), true),
            Arguments.of(TimestampType.get(), DateType.get(), true),
            Arguments.of(DateType.get(), LongType.get(), true),
            Arguments.of(NullType.get(), DateType.get(), true),
            Arguments.of(new ListType(StringType.get()), StringType.get(), true),
            Arguments.of(DateType.get(), BooleanType.get(), false),
            Arguments.of(LongType.get(), DateType.get(), false),
            Arguments.of(new ListType(LongType.get()), LongType.get(), false)
        );
    }

    @ParameterizedTest(name = "{0} -> {1}: {2}")
    @MethodSource("casts")
    @DisplayName("Cast availability")
    void testCanCast(DataType from, DataType to, boolean expected) {
        assertThat(TypeCoercion.canCast(from, to)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Type classification")
    void testClassification() {
        assertThat(TypeCoercion.isIntegral(IntegerType.get())).isTrue();
        assertThat(TypeCoercion.isFloating(FloatType.get())).isTrue();
        assertThat(TypeCoercion.isNumeric(BooleanType.get())).isFalse();
        assertThat(TypeCoercion.isTemporal(DateType.get())).isTrue();
        assertThat(TypeCoercion.isOrderable(StringType.get())).isTrue();
        assertThat(TypeCoercion.isOrderable(new ListType(LongType.get()))).isFalse();
    }
}
