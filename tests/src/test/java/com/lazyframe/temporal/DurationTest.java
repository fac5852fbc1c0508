package com.lazyframe.temporal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lazyframe.exception.InvalidOperationException;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for {@link Duration}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Duration")
public class DurationTest extends TestBase {

    private static final LocalDateTime NOON = LocalDateTime.of(2024, 1, 15, 12, 0);

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @ParameterizedTest(name = "{0}")
        @CsvSource({
            "1ns, 0, 0, 0, 1",
            "3us, 0, 0, 0, 3000",
            "2ms, 0, 0, 0, 2000000",
            "1h30m, 0, 0, 0, 5400000000000",
            "2d, 0, 0, 2, 0",
            "1w, 0, 1, 0, 0",
            "1mo2d, 1, 0, 2, 0",
            "1q, 3, 0, 0, 0",
            "2y, 24, 0, 0, 0"
        })
        @DisplayName("Compound terms accumulate per unit")
        void testComponents(String text, long months, long weeks, long days, long nanos) {
            Duration duration = Duration.parse(text);

            assertThat(duration.months()).isEqualTo(months);
            assertThat(duration.weeks()).isEqualTo(weeks);
            assertThat(duration.days()).isEqualTo(days);
            assertThat(duration.nanos()).isEqualTo(nanos);
            assertThat(duration.toString()).isEqualTo(text);
        }

        @Test
        @DisplayName("A leading minus negates the whole duration")
        void testNegative() {
            Duration duration = Duration.parse("-1d12h");

            assertThat(duration.isNegative()).isTrue();
            assertThat(duration.days()).isEqualTo(1);
            assertThat(duration.negated()).isEqualTo(Duration.parse("1d12h"));
        }

        @Test
        @DisplayName("Zero is neither positive nor negative")
        void testZero() {
            Duration zero = Duration.parse("0");

            assertThat(zero.isZero()).isTrue();
            assertThat(zero.isPositive()).isFalse();
            assertThat(zero.isNegative()).isFalse();
            assertThat(zero.negated()).isSameAs(zero);
            assertThat(Duration.parse("-0s")).isEqualTo(Duration.parse("0"));
        }

        @ParameterizedTest(name = "''{0}''")
        @ValueSource(strings = {"", "-", "5", "1x", "m5", "1d-2h", "99999999999999999999s"})
        @DisplayName("Malformed durations are rejected")
        void testMalformed(String text) {
            assertThatThrownBy(() -> Duration.parse(text))
                .isInstanceOf(InvalidOperationException.class)
                .hasMessageContaining("invalid duration");
        }
    }

    @Nested
    @DisplayName("Timestamp arithmetic")
    class ArithmeticTests {

        @Test
        @DisplayName("Month steps clamp to the end of the month")
        void testMonthEnd() {
            LocalDateTime endOfJanuary = LocalDateTime.of(2024, 1, 31, 8, 0);

            assertThat(Duration.parse("1mo").addTo(endOfJanuary)).isEqualTo(LocalDateTime.of(2024, 2, 29, 8, 0));
            assertThat(Duration.parse("1y").addTo(LocalDateTime.of(2024, 2, 29, 0, 0)))
                .isEqualTo(LocalDateTime.of(2025, 2, 28, 0, 0));
        }

        @Test
        @DisplayName("Calendar units apply before exact units")
        void testCalendarBeforeExact() {
            assertThat(Duration.parse("1mo1d1h").addTo(LocalDateTime.of(2024, 1, 31, 23, 0)))
                .isEqualTo(LocalDateTime.of(2024, 3, 2, 0, 0));
        }

        @Test
        @DisplayName("Negative durations move backwards")
        void testNegativeShift() {
            assertThat(Duration.parse("-2h").addTo(NOON)).isEqualTo(NOON.minusHours(2));
            assertThat(Duration.parse("2h").subtractFrom(NOON)).isEqualTo(NOON.minusHours(2));
            assertThat(Duration.parse("-1w").subtractFrom(NOON)).isEqualTo(NOON.plusDays(7));
        }

        @Test
        @DisplayName("Sub-second units are exact")
        void testSubSecond() {
            assertThat(Duration.parse("1500ms").addTo(NOON)).isEqualTo(NOON.plusNanos(1_500_000_000L));
        }
    }
}
