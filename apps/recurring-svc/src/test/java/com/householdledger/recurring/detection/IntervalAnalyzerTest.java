package com.householdledger.recurring.detection;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class IntervalAnalyzerTest {

    private final IntervalAnalyzer analyzer = new IntervalAnalyzer();

    @Test
    void computesCalendarDayGaps() {
        List<Integer> gaps = analyzer.gaps(List.of(
                LocalDate.of(2024, 1, 5),
                LocalDate.of(2024, 2, 4),
                LocalDate.of(2024, 3, 6)
        ));

        // 2024 is a leap year, so February has 29 days
        assertThat(gaps).containsExactly(30, 31);
    }

    @Test
    void sameDayDuplicatesProduceZeroGap() {
        assertThat(analyzer.gaps(List.of(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 1)))).containsExactly(0);
    }

    @Test
    void fewerThanTwoDatesHaveNoGaps() {
        assertThat(analyzer.gaps(List.of())).isEmpty();
        assertThat(analyzer.gaps(List.of(LocalDate.of(2024, 3, 1)))).isEmpty();
    }

    @Test
    void meanOfEmptyListIsZero() {
        assertThat(IntervalAnalyzer.mean(List.of())).isZero();
        assertThat(IntervalAnalyzer.mean(List.of(30, 31))).isEqualTo(30.5d);
    }
}
