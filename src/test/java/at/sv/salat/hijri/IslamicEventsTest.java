package at.sv.salat.hijri;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IslamicEventsTest {

    private static Optional<String> keyOf(int day, int month) {
        return IslamicEvents.lookup(day, month).map(IslamicEvent::key);
    }

    @Test
    void singleDayEvents() {
        assertThat(keyOf(1, 1)).contains("new_year");
        assertThat(keyOf(10, 1)).contains("ashura");
        assertThat(keyOf(12, 3)).contains("mawlid");
        assertThat(keyOf(27, 7)).contains("isra");
        assertThat(keyOf(15, 8)).contains("baraat");
        assertThat(keyOf(1, 9)).contains("ramadan_start");
        assertThat(keyOf(1, 10)).contains("fitr");
    }

    @Test
    void lastTenNightsOfRamadan_resolveToQadr() {
        for (int day = 21; day <= 30; day++) {
            assertThat(keyOf(day, 9)).as("day " + day).contains("qadr");
        }
    }

    @Test
    void outsideRange_noEvent() {
        assertThat(keyOf(20, 9)).isEmpty();
        assertThat(keyOf(31, 9)).isEmpty();
        assertThat(keyOf(2, 9)).isEmpty();
        assertThat(keyOf(1, 2)).isEmpty();
        assertThat(keyOf(14, 12)).isEmpty();
    }

    @Test
    void hajjDays_firstMatchWins() {
        for (int day = 8; day <= 13; day++) {
            assertThat(keyOf(day, 12)).as("day " + day).contains("hajj");
        }
    }

    @Test
    void lookupAll_returnsOverlappingEvents() {
        assertThat(IslamicEvents.lookupAll(9, 12)).extracting(IslamicEvent::key).containsExactly("hajj", "arafah");
        assertThat(IslamicEvents.lookupAll(10, 12)).extracting(IslamicEvent::key).containsExactly("hajj", "adha");
        assertThat(IslamicEvents.lookupAll(20, 9)).isEmpty();
    }

    @Test
    void lookupByHijriDate() {
        assertThat(IslamicEvents.lookup(new HijriDate(27, 9, 1445))).map(IslamicEvent::key).contains("qadr");
    }

    @Test
    void table_isImmutable() {
        assertThat(IslamicEvents.getAll()).hasSize(11);
        assertThat(IslamicEvents.getAll().stream().filter(IslamicEvent::isMultiDay))
                .extracting(IslamicEvent::key).containsExactly("qadr", "hajj");
        assertThatThrownBy(() -> IslamicEvents.getAll().add(IslamicEvent.singleDay(1, 2, "test")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
