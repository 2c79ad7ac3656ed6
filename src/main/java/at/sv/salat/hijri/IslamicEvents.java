package at.sv.salat.hijri;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public final class IslamicEvents {

    private static final List<IslamicEvent> EVENTS = List.of(
            IslamicEvent.singleDay(1, 1, "new_year"),
            IslamicEvent.singleDay(1, 10, "ashura"),
            IslamicEvent.singleDay(3, 12, "mawlid"),
            IslamicEvent.singleDay(7, 27, "isra"),
            IslamicEvent.singleDay(8, 15, "baraat"),
            IslamicEvent.singleDay(9, 1, "ramadan_start"),
            IslamicEvent.spanning(9, 21, "qadr", 10),
            IslamicEvent.singleDay(10, 1, "fitr"),
            IslamicEvent.spanning(12, 8, "hajj", 6),
            IslamicEvent.singleDay(12, 9, "arafah"),
            IslamicEvent.singleDay(12, 10, "adha")
    );

    private IslamicEvents() {
    }

    /**
     * Returns the first table entry covering the given day. Entries are ordered, so a multi-day occasion hides
     * single-day occasions listed after it (e.g. 9 Dhu al-Hijjah resolves to {@code hajj}).
     *
     * @param hijriDay   the Hijri day of month
     * @param hijriMonth the Hijri month
     * @return the event, or empty if no occasion falls on that day
     */
    public static Optional<IslamicEvent> lookup(int hijriDay, int hijriMonth) {
        return EVENTS.stream()
                     .filter(event -> event.matches(hijriDay, hijriMonth))
                     .findFirst();
    }

    public static Optional<IslamicEvent> lookup(HijriDate date) {
        return lookup(date.day(), date.month());
    }

    /**
     * @return all table entries covering the given day, in table order
     */
    public static List<IslamicEvent> lookupAll(int hijriDay, int hijriMonth) {
        return EVENTS.stream()
                     .filter(event -> event.matches(hijriDay, hijriMonth))
                     .collect(Collectors.toList());
    }

    public static List<IslamicEvent> getAll() {
        return EVENTS;
    }
}
