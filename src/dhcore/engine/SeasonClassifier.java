package dhcore.engine;

import dhcore.model.Season;

import java.time.MonthDay;

/**
 * Сезон по (месяц, день). Сравнение идёт по календарному порядку MonthDay,
 * а не по строкам вида "MMdd"; год, часы и локаль не участвуют.
 */
public final class SeasonClassifier {

    private static final MonthDay SPRING_START = MonthDay.of(3, 21);
    private static final MonthDay SUMMER_START = MonthDay.of(6, 21);
    private static final MonthDay FALL_START = MonthDay.of(9, 21);
    private static final MonthDay WINTER_START = MonthDay.of(12, 21);

    private SeasonClassifier() {}

    public static Season classify(int month, int day) {
        return classify(MonthDay.of(month, day));
    }

    public static Season classify(MonthDay md) {
        if (md.isBefore(SPRING_START)) return Season.WINTER;
        if (md.isBefore(SUMMER_START)) return Season.SPRING;
        if (md.isBefore(FALL_START)) return Season.SUMMER;
        if (md.isBefore(WINTER_START)) return Season.FALL;
        return Season.WINTER;
    }
}
