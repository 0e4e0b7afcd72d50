package io.github.riemr.duty.application.util;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.TemporalAdjusters;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * スウェーデンの祝日（イブを含む）。年ごとにキャッシュする。
 */
public class SwedishHolidayCalendar implements HolidayCalendar {

    private static final Set<MonthDay> FIXED = Set.of(
            MonthDay.of(1, 1),   // Nyårsdagen
            MonthDay.of(1, 6),   // Trettondedag jul
            MonthDay.of(5, 1),   // Första maj
            MonthDay.of(6, 6),   // Sveriges nationaldag
            MonthDay.of(12, 24), // Julafton
            MonthDay.of(12, 25), // Juldagen
            MonthDay.of(12, 26), // Annandag jul
            MonthDay.of(12, 31)  // Nyårsafton
    );

    private final Map<Integer, Set<LocalDate>> movableByYear = new ConcurrentHashMap<>();

    @Override
    public boolean isHoliday(LocalDate date) {
        if (date == null) return false;
        if (FIXED.contains(MonthDay.from(date))) return true;
        return movableByYear.computeIfAbsent(date.getYear(), SwedishHolidayCalendar::movableHolidays).contains(date);
    }

    static Set<LocalDate> movableHolidays(int year) {
        Set<LocalDate> days = new HashSet<>();
        LocalDate easter = easterSunday(year);
        days.add(easter.minusDays(2));  // Långfredagen
        days.add(easter);               // Påskdagen
        days.add(easter.plusDays(1));   // Annandag påsk
        days.add(easter.plusDays(39));  // Kristi himmelsfärdsdag
        days.add(easter.plusDays(49));  // Pingstdagen
        // Midsommarafton: 6/19-6/25 の金曜、翌日が Midsommardagen
        LocalDate midsummerEve = LocalDate.of(year, 6, 19).with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY));
        days.add(midsummerEve);
        days.add(midsummerEve.plusDays(1));
        // Alla helgons dag: 10/31-11/6 の土曜
        days.add(LocalDate.of(year, 10, 31).with(TemporalAdjusters.nextOrSame(DayOfWeek.SATURDAY)));
        return days;
    }

    // Anonymous Gregorian algorithm (Meeus/Jones/Butcher)
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
