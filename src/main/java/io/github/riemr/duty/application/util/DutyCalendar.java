package io.github.riemr.duty.application.util;

import io.github.riemr.duty.domain.model.TimeSlot;
import io.github.riemr.duty.domain.model.WeeklyTimeRule;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.IsoFields;
import java.util.List;

/**
 * 割当処理で共有する暦の規約。
 * <ul>
 *   <li>曜日: ISO-8601（月=1 ... 日=7）。ルール側の 0=日曜は {@link WeeklyTimeRule} で 7 に読み替え済み</li>
 *   <li>同一週: ISO 週番号と週基準年が一致</li>
 *   <li>同一月: 暦年と月が一致</li>
 *   <li>時間帯: [start, end)。end &lt; start は日付またぎ</li>
 * </ul>
 * 可否判定・スコア・週/月境界の判定はすべてこのクラスを経由する。
 */
@Component
public class DutyCalendar {

    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE; // yyyy-MM-dd
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public int dayOfWeek(LocalDate date) {
        return date.getDayOfWeek().getValue();
    }

    public boolean isSameWeek(LocalDate a, LocalDate b) {
        return a.get(IsoFields.WEEK_BASED_YEAR) == b.get(IsoFields.WEEK_BASED_YEAR)
                && a.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR) == b.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    public boolean isSameMonth(LocalDate a, LocalDate b) {
        return YearMonth.from(a).equals(YearMonth.from(b));
    }

    public boolean isTimeInRange(LocalTime time, LocalTime start, LocalTime end) {
        if (time == null || start == null || end == null) return false;
        if (start.equals(end)) return false;
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        // 日付またぎ（例: 22:00-06:00）
        return !time.isBefore(start) || time.isBefore(end);
    }

    /**
     * 指定日の曜日に一致するルールのいずれかの時間帯に time が含まれるか。
     */
    public boolean matchesAny(List<WeeklyTimeRule> rules, LocalDate date, LocalTime time) {
        if (rules == null || rules.isEmpty()) return false;
        int dow = dayOfWeek(date);
        for (WeeklyTimeRule rule : rules) {
            if (rule == null || rule.getDayOfWeek() == null || rule.getDayOfWeek() != dow) continue;
            if (rule.getTimeSlots() == null) continue;
            for (TimeSlot slot : rule.getTimeSlots()) {
                if (slot != null && isTimeInRange(time, slot.getStart(), slot.getEnd())) {
                    return true;
                }
            }
        }
        return false;
    }

    public static String format(LocalDate date) {
        return DATE_FORMAT.format(date);
    }

    public static LocalDate parseDate(String raw) {
        return LocalDate.parse(raw.trim(), DATE_FORMAT);
    }

    /**
     * "HH:MM" または "HH:MM-HH:MM" から開始時刻を取り出す。
     */
    public static LocalTime parseStartTime(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("start time is required");
        }
        String s = raw.trim();
        int dash = s.indexOf('-');
        if (dash > 0) s = s.substring(0, dash).trim();
        try {
            return LocalTime.parse(s.length() == 4 ? "0" + s : s, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid start time (HH:MM expected): " + raw, e);
        }
    }
}
