package io.github.riemr.duty.domain.model;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 曜日ごとの時間帯ルール（不可枠・希望枠の両方で使用）。
 * dayOfWeek は ISO（1=Mon ... 7=Sun）。既存名簿の 0=Sun も受け付け、7 に読み替える。
 */
@Data
@NoArgsConstructor
public class WeeklyTimeRule {
    private Integer dayOfWeek;
    private List<TimeSlot> timeSlots = new ArrayList<>();

    @Builder
    public WeeklyTimeRule(Integer dayOfWeek, List<TimeSlot> timeSlots) {
        setDayOfWeek(dayOfWeek);
        this.timeSlots = timeSlots == null ? new ArrayList<>() : timeSlots;
    }

    public static WeeklyTimeRule of(int dayOfWeek, TimeSlot... slots) {
        return new WeeklyTimeRule(dayOfWeek, new ArrayList<>(List.of(slots)));
    }

    public void setDayOfWeek(Integer dayOfWeek) {
        this.dayOfWeek = normalizeDayOfWeek(dayOfWeek);
    }

    static Integer normalizeDayOfWeek(Integer value) {
        if (value == null) return null;
        if (value == 0) return 7;
        if (value < 1 || value > 7) {
            throw new IllegalArgumentException("dayOfWeek must be 1 (Mon) .. 7 (Sun), or 0 for Sunday: " + value);
        }
        return value;
    }
}
