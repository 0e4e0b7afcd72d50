package io.github.riemr.duty.application.dto;

import io.github.riemr.duty.application.exception.AssignmentConfigurationException;
import io.github.riemr.duty.application.util.DutyCalendar;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * 呼び出し側から渡される割当設定。すべて任意項目。
 * algorithm / stableId / organizationId の3つが揃ったときだけ順番方式になり、
 * 一部だけの指定は従来のスコア方式として扱う（エラーにはしない）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentOptions {
    private String algorithm;
    private String stableId;
    private String organizationId;
    private LocalDate startDate;
    private LocalDate endDate;
    private Double preferenceBonus;
    private Double holidayMultiplier;
    private String tieBreak;

    public static AssignmentOptions empty() {
        return new AssignmentOptions();
    }

    public boolean hasRankingContext() {
        return present(algorithm) && present(stableId) && present(organizationId);
    }

    /**
     * JSON 等から読み込んだ型の緩い設定を変換する。
     *
     * @throws AssignmentConfigurationException 数値・日付項目の型が不正な場合
     */
    public static AssignmentOptions fromMap(Map<String, ?> bag) {
        if (bag == null || bag.isEmpty()) return empty();
        return AssignmentOptions.builder()
                .algorithm(text(bag.get("algorithm")))
                .stableId(text(bag.get("stableId")))
                .organizationId(text(bag.get("organizationId")))
                .startDate(date("startDate", bag.get("startDate")))
                .endDate(date("endDate", bag.get("endDate")))
                .preferenceBonus(number("preferenceBonus", bag.get("preferenceBonus")))
                .holidayMultiplier(number("holidayMultiplier", bag.get("holidayMultiplier")))
                .tieBreak(text(bag.get("tieBreak")))
                .build();
    }

    private static boolean present(String s) {
        return s != null && !s.isBlank();
    }

    private static String text(Object value) {
        if (value == null) return null;
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    private static Double number(String key, Object value) {
        if (value == null) return null;
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new AssignmentConfigurationException(key + " must be a finite number: " + value);
            }
            return d;
        }
        if (value instanceof String s) {
            if (s.isBlank()) return null;
            try {
                return number(key, Double.valueOf(s.trim()));
            } catch (NumberFormatException e) {
                throw new AssignmentConfigurationException(key + " must be numeric: " + s, e);
            }
        }
        throw new AssignmentConfigurationException(key + " must be numeric but was " + value.getClass().getSimpleName());
    }

    private static LocalDate date(String key, Object value) {
        if (value == null) return null;
        if (value instanceof LocalDate d) return d;
        if (value instanceof String s) {
            if (s.isBlank()) return null;
            try {
                return DutyCalendar.parseDate(s);
            } catch (DateTimeParseException e) {
                throw new AssignmentConfigurationException(key + " must be yyyy-MM-dd: " + s, e);
            }
        }
        throw new AssignmentConfigurationException(key + " must be a date but was " + value.getClass().getSimpleName());
    }
}
