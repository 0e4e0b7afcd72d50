package io.github.riemr.duty.config;

import io.github.riemr.duty.optimization.config.TieBreakPolicy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * application.yml の duty.* 設定値。
 */
@Component
@Getter
@Slf4j
public class DutyAssignmentSettings {

    private static final Pattern ISO_WITHOUT_UNIT = Pattern.compile("^PT\\d+$");
    private static final Pattern SHORT_DURATION = Pattern.compile("^(\\d{1,12})\\s*(MS|S|M|H)?$");

    private final double preferenceBonus;
    private final double holidayMultiplier;
    private final TieBreakPolicy tieBreak;
    private final Duration turnOrderTimeout;
    private final int turnOrderParallelism;
    private final int memoryHorizonDays;
    private final Locale collationLocale;

    public DutyAssignmentSettings(
            @Value("${duty.assignment.preference-bonus:-2}") double preferenceBonus,
            @Value("${duty.assignment.holiday-multiplier:1.0}") double holidayMultiplier,
            @Value("${duty.assignment.tie-break:INPUT_ORDER}") String tieBreak,
            @Value("${duty.turn-order.timeout:PT10S}") String turnOrderTimeout,
            @Value("${duty.turn-order.parallelism:2}") int turnOrderParallelism,
            @Value("${duty.selection.memory-horizon-days:90}") int memoryHorizonDays,
            @Value("${duty.selection.collation-locale:sv-SE}") String collationLocale) {
        this.preferenceBonus = preferenceBonus;
        this.holidayMultiplier = holidayMultiplier;
        this.tieBreak = TieBreakPolicy.fromCode(tieBreak);
        this.turnOrderTimeout = parseDurationTolerant(turnOrderTimeout, Duration.ofSeconds(10));
        this.turnOrderParallelism = Math.max(1, turnOrderParallelism);
        this.memoryHorizonDays = memoryHorizonDays > 0 ? memoryHorizonDays : 90;
        this.collationLocale = (collationLocale == null || collationLocale.isBlank())
                ? Locale.forLanguageTag("sv-SE")
                : Locale.forLanguageTag(collationLocale.trim());
    }

    /** テスト・手動構築用の既定値 */
    public static DutyAssignmentSettings defaults() {
        return new DutyAssignmentSettings(-2, 1.0, "INPUT_ORDER", "PT10S", 2, 90, "sv-SE");
    }

    /**
     * 順番計算のタイムアウト値を解釈する。ISO-8601（"PT10S"、秒の単位を書き忘れた "PT10" も可）か、
     * 数値 + 単位（ms / s / m / h、単位なしは秒）。解釈できなければ def。
     */
    static Duration parseDurationTolerant(String raw, Duration def) {
        if (raw == null || raw.isBlank()) return def;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        if (s.startsWith("P")) {
            try {
                return Duration.parse(ISO_WITHOUT_UNIT.matcher(s).matches() ? s + "S" : s);
            } catch (DateTimeParseException e) {
                log.warn("Unparsable duration '{}', using {}", raw, def);
                return def;
            }
        }
        Matcher m = SHORT_DURATION.matcher(s);
        if (!m.matches()) {
            log.warn("Unparsable duration '{}', using {}", raw, def);
            return def;
        }
        long amount = Long.parseLong(m.group(1));
        String unit = m.group(2) == null ? "S" : m.group(2);
        switch (unit) {
            case "MS":
                return Duration.ofMillis(amount);
            case "M":
                return Duration.ofMinutes(amount);
            case "H":
                return Duration.ofHours(amount);
            default:
                return Duration.ofSeconds(amount);
        }
    }
}
