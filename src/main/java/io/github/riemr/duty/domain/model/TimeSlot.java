package io.github.riemr.duty.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

/**
 * 1日の中の時間帯。start を含み end を含まない（[start, end)）。
 * end が start より前の場合は日付をまたぐ枠として扱う。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeSlot {
    @JsonFormat(pattern = "HH:mm")
    private LocalTime start;
    @JsonFormat(pattern = "HH:mm")
    private LocalTime end;

    public static TimeSlot of(String start, String end) {
        return new TimeSlot(LocalTime.parse(start), LocalTime.parse(end));
    }
}
