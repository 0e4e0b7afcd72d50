package io.github.riemr.duty.optimization.strategy;

import io.github.riemr.duty.application.util.HolidayCalendar;
import io.github.riemr.duty.domain.model.DutyAssignment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 順番リストに従って dates[i] を order[i % n] に割り当てる。
 * 可否・上限は見ない（順番計算側で考慮済みの前提）。
 */
@Component
@RequiredArgsConstructor
public class RoundRobinDistributor {

    private final HolidayCalendar holidayCalendar;

    public List<DutyAssignment> distribute(List<String> order, List<LocalDate> dates, double pointsValue) {
        if (order == null || order.isEmpty() || dates == null || dates.isEmpty()) {
            return List.of();
        }
        List<DutyAssignment> results = new ArrayList<>(dates.size());
        for (int i = 0; i < dates.size(); i++) {
            LocalDate date = dates.get(i);
            results.add(new DutyAssignment(date, order.get(i % order.size()), pointsValue, holidayCalendar.isHoliday(date)));
        }
        return results;
    }
}
