package io.github.riemr.duty.application.util;

import java.time.LocalDate;

public interface HolidayCalendar {

    boolean isHoliday(LocalDate date);

    /** 祝日を持たないカレンダー */
    static HolidayCalendar none() {
        return date -> false;
    }
}
