package io.github.riemr.duty.config;

import io.github.riemr.duty.application.util.HolidayCalendar;
import io.github.riemr.duty.application.util.SwedishHolidayCalendar;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DutyAssignmentConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock dutyClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean(HolidayCalendar.class)
    public HolidayCalendar holidayCalendar() {
        return new SwedishHolidayCalendar();
    }

    // 順番計算（外部I/O）専用のプール。貪欲割当はこのプールを使わない
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService turnOrderExecutor(DutyAssignmentSettings settings) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "turn-order-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(settings.getTurnOrderParallelism(), factory);
    }
}
