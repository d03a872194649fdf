package com.cryptofolio.backend.report;

import com.cryptofolio.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "report.enabled", havingValue = "true")
public class DailyReportScheduler {

    private final DailyReportService dailyReportService;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(cron = "${report.cron}", zone = "${analytics.zone:UTC}")
    public void writeReport() {
        scheduledTaskGuard.run("daily-report", dailyReportService::generate);
    }
}
