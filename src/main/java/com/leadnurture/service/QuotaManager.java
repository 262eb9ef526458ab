package com.leadnurture.service;

import com.leadnurture.config.NurtureProperties;
import com.leadnurture.dto.QuotaDecision;
import com.leadnurture.dto.QuotaSnapshot;
import com.leadnurture.model.CampaignStep;
import com.leadnurture.model.LeadPriority;
import com.leadnurture.model.Priority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Daily and hourly caps on outbound nurture email.
 *
 * ADMISSION RULES (in order):
 *   1. daily or hourly cap exhausted           → reject
 *   2. step HIGH or lead URGENT                → admit
 *   3. step MEDIUM                             → admit only within business hours
 *   4. step LOW                                → admit only while under the low-priority
 *                                                share of the daily cap (default 50%)
 *
 * Counters move only through recordSend(), which callers invoke after the
 * transport confirmed delivery, so a failed send never consumes quota.
 *
 * Periods roll over lazily: the first call in a new calendar day (or hour)
 * zeroes the counter; further calls in the same period leave it alone.
 * All methods are synchronized so check-then-increment is serialized.
 */
@Component
@Slf4j
public class QuotaManager {

    private final NurtureProperties.Quota limits;
    private final Clock clock;

    private int dailyCount;
    private LocalDate dailyResetDate;
    private int hourlyCount;
    private LocalDateTime hourlyResetHour;

    private long sent;
    private long failed;

    public QuotaManager(NurtureProperties properties, Clock clock) {
        this.limits = properties.getQuota();
        this.clock = clock;
        ZonedDateTime now = ZonedDateTime.now(clock);
        this.dailyResetDate = now.toLocalDate();
        this.hourlyResetHour = now.toLocalDateTime().truncatedTo(ChronoUnit.HOURS);
    }

    public synchronized boolean checkDailyLimit() {
        rollDay(ZonedDateTime.now(clock));
        return dailyCount < limits.getMaxDaily();
    }

    public synchronized boolean checkHourlyLimit() {
        rollHour(ZonedDateTime.now(clock));
        return hourlyCount < limits.getMaxHourly();
    }

    public boolean admit(CampaignStep step, LeadPriority leadPriority) {
        return evaluate(step.getPriority(), leadPriority).isAdmitted();
    }

    public synchronized QuotaDecision evaluate(Priority stepPriority, LeadPriority leadPriority) {
        if (!checkDailyLimit()) {
            return QuotaDecision.DAILY_CAP_REACHED;
        }
        if (!checkHourlyLimit()) {
            return QuotaDecision.HOURLY_CAP_REACHED;
        }
        if (stepPriority == Priority.HIGH || leadPriority == LeadPriority.URGENT) {
            return QuotaDecision.ADMITTED;
        }
        if (stepPriority == Priority.MEDIUM) {
            int hour = ZonedDateTime.now(clock).getHour();
            return hour >= limits.getBusinessHourStart() && hour <= limits.getBusinessHourEnd()
                    ? QuotaDecision.ADMITTED
                    : QuotaDecision.OUTSIDE_BUSINESS_HOURS;
        }
        return dailyCount < limits.getMaxDaily() * limits.getLowPriorityShare()
                ? QuotaDecision.ADMITTED
                : QuotaDecision.LOW_PRIORITY_CAPACITY_RESERVED;
    }

    /** Counts a confirmed send against both caps. */
    public synchronized void recordSend() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        rollDay(now);
        rollHour(now);
        dailyCount++;
        hourlyCount++;
        sent++;
    }

    public synchronized void recordFailure() {
        failed++;
    }

    public synchronized QuotaSnapshot snapshot() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        rollDay(now);
        rollHour(now);
        return QuotaSnapshot.builder()
                .sent(sent)
                .failed(failed)
                .dailySent(dailyCount)
                .dailyLimit(limits.getMaxDaily())
                .remainingToday(Math.max(0, limits.getMaxDaily() - dailyCount))
                .hourlySent(hourlyCount)
                .hourlyLimit(limits.getMaxHourly())
                .remainingThisHour(Math.max(0, limits.getMaxHourly() - hourlyCount))
                .build();
    }

    synchronized int getDailyCount() {
        return dailyCount;
    }

    synchronized int getHourlyCount() {
        return hourlyCount;
    }

    private void rollDay(ZonedDateTime now) {
        LocalDate today = now.toLocalDate();
        if (!today.equals(dailyResetDate)) {
            log.info("Daily email quota reset ({} sent on {})", dailyCount, dailyResetDate);
            dailyCount = 0;
            dailyResetDate = today;
        }
    }

    // Keyed on date + hour so 10:00 today never matches 10:00 yesterday
    private void rollHour(ZonedDateTime now) {
        LocalDateTime hour = now.toLocalDateTime().truncatedTo(ChronoUnit.HOURS);
        if (!hour.equals(hourlyResetHour)) {
            log.debug("Hourly email quota reset ({} sent in {})", hourlyCount, hourlyResetHour);
            hourlyCount = 0;
            hourlyResetHour = hour;
        }
    }
}
