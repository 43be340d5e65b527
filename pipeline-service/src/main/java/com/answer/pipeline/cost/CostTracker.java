package com.answer.pipeline.cost;

import com.answer.pipeline.audit.AuditSink;
import com.answer.pipeline.config.PipelineProperties;
import com.answer.pipeline.model.CostRecord;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

public class CostTracker {

    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);
    private static final String GLOBAL = "global";

    private final Clock clock;
    private final PipelineProperties.Budget budget;
    private final AuditSink auditSink;
    private final MeterRegistry meterRegistry;
    private final Ledger globalLedger = new Ledger();
    private final Map<String, Ledger> providerLedgers = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<CostRecord> records = new ConcurrentLinkedDeque<>();

    public CostTracker(PipelineProperties.Budget budget, Clock clock) {
        this(budget, clock, AuditSink.noop(), null);
    }

    public CostTracker(PipelineProperties.Budget budget, Clock clock, AuditSink auditSink, MeterRegistry meterRegistry) {
        this.budget = budget;
        this.clock = clock;
        this.auditSink = auditSink == null ? AuditSink.noop() : auditSink;
        this.meterRegistry = meterRegistry;
    }

    public ReservationDecision reserve(String provider, double estimatedAmount) {
        double estimate = Math.max(0.0, estimatedAmount);
        Instant now = clock.instant();
        String exhausted = null;
        if (globalLedger.wouldExceed(now, estimate, budget.getDailyGlobalUsd(), budget.getMonthlyGlobalUsd())) {
            exhausted = GLOBAL;
        } else if (ledgerFor(provider).wouldExceed(now, estimate,
                budget.getProviderDailyUsd().getOrDefault(provider, 0.0),
                budget.getProviderMonthlyUsd().getOrDefault(provider, 0.0))) {
            exhausted = provider;
        }
        if (exhausted == null) {
            return ReservationDecision.ALLOWED;
        }
        log.info("event=budget_denied provider={} budget={} estimate={}", provider, exhausted, estimate);
        incrementCounter("pipeline_budget_denied_total", provider);
        return ReservationDecision.DENIED;
    }

    public CostRecord record(String provider, double actualAmount, String requestFingerprint) {
        if (actualAmount < 0.0) {
            throw new IllegalArgumentException("cost amount must not be negative: " + actualAmount);
        }
        Instant now = clock.instant();
        ledgerFor(provider).add(now, actualAmount);
        double dailyTotal = globalLedger.add(now, actualAmount);

        CostRecord record = new CostRecord(provider, actualAmount, now, requestFingerprint);
        records.addLast(record);
        auditSink.appendCost(record);
        incrementCounter("pipeline_cost_records_total", provider);

        checkAlert(now, dailyTotal);
        return record;
    }

    public List<CostRecord> recordsFor(String requestFingerprint) {
        List<CostRecord> matching = new ArrayList<>();
        for (CostRecord record : records) {
            if (record.requestFingerprint() != null && record.requestFingerprint().equals(requestFingerprint)) {
                matching.add(record);
            }
        }
        return matching;
    }

    public CostSummary summary() {
        Instant now = clock.instant();
        Map<String, CostSummary.ProviderSpend> providers = new TreeMap<>();
        providerLedgers.forEach((name, ledger) -> providers.put(name, new CostSummary.ProviderSpend(
                ledger.dailyTotal(now),
                ledger.monthlyTotal(now),
                budget.getProviderDailyUsd().getOrDefault(name, 0.0),
                budget.getProviderMonthlyUsd().getOrDefault(name, 0.0)
        )));
        return new CostSummary(
                globalLedger.dailyTotal(now),
                globalLedger.monthlyTotal(now),
                budget.getDailyGlobalUsd(),
                budget.getMonthlyGlobalUsd(),
                providers,
                records.size()
        );
    }

    /**
     * Drops records from before the current UTC month. Totals live in the ledgers and are
     * unaffected.
     */
    @Scheduled(fixedDelayString = "${pipeline.budget.prune-interval-ms:3600000}")
    public int pruneExpiredRecords() {
        Instant monthStart = YearMonth.now(clock.withZone(ZoneOffset.UTC))
                .atDay(1)
                .atStartOfDay()
                .toInstant(ZoneOffset.UTC);
        int removed = 0;
        Iterator<CostRecord> iterator = records.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().timestamp().isBefore(monthStart)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.info("event=cost_records_pruned removed={}", removed);
        }
        return removed;
    }

    private Ledger ledgerFor(String provider) {
        return providerLedgers.computeIfAbsent(provider, ignored -> new Ledger());
    }

    private void checkAlert(Instant now, double dailyTotal) {
        double limit = budget.getDailyGlobalUsd();
        if (limit <= 0.0 || dailyTotal < limit * budget.getAlertThreshold()) {
            return;
        }
        if (globalLedger.markAlerted(now)) {
            log.warn("event=budget_alert scope=global_daily spent={} budget={} utilisation={}",
                    String.format("%.4f", dailyTotal), limit, String.format("%.2f", dailyTotal / limit));
        }
    }

    private void incrementCounter(String metricName, String provider) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName, "provider", provider).increment();
    }

    /**
     * Daily and monthly running totals for one scope, each guarded by the ledger's monitor.
     */
    private static final class Ledger {
        private LocalDate day;
        private YearMonth month;
        private double dailyTotal;
        private double monthlyTotal;
        private LocalDate alertedDay;

        synchronized boolean wouldExceed(Instant now, double estimate, double dailyLimit, double monthlyLimit) {
            roll(now);
            return exceeds(dailyTotal, estimate, dailyLimit) || exceeds(monthlyTotal, estimate, monthlyLimit);
        }

        synchronized double add(Instant now, double amount) {
            roll(now);
            dailyTotal += amount;
            monthlyTotal += amount;
            return dailyTotal;
        }

        synchronized double dailyTotal(Instant now) {
            roll(now);
            return dailyTotal;
        }

        synchronized double monthlyTotal(Instant now) {
            roll(now);
            return monthlyTotal;
        }

        synchronized boolean markAlerted(Instant now) {
            roll(now);
            if (day.equals(alertedDay)) {
                return false;
            }
            alertedDay = day;
            return true;
        }

        private void roll(Instant now) {
            LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
            YearMonth thisMonth = YearMonth.from(today);
            if (!today.equals(day)) {
                day = today;
                dailyTotal = 0.0;
            }
            if (!thisMonth.equals(month)) {
                month = thisMonth;
                monthlyTotal = 0.0;
            }
        }

        // a limit of zero means unlimited
        private static boolean exceeds(double total, double estimate, double limit) {
            if (limit <= 0.0) {
                return false;
            }
            return total >= limit || total + estimate > limit;
        }
    }
}
