package com.flagship.fx_payments.observability;

import com.flagship.fx_payments.fx.QuoteCache;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically copies outbox backlog and rate cache sizes into their gauges.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final QuoteMetrics quoteMetrics;
    private final QuoteCache quoteCache;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        quoteMetrics.updateCachedPairs(quoteCache.size());
    }
}
