package com.marketplace.realtime.jobs;

import com.marketplace.realtime.service.ExpirationResult;
import com.marketplace.realtime.service.ExpirationSweepService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.expiration", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExpirationJob {

    private final ExpirationSweepService sweepService;
    private static final Logger log = LoggerFactory.getLogger(ExpirationJob.class);

    public ExpirationJob(ExpirationSweepService sweepService) {
        this.sweepService = sweepService;
    }

    @Scheduled(cron = "${app.expiration.cron:0 */15 * * * *}", zone = "${app.expiration.zone:UTC}")
    public void run() {
        log.info("Running request expiration job");
        try {
            ExpirationResult result = sweepService.expireStaleRequests();
            log.info("Request expiration job completed - expired {} pending, {} accepted",
                    result.expiredPending(), result.expiredAccepted());
        } catch (Exception e) {
            log.error("Request expiration job failed", e);
        }
    }
}
