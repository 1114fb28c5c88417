package com.marketplace.realtime.controller;

import com.marketplace.realtime.config.CronProperties;
import com.marketplace.realtime.service.ExpirationResult;
import com.marketplace.realtime.service.ExpirationSweepService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-demand trigger of the request expiration sweep, for external schedulers
 * and manual checks.
 */
@Slf4j
@RestController
@RequestMapping("/cron")
public class ExpirationController {

    static final String RATE_LIMITER = "cronEndpoint";

    private final ExpirationSweepService sweepService;
    private final CronSecretVerifier secretVerifier;
    private final RateLimiter rateLimiter;
    private final Clock clock;

    public ExpirationController(ExpirationSweepService sweepService,
                                CronSecretVerifier secretVerifier,
                                RateLimiterRegistry rateLimiterRegistry,
                                CronProperties properties,
                                Clock clock) {
        this.sweepService = sweepService;
        this.secretVerifier = secretVerifier;
        this.clock = clock;

        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(properties.getRateLimit().getLimitForPeriod())
                .limitRefreshPeriod(properties.getRateLimit().getRefreshPeriod())
                .timeoutDuration(Duration.ZERO)
                .build();
        this.rateLimiter = rateLimiterRegistry.rateLimiter(RATE_LIMITER, config);
    }

    @GetMapping("/expire-requests")
    public ResponseEntity<Map<String, Object>> expireRequests(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        if (!rateLimiter.acquirePermission()) {
            log.warn("⛔ Expire-requests call rejected by rate limiter");
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(Map.of("error", "Too many requests"));
        }
        if (!secretVerifier.isAuthorized(authorization)) {
            log.warn("🔒 Unauthorized expire-requests call");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Unauthorized"));
        }

        try {
            log.info("🕒 Expiration sweep requested via cron endpoint");
            ExpirationResult result = sweepService.expireStaleRequests();

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("timestamp", clock.instant().toString());
            body.put("results", result);
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("❌ Expiration sweep failed", e);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
        }
    }
}
