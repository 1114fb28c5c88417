package com.marketplace.realtime.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for externally triggered cron endpoints.
 *
 * YAML prefix: {@code app.cron}
 */
@Getter
@Setter
@ToString(exclude = "secret")
@Validated
@ConfigurationProperties(prefix = "app.cron")
public class CronProperties {

    /** Shared bearer secret; blank disables the check outside production. */
    private String secret;

    @Valid
    @NotNull
    private RateLimit rateLimit = new RateLimit();

    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }

    @Getter
    @Setter
    @ToString
    public static class RateLimit {

        @Min(1)
        private int limitForPeriod = 5;

        @NotNull
        private Duration refreshPeriod = Duration.ofMinutes(1);
    }
}
