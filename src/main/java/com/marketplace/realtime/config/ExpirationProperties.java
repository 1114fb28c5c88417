package com.marketplace.realtime.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Request expiration rules.
 *
 * YAML prefix: {@code app.expiration}
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "app.expiration")
public class ExpirationProperties {

    /** Whether {@code ExpirationJob} runs on its cron schedule. */
    private boolean enabled = true;

    @NotBlank
    private String cron = "0 */15 * * * *";

    /** Zone used to interpret a request's preferred date and time. */
    @NotNull
    private ZoneId zone = ZoneId.of("UTC");

    /** Pending requests older than this are cancelled. */
    @NotNull
    private Duration pendingTtl = Duration.ofHours(24);

    /** Accepted requests are cancelled this long after the scheduled start. */
    @NotNull
    private Duration acceptedGrace = Duration.ofHours(2);

    /** Start time assumed when a request has a preferred date but no time. */
    @NotNull
    private LocalTime defaultPreferredTime = LocalTime.of(9, 0);

    /** Locale of the provider responses and notifications the sweep writes. */
    @NotNull
    private Locale messageLocale = Locale.forLanguageTag("mn");
}
