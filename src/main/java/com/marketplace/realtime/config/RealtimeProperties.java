package com.marketplace.realtime.config;

import com.marketplace.realtime.subscription.RetryConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Locale;

/**
 * Realtime synchronization settings.
 *
 * YAML prefix: {@code app.realtime}
 *
 * <pre>
 * app:
 *   realtime:
 *     feed: kafka            # kafka | local
 *     notice-locale: mn
 *     banner-delay: 2s
 *     retry:
 *       max-retries: 5
 *       base-delay: 1s
 *       max-delay: 16s
 *     kafka:
 *       topic-prefix: marketplace.public
 *       heartbeat-topic: marketplace.heartbeat
 * </pre>
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "app.realtime")
public class RealtimeProperties {

    /** Change feed transport, {@code kafka} or {@code local}. */
    @NotBlank
    private String feed = "kafka";

    /** Locale used to render status notices. */
    @NotNull
    private Locale noticeLocale = Locale.forLanguageTag("mn");

    /** How long the connection must stay down before the banner shows. */
    @NotNull
    private Duration bannerDelay = Duration.ofSeconds(2);

    @Valid
    @NotNull
    private Retry retry = new Retry();

    @Valid
    @NotNull
    private Kafka kafka = new Kafka();

    @Getter
    @Setter
    @ToString
    public static class Retry {

        @Min(0)
        private int maxRetries = RetryConfig.DEFAULTS.maxRetries();

        @NotNull
        private Duration baseDelay = RetryConfig.DEFAULTS.baseDelay();

        @NotNull
        private Duration maxDelay = RetryConfig.DEFAULTS.maxDelay();

        public RetryConfig toRetryConfig() {
            return new RetryConfig(maxRetries, baseDelay, maxDelay);
        }
    }

    @Getter
    @Setter
    @ToString
    public static class Kafka {

        /** Change topics are named {@code <topicPrefix>.<table>}. */
        @NotBlank
        private String topicPrefix = "marketplace.public";

        /** Topic consumed by presence channels. */
        @NotBlank
        private String heartbeatTopic = "marketplace.heartbeat";

        /** A consumer silent for longer than this reports a timeout. */
        @NotNull
        private Duration nonResponsiveTimeout = Duration.ofSeconds(30);

        public String topicFor(String table) {
            return topicPrefix + "." + table;
        }
    }
}
