package com.marketplace.realtime.connection;

import com.marketplace.realtime.scheduling.VirtualDelayScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConnectionBanner Tests")
class ConnectionBannerTest {

    @Mock
    private ConnectionMonitor monitor;

    private VirtualDelayScheduler scheduler;
    private ConnectionBanner banner;

    @BeforeEach
    void setUp() {
        when(monitor.status()).thenReturn(ConnectionStatus.CONNECTING);
        scheduler = new VirtualDelayScheduler();
        banner = new ConnectionBanner(monitor, scheduler, Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("A short outage never shows the banner")
    void shortBlipStaysHidden() {
        banner.onStatus(ConnectionStatus.CONNECTED);
        banner.onStatus(ConnectionStatus.DISCONNECTED);
        banner.onStatus(ConnectionStatus.RECONNECTING);
        scheduler.advance(Duration.ofMillis(1_500));
        banner.onStatus(ConnectionStatus.CONNECTED);
        scheduler.advance(Duration.ofSeconds(5));

        assertThat(banner.isVisible()).isFalse();
        assertThat(banner.mode()).isEqualTo(BannerMode.HIDDEN);
    }

    @Test
    @DisplayName("An outage longer than the delay shows the reconnecting banner")
    void longOutageShowsReconnecting() {
        banner.onStatus(ConnectionStatus.RECONNECTING);
        scheduler.advance(Duration.ofMillis(1_999));
        assertThat(banner.isVisible()).isFalse();

        scheduler.advance(Duration.ofMillis(1));

        assertThat(banner.isVisible()).isTrue();
        assertThat(banner.isReconnecting()).isTrue();
        assertThat(banner.mode()).isEqualTo(BannerMode.RECONNECTING);
    }

    @Test
    @DisplayName("Exhausted retries switch the banner to the manual reconnect mode")
    void disconnectedMode() {
        banner.onStatus(ConnectionStatus.RECONNECTING);
        scheduler.advance(Duration.ofSeconds(3));
        banner.onStatus(ConnectionStatus.DISCONNECTED);

        assertThat(banner.mode()).isEqualTo(BannerMode.DISCONNECTED);
        assertThat(banner.isReconnecting()).isFalse();
    }

    @Test
    @DisplayName("Reconnecting hides the banner right away")
    void recoveryHides() {
        banner.onStatus(ConnectionStatus.DISCONNECTED);
        scheduler.advance(Duration.ofSeconds(3));
        assertThat(banner.isVisible()).isTrue();

        banner.onStatus(ConnectionStatus.CONNECTED);

        assertThat(banner.isVisible()).isFalse();
    }
}
