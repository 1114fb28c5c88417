package com.marketplace.realtime.controller;

import com.marketplace.realtime.connection.BannerMode;
import com.marketplace.realtime.connection.ConnectionBanner;
import com.marketplace.realtime.connection.ConnectionMonitor;
import com.marketplace.realtime.connection.ConnectionStatus;
import com.marketplace.realtime.subscription.Subscription;
import com.marketplace.realtime.subscription.SubscriptionManager;
import com.marketplace.realtime.subscription.SubscriptionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("RealtimeStatusController Tests")
class RealtimeStatusControllerTest {

    @Mock
    private ConnectionMonitor connectionMonitor;

    @Mock
    private ConnectionBanner connectionBanner;

    @Mock
    private SubscriptionManager subscriptionManager;

    @InjectMocks
    private RealtimeStatusController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    @DisplayName("Describes the connection and every open channel")
    void connection() throws Exception {
        Subscription chat = mock(Subscription.class);
        when(chat.channelName()).thenReturn("chat-messages-r1");
        when(chat.state()).thenReturn(SubscriptionState.RECONNECTING);
        when(chat.retryCount()).thenReturn(2);
        when(connectionMonitor.status()).thenReturn(ConnectionStatus.RECONNECTING);
        when(connectionMonitor.isReconnecting()).thenReturn(true);
        when(connectionMonitor.retryCount()).thenReturn(2);
        when(connectionBanner.mode()).thenReturn(BannerMode.RECONNECTING);
        when(subscriptionManager.activeSubscriptions()).thenReturn(List.of(chat));

        mockMvc.perform(get("/api/internal/realtime/connection"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RECONNECTING"))
                .andExpect(jsonPath("$.connected").value(false))
                .andExpect(jsonPath("$.reconnecting").value(true))
                .andExpect(jsonPath("$.retryCount").value(2))
                .andExpect(jsonPath("$.banner").value("RECONNECTING"))
                .andExpect(jsonPath("$.channels[0].name").value("chat-messages-r1"))
                .andExpect(jsonPath("$.channels[0].state").value("RECONNECTING"));
    }

    @Test
    @DisplayName("Triggers a manual reconnect")
    void reconnect() throws Exception {
        when(connectionMonitor.status()).thenReturn(ConnectionStatus.CONNECTING);

        mockMvc.perform(post("/api/internal/realtime/reconnect"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONNECTING"));

        verify(connectionMonitor).reconnect();
    }

    @Test
    @DisplayName("Reports reconnect failures as 500")
    void reconnectFailure() throws Exception {
        doThrow(new IllegalStateException("monitor stopped")).when(connectionMonitor).reconnect();

        mockMvc.perform(post("/api/internal/realtime/reconnect"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("monitor stopped"));
    }
}
