package io.github.drompincen.habitnotifier.runtime.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TelegramNotificationChannelTest {

    @Mock private HttpClient httpClient;
    @Mock private HttpResponse<String> response;

    private TelegramNotificationChannel channel;

    @BeforeEach
    void setUp() {
        channel = new TelegramNotificationChannel(httpClient, new ObjectMapper(),
                "https://telegram.test/", "123:abc", Duration.ofSeconds(2));
    }

    @Test
    void postsSendMessageToBotEndpoint() throws Exception {
        when(response.statusCode()).thenReturn(200);
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        DeliveryResult result = channel.send(42, "🔔 Reminder: time for 'Drink water'!");

        assertThat(result.isSuccess()).isTrue();
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        assertThat(request.uri().toString()).isEqualTo("https://telegram.test/bot123:abc/sendMessage");
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.headers().firstValue("Content-Type")).contains("application/json");
        assertThat(request.timeout()).contains(Duration.ofSeconds(2));
    }

    @Test
    void blockedBotIsPermanent() throws Exception {
        when(response.statusCode()).thenReturn(403);
        when(response.body()).thenReturn("{\"ok\":false,\"error_code\":403,\"description\":\"Forbidden: bot was blocked by the user\"}");
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

        DeliveryResult result = channel.send(42, "hi");

        assertThat(result.isPermanentFailure()).isTrue();
        assertThat(result.detail()).isEqualTo("403 Forbidden: bot was blocked by the user");
    }

    @Test
    void transportErrorIsTransient() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(HttpRequest.class), any());

        DeliveryResult result = channel.send(42, "hi");

        assertThat(result.status()).isEqualTo(DeliveryStatus.TRANSIENT_FAILURE);
        assertThat(result.detail()).contains("connection reset");
    }

    @Test
    void missingTokenSendsNothing() {
        TelegramNotificationChannel unconfigured = new TelegramNotificationChannel(httpClient, new ObjectMapper(),
                "https://telegram.test", "", Duration.ofSeconds(2));

        DeliveryResult result = unconfigured.send(42, "hi");

        assertThat(result.status()).isEqualTo(DeliveryStatus.TRANSIENT_FAILURE);
        verifyNoInteractions(httpClient);
    }

    @Test
    void classifiesStatusCodes() {
        assertThat(channel.classify(200, "{\"ok\":true}").status()).isEqualTo(DeliveryStatus.SUCCESS);
        assertThat(channel.classify(400, "{\"description\":\"Bad Request: chat not found\"}").status())
                .isEqualTo(DeliveryStatus.PERMANENT_FAILURE);
        assertThat(channel.classify(429, "{\"description\":\"Too Many Requests: retry after 5\"}").status())
                .isEqualTo(DeliveryStatus.TRANSIENT_FAILURE);
        assertThat(channel.classify(502, "<html>Bad Gateway</html>").status())
                .isEqualTo(DeliveryStatus.TRANSIENT_FAILURE);
        assertThat(channel.classify(502, "<html>Bad Gateway</html>").detail()).isEqualTo("502 <html>Bad Gateway</html>");
    }
}
