package com.httpmonitor.service;

import com.httpmonitor.model.ErrorCategory;
import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.HttpMethod;
import com.httpmonitor.model.Target;
import com.httpmonitor.transport.HttpResponseData;
import com.httpmonitor.transport.ProbeRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

public class ProberTest {
    private static final String URL = "http://example.com/health";
    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private FakeTransport transport;
    private Prober prober;

    @BeforeEach
    void setup() {
        transport = new FakeTransport();
        prober = new Prober(transport, new UserAgentProvider(), new UnknownCertificateExpiryInspector(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Target target(List<Integer> expectedStatus, String expectedContent) {
        return new Target("api", URL, HttpMethod.GET, Map.of(), expectedStatus, expectedContent,
            Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    @Test
    void configuredRedirectStatusIsSuccess() {
        transport.enqueue(URL, new FakeTransport.TransportOutcome(
            FakeTransport.response(301, "", Duration.ofMillis(40))));

        HealthCheck check = prober.probe(target(List.of(200, 301, 302), null));

        assertThat(check.isSuccess()).isTrue();
        assertThat(check.getStatusCode()).isEqualTo(301);
        assertThat(check.getErrorCategory()).isEqualTo(ErrorCategory.NONE);
        assertThat(check.getResponseTimeMs()).isEqualTo(40);
        assertThat(check.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    void unexpectedStatusFailsWithoutReadingBody() {
        HttpResponseData response = FakeTransport.response(404, "not found", Duration.ofMillis(40));
        transport.enqueue(URL, new FakeTransport.TransportOutcome(response));

        HealthCheck check = prober.probe(target(List.of(200, 301, 302), null));

        assertThat(check.isSuccess()).isFalse();
        assertThat(check.getStatusCode()).isEqualTo(404);
        assertThat(check.getErrorCategory()).isEqualTo(ErrorCategory.HTTP_ERROR);
        assertThat(response.isBodyRead()).isFalse();
    }

    @Test
    void emptyExpectedStatusAcceptsAny2xx() {
        transport.enqueue(URL, new FakeTransport.TransportOutcome(
            FakeTransport.response(204, "", Duration.ofMillis(10))));
        transport.enqueue(URL, new FakeTransport.TransportOutcome(
            FakeTransport.response(302, "", Duration.ofMillis(10))));

        assertThat(prober.probe(target(List.of(), null)).isSuccess()).isTrue();
        assertThat(prober.probe(target(List.of(), null)).isSuccess()).isFalse();
    }

    @Test
    void bodyIsNotReadWithoutExpectedContent() {
        HttpResponseData response = FakeTransport.response(200, "ok", Duration.ofMillis(10));
        transport.enqueue(URL, new FakeTransport.TransportOutcome(response));

        prober.probe(target(List.of(), null));

        assertThat(response.isBodyRead()).isFalse();
    }

    @Test
    void expectedContentPresentIsSuccess() {
        transport.enqueue(URL, new FakeTransport.TransportOutcome(
            FakeTransport.response(200, "{\"status\":\"ok\"}", Duration.ofMillis(10))));

        HealthCheck check = prober.probe(target(List.of(200), "\"status\":\"ok\""));

        assertThat(check.isSuccess()).isTrue();
        assertThat(check.getError()).isNull();
    }

    @Test
    void contentMismatchIsRecordedDistinctly() {
        transport.enqueue(URL, new FakeTransport.TransportOutcome(
            FakeTransport.response(200, "{\"status\":\"down\"}", Duration.ofMillis(10))));

        HealthCheck check = prober.probe(target(List.of(200), "\"status\":\"ok\""));

        assertThat(check.isSuccess()).isFalse();
        assertThat(check.getStatusCode()).isEqualTo(200);
        assertThat(check.getErrorCategory()).isEqualTo(ErrorCategory.CONTENT_MISMATCH);
        assertThat(check.getError()).isEqualTo("Expected content '\"status\":\"ok\"' not found in response");
    }

    @Test
    void bodyReadFailureIsFailure() {
        transport.enqueue(URL, new FakeTransport.TransportOutcome(
            FakeTransport.unreadableResponse(200, Duration.ofMillis(10))));

        HealthCheck check = prober.probe(target(List.of(200), "ok"));

        assertThat(check.isSuccess()).isFalse();
        assertThat(check.getErrorCategory()).isEqualTo(ErrorCategory.BODY_READ_ERROR);
        assertThat(check.getError()).startsWith("Failed to read response body");
    }

    @Test
    void slowBodyCountsAgainstTargetTimeout() {
        transport.enqueue(URL, new FakeTransport.TransportOutcome(
            FakeTransport.stalledResponse(200, Duration.ofMillis(50), Duration.ofSeconds(3))));
        Target target = new Target("api", URL, HttpMethod.GET, Map.of(), List.of(200), "ok",
            Duration.ofMillis(300), Duration.ofSeconds(30));

        long start = System.nanoTime();
        HealthCheck check = prober.probe(target);
        Duration wall = Duration.ofNanos(System.nanoTime() - start);

        assertThat(check.isSuccess()).isFalse();
        assertThat(check.getStatusCode()).isEqualTo(200);
        assertThat(check.getErrorCategory()).isEqualTo(ErrorCategory.TIMEOUT);
        assertThat(check.getError()).isEqualTo("Request timed out");
        assertThat(check.getResponseTimeMs()).isGreaterThanOrEqualTo(250);
        assertThat(wall).isLessThan(Duration.ofSeconds(2));
    }

    @Test
    void timeoutIsRecordedNotThrown() {
        transport.enqueue(URL, new FakeTransport.TransportOutcome(new HttpTimeoutException("timeout")));

        HealthCheck check = prober.probe(target(List.of(), null));

        assertThat(check.isSuccess()).isFalse();
        assertThat(check.getStatusCode()).isNull();
        assertThat(check.getErrorCategory()).isEqualTo(ErrorCategory.TIMEOUT);
        assertThat(check.getError()).isEqualTo("Request timed out");
    }

    @Test
    void dnsFailureIsHandled() {
        transport.enqueue(URL, new FakeTransport.TransportOutcome(new UnknownHostException("example.com")));

        assertThat(prober.probe(target(List.of(), null)).getErrorCategory()).isEqualTo(ErrorCategory.DNS_FAILURE);
    }

    @Test
    void wrappedDnsFailureIsHandled() {
        ConnectException wrapped = new ConnectException();
        wrapped.initCause(new java.nio.channels.UnresolvedAddressException());
        transport.enqueue(URL, new FakeTransport.TransportOutcome(wrapped));

        assertThat(prober.probe(target(List.of(), null)).getErrorCategory()).isEqualTo(ErrorCategory.DNS_FAILURE);
    }

    @Test
    void tlsFailureIsHandled() {
        transport.enqueue(URL, new FakeTransport.TransportOutcome(new SSLHandshakeException("tls")));

        assertThat(prober.probe(target(List.of(), null)).getErrorCategory()).isEqualTo(ErrorCategory.TLS_ERROR);
    }

    @Test
    void connectionRefusedIsHandled() {
        transport.enqueue(URL, new FakeTransport.TransportOutcome(new ConnectException("Connection refused")));

        HealthCheck check = prober.probe(target(List.of(), null));

        assertThat(check.getErrorCategory()).isEqualTo(ErrorCategory.CONNECTION_FAILURE);
        assertThat(check.getError()).contains("Connection refused");
    }

    @Test
    void userAgentIsAddedWhenMissing() {
        prober.probe(target(List.of(), null));

        ProbeRequest request = transport.getRequests().get(0);
        assertThat(request.getHeaders()).containsKey("User-Agent");
        assertThat(request.getHeaders().get("User-Agent")).startsWith("Mozilla/5.0");
    }

    @Test
    void callerUserAgentIsKept() {
        Target target = new Target("api", URL, HttpMethod.HEAD, Map.of("user-agent", "probe/1.0", "X-Token", "abc"),
            List.of(), null, Duration.ofSeconds(2), Duration.ofSeconds(30));

        prober.probe(target);

        ProbeRequest request = transport.getRequests().get(0);
        assertThat(request.getHeaders()).containsEntry("user-agent", "probe/1.0")
            .containsEntry("X-Token", "abc")
            .doesNotContainKey("User-Agent");
        assertThat(request.getMethod()).isEqualTo(HttpMethod.HEAD);
        assertThat(request.getTimeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void certificateExpiryOnlyLookedUpForHttps() {
        String httpsUrl = "https://secure.example.com";
        Prober withCert = new Prober(transport, new UserAgentProvider(), url -> OptionalInt.of(5),
            Clock.fixed(NOW, ZoneOffset.UTC));
        Target https = new Target("secure", httpsUrl, HttpMethod.GET, Map.of(), List.of(), null,
            Duration.ofSeconds(1), Duration.ofSeconds(30));

        assertThat(withCert.probe(https).getCertExpiresDays()).isEqualTo(5);
        assertThat(withCert.probe(target(List.of(), null)).getCertExpiresDays()).isNull();
        assertThat(prober.probe(https).getCertExpiresDays()).isNull();
    }
}
