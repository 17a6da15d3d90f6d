package com.httpmonitor.transport;

import com.httpmonitor.model.HttpMethod;

import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

public class JavaHttpTransport implements HttpTransport {
    private final HttpClient httpClient;

    public JavaHttpTransport(boolean followRedirects) {
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(followRedirects ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public HttpResponseData execute(ProbeRequest probe) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(probe.getUrl()))
            .timeout(probe.getTimeout());

        for (Map.Entry<String, String> entry : probe.getHeaders().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        HttpMethod method = probe.getMethod();
        if (method == HttpMethod.GET) {
            builder.GET();
        } else if (method == HttpMethod.DELETE) {
            builder.DELETE();
        } else {
            builder.method(method.name(), HttpRequest.BodyPublishers.noBody());
        }

        HttpRequest request = builder.build();
        Instant start = Instant.now();
        HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        Duration duration = Duration.between(start, Instant.now());

        return new HttpResponseData(response.statusCode(), response.headers().map(), duration, response.body());
    }
}
