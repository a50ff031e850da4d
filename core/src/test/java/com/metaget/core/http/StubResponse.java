package com.metaget.core.http;

import javax.net.ssl.SSLSession;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/** 테스트용 HttpResponse<InputStream>: 본문 close 여부를 기록 */
class StubResponse implements HttpResponse<InputStream> {

    static final class TrackingBody extends ByteArrayInputStream {
        volatile boolean closed;
        TrackingBody(String s) { super(s.getBytes(StandardCharsets.UTF_8)); }
        @Override public void close() throws IOException { closed = true; super.close(); }
    }

    final int code;
    final TrackingBody body;
    private final HttpRequest request;

    StubResponse(HttpRequest request, int code, String body) {
        this.request = request;
        this.code = code;
        this.body = new TrackingBody(body);
    }

    @Override public int statusCode() { return code; }
    @Override public HttpRequest request() { return request; }
    @Override public Optional<HttpResponse<InputStream>> previousResponse() { return Optional.empty(); }
    @Override public HttpHeaders headers() { return HttpHeaders.of(Map.of(), (a, b) -> true); }
    @Override public InputStream body() { return body; }
    @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
    @Override public URI uri() { return request.uri(); }
    @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
}
