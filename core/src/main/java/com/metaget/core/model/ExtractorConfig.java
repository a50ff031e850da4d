package com.metaget.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 기본 전송(HttpClient) 설정. extractor.yml 매핑 대상.
 * 사용자가 HttpSender/HttpClient 를 직접 주입하면 connectTimeout/followRedirects 는 쓰이지 않는다.
 */
public final class ExtractorConfig {

    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(30); // 요청 1건 전체 타임아웃
    private boolean followRedirects = true;

    // ---------- getters ----------
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public boolean isFollowRedirects() { return followRedirects; }

    // ---------- fluent setters ----------
    public ExtractorConfig setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; return this; }
    public ExtractorConfig setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; return this; }
    public ExtractorConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }

    public ExtractorConfig setConnectTimeoutMs(long ms) {
        this.connectTimeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    public ExtractorConfig setRequestTimeoutMs(long ms) {
        this.requestTimeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero())
            throw new IllegalArgumentException("connectTimeout must be > 0");
        if (requestTimeout.isNegative() || requestTimeout.isZero())
            throw new IllegalArgumentException("requestTimeout must be > 0");
    }

    // ---------- helpers ----------
    public static ExtractorConfig defaults() { return new ExtractorConfig(); }
}
