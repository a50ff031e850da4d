package com.metaget.core.http;

import com.metaget.core.api.IPageFetcher;
import com.metaget.core.exception.FetchFailedException;
import com.metaget.core.exception.InvalidUrlException;
import com.metaget.core.exception.MetaExtractionException;
import com.metaget.core.exception.UnexpectedStatusException;
import com.metaget.core.model.ExtractorConfig;
import com.metaget.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * 단발 GET 페처.
 * - 스킴 검사(http:// | https://)는 전송 전에 수행
 * - 200 이외 응답은 본문을 닫고 UnexpectedStatusException
 * - 재시도 없음, 커스텀 헤더 없음
 */
public final class PageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PageFetcher.class);

    private final ExtractorConfig config;
    private final HttpSender sender;

    /** 기본 전송: config 기반 HttpClient */
    public PageFetcher(ExtractorConfig config) {
        this(config, HttpSender.of(defaultClient(config)));
    }

    /** 전송 주입(테스트 더블, 프록시/TLS 커스텀 클라이언트) */
    public PageFetcher(ExtractorConfig config, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    static HttpClient defaultClient(ExtractorConfig config) {
        Objects.requireNonNull(config, "config");
        config.validate();
        return HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getConnectTimeout())
                .build();
    }

    @Override
    public InputStream fetch(String url) throws MetaExtractionException {
        if (!UrlUtils.isHttpUrl(url)) {
            LOG.atWarn().addKeyValue("url", url).log("fetch.invalid_url");
            throw new InvalidUrlException(url);
        }

        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(config.getRequestTimeout())
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            // 접두사는 맞지만 URI 로 해석 불가(공백, 호스트 누락 등)
            throw failed(url, e);
        }

        long start = System.nanoTime();
        HttpResponse<InputStream> resp;
        try {
            resp = sender.send(req);
        } catch (IOException e) {
            throw failed(url, e);
        } catch (IllegalArgumentException e) {
            // HttpClient 가 전송 단계에서야 거부하는 URI (예: 범위 밖 포트)
            throw failed(url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failed(url, e);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        int status = resp.statusCode();
        if (status != 200) {
            LOG.atWarn().addKeyValue("url", url).addKeyValue("status", status).addKeyValue("ms", elapsedMs)
                    .log("fetch.status");
            UnexpectedStatusException ex = new UnexpectedStatusException(url, status);
            closeBody(resp.body(), ex);
            throw ex;
        }

        LOG.atDebug().addKeyValue("url", url).addKeyValue("status", status).addKeyValue("ms", elapsedMs)
                .log("fetch.ok");
        InputStream body = resp.body();
        return body == null ? InputStream.nullInputStream() : body;
    }

    private static FetchFailedException failed(String url, Exception cause) {
        LOG.atWarn().setCause(cause).addKeyValue("url", url).addKeyValue("error", cause.getClass().getSimpleName())
                .log("fetch.failed");
        return new FetchFailedException(url, cause);
    }

    /** 실패 경로에서 본문 정리. close 실패는 던질 예외에 suppressed 로 붙인다. */
    private static void closeBody(InputStream body, Exception primary) {
        if (body == null) return;
        try {
            body.close();
        } catch (IOException e) {
            LOG.debug("body close failed after error: {}", e.toString());
            primary.addSuppressed(e);
        }
    }
}
