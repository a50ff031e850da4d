package com.metaget.core.service;

import com.metaget.core.api.IMetaExtractor;
import com.metaget.core.api.IMetaTagParser;
import com.metaget.core.api.IPageFetcher;
import com.metaget.core.exception.FetchFailedException;
import com.metaget.core.exception.MetaExtractionException;
import com.metaget.core.http.HttpSender;
import com.metaget.core.http.PageFetcher;
import com.metaget.core.model.ExtractorConfig;
import com.metaget.core.model.MetaTag;
import com.metaget.core.parser.JsoupMetaTagParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;

/**
 * meta 추출 진입점: fetch → parse → 순회.
 *  - 기본 생성자는 플랫폼 HttpClient 사용
 *  - HttpSender 주입 생성자는 테스트 더블/프록시/TLS 커스텀용
 *  - 상태 없음: 같은 인스턴스를 여러 스레드가 써도 된다(전송이 허용하는 한)
 */
public final class MetaExtractor implements IMetaExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(MetaExtractor.class);

    private final IPageFetcher fetcher;
    private final IMetaTagParser parser;

    public MetaExtractor() {
        this(ExtractorConfig.defaults());
    }

    public MetaExtractor(ExtractorConfig config) {
        this(new PageFetcher(config), new JsoupMetaTagParser());
    }

    public MetaExtractor(HttpSender transport) {
        this(ExtractorConfig.defaults(), transport);
    }

    public MetaExtractor(ExtractorConfig config, HttpSender transport) {
        this(new PageFetcher(config, transport), new JsoupMetaTagParser());
    }

    /** DI/테스트용 */
    public MetaExtractor(IPageFetcher fetcher, IMetaTagParser parser) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public List<MetaTag> extract(String url) throws MetaExtractionException {
        long start = System.nanoTime();
        List<MetaTag> tags;
        try (InputStream body = fetcher.fetch(url)) {
            tags = parser.parse(body, url);
        } catch (IOException e) {
            // 파싱은 끝났지만 응답 본문 close 실패 → 전송 계층 문제로 본다
            throw new FetchFailedException(url, e);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        LOG.atInfo().addKeyValue("url", url).addKeyValue("tags", tags.size()).addKeyValue("ms", elapsedMs)
                .log("extract.done");
        return tags;
    }

    @Override
    public List<MetaTag> extract(InputStream html) throws MetaExtractionException {
        Objects.requireNonNull(html, "html");
        List<MetaTag> tags = parser.parse(html, "");
        LOG.debug("extracted {} meta tag(s) from stream", tags.size());
        return tags;
    }
}
