package com.metaget.core.exception;

/** 전송 계층 실패(DNS, 연결 거부, 타임아웃, TLS 등). 원인 예외를 감싼다. */
public class FetchFailedException extends MetaExtractionException {
    private final String url;

    public FetchFailedException(String url, Throwable cause) {
        super(Kind.FETCH_FAILED, "failed to fetch URL: " + url
                + (cause != null && cause.getMessage() != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.url = url;
    }

    public String getUrl() { return url; }
}
