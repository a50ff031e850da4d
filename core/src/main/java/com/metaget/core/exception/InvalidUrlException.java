package com.metaget.core.exception;

/** http:// 또는 https:// 로 시작하지 않는 URL. 네트워크 호출 전에 던진다. */
public class InvalidUrlException extends MetaExtractionException {
    private final String url;

    public InvalidUrlException(String url) {
        super(Kind.INVALID_URL, "invalid URL scheme: " + url);
        this.url = url;
    }

    public String getUrl() { return url; }
}
