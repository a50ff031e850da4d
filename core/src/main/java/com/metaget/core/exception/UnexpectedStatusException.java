package com.metaget.core.exception;

/** 서버가 응답했지만 200 이 아니었다. */
public class UnexpectedStatusException extends MetaExtractionException {
    private final String url;
    private final int statusCode;

    public UnexpectedStatusException(String url, int statusCode) {
        super(Kind.UNEXPECTED_STATUS, "unexpected status code: " + statusCode + " (" + url + ")");
        this.url = url;
        this.statusCode = statusCode;
    }

    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
}
