package com.metaget.core.exception;

/**
 * 추출 호출 1건의 실패. 원인별 하위 타입이 있고 {@link #getKind()} 로도 구분할 수 있다.
 * 실패 시 부분 결과는 없다.
 */
public abstract class MetaExtractionException extends Exception {

    public enum Kind { INVALID_URL, FETCH_FAILED, UNEXPECTED_STATUS, PARSE_FAILED }

    private final Kind kind;

    protected MetaExtractionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected MetaExtractionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
