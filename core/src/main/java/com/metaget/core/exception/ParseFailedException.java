package com.metaget.core.exception;

/** HTML 파서가 바이트 스트림에서 문서 트리를 만들지 못했다. */
public class ParseFailedException extends MetaExtractionException {
    public ParseFailedException(Throwable cause) {
        super(Kind.PARSE_FAILED, "failed to parse HTML"
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
    }
}
