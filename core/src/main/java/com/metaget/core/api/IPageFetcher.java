package com.metaget.core.api;

import com.metaget.core.exception.MetaExtractionException;

import java.io.InputStream;

/** URL 하나를 GET 해서 200 응답 본문을 스트림으로 돌려준다. */
public interface IPageFetcher {
    /**
     * 반환된 스트림은 호출자가 닫는다. 예외로 끝나는 경우 본문은 이미 닫혀 있다.
     */
    InputStream fetch(String url) throws MetaExtractionException;
}
