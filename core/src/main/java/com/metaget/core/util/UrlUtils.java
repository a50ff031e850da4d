package com.metaget.core.util;

/** URL 스킴 판정 유틸 */
public final class UrlUtils {
    private UrlUtils() {}

    /** 대소문자 구분 접두사 검사. "HTTP://" 나 상대 경로는 거부 */
    public static boolean isHttpUrl(String url) {
        if (url == null) return false;
        return url.startsWith("http://") || url.startsWith("https://");
    }
}
