package com.metaget.core.http;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * 전송 계층 훅. 요청 1건을 보내고 상태 코드 + 본문 스트림을 돌려준다.
 * 테스트에서는 람다로 대체하고, 프로덕션에서는 {@link #of(HttpClient)} 로 감싼다.
 */
@FunctionalInterface
public interface HttpSender {

    HttpResponse<InputStream> send(HttpRequest req) throws IOException, InterruptedException;

    /** 사용자 HttpClient(프록시/TLS 설정 포함)를 그대로 사용 */
    static HttpSender of(HttpClient client) {
        Objects.requireNonNull(client, "client");
        return req -> client.send(req, HttpResponse.BodyHandlers.ofInputStream());
    }
}
