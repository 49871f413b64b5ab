package com.p2pclient.core.http;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/** 전송 훅: 프로덕션은 JDK HttpClient, 테스트는 가짜 응답을 주입한다. */
@FunctionalInterface
public interface HttpTransport {
    HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
}
