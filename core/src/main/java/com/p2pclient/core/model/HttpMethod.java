package com.p2pclient.core.model;

/** P2P API 가 쓰는 HTTP 동사. GET 만 기본적으로 "읽기"(캐시 대상). */
public enum HttpMethod {
    GET(true),
    POST(false),
    PUT(false),
    DELETE(false);

    private final boolean readByDefault;

    HttpMethod(boolean readByDefault) { this.readByDefault = readByDefault; }

    public boolean isReadByDefault() { return readByDefault; }
}
