package com.mmbrief.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * 模块说明：HttpClientEx（class）。
 * 主要职责：封装 JDK HttpClient 的 GET 调用，返回状态码与响应体，由调用方决定重试策略。
 * 使用建议：测试中可继承本类覆盖 get，避免真实网络访问。
 */
public class HttpClientEx {
    private static final String USER_AGENT = "Mozilla/5.0 (compatible; mmbrief/1.0)";

    private final HttpClient client;

    public HttpClientEx() {
        this(20);
    }

    public HttpClientEx(int connectTimeoutSeconds) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(Math.max(1, connectTimeoutSeconds)))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public Response get(String url, int timeoutSeconds) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        return new Response(resp.statusCode(), resp.body());
    }

    public static final class Response {
        public final int status;
        public final String body;

        public Response(int status, String body) {
            this.status = status;
            this.body = body == null ? "" : body;
        }

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
