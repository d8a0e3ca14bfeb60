package cn.bafuka.geoarmor.spi.impl;

import cn.bafuka.geoarmor.core.TransportResponse;
import cn.bafuka.geoarmor.spi.RemoteTransport;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 基于 RestTemplate 的远程缓存传输层
 * 带固定超时，从不抛异常
 */
@Slf4j
public class RestTemplateRemoteTransport implements RemoteTransport {

    /**
     * 远程缓存服务地址
     */
    private final String baseUrl;

    /**
     * 单次调用超时（毫秒）
     */
    private final long timeoutMs;

    private final RestTemplate restTemplate;

    private final ExecutorService httpExecutor = Executors.newFixedThreadPool(4, r -> {
        Thread thread = new Thread(r, "geoarmor-remote-http");
        thread.setDaemon(true);
        return thread;
    });

    public RestTemplateRemoteTransport(String baseUrl, long timeoutMs) {
        this(baseUrl, timeoutMs, new RestTemplate(requestFactory(timeoutMs)));
    }

    public RestTemplateRemoteTransport(String baseUrl, long timeoutMs, RestTemplate restTemplate) {
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.timeoutMs = timeoutMs;
        this.restTemplate = restTemplate;
    }

    @Override
    public CompletableFuture<TransportResponse> call(String path, String method, Object body) {
        if (baseUrl.isEmpty()) {
            return CompletableFuture.completedFuture(TransportResponse.failure(0, "no-server"));
        }

        try {
            return CompletableFuture.supplyAsync(() -> exchange(path, method, body), httpExecutor)
                    .completeOnTimeout(TransportResponse.failure(0, "timeout"), timeoutMs, TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        log.warn("远程调用异常: path={}, error={}", path, e.getMessage());
                        return TransportResponse.failure(0, String.valueOf(e.getMessage()));
                    });
        } catch (Exception e) {
            // 线程池已关闭
            log.warn("远程调用提交失败: path={}, error={}", path, e.getMessage());
            return CompletableFuture.completedFuture(TransportResponse.failure(0, String.valueOf(e.getMessage())));
        }
    }

    public void shutdown() {
        httpExecutor.shutdownNow();
    }

    private TransportResponse exchange(String path, String method, Object body) {
        String url = baseUrl + path;
        HttpMethod httpMethod = HttpMethod.resolve(method.toUpperCase());
        if (httpMethod == null) {
            return TransportResponse.failure(0, "unsupported method: " + method);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<String> entity = new HttpEntity<>(body != null ? JSON.toJSONString(body) : null, headers);

        try {
            ResponseEntity<String> response = restTemplate.exchange(url, httpMethod, entity, String.class);
            int status = response.getStatusCodeValue();
            return new TransportResponse(response.getStatusCode().is2xxSuccessful(), status,
                    parseBody(response.getBody()), null);

        } catch (RestClientResponseException e) {
            return new TransportResponse(false, e.getRawStatusCode(),
                    parseBody(e.getResponseBodyAsString()), e.getStatusText());

        } catch (RestClientException e) {
            return TransportResponse.failure(0, e.getMessage());
        }
    }

    private static JSONObject parseBody(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        try {
            return JSON.parseObject(body);
        } catch (JSONException | ClassCastException e) {
            return null;
        }
    }

    private static SimpleClientHttpRequestFactory requestFactory(long timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeoutMs);
        factory.setReadTimeout((int) timeoutMs);
        return factory;
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
