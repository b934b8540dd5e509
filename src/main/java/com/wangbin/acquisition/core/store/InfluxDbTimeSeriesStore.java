package com.wangbin.acquisition.core.store;

import com.wangbin.acquisition.common.domain.entity.BatchPoint;
import com.wangbin.acquisition.common.exception.AcquisitionException;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * InfluxDB v2 写入实现（HTTP 行协议）
 */
@Slf4j
public class InfluxDbTimeSeriesStore implements TimeSeriesStore {

    private final AcquisitionProperties.Store config;
    private final HttpClient httpClient;
    private final URI writeUri;
    private final URI healthUri;

    public InfluxDbTimeSeriesStore(AcquisitionProperties.Store config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .build();
        String baseUrl = trimTrailingSlash(config.getUrl());
        this.writeUri = URI.create(baseUrl + "/api/v2/write?org=" + encode(config.getOrg())
                + "&bucket=" + encode(config.getBucket()) + "&precision=ms");
        this.healthUri = URI.create(baseUrl + "/health");
    }

    @Override
    public void writeBatch(List<BatchPoint> points) throws AcquisitionException {
        if (points == null || points.isEmpty()) {
            return;
        }
        String body = LineProtocolEncoder.encode(points);
        if (body.isEmpty()) {
            log.debug("批次中没有可写入字段，跳过写入: {} 点", points.size());
            return;
        }
        HttpResponse<String> response;
        try {
            response = httpClient.send(buildWriteRequest(body), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AcquisitionException.storeWriteException("InfluxDB 写入被中断", e);
        } catch (IOException e) {
            throw AcquisitionException.storeWriteException("InfluxDB 不可达: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // 请求构建失败（如 token 含非法字符）属于配置问题，与数据无关
            throw AcquisitionException.storeWriteException("InfluxDB 写入请求无效: " + e.getMessage(), e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String message = "InfluxDB 拒绝写入, HTTP " + status + ": " + response.body();
            if (isDataRejection(status)) {
                throw AcquisitionException.storeRejectedException(message);
            }
            throw AcquisitionException.storeWriteException(message, null);
        }
        log.debug("InfluxDB 写入成功: {} 点", points.size());
    }

    private HttpRequest buildWriteRequest(String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(writeUri)
                .timeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .header("Content-Type", "text/plain; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (config.getToken() != null && !config.getToken().isBlank()) {
            builder.header("Authorization", "Token " + config.getToken());
        }
        return builder.build();
    }

    /**
     * 400/413/422 表示数据本身无法写入；401/403/404/5xx 与数据无关，稍后重试
     */
    static boolean isDataRejection(int status) {
        return status == 400 || status == 413 || status == 422;
    }

    @Override
    public boolean isHealthy() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(healthUri)
                .timeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (IOException e) {
            log.warn("InfluxDB 健康检查失败: {}", e.getMessage());
            return false;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
