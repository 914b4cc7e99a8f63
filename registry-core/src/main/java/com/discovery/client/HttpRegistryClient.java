package com.discovery.client;

import cn.hutool.http.Header;
import cn.hutool.http.HttpRequest;
import cn.hutool.http.HttpResponse;
import cn.hutool.http.HttpStatus;
import com.discovery.config.RegistryConfig;
import com.discovery.constant.RegistryConstant;
import com.discovery.exception.DeliveryException;
import com.discovery.model.Patch;
import com.discovery.serializer.Serializer;
import com.discovery.serializer.SerializerFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.function.Supplier;

/**
 * 基于 hutool http 的实现，所有请求都带超时
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class HttpRegistryClient implements RegistryClient {

    private final Serializer serializer;

    private final int timeoutMillis;

    public HttpRegistryClient(RegistryConfig registryConfig) {
        this(SerializerFactory.getInstance(registryConfig.getSerializer()), registryConfig.getHttpTimeoutMillis());
    }

    public HttpRegistryClient(Serializer serializer, int timeoutMillis) {
        this.serializer = serializer;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public void sendPatch(Patch patch, String url) {
        byte[] bodyBytes;
        try {
            bodyBytes = serializer.serialize(patch);
        } catch (IOException e) {
            throw new DeliveryException(url, e);
        }

        try (HttpResponse httpResponse = execute(url, () -> HttpRequest.post(url)
                .header(Header.CONTENT_TYPE, RegistryConstant.CONTENT_TYPE_JSON)
                .body(bodyBytes)
                .timeout(timeoutMillis))) {
            if (!httpResponse.isOk()) {
                throw new DeliveryException(url, httpResponse.getStatus());
            }
        }
        log.debug("patch sent to {}: {}", url, patch);
    }

    @Override
    public boolean checkHealth(String url) {
        try (HttpResponse httpResponse = execute(url, () -> HttpRequest.get(url).timeout(timeoutMillis))) {
            return httpResponse.getStatus() == HttpStatus.HTTP_OK;
        }
    }

    /**
     * 发送请求，连接失败、超时、非法地址统一转为 DeliveryException
     *
     * @param url
     * @param request
     * @return
     */
    private HttpResponse execute(String url, Supplier<HttpRequest> request) {
        try {
            return request.get().execute();
        } catch (RuntimeException e) {
            throw new DeliveryException(url, e);
        }
    }
}
