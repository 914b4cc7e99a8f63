package com.discovery.server.handler;

import cn.hutool.core.util.StrUtil;
import cn.hutool.http.HttpStatus;
import com.discovery.constant.RegistryConstant;
import com.discovery.model.Registration;
import com.discovery.registry.Registry;
import com.discovery.serializer.Serializer;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerRequest;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 注册接口
 * <p>
 * POST /services 注册，请求体为 json 格式的注册信息；
 * DELETE /services 注销，请求体为服务地址。
 * 注册中心的调用可能包含对外 http 请求，放在 worker 线程中执行
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class RegistrationHandler implements Handler<HttpServerRequest> {

    private final Vertx vertx;

    private final Registry registry;

    private final Serializer serializer;

    public RegistrationHandler(Vertx vertx, Registry registry, Serializer serializer) {
        this.vertx = vertx;
        this.registry = registry;
        this.serializer = serializer;
    }

    @Override
    public void handle(HttpServerRequest httpServerRequest) {
        log.debug("Received request:{} {}", httpServerRequest.method(), httpServerRequest.uri());

        if (!RegistryConstant.SERVICES_PATH.equals(httpServerRequest.path())) {
            doResponse(httpServerRequest, HttpStatus.HTTP_NOT_FOUND);
            return;
        }

        HttpMethod method = httpServerRequest.method();
        if (HttpMethod.POST.equals(method)) {
            httpServerRequest.exceptionHandler(e -> {
                log.warn("fail to read registration body", e);
                doResponse(httpServerRequest, HttpStatus.HTTP_BAD_REQUEST);
            });
            httpServerRequest.bodyHandler(body -> doRegister(httpServerRequest, body));
        } else if (HttpMethod.DELETE.equals(method)) {
            httpServerRequest.exceptionHandler(e -> {
                log.warn("fail to read service url", e);
                doResponse(httpServerRequest, HttpStatus.HTTP_INTERNAL_ERROR);
            });
            httpServerRequest.bodyHandler(body -> doUnRegister(httpServerRequest, body));
        } else {
            doResponse(httpServerRequest, HttpStatus.HTTP_BAD_METHOD);
        }
    }

    private void doRegister(HttpServerRequest request, Buffer body) {
        Registration registration;
        try {
            registration = serializer.deserialize(body.getBytes(), Registration.class);
        } catch (IOException e) {
            log.warn("malformed registration: {}", e.getMessage());
            doResponse(request, HttpStatus.HTTP_BAD_REQUEST);
            return;
        }
        if (registration == null) {
            doResponse(request, HttpStatus.HTTP_BAD_REQUEST);
            return;
        }

        vertx.executeBlocking(() -> {
            registry.register(registration);
            return null;
        }, false).onComplete(result -> {
            if (result.succeeded()) {
                doResponse(request, HttpStatus.HTTP_OK);
            } else {
                log.warn("fail to register {}: {}", registration.getServiceUrl(), result.cause().getMessage());
                doResponse(request, HttpStatus.HTTP_BAD_REQUEST);
            }
        });
    }

    private void doUnRegister(HttpServerRequest request, Buffer body) {
        String serviceUrl = StrUtil.trim(body.toString(StandardCharsets.UTF_8));
        log.info("remove service with url:{}", serviceUrl);

        vertx.executeBlocking(() -> {
            registry.unRegister(serviceUrl);
            return null;
        }, false).onComplete(result -> {
            if (result.succeeded()) {
                doResponse(request, HttpStatus.HTTP_OK);
            } else {
                log.error("fail to remove {}", serviceUrl, result.cause());
                doResponse(request, HttpStatus.HTTP_INTERNAL_ERROR);
            }
        });
    }

    /**
     * 响应方法，只返回状态码
     *
     * @param request
     * @param statusCode
     */
    void doResponse(HttpServerRequest request, int statusCode) {
        if (request.response().ended()) {
            return;
        }
        request.response()
                .setStatusCode(statusCode)
                .end();
    }
}
