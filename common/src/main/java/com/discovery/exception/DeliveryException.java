package com.discovery.exception;

import lombok.Getter;

/**
 * 对外 http 调用失败（推送、补发、心跳）
 *
 * @author sakame
 * @version 1.0
 */
@Getter
public class DeliveryException extends RegistryException {

    /**
     * 目标地址
     */
    private final String url;

    /**
     * 响应状态码，传输层失败时为 -1
     */
    private final int status;

    public DeliveryException(String url, int status) {
        super(String.format("request to %s failed with code:%d", url, status));
        this.url = url;
        this.status = status;
    }

    public DeliveryException(String url, Throwable cause) {
        super(String.format("request to %s failed: %s", url, cause.getMessage()), cause);
        this.url = url;
        this.status = -1;
    }
}
