package com.discovery.exception;

/**
 * 注册中心异常基类
 *
 * @author sakame
 * @version 1.0
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
