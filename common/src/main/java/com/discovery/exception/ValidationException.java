package com.discovery.exception;

/**
 * 注册请求格式错误，直接返回给调用方，不重试
 *
 * @author sakame
 * @version 1.0
 */
public class ValidationException extends RegistryException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
