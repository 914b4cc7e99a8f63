package com.discovery.exception;

/**
 * 修改注册表时的意外错误，只影响当前请求
 *
 * @author sakame
 * @version 1.0
 */
public class StoreException extends RegistryException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
