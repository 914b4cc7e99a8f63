package com.discovery.constant;

/**
 * 心跳失败时移除服务的时机
 *
 * @author sakame
 * @version 1.0
 */
public enum RemovalPolicy {
    /**
     * 第一次失败立即移除，之后重试成功再重新注册
     */
    EAGER,

    /**
     * 所有尝试都失败后才移除
     */
    AFTER_RETRIES
}
