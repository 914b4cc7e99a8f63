package com.discovery.constant;

/**
 * 服务健康状态
 *
 * @author sakame
 * @version 1.0
 */
public enum HealthStatus {
    /**
     * 最近一次检测通过
     */
    HEALTHY,

    /**
     * 正在检测或重试中
     */
    PROBING,

    /**
     * 所有尝试均失败，已移除
     */
    UNHEALTHY
}
