package com.discovery.config;

import com.discovery.constant.RegistryConstant;
import com.discovery.constant.RemovalPolicy;
import com.discovery.serializer.SerializerKeys;
import com.discovery.utils.ConfigUtils;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * 注册中心配置，对应 application.properties 中 registry. 开头的配置项
 *
 * @author sakame
 * @version 1.0
 */
@Data
@Slf4j
public class RegistryConfig {

    /**
     * 主机名
     */
    private String serverHost = "localhost";

    /**
     * 端口号
     */
    private Integer serverPort = RegistryConstant.DEFAULT_SERVER_PORT;

    /**
     * 心跳间隔，一轮检测结束后等待的时间
     */
    private long heartbeatIntervalMillis = 3000;

    /**
     * 单次心跳检测的最大尝试次数
     */
    private int heartbeatAttempts = 3;

    /**
     * 心跳失败后重试前的等待时间
     */
    private long heartbeatRetryDelayMillis = 1000;

    /**
     * 心跳失败时何时移除服务
     */
    private RemovalPolicy removalPolicy = RemovalPolicy.EAGER;

    /**
     * 对外 http 调用超时
     */
    private int httpTimeoutMillis = 3000;

    /**
     * 推送线程数
     */
    private int notifyThreads = 8;

    /**
     * 推送任务队列长度，超出的推送会被丢弃
     */
    private int notifyQueueCapacity = 1024;

    /**
     * 关闭时等待未完成推送的时间
     */
    private long shutdownTimeoutMillis = 5000;

    /**
     * 序列化器
     */
    private String serializer = SerializerKeys.JSON;

    /**
     * 单例
     */
    private static volatile RegistryConfig registryConfig;

    /**
     * 获取配置，首次调用时从配置文件加载
     *
     * @return
     */
    public static RegistryConfig getRegistryConfig() {
        if (registryConfig == null) {
            synchronized (RegistryConfig.class) {
                if (registryConfig == null) {
                    registryConfig = ConfigUtils.loadConfig(RegistryConfig.class, RegistryConstant.DEFAULT_CONFIG_PREFIX);
                    log.info("registry config loaded: {}", registryConfig);
                }
            }
        }
        return registryConfig;
    }
}
