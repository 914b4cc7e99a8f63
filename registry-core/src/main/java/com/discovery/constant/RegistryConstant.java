package com.discovery.constant;

/**
 * 注册中心相关常量
 *
 * @author sakame
 * @version 1.0
 */
public interface RegistryConstant {
    /**
     * 默认配置文件加载前缀
     */
    String DEFAULT_CONFIG_PREFIX = "registry";

    /**
     * 默认端口
     */
    int DEFAULT_SERVER_PORT = 3000;

    /**
     * 注册接口路径
     */
    String SERVICES_PATH = "/services";

    String CONTENT_TYPE_JSON = "application/json";
}
