package com.discovery.utils;

import cn.hutool.core.io.resource.ResourceUtil;
import cn.hutool.core.util.ReflectUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.setting.dialect.Props;
import lombok.extern.slf4j.Slf4j;

/**
 * 配置工具类，从 classpath 下的 properties 文件读取配置
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class ConfigUtils {

    private static final String BASE_NAME = "application";

    /**
     * 加载配置对象
     *
     * @param tClass
     * @param prefix
     * @param <T>
     * @return
     */
    public static <T> T loadConfig(Class<T> tClass, String prefix) {
        return loadConfig(tClass, prefix, "");
    }

    /**
     * 加载配置对象，支持区分环境，application-{environment}.properties 覆盖默认文件
     *
     * @param tClass
     * @param prefix
     * @param environment
     * @param <T>
     * @return 文件都不存在时返回默认配置
     */
    public static <T> T loadConfig(Class<T> tClass, String prefix, String environment) {
        Props props = new Props();
        loadInto(props, BASE_NAME + ".properties");
        if (StrUtil.isNotBlank(environment)) {
            loadInto(props, BASE_NAME + "-" + environment + ".properties");
        }
        if (props.isEmpty()) {
            log.info("no {} properties found, use default {}", BASE_NAME, tClass.getSimpleName());
            return ReflectUtil.newInstance(tClass);
        }
        return props.toBean(tClass, prefix);
    }

    private static void loadInto(Props props, String fileName) {
        if (ResourceUtil.getResource(fileName) == null) {
            return;
        }
        props.putAll(new Props(fileName));
        log.info("load config file {}", fileName);
    }
}
