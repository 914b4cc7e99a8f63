package com.discovery.spi;

import cn.hutool.core.io.resource.ResourceUtil;
import com.discovery.exception.RegistryException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按 key 加载接口实现类，配置文件每行格式为 key=实现类全名
 *
 * @author sakame
 * @version 1.0
 */
@Slf4j
public class SpiLoader {

    /**
     * 存储已加载的类：接口名 => (key => 实现类)
     */
    private static final Map<String, Map<String, Class<?>>> loaderMap = new ConcurrentHashMap<>();

    /**
     * 对象实例缓存
     */
    private static final Map<String, Object> instanceCache = new ConcurrentHashMap<>();

    /**
     * 系统 SPI 目录
     */
    private static final String SYSTEM_SPI_DIR = "META-INF/registry/system/";

    /**
     * 自定义 SPI 目录，同名 key 覆盖系统实现
     */
    private static final String CUSTOM_SPI_DIR = "META-INF/registry/custom/";

    /**
     * 扫描目录
     */
    private static final String[] SCAN_DIRS = new String[]{SYSTEM_SPI_DIR, CUSTOM_SPI_DIR};

    /**
     * 加载单个接口
     * @param loadClass
     * @return
     */
    public static Map<String, Class<?>> load(Class<?> loadClass) {
        log.info("load SPI of type {}", loadClass.getName());
        Map<String, Class<?>> keyClassMap = new HashMap<>();
        for (String scanDir : SCAN_DIRS) {
            List<URL> resources = ResourceUtil.getResources(scanDir + loadClass.getName());
            for (URL resource : resources) {
                try (BufferedReader bufferedReader = new BufferedReader(
                        new InputStreamReader(resource.openStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = bufferedReader.readLine()) != null) {
                        String[] strArray = line.trim().split("=");
                        if (strArray.length > 1) {
                            keyClassMap.put(strArray[0].trim(), Class.forName(strArray[1].trim()));
                        }
                    }
                } catch (Exception e) {
                    log.error("spi resource load error: {}", resource, e);
                }
            }
        }
        loaderMap.put(loadClass.getName(), keyClassMap);
        return keyClassMap;
    }

    /**
     * 获取接口类对应的 key 实现类实例
     * @param tClass
     * @param key
     * @return
     * @param <T>
     */
    @SuppressWarnings("unchecked")
    public static <T> T getInstance(Class<?> tClass, String key) {
        String tClassName = tClass.getName();
        Map<String, Class<?>> keyClassMap = loaderMap.get(tClassName);
        if (keyClassMap == null) {
            throw new RegistryException(String.format("SpiLoader did not load type %s", tClassName));
        }
        if (!keyClassMap.containsKey(key)) {
            throw new RegistryException(String.format("SpiLoader has no %s for key '%s'", tClassName, key));
        }
        Class<?> implClass = keyClassMap.get(key);
        String implClassName = implClass.getName();
        return (T) instanceCache.computeIfAbsent(implClassName, name -> {
            try {
                return implClass.getDeclaredConstructor().newInstance();
            } catch (Exception e) {
                throw new RegistryException(String.format("fail to instantiate class %s", name), e);
            }
        });
    }

}
