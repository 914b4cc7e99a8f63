package com.discovery.client;

import com.discovery.model.Patch;

/**
 * 注册中心对外发起的 http 调用
 *
 * @author sakame
 * @version 1.0
 */
public interface RegistryClient {

    /**
     * 向服务推送 patch
     *
     * @param patch
     * @param url   服务的 ServiceUpdateUrl
     * @throws com.discovery.exception.DeliveryException 非 2xx 响应或传输失败
     */
    void sendPatch(Patch patch, String url);

    /**
     * 心跳检测
     *
     * @param url 服务的 HeartbeatUrl
     * @return 响应码为 200 时返回 true
     * @throws com.discovery.exception.DeliveryException 传输失败
     */
    boolean checkHealth(String url);
}
