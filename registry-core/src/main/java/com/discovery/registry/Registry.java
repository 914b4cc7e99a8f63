package com.discovery.registry;

import com.discovery.model.Registration;

import java.util.List;

/**
 * 注册中心
 * @author sakame
 * @version 1.0
 */
public interface Registry {

    /**
     * 服务注册，注册成功后向新服务补发它依赖的已有服务，并通知依赖它的服务
     * @param registration
     * @throws com.discovery.exception.ValidationException 注册信息不完整
     * @throws com.discovery.exception.DeliveryException 补发失败，注册已回滚
     */
    void register(Registration registration);

    /**
     * 注销服务，地址不存在时什么也不做
     * @param serviceUrl
     */
    void unRegister(String serviceUrl);

    /**
     * 仅当该地址当前保存的仍是这个注册信息对象时才注销
     * @param registration
     * @return 是否注销
     */
    boolean unRegisterIfCurrent(Registration registration);

    /**
     * 仅当该地址当前没有注册信息时才注册，用于心跳恢复
     * @param registration
     * @return 是否注册
     * @throws com.discovery.exception.DeliveryException 补发失败，注册已回滚
     */
    boolean registerIfAbsent(Registration registration);

    /**
     * 当前所有注册信息的只读拷贝
     * @return
     */
    List<Registration> snapshot();

    /**
     * 服务销毁
     */
    void destroy();

}
