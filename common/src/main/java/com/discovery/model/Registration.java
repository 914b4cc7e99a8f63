package com.discovery.model;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 服务注册信息，一个存活的服务实例
 * <p>
 * 注册中心只整体替换，不会原地修改已保存的注册信息
 *
 * @author sakame
 * @version 1.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Registration {

    /**
     * 服务名称，依赖关系按名称匹配
     */
    @SerializedName(value = "ServiceName", alternate = {"serviceName"})
    private String serviceName;

    /**
     * 服务地址，同时作为注册中心中的唯一键
     */
    @SerializedName(value = "ServiceUrl", alternate = {"serviceUrl"})
    private String serviceUrl;

    /**
     * 依赖的服务名称
     */
    @Builder.Default
    @SerializedName(value = "RequiredServices", alternate = {"requiredServices"})
    private List<String> requiredServices = new ArrayList<>();

    /**
     * 接收 patch 推送的地址
     */
    @SerializedName(value = "ServiceUpdateUrl", alternate = {"serviceUpdateUrl"})
    private String serviceUpdateUrl;

    /**
     * 心跳检测地址
     */
    @SerializedName(value = "HeartbeatUrl", alternate = {"heartbeatUrl"})
    private String heartbeatUrl;

    /**
     * 依赖列表，json 中缺省时为空列表
     *
     * @return
     */
    public List<String> getRequiredServices() {
        return requiredServices == null ? new ArrayList<>() : requiredServices;
    }

    /**
     * 是否依赖某个服务
     *
     * @param name
     * @return
     */
    public boolean requires(String name) {
        return getRequiredServices().contains(name);
    }

    /**
     * 转为 patch 条目
     *
     * @return
     */
    public PatchEntry toEntry() {
        return new PatchEntry(serviceName, serviceUrl);
    }
}
