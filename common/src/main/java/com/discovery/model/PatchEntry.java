package com.discovery.model;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * patch 条目，描述一个服务实例的名称和地址
 *
 * @author sakame
 * @version 1.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PatchEntry {

    @SerializedName(value = "Name", alternate = {"name"})
    private String name;

    @SerializedName(value = "Url", alternate = {"url"})
    private String url;

}
