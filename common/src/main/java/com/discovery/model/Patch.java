package com.discovery.model;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 服务变更增量，只包含新增和移除的条目，不是全量快照
 *
 * @author sakame
 * @version 1.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Patch {

    /**
     * 新增的服务
     */
    @SerializedName(value = "Added", alternate = {"added"})
    private List<PatchEntry> added = new ArrayList<>();

    /**
     * 移除的服务
     */
    @SerializedName(value = "Removed", alternate = {"removed"})
    private List<PatchEntry> removed = new ArrayList<>();

    public static Patch added(PatchEntry... entries) {
        return new Patch(new ArrayList<>(Arrays.asList(entries)), new ArrayList<>());
    }

    public static Patch removed(PatchEntry... entries) {
        return new Patch(new ArrayList<>(), new ArrayList<>(Arrays.asList(entries)));
    }

    public List<PatchEntry> getAdded() {
        return added == null ? new ArrayList<>() : added;
    }

    public List<PatchEntry> getRemoved() {
        return removed == null ? new ArrayList<>() : removed;
    }

    public boolean isEmpty() {
        return getAdded().isEmpty() && getRemoved().isEmpty();
    }

    /**
     * 过滤出名称匹配的条目，组成新的 patch
     *
     * @param name 依赖的服务名称
     * @return 子 patch，可能为空
     */
    public Patch filterByName(String name) {
        List<PatchEntry> subAdded = getAdded().stream()
                .filter(entry -> name.equals(entry.getName()))
                .collect(Collectors.toList());
        List<PatchEntry> subRemoved = getRemoved().stream()
                .filter(entry -> name.equals(entry.getName()))
                .collect(Collectors.toList());
        return new Patch(subAdded, subRemoved);
    }
}
