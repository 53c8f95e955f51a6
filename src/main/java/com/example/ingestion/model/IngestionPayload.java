package com.example.ingestion.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 文件摄取任务的载荷
 * 
 * <p>以JSON形式持久化在任务表中，键名与历史数据保持一致：
 * {@code selectedFiles}（文件ID列表）和 {@code options}（处理选项）。
 * </p>
 *
 * @param selectedFiles 待处理的文件ID列表
 * @param options 处理选项，可为空
 */
public record IngestionPayload(List<String> selectedFiles, Map<String, Object> options) {

    public static final String SELECTED_FILES = "selectedFiles";
    public static final String OPTIONS = "options";

    public IngestionPayload {
        selectedFiles = selectedFiles == null ? List.of() : List.copyOf(selectedFiles);
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public int fileCount() {
        return selectedFiles.size();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(SELECTED_FILES, new ArrayList<>(selectedFiles));
        map.put(OPTIONS, new LinkedHashMap<>(options));
        return map;
    }

    /**
     * 从持久化的JSON Map还原载荷，缺失或类型不符的字段按空处理
     */
    @SuppressWarnings("unchecked")
    public static IngestionPayload fromMap(Map<String, Object> map) {
        if (map == null) {
            return new IngestionPayload(List.of(), Map.of());
        }
        List<String> files = new ArrayList<>();
        Object rawFiles = map.get(SELECTED_FILES);
        if (rawFiles instanceof Collection<?> collection) {
            for (Object file : collection) {
                if (file != null) {
                    files.add(file.toString());
                }
            }
        }
        Map<String, Object> options = new LinkedHashMap<>();
        Object rawOptions = map.get(OPTIONS);
        if (rawOptions instanceof Map<?, ?> optionMap) {
            options.putAll((Map<String, Object>) optionMap);
        }
        return new IngestionPayload(files, options);
    }
}
