package com.blogpulse.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 实时事件流记录。
 *
 * <p>写入事件流时序列化为 JSON 放在字段 {@code event} 中；{@code timestamp} 为入流时间（毫秒），
 * {@code id} 为存储生成的记录 ID，仅在读取时填充。</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreamEvent {
    @JsonIgnore
    private String id;
    private String itemId;
    private StreamEventType type;
    private Map<String, Object> data = new LinkedHashMap<>();
    private long timestamp;

    public static StreamEvent of(String itemId, StreamEventType type, Map<String, Object> data) {
        return new StreamEvent(null, itemId, type, data == null ? new LinkedHashMap<>() : data, 0L);
    }
}
