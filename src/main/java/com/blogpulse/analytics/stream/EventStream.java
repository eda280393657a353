package com.blogpulse.analytics.stream;

import com.blogpulse.analytics.model.StreamEvent;
import com.blogpulse.analytics.schema.AnalyticsKeys;
import com.blogpulse.config.AnalyticsProperties;
import com.blogpulse.exception.AnalyticsException;
import com.blogpulse.exception.ErrorCode;
import com.blogpulse.store.AnalyticsStore;
import com.blogpulse.store.StoreBatch;
import com.blogpulse.store.StreamEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 实时事件流：全局追加日志，按近似长度裁剪（XADD MAXLEN ~）。
 *
 * <p>职责：</p>
 * - 为事件打上入流时间戳并序列化为 JSON，写入字段 {@code event}；
 * - 支持单独追加或并入埋点批次；
 * - 为下游消费者读取最近的事件。
 * <p>
 * 投递语义为至多一次，不保证送达。
 */
@Slf4j
@Component
public class EventStream {

    public static final String FIELD = "event";

    private final AnalyticsStore store;
    private final ObjectMapper objectMapper;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public EventStream(AnalyticsStore store, ObjectMapper objectMapper, AnalyticsProperties properties, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 追加一条事件。
     * @return 存储生成的记录 ID
     */
    public String append(StreamEvent event) {
        return store.appendToStream(AnalyticsKeys.EVENT_STREAM, encode(event), properties.getStream().getMaxLen());
    }

    public void appendTo(StoreBatch batch, StreamEvent event) {
        batch.appendToStream(AnalyticsKeys.EVENT_STREAM, encode(event), properties.getStream().getMaxLen());
    }

    /**
     * 最近的 limit 条事件，新到旧。无法解析的记录跳过。
     */
    public List<StreamEvent> recent(int limit) {
        List<StreamEntry> entries = store.reverseStream(AnalyticsKeys.EVENT_STREAM, limit);
        List<StreamEvent> out = new ArrayList<>(entries.size());
        for (StreamEntry entry : entries) {
            String json = entry.fields().get(FIELD);
            if (json == null) {
                continue;
            }
            try {
                StreamEvent event = objectMapper.readValue(json, StreamEvent.class);
                event.setId(entry.id());
                out.add(event);
            } catch (JsonProcessingException e) {
                log.warn("Skip unreadable stream record {}: {}", entry.id(), e.getOriginalMessage());
            }
        }
        return out;
    }

    public long length() {
        return store.streamLength(AnalyticsKeys.EVENT_STREAM);
    }

    private Map<String, String> encode(StreamEvent event) {
        StreamEvent stamped = new StreamEvent(null, event.getItemId(), event.getType(), event.getData(), clock.millis());
        try {
            return Map.of(FIELD, objectMapper.writeValueAsString(stamped));
        } catch (JsonProcessingException e) {
            throw new AnalyticsException(ErrorCode.SERIALIZATION_FAILED,
                    "Serialize stream event failed, item " + event.getItemId(), e);
        }
    }
}
