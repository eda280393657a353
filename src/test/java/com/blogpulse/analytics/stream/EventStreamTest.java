package com.blogpulse.analytics.stream;

import com.blogpulse.analytics.model.StreamEvent;
import com.blogpulse.analytics.model.StreamEventType;
import com.blogpulse.analytics.schema.AnalyticsKeys;
import com.blogpulse.store.StreamEntry;
import com.blogpulse.testutil.AnalyticsFixture;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventStreamTest {

    private AnalyticsFixture fx;
    private EventStream stream;

    @BeforeEach
    void setUp() {
        fx = AnalyticsFixture.local();
        stream = fx.eventStream;
    }

    @Test
    void recordIsSingleJsonFieldStampedWithIngestTime() throws Exception {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("url", "https://a.example");
        StreamEvent event = StreamEvent.of("post-1", StreamEventType.LINK, data);
        event.setTimestamp(42L);

        String id = stream.append(event);

        List<StreamEntry> raw = fx.store.reverseStream(AnalyticsKeys.EVENT_STREAM, 1);
        assertThat(raw).hasSize(1);
        assertThat(raw.get(0).id()).isEqualTo(id);
        assertThat(raw.get(0).fields()).containsOnlyKeys(EventStream.FIELD);

        JsonNode json = fx.objectMapper.readTree(raw.get(0).fields().get(EventStream.FIELD));
        assertThat(json.get("itemId").asText()).isEqualTo("post-1");
        assertThat(json.get("type").asText()).isEqualTo("link");
        assertThat(json.get("data").get("url").asText()).isEqualTo("https://a.example");
        assertThat(json.get("timestamp").asLong()).isEqualTo(fx.clock.millis());
        assertThat(json.has("id")).isFalse();
        // 调用方的事件对象不被改写
        assertThat(event.getTimestamp()).isEqualTo(42L);
    }

    @Test
    void recentReturnsNewestFirstWithIds() {
        stream.append(StreamEvent.of("post-1", StreamEventType.VIEW, null));
        fx.clock.advance(Duration.ofMillis(5));
        stream.append(StreamEvent.of("post-2", StreamEventType.READ, null));

        List<StreamEvent> recent = stream.recent(10);
        assertThat(recent).extracting(StreamEvent::getItemId).containsExactly("post-2", "post-1");
        assertThat(recent).allSatisfy(e -> assertThat(e.getId()).isNotBlank());
        assertThat(recent.get(0).getTimestamp()).isEqualTo(fx.clock.millis());
    }

    @Test
    void unreadableRecordsAreSkipped() {
        fx.store.appendToStream(AnalyticsKeys.EVENT_STREAM, Map.of(EventStream.FIELD, "{broken"), 100);
        fx.store.appendToStream(AnalyticsKeys.EVENT_STREAM, Map.of("other", "x"), 100);
        stream.append(StreamEvent.of("post-1", StreamEventType.PROGRESS, null));

        assertThat(stream.recent(10)).extracting(StreamEvent::getType).containsExactly(StreamEventType.PROGRESS);
        assertThat(stream.length()).isEqualTo(3);
    }
}
