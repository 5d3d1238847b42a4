package com.qualitysentinel.core.events;

import com.qualitysentinel.core.model.DetectionMethodType;
import com.qualitysentinel.core.model.RegressionCategory;
import com.qualitysentinel.core.model.RegressionEvent;
import com.qualitysentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.qualitysentinel.core.events.EventFixtures.T0;
import static com.qualitysentinel.core.events.EventFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;

class EventStoreTest {

    private EventStore store;
    private RegressionEvent early;
    private RegressionEvent middle;
    private RegressionEvent late;

    @BeforeEach
    void setUp() {
        store = new EventStore();
        early = event("checkout", Severity.MINOR, T0);
        middle = event("search", Severity.CRITICAL, T0.plusSeconds(60));
        late = event("checkout", Severity.CRITICAL, T0.plusSeconds(120));
        store.record(middle);
        store.record(late);
        store.record(early);
    }

    @Test
    @DisplayName("Query without filters should return all events newest first")
    void shouldOrderNewestFirst() {
        assertThat(store.all()).containsExactly(late, middle, early);
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Filters should combine")
    void shouldApplyFilters() {
        assertThat(store.query("checkout", null, null)).containsExactly(late, early);
        assertThat(store.query(null, Severity.CRITICAL, null)).containsExactly(late, middle);
        assertThat(store.query("checkout", Severity.CRITICAL, null)).containsExactly(late);
        assertThat(store.query(null, null, T0.plusSeconds(60))).containsExactly(late, middle);
        assertThat(store.query("unknown", null, null)).isEmpty();
    }

    @Test
    @DisplayName("Period lookup should be inclusive and oldest first")
    void shouldSelectPeriodInclusive() {
        List<RegressionEvent> period = store.between(T0, T0.plusSeconds(60));

        assertThat(period).containsExactly(early, middle);
    }

    @Test
    @DisplayName("Should find events by id")
    void shouldGetById() {
        assertThat(store.get(middle.getId())).contains(middle);
        assertThat(store.get("missing")).isEmpty();
        assertThat(store.get(null)).isEmpty();
    }

    @Test
    @DisplayName("Last event should be tracked per component, metric and method")
    void shouldTrackLastEventPerSource() {
        RegressionEvent trend = event("checkout", RegressionCategory.PERFORMANCE, Severity.MAJOR,
                DetectionMethodType.TREND, T0.plusSeconds(300));
        store.record(trend);

        assertThat(store.lastEvent("checkout", "latency_ms", DetectionMethodType.STATISTICAL)).contains(late);
        assertThat(store.lastEvent("checkout", "latency_ms", DetectionMethodType.TREND)).contains(trend);
        assertThat(store.lastEvent("checkout", "latency_ms", DetectionMethodType.ANOMALY)).isEmpty();
    }

    @Test
    @DisplayName("Prune should drop events older than the cutoff")
    void shouldPrune() {
        int removed = store.prune(T0.plusSeconds(60));

        assertThat(removed).isEqualTo(1);
        assertThat(store.all()).containsExactly(late, middle);
        assertThat(store.lastEvent("checkout", "latency_ms", DetectionMethodType.STATISTICAL)).contains(late);
    }
}
