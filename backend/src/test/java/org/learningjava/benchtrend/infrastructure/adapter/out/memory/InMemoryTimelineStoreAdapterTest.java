package org.learningjava.benchtrend.infrastructure.adapter.out.memory;

import org.junit.jupiter.api.Test;
import org.learningjava.benchtrend.domain.model.stats.SummaryStatistics;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTimelineStoreAdapterTest {

    @Test
    void recordTimeline_replacesPreviousEntryOfSameKey() {
        var store = new InMemoryTimelineStoreAdapter();

        store.recordTimeline(1, 1, 1, new SummaryStatistics(1, 1, 0, 1, 1, 1, 1, 1));
        store.recordTimeline(1, 1, 1, new SummaryStatistics(2, 2, 0, 2, 2, 1, 2, 2));

        assertEquals(1, store.size());
        assertEquals(2.0, store.findTimeline(1, 1).get(0).stats().median(), 1e-9);
    }
}
