package com.cloudcost.anomaly.repository;

import com.cloudcost.anomaly.model.CostEventDocument;
import com.cloudcost.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCostEventStoreTest {

    private InMemoryCostEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCostEventStore();
    }

    @Test
    void save_sameId_replacesEvent() {
        LocalDate day = LocalDate.of(2024, 1, 5);
        store.save(TestDataFactory.createEventDocument("evt-1", day, "compute", 10.0));
        store.save(TestDataFactory.createEventDocument("evt-1", day, "compute", 25.0));

        assertThat(store.count()).isEqualTo(1);
        assertThat(store.findBetween(day, day)).extracting(CostEventDocument::getCostUsd).containsExactly(25.0);
    }

    @Test
    void findBetween_isInclusiveOnBothEnds() {
        for (int i = 1; i <= 5; i++) {
            store.save(TestDataFactory.createEventDocument("evt-" + i, LocalDate.of(2024, 1, i), "compute", i));
        }

        List<CostEventDocument> found = store.findBetween(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 4));

        assertThat(found).extracting(CostEventDocument::getId)
                .containsExactlyInAnyOrder("evt-2", "evt-3", "evt-4");
    }

    @Test
    void count_emptyStore_isZero() {
        assertThat(store.count()).isZero();
    }
}
