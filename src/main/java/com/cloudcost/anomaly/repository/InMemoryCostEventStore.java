package com.cloudcost.anomaly.repository;

import com.cloudcost.anomaly.model.CostEventDocument;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
@ConditionalOnProperty(prefix = "cost", name = "data-source", havingValue = "mock", matchIfMissing = true)
public class InMemoryCostEventStore implements CostEventStore {

    private final Map<String, CostEventDocument> events = new ConcurrentHashMap<>();

    @Override
    public void save(CostEventDocument event) {
        events.put(event.getId(), event);
    }

    @Override
    public List<CostEventDocument> findBetween(LocalDate from, LocalDate to) {
        return events.values().stream()
                .filter(e -> !e.getDate().isBefore(from) && !e.getDate().isAfter(to))
                .collect(Collectors.toList());
    }

    @Override
    public long count() {
        return events.size();
    }
}
