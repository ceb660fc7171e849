package br.com.analytics.pipeline.order_analytics_batch.pipeline;

import br.com.analytics.pipeline.order_analytics_batch.model.AggregateSnapshot;

import java.util.concurrent.atomic.AtomicReference;

public class AggregateStore {

    private final AtomicReference<AggregateSnapshot> current = new AtomicReference<>();

    public void publish(AggregateSnapshot snapshot) {
        current.set(snapshot);
    }

    public AggregateSnapshot current() {
        AggregateSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new IllegalStateException("No aggregates published; the aggregation step must run before composition");
        }
        return snapshot;
    }

    public void clear() {
        current.set(null);
    }
}
