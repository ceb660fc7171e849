package br.com.analytics.pipeline.order_analytics_batch.aggregator;

import java.util.Map;

public interface EntityAggregator<T, S> {

    Accumulation<T, S> start();

    String entityName();

    default Map<String, S> aggregate(Iterable<? extends T> rows) {
        Accumulation<T, S> accumulation = start();
        for (T row : rows) {
            accumulation.add(row);
        }
        return accumulation.finish();
    }
}
