package br.com.analytics.pipeline.order_analytics_batch.aggregator;

import java.util.Map;

// One grouping pass: rows are added one at a time, finish() yields at most one summary per order id.
public interface Accumulation<T, S> {

    void add(T row);

    Map<String, S> finish();
}
