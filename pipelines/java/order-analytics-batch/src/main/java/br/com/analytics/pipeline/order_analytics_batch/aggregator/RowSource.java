package br.com.analytics.pipeline.order_analytics_batch.aggregator;

import java.util.function.Consumer;

@FunctionalInterface
public interface RowSource<T> {

    void forEach(Consumer<? super T> consumer);
}
