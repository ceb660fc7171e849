package br.com.analytics.pipeline.order_analytics_batch.aggregator;

import br.com.analytics.pipeline.order_analytics_batch.model.ItemSummary;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderItem;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

public class ItemAggregator implements EntityAggregator<OrderItem, ItemSummary> {

    @Override
    public Accumulation<OrderItem, ItemSummary> start() {
        return new ItemAccumulation();
    }

    @Override
    public String entityName() {
        return "items";
    }

    private static class ItemAccumulation implements Accumulation<OrderItem, ItemSummary> {

        private final Map<String, Aggregation> aggregates = new HashMap<>();

        @Override
        public void add(OrderItem item) {
            if (item.orderId() == null) {
                return;
            }
            aggregates.computeIfAbsent(item.orderId(), k -> new Aggregation()).add(item);
        }

        @Override
        public Map<String, ItemSummary> finish() {
            return aggregates.entrySet().stream()
                    .collect(Collectors.toMap(
                            Map.Entry::getKey,
                            entry -> new ItemSummary(
                                    entry.getKey(),
                                    entry.getValue().productValue,
                                    entry.getValue().freightValue)));
        }
    }

    private static class Aggregation {
        BigDecimal productValue = BigDecimal.ZERO;
        BigDecimal freightValue = BigDecimal.ZERO;

        void add(OrderItem item) {
            if (item.price() != null) {
                productValue = productValue.add(item.price());
            }
            if (item.freightValue() != null) {
                freightValue = freightValue.add(item.freightValue());
            }
        }
    }
}
