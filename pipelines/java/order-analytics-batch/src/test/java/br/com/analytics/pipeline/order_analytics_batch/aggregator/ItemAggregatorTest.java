package br.com.analytics.pipeline.order_analytics_batch.aggregator;

import br.com.analytics.pipeline.order_analytics_batch.model.ItemSummary;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderItem;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ItemAggregatorTest {

    private final ItemAggregator aggregator = new ItemAggregator();

    @Test
    void sumsPriceAndFreightPerOrder() {
        Map<String, ItemSummary> summaries = aggregator.aggregate(List.of(
                new OrderItem("A6", new BigDecimal("12.00"), new BigDecimal("3.00")),
                new OrderItem("A6", new BigDecimal("18.00"), new BigDecimal("3.00")),
                new OrderItem("A6", new BigDecimal("10.00"), new BigDecimal("4.00")),
                new OrderItem("A1", new BigDecimal("35.00"), new BigDecimal("5.00"))
        ));

        assertThat(summaries).hasSize(2);
        assertThat(summaries.get("A6").totalProductValue()).isEqualByComparingTo("40.00");
        assertThat(summaries.get("A6").totalFreightValue()).isEqualByComparingTo("10.00");
        assertThat(summaries.get("A1").totalProductValue()).isEqualByComparingTo("35.00");
    }

    @Test
    void nullFreightContributesNothing() {
        Map<String, ItemSummary> summaries = aggregator.aggregate(List.of(
                new OrderItem("A1", new BigDecimal("9.90"), null)));

        assertThat(summaries.get("A1").totalFreightValue()).isEqualByComparingTo(BigDecimal.ZERO);
    }
}
