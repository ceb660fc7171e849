package br.com.analytics.pipeline.order_analytics_batch.pipeline;

import br.com.analytics.pipeline.order_analytics_batch.model.AggregateSnapshot;
import br.com.analytics.pipeline.order_analytics_batch.model.ComposedOrder;
import br.com.analytics.pipeline.order_analytics_batch.model.Customer;
import br.com.analytics.pipeline.order_analytics_batch.model.ItemSummary;
import br.com.analytics.pipeline.order_analytics_batch.model.Order;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderCustomerRow;
import br.com.analytics.pipeline.order_analytics_batch.model.PaymentSummary;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class OrderComposerTest {

    private final OrderComposer composer = new OrderComposer();

    @Test
    void ordersWithoutCustomerAreExcludedFromTheBase() {
        List<OrderCustomerRow> base = composer.baseRelation(
                List.of(order("O1", "C1"), order("O2", "C404"), order("O3", "C1")),
                List.of(customer("C1"), customer("C2")));

        assertThat(base).extracting(row -> row.order().orderId()).containsExactly("O1", "O3");
        assertThat(base).allSatisfy(row -> assertThat(row.customer().customerId()).isEqualTo("C1"));
    }

    @Test
    void matchesSummariesByOrderIdAndLeavesMissingOnesAbsent() {
        PaymentSummary payments = new PaymentSummary("O1", new BigDecimal("40.00"), new TreeSet<>(List.of("voucher")));
        ItemSummary items = new ItemSummary("O2", new BigDecimal("10.00"), BigDecimal.ONE);
        AggregateSnapshot aggregates = new AggregateSnapshot(Map.of("O1", payments), Map.of("O2", items), Map.of());

        ComposedOrder composed = composer.compose(new OrderCustomerRow(order("O1", "C1"), customer("C1")), aggregates);

        assertThat(composed.payments()).isEqualTo(payments);
        assertThat(composed.items()).isNull();
        assertThat(composed.reviews()).isNull();
    }

    private static Order order(String orderId, String customerId) {
        return new Order(orderId, customerId, "delivered", null, null, null);
    }

    private static Customer customer(String customerId) {
        return new Customer(customerId, "U-" + customerId, "curitiba", "PR");
    }
}
