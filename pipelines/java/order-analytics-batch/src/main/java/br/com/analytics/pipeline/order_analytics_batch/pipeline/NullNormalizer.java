package br.com.analytics.pipeline.order_analytics_batch.pipeline;

import br.com.analytics.pipeline.order_analytics_batch.model.ComposedOrder;
import br.com.analytics.pipeline.order_analytics_batch.model.Customer;
import br.com.analytics.pipeline.order_analytics_batch.model.DeliveryKpis;
import br.com.analytics.pipeline.order_analytics_batch.model.ItemSummary;
import br.com.analytics.pipeline.order_analytics_batch.model.Order;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderAnalyticsRecord;
import br.com.analytics.pipeline.order_analytics_batch.model.PaymentSummary;
import br.com.analytics.pipeline.order_analytics_batch.model.ReviewSummary;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

/**
 * Builds the output record from a composed order. Missing monetary totals become zero;
 * a missing review score stays null, since no review is not the same as a score of zero.
 */
public class NullNormalizer {

    public static final String DEFAULT_METHOD_SEPARATOR = ", ";

    private final String methodSeparator;

    public NullNormalizer() {
        this(DEFAULT_METHOD_SEPARATOR);
    }

    public NullNormalizer(String methodSeparator) {
        this.methodSeparator = methodSeparator;
    }

    public OrderAnalyticsRecord normalize(ComposedOrder composed, String region, DeliveryKpis kpis) {
        Order order = composed.order();
        Customer customer = composed.customer();
        PaymentSummary payments = composed.payments();
        ItemSummary items = composed.items();
        ReviewSummary reviews = composed.reviews();

        return new OrderAnalyticsRecord(
                order.orderId(),
                customer.customerUniqueId(),
                order.orderStatus(),
                customer.customerCity(),
                customer.customerState(),
                region,
                order.purchaseTimestamp(),
                order.deliveredCustomerDate(),
                order.estimatedDeliveryDate(),
                kpis.deliveryLeadTimeDays(),
                kpis.promisedLeadTimeDays(),
                kpis.deliveryStatus().label(),
                orZero(payments == null ? null : payments.totalPaymentValue()),
                orZero(items == null ? null : items.totalProductValue()),
                orZero(items == null ? null : items.totalFreightValue()),
                renderMethods(payments),
                reviews == null ? null : reviews.averageScore());
    }

    static BigDecimal orZero(@Nullable BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private @Nullable String renderMethods(@Nullable PaymentSummary payments) {
        if (payments == null || payments.paymentMethods().isEmpty()) {
            return null;
        }
        return String.join(methodSeparator, payments.paymentMethods());
    }
}
