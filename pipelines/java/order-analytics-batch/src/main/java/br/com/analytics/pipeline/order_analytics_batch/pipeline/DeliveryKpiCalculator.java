package br.com.analytics.pipeline.order_analytics_batch.pipeline;

import br.com.analytics.pipeline.order_analytics_batch.model.DeliveryKpis;
import br.com.analytics.pipeline.order_analytics_batch.model.DeliveryStatus;
import br.com.analytics.pipeline.order_analytics_batch.model.Order;
import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Lead times are calendar-day differences: the time of day is dropped from both operands
 * before subtracting, so 23:59 on day 1 to 00:01 on day 2 counts as one day.
 */
public class DeliveryKpiCalculator {

    public DeliveryKpis calculate(Order order) {
        return new DeliveryKpis(
                daysBetween(order.purchaseTimestamp(), order.deliveredCustomerDate()),
                daysBetween(order.purchaseTimestamp(), order.estimatedDeliveryDate()),
                deliveryStatus(order.deliveredCustomerDate(), order.estimatedDeliveryDate()));
    }

    static @Nullable Long daysBetween(@Nullable LocalDateTime from, @Nullable LocalDateTime to) {
        if (from == null || to == null) {
            return null;
        }
        return ChronoUnit.DAYS.between(from.toLocalDate(), to.toLocalDate());
    }

    static DeliveryStatus deliveryStatus(@Nullable LocalDateTime delivered, @Nullable LocalDateTime estimated) {
        if (delivered != null && estimated != null && delivered.isAfter(estimated)) {
            return DeliveryStatus.DELAYED;
        }
        return DeliveryStatus.ON_TIME;
    }
}
