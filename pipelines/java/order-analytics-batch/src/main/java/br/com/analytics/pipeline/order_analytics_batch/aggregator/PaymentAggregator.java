package br.com.analytics.pipeline.order_analytics_batch.aggregator;

import br.com.analytics.pipeline.order_analytics_batch.model.Payment;
import br.com.analytics.pipeline.order_analytics_batch.model.PaymentSummary;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

public class PaymentAggregator implements EntityAggregator<Payment, PaymentSummary> {

    @Override
    public Accumulation<Payment, PaymentSummary> start() {
        return new PaymentAccumulation();
    }

    @Override
    public String entityName() {
        return "payments";
    }

    private static class PaymentAccumulation implements Accumulation<Payment, PaymentSummary> {

        private final Map<String, Aggregation> aggregates = new HashMap<>();

        @Override
        public void add(Payment payment) {
            if (payment.orderId() == null) {
                return;
            }
            aggregates.computeIfAbsent(payment.orderId(), k -> new Aggregation()).add(payment);
        }

        @Override
        public Map<String, PaymentSummary> finish() {
            return aggregates.entrySet().stream()
                    .collect(Collectors.toMap(
                            Map.Entry::getKey,
                            entry -> new PaymentSummary(
                                    entry.getKey(),
                                    entry.getValue().totalValue,
                                    Collections.unmodifiableSortedSet(entry.getValue().methods))));
        }
    }

    private static class Aggregation {
        BigDecimal totalValue = BigDecimal.ZERO;
        TreeSet<String> methods = new TreeSet<>();

        void add(Payment payment) {
            if (payment.paymentValue() != null) {
                totalValue = totalValue.add(payment.paymentValue());
            }
            if (payment.paymentType() != null) {
                methods.add(payment.paymentType());
            }
        }
    }
}
