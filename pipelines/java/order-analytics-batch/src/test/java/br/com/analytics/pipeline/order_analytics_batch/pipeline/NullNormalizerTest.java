package br.com.analytics.pipeline.order_analytics_batch.pipeline;

import br.com.analytics.pipeline.order_analytics_batch.model.ComposedOrder;
import br.com.analytics.pipeline.order_analytics_batch.model.Customer;
import br.com.analytics.pipeline.order_analytics_batch.model.DeliveryKpis;
import br.com.analytics.pipeline.order_analytics_batch.model.DeliveryStatus;
import br.com.analytics.pipeline.order_analytics_batch.model.Order;
import br.com.analytics.pipeline.order_analytics_batch.model.OrderAnalyticsRecord;
import br.com.analytics.pipeline.order_analytics_batch.model.PaymentSummary;
import br.com.analytics.pipeline.order_analytics_batch.model.ReviewSummary;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class NullNormalizerTest {

    private static final Order ORDER = new Order("O1", "C1", "delivered", null, null, null);
    private static final Customer CUSTOMER = new Customer("C1", "U1", "recife", "PE");
    private static final DeliveryKpis KPIS = new DeliveryKpis(3L, 5L, DeliveryStatus.ON_TIME);

    @Test
    void missingMonetaryTotalsBecomeZeroButReviewStaysAbsent() {
        OrderAnalyticsRecord normalized = new NullNormalizer()
                .normalize(new ComposedOrder(ORDER, CUSTOMER, null, null, null), "Northeast", KPIS);

        assertThat(normalized.totalPaymentValue()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(normalized.totalProductValue()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(normalized.totalFreightValue()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(normalized.paymentMethods()).isNull();
        assertThat(normalized.reviewScore()).isNull();
    }

    @Test
    void presentValuesPassThrough() {
        PaymentSummary payments = new PaymentSummary("O1", new BigDecimal("40.00"),
                new TreeSet<>(List.of("voucher", "credit_card")));
        ReviewSummary reviews = new ReviewSummary("O1", new BigDecimal("4.5000"));

        OrderAnalyticsRecord normalized = new NullNormalizer()
                .normalize(new ComposedOrder(ORDER, CUSTOMER, payments, null, reviews), "Northeast", KPIS);

        assertThat(normalized.totalPaymentValue()).isEqualByComparingTo("40.00");
        assertThat(normalized.paymentMethods()).isEqualTo("credit_card, voucher");
        assertThat(normalized.reviewScore()).isEqualByComparingTo("4.5");
        assertThat(normalized.region()).isEqualTo("Northeast");
        assertThat(normalized.deliveryStatus()).isEqualTo("On Time");
        assertThat(normalized.customerUniqueId()).isEqualTo("U1");
    }

    @Test
    void usesConfiguredSeparator() {
        PaymentSummary payments = new PaymentSummary("O1", BigDecimal.TEN, new TreeSet<>(List.of("boleto", "voucher")));

        OrderAnalyticsRecord normalized = new NullNormalizer("|")
                .normalize(new ComposedOrder(ORDER, CUSTOMER, payments, null, null), "Northeast", KPIS);

        assertThat(normalized.paymentMethods()).isEqualTo("boleto|voucher");
    }
}
