package br.com.analytics.pipeline.order_analytics_batch.pipeline;

import br.com.analytics.pipeline.order_analytics_batch.model.DeliveryKpis;
import br.com.analytics.pipeline.order_analytics_batch.model.DeliveryStatus;
import br.com.analytics.pipeline.order_analytics_batch.model.Order;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryKpiCalculatorTest {

    private final DeliveryKpiCalculator calculator = new DeliveryKpiCalculator();

    @Test
    void lateDeliveryIsDelayed() {
        DeliveryKpis kpis = calculator.calculate(order(
                LocalDateTime.of(2024, 1, 1, 10, 15),
                LocalDateTime.of(2024, 1, 8, 0, 0),
                LocalDateTime.of(2024, 1, 10, 14, 30)));

        assertThat(kpis.deliveryLeadTimeDays()).isEqualTo(9L);
        assertThat(kpis.promisedLeadTimeDays()).isEqualTo(7L);
        assertThat(kpis.deliveryStatus()).isEqualTo(DeliveryStatus.DELAYED);
        assertThat(kpis.deliveryStatus().label()).isEqualTo("Delayed");
    }

    @Test
    void leadTimeCountsCalendarDaysNotElapsedHours() {
        DeliveryKpis kpis = calculator.calculate(order(
                LocalDateTime.of(2024, 6, 1, 23, 50),
                LocalDateTime.of(2024, 6, 10, 0, 0),
                LocalDateTime.of(2024, 6, 2, 0, 10)));

        assertThat(kpis.deliveryLeadTimeDays()).isEqualTo(1L);
    }

    @Test
    void deliveryAtTheEstimateIsOnTime() {
        LocalDateTime estimate = LocalDateTime.of(2024, 3, 20, 0, 0);
        DeliveryKpis kpis = calculator.calculate(order(LocalDateTime.of(2024, 3, 1, 9, 0), estimate, estimate));

        assertThat(kpis.deliveryStatus()).isEqualTo(DeliveryStatus.ON_TIME);
        assertThat(kpis.deliveryStatus().label()).isEqualTo("On Time");
    }

    @Test
    void laterTimeOnTheEstimatedDayIsDelayed() {
        DeliveryKpis kpis = calculator.calculate(order(
                LocalDateTime.of(2024, 3, 1, 9, 0),
                LocalDateTime.of(2024, 3, 20, 0, 0),
                LocalDateTime.of(2024, 3, 20, 8, 0)));

        assertThat(kpis.deliveryLeadTimeDays()).isEqualTo(19L);
        assertThat(kpis.promisedLeadTimeDays()).isEqualTo(19L);
        assertThat(kpis.deliveryStatus()).isEqualTo(DeliveryStatus.DELAYED);
    }

    @Test
    void missingTimestampsLeaveLeadTimesAbsent() {
        DeliveryKpis kpis = calculator.calculate(order(LocalDateTime.of(2024, 3, 1, 9, 0), null, null));

        assertThat(kpis.deliveryLeadTimeDays()).isNull();
        assertThat(kpis.promisedLeadTimeDays()).isNull();
        assertThat(kpis.deliveryStatus()).isEqualTo(DeliveryStatus.ON_TIME);
    }

    private static Order order(LocalDateTime purchase, LocalDateTime estimated, LocalDateTime delivered) {
        return new Order("O1", "C1", "delivered", purchase, estimated, delivered);
    }
}
