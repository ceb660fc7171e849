package br.com.analytics.pipeline.order_analytics_batch.model;

public enum DeliveryStatus {
    DELAYED("Delayed"),
    ON_TIME("On Time");

    private final String label;

    DeliveryStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
