package br.com.analytics.pipeline.order_analytics_batch.aggregator;

import br.com.analytics.pipeline.order_analytics_batch.model.Review;
import br.com.analytics.pipeline.order_analytics_batch.model.ReviewSummary;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

public class ReviewAggregator implements EntityAggregator<Review, ReviewSummary> {

    static final int SCORE_SCALE = 4;

    @Override
    public Accumulation<Review, ReviewSummary> start() {
        return new ReviewAccumulation();
    }

    @Override
    public String entityName() {
        return "reviews";
    }

    private static class ReviewAccumulation implements Accumulation<Review, ReviewSummary> {

        private final Map<String, Aggregation> aggregates = new HashMap<>();

        @Override
        public void add(Review review) {
            if (review.orderId() == null) {
                return;
            }
            aggregates.computeIfAbsent(review.orderId(), k -> new Aggregation()).add(review);
        }

        @Override
        public Map<String, ReviewSummary> finish() {
            return aggregates.entrySet().stream()
                    .collect(Collectors.toMap(
                            Map.Entry::getKey,
                            entry -> new ReviewSummary(entry.getKey(), entry.getValue().average())));
        }
    }

    private static class Aggregation {
        long scoreSum = 0;
        long scoreCount = 0;

        void add(Review review) {
            if (review.reviewScore() != null) {
                scoreSum += review.reviewScore();
                scoreCount++;
            }
        }

        // null scores are skipped; a group with only null scores has no average
        @Nullable BigDecimal average() {
            if (scoreCount == 0) {
                return null;
            }
            return BigDecimal.valueOf(scoreSum)
                    .divide(BigDecimal.valueOf(scoreCount), SCORE_SCALE, RoundingMode.HALF_UP);
        }
    }
}
