package br.com.analytics.pipeline.order_analytics_batch.reader;

import br.com.analytics.pipeline.order_analytics_batch.model.Review;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

public class ReviewRowMapper implements RowMapper<Review> {

    @Override
    public Review mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        int score = resultSet.getInt("review_score");
        return new Review(
                resultSet.getString("order_id"),
                resultSet.wasNull() ? null : score
        );
    }
}
