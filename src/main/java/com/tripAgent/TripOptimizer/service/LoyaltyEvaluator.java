package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.config.OptimizerProperties;
import com.tripAgent.TripOptimizer.model.LoyaltyEvaluation;
import com.tripAgent.TripOptimizer.model.LoyaltyRecommendation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Cash versus points decision for a single price. Stateless apart from the savings threshold.
 */
@Component
public class LoyaltyEvaluator {

    private static final int VALUE_PER_POINT_SCALE = 6;

    private final BigDecimal savingsThreshold;

    @Autowired
    public LoyaltyEvaluator(OptimizerProperties properties) {
        this(properties.getLoyaltySavingsThreshold());
    }

    public LoyaltyEvaluator(double savingsThreshold) {
        if (savingsThreshold <= 0) {
            throw new IllegalArgumentException("Savings threshold must be positive, got " + savingsThreshold);
        }
        this.savingsThreshold = BigDecimal.valueOf(savingsThreshold);
    }

    /**
     * @param cashPrice      price when paying cash
     * @param pointsRequired points needed to pay the same price
     * @param pointValue     cash value of one point
     * @param programCode    program the points belong to
     * @param pointsBalance  points the traveler holds
     */
    public LoyaltyEvaluation evaluate(double cashPrice, long pointsRequired, double pointValue,
                                      String programCode, long pointsBalance) {
        if (cashPrice < 0 || pointsRequired < 0 || pointValue < 0 || pointsBalance < 0) {
            throw new IllegalArgumentException("Loyalty inputs must not be negative");
        }

        LoyaltyEvaluation.LoyaltyEvaluationBuilder result = LoyaltyEvaluation.builder()
                .programCode(programCode)
                .pointsRequired(pointsRequired)
                .pointsBalance(pointsBalance);

        if (pointsRequired > pointsBalance) {
            return result
                    .recommendation(LoyaltyRecommendation.USE_CASH)
                    .pointsCostInCash(0)
                    .savings(0)
                    .effectiveValuePerPoint(pointsRequired > 0 ? 0.0 : null)
                    .comment(String.format("Insufficient points: %d required, %d available",
                            pointsRequired, pointsBalance))
                    .build();
        }

        BigDecimal pointsCost = BigDecimal.valueOf(pointValue).multiply(BigDecimal.valueOf(pointsRequired));
        BigDecimal savings = BigDecimal.valueOf(cashPrice).subtract(pointsCost);

        LoyaltyRecommendation recommendation;
        if (savings.compareTo(savingsThreshold) > 0) {
            recommendation = LoyaltyRecommendation.USE_POINTS;
        } else if (savings.compareTo(savingsThreshold.negate()) < 0) {
            recommendation = LoyaltyRecommendation.USE_CASH;
        } else {
            recommendation = LoyaltyRecommendation.EITHER;
        }

        Double valuePerPoint = null;
        if (pointsRequired > 0) {
            valuePerPoint = savings
                    .divide(BigDecimal.valueOf(pointsRequired), VALUE_PER_POINT_SCALE, RoundingMode.HALF_UP)
                    .doubleValue();
        }

        return result
                .recommendation(recommendation)
                .pointsCostInCash(pointsCost.doubleValue())
                .savings(savings.doubleValue())
                .effectiveValuePerPoint(valuePerPoint)
                .comment(comment(recommendation, savings, pointsRequired))
                .build();
    }

    private static String comment(LoyaltyRecommendation recommendation, BigDecimal savings, long pointsRequired) {
        if (pointsRequired == 0) {
            return "No points required; value per point not applicable";
        }
        BigDecimal amount = savings.abs().setScale(2, RoundingMode.HALF_UP);
        switch (recommendation) {
            case USE_POINTS:
                return "Points save " + amount + " over cash";
            case USE_CASH:
                return "Cash is " + amount + " cheaper than redeeming points";
            default:
                return "Cash and points are within " + amount + " of each other";
        }
    }
}
