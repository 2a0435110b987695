package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.exception.UnknownLoyaltyProgramException;
import com.tripAgent.TripOptimizer.model.LoyaltyEvaluation;
import com.tripAgent.TripOptimizer.model.LoyaltyProgram;
import com.tripAgent.TripOptimizer.model.TripPackage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Loyalty lookups for the optimizer and for standalone cash-vs-points queries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoyaltyService {

    private final LoyaltyProgramRegistry registry;
    private final LoyaltyEvaluator evaluator;

    public LoyaltyEvaluation evaluateLoyalty(double cashPrice, long pointsPrice, String programCode, long pointsBalance) {
        LoyaltyProgram program = registry.find(programCode)
                .orElseThrow(() -> new UnknownLoyaltyProgramException(programCode));
        return evaluator.evaluate(cashPrice, pointsPrice, program.getPointValue(), program.getCode(), pointsBalance);
    }

    public List<LoyaltyProgram> listPrograms() {
        return registry.listPrograms();
    }

    /**
     * Evaluates the package against every held balance and keeps the evaluation with the
     * largest savings. Ties go to the alphabetically first program code.
     */
    public Optional<LoyaltyEvaluation> bestEvaluation(TripPackage tripPackage, Map<String, Long> balances) {
        if (balances == null || balances.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Long> ordered = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        ordered.putAll(balances);

        LoyaltyEvaluation best = null;
        for (Map.Entry<String, Long> entry : ordered.entrySet()) {
            Optional<LoyaltyProgram> program = registry.find(entry.getKey());
            if (program.isEmpty()) {
                log.warn("Skipping unknown loyalty program {}", entry.getKey());
                continue;
            }
            LoyaltyEvaluation evaluation = evaluator.evaluate(
                    tripPackage.getTotalCost(),
                    pointsRequired(tripPackage.getTotalCost(), program.get()),
                    program.get().getPointValue(),
                    program.get().getCode(),
                    entry.getValue());
            if (best == null || evaluation.getSavings() > best.getSavings()) {
                best = evaluation;
            }
        }
        return Optional.ofNullable(best);
    }

    static long pointsRequired(double cashPrice, LoyaltyProgram program) {
        return BigDecimal.valueOf(cashPrice)
                .multiply(BigDecimal.valueOf(program.getConversionRate()))
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
    }
}
