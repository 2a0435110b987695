package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.config.OptimizerProperties;
import com.tripAgent.TripOptimizer.model.TravelWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Enumerates start/end date pairs inside a date range, ordered by start date then duration.
 * <p>
 * The returned {@link Iterable} is lazy and can be iterated any number of times; every
 * iteration recomputes the same sequence.
 */
@Component
@RequiredArgsConstructor
public class WindowEnumerator {

    private final OptimizerProperties properties;

    /**
     * Windows capped to {@code optimizer.window-cap}.
     */
    public Iterable<TravelWindow> enumerate(LocalDate rangeStart, LocalDate rangeEnd,
                                            int minDuration, int maxDuration) {
        return enumerate(rangeStart, rangeEnd, minDuration, maxDuration, properties.getWindowCap());
    }

    /**
     * @param limit maximum number of windows; zero or negative means uncapped
     */
    public Iterable<TravelWindow> enumerate(LocalDate rangeStart, LocalDate rangeEnd,
                                            int minDuration, int maxDuration, int limit) {
        return () -> windows(rangeStart, rangeEnd, minDuration, maxDuration, limit).iterator();
    }

    private Stream<TravelWindow> windows(LocalDate rangeStart, LocalDate rangeEnd,
                                         int minDuration, int maxDuration, int limit) {
        long rangeDays = ChronoUnit.DAYS.between(rangeStart, rangeEnd);
        if (minDuration > rangeDays) {
            return Stream.empty();
        }
        int effectiveMax = (int) Math.min(maxDuration, rangeDays);

        Stream<TravelWindow> all = Stream
                .iterate(rangeStart,
                        start -> !start.plusDays(minDuration).isAfter(rangeEnd),
                        start -> start.plusDays(1))
                .flatMap(start -> IntStream.rangeClosed(minDuration, effectiveMax)
                        .filter(duration -> !start.plusDays(duration).isAfter(rangeEnd))
                        .mapToObj(duration -> TravelWindow.of(start, duration)));

        return limit > 0 ? all.limit(limit) : all;
    }
}
