package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.adapter.CandidateSource;
import com.tripAgent.TripOptimizer.adapter.FlightSource;
import com.tripAgent.TripOptimizer.adapter.HotelSource;
import com.tripAgent.TripOptimizer.config.OptimizerProperties;
import com.tripAgent.TripOptimizer.exception.NoCandidatesAvailableException;
import com.tripAgent.TripOptimizer.exception.SourceUnavailableException;
import com.tripAgent.TripOptimizer.exception.WindowTimeoutException;
import com.tripAgent.TripOptimizer.model.Candidate;
import com.tripAgent.TripOptimizer.model.CandidateBatch;
import com.tripAgent.TripOptimizer.model.CandidateKind;
import com.tripAgent.TripOptimizer.model.FlightCandidate;
import com.tripAgent.TripOptimizer.model.HotelCandidate;
import com.tripAgent.TripOptimizer.model.TravelWindow;
import com.tripAgent.TripOptimizer.model.TripIntent;
import com.tripAgent.TripOptimizer.model.WindowCandidates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a window out to every registered source of a kind and merges what comes back.
 * <p>
 * Each source runs as its own task with its own timeout. Failed or late sources are dropped
 * and reported as degraded; the call only fails when no source of the kind succeeded.
 * Results are merged in registration order regardless of completion order.
 * Late tasks are cancelled with an interrupt so a hanging source gives its thread back.
 */
@Slf4j
@Service
public class CandidateAggregator {

    private final List<FlightSource> flightSources;
    private final List<HotelSource> hotelSources;
    private final ExecutorService executor;
    private final Duration sourceTimeout;
    private final int perSourceLimit;

    @Autowired
    public CandidateAggregator(ObjectProvider<FlightSource> flightSources,
                               ObjectProvider<HotelSource> hotelSources,
                               @Qualifier("sourceExecutor") ExecutorService executor,
                               OptimizerProperties properties) {
        this(flightSources.orderedStream().toList(), hotelSources.orderedStream().toList(), executor, properties);
    }

    public CandidateAggregator(List<FlightSource> flightSources,
                               List<HotelSource> hotelSources,
                               ExecutorService executor,
                               OptimizerProperties properties) {
        this.flightSources = List.copyOf(flightSources);
        this.hotelSources = List.copyOf(hotelSources);
        this.executor = executor;
        this.sourceTimeout = properties.getSourceTimeout();
        this.perSourceLimit = properties.getPerSourceLimit();
        log.info("Registered flight sources {} and hotel sources {}",
                names(this.flightSources), names(this.hotelSources));
    }

    public CandidateBatch<FlightCandidate> fetchFlights(TravelWindow window, TripIntent intent) {
        Deadline deadline = Deadline.start(sourceTimeout, null);
        List<Future<List<FlightCandidate>>> tasks = launch(flightSources, window, intent);
        try {
            return collect(CandidateKind.FLIGHT, flightSources, tasks, deadline, window);
        } finally {
            cancelAll(tasks);
        }
    }

    public CandidateBatch<HotelCandidate> fetchHotels(TravelWindow window, TripIntent intent) {
        Deadline deadline = Deadline.start(sourceTimeout, null);
        List<Future<List<HotelCandidate>>> tasks = launch(hotelSources, window, intent);
        try {
            return collect(CandidateKind.HOTEL, hotelSources, tasks, deadline, window);
        } finally {
            cancelAll(tasks);
        }
    }

    public WindowCandidates fetchWindow(TravelWindow window, TripIntent intent) {
        return fetchWindow(window, intent, null);
    }

    /**
     * Starts the flight and hotel fan-outs together, then joins them. The window timeout,
     * when given, starts with the fan-out and bounds both joins.
     *
     * @throws NoCandidatesAvailableException when every source of either kind failed
     * @throws WindowTimeoutException         when the window timeout elapsed before the sources answered
     */
    public WindowCandidates fetchWindow(TravelWindow window, TripIntent intent, Duration windowTimeout) {
        Deadline deadline = Deadline.start(sourceTimeout, windowTimeout);
        List<Future<List<FlightCandidate>>> flights = launch(flightSources, window, intent);
        List<Future<List<HotelCandidate>>> hotels = launch(hotelSources, window, intent);

        try {
            return new WindowCandidates(window,
                    collect(CandidateKind.FLIGHT, flightSources, flights, deadline, window),
                    collect(CandidateKind.HOTEL, hotelSources, hotels, deadline, window));
        } finally {
            cancelAll(flights);
            cancelAll(hotels);
        }
    }

    private <C extends Candidate> List<Future<List<C>>> launch(
            List<? extends CandidateSource<C>> sources, TravelWindow window, TripIntent intent) {
        List<Future<List<C>>> tasks = new ArrayList<>(sources.size());
        for (CandidateSource<C> source : sources) {
            tasks.add(executor.submit(() -> source.fetch(window, intent)));
        }
        return tasks;
    }

    private <C extends Candidate> CandidateBatch<C> collect(CandidateKind kind,
                                                            List<? extends CandidateSource<C>> sources,
                                                            List<Future<List<C>>> tasks,
                                                            Deadline deadline,
                                                            TravelWindow window) {
        List<C> merged = new ArrayList<>();
        List<String> succeeded = new ArrayList<>();
        List<String> degraded = new ArrayList<>();

        for (int i = 0; i < sources.size(); i++) {
            String name = sources.get(i).getSourceName();
            try {
                List<C> candidates = await(name, tasks.get(i), deadline, window);
                merged.addAll(truncate(name, candidates));
                succeeded.add(name);
            } catch (SourceUnavailableException e) {
                degraded.add(name);
                log.warn("⚠️ Degraded {} source for window {}: {}", kind, window.getStartDate(), e.getMessage());
            }
        }

        if (succeeded.isEmpty()) {
            throw new NoCandidatesAvailableException(kind, String.format(
                    "No %s source succeeded for window %s..%s (degraded: %s)",
                    kind, window.getStartDate(), window.getEndDate(), degraded));
        }

        log.debug("Collected {} {} candidates for window {} from {}", merged.size(), kind,
                window.getStartDate(), succeeded);
        return new CandidateBatch<>(kind, List.copyOf(merged), List.copyOf(succeeded), List.copyOf(degraded));
    }

    private <C> List<C> await(String sourceName, Future<List<C>> task, Deadline deadline, TravelWindow window) {
        try {
            List<C> result = task.get(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
            if (result == null) {
                return List.of();
            }
            return result.stream().filter(Objects::nonNull).toList();
        } catch (TimeoutException e) {
            task.cancel(true);
            if (deadline.isWindowBound()) {
                throw new WindowTimeoutException(String.format("Window %s +%dd timed out after %s waiting for [%s]",
                        window.getStartDate(), window.getDuration(), deadline.windowTimeout, sourceName),
                        deadline.windowTimeout);
            }
            throw new SourceUnavailableException(sourceName, "timed out after " + sourceTimeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SourceUnavailableException(sourceName, "failed: " + cause.getMessage(), cause);
        } catch (CancellationException e) {
            throw new SourceUnavailableException(sourceName, "cancelled", e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(sourceName, "interrupted while waiting", e);
        }
    }

    private <C> List<C> truncate(String sourceName, List<C> candidates) {
        if (candidates.size() <= perSourceLimit) {
            return candidates;
        }
        log.debug("[{}] returned {} candidates, keeping the first {}", sourceName, candidates.size(), perSourceLimit);
        return candidates.subList(0, perSourceLimit);
    }

    private static void cancelAll(List<? extends Future<?>> tasks) {
        tasks.forEach(task -> task.cancel(true));
    }

    private static List<String> names(List<? extends CandidateSource<?>> sources) {
        return sources.stream().map(CandidateSource::getSourceName).toList();
    }

    /**
     * Shared deadline of one fan-out. Every task starts at the same instant, so a common
     * deadline gives each source its own full timeout.
     */
    private static final class Deadline {
        private final long sourceDeadline;
        private final long windowDeadline;
        private final Duration windowTimeout;

        private Deadline(long sourceDeadline, long windowDeadline, Duration windowTimeout) {
            this.sourceDeadline = sourceDeadline;
            this.windowDeadline = windowDeadline;
            this.windowTimeout = windowTimeout;
        }

        static Deadline start(Duration sourceTimeout, Duration windowTimeout) {
            long now = System.nanoTime();
            long window = windowTimeout != null ? now + windowTimeout.toNanos() : Long.MAX_VALUE;
            return new Deadline(now + sourceTimeout.toNanos(), window, windowTimeout);
        }

        long remainingNanos() {
            return Math.min(sourceDeadline, windowDeadline) - System.nanoTime();
        }

        boolean isWindowBound() {
            return windowTimeout != null && windowDeadline - sourceDeadline < 0;
        }
    }
}
