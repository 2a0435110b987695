package com.tripAgent.TripOptimizer.service;

import com.tripAgent.TripOptimizer.config.OptimizerProperties;
import com.tripAgent.TripOptimizer.exception.NoCandidatesAvailableException;
import com.tripAgent.TripOptimizer.exception.WindowTimeoutException;
import com.tripAgent.TripOptimizer.model.PreferencePriority;
import com.tripAgent.TripOptimizer.model.TravelPreferences;
import com.tripAgent.TripOptimizer.model.TravelWindow;
import com.tripAgent.TripOptimizer.model.TripIntent;
import com.tripAgent.TripOptimizer.model.TripPackage;
import com.tripAgent.TripOptimizer.model.WindowCandidates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Entry point of the engine: intent in, ranked packages out.
 * <p>
 * Windows are processed concurrently on the window pool; everything after the fan-out
 * (assembly, loyalty, scoring, ranking) runs on the calling thread.
 */
@Slf4j
@Service
public class TripOptimizerService {

    private final IntentValidator intentValidator;
    private final WindowEnumerator windowEnumerator;
    private final CandidateAggregator candidateAggregator;
    private final PackageAssembler packageAssembler;
    private final LoyaltyService loyaltyService;
    private final PackageScorer packageScorer;
    private final PackageRanker packageRanker;
    private final ExecutorService windowExecutor;
    private final Duration windowTimeout;

    public TripOptimizerService(IntentValidator intentValidator,
                                WindowEnumerator windowEnumerator,
                                CandidateAggregator candidateAggregator,
                                PackageAssembler packageAssembler,
                                LoyaltyService loyaltyService,
                                PackageScorer packageScorer,
                                PackageRanker packageRanker,
                                @Qualifier("windowExecutor") ExecutorService windowExecutor,
                                OptimizerProperties properties) {
        this.intentValidator = intentValidator;
        this.windowEnumerator = windowEnumerator;
        this.candidateAggregator = candidateAggregator;
        this.packageAssembler = packageAssembler;
        this.loyaltyService = loyaltyService;
        this.packageScorer = packageScorer;
        this.packageRanker = packageRanker;
        this.windowExecutor = windowExecutor;
        this.windowTimeout = properties.getWindowTimeout();
    }

    /**
     * @throws com.tripAgent.TripOptimizer.exception.InvalidIntentException before any source is called
     * @throws NoCandidatesAvailableException when no window produced a single package
     */
    public List<TripPackage> optimize(TripIntent intent) {
        intentValidator.validate(intent);
        TravelPreferences preferences = intent.getPreferences();

        List<TravelWindow> windows = new ArrayList<>();
        windowEnumerator.enumerate(intent.getStartDate(), intent.getEndDate(),
                preferences.getMinDuration(), preferences.getMaxDuration()).forEach(windows::add);

        log.info("✈️ Optimizing trip to {} ({} .. {}, {} travelers) over {} windows",
                intent.getDestination(), intent.getStartDate(), intent.getEndDate(),
                intent.getTravelers(), windows.size());

        if (windows.isEmpty()) {
            throw new NoCandidatesAvailableException(String.format(
                    "No window of %d-%d days fits between %s and %s",
                    preferences.getMinDuration(), preferences.getMaxDuration(),
                    intent.getStartDate(), intent.getEndDate()));
        }

        // the window timeout is applied inside each task, so queueing on the pool does not count
        List<CompletableFuture<List<TripPackage>>> futures = new ArrayList<>(windows.size());
        for (TravelWindow window : windows) {
            futures.add(CompletableFuture.supplyAsync(() -> packagesFor(window, intent), windowExecutor));
        }

        List<TripPackage> packages = new ArrayList<>();
        for (int i = 0; i < windows.size(); i++) {
            packages.addAll(awaitWindow(windows.get(i), futures.get(i)));
        }

        if (packages.isEmpty()) {
            throw new NoCandidatesAvailableException(String.format(
                    "No trip package could be assembled for %s in any of %d windows",
                    intent.getDestination(), windows.size()));
        }

        PreferencePriority priority = PreferencePriority.resolve(preferences);
        for (TripPackage tripPackage : packages) {
            loyaltyService.bestEvaluation(tripPackage, intent.getLoyaltyBalances())
                    .ifPresent(tripPackage::setLoyaltyEvaluation);
            tripPackage.setTotalScore(packageScorer.score(tripPackage, preferences, priority));
        }

        List<TripPackage> ranked = packageRanker.rank(packages);
        log.info("✅ Scored {} packages with {} weights, returning top {}", packages.size(), priority, ranked.size());
        return ranked;
    }

    private List<TripPackage> packagesFor(TravelWindow window, TripIntent intent) {
        WindowCandidates candidates = candidateAggregator.fetchWindow(window, intent, windowTimeout);
        List<TripPackage> packages = packageAssembler.assemble(window,
                candidates.getFlights().getCandidates(),
                candidates.getHotels().getCandidates(),
                intent);
        log.debug("Window {} +{}d: {} flights x {} hotels = {} packages", window.getStartDate(), window.getDuration(),
                candidates.getFlights().getCandidates().size(), candidates.getHotels().getCandidates().size(),
                packages.size());
        return packages;
    }

    private List<TripPackage> awaitWindow(TravelWindow window, CompletableFuture<List<TripPackage>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof NoCandidatesAvailableException) {
                log.warn("⚠️ Window {} +{}d skipped: {}", window.getStartDate(), window.getDuration(), cause.getMessage());
                return List.of();
            }
            if (cause instanceof WindowTimeoutException) {
                log.warn("⚠️ Window {} +{}d skipped: {}", window.getStartDate(), window.getDuration(), cause.getMessage());
                return List.of();
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw e;
        }
    }
}
