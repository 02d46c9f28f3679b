package com.pointbreak.award.service;

import com.pointbreak.award.enums.CabinClass;
import com.pointbreak.award.enums.SearchType;
import com.pointbreak.award.exception.UpstreamUnavailableException;
import com.pointbreak.award.model.ComparisonResult;
import com.pointbreak.award.model.MatchedFlight;
import com.pointbreak.award.model.RawOffer;
import com.pointbreak.award.model.SearchRequest;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for a cash-versus-points comparison. Runs the award and revenue searches
 * concurrently on separate leased sessions, then matches the two result sets.
 */
@Slf4j
@Service
public class FlightComparisonService {

    private final RequestDispatcher requestDispatcher;
    private final OfferMatcher offerMatcher;

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService searchExecutor = Executors.newFixedThreadPool(4, r -> {
        Thread t = new Thread(r, "search-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public FlightComparisonService(RequestDispatcher requestDispatcher, OfferMatcher offerMatcher) {
        this.requestDispatcher = requestDispatcher;
        this.offerMatcher = offerMatcher;
    }

    /**
     * Validates raw input, then compares. The cabin is checked before anything reaches upstream.
     */
    public ComparisonResult compare(String origin, String destination, String date, int passengers, String cabinClass) {
        CabinClass cabin = CabinClass.fromValue(cabinClass);
        return compare(SearchRequest.of(origin, destination, date, passengers, cabin));
    }

    public ComparisonResult compare(SearchRequest request) {
        long start = System.currentTimeMillis();
        log.info("Comparing {} -> {} on {} ({} pax, {})", request.getOrigin(), request.getDestination(),
                request.getDate(), request.getPassengerCount(), request.getCabinClass());

        CompletableFuture<List<RawOffer>> award = CompletableFuture.supplyAsync(
                () -> requestDispatcher.execute(request, SearchType.AWARD), searchExecutor);
        CompletableFuture<List<RawOffer>> revenue = CompletableFuture.supplyAsync(
                () -> requestDispatcher.execute(request, SearchType.REVENUE), searchExecutor);

        List<RawOffer> awardOffers = await(award, revenue);
        List<RawOffer> cashOffers = await(revenue, null);

        List<MatchedFlight> flights = offerMatcher.match(awardOffers, cashOffers,
                request.getCabinClass(), request.getPassengerCount());

        log.info("Comparison {} -> {} done: {} award, {} cash, {} matched in {}ms",
                request.getOrigin(), request.getDestination(), awardOffers.size(), cashOffers.size(),
                flights.size(), System.currentTimeMillis() - start);
        return new ComparisonResult(request, flights);
    }

    // waits for the sibling too, so a failure never leaves a search running against a lease
    private List<RawOffer> await(CompletableFuture<List<RawOffer>> future, CompletableFuture<?> sibling) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (sibling != null) {
                sibling.handle((value, ex) -> null).join();
            }
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new UpstreamUnavailableException("Search failed: " + cause.getMessage(), cause);
        }
    }

    @PreDestroy
    public void shutdown() {
        searchExecutor.shutdownNow();
    }
}
