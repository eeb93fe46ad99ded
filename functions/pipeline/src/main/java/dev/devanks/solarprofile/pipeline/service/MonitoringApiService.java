package dev.devanks.solarprofile.pipeline.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.devanks.solarprofile.pipeline.client.MonitoringApiClient;
import dev.devanks.solarprofile.pipeline.config.PipelineProperties;
import dev.devanks.solarprofile.pipeline.exception.FetchException;
import dev.devanks.solarprofile.pipeline.exception.PayloadParseException;
import dev.devanks.solarprofile.pipeline.model.DecodedPayload;
import dev.devanks.solarprofile.pipeline.model.SitePage;
import dev.devanks.solarprofile.pipeline.parser.TolerantJsonDecoder;
import feign.FeignException;
import feign.RetryableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static reactor.core.scheduler.Schedulers.boundedElastic;

/**
 * Calls the monitoring API through {@link MonitoringApiClient} and owns the retry policy:
 * transport faults and 5xx responses without a JSON body are retried with exponential backoff
 * and jitter, everything else fails at once. An undecodable listing is fetched one more time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitoringApiService {

    private final MonitoringApiClient apiClient;
    private final TolerantJsonDecoder decoder;
    private final PipelineProperties properties;

    /**
     * Fetches one page of the public site listing.
     *
     * @param offset index of the first record
     * @param limit  number of records requested
     * @return the decoded page; errors with {@link FetchException}
     */
    public Mono<SitePage> fetchPage(int offset, int limit) {
        return Mono.defer(() -> {
            var attempts = new AtomicInteger();
            var what = String.format("Site listing (start=%d, limit=%d)", offset, limit);
            return fetchListing(offset, limit, what, attempts)
                    .map(body -> toPage(offset, decoder.decode(body)))
                    .onErrorResume(PayloadParseException.class, firstFailure -> {
                        log.warn("{} could not be decoded, fetching it once more. Strategies: {}",
                                what, firstFailure.getStrategyFailures());
                        return fetchListing(offset, limit, what, attempts)
                                .map(body -> toPage(offset, decoder.decode(body)))
                                .onErrorMap(PayloadParseException.class, secondFailure -> new FetchException(
                                        what + " returned an undecodable payload twice", attempts.get(), false, secondFailure));
                    });
        });
    }

    /**
     * Downloads the production CSV export of one site for the given window.
     */
    public Mono<byte[]> downloadSiteCsv(long siteId, Instant from, Instant to) {
        return Mono.defer(() -> {
            var attempts = new AtomicInteger();
            var what = String.format("CSV export of site %d (%s to %s)", siteId, from, to);
            return call(what, attempts, () -> apiClient.exportChart(siteId, from.toEpochMilli(), to.toEpochMilli(),
                    siteId, properties.getApi().getExportParams()));
        });
    }

    private Mono<String> fetchListing(int offset, int limit, String what, AtomicInteger attempts) {
        return call(what, attempts, () -> apiClient.listSites(offset, limit, properties.getApi().getListParams()));
    }

    private <T> Mono<T> call(String what, AtomicInteger attempts, Callable<T> request) {
        return Mono.fromCallable(() -> {
                    attempts.incrementAndGet();
                    log.debug("{}: attempt {} on thread {}", what, attempts.get(), Thread.currentThread().getName());
                    return request.call();
                })
                .subscribeOn(boundedElastic())
                .onErrorMap(e -> !(e instanceof FetchException), e -> classify(what, attempts.get(), e))
                .retryWhen(retrySpec(what, attempts));
    }

    private Retry retrySpec(String what, AtomicInteger attempts) {
        var api = properties.getApi();
        return Retry.backoff(api.getMaxAttempts() - 1L, api.getInitialBackoff())
                .maxBackoff(api.getMaxBackoff())
                .jitter(api.getJitter())
                .filter(e -> e instanceof FetchException && ((FetchException) e).isRetryable())
                .doBeforeRetry(signal -> log.warn("{} failed (attempt {}), retrying: {}",
                        what, attempts.get(), signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> new FetchException(
                        String.format("%s failed after %d attempt(s): %s", what, attempts.get(), signal.failure().getMessage()),
                        attempts.get(), true, signal.failure().getCause()));
    }

    /**
     * Sorts a failed call into retryable or terminal.
     */
    FetchException classify(String what, int attempts, Throwable error) {
        if (!(error instanceof FeignException)) {
            log.error("{} failed: {}", what, error.getMessage(), error);
            return new FetchException(what + " failed: " + error.getMessage(), attempts, false, error);
        }
        var feignException = (FeignException) error;
        int status = feignException.status();
        if (feignException instanceof RetryableException || status <= 0) {
            return new FetchException(what + " transport failure: " + feignException.getMessage(), attempts, true, feignException);
        }
        String body = feignException.contentUTF8();
        log.error("Monitoring API call failed (Feign): Status={}, Body={}", status, TolerantJsonDecoder.excerpt(body));
        boolean retryable = status >= 500 && !isJson(body);
        return new FetchException(String.format("%s returned HTTP %d", what, status), attempts, retryable, feignException);
    }

    private boolean isJson(String body) {
        if (body == null || body.isBlank()) {
            return false;
        }
        try {
            decoder.decode(body);
            return true;
        } catch (PayloadParseException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
            return false;
        }
    }

    private SitePage toPage(int offset, DecodedPayload payload) {
        JsonNode body = payload.getBody();
        List<JsonNode> records = new ArrayList<>();
        JsonNode recordsNode = body.path("records");
        if (recordsNode.isArray()) {
            recordsNode.forEach(records::add);
        } else {
            log.warn("Site listing at offset {} has no 'records' array, treating it as empty.", offset);
        }

        JsonNode totalNode = body.path("totalCount");
        int totalCount = totalNode.isNumber() || totalNode.isTextual()
                ? totalNode.asInt(SitePage.UNKNOWN_TOTAL)
                : SitePage.UNKNOWN_TOTAL;

        log.info("Fetched site listing page at offset {}: {} record(s), totalCount {} (decoded by '{}').",
                offset, records.size(), totalCount, payload.getStrategy());
        return SitePage.builder()
                .offset(offset)
                .records(records)
                .totalCount(totalCount)
                .decodedBy(payload.getStrategy())
                .build();
    }
}
