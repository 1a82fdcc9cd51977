package com.netintel.wigle.service;

import com.netintel.wigle.exception.AuthorizationException;
import com.netintel.wigle.exception.PageFetchException;
import com.netintel.wigle.exception.WigleApiException;
import com.netintel.wigle.model.Page;
import com.netintel.wigle.model.RunContext;
import com.netintel.wigle.model.SearchKind;
import com.netintel.wigle.model.SearchResponse;
import com.netintel.wigle.output.PageStore;
import com.netintel.wigle.run.CancellationToken;
import com.netintel.wigle.run.RunReporter;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Walks a search endpoint page by page, following the server's continuation cursor.
 *
 * Requests are strictly sequential: each one needs the cursor from the previous response.
 * The walk ends when the cursor disappears, when the service stalls (same cursor twice, or
 * no records while still advertising a cursor), at the page limit, on cancellation, or on
 * a page failure.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaginatedFetcher {

    /** Query parameters owned by the fetcher; dropped from caller filters. */

    public enum StopReason { EXHAUSTED, STALLED, MAX_PAGES, CANCELLED, FAILED }

    public record FetchResult(int pagesFetched, int recordsFetched, Long totalInSource,
                              StopReason stopReason, PageFetchException failure) {

        public boolean failed() {
            return failure != null;
        }
    }

    private final WigleApiClient apiClient;
    private final Retry wigleApiRetry;

    /**
     * Lazily fetched pages. Single use: cursors cannot be replayed, so the sequence cannot restart.
     */
    public PageSequence open(SearchKind kind, Map<String, String> params, int resultsPerPage,
                             int maxPages, CancellationToken token) {
        return new PageSequence(kind, withoutPagination(params), resultsPerPage, maxPages, token);
    }

    /**
     * Fetch every page into the store, reporting one event per page.
     * A page failure ends the walk and is returned in the result; pages already stored stay.
     *
     * @throws AuthorizationException on 401/403, immediately
     */
    public FetchResult fetchInto(PageStore store, SearchKind kind, Map<String, String> params,
                                 RunContext context, RunReporter reporter, CancellationToken token) {
        PageSequence pages = open(kind, params, context.getResultsPerPage(), context.getMaxPages(), token);
        reporter.event("Submitted: " + apiClient.searchUri(kind, pages.params, null, context.getResultsPerPage()));

        int records = 0;
        Long total = null;
        try {
            while (pages.hasNext()) {
                Page page = pages.next();
                store.append(page);
                records += page.size();
                if (page.totalResults() != null) {
                    total = page.totalResults();
                }
                reporter.event(progress(page, records, total));
            }
        } catch (PageFetchException e) {
            reporter.event("Request failed: " + e.getMessage());
            return new FetchResult(pages.pagesFetched(), records, total, StopReason.FAILED, e);
        }

        log.info("{} search stopped ({}): {} pages, {} records", kind, pages.stopReason(), pages.pagesFetched(), records);
        return new FetchResult(pages.pagesFetched(), records, total, pages.stopReason(), null);
    }

    private static String progress(Page page, int cumulative, Long total) {
        String line = "Page " + page.number() + ": " + page.size() + " results saved (" + cumulative + " so far";
        return total != null ? line + " of " + total + " in source)" : line + ")";
    }

    private static Map<String, String> withoutPagination(Map<String, String> params) {
        Map<String, String> clean = new LinkedHashMap<>();
        params.forEach((k, v) -> {
            if (!WigleApiClient.PAGINATION_PARAMS.contains(k) && v != null && !v.isBlank()) {
                clean.put(k, v.trim());
            }
        });
        return clean;
    }

    // ── Sequence ─────────────────────────────────────────────────────────────

    public final class PageSequence implements Iterator<Page> {

        private final SearchKind kind;
        private final Map<String, String> params;
        private final int resultsPerPage;
        private final int maxPages;
        private final CancellationToken token;

        private String cursor;
        private int pagesFetched;
        private Page buffered;
        private StopReason stopReason;

        private PageSequence(SearchKind kind, Map<String, String> params, int resultsPerPage,
                             int maxPages, CancellationToken token) {
            this.kind = kind;
            this.params = Map.copyOf(params);
            this.resultsPerPage = resultsPerPage;
            this.maxPages = maxPages;
            this.token = token;
        }

        /**
         * Issues at most one request. Cancellation and the page limit are checked first.
         *
         * @throws PageFetchException    when the page fails after retries
         * @throws AuthorizationException on 401/403
         */
        @Override
        public boolean hasNext() {
            if (buffered != null) return true;
            if (stopReason != null) return false;
            if (token.isCancelled()) {
                stopReason = StopReason.CANCELLED;
                return false;
            }
            if (maxPages > 0 && pagesFetched >= maxPages) {
                stopReason = StopReason.MAX_PAGES;
                return false;
            }

            int number = pagesFetched + 1;
            String sent = cursor;
            SearchResponse response = fetch(number, sent);

            if (response.records().isEmpty()) {
                if (response.hasCursor()) {
                    log.warn("{} page {} returned no records but a cursor; treating as exhausted", kind, number);
                }
                stopReason = response.hasCursor() ? StopReason.STALLED : StopReason.EXHAUSTED;
                return false;
            }

            pagesFetched = number;
            buffered = new Page(number, response.records(), response.nextCursor(), response.totalResults());
            if (!response.hasCursor()) {
                stopReason = StopReason.EXHAUSTED;
            } else if (response.nextCursor().equals(sent)) {
                log.warn("{} page {} repeated cursor {}; stopping", kind, number, sent);
                stopReason = StopReason.STALLED;
            } else {
                cursor = response.nextCursor();
            }
            return true;
        }

        @Override
        public Page next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Page page = buffered;
            buffered = null;
            return page;
        }

        public int pagesFetched() {
            return pagesFetched;
        }

        /** Why the sequence ended; null while it can still produce pages. */
        public StopReason stopReason() {
            return stopReason;
        }

        private SearchResponse fetch(int number, String sent) {
            try {
                return wigleApiRetry.executeSupplier(() -> apiClient.search(kind, params, sent, resultsPerPage));
            } catch (AuthorizationException e) {
                stopReason = StopReason.FAILED;
                throw e;
            } catch (WigleApiException e) {
                stopReason = StopReason.FAILED;
                throw new PageFetchException(number, e);
            }
        }
    }
}
