package org.msgsearch.search.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.msgsearch.search.index.IndexSnapshot;
import org.msgsearch.search.model.SearchPage;
import org.msgsearch.search.model.SearchResponse;
import org.msgsearch.search.refresh.IndexRefresher;
import org.msgsearch.search.refresh.RefreshStatus;
import org.msgsearch.search.service.InvalidPaginationException;
import org.msgsearch.search.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = new Gson();
	private final SearchService searchService;
	private final IndexRefresher refresher;
	private final int defaultPageSize;

	public SearchController(SearchService searchService, IndexRefresher refresher, int defaultPageSize) {
		this.searchService = searchService;
		this.refresher = refresher;
		this.defaultPageSize = defaultPageSize;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get("/ready", this::handleReady);

		app.get("/search", this::handleSearch);

		app.get("/stats", this::handleStats);

		app.post("/index/refresh", this::handleRefresh);

		logger.info("Search routes registered");
	}

	/**
	 * GET /health
	 * Liveness check; also reports whether an index has been published
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "search-service");
		health.put("status", "ok");
		health.put("timestamp", System.currentTimeMillis());

		try {
			SearchService.SearchStats stats = searchService.getStats();
			health.put("ready", stats.ready());
			health.put("indexed_docs", stats.index().documents());
		} catch (Exception e) {
			health.put("indexed_docs", "error");
			logger.error("Error getting stats for health check", e);
		}

		respond(ctx, 200, health);
	}

	/**
	 * GET /ready
	 * 200 once the first refresh has been published, 503 before
	 */
	private void handleReady(Context ctx) {
		SearchService.SearchStats stats = searchService.getStats();

		Map<String, Object> response = new HashMap<>();
		response.put("ready", stats.ready());
		response.put("generation", stats.index().generation());
		response.put("indexed_docs", stats.index().documents());

		respond(ctx, stats.ready() ? 200 : 503, response);
	}

	/**
	 * GET /search?search_query={query}&page={page}&page_size={size}
	 * Search messages
	 */
	private void handleSearch(Context ctx) {
		try {
			String query = ctx.queryParam("search_query");
			if (query == null) {
				respondError(ctx, 400, "Query parameter 'search_query' is required.");
				return;
			}

			int page;
			int pageSize;
			try {
				page = intParam(ctx, "page", 1);
				pageSize = intParam(ctx, "page_size", defaultPageSize);
			} catch (NumberFormatException e) {
				respondError(ctx, 400, "Invalid pagination parameters: page and page_size must be integers.");
				return;
			}

			logger.info("Search request: search_query='{}', page={}, page_size={}", query, page, pageSize);

			SearchPage result = searchService.search(query, page, pageSize);

			respond(ctx, 200, SearchResponse.fromPage(result));
			logger.info("Returned {} of {} matches", result.items().size(), result.totalMatches());

		} catch (InvalidPaginationException e) {
			respondError(ctx, 400, "Invalid pagination parameters: " + e.getMessage());
			logger.warn("Rejected search request: {}", e.getMessage());

		} catch (Exception e) {
			respondError(ctx, 500, "Search failed: " + e.getMessage());
			logger.error("Search failed", e);
		}
	}

	/**
	 * GET /stats
	 * Index and refresher statistics
	 */
	private void handleStats(Context ctx) {
		try {
			SearchService.SearchStats stats = searchService.getStats();
			IndexSnapshot.IndexStats index = stats.index();
			RefreshStatus status = refresher.getStatus();

			Map<String, Object> indexInfo = new HashMap<>();
			indexInfo.put("ready", stats.ready());
			indexInfo.put("documents", index.documents());
			indexInfo.put("unique_tokens", index.uniqueTokens());
			indexInfo.put("total_postings", index.totalPostings());
			indexInfo.put("generation", index.generation());
			indexInfo.put("built_at", stats.ready() ? index.builtAt().toString() : null);

			Map<String, Object> refreshInfo = new HashMap<>();
			refreshInfo.put("state", status.state().name());
			refreshInfo.put("last_success", format(status.lastSuccess()));
			refreshInfo.put("last_failure", format(status.lastFailure()));
			refreshInfo.put("last_error", status.lastError());
			refreshInfo.put("successful_cycles", status.successfulCycles());
			refreshInfo.put("failed_cycles", status.failedCycles());
			refreshInfo.put("skipped_triggers", status.skippedTriggers());

			Map<String, Object> response = new HashMap<>();
			response.put("index", indexInfo);
			response.put("refresh", refreshInfo);
			response.put("max_page_size", searchService.getMaxPageSize());

			respond(ctx, 200, response);
			logger.debug("Retrieved search statistics");

		} catch (Exception e) {
			respondError(ctx, 500, "Failed to retrieve statistics: " + e.getMessage());
			logger.error("Failed to get statistics", e);
		}
	}

	/**
	 * POST /index/refresh
	 * Start a refresh cycle now
	 */
	private void handleRefresh(Context ctx) {
		logger.info("Received index refresh request");

		Map<String, Object> response = new HashMap<>();
		if (refresher.triggerNow()) {
			response.put("status", "accepted");
			respond(ctx, 202, response);
		} else {
			response.put("status", "busy");
			respond(ctx, 409, response);
		}
	}

	private static int intParam(Context ctx, String name, int defaultValue) {
		String value = ctx.queryParam(name);
		if (value == null || value.isBlank()) {
			return defaultValue;
		}
		return Integer.parseInt(value.trim());
	}

	private static String format(Instant instant) {
		return instant == null ? null : instant.toString();
	}

	private static void respondError(Context ctx, int status, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		respond(ctx, status, error);
	}

	private static void respond(Context ctx, int status, Object body) {
		ctx.status(status).contentType("application/json").result(gson.toJson(body));
	}
}
