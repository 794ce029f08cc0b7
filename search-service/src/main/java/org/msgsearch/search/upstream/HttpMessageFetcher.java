package org.msgsearch.search.upstream;

import com.google.gson.JsonParseException;
import org.msgsearch.core.model.Message;
import org.msgsearch.search.config.SearchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads every message from the upstream API by paging through {@code skip}/{@code limit}.
 *
 * <p>A probe request for a single message discovers the reported {@code total}; when present the whole set is
 * requested in one chunk. Each page is retried with exponential backoff. HTTP 401 and 403 are not retried.
 * Any page that still fails aborts the fetch, so callers never see a partial set.</p>
 */
public class HttpMessageFetcher implements MessageFetcher {
	private static final Logger logger = LoggerFactory.getLogger(HttpMessageFetcher.class);

	private final SearchConfig.Upstream config;
	private final HttpClient httpClient;
	private final MessagePageParser parser;

	public HttpMessageFetcher(SearchConfig.Upstream config) {
		this.config = config;
		this.httpClient = HttpClient.newBuilder()
				.connectTimeout(config.requestTimeout())
				.followRedirects(HttpClient.Redirect.NORMAL)
				.build();
		this.parser = new MessagePageParser();
	}

	@Override
	public List<Message> fetchAll() throws UpstreamUnavailableException {
		int chunk = probeChunkSize();
		List<Message> all = new ArrayList<>();
		int skip = 0;

		while (true) {
			MessagePageParser.MessagePage page = fetchPage(skip, chunk);
			if (page.items().isEmpty()) {
				break;
			}

			all.addAll(page.items());

			if (page.total() != null) {
				if (all.size() >= page.total()) {
					break;
				}
			} else if (page.items().size() < chunk) {
				break;
			}
			// upstream may cap the limit, so advance by what was actually returned
			skip += page.items().size();
			pause(config.pageDelay());
		}

		logger.info("Fetched {} messages from {}", all.size(), config.messagesUrl());
		return all;
	}

	/**
	 * Ask for one message to learn the reported total. Falls back to the configured page size.
	 */
	private int probeChunkSize() {
		try {
			MessagePageParser.MessagePage probe = parser.parse(get(0, 1));
			if (probe.total() != null && probe.total() > 0) {
				logger.debug("Upstream reports {} messages, fetching in one chunk", probe.total());
				return probe.total();
			}
		} catch (IOException | JsonParseException e) {
			logger.debug("Probe request failed, paging with chunk {}: {}", config.pageSize(), e.getMessage());
		}
		return config.pageSize();
	}

	private MessagePageParser.MessagePage fetchPage(int skip, int limit) throws UpstreamUnavailableException {
		Duration backoff = config.retryBackoff();
		Exception lastException = null;

		for (int attempt = 1; attempt <= config.maxRetries(); attempt++) {
			try {
				return parser.parse(get(skip, limit));
			} catch (UpstreamUnavailableException e) {
				logger.error("Giving up on messages at skip={} limit={}: {}", skip, limit, e.getMessage());
				throw e;
			} catch (IOException | JsonParseException e) {
				lastException = e;
			}

			logger.warn("Transient error fetching messages (attempt {}/{}) at skip={}: {}",
					attempt, config.maxRetries(), skip, lastException.getMessage());
			if (attempt < config.maxRetries()) {
				pause(backoff);
				backoff = backoff.multipliedBy(2);
			}
		}

		throw new UpstreamUnavailableException(
				String.format("Failed to fetch messages at skip=%d after %d attempts", skip, config.maxRetries()),
				lastException
		);
	}

	/**
	 * GET one page.
	 *
	 * @throws UpstreamUnavailableException for 401/403 responses, which are not worth retrying
	 * @throws IOException for any other failed request
	 */
	private String get(int skip, int limit) throws IOException {
		String url = String.format("%s?skip=%d&limit=%d", config.messagesUrl(), skip, limit);
		logger.debug("GET {}", url);

		HttpRequest request = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.timeout(config.requestTimeout())
				.header("Accept", "application/json")
				.GET()
				.build();

		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new UpstreamUnavailableException("Interrupted while fetching " + url, e);
		}

		int status = response.statusCode();
		if (status == 401 || status == 403) {
			throw new UpstreamUnavailableException("HTTP " + status + " for URL: " + url);
		}
		if (status >= 400) {
			throw new IOException("HTTP " + status + " for URL: " + url);
		}
		return response.body();
	}

	private static void pause(Duration duration) throws UpstreamUnavailableException {
		if (duration.isZero() || duration.isNegative()) {
			return;
		}
		try {
			Thread.sleep(duration.toMillis());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new UpstreamUnavailableException("Interrupted while fetching messages", e);
		}
	}
}
