package org.msgsearch.search.config;

import org.junit.jupiter.api.Test;
import org.msgsearch.search.service.TieBreak;

import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class SearchConfigTest {

	private static Properties defaults() throws Exception {
		Properties properties = new Properties();
		try (InputStream in = SearchConfigTest.class.getClassLoader().getResourceAsStream("application.properties")) {
			assertNotNull(in, "application.properties should be on the classpath");
			properties.load(in);
		}
		return properties;
	}

	@Test
	public void testDefaults() throws Exception {
		SearchConfig config = SearchConfig.from(defaults());

		assertEquals(8080, config.serverPort());
		assertEquals(100, config.search().maxPageSize());
		assertEquals(10, config.search().defaultPageSize());
		assertEquals(TieBreak.ID, config.search().tieBreak());
		assertEquals(Duration.ofSeconds(300), config.refresh().interval());
		assertEquals(Duration.ofSeconds(60), config.refresh().fetchTimeout());
		assertTrue(config.refresh().onStartup());
		assertEquals(3, config.upstream().maxRetries());
		assertEquals(Duration.ofMillis(200), config.upstream().retryBackoff());
		assertEquals("https://november7-730026606190.europe-west1.run.app/messages/", config.upstream().messagesUrl());
	}

	@Test
	public void testEnvironmentOverridesAndAliases() throws Exception {
		Properties properties = defaults();
		SearchConfig.overlayEnvironment(properties, Map.of(
				"MAX_PAGE_SIZE", "25",
				"PORT", "9090",
				"search.tiebreak", "upstream",
				"REFRESH_INTERVAL_SECONDS", "30"
		));

		SearchConfig config = SearchConfig.from(properties);

		assertEquals(25, config.search().maxPageSize());
		assertEquals(9090, config.serverPort());
		assertEquals(TieBreak.UPSTREAM, config.search().tieBreak());
		assertEquals(Duration.ofSeconds(30), config.refresh().interval());
	}

	@Test
	public void testMessagesUrlJoinsSlashes() {
		SearchConfig.Upstream upstream = new SearchConfig.Upstream("http://host/", "/messages/", 1, 1,
				Duration.ZERO, Duration.ZERO, Duration.ofSeconds(1));

		assertEquals("http://host/messages/", upstream.messagesUrl());
	}

	@Test
	public void testMissingKeyFailsFast() throws Exception {
		Properties properties = defaults();
		properties.remove("search.max.page.size");

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> SearchConfig.from(properties));
		assertTrue(e.getMessage().contains("search.max.page.size"));
	}

	@Test
	public void testInvalidValuesFailFast() throws Exception {
		Properties badInt = defaults();
		badInt.setProperty("refresh.interval.seconds", "soon");
		assertThrows(IllegalStateException.class, () -> SearchConfig.from(badInt));

		Properties badTieBreak = defaults();
		badTieBreak.setProperty("search.tiebreak", "random");
		assertThrows(IllegalStateException.class, () -> SearchConfig.from(badTieBreak));

		Properties badBoolean = defaults();
		badBoolean.setProperty("refresh.on.startup", "maybe");
		assertThrows(IllegalStateException.class, () -> SearchConfig.from(badBoolean));

		Properties zeroPageSize = defaults();
		zeroPageSize.setProperty("search.max.page.size", "0");
		assertThrows(IllegalStateException.class, () -> SearchConfig.from(zeroPageSize));
	}

	@Test
	public void testNonPositiveRequestTimeoutFailsAtLoad() throws Exception {
		for (String value : new String[]{"0", "-5"}) {
			Properties properties = defaults();
			properties.setProperty("upstream.request.timeout.ms", value);

			IllegalStateException e = assertThrows(IllegalStateException.class, () -> SearchConfig.from(properties));
			assertTrue(e.getMessage().contains("upstream.request.timeout.ms"));
		}
	}
}
