package org.msgsearch.search.bootstrap;

import org.msgsearch.search.config.SearchConfig;
import org.msgsearch.search.controller.SearchController;
import org.msgsearch.search.index.InvertedIndexBuilder;
import org.msgsearch.search.index.SnapshotHolder;
import org.msgsearch.search.refresh.IndexRefresher;
import org.msgsearch.search.service.SearchService;
import org.msgsearch.search.upstream.HttpMessageFetcher;
import org.msgsearch.search.upstream.MessageFetcher;
import org.msgsearch.search.web.SearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration, starts the index refresher and the HTTP API, and registers a JVM shutdown hook.
 * The HTTP API comes up before the first refresh completes; until then searches return no results and
 * {@code /ready} answers 503.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run() {
        try {
            start();
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start() {
        SearchConfig cfg = SearchConfig.load();
        SnapshotHolder snapshots = new SnapshotHolder();
        IndexRefresher refresher = startRefresher(cfg, snapshots);
        Javalin app = startHttp(cfg, snapshots, refresher);
        addShutdownHook(refresher, app);
        logger.info("Search Service started successfully.");
    }

    private static IndexRefresher startRefresher(SearchConfig cfg, SnapshotHolder snapshots) {
        MessageFetcher fetcher = new HttpMessageFetcher(cfg.upstream());
        IndexRefresher refresher = new IndexRefresher(
            fetcher,
            new InvertedIndexBuilder(),
            snapshots,
            cfg.refresh().interval(),
            cfg.refresh().fetchTimeout()
        );
        refresher.start(cfg.refresh().onStartup());
        return refresher;
    }

    private static Javalin startHttp(SearchConfig cfg, SnapshotHolder snapshots, IndexRefresher refresher) {
        SearchService service = new SearchService(
            snapshots,
            cfg.search().maxPageSize(),
            cfg.search().tieBreak()
        );
        SearchController controller = new SearchController(service, refresher, cfg.search().defaultPageSize());
        Javalin app = SearchHttpServer.start(cfg.serverPort(), controller);
        logger.info("Javalin server started on port {}", app.port());
        return app;
    }

    private static void addShutdownHook(IndexRefresher refresher, Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(refresher, app)));
    }

    private static void shutdown(IndexRefresher refresher, Javalin app) {
        logger.info("Shutting down Search Service...");
        refresher.stop();
        app.stop();
        logger.info("Search Service stopped.");
    }
}
