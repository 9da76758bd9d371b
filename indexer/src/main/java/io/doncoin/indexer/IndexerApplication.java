package io.doncoin.indexer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.doncoin.indexer.config.DeploymentManifest;
import io.doncoin.indexer.config.DeploymentManifestLoader;
import io.doncoin.indexer.config.IndexerConfig;
import io.doncoin.indexer.eth.Web3jRpcClient;
import io.doncoin.indexer.event.DonationReceivedHandler;
import io.doncoin.indexer.event.EventDecoder;
import io.doncoin.indexer.event.EventProcessor;
import io.doncoin.indexer.event.GrantCreatedHandler;
import io.doncoin.indexer.metrics.IndexerMetrics;
import io.doncoin.indexer.metrics.MetricsHttpServer;
import io.doncoin.indexer.session.ChainSession;
import io.doncoin.indexer.session.ChainSessionManager;
import io.doncoin.indexer.session.DeploymentDetector;
import io.doncoin.indexer.session.DeploymentNotFoundException;
import io.doncoin.indexer.store.CursorStore;
import io.doncoin.indexer.store.DataSources;
import io.doncoin.indexer.store.FileCursorStore;
import io.doncoin.indexer.store.JdbcChainSessionRepository;
import io.doncoin.indexer.store.JdbcCursorStore;
import io.doncoin.indexer.store.JdbcEventStore;
import io.doncoin.indexer.store.SchemaInitializer;
import io.doncoin.indexer.sync.BackfillReport;
import io.doncoin.indexer.sync.BackfillWorker;
import io.doncoin.indexer.sync.LogFetcher;
import io.doncoin.indexer.sync.Sleeper;
import io.doncoin.indexer.sync.TailingLoop;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public class IndexerApplication {

    private static final Logger log = LoggerFactory.getLogger(IndexerApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env) {
        IndexerCommand command;
        IndexerConfig config;
        try {
            command = IndexerCommand.parse(args);
            config = command.applyTo(IndexerConfig.fromEnv(env));
        } catch (IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            System.err.print(IndexerCommand.USAGE);
            return EXIT_USAGE;
        }

        try {
            return execute(command, config);
        } catch (DeploymentNotFoundException e) {
            log.error("Cannot start without a chain session: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("RPC failure during startup", e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Indexer failed", e);
            return EXIT_FAILURE;
        } finally {
            log.info("Indexer shutdown complete");
        }
    }

    private static int execute(IndexerCommand command, IndexerConfig config) throws IOException {
        ObjectMapper objectMapper = new ObjectMapper();
        Clock clock = Clock.systemUTC();
        DeploymentManifest manifest = new DeploymentManifestLoader(objectMapper).load(config.manifestPath());

        PrometheusMeterRegistry meterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        IndexerMetrics metrics = new IndexerMetrics(meterRegistry);

        try (
            HikariDataSource dataSource = DataSources.create(config);
            Web3jRpcClient rpcClient = Web3jRpcClient.create(config.rpcUrl(), config.rpcTimeoutMs());
            MetricsHttpServer metricsServer = config.metricsPort() > 0
                ? MetricsHttpServer.start(config.metricsPort(), meterRegistry)
                : null
        ) {
            new SchemaInitializer(dataSource).initialize();

            ChainSessionManager sessionManager = new ChainSessionManager(
                new DeploymentDetector(rpcClient),
                new JdbcChainSessionRepository(dataSource),
                clock
            );
            ChainSession session = sessionManager.resolve(manifest, config.verifyWatchedContracts());

            try (MDC.MDCCloseable ignored = MDC.putCloseable("sessionId", session.sessionId().toString())) {
                EventProcessor eventProcessor = new EventProcessor(
                    new JdbcEventStore(dataSource),
                    new EventDecoder(),
                    new GrantCreatedHandler(objectMapper, clock),
                    new DonationReceivedHandler(),
                    config.unknownEventPolicy(),
                    metrics,
                    objectMapper,
                    clock
                );
                LogFetcher logFetcher = new LogFetcher(rpcClient, manifest.watchedContracts(), config.maxBlockRange());

                return switch (command.mode()) {
                    case TAIL -> runTail(config, session, rpcClient, logFetcher, eventProcessor, metrics, dataSource, clock);
                    case BACKFILL -> runBackfill(command, config, session, rpcClient, logFetcher, eventProcessor, metrics);
                };
            }
        }
    }

    private static int runTail(
        IndexerConfig config,
        ChainSession session,
        Web3jRpcClient rpcClient,
        LogFetcher logFetcher,
        EventProcessor eventProcessor,
        IndexerMetrics metrics,
        HikariDataSource dataSource,
        Clock clock
    ) {
        Thread loopThread = Thread.currentThread();
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            loopThread.interrupt();
            try {
                if (!stopped.await(10, TimeUnit.SECONDS)) {
                    log.warn("Tailing loop did not stop within 10s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "indexer-shutdown"));

        try (CursorStore cursorStore = createCursorStore(config, dataSource, clock)) {
            new TailingLoop(
                config,
                session,
                rpcClient,
                logFetcher,
                eventProcessor,
                cursorStore,
                metrics,
                Sleeper.THREAD
            ).run();
        } finally {
            stopped.countDown();
        }
        return EXIT_OK;
    }

    private static int runBackfill(
        IndexerCommand command,
        IndexerConfig config,
        ChainSession session,
        Web3jRpcClient rpcClient,
        LogFetcher logFetcher,
        EventProcessor eventProcessor,
        IndexerMetrics metrics
    ) throws IOException {
        long toBlock = command.toBlock() != null ? command.toBlock() : rpcClient.currentBlockHeight();
        BackfillWorker worker = new BackfillWorker(
            session,
            logFetcher,
            eventProcessor,
            metrics,
            config.backfillChunkSize()
        );
        BackfillReport report = worker.run(command.fromBlock(), toBlock);
        for (BackfillReport.ChunkFailure failure : report.failures()) {
            log.error("Failed chunk from={} to={} error={}", failure.fromBlock(), failure.toBlock(), failure.error());
        }
        return report.hasFailures() ? EXIT_FAILURE : EXIT_OK;
    }

    private static CursorStore createCursorStore(IndexerConfig config, HikariDataSource dataSource, Clock clock) {
        return switch (config.cursorStoreType()) {
            case POSTGRES -> new JdbcCursorStore(dataSource, clock);
            case FILE -> new FileCursorStore(config.cursorDir());
        };
    }
}
