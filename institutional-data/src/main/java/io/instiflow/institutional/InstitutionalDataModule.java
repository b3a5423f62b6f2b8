package io.instiflow.institutional;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.TypeLiteral;
import io.instiflow.institutional.fetch.HttpPublisherClient;
import io.instiflow.institutional.fetch.PublisherClient;
import io.instiflow.institutional.parse.ContentDecoder;
import io.instiflow.institutional.parse.TableMerger;
import io.instiflow.institutional.store.DailySnapshotStore;
import io.instiflow.institutional.store.HistoryAccumulator;
import io.instiflow.institutional.store.StorageLayout;
import io.instiflow.metrics.Metrics;
import io.instiflow.retry.ExponentialBackoffRetryPolicy;

import java.util.List;

/**
 * Wires the flow for one run from the loaded settings and the tracked securities.
 */
public class InstitutionalDataModule extends AbstractModule {
    private final InstitutionalConfig config;
    private final List<TrackedSecurity> securities;

    public InstitutionalDataModule(InstitutionalConfig config, List<TrackedSecurity> securities) {
        this.config = config;
        this.securities = List.copyOf(securities);
    }

    @Override
    protected void configure() {
        bind(InstitutionalConfig.class).toInstance(config);
        bind(new TypeLiteral<List<TrackedSecurity>>() {}).toInstance(securities);
        bind(PublisherCatalog.class).toInstance(PublisherCatalog.defaults());
    }

    @Provides @Singleton
    MetricRegistry metricRegistry() {
        return new MetricRegistry();
    }

    @Provides @Singleton
    Metrics metrics(MetricRegistry registry) {
        return new Metrics(registry);
    }

    @Provides @Singleton
    StorageLayout storageLayout() {
        return new StorageLayout(config.dataDir());
    }

    @Provides @Singleton
    PublisherClient publisherClient() {
        return new HttpPublisherClient(config.requestTimeout(), config.userAgent(),
                new ExponentialBackoffRetryPolicy(config.fetchAttempts(), 500, 5_000));
    }

    @Provides @Singleton
    HistoryAccumulator historyAccumulator(StorageLayout layout) {
        return new HistoryAccumulator(layout);
    }

    @Provides @Singleton
    DayOrchestrator dayOrchestrator(PublisherCatalog catalog, PublisherClient client, Metrics metrics) {
        return new DayOrchestrator(catalog, client, new ContentDecoder(), new TableMerger(), securities,
                config.pacing(), config.minPayloadBytes(), metrics);
    }

    @Provides @Singleton
    SecurityDaySink securityDaySink(StorageLayout layout, HistoryAccumulator history, Metrics metrics) {
        return new SecurityDaySink(new DailySnapshotStore(layout), history, metrics);
    }

    @Provides @Singleton
    InstitutionalFlowRunner runner(DayOrchestrator orchestrator, SecurityDaySink sink, HistoryAccumulator history,
                                   MetricRegistry registry) {
        return new InstitutionalFlowRunner(config, orchestrator, sink, history, securities, registry);
    }
}
