package com.tessera.database.config;

import com.tessera.database.jdbc.JdbcActiveRecordStrategy;
import com.tessera.database.migration.SchemaMigrator;
import com.tessera.eventmodel.SequencedItemMapper;
import com.tessera.eventmodel.TopicRegistry;
import com.tessera.eventmodel.cipher.AesGcmCipherStrategy;
import com.tessera.eventstore.ActiveRecordStrategy;
import com.tessera.eventstore.EventStore;
import com.tessera.eventstore.snapshot.EventSourcedSnapshotStrategy;
import com.tessera.eventstore.snapshot.SnapshotPolicy;
import com.tessera.eventstore.snapshot.SnapshotScheme;
import com.tessera.eventstore.snapshot.SnapshotStrategy;
import com.tessera.observability.EventStoreMetrics;
import com.tessera.observability.StoreTracing;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds a JDBC-backed event store from {@link EventStoreProperties}.
 *
 * <p>Every strategy is constructed here explicitly; nothing is looked up by class name. The
 * application supplies the {@link TopicRegistry} for its event types and, optionally, a {@link
 * MeterRegistry} and an {@link OpenTelemetry} instance. The pooled data source is closed with the
 * context.
 *
 * <p>Repositories are per entity type, so the application builds them from the beans here:
 *
 * <pre>{@code
 * @Bean
 * EventSourcedRepository<Account> accounts(EventStore store, SnapshotStrategy snapshots, SnapshotPolicy policy) {
 *     return new EventSourcedRepository<>(store, Account.class, Account::initial, snapshots, policy);
 * }
 * }</pre>
 */
@Configuration
@EnableConfigurationProperties(EventStoreProperties.class)
@ConditionalOnProperty(prefix = "tessera.eventstore", name = "enabled", havingValue = "true")
public class EventStoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EventStoreConfiguration.class);

    public static final String DATA_SOURCE_BEAN = "tesseraDataSource";
    public static final String ITEM_RECORDS_BEAN = "tesseraItemRecords";

    @Bean(name = DATA_SOURCE_BEAN, destroyMethod = "close")
    public HikariDataSource tesseraDataSource(EventStoreProperties properties) {
        EventStoreProperties.Datasource settings = properties.datasource();
        var config = new HikariConfig();
        config.setPoolName("tessera-eventstore");
        config.setJdbcUrl(settings.url());
        config.setUsername(settings.username());
        config.setPassword(settings.password());
        config.setMaximumPoolSize(settings.maximumPoolSize());
        return new HikariDataSource(config);
    }

    @Bean
    public SchemaMigrator schemaMigrator(
            @Qualifier(DATA_SOURCE_BEAN) HikariDataSource dataSource, EventStoreProperties properties) {
        var migrator = new SchemaMigrator(dataSource, properties.itemsTable(), properties.snapshotsTable());
        if (properties.migrateOnStartup()) {
            migrator.migrate();
        }
        return migrator;
    }

    @Bean(name = ITEM_RECORDS_BEAN)
    public ActiveRecordStrategy tesseraItemRecords(
            @Qualifier(DATA_SOURCE_BEAN) HikariDataSource dataSource, SchemaMigrator migrator) {
        return new JdbcActiveRecordStrategy(dataSource, migrator.itemsTable());
    }

    @Bean
    public SequencedItemMapper sequencedItemMapper(
            ObjectProvider<TopicRegistry> topics, EventStoreProperties properties) {
        TopicRegistry registry = topics.getIfAvailable(() -> {
            log.warn("No TopicRegistry bean found; only snapshots can be stored");
            return TopicRegistry.builder().build();
        });
        if (properties.cipher().isEnabled()) {
            return new SequencedItemMapper(registry, AesGcmCipherStrategy.fromBase64Key(properties.cipher().key()));
        }
        return new SequencedItemMapper(registry);
    }

    @Bean
    public EventStoreMetrics eventStoreMetrics(
            ObjectProvider<MeterRegistry> registry, EventStoreProperties properties) {
        MeterRegistry meters = registry.getIfAvailable();
        return meters != null ? new EventStoreMetrics(meters, properties.itemsTable()) : EventStoreMetrics.noop();
    }

    @Bean
    public StoreTracing storeTracing(ObjectProvider<OpenTelemetry> openTelemetry) {
        OpenTelemetry otel = openTelemetry.getIfAvailable();
        return otel != null ? new StoreTracing(otel.getTracer(StoreTracing.INSTRUMENTATION_NAME)) : StoreTracing.noop();
    }

    @Bean
    public EventStore eventStore(
            @Qualifier(ITEM_RECORDS_BEAN) ActiveRecordStrategy records,
            SequencedItemMapper mapper,
            EventStoreMetrics metrics,
            StoreTracing tracing,
            EventStoreProperties properties) {
        return new EventStore(records, mapper, properties.pageSize(), metrics, tracing);
    }

    @Bean
    public SnapshotStrategy snapshotStrategy(
            EventStore eventStore,
            @Qualifier(DATA_SOURCE_BEAN) HikariDataSource dataSource,
            SchemaMigrator migrator,
            SequencedItemMapper mapper,
            EventStoreMetrics metrics,
            EventStoreProperties properties) {
        if (properties.snapshot().scheme() == SnapshotScheme.SHARED_CHAIN) {
            return EventSourcedSnapshotStrategy.sharedChain(eventStore, metrics);
        }
        return EventSourcedSnapshotStrategy.separateStream(
                new JdbcActiveRecordStrategy(dataSource, migrator.snapshotsTable()), mapper, metrics);
    }

    @Bean
    public SnapshotPolicy snapshotPolicy(EventStoreProperties properties) {
        return SnapshotPolicy.every(properties.snapshot().period());
    }
}
