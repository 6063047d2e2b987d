package io.streamvault.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.app.view.UnifiedAnalysisView;
import io.streamvault.app.view.UnifiedPortfolioView;
import io.streamvault.app.view.UnifiedSystemHealthView;
import io.streamvault.app.view.UnifiedTradingView;
import io.streamvault.projection.Projection;
import io.streamvault.projection.ProjectionRefresher;
import io.streamvault.projection.ProjectionRouter;
import io.streamvault.store.*;
import io.streamvault.store.archive.ArchivalService;
import io.streamvault.store.feed.EventFeed;
import io.streamvault.store.memory.InMemoryEventLog;
import io.streamvault.store.memory.InMemoryProjectionStatusStore;
import io.streamvault.store.memory.InMemorySchemaRegistry;
import io.streamvault.store.memory.InMemorySnapshotStore;
import io.streamvault.store.pg.*;
import io.streamvault.store.replay.StreamReplayer;
import io.streamvault.store.schema.PayloadSchemaValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import static io.streamvault.projection.ProjectionRouter.*;

@Configuration
public class Beans {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    // in-memory storage

    @Bean
    @Profile("inmem")
    EventLog inMemoryEventLog(Clock clock) {
        return new InMemoryEventLog(clock);
    }

    @Bean
    @Profile("inmem")
    SnapshotStore inMemorySnapshotStore(Clock clock) {
        return new InMemorySnapshotStore(clock);
    }

    @Bean
    @Profile("inmem")
    ProjectionStatusStore inMemoryProjectionStatusStore() {
        return new InMemoryProjectionStatusStore();
    }

    @Bean
    @Profile("inmem")
    SchemaRegistry inMemorySchemaRegistry() {
        return new InMemorySchemaRegistry();
    }

    @Bean
    @Profile("inmem")
    UnifiedAnalysisView unifiedAnalysisView(EventLog eventLog, ObjectMapper mapper) {
        return new UnifiedAnalysisView(eventLog, mapper);
    }

    @Bean
    @Profile("inmem")
    UnifiedPortfolioView unifiedPortfolioView(EventLog eventLog, ObjectMapper mapper) {
        return new UnifiedPortfolioView(eventLog, mapper);
    }

    @Bean
    @Profile("inmem")
    UnifiedTradingView unifiedTradingView(EventLog eventLog, ObjectMapper mapper) {
        return new UnifiedTradingView(eventLog, mapper);
    }

    @Bean
    @Profile("inmem")
    UnifiedSystemHealthView unifiedSystemHealthView(EventLog eventLog, ObjectMapper mapper) {
        return new UnifiedSystemHealthView(eventLog, mapper);
    }

    // postgres storage

    @Bean
    @Profile("pg")
    EventLog postgresEventLog(JdbcTemplate jdbc, TransactionTemplate tx, ObjectMapper mapper, Clock clock) {
        return new PostgresEventLog(jdbc, tx, mapper, clock);
    }

    @Bean
    @Profile("pg")
    SnapshotStore postgresSnapshotStore(JdbcTemplate jdbc, ObjectMapper mapper) {
        return new PostgresSnapshotStore(jdbc, mapper);
    }

    @Bean
    @Profile("pg")
    ProjectionStatusStore postgresProjectionStatusStore(JdbcTemplate jdbc) {
        return new PostgresProjectionStatusStore(jdbc);
    }

    @Bean
    @Profile("pg")
    SchemaRegistry postgresSchemaRegistry(JdbcTemplate jdbc, ObjectMapper mapper) {
        return new PostgresSchemaRegistry(jdbc, mapper);
    }

    @Bean
    @Profile("pg")
    MaterializedViewProjection stockAnalysisUnified(JdbcTemplate jdbc) {
        return MaterializedViewProjection.unified(UNIFIED_ANALYSIS, jdbc);
    }

    @Bean
    @Profile("pg")
    MaterializedViewProjection portfolioUnified(JdbcTemplate jdbc) {
        return MaterializedViewProjection.unified(UNIFIED_PORTFOLIO, jdbc);
    }

    @Bean
    @Profile("pg")
    MaterializedViewProjection tradingActivityUnified(JdbcTemplate jdbc) {
        return MaterializedViewProjection.unified(UNIFIED_TRADING, jdbc);
    }

    @Bean
    @Profile("pg")
    MaterializedViewProjection systemHealthUnified(JdbcTemplate jdbc) {
        return MaterializedViewProjection.unified(UNIFIED_SYSTEM_HEALTH, jdbc);
    }

    // engine

    @Bean
    PayloadSchemaValidator payloadSchemaValidator(SchemaRegistry registry, ObjectMapper mapper) {
        BuiltinSchemas.registerMissing(registry, mapper);
        return new PayloadSchemaValidator(registry, mapper);
    }

    @Bean
    ProjectionRouter projectionRouter(StreamVaultProperties properties) {
        return new ProjectionRouter(ProjectionRouter.defaultRoutes(), properties.projections().unmappedPolicy());
    }

    @Bean
    Executor projectionRefreshExecutor(StreamVaultProperties properties) {
        var projections = properties.projections();
        if (projections.refreshMode() == StreamVaultProperties.RefreshMode.SYNC) {
            return Runnable::run;
        }
        var pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(projections.workerThreads());
        pool.setMaxPoolSize(projections.workerThreads());
        pool.setThreadNamePrefix("projection-refresh-");
        pool.setWaitForTasksToCompleteOnShutdown(true);
        pool.setAwaitTerminationSeconds(10);
        return pool;
    }

    @Bean
    ProjectionRefresher projectionRefresher(ProjectionRouter router, ProjectionStatusStore statusStore,
                                            @Qualifier("projectionRefreshExecutor") Executor executor, Clock clock,
                                            List<Projection> projections) {
        var refresher = new ProjectionRefresher(router, statusStore, executor, clock);
        projections.forEach(refresher::register);
        return refresher;
    }

    @Bean
    EventFeed eventFeed(EventLog eventLog, StreamVaultProperties properties) {
        return new EventFeed(eventLog, ForkJoinPool.commonPool(), properties.feed().batchSize());
    }

    @Bean
    AppendCoordinator appendCoordinator(EventLog eventLog, PayloadSchemaValidator validator,
                                        ProjectionRefresher refresher, EventFeed feed) {
        var coordinator = new AppendCoordinator(eventLog, validator);
        coordinator.addListener(refresher);
        coordinator.addListener(feed);
        return coordinator;
    }

    @Bean
    StreamReplayer streamReplayer(EventLog eventLog, SnapshotStore snapshots) {
        return new StreamReplayer(eventLog, snapshots);
    }

    @Bean
    ArchivalService archivalService(EventLog eventLog, Clock clock) {
        return new ArchivalService(eventLog, clock);
    }
}
