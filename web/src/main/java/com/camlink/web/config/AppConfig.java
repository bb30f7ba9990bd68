/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.config;

import com.camlink.common.config.CamLinkProperties;
import com.camlink.common.model.BrokerConfig;
import com.camlink.server.cache.EventCache;
import com.camlink.server.gateway.PubSubGateway;
import com.camlink.server.ingestion.IngestionWorker;
import com.camlink.server.metrics.MetricsService;
import com.camlink.server.persistence.BatchWriter;
import com.camlink.server.presentation.PresentationLoop;
import com.camlink.server.presentation.StatusBoard;
import com.camlink.server.presentation.StatusDispatcher;
import com.camlink.server.readmodel.ReadModel;
import com.camlink.server.readmodel.ReadModelRefresher;
import com.camlink.server.session.CameraCatalog;
import com.camlink.server.session.ConnectionSessionManager;
import com.camlink.server.session.PipelineLauncher;
import com.camlink.server.session.ProcessPipelineConnectionFactory;
import com.camlink.server.session.SessionCommandDispatcher;
import com.camlink.server.shutdown.ProcessTerminator;
import com.camlink.server.shutdown.ShutdownCoordinator;
import com.camlink.server.store.EventStore;
import com.camlink.server.store.SqliteEventStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    static final String BUNDLED_CAMERAS = "config/cameras.json";

    @Value("${camlink.db.path:data/camera_events.db}")
    private String dbPath;

    @Value("${camlink.cameras.file:config/cameras.json}")
    private String camerasFile;

    @Value("${camlink.broker.id:default}")
    private String brokerId;

    @Value("${camlink.broker.type:ACTIVEMQ}")
    private String brokerType;

    @Value("${camlink.broker.url:tcp://localhost:61616}")
    private String brokerUrl;

    @Value("${camlink.broker.username:}")
    private String brokerUsername;

    @Value("${camlink.broker.password:}")
    private String brokerPassword;

    @Value("${camlink.broker.client-id:camlink}")
    private String brokerClientId;

    @Value("${camlink.broker.reconnect-interval-seconds:10}")
    private int reconnectIntervalSeconds;

    @Value("${camlink.topic-prefix:rtsp_client}")
    private String topicPrefix;

    @Value("${camlink.status.publish:true}")
    private boolean publishStatus;

    @Value("${camlink.status.history:50}")
    private int statusHistory;

    @Value("${camlink.writer.batch-size:10}")
    private int batchSize;

    @Value("${camlink.pipeline.command:gst-launch-1.0 -q}")
    private String pipelineCommand;

    // --- Durations go through CamLinkProperties so "100ms", "5s" and "PT5S" all work ---

    private static Duration duration(String key, Duration defaultValue) {
        return CamLinkProperties.get().getDuration(key, defaultValue);
    }

    @Bean
    public MetricsService metricsService(MeterRegistry meterRegistry) {
        return new MetricsService(meterRegistry);
    }

    @Bean(destroyMethod = "")
    public EventStore eventStore() {
        return SqliteEventStore.open(Paths.get(dbPath));
    }

    @Bean
    public EventCache eventCache() {
        return new EventCache();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ReadModel readModel(EventCache cache, Clock clock) {
        return new ReadModel(cache, clock);
    }

    @Bean(destroyMethod = "")
    public PresentationLoop presentationLoop() {
        return new PresentationLoop();
    }

    @Bean
    public ReadModelRefresher readModelRefresher(ReadModel readModel, PresentationLoop loop) {
        return new ReadModelRefresher(readModel, loop);
    }

    @Bean
    public StatusBoard statusBoard() {
        return new StatusBoard(statusHistory);
    }

    @Bean
    public StatusDispatcher statusDispatcher(PresentationLoop loop, StatusBoard board) {
        StatusDispatcher dispatcher = new StatusDispatcher(loop);
        dispatcher.addObserver(board);
        return dispatcher;
    }

    @Bean
    public BatchWriter batchWriter(EventStore store, ReadModelRefresher refresher, MetricsService metrics,
                                   CamLinkPropertiesInitializer properties) {
        return new BatchWriter(store, refresher, metrics, batchSize,
                duration("camlink.writer.batch-delay", BatchWriter.DEFAULT_BATCH_DELAY));
    }

    @Bean
    public PipelineLauncher pipelineLauncher(CamLinkPropertiesInitializer properties) {
        PipelineLauncher defaults = PipelineLauncher.defaults();
        Map<String, String> env = new LinkedHashMap<>(defaults.environment());
        env.putAll(CamLinkProperties.get().getSubProperties("camlink.pipeline.env."));
        List<String> command = Arrays.stream(pipelineCommand.trim().split("\\s+")).toList();
        return new PipelineLauncher(command, env,
                duration("camlink.pipeline.probe-window", defaults.probeWindow()),
                duration("camlink.pipeline.stop-timeout", defaults.stopTimeout()));
    }

    @Bean
    public CameraCatalog cameraCatalog() throws IOException {
        Path file = Paths.get(camerasFile);
        if (Files.isRegularFile(file)) {
            return CameraCatalog.load(file, CameraCatalog.DEFAULT_TEMPLATES);
        }
        log.warn("Camera file {} not found, using bundled {}", file.toAbsolutePath(), BUNDLED_CAMERAS);
        ClassPathResource bundled = new ClassPathResource(BUNDLED_CAMERAS);
        String json = new String(bundled.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        return CameraCatalog.fromJson(json, CameraCatalog.DEFAULT_TEMPLATES, "classpath:" + BUNDLED_CAMERAS);
    }

    @Bean
    public ConnectionSessionManager connectionSessionManager(CameraCatalog catalog, PipelineLauncher launcher,
                                                             StatusDispatcher status, PresentationLoop loop,
                                                             MetricsService metrics) {
        return new ConnectionSessionManager(catalog, new ProcessPipelineConnectionFactory(launcher),
                status, loop, metrics);
    }

    @Bean
    public SessionCommandDispatcher sessionCommandDispatcher(ConnectionSessionManager manager,
                                                             PresentationLoop loop) {
        return new SessionCommandDispatcher(manager, loop);
    }

    @Bean
    public IngestionWorker ingestionWorker(EventCache cache, ReadModelRefresher refresher, BatchWriter writer,
                                           StatusDispatcher status, SessionCommandDispatcher sessions,
                                           MetricsService metrics, CamLinkPropertiesInitializer properties) {
        return new IngestionWorker(cache, refresher, writer, status, sessions, metrics,
                duration("camlink.ingestion.wake-interval", IngestionWorker.DEFAULT_WAKE_INTERVAL));
    }

    @Bean
    public BrokerConfig brokerConfig(CamLinkPropertiesInitializer properties) {
        BrokerConfig config = new BrokerConfig();
        config.setBrokerId(brokerId);
        config.setBrokerType(BrokerConfig.BrokerType.valueOf(brokerType.trim().toUpperCase()));
        config.setConnectionUri(brokerUrl);
        config.setUsername(brokerUsername.isBlank() ? null : brokerUsername);
        config.setPassword(brokerPassword.isBlank() ? null : brokerPassword);
        config.setClientId(brokerClientId);
        config.setReconnectIntervalSeconds(reconnectIntervalSeconds);
        config.setProperties(CamLinkProperties.get().getSubProperties("camlink.broker.properties."));
        return config;
    }

    @Bean
    public PubSubGateway pubSubGateway(BrokerConfig brokerConfig, IngestionWorker ingestion,
                                       StatusDispatcher status) {
        PubSubGateway gateway = new PubSubGateway(brokerConfig, topicPrefix, ingestion, status, publishStatus);
        status.addObserver(gateway);
        return gateway;
    }

    @Bean
    public ProcessTerminator processTerminator() {
        return ProcessTerminator.HALT;
    }

    @Bean(destroyMethod = "")
    public ShutdownCoordinator shutdownCoordinator(IngestionWorker ingestion, BatchWriter writer,
                                                   PubSubGateway gateway, SessionCommandDispatcher sessions,
                                                   EventStore store, PresentationLoop loop,
                                                   ProcessTerminator terminator,
                                                   CamLinkPropertiesInitializer properties) {
        return ShutdownCoordinator.standard(ingestion, writer, gateway, sessions, store, loop,
                duration("camlink.shutdown.deadline", ShutdownCoordinator.DEFAULT_DEADLINE), terminator);
    }
}
