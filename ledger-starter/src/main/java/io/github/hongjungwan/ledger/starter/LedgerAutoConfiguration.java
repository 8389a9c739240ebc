package io.github.hongjungwan.ledger.starter;

import io.github.hongjungwan.ledger.api.DocumentLedger;
import io.github.hongjungwan.ledger.api.DocumentLedgerFactory;
import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.core.cache.VerificationCache;
import io.github.hongjungwan.ledger.core.chain.ChainVerifier;
import io.github.hongjungwan.ledger.core.diagnostics.LedgerDoctor;
import io.github.hongjungwan.ledger.core.internal.DefaultDocumentLedger;
import io.github.hongjungwan.ledger.core.metrics.LedgerMetrics;
import io.github.hongjungwan.ledger.spi.BlobStore;
import io.github.hongjungwan.ledger.spi.KeyService;
import io.github.hongjungwan.ledger.spi.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Document Ledger Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(LedgerProperties.class)
@ConditionalOnProperty(prefix = "document-ledger", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class LedgerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LedgerConfig ledgerConfig(LedgerProperties properties) {
        return properties.toConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyService keyService(LedgerConfig config) {
        return DocumentLedgerFactory.createKeyService(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public BlobStore blobStore(LedgerConfig config) {
        return DocumentLedgerFactory.createBlobStore(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerStore ledgerStore(LedgerConfig config) {
        return DocumentLedgerFactory.createLedgerStore(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public VerificationCache verificationCache(LedgerConfig config) {
        return new VerificationCache(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerMetrics ledgerMetrics() {
        return new LedgerMetrics();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChainVerifier chainVerifier(LedgerConfig config, LedgerStore ledgerStore, KeyService keyService) {
        return new ChainVerifier(config, ledgerStore, keyService);
    }

    @Bean
    @ConditionalOnMissingBean(DocumentLedger.class)
    public DefaultDocumentLedger documentLedger(
            LedgerConfig config,
            KeyService keyService,
            BlobStore blobStore,
            LedgerStore ledgerStore,
            VerificationCache cache,
            LedgerMetrics metrics
    ) {
        return DocumentLedgerFactory.builder()
                .config(config)
                .keyService(keyService)
                .blobStore(blobStore)
                .ledgerStore(ledgerStore)
                .cache(cache)
                .metrics(metrics)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerDoctor ledgerDoctor(LedgerConfig config, KeyService keyService, BlobStore blobStore,
                                     ChainVerifier chainVerifier) {
        return new LedgerDoctor(config, keyService, blobStore, chainVerifier);
    }

    @Bean
    public LedgerLifecycle ledgerLifecycle(LedgerDoctor doctor, VerificationCache cache, LedgerProperties properties) {
        return new LedgerLifecycle(doctor, cache, properties);
    }

    /**
     * 기동 시 자가 진단, 실행 중 캐시 정리 스케줄을 관리하는 SmartLifecycle 구현체.
     */
    static class LedgerLifecycle implements SmartLifecycle {

        private final LedgerDoctor doctor;
        private final VerificationCache cache;
        private final LedgerProperties properties;
        private volatile ScheduledExecutorService cleanupScheduler;
        private volatile LedgerDoctor.DiagnosticReport lastReport;
        private volatile boolean running = false;

        LedgerLifecycle(LedgerDoctor doctor, VerificationCache cache, LedgerProperties properties) {
            this.doctor = doctor;
            this.cache = cache;
            this.properties = properties;
        }

        @Override
        public void start() {
            log.info("Starting document ledger...");

            if (properties.isDiagnoseOnStartup()) {
                lastReport = doctor.diagnose();
                if (lastReport.hasFailures()) {
                    log.warn("Diagnostic failures detected - ledger operations may fail until resolved");
                }
            }

            Duration interval = properties.getCache().getCleanupInterval();
            cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "document-ledger-cache-cleanup");
                t.setDaemon(true);
                return t;
            });
            cleanupScheduler.scheduleAtFixedRate(
                    () -> {
                        try {
                            cache.clearExpired();
                        } catch (Exception e) {
                            log.error("Failed to clear expired verification cache entries", e);
                        }
                    },
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );

            running = true;
            log.info("Document ledger started (cache cleanup every {}ms)", interval.toMillis());
        }

        @Override
        public void stop() {
            log.info("Stopping document ledger...");
            ScheduledExecutorService scheduler = cleanupScheduler;
            if (scheduler != null) {
                scheduler.shutdown();
                try {
                    if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                        scheduler.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    scheduler.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            running = false;
            log.info("Document ledger stopped");
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }

        LedgerDoctor.DiagnosticReport getLastReport() {
            return lastReport;
        }
    }
}
