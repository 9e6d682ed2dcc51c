package com.firesql.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Opens Firestore clients and keeps one per distinct {@link DatasourceSettings}.
 *
 * Idle clients expire after the configured TTL and are closed on eviction
 * and when the application shuts down.
 */
@Component
public class FirestoreDocumentStoreFactory implements DocumentStoreFactory {
    private static final Logger logger = LoggerFactory.getLogger(FirestoreDocumentStoreFactory.class);

    private final Cache<DatasourceSettings, Firestore> clients;

    public FirestoreDocumentStoreFactory(
            @Value("${firesql.datasource.client-cache-ttl:10m}") Duration clientTtl) {
        this.clients = Caffeine.newBuilder()
            .expireAfterAccess(clientTtl)
            .maximumSize(64)
            .executor(Runnable::run)
            .removalListener((DatasourceSettings settings, Firestore client, RemovalCause cause) ->
                close(settings, client, cause))
            .build();
        logger.info("Firestore client cache initialized with ttl {}", clientTtl);
    }

    @Override
    public DocumentStore connect(DatasourceSettings settings) {
        settings.validate();
        return new FirestoreDocumentStore(clients.get(settings, this::createClient));
    }

    private Firestore createClient(DatasourceSettings settings) {
        FirestoreOptions.Builder options = FirestoreOptions.newBuilder()
            .setProjectId(settings.getProjectId());
        if (settings.hasServiceAccount()) {
            try {
                options.setCredentials(GoogleCredentials.fromStream(
                    new ByteArrayInputStream(settings.getServiceAccount().getBytes(StandardCharsets.UTF_8))));
            } catch (IOException e) {
                throw new DatasourceConfigException("invalid service account, it is expected to be a JSON", e);
            }
        }
        try {
            Firestore client = options.build().getService();
            logger.info("Firestore client created for project {}", settings.getProjectId());
            return client;
        } catch (RuntimeException e) {
            logger.error("Failed to create Firestore client for project {}", settings.getProjectId(), e);
            throw new StoreException("failed to create firestore client: " + e.getMessage(), e);
        }
    }

    private static void close(DatasourceSettings settings, Firestore client, RemovalCause cause) {
        if (client == null) {
            return;
        }
        try {
            client.close();
            logger.info("Firestore client for project {} closed ({})",
                settings != null ? settings.getProjectId() : "unknown", cause);
        } catch (Exception e) {
            logger.error("Error closing Firestore client", e);
        }
    }

    long cachedClients() {
        clients.cleanUp();
        return clients.estimatedSize();
    }

    /**
     * Close all cached clients on shutdown.
     */
    @PreDestroy
    public void cleanup() {
        clients.invalidateAll();
        clients.cleanUp();
    }
}
