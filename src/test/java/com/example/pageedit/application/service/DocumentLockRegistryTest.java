package com.example.pageedit.application.service;

import com.example.pageedit.application.exception.DocumentBusyException;
import com.example.pageedit.application.service.DocumentLockRegistry.DocumentLease;
import com.example.pageedit.config.PageEditProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for per-document leases.
 */
class DocumentLockRegistryTest {

    private final DocumentLockRegistry registry = new DocumentLockRegistry(properties(Duration.ofMillis(100)));

    @Test
    void leaseBlocksOtherThreadsUntilClosed() throws Exception {
        UUID documentId = UUID.randomUUID();

        try (DocumentLease ignored = registry.acquire(List.of(documentId))) {
            Throwable failure = acquireOnOtherThread(documentId);
            assertThat(failure).isInstanceOf(DocumentBusyException.class);
        }

        assertThat(acquireOnOtherThread(documentId)).isNull();
    }

    @Test
    void failedAcquireReleasesLocksAlreadyTaken() throws Exception {
        UUID first = new UUID(0, 1);
        UUID second = new UUID(0, 2);

        try (DocumentLease ignored = registry.acquire(List.of(second))) {
            assertThat(acquireOnOtherThread(first, second)).isInstanceOf(DocumentBusyException.class);
        }

        assertThat(acquireOnOtherThread(first)).isNull();
    }

    @Test
    void leaseIsReentrantForTheHoldingThread() {
        UUID documentId = UUID.randomUUID();

        try (DocumentLease outer = registry.acquire(List.of(documentId));
             DocumentLease inner = registry.acquire(List.of(documentId))) {
            assertThat(inner).isNotSameAs(outer);
        }
    }

    private Throwable acquireOnOtherThread(UUID... documentIds) throws InterruptedException {
        try {
            CompletableFuture.runAsync(() -> registry.acquire(List.of(documentIds)).close())
                    .get(5, TimeUnit.SECONDS);
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (TimeoutException e) {
            throw new AssertionError("lock attempt did not time out", e);
        }
    }

    private static PageEditProperties properties(Duration timeout) {
        PageEditProperties properties = new PageEditProperties();
        properties.setLockTimeout(timeout);
        return properties;
    }
}
