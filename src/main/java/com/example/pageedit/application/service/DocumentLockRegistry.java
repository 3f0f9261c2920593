package com.example.pageedit.application.service;

import com.example.pageedit.application.exception.DocumentBusyException;
import com.example.pageedit.config.PageEditProperties;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out exclusive per-document leases. A structural edit holds the lease of every document it
 * touches from validation until its last commit, so two edits never bump from the same current version.
 */
@Component
public class DocumentLockRegistry {

    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long timeoutMillis;

    public DocumentLockRegistry(PageEditProperties properties) {
        this.timeoutMillis = properties.getLockTimeout().toMillis();
    }

    /**
     * Locks the given documents in ascending id order.
     *
     * @param documentIds documents the caller is about to edit
     * @return lease releasing every lock on close
     * @throws DocumentBusyException when a lock is not acquired within the configured timeout
     */
    public DocumentLease acquire(Collection<UUID> documentIds) {
        Deque<ReentrantLock> held = new ArrayDeque<>();
        for (UUID documentId : new TreeSet<>(documentIds)) {
            ReentrantLock lock = locks.computeIfAbsent(documentId, id -> new ReentrantLock());
            boolean acquired;
            try {
                acquired = lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                release(held);
                throw new DocumentBusyException(documentId, e);
            }
            if (!acquired) {
                release(held);
                throw new DocumentBusyException(documentId);
            }
            held.push(lock);
        }
        return new DocumentLease(held);
    }

    private static void release(Deque<ReentrantLock> held) {
        while (!held.isEmpty()) {
            held.pop().unlock();
        }
    }

    /**
     * Exclusive access token for one or more documents.
     */
    public static final class DocumentLease implements AutoCloseable {

        private final Deque<ReentrantLock> held;

        private DocumentLease(Deque<ReentrantLock> held) {
            this.held = held;
        }

        @Override
        public void close() {
            release(held);
        }
    }
}
