package com.example.pageedit.application.service;

import com.example.pageedit.domain.exception.PageCountInvariantException;
import com.example.pageedit.domain.model.Document;
import com.example.pageedit.domain.model.DocumentVersion;
import com.example.pageedit.domain.model.Page;
import com.example.pageedit.domain.port.DocumentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

/**
 * Application-layer service creating new document versions and switching the current one.
 * Callers must hold the document's lease from {@link DocumentLockRegistry}.
 */
@Service
public class VersionManager {

    private static final Logger log = LoggerFactory.getLogger(VersionManager.class);

    private final DocumentRepository documentRepository;

    public VersionManager(DocumentRepository documentRepository) {
        this.documentRepository = documentRepository;
    }

    /**
     * Appends a pending version with {@code targetPageCount} placeholder pages numbered 1..N.
     *
     * @param document        document receiving the version
     * @param targetPageCount page count of the new version
     * @return pending version
     * @throws PageCountInvariantException when the count is below 1
     */
    public DocumentVersion bump(Document document, int targetPageCount) {
        if (targetPageCount < 1) {
            throw new PageCountInvariantException(targetPageCount);
        }
        DocumentVersion version = document.appendVersion(Collections.nCopies(targetPageCount, document.lang()));
        documentRepository.save(document);
        log.debug("Bumped {} to pending version {} with {} pages", document.id(), version.number(), targetPageCount);
        return version;
    }

    /**
     * Appends a pending version seeded, in the given order, from an existing page set. The seeded
     * pages keep their language and are renumbered from 1; text is left for the replicator.
     *
     * @param document document receiving the version
     * @param pages    pages the new version is built from
     * @return pending version
     */
    public DocumentVersion bumpFromPages(Document document, List<Page> pages) {
        if (pages.isEmpty()) {
            throw new PageCountInvariantException(0);
        }
        DocumentVersion version = document.appendVersion(pages.stream().map(Page::lang).toList());
        documentRepository.save(document);
        log.debug("Bumped {} to pending version {} seeded from {} pages", document.id(), version.number(), pages.size());
        return version;
    }

    /**
     * Makes the pending version current and archives its predecessor in one save.
     *
     * @param document owning document
     * @param version  pending version whose payload and side data are complete
     */
    public void commit(Document document, DocumentVersion version) {
        document.commit(version);
        documentRepository.save(document);
        log.info("Document {} is now at version {} ({} pages)", document.id(), version.number(), version.pageCount());
    }
}
