package com.example.pageedit.application.service;

import com.example.pageedit.application.service.DocumentLockRegistry.DocumentLease;
import com.example.pageedit.domain.exception.ArchivedPageEditException;
import com.example.pageedit.domain.exception.DocumentNotFoundException;
import com.example.pageedit.domain.exception.PageNotFoundException;
import com.example.pageedit.domain.model.Document;
import com.example.pageedit.domain.model.DocumentVersion;
import com.example.pageedit.domain.model.PageLocation;
import com.example.pageedit.domain.model.PageView;
import com.example.pageedit.domain.port.DocumentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Application-layer service for page lookups and text population.
 * Text written here lands on the current version only; archived versions are read-only.
 */
@Service
public class PageQueryService {

    private static final Logger log = LoggerFactory.getLogger(PageQueryService.class);

    private final DocumentRepository documentRepository;
    private final DocumentLockRegistry lockRegistry;

    public PageQueryService(DocumentRepository documentRepository, DocumentLockRegistry lockRegistry) {
        this.documentRepository = documentRepository;
        this.lockRegistry = lockRegistry;
    }

    /**
     * @param pageId page of any version
     * @return the page, flagged when its version is no longer current
     */
    public PageView get(UUID pageId) {
        return PageView.of(locate(pageId));
    }

    /**
     * @param documentId document to list
     * @return pages of the current version ordered by number
     */
    public List<PageView> listCurrentPages(UUID documentId) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        DocumentVersion current = document.currentVersion()
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        return current.pages().stream()
                .map(page -> PageView.of(new PageLocation(document, current, page)))
                .toList();
    }

    /**
     * Stores recognized text for a page and refreshes the version's aggregate text.
     *
     * @param pageId page of the current version
     * @param text   page text, {@code null} clears it
     * @return the updated page
     * @throws ArchivedPageEditException when the page belongs to a superseded version
     */
    public PageView updateText(UUID pageId, String text) {
        UUID documentId = locate(pageId).document().id();
        try (DocumentLease ignored = lockRegistry.acquire(List.of(documentId))) {
            PageLocation location = locate(pageId);
            if (location.isArchived()) {
                throw new ArchivedPageEditException(pageId);
            }
            location.version().updatePageText(location.page().number(), text);
            documentRepository.save(location.document());
            log.debug("Stored text for page {} of {}", location.page().number(), location.version());
            return PageView.of(location);
        }
    }

    private PageLocation locate(UUID pageId) {
        return documentRepository.findPage(pageId).orElseThrow(() -> new PageNotFoundException(pageId));
    }
}
