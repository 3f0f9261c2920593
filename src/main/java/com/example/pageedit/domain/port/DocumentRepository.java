package com.example.pageedit.domain.port;

import com.example.pageedit.domain.model.Document;
import com.example.pageedit.domain.model.PageLocation;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for documents, their versions and pages.
 */
public interface DocumentRepository {

    /**
     * Stores the document together with every version and page it owns.
     *
     * @param document document to persist
     * @return the persisted document
     */
    Document save(Document document);

    Optional<Document> findById(UUID documentId);

    /**
     * Resolves a page of any version, current or archived.
     *
     * @param pageId page identifier
     * @return the page with its owning version and document
     */
    Optional<PageLocation> findPage(UUID pageId);

    List<Document> findByFolder(UUID folderId);
}
