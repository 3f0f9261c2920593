package com.example.pageedit.infrastructure.persistence;

import com.example.pageedit.domain.model.Document;
import com.example.pageedit.domain.model.DocumentVersion;
import com.example.pageedit.domain.model.Page;
import com.example.pageedit.domain.model.PageLocation;
import com.example.pageedit.domain.port.DocumentRepository;

import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link DocumentRepository} keeping documents in memory with a page id index.
 */
@Repository
public class InMemoryDocumentRepository implements DocumentRepository {

    private final Map<UUID, Document> documents = new ConcurrentHashMap<>();
    private final Map<UUID, PageKey> pageIndex = new ConcurrentHashMap<>();

    @Override
    public Document save(Document document) {
        documents.put(document.id(), document);
        for (DocumentVersion version : document.versions()) {
            for (Page page : version.pages()) {
                pageIndex.putIfAbsent(page.id(), new PageKey(document.id(), version.id()));
            }
        }
        return document;
    }

    @Override
    public Optional<Document> findById(UUID documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public Optional<PageLocation> findPage(UUID pageId) {
        PageKey key = pageIndex.get(pageId);
        if (key == null) {
            return Optional.empty();
        }
        Document document = documents.get(key.documentId());
        return document.version(key.versionId())
                .flatMap(version -> version.pages().stream()
                        .filter(page -> page.id().equals(pageId))
                        .findFirst()
                        .map(page -> new PageLocation(document, version, page)));
    }

    @Override
    public List<Document> findByFolder(UUID folderId) {
        return documents.values().stream()
                .filter(document -> folderId.equals(document.folderId()))
                .sorted(Comparator.comparing(Document::title).thenComparing(document -> document.id().toString()))
                .toList();
    }

    private record PageKey(UUID documentId, UUID versionId) {
    }
}
