package com.example.pageedit.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mutable container owning an append-only history of {@link DocumentVersion}s.
 */
public final class Document {

    private final UUID id;
    private final String title;
    private final String lang;
    private final UUID folderId;
    // Appended under the document lease, read without it.
    private final List<DocumentVersion> versions = new CopyOnWriteArrayList<>();

    private Document(UUID id, String title, String lang, UUID folderId) {
        this.id = id;
        this.title = title;
        this.lang = lang;
        this.folderId = folderId;
    }

    public static Document create(String title, String lang, UUID folderId) {
        return new Document(UUID.randomUUID(), title, lang, folderId);
    }

    public UUID id() {
        return id;
    }

    public String title() {
        return title;
    }

    public String lang() {
        return lang;
    }

    public UUID folderId() {
        return folderId;
    }

    public List<DocumentVersion> versions() {
        return Collections.unmodifiableList(versions);
    }

    public Optional<DocumentVersion> version(UUID versionId) {
        return versions.stream().filter(version -> version.id().equals(versionId)).findFirst();
    }

    public Optional<DocumentVersion> currentVersion() {
        return versions.stream().filter(DocumentVersion::isCurrent).findFirst();
    }

    /**
     * Appends a pending version whose pages carry the given languages, one entry per page.
     *
     * @param pageLanguages language of each new page in page order
     * @return appended pending version
     */
    public DocumentVersion appendVersion(List<String> pageLanguages) {
        if (pageLanguages.isEmpty()) {
            throw new IllegalArgumentException("A version needs at least one page");
        }
        int nextNumber = versions.isEmpty() ? 1 : versions.get(versions.size() - 1).number() + 1;
        DocumentVersion version = DocumentVersion.pending(id, nextNumber, pageLanguages);
        versions.add(version);
        return version;
    }

    /**
     * Makes {@code version} the current one and archives the version it supersedes.
     *
     * @param version pending version of this document
     */
    public void commit(DocumentVersion version) {
        if (!versions.contains(version)) {
            throw new IllegalArgumentException(version + " does not belong to document " + id);
        }
        Optional<DocumentVersion> previous = currentVersion();
        version.markCurrent();
        previous.ifPresent(DocumentVersion::markArchived);
    }

    @Override
    public String toString() {
        return "Document[" + id + ", " + title + ", " + versions.size() + " versions]";
    }
}
