package com.example.pageedit.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Snapshot of a document's pages and PDF payload.
 * The page list and payload never change once created; only text side data may be written,
 * and only until the version is archived.
 */
public final class DocumentVersion {

    private static final String PAYLOAD_FILE_NAME = "document.pdf";

    private final UUID id;
    private final UUID documentId;
    private final int number;
    private final List<Page> pages;
    private volatile String text;
    private volatile VersionStatus status;

    private DocumentVersion(UUID documentId, int number, List<String> pageLanguages) {
        this.id = UUID.randomUUID();
        this.documentId = documentId;
        this.number = number;
        List<Page> created = new ArrayList<>(pageLanguages.size());
        for (int i = 0; i < pageLanguages.size(); i++) {
            created.add(new Page(documentId, id, number, i + 1, pageLanguages.get(i)));
        }
        this.pages = Collections.unmodifiableList(created);
        this.status = VersionStatus.PENDING;
    }

    static DocumentVersion pending(UUID documentId, int number, List<String> pageLanguages) {
        return new DocumentVersion(documentId, number, pageLanguages);
    }

    public UUID id() {
        return id;
    }

    public UUID documentId() {
        return documentId;
    }

    public int number() {
        return number;
    }

    public int pageCount() {
        return pages.size();
    }

    public List<Page> pages() {
        return pages;
    }

    /**
     * @param pageNumber 1-based page number
     * @return page at that position
     * @throws IllegalArgumentException when the number is outside 1..pageCount
     */
    public Page page(int pageNumber) {
        if (pageNumber < 1 || pageNumber > pages.size()) {
            throw new IllegalArgumentException("Version " + number + " has no page " + pageNumber);
        }
        return pages.get(pageNumber - 1);
    }

    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    public VersionStatus status() {
        return status;
    }

    public boolean isCurrent() {
        return status == VersionStatus.CURRENT;
    }

    public boolean isArchived() {
        return status == VersionStatus.ARCHIVED;
    }

    /**
     * @return storage path of the PDF payload of this version
     */
    public String payloadPath() {
        return "docs/" + documentId + "/v" + number + "/" + PAYLOAD_FILE_NAME;
    }

    /**
     * Stores one text per page, in page order, and rebuilds the aggregate text.
     *
     * @param pageTexts texts for pages 1..pageCount; {@code null} entries clear the page text
     */
    public void updateText(List<String> pageTexts) {
        ensureWritable();
        if (pageTexts.size() != pages.size()) {
            throw new IllegalArgumentException(
                    "Expected " + pages.size() + " page texts for version " + number + " but got " + pageTexts.size());
        }
        for (int i = 0; i < pages.size(); i++) {
            pages.get(i).assignText(normalize(pageTexts.get(i)));
        }
        rebuildAggregateText();
    }

    /**
     * Stores the text of a single page and rebuilds the aggregate text.
     *
     * @param pageNumber 1-based page number
     * @param pageText   new text, {@code null} to clear
     */
    public void updatePageText(int pageNumber, String pageText) {
        ensureWritable();
        page(pageNumber).assignText(normalize(pageText));
        rebuildAggregateText();
    }

    void markCurrent() {
        if (status != VersionStatus.PENDING) {
            throw new IllegalStateException("Only pending versions can be committed, version " + number + " is " + status);
        }
        status = VersionStatus.CURRENT;
    }

    void markArchived() {
        status = VersionStatus.ARCHIVED;
    }

    private void ensureWritable() {
        if (!status.acceptsSideData()) {
            throw new IllegalStateException("Version " + number + " of document " + documentId + " is archived");
        }
    }

    private void rebuildAggregateText() {
        text = pages.stream()
                .map(Page::text)
                .flatMap(Optional::stream)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining(" "));
    }

    private static String normalize(String value) {
        return value == null ? null : value.strip();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof DocumentVersion version && version.id.equals(id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "DocumentVersion[" + documentId + " v" + number + ", " + pages.size() + " pages, " + status + "]";
    }
}
