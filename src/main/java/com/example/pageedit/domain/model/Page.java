package com.example.pageedit.domain.model;

import java.util.Optional;
import java.util.UUID;

/**
 * A single page of a {@link DocumentVersion}.
 * Text is side data filled in after the version is created, either by replication from an older
 * version or by the external OCR collaborator.
 */
public final class Page {

    private final UUID id;
    private final UUID documentId;
    private final UUID versionId;
    private final int versionNumber;
    private final int number;
    private final String lang;
    private volatile String text;

    Page(UUID documentId, UUID versionId, int versionNumber, int number, String lang) {
        this.id = UUID.randomUUID();
        this.documentId = documentId;
        this.versionId = versionId;
        this.versionNumber = versionNumber;
        this.number = number;
        this.lang = lang;
    }

    public UUID id() {
        return id;
    }

    public UUID documentId() {
        return documentId;
    }

    public UUID versionId() {
        return versionId;
    }

    public int versionNumber() {
        return versionNumber;
    }

    public int number() {
        return number;
    }

    public String lang() {
        return lang;
    }

    public Optional<String> text() {
        return Optional.ofNullable(text);
    }

    /**
     * @return location of this page's rendering artifacts
     */
    public PagePath path() {
        return new PagePath(documentId, versionNumber, number);
    }

    void assignText(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return "Page[" + id + ", v" + versionNumber + "#" + number + "]";
    }
}
