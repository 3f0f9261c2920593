package com.example.pageedit.domain.model;

import java.util.UUID;

/**
 * Storage location of one page's rendering artifacts (previews, hOCR, thumbnails).
 *
 * @param documentId    owning document
 * @param versionNumber version the page belongs to
 * @param pageNumber    1-based page number inside that version
 */
public record PagePath(UUID documentId, int versionNumber, int pageNumber) {

    public String sidecarDirectory() {
        return "sidecars/" + documentId + "/v" + versionNumber + "/pages/" + pageNumber;
    }
}
