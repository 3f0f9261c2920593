package com.example.pageedit.domain.model;

/**
 * Per-page information that lives outside the PDF payload and is carried between versions.
 */
public enum SideDataChannel {
    TEXT,
    ARTIFACTS
}
