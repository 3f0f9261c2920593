package com.example.pageedit.domain.model;

import java.util.UUID;

/**
 * Requested rotation of one page, clockwise, relative to its current orientation.
 */
public record PageRotation(UUID pageId, int angle) {
}
