package com.example.pageedit.domain.model;

import java.util.UUID;

/**
 * Requested move of one page inside its version.
 *
 * @param pageId    page being moved
 * @param oldNumber its current 1-based position
 * @param newNumber its 1-based position in the new version
 */
public record PageReorder(UUID pageId, int oldNumber, int newNumber) {
}
