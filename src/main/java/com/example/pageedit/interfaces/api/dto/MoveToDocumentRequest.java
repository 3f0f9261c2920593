package com.example.pageedit.interfaces.api.dto;

import java.util.List;
import java.util.UUID;

/**
 * Request body moving pages into an existing document.
 *
 * @param pages    pages to move
 * @param dst      destination document
 * @param position destination page the moved pages follow, 0 for the front; required
 */
public record MoveToDocumentRequest(List<UUID> pages, UUID dst, Integer position) {
}
