package com.example.pageedit.interfaces.api.dto;

import java.util.List;
import java.util.UUID;

/**
 * Request body moving pages into new documents under a folder.
 *
 * @param pages      pages to move
 * @param dst        destination folder
 * @param singlePage one document per page when {@code true}
 */
public record MoveToFolderRequest(List<UUID> pages, UUID dst, boolean singlePage) {
}
