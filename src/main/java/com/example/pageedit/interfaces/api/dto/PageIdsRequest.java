package com.example.pageedit.interfaces.api.dto;

import java.util.List;
import java.util.UUID;

/**
 * Request body naming a set of pages.
 */
public record PageIdsRequest(List<UUID> pages) {
}
