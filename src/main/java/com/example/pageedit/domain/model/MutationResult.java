package com.example.pageedit.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Outcome of a structural edit for one document: the version that became current.
 *
 * @param documentId         edited or created document
 * @param versionId          newly committed version
 * @param versionNumber      number of the new version
 * @param pageCount          page count of the new version
 * @param pageIds            ids of the new version's pages in page order
 * @param replicatedChannels side data carried over from the previous version(s)
 */
public record MutationResult(
        UUID documentId,
        UUID versionId,
        int versionNumber,
        int pageCount,
        List<UUID> pageIds,
        Set<SideDataChannel> replicatedChannels
) {

    public static MutationResult of(DocumentVersion version, Set<SideDataChannel> channels) {
        return new MutationResult(
                version.documentId(),
                version.id(),
                version.number(),
                version.pageCount(),
                version.pages().stream().map(Page::id).toList(),
                channels.isEmpty() ? EnumSet.noneOf(SideDataChannel.class) : EnumSet.copyOf(channels)
        );
    }
}
