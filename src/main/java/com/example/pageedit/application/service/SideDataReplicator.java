package com.example.pageedit.application.service;

import com.example.pageedit.domain.model.DocumentVersion;
import com.example.pageedit.domain.model.PageMap;
import com.example.pageedit.domain.model.PageMapping;
import com.example.pageedit.domain.model.PageOrigin;
import com.example.pageedit.domain.port.DocumentStorage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Carries per-page side data from old versions into a new one following a {@link PageMap}.
 * Rendering artifacts are copied in storage; text is copied onto the new version's pages.
 */
@Service
public class SideDataReplicator {

    private static final Logger log = LoggerFactory.getLogger(SideDataReplicator.class);

    private final DocumentStorage storage;

    public SideDataReplicator(DocumentStorage storage) {
        this.storage = storage;
    }

    /**
     * Copies the artifacts of every mapping with the given origin from {@code from} into {@code to}.
     * Pages without artifacts are skipped; the renderer creates them on first access.
     *
     * @param from   version the mapped old numbers refer to
     * @param to     new version
     * @param map    page map of the new version
     * @param origin which mappings to copy
     * @return number of pages whose artifacts were copied
     */
    public int replicateArtifacts(DocumentVersion from, DocumentVersion to, PageMap map, PageOrigin origin) {
        int copied = 0;
        for (PageMapping mapping : map.withOrigin(origin)) {
            boolean present = storage.copyPage(
                    from.page(mapping.oldNumber()).path(),
                    to.page(mapping.newNumber()).path());
            if (present) {
                copied++;
            } else {
                log.debug("No artifacts for page {} of {}, left for lazy rendering", mapping.oldNumber(), from);
            }
        }
        return copied;
    }

    /**
     * Copies text for a map whose pages all come from the document's previous version.
     *
     * @param oldVersion previous version
     * @param newVersion new version
     * @param map        page map of the new version
     */
    public void replicateText(DocumentVersion oldVersion, DocumentVersion newVersion, PageMap map) {
        replicateText(oldVersion, null, newVersion, map);
    }

    /**
     * Gathers the page texts of the new version in position order and stores them, which also
     * rebuilds the aggregate text.
     *
     * @param retainedFrom version read for {@link PageOrigin#RETAINED} mappings, may be {@code null}
     *                     when the map has none
     * @param insertedFrom version read for {@link PageOrigin#INSERTED} mappings, may be {@code null}
     *                     when the map has none
     * @param newVersion   version receiving the text
     * @param map          page map of the new version
     */
    public void replicateText(DocumentVersion retainedFrom,
                              DocumentVersion insertedFrom,
                              DocumentVersion newVersion,
                              PageMap map) {
        List<String> texts = new ArrayList<>(map.size());
        for (PageMapping mapping : map.mappings()) {
            DocumentVersion origin = mapping.isRetained() ? retainedFrom : insertedFrom;
            if (origin == null) {
                throw new IllegalArgumentException("No version supplied for " + mapping.origin() + " page " + mapping.oldNumber());
            }
            texts.add(origin.page(mapping.oldNumber()).text().orElse(null));
        }
        newVersion.updateText(texts);
        log.debug("Replicated text of {} pages into {}", texts.size(), newVersion);
    }
}
