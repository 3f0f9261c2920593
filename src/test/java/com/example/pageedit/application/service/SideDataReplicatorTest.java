package com.example.pageedit.application.service;

import com.example.pageedit.domain.model.Document;
import com.example.pageedit.domain.model.DocumentVersion;
import com.example.pageedit.domain.model.PageMap;
import com.example.pageedit.domain.model.PageOrigin;
import com.example.pageedit.domain.model.PagePath;
import com.example.pageedit.domain.port.DocumentStorage;
import com.example.pageedit.domain.service.PageMapBuilder;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.mockito.Mockito;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;

/**
 * Unit tests for side data replication along page maps.
 */
class SideDataReplicatorTest {

    private final DocumentStorage storage = Mockito.mock(DocumentStorage.class);
    private final SideDataReplicator replicator = new SideDataReplicator(storage);

    @Test
    void textFollowsRetainedPages() {
        Document document = Document.create("doc", "deu", null);
        DocumentVersion oldVersion = version(document, 3);
        oldVersion.updateText(List.of("one", "two", "three"));
        PageMap map = PageMapBuilder.delete(3, Set.of(2));
        DocumentVersion newVersion = version(document, map.size());

        replicator.replicateText(oldVersion, newVersion, map);

        assertThat(newVersion.page(1).text()).contains("one");
        assertThat(newVersion.page(2).text()).contains("three");
        assertThat(newVersion.text()).contains("one three");
    }

    @Test
    void textOfInsertedPagesComesFromTheirSourceVersion() {
        DocumentVersion destination = version(Document.create("b", "deu", null), 2);
        destination.updateText(List.of("b1", "b2"));
        DocumentVersion source = version(Document.create("a", "deu", null), 2);
        source.updateText(List.of("a1", "a2"));
        PageMap map = PageMapBuilder.insertAtPosition(1, List.of(2), 2);
        DocumentVersion target = version(Document.create("b", "deu", null), map.size());

        replicator.replicateText(destination, source, target, map);

        assertThat(target.pages()).extracting(page -> page.text().orElse(null)).containsExactly("b1", "a2", "b2");
    }

    @Test
    void missingSourceVersionIsRejected() {
        PageMap map = PageMapBuilder.extract(List.of(1));
        DocumentVersion target = version(Document.create("a", "deu", null), 1);

        assertThrows(IllegalArgumentException.class, () -> replicator.replicateText(null, null, target, map));
    }

    @Test
    void artifactsAreCopiedOnlyForRequestedOrigin() {
        Document document = Document.create("doc", "deu", null);
        DocumentVersion oldVersion = version(document, 2);
        PageMap map = PageMapBuilder.insertAtPosition(2, List.of(1), 2);
        DocumentVersion newVersion = version(document, map.size());
        BDDMockito.given(storage.copyPage(any(PagePath.class), any(PagePath.class))).willReturn(true, false);

        int copied = replicator.replicateArtifacts(oldVersion, newVersion, map, PageOrigin.RETAINED);

        assertThat(copied).isEqualTo(1);
        Mockito.verify(storage).copyPage(oldVersion.page(1).path(), newVersion.page(1).path());
        Mockito.verify(storage).copyPage(oldVersion.page(2).path(), newVersion.page(2).path());
        Mockito.verifyNoMoreInteractions(storage);
    }

    private static DocumentVersion version(Document document, int pages) {
        return document.appendVersion(Collections.nCopies(pages, "deu"));
    }
}
