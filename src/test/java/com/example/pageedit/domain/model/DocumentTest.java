package com.example.pageedit.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for version numbering, commit and side data rules on {@link Document}.
 */
class DocumentTest {

    @Test
    void versionsAreNumberedSequentiallyAndCommitArchivesPredecessor() {
        Document document = Document.create("report", "deu", null);
        DocumentVersion first = document.appendVersion(List.of("deu", "deu"));
        document.commit(first);

        DocumentVersion second = document.appendVersion(List.of("deu"));

        assertThat(second.number()).isEqualTo(2);
        assertThat(second.status()).isEqualTo(VersionStatus.PENDING);
        assertThat(document.currentVersion()).contains(first);

        document.commit(second);

        assertThat(document.currentVersion()).contains(second);
        assertThat(first.isArchived()).isTrue();
        assertThat(second.pages()).extracting(Page::number).containsExactly(1);
    }

    @Test
    void committingTwiceIsRejected() {
        Document document = Document.create("report", "deu", null);
        DocumentVersion version = document.appendVersion(List.of("deu"));
        document.commit(version);

        assertThrows(IllegalStateException.class, () -> document.commit(version));
    }

    @Test
    void aggregateTextJoinsNonBlankPageTexts() {
        Document document = Document.create("report", "deu", null);
        DocumentVersion version = document.appendVersion(List.of("deu", "deu", "deu"));

        version.updateText(Arrays.asList(" page 1 ", null, "page 3"));

        assertThat(version.page(1).text()).contains("page 1");
        assertThat(version.page(2).text()).isEmpty();
        assertThat(version.text()).contains("page 1 page 3");
    }

    @Test
    void archivedVersionRejectsText() {
        Document document = Document.create("report", "deu", null);
        DocumentVersion first = document.appendVersion(List.of("deu"));
        document.commit(first);
        document.commit(document.appendVersion(List.of("deu")));

        assertThrows(IllegalStateException.class, () -> first.updatePageText(1, "late"));
    }

    @Test
    void pageLookupIsOneBased() {
        Document document = Document.create("report", "deu", null);
        DocumentVersion version = document.appendVersion(List.of("deu", "eng"));

        assertThat(version.page(2).lang()).isEqualTo("eng");
        assertThrows(IllegalArgumentException.class, () -> version.page(0));
        assertThrows(IllegalArgumentException.class, () -> version.page(3));
    }
}
