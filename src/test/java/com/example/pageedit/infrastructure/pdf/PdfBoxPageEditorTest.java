package com.example.pageedit.infrastructure.pdf;

import com.example.pageedit.domain.service.PageMapBuilder;
import com.example.pageedit.infrastructure.exception.PdfProcessingException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static com.example.pageedit.TestPdfs.createPdf;
import static com.example.pageedit.TestPdfs.pageTexts;
import static com.example.pageedit.TestPdfs.rotations;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the PDFBox page editor against PDFs built in memory.
 */
class PdfBoxPageEditorTest {

    private final PdfBoxPageEditor editor = new PdfBoxPageEditor();

    @Test
    void removeDropsSelectedPages() {
        byte[] pdf = createPdf("page 1", "page 2", "page 3");

        byte[] result = editor.remove(pdf, List.of(1, 2));

        assertThat(pageTexts(result)).containsExactly("page 3");
    }

    @Test
    void reorderFollowsPageMap() {
        byte[] pdf = createPdf("fish", "cat");

        byte[] result = editor.reorder(pdf, PageMapBuilder.reorder(Map.of(1, 2, 2, 1), 2));

        assertThat(pageTexts(result)).containsExactly("cat", "fish");
    }

    @Test
    void rotateIsRelativeToCurrentOrientation() {
        byte[] pdf = createPdf("a", "b");

        byte[] once = editor.rotate(pdf, Map.of(1, 90));
        byte[] twice = editor.rotate(once, Map.of(1, 270, 2, -90));

        assertThat(rotations(once)).containsExactly(90, 0);
        assertThat(rotations(twice)).containsExactly(0, 270);
        assertThat(pageTexts(twice)).containsExactly("a", "b");
    }

    @Test
    void rotateReducesLargeAnglesBeforeAdding() {
        byte[] pdf = editor.rotate(createPdf("a"), Map.of(1, 90));

        byte[] result = editor.rotate(pdf, Map.of(1, 90 * 23860929));

        assertThat(rotations(result)).containsExactly(180);
    }

    @Test
    void insertPlacesSourcePagesAfterPosition() {
        byte[] destination = createPdf("b1", "b2", "b3");
        byte[] source = createPdf("a1", "a2", "a3");

        byte[] result = editor.insert(destination, source, List.of(3, 1), 1);

        assertThat(pageTexts(result)).containsExactly("b1", "a3", "a1", "b2", "b3");
    }

    @Test
    void extractCopiesPagesInGivenOrder() {
        byte[] pdf = createPdf("one", "two", "three");

        byte[] result = editor.extract(pdf, List.of(3, 2));

        assertThat(pageTexts(result)).containsExactly("three", "two");
    }

    @Test
    void sourcePayloadIsNotModified() {
        byte[] pdf = createPdf("one", "two");
        byte[] copy = pdf.clone();

        editor.remove(pdf, List.of(1));
        editor.rotate(pdf, Map.of(2, 180));

        assertThat(pdf).isEqualTo(copy);
    }

    @Test
    void unreadablePayloadFailsWithProcessingException() {
        byte[] garbage = "not a pdf".getBytes(StandardCharsets.UTF_8);

        assertThrows(PdfProcessingException.class, () -> editor.remove(garbage, List.of(1)));
    }
}
