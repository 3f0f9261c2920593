package com.example.pageedit.infrastructure.pdf;

import com.example.pageedit.domain.model.PageMap;
import com.example.pageedit.infrastructure.exception.PdfProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Infrastructure component applying structural page edits to PDF payloads with PDFBox.
 * Every operation loads its input into memory and returns a freshly serialized payload; the input
 * bytes are never modified.
 */
@Component
public class PdfBoxPageEditor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxPageEditor.class);

    /**
     * Removes the given pages and keeps the survivors in their original order.
     *
     * @param payload   source PDF
     * @param positions 1-based pages to remove
     * @return new PDF without those pages
     */
    public byte[] remove(byte[] payload, Collection<Integer> positions) {
        return edit(payload, "remove pages " + positions, document -> {
            SortedSet<Integer> descending = new TreeSet<>((left, right) -> Integer.compare(right, left));
            descending.addAll(positions);
            for (Integer position : descending) {
                requirePage(document, position);
                document.removePage(position - 1);
            }
            return document;
        });
    }

    /**
     * Rebuilds the document so that new position {@code n} holds the old page the map assigns to it.
     *
     * @param payload source PDF
     * @param pageMap permutation of the source pages
     * @return reordered PDF
     */
    public byte[] reorder(byte[] payload, PageMap pageMap) {
        return compose("reorder pages", target -> {
            try (PDDocument source = load(payload)) {
                if (pageMap.size() != source.getNumberOfPages()) {
                    throw new IllegalArgumentException("Page map covers " + pageMap.size()
                            + " pages but the document has " + source.getNumberOfPages());
                }
                for (Integer oldNumber : pageMap.oldNumbers()) {
                    target.importPage(requirePage(source, oldNumber));
                }
                return save(target);
            }
        });
    }

    /**
     * Rotates pages relative to their current orientation.
     *
     * @param payload source PDF
     * @param angles  1-based page number to clockwise angle in degrees
     * @return PDF with the same pages in the same order
     */
    public byte[] rotate(byte[] payload, Map<Integer, Integer> angles) {
        return edit(payload, "rotate pages " + angles.keySet(), document -> {
            for (Map.Entry<Integer, Integer> entry : angles.entrySet()) {
                PDPage page = requirePage(document, entry.getKey());
                int rotation = Math.floorMod(page.getRotation() + Math.floorMod(entry.getValue(), 360), 360);
                page.setRotation(rotation);
                log.debug("Page {} rotated to {} degrees", entry.getKey(), rotation);
            }
            return document;
        });
    }

    /**
     * Inserts source pages into the destination immediately after {@code insertAt}.
     *
     * @param destination     destination PDF
     * @param source          PDF the pages are taken from
     * @param sourcePositions 1-based source pages in insertion order
     * @param insertAt        destination page the inserted pages follow, 0 for the front
     * @return destination PDF with the inserted pages
     */
    public byte[] insert(byte[] destination, byte[] source, List<Integer> sourcePositions, int insertAt) {
        return compose("insert pages " + sourcePositions + " after " + insertAt, target -> {
            try (PDDocument destinationDocument = load(destination);
                 PDDocument sourceDocument = load(source)) {
                int destinationPages = destinationDocument.getNumberOfPages();
                if (insertAt < 0 || insertAt > destinationPages) {
                    throw new IllegalArgumentException("Insert position " + insertAt + " is outside 0.." + destinationPages);
                }
                for (int number = 1; number <= insertAt; number++) {
                    target.importPage(destinationDocument.getPage(number - 1));
                }
                for (Integer position : sourcePositions) {
                    target.importPage(requirePage(sourceDocument, position));
                }
                for (int number = insertAt + 1; number <= destinationPages; number++) {
                    target.importPage(destinationDocument.getPage(number - 1));
                }
                return save(target);
            }
        });
    }

    /**
     * Copies the given pages, in the given order, into a new PDF.
     *
     * @param payload   source PDF
     * @param positions 1-based pages to keep
     * @return PDF holding only those pages
     */
    public byte[] extract(byte[] payload, List<Integer> positions) {
        return compose("extract pages " + positions, target -> {
            try (PDDocument source = load(payload)) {
                for (Integer position : positions) {
                    target.importPage(requirePage(source, position));
                }
                return save(target);
            }
        });
    }

    /**
     * Loads the payload, mutates it in place and serializes the result.
     */
    private byte[] edit(byte[] payload, String description, PdfEdit edit) {
        try (PDDocument document = load(payload)) {
            return save(edit.apply(document));
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to " + description + ".", e);
        }
    }

    /**
     * Builds a new document from imported pages. Imported pages share resources with their source,
     * so the composer saves before the source documents are closed.
     */
    private byte[] compose(String description, PdfComposition composition) {
        try (PDDocument target = new PDDocument()) {
            return composition.apply(target);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to " + description + ".", e);
        }
    }

    private static PDDocument load(byte[] payload) throws IOException {
        return Loader.loadPDF(payload);
    }

    private static byte[] save(PDDocument document) throws IOException {
        try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    private static PDPage requirePage(PDDocument document, Integer position) {
        if (position == null || position < 1 || position > document.getNumberOfPages()) {
            throw new IllegalArgumentException("Page " + position + " is outside 1.." + document.getNumberOfPages());
        }
        return document.getPage(position - 1);
    }

    @FunctionalInterface
    private interface PdfEdit {
        PDDocument apply(PDDocument document) throws IOException;
    }

    @FunctionalInterface
    private interface PdfComposition {
        byte[] apply(PDDocument target) throws IOException;
    }
}
