package com.example.pageedit.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Infrastructure service that reads the document title of an uploaded PDF.
 * The info dictionary wins; the XMP Dublin Core title is the fallback.
 */
@Service
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);

    /**
     * Reads the title embedded in the PDF.
     *
     * @param document already opened PDF document
     * @return non-blank title, or empty when the PDF carries none
     */
    public Optional<String> readTitle(PDDocument document) {
        if (document == null) {
            return Optional.empty();
        }
        return infoTitle(document.getDocumentInformation())
                .or(() -> xmpTitle(document.getDocumentCatalog()));
    }

    /**
     * @param info info dictionary from PDFBox
     * @return title from the legacy info dictionary
     */
    private Optional<String> infoTitle(PDDocumentInformation info) {
        if (info == null) {
            return Optional.empty();
        }
        return nonBlank(info.getTitle());
    }

    /**
     * Extracts the Dublin Core title from the XMP metadata stream.
     *
     * @param catalog document catalog pointer supplied by PDFBox
     * @return parsed title, empty when the stream is missing or invalid
     */
    private Optional<String> xmpTitle(PDDocumentCatalog catalog) {
        if (catalog == null) {
            return Optional.empty();
        }
        PDMetadata pdMetadata = catalog.getMetadata();
        if (pdMetadata == null) {
            return Optional.empty();
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return Optional.empty();
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            DublinCoreSchema dc = xmp.getDublinCoreSchema();
            return dc != null ? nonBlank(dc.getTitle()) : Optional.empty();
        } catch (IOException | XmpParsingException | BadFieldValueException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return Optional.empty();
        }
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.strip());
    }
}
