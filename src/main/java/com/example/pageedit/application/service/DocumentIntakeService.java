package com.example.pageedit.application.service;

import com.example.pageedit.application.exception.UseCaseValidationException;
import com.example.pageedit.config.PageEditProperties;
import com.example.pageedit.domain.exception.FolderNotFoundException;
import com.example.pageedit.domain.exception.PdfFileRequiredException;
import com.example.pageedit.domain.exception.UnsupportedPdfFormatException;
import com.example.pageedit.domain.model.Document;
import com.example.pageedit.domain.model.DocumentVersion;
import com.example.pageedit.domain.model.MutationResult;
import com.example.pageedit.domain.model.SideDataChannel;
import com.example.pageedit.domain.port.DocumentStorage;
import com.example.pageedit.domain.port.FolderRepository;
import com.example.pageedit.infrastructure.exception.PdfProcessingException;
import com.example.pageedit.infrastructure.pdf.PdfBoxMetadataReader;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.UUID;

/**
 * Application-layer service that turns an uploaded PDF into a document with its first version.
 */
@Service
public class DocumentIntakeService {

    private static final Logger log = LoggerFactory.getLogger(DocumentIntakeService.class);
    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);

    private final FolderRepository folderRepository;
    private final DocumentStorage storage;
    private final VersionManager versionManager;
    private final PdfBoxMetadataReader metadataReader;
    private final PageEditProperties properties;

    public DocumentIntakeService(FolderRepository folderRepository,
                                 DocumentStorage storage,
                                 VersionManager versionManager,
                                 PdfBoxMetadataReader metadataReader,
                                 PageEditProperties properties) {
        this.folderRepository = folderRepository;
        this.storage = storage;
        this.versionManager = versionManager;
        this.metadataReader = metadataReader;
        this.properties = properties;
    }

    /**
     * Stores the PDF as version 1 of a new document.
     *
     * @param folderId destination folder
     * @param fileName original file name, used as title when the PDF has none
     * @param lang     page language, the configured default when blank
     * @param bytes    PDF content
     * @return the created document's first version
     * @throws PdfFileRequiredException      when no content was supplied
     * @throws UnsupportedPdfFormatException when the content is not a PDF
     * @throws PdfProcessingException        when PDFBox cannot read the content
     */
    public MutationResult upload(UUID folderId, String fileName, String lang, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(bytes)) {
            throw new UnsupportedPdfFormatException(fileName);
        }
        if (folderId == null) {
            throw new UseCaseValidationException("A destination folder is required.");
        }
        if (folderRepository.findById(folderId).isEmpty()) {
            throw new FolderNotFoundException(folderId);
        }

        int pageCount;
        String title;
        try (PDDocument pdf = Loader.loadPDF(bytes)) {
            pageCount = pdf.getNumberOfPages();
            title = metadataReader.readTitle(pdf).orElseGet(() -> titleFromFileName(fileName));
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the uploaded PDF " + fileName, e);
        }

        String language = lang == null || lang.isBlank() ? properties.getDefaultLanguage() : lang.strip();
        Document document = Document.create(title, language, folderId);
        DocumentVersion version = versionManager.bump(document, pageCount);
        storage.write(version.payloadPath(), bytes);
        versionManager.commit(document, version);
        log.info("Created document {} '{}' with {} pages", document.id(), title, pageCount);
        return MutationResult.of(version, EnumSet.noneOf(SideDataChannel.class));
    }

    private static boolean looksLikePdf(byte[] bytes) {
        return bytes.length >= PDF_MAGIC.length
                && Arrays.equals(bytes, 0, PDF_MAGIC.length, PDF_MAGIC, 0, PDF_MAGIC.length);
    }

    private static String titleFromFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "Untitled";
        }
        String name = fileName.strip();
        if (name.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            name = name.substring(0, name.length() - 4);
        }
        return name.isBlank() ? "Untitled" : name;
    }
}
