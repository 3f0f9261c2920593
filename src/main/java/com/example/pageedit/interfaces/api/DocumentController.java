package com.example.pageedit.interfaces.api;

import com.example.pageedit.application.service.DocumentIntakeService;
import com.example.pageedit.application.service.PageQueryService;
import com.example.pageedit.domain.exception.PdfFileRequiredException;
import com.example.pageedit.domain.model.MutationResult;
import com.example.pageedit.domain.model.PageView;
import com.example.pageedit.infrastructure.exception.PdfProcessingException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Interfaces-layer REST controller for document uploads and page listings.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final DocumentIntakeService documentIntakeService;
    private final PageQueryService pageQueryService;

    public DocumentController(DocumentIntakeService documentIntakeService, PageQueryService pageQueryService) {
        this.documentIntakeService = documentIntakeService;
        this.pageQueryService = pageQueryService;
    }

    /**
     * Uploads a PDF as a new document.
     *
     * @param file   uploaded PDF
     * @param folder destination folder
     * @param lang   page language (optional)
     * @return the document's first version
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<MutationResult> upload(@RequestParam("file") MultipartFile file,
                                                 @RequestParam("folder") UUID folder,
                                                 @RequestParam(value = "lang", required = false) String lang) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        try {
            return ResponseEntity.ok(
                    documentIntakeService.upload(folder, file.getOriginalFilename(), lang, file.getBytes()));
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the uploaded PDF file.", e);
        }
    }

    @GetMapping("/{id}/pages")
    public ResponseEntity<List<PageView>> listPages(@PathVariable UUID id) {
        return ResponseEntity.ok(pageQueryService.listCurrentPages(id));
    }
}
