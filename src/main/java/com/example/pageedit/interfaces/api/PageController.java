package com.example.pageedit.interfaces.api;

import com.example.pageedit.application.exception.UseCaseValidationException;
import com.example.pageedit.application.service.PageMutationService;
import com.example.pageedit.application.service.PageQueryService;
import com.example.pageedit.domain.model.MutationResult;
import com.example.pageedit.domain.model.PageView;
import com.example.pageedit.interfaces.api.dto.MoveToDocumentRequest;
import com.example.pageedit.interfaces.api.dto.MoveToFolderRequest;
import com.example.pageedit.interfaces.api.dto.PageIdsRequest;
import com.example.pageedit.interfaces.api.dto.PageTextRequest;
import com.example.pageedit.interfaces.api.dto.ReorderRequest;
import com.example.pageedit.interfaces.api.dto.RotateRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Interfaces-layer REST controller for page lookups and structural page edits.
 * Every successful edit answers with the versions it committed.
 */
@RestController
@RequestMapping("/api/pages")
public class PageController {

    private final PageMutationService pageMutationService;
    private final PageQueryService pageQueryService;

    /**
     * Creates the controller with the required application services.
     *
     * @param pageMutationService service performing structural edits
     * @param pageQueryService    service reading and annotating pages
     */
    public PageController(PageMutationService pageMutationService, PageQueryService pageQueryService) {
        this.pageMutationService = pageMutationService;
        this.pageQueryService = pageQueryService;
    }

    /**
     * Returns a page of any version.
     *
     * @param id page identifier
     * @return JSON page view
     */
    @GetMapping("/{id}")
    public ResponseEntity<PageView> getPage(@PathVariable UUID id) {
        return ResponseEntity.ok(pageQueryService.get(id));
    }

    /**
     * Returns only the text of a page.
     *
     * @param id page identifier
     * @return page text, empty when none was recognized yet
     */
    @GetMapping(value = "/{id}", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getPageText(@PathVariable UUID id) {
        PageView page = pageQueryService.get(id);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(page.text() != null ? page.text() : "");
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<List<MutationResult>> deletePage(@PathVariable UUID id) {
        return ResponseEntity.ok(List.of(pageMutationService.deletePage(id)));
    }

    @DeleteMapping
    public ResponseEntity<List<MutationResult>> deletePages(@RequestBody PageIdsRequest request) {
        return ResponseEntity.ok(pageMutationService.delete(nullToEmpty(request.pages())));
    }

    @PostMapping("/reorder")
    public ResponseEntity<List<MutationResult>> reorder(@RequestBody ReorderRequest request) {
        return ResponseEntity.ok(pageMutationService.reorder(request.toReorders()));
    }

    @PostMapping("/rotate")
    public ResponseEntity<List<MutationResult>> rotate(@RequestBody RotateRequest request) {
        return ResponseEntity.ok(pageMutationService.rotate(request.toRotations()));
    }

    /**
     * Moves pages into new documents under a folder.
     *
     * @param request pages, destination folder and split mode
     * @return source version followed by every created document
     */
    @PostMapping("/move-to-folder")
    public ResponseEntity<List<MutationResult>> moveToFolder(@RequestBody MoveToFolderRequest request) {
        return ResponseEntity.ok(pageMutationService.moveToFolder(
                nullToEmpty(request.pages()), request.dst(), request.singlePage()));
    }

    /**
     * Moves pages into an existing document.
     *
     * @param request pages, destination document and insert position
     * @return source version followed by destination version
     */
    @PostMapping("/move-to-document")
    public ResponseEntity<List<MutationResult>> moveToDocument(@RequestBody MoveToDocumentRequest request) {
        if (request.position() == null) {
            throw new UseCaseValidationException("An insert position is required, use 0 to insert at the front.");
        }
        return ResponseEntity.ok(pageMutationService.moveToDocument(
                nullToEmpty(request.pages()), request.dst(), request.position()));
    }

    /**
     * Stores recognized text for a page of the current version.
     *
     * @param id      page identifier
     * @param request new text
     * @return updated page view
     */
    @PutMapping("/{id}/text")
    public ResponseEntity<PageView> updateText(@PathVariable UUID id, @RequestBody PageTextRequest request) {
        return ResponseEntity.ok(pageQueryService.updateText(id, request.text()));
    }

    private static List<UUID> nullToEmpty(List<UUID> pages) {
        return pages != null ? pages : List.of();
    }
}
