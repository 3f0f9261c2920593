package com.example.pageedit.interfaces.api;

import com.example.pageedit.application.exception.DocumentBusyException;
import com.example.pageedit.application.exception.UseCaseValidationException;
import com.example.pageedit.application.service.DocumentIntakeService;
import com.example.pageedit.application.service.FolderService;
import com.example.pageedit.application.service.PageMutationService;
import com.example.pageedit.application.service.PageQueryService;
import com.example.pageedit.domain.exception.ArchivedPageEditException;
import com.example.pageedit.domain.exception.InvalidRotationAngleException;
import com.example.pageedit.domain.exception.PageCountInvariantException;
import com.example.pageedit.domain.exception.PageNotFoundException;
import com.example.pageedit.domain.model.MutationResult;
import com.example.pageedit.domain.model.PageReorder;
import com.example.pageedit.domain.model.PageView;
import com.example.pageedit.domain.model.SideDataChannel;
import com.example.pageedit.infrastructure.exception.StorageException;
import com.example.pageedit.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the page endpoints and their exception mapping.
 */
@WebMvcTest(controllers = {PageController.class, DocumentController.class, FolderController.class})
@Import(GlobalExceptionHandler.class)
class PageControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PageMutationService pageMutationService;

    @MockBean
    private PageQueryService pageQueryService;

    @MockBean
    private DocumentIntakeService documentIntakeService;

    @MockBean
    private FolderService folderService;

    /**
     * Verifies that a successful delete returns the committed version.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void deletePageReturnsNewVersion() throws Exception {
        UUID pageId = UUID.randomUUID();
        MutationResult result = new MutationResult(UUID.randomUUID(), UUID.randomUUID(), 2, 1,
                List.of(UUID.randomUUID()), EnumSet.allOf(SideDataChannel.class));
        BDDMockito.given(pageMutationService.deletePage(pageId)).willReturn(result);

        mockMvc.perform(delete("/api/pages/{id}", pageId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].versionNumber").value(2))
                .andExpect(jsonPath("$[0].pageCount").value(1));
    }

    /**
     * Verifies that reorder bodies are translated into page reorders.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void reorderBodyIsForwarded() throws Exception {
        UUID fish = UUID.randomUUID();
        UUID cat = UUID.randomUUID();
        List<PageReorder> expected = List.of(new PageReorder(fish, 1, 2), new PageReorder(cat, 2, 1));
        BDDMockito.given(pageMutationService.reorder(expected)).willReturn(List.of(new MutationResult(
                UUID.randomUUID(), UUID.randomUUID(), 2, 2, List.of(), Set.of(SideDataChannel.TEXT))));

        mockMvc.perform(post("/api/pages/reorder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"pages":[{"id":"%s","oldNumber":1,"newNumber":2},{"id":"%s","oldNumber":2,"newNumber":1}]}
                                """.formatted(fish, cat)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].replicatedChannels[0]").value("TEXT"));
    }

    /**
     * Verifies that archived page edits translate to HTTP 409 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void archivedEditMappedToConflict() throws Exception {
        UUID pageId = UUID.randomUUID();
        BDDMockito.given(pageMutationService.rotate(anyList())).willThrow(new ArchivedPageEditException(pageId));

        mockMvc.perform(post("/api/pages/rotate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pages\":[{\"id\":\"" + pageId + "\",\"angle\":90}]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ARCHIVED_EDIT_CONFLICT"));
    }

    /**
     * Verifies that invalid requests translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void invalidAngleMappedToBadRequest() throws Exception {
        BDDMockito.given(pageMutationService.rotate(anyList())).willThrow(new InvalidRotationAngleException(45));

        mockMvc.perform(post("/api/pages/rotate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pages\":[{\"id\":\"" + UUID.randomUUID() + "\",\"angle\":45}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    /**
     * Verifies that page count violations translate to HTTP 422 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void pageCountViolationMappedTo422() throws Exception {
        BDDMockito.given(pageMutationService.moveToFolder(anyList(), isNull(), anyBoolean()))
                .willThrow(new PageCountInvariantException(0));

        mockMvc.perform(post("/api/pages/move-to-folder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pages\":[\"" + UUID.randomUUID() + "\"]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INVARIANT_VIOLATION"));
    }

    /**
     * Verifies that busy documents and storage failures map to 409 and 500.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void busyAndStorageFailuresMapped() throws Exception {
        UUID destination = UUID.randomUUID();
        BDDMockito.given(pageMutationService.moveToDocument(anyList(), eq(destination), anyInt()))
                .willThrow(new DocumentBusyException(destination))
                .willThrow(new StorageException("Unable to write", new IOException("disk full")));
        String body = "{\"pages\":[\"" + UUID.randomUUID() + "\"],\"dst\":\"" + destination + "\",\"position\":0}";

        mockMvc.perform(post("/api/pages/move-to-document").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DOCUMENT_BUSY"));
        mockMvc.perform(post("/api/pages/move-to-document").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("IO_FAILURE"));
    }

    /**
     * Verifies that a move without an insert position is rejected instead of defaulting to the front.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void moveToDocumentWithoutPositionMappedToBadRequest() throws Exception {
        String body = "{\"pages\":[\"" + UUID.randomUUID() + "\"],\"dst\":\"" + UUID.randomUUID() + "\"}";

        mockMvc.perform(post("/api/pages/move-to-document").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
        BDDMockito.then(pageMutationService).shouldHaveNoInteractions();
    }

    /**
     * Verifies that a page is served as JSON by default and as plain text on request.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void getPageSupportsJsonAndPlainText() throws Exception {
        UUID pageId = UUID.randomUUID();
        PageView view = new PageView(pageId, 3, "hello world", "deu", UUID.randomUUID(), UUID.randomUUID(), 4, false);
        BDDMockito.given(pageQueryService.get(pageId)).willReturn(view);

        mockMvc.perform(get("/api/pages/{id}", pageId).accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.number").value(3))
                .andExpect(jsonPath("$.archived").value(false));
        mockMvc.perform(get("/api/pages/{id}", pageId).accept(MediaType.TEXT_PLAIN))
                .andExpect(status().isOk())
                .andExpect(content().string("hello world"));
    }

    /**
     * Verifies that unknown pages translate to HTTP 404 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void unknownPageMappedToNotFound() throws Exception {
        UUID pageId = UUID.randomUUID();
        BDDMockito.given(pageQueryService.get(pageId)).willThrow(new PageNotFoundException(pageId));

        mockMvc.perform(get("/api/pages/{id}", pageId).accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    /**
     * Verifies that malformed identifiers translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void malformedIdMappedToBadRequest() throws Exception {
        mockMvc.perform(delete("/api/pages/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    /**
     * Verifies that multipart uploads reach the intake service.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void uploadReturnsFirstVersion() throws Exception {
        UUID folderId = UUID.randomUUID();
        MockMultipartFile file = new MockMultipartFile("file", "scan.pdf", "application/pdf", "%PDF-1.7".getBytes());
        BDDMockito.given(documentIntakeService.upload(eq(folderId), eq("scan.pdf"), isNull(), any(byte[].class)))
                .willReturn(new MutationResult(UUID.randomUUID(), UUID.randomUUID(), 1, 3, List.of(), Set.of()));

        mockMvc.perform(multipart("/api/documents").file(file).param("folder", folderId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.versionNumber").value(1))
                .andExpect(jsonPath("$.pageCount").value(3));
    }

    /**
     * Verifies that blank folder titles translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void blankFolderTitleMappedToBadRequest() throws Exception {
        BDDMockito.given(folderService.create(any(), any()))
                .willThrow(new UseCaseValidationException("Folder title must not be blank."));

        mockMvc.perform(post("/api/folders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }
}
