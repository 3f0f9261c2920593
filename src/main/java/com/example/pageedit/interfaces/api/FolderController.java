package com.example.pageedit.interfaces.api;

import com.example.pageedit.application.service.FolderService;
import com.example.pageedit.domain.model.DocumentSummary;
import com.example.pageedit.domain.model.Folder;
import com.example.pageedit.interfaces.api.dto.CreateFolderRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Interfaces-layer REST controller for folders.
 */
@RestController
@RequestMapping("/api/folders")
public class FolderController {

    private final FolderService folderService;

    public FolderController(FolderService folderService) {
        this.folderService = folderService;
    }

    @PostMapping
    public ResponseEntity<Folder> create(@RequestBody CreateFolderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(folderService.create(request.title(), request.parentId()));
    }

    @GetMapping("/{id}/documents")
    public ResponseEntity<List<DocumentSummary>> listDocuments(@PathVariable UUID id) {
        return ResponseEntity.ok(folderService.listDocuments(id));
    }
}
