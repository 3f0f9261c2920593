package com.example.pageedit.application.service;

import com.example.pageedit.application.exception.UseCaseValidationException;
import com.example.pageedit.domain.exception.FolderNotFoundException;
import com.example.pageedit.domain.model.DocumentSummary;
import com.example.pageedit.domain.model.Folder;
import com.example.pageedit.domain.port.DocumentRepository;
import com.example.pageedit.domain.port.FolderRepository;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Application-layer service for folders and the documents filed under them.
 */
@Service
public class FolderService {

    private final FolderRepository folderRepository;
    private final DocumentRepository documentRepository;

    public FolderService(FolderRepository folderRepository, DocumentRepository documentRepository) {
        this.folderRepository = folderRepository;
        this.documentRepository = documentRepository;
    }

    /**
     * @param title    non-blank folder title
     * @param parentId optional parent folder
     * @return the stored folder
     */
    public Folder create(String title, UUID parentId) {
        if (title == null || title.isBlank()) {
            throw new UseCaseValidationException("Folder title must not be blank.");
        }
        if (parentId != null && folderRepository.findById(parentId).isEmpty()) {
            throw new FolderNotFoundException(parentId);
        }
        return folderRepository.save(Folder.create(title.strip(), parentId));
    }

    public Folder get(UUID folderId) {
        return folderRepository.findById(folderId).orElseThrow(() -> new FolderNotFoundException(folderId));
    }

    /**
     * Lists the folder's documents, described by their current versions.
     */
    public List<DocumentSummary> listDocuments(UUID folderId) {
        get(folderId);
        return documentRepository.findByFolder(folderId).stream()
                .flatMap(document -> document.currentVersion()
                        .map(current -> DocumentSummary.of(document, current))
                        .stream())
                .toList();
    }
}
