package com.example.pageedit.domain.port;

import com.example.pageedit.domain.model.Folder;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for folders.
 */
public interface FolderRepository {

    Folder save(Folder folder);

    Optional<Folder> findById(UUID folderId);
}
