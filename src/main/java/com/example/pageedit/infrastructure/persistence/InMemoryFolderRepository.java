package com.example.pageedit.infrastructure.persistence;

import com.example.pageedit.domain.model.Folder;
import com.example.pageedit.domain.port.FolderRepository;

import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link FolderRepository}.
 */
@Repository
public class InMemoryFolderRepository implements FolderRepository {

    private final Map<UUID, Folder> folders = new ConcurrentHashMap<>();

    @Override
    public Folder save(Folder folder) {
        folders.put(folder.id(), folder);
        return folder;
    }

    @Override
    public Optional<Folder> findById(UUID folderId) {
        return Optional.ofNullable(folders.get(folderId));
    }
}
