package com.example.pageedit.application.service;

import com.example.pageedit.application.exception.UseCaseValidationException;
import com.example.pageedit.application.service.DocumentLockRegistry.DocumentLease;
import com.example.pageedit.domain.exception.ArchivedPageEditException;
import com.example.pageedit.domain.exception.DocumentNotFoundException;
import com.example.pageedit.domain.exception.FolderNotFoundException;
import com.example.pageedit.domain.exception.InvalidPageOrderException;
import com.example.pageedit.domain.exception.InvalidPageSelectionException;
import com.example.pageedit.domain.exception.InvalidRotationAngleException;
import com.example.pageedit.domain.exception.PageCountInvariantException;
import com.example.pageedit.domain.exception.PageNotFoundException;
import com.example.pageedit.domain.model.Document;
import com.example.pageedit.domain.model.DocumentVersion;
import com.example.pageedit.domain.model.Folder;
import com.example.pageedit.domain.model.MutationResult;
import com.example.pageedit.domain.model.Page;
import com.example.pageedit.domain.model.PageLocation;
import com.example.pageedit.domain.model.PageMap;
import com.example.pageedit.domain.model.PageOrigin;
import com.example.pageedit.domain.model.PageReorder;
import com.example.pageedit.domain.model.PageRotation;
import com.example.pageedit.domain.model.PageSelection;
import com.example.pageedit.domain.model.SideDataChannel;
import com.example.pageedit.domain.port.DocumentRepository;
import com.example.pageedit.domain.port.DocumentStorage;
import com.example.pageedit.domain.port.FolderRepository;
import com.example.pageedit.domain.service.PageMapBuilder;
import com.example.pageedit.infrastructure.pdf.PdfBoxPageEditor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Application-layer service orchestrating structural page edits.
 * Each operation validates its input without side effects, then bumps a new version, writes the
 * edited payload, replicates side data along the page map and commits. A failure after the bump
 * leaves the new version pending and the previous version current.
 */
@Service
public class PageMutationService {

    private static final Logger log = LoggerFactory.getLogger(PageMutationService.class);
    private static final Set<SideDataChannel> ALL_CHANNELS = EnumSet.allOf(SideDataChannel.class);
    private static final Set<SideDataChannel> TEXT_ONLY = EnumSet.of(SideDataChannel.TEXT);

    private final DocumentRepository documentRepository;
    private final FolderRepository folderRepository;
    private final DocumentStorage storage;
    private final PdfBoxPageEditor pageEditor;
    private final VersionManager versionManager;
    private final SideDataReplicator replicator;
    private final DocumentLockRegistry lockRegistry;

    public PageMutationService(DocumentRepository documentRepository,
                               FolderRepository folderRepository,
                               DocumentStorage storage,
                               PdfBoxPageEditor pageEditor,
                               VersionManager versionManager,
                               SideDataReplicator replicator,
                               DocumentLockRegistry lockRegistry) {
        this.documentRepository = documentRepository;
        this.folderRepository = folderRepository;
        this.storage = storage;
        this.pageEditor = pageEditor;
        this.versionManager = versionManager;
        this.replicator = replicator;
        this.lockRegistry = lockRegistry;
    }

    /**
     * Deletes one page.
     *
     * @param pageId page of a current version
     * @return the document's new version
     */
    public MutationResult deletePage(UUID pageId) {
        return delete(List.of(pageId)).get(0);
    }

    /**
     * Deletes pages of one document version.
     *
     * @param pageIds pages of the same current version
     * @return the document's new version
     * @throws InvalidPageSelectionException when the selection is empty, repeats a page or spans versions
     * @throws ArchivedPageEditException     when a page is not on the current version
     * @throws PageCountInvariantException   when no page would remain
     */
    public List<MutationResult> delete(Collection<UUID> pageIds) {
        UUID documentId = owningDocument(pageIds);
        try (DocumentLease ignored = lockRegistry.acquire(List.of(documentId))) {
            PageSelection selection = select(pageIds);
            requireRemainingPages(selection);
            return List.of(removeSelection(selection));
        }
    }

    /**
     * Reorders every page of a version.
     *
     * @param reorders one entry per page of the version
     * @return the document's new version
     * @throws InvalidPageOrderException when the assignments are not a permutation of the pages
     */
    public List<MutationResult> reorder(List<PageReorder> reorders) {
        if (reorders == null || reorders.isEmpty()) {
            throw new InvalidPageSelectionException("At least one page must be selected for reordering.");
        }
        List<UUID> pageIds = reorders.stream().map(PageReorder::pageId).toList();
        UUID documentId = owningDocument(pageIds);
        try (DocumentLease ignored = lockRegistry.acquire(List.of(documentId))) {
            PageSelection selection = select(pageIds);
            DocumentVersion oldVersion = selection.version();
            Map<Integer, Integer> assignments = new HashMap<>();
            for (PageReorder reorder : reorders) {
                Page page = oldVersion.pages().stream()
                        .filter(candidate -> candidate.id().equals(reorder.pageId()))
                        .findFirst()
                        .orElseThrow(() -> new PageNotFoundException(reorder.pageId()));
                if (page.number() != reorder.oldNumber()) {
                    throw new InvalidPageOrderException("Page " + page.id() + " is at position " + page.number()
                            + ", not " + reorder.oldNumber() + ".");
                }
                assignments.put(reorder.oldNumber(), reorder.newNumber());
            }
            PageMap pageMap = PageMapBuilder.reorder(assignments, oldVersion.pageCount());

            Document document = selection.document();
            DocumentVersion newVersion = versionManager.bump(document, oldVersion.pageCount());
            byte[] payload = pageEditor.reorder(storage.read(oldVersion.payloadPath()), pageMap);
            storage.write(newVersion.payloadPath(), payload);
            replicator.replicateText(oldVersion, newVersion, pageMap);
            versionManager.commit(document, newVersion);
            return List.of(MutationResult.of(newVersion, TEXT_ONLY));
        }
    }

    /**
     * Rotates pages of one version. Page text is kept; rendering artifacts are not carried over and
     * must be regenerated, which the result reports by listing only {@link SideDataChannel#TEXT}.
     *
     * @param rotations pages and clockwise angles
     * @return the document's new version
     * @throws InvalidRotationAngleException when an angle is not a non-zero multiple of 90
     */
    public List<MutationResult> rotate(List<PageRotation> rotations) {
        if (rotations == null || rotations.isEmpty()) {
            throw new InvalidPageSelectionException("At least one page must be selected for rotation.");
        }
        for (PageRotation rotation : rotations) {
            if (rotation.angle() == 0 || rotation.angle() % 90 != 0) {
                throw new InvalidRotationAngleException(rotation.angle());
            }
        }
        List<UUID> pageIds = rotations.stream().map(PageRotation::pageId).toList();
        UUID documentId = owningDocument(pageIds);
        try (DocumentLease ignored = lockRegistry.acquire(List.of(documentId))) {
            PageSelection selection = select(pageIds);
            DocumentVersion oldVersion = selection.version();
            Map<UUID, Integer> numbersById = new HashMap<>();
            selection.pages().forEach(page -> numbersById.put(page.id(), page.number()));
            Map<Integer, Integer> angles = new TreeMap<>();
            rotations.forEach(rotation -> angles.put(numbersById.get(rotation.pageId()), rotation.angle()));
            PageMap pageMap = PageMapBuilder.rotate(oldVersion.pageCount());

            Document document = selection.document();
            DocumentVersion newVersion = versionManager.bump(document, oldVersion.pageCount());
            byte[] payload = pageEditor.rotate(storage.read(oldVersion.payloadPath()), angles);
            storage.write(newVersion.payloadPath(), payload);
            replicator.replicateText(oldVersion, newVersion, pageMap);
            versionManager.commit(document, newVersion);
            log.info("Rotated pages {} of document {}; artifacts need regeneration", angles.keySet(), document.id());
            return List.of(MutationResult.of(newVersion, TEXT_ONLY));
        }
    }

    /**
     * Moves pages out of their document into new documents filed under a folder.
     *
     * @param pageIds    pages of the same current version
     * @param folderId   destination folder
     * @param singlePage {@code true} for one single-page document per moved page, {@code false} for
     *                   one document holding all moved pages in their original order
     * @return the source document's new version followed by every created document
     */
    public List<MutationResult> moveToFolder(Collection<UUID> pageIds, UUID folderId, boolean singlePage) {
        if (folderId == null) {
            throw new UseCaseValidationException("A destination folder is required.");
        }
        UUID documentId = owningDocument(pageIds);
        try (DocumentLease ignored = lockRegistry.acquire(List.of(documentId))) {
            PageSelection selection = select(pageIds);
            requireRemainingPages(selection);
            Folder folder = folderRepository.findById(folderId)
                    .orElseThrow(() -> new FolderNotFoundException(folderId));

            List<MutationResult> results = new ArrayList<>();
            results.add(removeSelection(selection));

            DocumentVersion sourceVersion = selection.version();
            byte[] sourcePayload = storage.read(sourceVersion.payloadPath());
            if (singlePage) {
                for (Page page : selection.pages()) {
                    String title = selection.document().title() + " - page " + page.number();
                    results.add(extractIntoDocument(sourceVersion, sourcePayload, List.of(page), title, folder));
                }
            } else {
                results.add(extractIntoDocument(sourceVersion, sourcePayload, selection.pages(),
                        selection.document().title(), folder));
            }
            return results;
        }
    }

    /**
     * Moves pages into another document right after its {@code position}-th page.
     * The source and destination are committed one after the other, not atomically.
     *
     * @param pageIds       pages of the same current version
     * @param destinationId destination document, different from the source
     * @param position      destination page the moved pages follow, 0 for the front
     * @return the source's and then the destination's new version
     */
    public List<MutationResult> moveToDocument(Collection<UUID> pageIds, UUID destinationId, int position) {
        if (destinationId == null) {
            throw new UseCaseValidationException("A destination document is required.");
        }
        UUID sourceId = owningDocument(pageIds);
        if (sourceId.equals(destinationId)) {
            throw new InvalidPageSelectionException("Pages cannot be moved into their own document, use reorder instead.");
        }
        try (DocumentLease ignored = lockRegistry.acquire(List.of(sourceId, destinationId))) {
            PageSelection selection = select(pageIds);
            requireRemainingPages(selection);
            Document destination = documentRepository.findById(destinationId)
                    .orElseThrow(() -> new DocumentNotFoundException(destinationId));
            DocumentVersion destinationOld = destination.currentVersion()
                    .orElseThrow(() -> new DocumentNotFoundException(destinationId));
            PageMap destinationMap = PageMapBuilder.insertAtPosition(
                    position, selection.numbers(), destinationOld.pageCount());

            MutationResult sourceResult = removeSelection(selection);

            DocumentVersion sourceOld = selection.version();
            DocumentVersion destinationNew = versionManager.bump(destination, destinationMap.size());
            byte[] payload = pageEditor.insert(
                    storage.read(destinationOld.payloadPath()),
                    storage.read(sourceOld.payloadPath()),
                    selection.numbers(),
                    position);
            storage.write(destinationNew.payloadPath(), payload);
            replicator.replicateArtifacts(destinationOld, destinationNew, destinationMap, PageOrigin.RETAINED);
            replicator.replicateText(destinationOld, sourceOld, destinationNew, destinationMap);
            versionManager.commit(destination, destinationNew);
            return List.of(sourceResult, MutationResult.of(destinationNew, ALL_CHANNELS));
        }
    }

    /**
     * Delete flow shared by delete and both move families. Expects a validated selection.
     */
    private MutationResult removeSelection(PageSelection selection) {
        Document document = selection.document();
        DocumentVersion oldVersion = selection.version();
        PageMap pageMap = PageMapBuilder.delete(oldVersion.pageCount(), selection.numbers());

        DocumentVersion newVersion = versionManager.bump(document, pageMap.size());
        byte[] payload = pageEditor.remove(storage.read(oldVersion.payloadPath()), selection.numbers());
        storage.write(newVersion.payloadPath(), payload);
        replicator.replicateArtifacts(oldVersion, newVersion, pageMap, PageOrigin.RETAINED);
        replicator.replicateText(oldVersion, newVersion, pageMap);
        versionManager.commit(document, newVersion);
        return MutationResult.of(newVersion, ALL_CHANNELS);
    }

    private MutationResult extractIntoDocument(DocumentVersion sourceVersion,
                                               byte[] sourcePayload,
                                               List<Page> pages,
                                               String title,
                                               Folder folder) {
        Document document = Document.create(title, pages.get(0).lang(), folder.id());
        List<Integer> numbers = pages.stream().map(Page::number).toList();
        PageMap pageMap = PageMapBuilder.extract(numbers);

        DocumentVersion version = versionManager.bumpFromPages(document, pages);
        storage.write(version.payloadPath(), pageEditor.extract(sourcePayload, numbers));
        replicator.replicateArtifacts(sourceVersion, version, pageMap, PageOrigin.INSERTED);
        replicator.replicateText(null, sourceVersion, version, pageMap);
        versionManager.commit(document, version);
        return MutationResult.of(version, ALL_CHANNELS);
    }

    /**
     * Resolves the document of the first page so its lease can be taken before full validation.
     */
    private UUID owningDocument(Collection<UUID> pageIds) {
        if (pageIds == null || pageIds.isEmpty()) {
            throw new InvalidPageSelectionException("At least one page must be selected.");
        }
        UUID first = pageIds.iterator().next();
        if (first == null) {
            throw new InvalidPageSelectionException("Page ids must not be null.");
        }
        return documentRepository.findPage(first)
                .map(location -> location.document().id())
                .orElseThrow(() -> new PageNotFoundException(first));
    }

    /**
     * Validates that the ids name distinct pages of one current version.
     */
    private PageSelection select(Collection<UUID> pageIds) {
        Set<UUID> unique = new LinkedHashSet<>(pageIds);
        if (unique.contains(null)) {
            throw new InvalidPageSelectionException("Page ids must not be null.");
        }
        if (unique.size() != pageIds.size()) {
            throw new InvalidPageSelectionException("The same page was selected more than once.");
        }
        List<PageLocation> locations = new ArrayList<>(unique.size());
        for (UUID pageId : unique) {
            PageLocation location = documentRepository.findPage(pageId)
                    .orElseThrow(() -> new PageNotFoundException(pageId));
            if (location.isArchived()) {
                throw new ArchivedPageEditException(pageId);
            }
            locations.add(location);
        }
        DocumentVersion version = locations.get(0).version();
        for (PageLocation location : locations) {
            if (!location.version().equals(version)) {
                throw new InvalidPageSelectionException("All pages must belong to the same document version.");
            }
        }
        List<Page> pages = locations.stream()
                .map(PageLocation::page)
                .sorted(Comparator.comparingInt(Page::number))
                .toList();
        return new PageSelection(locations.get(0).document(), version, pages);
    }

    private static void requireRemainingPages(PageSelection selection) {
        int remaining = selection.version().pageCount() - selection.size();
        if (remaining < 1) {
            throw new PageCountInvariantException(remaining);
        }
    }
}
