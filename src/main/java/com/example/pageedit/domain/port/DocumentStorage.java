package com.example.pageedit.domain.port;

import com.example.pageedit.domain.model.PagePath;

/**
 * Byte store holding version payloads and per-page rendering artifacts.
 * Paths are relative, slash separated keys.
 */
public interface DocumentStorage {

    byte[] read(String path);

    /**
     * Writes the bytes, creating parent locations as needed. The target either keeps its previous
     * content or holds the complete new content, never a partial write.
     *
     * @param path  relative storage key
     * @param bytes content to store
     */
    void write(String path, byte[] bytes);

    boolean exists(String path);

    /**
     * Copies every artifact of one page to another page slot.
     *
     * @param source page whose artifacts are copied
     * @param target page slot receiving the copy
     * @return {@code false} when the source page has no artifacts yet
     */
    boolean copyPage(PagePath source, PagePath target);
}
