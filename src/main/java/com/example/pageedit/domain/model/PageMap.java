package com.example.pageedit.domain.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered list of {@link PageMapping}s covering every page of a new version exactly once,
 * sorted by new page number.
 */
public record PageMap(List<PageMapping> mappings) {

    public PageMap {
        List<PageMapping> sorted = new ArrayList<>(mappings);
        sorted.sort(Comparator.comparingInt(PageMapping::newNumber));
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).newNumber() != i + 1) {
                throw new IllegalArgumentException("Page map must cover new positions 1.." + sorted.size());
            }
        }
        mappings = List.copyOf(sorted);
    }

    public int size() {
        return mappings.size();
    }

    /**
     * @return old page numbers listed in new-position order
     */
    public List<Integer> oldNumbers() {
        return mappings.stream().map(PageMapping::oldNumber).toList();
    }

    public List<PageMapping> withOrigin(PageOrigin origin) {
        return mappings.stream().filter(mapping -> mapping.origin() == origin).toList();
    }

    /**
     * Swaps new and old numbers. Only meaningful for permutations of a single document.
     *
     * @return inverse map
     * @throws IllegalStateException when the map contains inserted pages
     */
    public PageMap inverse() {
        List<PageMapping> inverted = new ArrayList<>(mappings.size());
        for (PageMapping mapping : mappings) {
            if (!mapping.isRetained()) {
                throw new IllegalStateException("Cannot invert a map that contains inserted pages");
            }
            inverted.add(PageMapping.retained(mapping.oldNumber(), mapping.newNumber()));
        }
        return new PageMap(inverted);
    }
}
