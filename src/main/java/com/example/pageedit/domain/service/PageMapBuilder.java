package com.example.pageedit.domain.service;

import com.example.pageedit.domain.exception.InvalidPageOrderException;
import com.example.pageedit.domain.exception.InvalidPageSelectionException;
import com.example.pageedit.domain.model.PageMap;
import com.example.pageedit.domain.model.PageMapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Pure functions computing how page positions of a new version correspond to positions of the
 * version(s) its pages come from. All numbers are 1-based.
 */
public final class PageMapBuilder {

    private PageMapBuilder() {
    }

    /**
     * Survivors keep their relative order and are renumbered from 1.
     * {@code delete(5, {3})} yields {@code [(1,1),(2,2),(3,4),(4,5)]}.
     *
     * @param totalPages       page count before the delete
     * @param deletedPositions positions being removed
     * @return compaction map
     * @throws InvalidPageSelectionException when the selection is empty or out of range
     */
    public static PageMap delete(int totalPages, Collection<Integer> deletedPositions) {
        requirePositiveTotal(totalPages);
        if (deletedPositions == null || deletedPositions.isEmpty()) {
            throw new InvalidPageSelectionException("At least one page must be selected for deletion.");
        }
        SortedSet<Integer> deleted = new TreeSet<>();
        for (Integer position : deletedPositions) {
            requireInRange(position, totalPages);
            deleted.add(position);
        }
        List<PageMapping> mappings = new ArrayList<>(totalPages - deleted.size());
        int newNumber = 1;
        for (int oldNumber = 1; oldNumber <= totalPages; oldNumber++) {
            if (!deleted.contains(oldNumber)) {
                mappings.add(PageMapping.retained(newNumber++, oldNumber));
            }
        }
        return new PageMap(mappings);
    }

    /**
     * Builds the map for a reorder where every page receives a new position.
     *
     * @param assignments old number to new number, one entry per page
     * @param totalPages  page count of the version
     * @return map sorted by new number
     * @throws InvalidPageOrderException when the new or old numbers are not exactly 1..totalPages
     */
    public static PageMap reorder(Map<Integer, Integer> assignments, int totalPages) {
        requirePositiveTotal(totalPages);
        if (assignments == null || assignments.size() != totalPages) {
            throw new InvalidPageOrderException("Reorder must assign a new position to each of the "
                    + totalPages + " pages, got " + (assignments == null ? 0 : assignments.size()) + ".");
        }
        SortedSet<Integer> seenNew = new TreeSet<>();
        List<PageMapping> mappings = new ArrayList<>(totalPages);
        for (Map.Entry<Integer, Integer> entry : assignments.entrySet()) {
            Integer oldNumber = entry.getKey();
            Integer newNumber = entry.getValue();
            if (oldNumber == null || oldNumber < 1 || oldNumber > totalPages) {
                throw new InvalidPageOrderException("Old page number " + oldNumber + " is outside 1.." + totalPages + ".");
            }
            if (newNumber == null || newNumber < 1 || newNumber > totalPages) {
                throw new InvalidPageOrderException("New page number " + newNumber + " is outside 1.." + totalPages + ".");
            }
            if (!seenNew.add(newNumber)) {
                throw new InvalidPageOrderException("New page number " + newNumber + " is assigned more than once.");
            }
            mappings.add(PageMapping.retained(newNumber, oldNumber));
        }
        return new PageMap(mappings);
    }

    /**
     * Rotation never changes count or order.
     *
     * @param totalPages page count of the version
     * @return identity map
     */
    public static PageMap rotate(int totalPages) {
        requirePositiveTotal(totalPages);
        List<PageMapping> mappings = new ArrayList<>(totalPages);
        for (int number = 1; number <= totalPages; number++) {
            mappings.add(PageMapping.retained(number, number));
        }
        return new PageMap(mappings);
    }

    /**
     * Map for pages inserted into a destination right after {@code position}.
     * Positions up to {@code position} keep identity, the inserted range maps to the source pages in
     * the given order and the remaining destination pages shift by the inserted count.
     *
     * @param position               destination position the pages go after, 0 for the front
     * @param sourcePageNumbers      source page numbers in insertion order
     * @param destinationTotalBefore destination page count before the insert
     * @return map over the destination's new version
     */
    public static PageMap insertAtPosition(int position, List<Integer> sourcePageNumbers, int destinationTotalBefore) {
        requirePositiveTotal(destinationTotalBefore);
        if (sourcePageNumbers == null || sourcePageNumbers.isEmpty()) {
            throw new InvalidPageSelectionException("At least one page must be selected for insertion.");
        }
        if (position < 0 || position > destinationTotalBefore) {
            throw new InvalidPageSelectionException(
                    "Insert position " + position + " is outside 0.." + destinationTotalBefore + ".");
        }
        int inserted = sourcePageNumbers.size();
        List<PageMapping> mappings = new ArrayList<>(destinationTotalBefore + inserted);
        for (int number = 1; number <= position; number++) {
            mappings.add(PageMapping.retained(number, number));
        }
        for (int i = 0; i < inserted; i++) {
            Integer sourceNumber = sourcePageNumbers.get(i);
            if (sourceNumber == null || sourceNumber < 1) {
                throw new InvalidPageSelectionException("Source page number " + sourceNumber + " is not a valid position.");
            }
            mappings.add(PageMapping.inserted(position + 1 + i, sourceNumber));
        }
        for (int oldNumber = position + 1; oldNumber <= destinationTotalBefore; oldNumber++) {
            mappings.add(PageMapping.retained(oldNumber + inserted, oldNumber));
        }
        return new PageMap(mappings);
    }

    /**
     * Map for a new document seeded from pages of another document.
     *
     * @param sourcePageNumbers source page numbers in the order they appear in the new document
     * @return map whose entries all point into the source version
     */
    public static PageMap extract(List<Integer> sourcePageNumbers) {
        if (sourcePageNumbers == null || sourcePageNumbers.isEmpty()) {
            throw new InvalidPageSelectionException("At least one page must be selected for extraction.");
        }
        List<PageMapping> mappings = new ArrayList<>(sourcePageNumbers.size());
        for (int i = 0; i < sourcePageNumbers.size(); i++) {
            mappings.add(PageMapping.inserted(i + 1, sourcePageNumbers.get(i)));
        }
        return new PageMap(mappings);
    }

    private static void requirePositiveTotal(int totalPages) {
        if (totalPages < 1) {
            throw new InvalidPageSelectionException("Document version must have at least one page, got " + totalPages + ".");
        }
    }

    private static void requireInRange(Integer position, int totalPages) {
        if (position == null || position < 1 || position > totalPages) {
            throw new InvalidPageSelectionException("Page number " + position + " is outside 1.." + totalPages + ".");
        }
    }
}
