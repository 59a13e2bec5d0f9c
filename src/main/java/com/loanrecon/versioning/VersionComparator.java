package com.loanrecon.versioning;

import com.loanrecon.domain.VersionCriterion;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Composite total order over {@link VersionFacts}: "better" versions sort first. Criteria are applied in the
 * configured precedence; DOCUMENT_ID (ascending) always comes last, so two distinct documents never compare equal.
 */
public final class VersionComparator implements Comparator<VersionFacts> {

    private final List<VersionCriterion> precedence;

    public VersionComparator(List<VersionCriterion> configured) {
        List<VersionCriterion> p = new ArrayList<>();
        if (configured != null) {
            for (VersionCriterion c : configured) {
                if (c != null && c != VersionCriterion.DOCUMENT_ID && !p.contains(c)) {
                    p.add(c);
                }
            }
        }
        p.add(VersionCriterion.DOCUMENT_ID);
        this.precedence = List.copyOf(p);
    }

    public List<VersionCriterion> precedence() {
        return precedence;
    }

    @Override
    public int compare(VersionFacts a, VersionFacts b) {
        for (VersionCriterion c : precedence) {
            int r = compareBy(c, a, b);
            if (r != 0) {
                return r;
            }
        }
        return 0;
    }

    /**
     * The first criterion under which {@code a} and {@code b} differ; empty only for the same document id.
     */
    public Optional<VersionCriterion> separatingCriterion(VersionFacts a, VersionFacts b) {
        for (VersionCriterion c : precedence) {
            if (compareBy(c, a, b) != 0) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    static int compareBy(VersionCriterion criterion, VersionFacts a, VersionFacts b) {
        return switch (criterion) {
            case FINALITY -> Integer.compare(b.finality().weight(), a.finality().weight());
            case SIGNATURE -> Boolean.compare(b.signed(), a.signed());
            case DOCUMENT_DATE -> compareDatesDescMissingLast(a.documentDate(), b.documentDate());
            case PAGE_COUNT -> Integer.compare(b.pageCount(), a.pageCount());
            case DOCUMENT_ID -> Objects.compare(a.documentId(), b.documentId(), Comparator.naturalOrder());
        };
    }

    private static int compareDatesDescMissingLast(LocalDate a, LocalDate b) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        return b.compareTo(a);
    }
}
