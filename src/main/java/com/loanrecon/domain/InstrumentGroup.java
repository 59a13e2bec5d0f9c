package com.loanrecon.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Documents believed to be drafts of one logical instrument. Created UNRESOLVED by grouping;
 * only version resolution moves it to RESOLVED and fills {@link #versions}.
 */
@Document(collection = "instrument_groups")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class InstrumentGroup {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String loanId;
    private String executionId;
    /** "hint:&lt;oracle hint&gt;" or "fp:&lt;type label&gt;:&lt;lowest member id&gt;". */
    private String groupKey;
    private String instrumentType;
    /** Sorted ascending. */
    private List<String> memberDocumentIds = new ArrayList<>();
    private GroupStatus status = GroupStatus.UNRESOLVED;
    private List<VersionRecord> versions = new ArrayList<>();
    private List<GroupingConflict> conflicts = new ArrayList<>();
    private Instant resolvedAt;

    public Optional<VersionRecord> master() {
        if (status != GroupStatus.RESOLVED || versions == null) {
            return Optional.empty();
        }
        return versions.stream()
                .filter(v -> v.getRank() == 0)
                .filter(v -> v.getRole() == VersionRecord.Role.MASTER || v.getRole() == VersionRecord.Role.UNIQUE)
                .findFirst();
    }

    public Optional<String> masterDocumentId() {
        return master().map(VersionRecord::getDocumentId);
    }

    public enum GroupStatus {
        UNRESOLVED,
        RESOLVED
    }
}
