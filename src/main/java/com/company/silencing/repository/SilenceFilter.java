package com.company.silencing.repository;

import com.company.silencing.domain.enums.SilenceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Query filter for listing and counting silences. Null fields are not applied.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SilenceFilter {

    // Any of these (derived from the time window at query time)
    private List<SilenceStatus> statuses;

    private String createdBy;

    // When both are set they must hold on the same matcher
    private String matcherName;
    private String matcherValue;

    private Instant startsAfter;
    private Instant startsBefore;
    private Instant endsAfter;
    private Instant endsBefore;

    // Defaults to the configured default limit, capped at the configured maximum
    private Integer limit;
    private Integer offset;

    private SortField sortBy;
    private SortDirection direction;

    public static SilenceFilter all() {
        return new SilenceFilter();
    }

    public static SilenceFilter byStatus(SilenceStatus... statuses) {
        return SilenceFilter.builder().statuses(List.of(statuses)).build();
    }

    public enum SortField {
        CREATED_AT("created_at"),
        STARTS_AT("starts_at"),
        ENDS_AT("ends_at");

        private final String column;

        SortField(String column) {
            this.column = column;
        }

        public String getColumn() {
            return column;
        }
    }

    public enum SortDirection {
        ASC,
        DESC
    }
}
