package com.company.silencing.domain;

import com.company.silencing.domain.enums.SilenceStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Silence domain model: suppresses notifications for alerts matching all of its
 * matchers between startsAt (inclusive) and endsAt (exclusive).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Silence implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int MAX_CREATED_BY_LENGTH = 255;
    public static final int MIN_COMMENT_LENGTH = 3;
    public static final int MAX_COMMENT_LENGTH = 1024;
    public static final int MAX_MATCHERS = 100;

    // UUID, assigned on create when absent
    private String id;

    @NotBlank(message = "Creator is required")
    @Size(max = MAX_CREATED_BY_LENGTH, message = "Creator must be at most 255 characters")
    private String createdBy;

    @NotNull(message = "Comment is required")
    @Size(min = MIN_COMMENT_LENGTH, max = MAX_COMMENT_LENGTH,
            message = "Comment must be between 3 and 1024 characters")
    private String comment;

    @NotNull(message = "Start time is required")
    private Instant startsAt;

    @NotNull(message = "End time is required")
    private Instant endsAt;

    @NotEmpty(message = "At least one matcher is required")
    @Size(max = MAX_MATCHERS, message = "At most 100 matchers are allowed")
    private List<@NotNull @Valid Matcher> matchers;

    // Derived from startsAt/endsAt, recomputed on every read and write
    private SilenceStatus status;

    private Instant createdAt;

    // Optimistic concurrency token
    private Instant updatedAt;

    /**
     * Status of this silence at the given instant, independent of the stored status field.
     */
    public SilenceStatus statusAt(Instant now) {
        return SilenceStatus.at(startsAt, endsAt, now);
    }

    public boolean isActiveAt(Instant now) {
        return statusAt(now) == SilenceStatus.ACTIVE;
    }

    /**
     * Copy safe to hand out of a shared cache. Matchers are immutable, the list is not.
     */
    public Silence copy() {
        return toBuilder()
                .matchers(matchers != null ? new ArrayList<>(matchers) : null)
                .build();
    }
}
