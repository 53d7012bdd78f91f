package com.company.silencing.repository;

import com.company.silencing.config.SilenceProperties;
import com.company.silencing.domain.Matcher;
import com.company.silencing.domain.Silence;
import com.company.silencing.domain.enums.MatcherType;
import com.company.silencing.domain.enums.SilenceStatus;
import com.company.silencing.exception.SilenceAlreadyExistsException;
import com.company.silencing.exception.SilenceConflictException;
import com.company.silencing.exception.SilenceException;
import com.company.silencing.exception.SilenceNotFoundException;
import com.company.silencing.exception.SilenceValidationException;
import com.company.silencing.exception.StorageUnavailableException;
import com.company.silencing.util.TimeUtils;
import com.company.silencing.validation.SilenceValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Durable silence storage over JDBC.
 *
 * <p>Every mutation is a single statement or a single transaction; concurrent updates of the
 * same silence are arbitrated by the database through the updated_at compare-and-swap.
 * No in-process locking happens here.
 *
 * <p>The stored status column is GC bookkeeping only. Returned silences always carry the status
 * derived from their time window at read time.
 */
@Repository
@Slf4j
public class SilenceRepository {

    private static final int MATCHER_LOAD_CHUNK = 500;

    private static final String INSERT_SILENCE = """
        INSERT INTO silences (
            id, created_by, comment_text, starts_at, ends_at,
            status, created_at, updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String INSERT_MATCHER = """
        INSERT INTO silence_matchers (silence_id, matcher_index, label_name, label_value, match_type)
        VALUES (?, ?, ?, ?, ?)
        """;

    private static final String UPDATE_SILENCE = """
        UPDATE silences
        SET comment_text = ?,
            starts_at = ?,
            ends_at = ?,
            status = ?,
            updated_at = ?
        WHERE id = ?
        AND updated_at = ?
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SilenceValidator validator;
    private final Clock clock;
    private final SilenceQueryBuilder queryBuilder;
    private final int batchSize;
    private final int expiringSoonLimit;

    public SilenceRepository(JdbcTemplate jdbcTemplate,
                             TransactionTemplate transactionTemplate,
                             SilenceValidator validator,
                             Clock clock,
                             SilenceProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.validator = validator;
        this.clock = clock;
        this.queryBuilder = new SilenceQueryBuilder(
                properties.getQuery().getDefaultLimit(),
                properties.getQuery().getMaxLimit());
        this.batchSize = properties.getGc().getBatchSize();
        this.expiringSoonLimit = properties.getQuery().getExpiringSoonLimit();
    }

    /**
     * Insert a new silence and its matchers in one transaction.
     * Assigns a UUID when the id is empty.
     */
    public Silence createSilence(Silence silence) {
        validator.validate(silence);

        Instant now = TimeUtils.now(clock);
        Silence toInsert = silence.copy();
        if (toInsert.getId() == null || toInsert.getId().isEmpty()) {
            toInsert.setId(UUID.randomUUID().toString());
        }
        toInsert.setStartsAt(TimeUtils.truncate(toInsert.getStartsAt()));
        toInsert.setEndsAt(TimeUtils.truncate(toInsert.getEndsAt()));
        toInsert.setCreatedAt(now);
        toInsert.setUpdatedAt(now);
        toInsert.setStatus(toInsert.statusAt(now));

        execute("create", () -> transactionTemplate.execute(tx -> {
            try {
                jdbcTemplate.update(INSERT_SILENCE,
                        toInsert.getId(),
                        toInsert.getCreatedBy(),
                        toInsert.getComment(),
                        Timestamp.from(toInsert.getStartsAt()),
                        Timestamp.from(toInsert.getEndsAt()),
                        toInsert.getStatus().getValue(),
                        Timestamp.from(now),
                        Timestamp.from(now));
            } catch (DuplicateKeyException e) {
                throw new SilenceAlreadyExistsException(toInsert.getId(), e);
            }
            insertMatchers(toInsert.getId(), toInsert.getMatchers());
            return null;
        }));

        log.info("Created silence {} by {} ({} matchers, status {}, ends {})",
                toInsert.getId(), toInsert.getCreatedBy(), toInsert.getMatchers().size(),
                toInsert.getStatus().getValue(), toInsert.getEndsAt());

        return toInsert;
    }

    public Silence getSilenceById(String id) {
        requireId(id);
        return execute("get", () -> findById(id, TimeUtils.now(clock)))
                .orElseThrow(() -> new SilenceNotFoundException(id));
    }

    /**
     * Filtered, sorted, paginated listing. Empty list when nothing matches.
     */
    public List<Silence> listSilences(SilenceFilter filter) {
        SilenceFilter effective = filter != null ? filter : SilenceFilter.all();
        Instant now = TimeUtils.now(clock);
        SqlQuery query = queryBuilder.buildListQuery(effective, now);

        return execute("list", () -> {
            List<Silence> silences = jdbcTemplate.query(
                    query.getSql(), new SilenceRowMapper(now), query.getArgs());
            attachMatchers(silences);
            log.debug("Listed {} silences", silences.size());
            return silences;
        });
    }

    public long countSilences(SilenceFilter filter) {
        SilenceFilter effective = filter != null ? filter : SilenceFilter.all();
        SqlQuery query = queryBuilder.buildCountQuery(effective, TimeUtils.now(clock));

        return execute("count", () -> {
            Long count = jdbcTemplate.queryForObject(query.getSql(), Long.class, query.getArgs());
            return count != null ? count : 0L;
        });
    }

    /**
     * Compare-and-swap update: succeeds only if the caller's updatedAt equals the stored one.
     * created_by and created_at are never changed.
     *
     * @return the stored silence after the update
     */
    public Silence updateSilence(Silence silence) {
        validator.validate(silence);
        requireId(silence.getId());
        if (silence.getUpdatedAt() == null) {
            throw new SilenceValidationException("updatedAt", "Update token is required");
        }

        String id = silence.getId();
        Instant expectedVersion = TimeUtils.truncate(silence.getUpdatedAt());
        Instant now = TimeUtils.now(clock);
        Instant newVersion = TimeUtils.nextVersion(expectedVersion, now);
        Instant startsAt = TimeUtils.truncate(silence.getStartsAt());
        Instant endsAt = TimeUtils.truncate(silence.getEndsAt());
        SilenceStatus status = SilenceStatus.at(startsAt, endsAt, now);

        Silence updated = execute("update", () -> transactionTemplate.execute(tx -> {
            int rows = jdbcTemplate.update(UPDATE_SILENCE,
                    silence.getComment(),
                    Timestamp.from(startsAt),
                    Timestamp.from(endsAt),
                    status.getValue(),
                    Timestamp.from(newVersion),
                    id,
                    Timestamp.from(expectedVersion));

            if (rows == 0) {
                if (!exists(id)) {
                    throw new SilenceNotFoundException(id);
                }
                throw new SilenceConflictException(id);
            }

            jdbcTemplate.update("DELETE FROM silence_matchers WHERE silence_id = ?", id);
            insertMatchers(id, silence.getMatchers());

            return findById(id, now).orElseThrow(() -> new SilenceNotFoundException(id));
        }));

        log.info("Updated silence {} (status {}, ends {}, version {})",
                id, updated.getStatus().getValue(), updated.getEndsAt(), updated.getUpdatedAt());

        return updated;
    }

    /**
     * Hard delete; matchers go with the silence (cascade).
     */
    public void deleteSilence(String id) {
        requireId(id);
        int rows = execute("delete", () -> jdbcTemplate.update("DELETE FROM silences WHERE id = ?", id));
        if (rows == 0) {
            throw new SilenceNotFoundException(id);
        }
        log.info("Deleted silence {}", id);
    }

    /**
     * Soft-expire only.
     */
    public int expireSilences(Instant before) {
        return expireSilences(before, false);
    }

    /**
     * Soft mode: mark silences with ends_at before the cutoff as expired.
     * Hard mode: delete silences already marked expired whose ends_at is before the cutoff.
     * Touches at most batchSize rows per call.
     *
     * @return number of affected silences
     */
    public int expireSilences(Instant before, boolean hardDelete) {
        Timestamp cutoff = Timestamp.from(before);
        String expired = SilenceStatus.EXPIRED.getValue();

        int affected = execute(hardDelete ? "delete-expired" : "expire", () -> transactionTemplate.execute(tx -> {
            String selectSql = hardDelete
                    ? """
                      SELECT id FROM silences
                      WHERE status = ? AND ends_at < ?
                      ORDER BY ends_at, id
                      """
                    : """
                      SELECT id FROM silences
                      WHERE status <> ? AND ends_at < ?
                      ORDER BY ends_at, id
                      """;

            List<String> ids = jdbcTemplate.queryForList(
                    selectSql + "FETCH FIRST " + batchSize + " ROWS ONLY",
                    String.class, expired, cutoff);

            if (ids.isEmpty()) {
                return 0;
            }

            String placeholders = placeholders(ids.size());
            Object[] params = new Object[ids.size() + 2];
            params[0] = expired;
            for (int i = 0; i < ids.size(); i++) {
                params[i + 1] = ids.get(i);
            }
            params[ids.size() + 1] = cutoff;

            if (hardDelete) {
                return jdbcTemplate.update(
                        "DELETE FROM silences WHERE status = ? AND id IN (" + placeholders + ") AND ends_at < ?",
                        params);
            }
            Object[] updateParams = new Object[params.length + 1];
            updateParams[0] = expired;
            System.arraycopy(params, 0, updateParams, 1, params.length);
            return jdbcTemplate.update(
                    "UPDATE silences SET status = ? WHERE status <> ? AND id IN (" + placeholders + ") AND ends_at < ?",
                    updateParams);
        }));

        if (affected > 0) {
            log.info("{} {} silences (ends before {})",
                    hardDelete ? "Deleted" : "Expired", affected, before);
        } else {
            log.debug("No silences to {} before {}", hardDelete ? "delete" : "expire", before);
        }
        return affected;
    }

    /**
     * Active silences ending within the window, soonest first.
     */
    public List<Silence> getExpiringSoon(Duration window) {
        Instant now = TimeUtils.now(clock);
        Timestamp nowTs = Timestamp.from(now);
        Timestamp horizon = Timestamp.from(now.plus(window));

        String sql = SilenceQueryBuilder.SELECT_BASE + """
            WHERE s.starts_at <= ?
            AND s.ends_at > ?
            AND s.ends_at <= ?
            ORDER BY s.ends_at ASC, s.id ASC
            """ + "FETCH FIRST " + expiringSoonLimit + " ROWS ONLY";

        return execute("expiring-soon", () -> {
            List<Silence> silences = jdbcTemplate.query(sql, new SilenceRowMapper(now), nowTs, nowTs, horizon);
            attachMatchers(silences);
            return silences;
        });
    }

    /**
     * Set the stored status of all given silences atomically. Any missing id rolls back the whole batch.
     */
    public int bulkUpdateStatus(Collection<String> ids, SilenceStatus status) {
        if (status == null) {
            throw new SilenceValidationException("status", "Status is required");
        }
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        List<String> distinctIds = ids.stream().distinct().toList();

        int updated = execute("bulk-update-status", () -> transactionTemplate.execute(tx -> {
            int count = 0;
            for (String id : distinctIds) {
                int rows = jdbcTemplate.update("UPDATE silences SET status = ? WHERE id = ?",
                        status.getValue(), id);
                if (rows == 0) {
                    throw new SilenceNotFoundException(id);
                }
                count += rows;
            }
            return count;
        }));

        log.info("Bulk-updated {} silences to status {}", updated, status.getValue());
        return updated;
    }

    /**
     * Every silence that has not ended yet (pending and active). Used to load the in-memory cache.
     */
    public List<Silence> listUnexpiredSilences() {
        Instant now = TimeUtils.now(clock);
        String sql = SilenceQueryBuilder.SELECT_BASE + """
            WHERE s.ends_at > ?
            ORDER BY s.ends_at ASC, s.id ASC
            """;

        return execute("list-unexpired", () -> {
            List<Silence> silences = jdbcTemplate.query(sql, new SilenceRowMapper(now), Timestamp.from(now));
            attachMatchers(silences);
            return silences;
        });
    }

    public SilenceStats getSilenceStats() {
        Timestamp now = Timestamp.from(TimeUtils.now(clock));

        String countSql = """
            SELECT COUNT(*) AS total,
                   COALESCE(SUM(CASE WHEN starts_at > ? THEN 1 ELSE 0 END), 0) AS pending,
                   COALESCE(SUM(CASE WHEN starts_at <= ? AND ends_at > ? THEN 1 ELSE 0 END), 0) AS active,
                   COALESCE(SUM(CASE WHEN ends_at <= ? THEN 1 ELSE 0 END), 0) AS expired
            FROM silences
            """;

        String creatorSql = """
            SELECT created_by, COUNT(*) AS silence_count
            FROM silences
            GROUP BY created_by
            ORDER BY silence_count DESC, created_by ASC
            FETCH FIRST 10 ROWS ONLY
            """;

        return execute("stats", () -> {
            SilenceStats stats = jdbcTemplate.queryForObject(countSql, (rs, rowNum) -> SilenceStats.builder()
                    .total(rs.getLong("total"))
                    .pending(rs.getLong("pending"))
                    .active(rs.getLong("active"))
                    .expired(rs.getLong("expired"))
                    .build(), now, now, now, now);

            Map<String, Long> byCreator = new LinkedHashMap<>();
            jdbcTemplate.query(creatorSql, rs -> {
                byCreator.put(rs.getString("created_by"), rs.getLong("silence_count"));
            });
            stats.setByCreator(byCreator);
            return stats;
        });
    }

    private Optional<Silence> findById(String id, Instant now) {
        List<Silence> rows = jdbcTemplate.query(
                SilenceQueryBuilder.SELECT_BASE + "WHERE s.id = ?",
                new SilenceRowMapper(now), id);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        attachMatchers(rows);
        return Optional.of(rows.get(0));
    }

    private boolean exists(String id) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM silences WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    private void insertMatchers(String silenceId, List<Matcher> matchers) {
        List<Object[]> batch = new ArrayList<>(matchers.size());
        for (int i = 0; i < matchers.size(); i++) {
            Matcher matcher = matchers.get(i);
            batch.add(new Object[]{
                    silenceId, i, matcher.getName(), matcher.getValue(), matcher.getType().getOperator()
            });
        }
        jdbcTemplate.batchUpdate(INSERT_MATCHER, batch);
    }

    /**
     * Load matchers for all given silences with one IN query per chunk.
     */
    private void attachMatchers(List<Silence> silences) {
        if (silences.isEmpty()) {
            return;
        }

        Map<String, List<Matcher>> byId = new HashMap<>();
        List<String> ids = silences.stream().map(Silence::getId).toList();

        for (int from = 0; from < ids.size(); from += MATCHER_LOAD_CHUNK) {
            List<String> chunk = ids.subList(from, Math.min(from + MATCHER_LOAD_CHUNK, ids.size()));
            String sql = """
                SELECT silence_id, matcher_index, label_name, label_value, match_type
                FROM silence_matchers
                WHERE silence_id IN (%s)
                ORDER BY silence_id, matcher_index
                """.formatted(placeholders(chunk.size()));

            jdbcTemplate.query(sql, rs -> {
                byId.computeIfAbsent(rs.getString("silence_id"), k -> new ArrayList<>())
                        .add(new Matcher(
                                rs.getString("label_name"),
                                rs.getString("label_value"),
                                MatcherType.fromOperator(rs.getString("match_type"))));
            }, chunk.toArray());
        }

        for (Silence silence : silences) {
            silence.setMatchers(byId.getOrDefault(silence.getId(), Collections.emptyList()));
        }
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (SilenceException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Silence storage failure during {}", operation, e);
            throw new StorageUnavailableException(operation, e);
        }
    }

    private static void requireId(String id) {
        if (id == null || id.isEmpty()) {
            throw new SilenceValidationException("id", "Silence ID is required");
        }
    }

    private static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }

    private static class SilenceRowMapper implements RowMapper<Silence> {

        private final Instant now;

        SilenceRowMapper(Instant now) {
            this.now = now;
        }

        @Override
        public Silence mapRow(ResultSet rs, int rowNum) throws SQLException {
            Instant startsAt = toInstant(rs.getTimestamp("starts_at"));
            Instant endsAt = toInstant(rs.getTimestamp("ends_at"));
            return Silence.builder()
                    .id(rs.getString("id"))
                    .createdBy(rs.getString("created_by"))
                    .comment(rs.getString("comment_text"))
                    .startsAt(startsAt)
                    .endsAt(endsAt)
                    .status(SilenceStatus.at(startsAt, endsAt, now))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }

        private static Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
