package com.company.silencing.repository;

import com.company.silencing.config.SilenceProperties;
import com.company.silencing.domain.Matcher;
import com.company.silencing.domain.Silence;
import com.company.silencing.domain.enums.MatcherType;
import com.company.silencing.domain.enums.SilenceStatus;
import com.company.silencing.exception.SilenceAlreadyExistsException;
import com.company.silencing.exception.SilenceConflictException;
import com.company.silencing.exception.SilenceNotFoundException;
import com.company.silencing.exception.SilenceValidationException;
import com.company.silencing.support.MutableClock;
import com.company.silencing.support.SilenceDatabase;
import com.company.silencing.support.TestSilences;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SilenceRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private SilenceDatabase database;
    private MutableClock clock;
    private SilenceRepository repository;

    @BeforeEach
    void setUp() {
        database = new SilenceDatabase();
        clock = new MutableClock(NOW);
        repository = database.repository(clock);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void createAndGetRoundTripsAllFields() {
        Silence input = TestSilences.silence(NOW.minusSeconds(60), NOW.plus(Duration.ofHours(2)),
                Matcher.equal("alertname", "HighCPU"),
                Matcher.regex("instance", "web-\\d+"),
                Matcher.notEqual("env", "dev"),
                Matcher.notRegex("team", "^infra"));

        Silence created = repository.createSilence(input);

        assertNotNull(created.getId());
        assertEquals(NOW, created.getCreatedAt());
        assertEquals(NOW, created.getUpdatedAt());
        assertEquals(SilenceStatus.ACTIVE, created.getStatus());

        Silence loaded = repository.getSilenceById(created.getId());
        assertEquals(created.getId(), loaded.getId());
        assertEquals("alice", loaded.getCreatedBy());
        assertEquals("maintenance window", loaded.getComment());
        assertEquals(input.getStartsAt(), loaded.getStartsAt());
        assertEquals(input.getEndsAt(), loaded.getEndsAt());
        assertEquals(input.getMatchers(), loaded.getMatchers());
        assertEquals(MatcherType.NOT_REGEX, loaded.getMatchers().get(3).getType());
        assertEquals(SilenceStatus.ACTIVE, loaded.getStatus());
        assertEquals(created.getUpdatedAt(), loaded.getUpdatedAt());
    }

    @Test
    void createKeepsCallerSuppliedId() {
        String id = UUID.randomUUID().toString();
        Silence input = TestSilences.activeAt(NOW);
        input.setId(id);

        assertEquals(id, repository.createSilence(input).getId());
        assertThrows(SilenceAlreadyExistsException.class, () -> repository.createSilence(input));
    }

    @Test
    void createRejectsInvalidSilenceBeforeTouchingStorage() {
        Silence input = TestSilences.silence(NOW, NOW.minusSeconds(1), Matcher.equal("a", "b"));

        SilenceValidationException e = assertThrows(SilenceValidationException.class,
                () -> repository.createSilence(input));
        assertTrue(e.getFieldErrors().containsKey("endsAt"));
        assertEquals(0, repository.countSilences(SilenceFilter.all()));
    }

    @Test
    void getUnknownIdThrowsNotFound() {
        assertThrows(SilenceNotFoundException.class,
                () -> repository.getSilenceById(UUID.randomUUID().toString()));
    }

    @Test
    void statusIsDerivedFromTimestampsAtReadTime() {
        Silence created = repository.createSilence(TestSilences.silence(
                NOW.plus(Duration.ofHours(1)), NOW.plus(Duration.ofHours(2)), Matcher.equal("a", "b")));
        assertEquals(SilenceStatus.PENDING, repository.getSilenceById(created.getId()).getStatus());

        clock.set(NOW.plus(Duration.ofMinutes(90)));
        assertEquals(SilenceStatus.ACTIVE, repository.getSilenceById(created.getId()).getStatus());

        clock.set(NOW.plus(Duration.ofHours(3)));
        assertEquals(SilenceStatus.EXPIRED, repository.getSilenceById(created.getId()).getStatus());
    }

    @Test
    void paginationReturnsDisjointPages() {
        for (int i = 0; i < 15; i++) {
            repository.createSilence(TestSilences.activeAt(NOW));
        }

        List<Silence> first = repository.listSilences(SilenceFilter.builder().limit(10).offset(0).build());
        List<Silence> second = repository.listSilences(SilenceFilter.builder().limit(10).offset(10).build());

        assertEquals(10, first.size());
        assertEquals(5, second.size());

        Set<String> ids = new HashSet<>();
        first.forEach(s -> ids.add(s.getId()));
        second.forEach(s -> ids.add(s.getId()));
        assertEquals(15, ids.size());
    }

    @Test
    void listRejectsNegativeLimit() {
        assertThrows(SilenceValidationException.class,
                () -> repository.listSilences(SilenceFilter.builder().limit(-1).build()));
    }

    @Test
    void listFiltersByStatusCreatorAndMatcher() {
        Silence active = repository.createSilence(TestSilences.silence(
                NOW.minusSeconds(60), NOW.plusSeconds(3600),
                Matcher.equal("alertname", "HighCPU"), Matcher.equal("env", "prod")));
        Silence pending = repository.createSilence(TestSilences.silence(
                NOW.plusSeconds(600), NOW.plusSeconds(3600), Matcher.equal("alertname", "DiskFull")));
        Silence bobs = repository.createSilence(TestSilences.silence(
                NOW.minusSeconds(60), NOW.plusSeconds(60), Matcher.equal("alertname", "prod"))
                .toBuilder().createdBy("bob").build());

        List<Silence> activeOnly = repository.listSilences(SilenceFilter.byStatus(SilenceStatus.ACTIVE));
        assertEquals(Set.of(active.getId(), bobs.getId()), ids(activeOnly));

        List<Silence> pendingOnly = repository.listSilences(SilenceFilter.byStatus(SilenceStatus.PENDING));
        assertEquals(Set.of(pending.getId()), ids(pendingOnly));

        List<Silence> byBob = repository.listSilences(SilenceFilter.builder().createdBy("bob").build());
        assertEquals(Set.of(bobs.getId()), ids(byBob));

        List<Silence> envProd = repository.listSilences(
                SilenceFilter.builder().matcherName("env").matcherValue("prod").build());
        assertEquals(Set.of(active.getId()), ids(envProd));

        List<Silence> alertname = repository.listSilences(
                SilenceFilter.builder().matcherName("alertname").build());
        assertEquals(3, alertname.size());

        clock.set(NOW.plusSeconds(120));
        List<Silence> expired = repository.listSilences(SilenceFilter.byStatus(SilenceStatus.EXPIRED));
        assertEquals(Set.of(bobs.getId()), ids(expired));
    }

    @Test
    void matcherNameAndValueMayHoldOnDifferentMatchers() {
        Silence split = repository.createSilence(TestSilences.silence(
                NOW.minusSeconds(60), NOW.plusSeconds(3600),
                Matcher.equal("alertname", "HighCPU"), Matcher.equal("env", "prod")));
        Silence same = repository.createSilence(TestSilences.silence(
                NOW.minusSeconds(60), NOW.plusSeconds(3600), Matcher.equal("alertname", "prod")));
        repository.createSilence(TestSilences.silence(
                NOW.minusSeconds(60), NOW.plusSeconds(3600), Matcher.equal("env", "prod")));

        SilenceFilter filter = SilenceFilter.builder().matcherName("alertname").matcherValue("prod").build();

        assertEquals(Set.of(split.getId(), same.getId()), ids(repository.listSilences(filter)));
        assertEquals(2, repository.countSilences(filter));
    }

    @Test
    void listSortsByEndTimeAscending() {
        Silence late = repository.createSilence(TestSilences.silence(
                NOW, NOW.plusSeconds(300), Matcher.equal("a", "1")));
        Silence early = repository.createSilence(TestSilences.silence(
                NOW, NOW.plusSeconds(100), Matcher.equal("a", "2")));

        List<Silence> sorted = repository.listSilences(SilenceFilter.builder()
                .sortBy(SilenceFilter.SortField.ENDS_AT)
                .direction(SilenceFilter.SortDirection.ASC)
                .build());

        assertEquals(List.of(early.getId(), late.getId()), sorted.stream().map(Silence::getId).toList());
    }

    @Test
    void countMatchesFilter() {
        repository.createSilence(TestSilences.activeAt(NOW));
        repository.createSilence(TestSilences.activeAt(NOW));
        repository.createSilence(TestSilences.silence(NOW.plusSeconds(60), NOW.plusSeconds(120),
                Matcher.equal("a", "b")));

        assertEquals(3, repository.countSilences(SilenceFilter.all()));
        assertEquals(2, repository.countSilences(SilenceFilter.byStatus(SilenceStatus.ACTIVE)));
    }

    @Test
    void updateWithCurrentTokenSucceedsAndStaleTokenConflicts() {
        Silence created = repository.createSilence(TestSilences.activeAt(NOW));

        Silence change = created.toBuilder()
                .comment("extended maintenance")
                .endsAt(NOW.plus(Duration.ofHours(4)))
                .matchers(List.of(Matcher.equal("alertname", "HighMemory")))
                .build();
        Silence updated = repository.updateSilence(change);

        assertEquals("extended maintenance", updated.getComment());
        assertEquals(NOW.plus(Duration.ofHours(4)), updated.getEndsAt());
        assertEquals(List.of(Matcher.equal("alertname", "HighMemory")), updated.getMatchers());
        assertEquals(created.getCreatedAt(), updated.getCreatedAt());
        assertNotEquals(created.getUpdatedAt(), updated.getUpdatedAt());

        // Same token again, now stale
        assertThrows(SilenceConflictException.class, () -> repository.updateSilence(change));
    }

    @Test
    void updateUnknownIdThrowsNotFound() {
        Silence ghost = TestSilences.activeAt(NOW);
        ghost.setId(UUID.randomUUID().toString());
        ghost.setUpdatedAt(NOW);

        assertThrows(SilenceNotFoundException.class, () -> repository.updateSilence(ghost));
    }

    @Test
    void updateWithoutTokenIsRejected() {
        Silence created = repository.createSilence(TestSilences.activeAt(NOW));
        created.setUpdatedAt(null);

        assertThrows(SilenceValidationException.class, () -> repository.updateSilence(created));
    }

    @Test
    void concurrentUpdatesFromSameTokenYieldOneSuccessAndOneConflict() throws Exception {
        Silence created = repository.createSilence(TestSilences.activeAt(NOW));
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            List<Future<Silence>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                String comment = "writer " + i;
                Callable<Silence> task = () -> {
                    go.await();
                    return repository.updateSilence(created.toBuilder().comment(comment).build());
                };
                futures.add(pool.submit(task));
            }
            go.countDown();

            int successes = 0;
            int conflicts = 0;
            for (Future<Silence> future : futures) {
                try {
                    future.get(10, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException e) {
                    assertInstanceOf(SilenceConflictException.class, e.getCause());
                    conflicts++;
                }
            }
            assertEquals(1, successes);
            assertEquals(1, conflicts);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void deleteRemovesSilenceAndMatchers() {
        Silence created = repository.createSilence(TestSilences.activeAt(NOW));

        repository.deleteSilence(created.getId());

        assertThrows(SilenceNotFoundException.class, () -> repository.getSilenceById(created.getId()));
        Integer matchers = database.jdbc().queryForObject(
                "SELECT COUNT(*) FROM silence_matchers WHERE silence_id = ?", Integer.class, created.getId());
        assertEquals(0, matchers);
        assertThrows(SilenceNotFoundException.class, () -> repository.deleteSilence(created.getId()));
    }

    @Test
    void softExpireIsIdempotent() {
        repository.createSilence(TestSilences.silence(NOW.minusSeconds(600), NOW.plusSeconds(60),
                Matcher.equal("a", "b")));
        repository.createSilence(TestSilences.silence(NOW.minusSeconds(600), NOW.plusSeconds(3600),
                Matcher.equal("a", "c")));

        clock.set(NOW.plusSeconds(120));
        assertEquals(1, repository.expireSilences(NOW.plusSeconds(120)));
        assertEquals(0, repository.expireSilences(NOW.plusSeconds(120)));
        assertEquals(2, repository.countSilences(SilenceFilter.all()));
    }

    @Test
    void softExpireDoesNotChangeUpdateToken() {
        Silence created = repository.createSilence(TestSilences.silence(
                NOW.minusSeconds(600), NOW.plusSeconds(60), Matcher.equal("a", "b")));

        clock.set(NOW.plusSeconds(120));
        repository.expireSilences(NOW.plusSeconds(120));

        assertEquals(created.getUpdatedAt(), repository.getSilenceById(created.getId()).getUpdatedAt());
    }

    @Test
    void hardDeleteOnlyRemovesExpiredSilencesPastCutoff() {
        Silence old = repository.createSilence(TestSilences.silence(
                NOW.minusSeconds(600), NOW.plusSeconds(60), Matcher.equal("a", "b")));
        Silence recent = repository.createSilence(TestSilences.silence(
                NOW.minusSeconds(600), NOW.plus(Duration.ofHours(36)), Matcher.equal("a", "c")));

        clock.set(NOW.plus(Duration.ofDays(2)));
        Instant now = NOW.plus(Duration.ofDays(2));

        // Not yet marked expired: hard delete skips it
        assertEquals(0, repository.expireSilences(now.minus(Duration.ofHours(24)), true));

        assertEquals(2, repository.expireSilences(now));
        assertEquals(1, repository.expireSilences(now.minus(Duration.ofHours(24)), true));

        assertThrows(SilenceNotFoundException.class, () -> repository.getSilenceById(old.getId()));
        assertEquals(SilenceStatus.EXPIRED, repository.getSilenceById(recent.getId()).getStatus());
    }

    @Test
    void expireIsCappedByBatchSize() {
        SilenceProperties properties = new SilenceProperties();
        properties.getGc().setBatchSize(2);
        SilenceRepository capped = database.repository(clock, properties);

        for (int i = 0; i < 5; i++) {
            capped.createSilence(TestSilences.silence(NOW.minusSeconds(60), NOW.plusSeconds(10 + i),
                    Matcher.equal("a", "b")));
        }
        clock.set(NOW.plusSeconds(600));

        assertEquals(2, capped.expireSilences(NOW.plusSeconds(600)));
        assertEquals(2, capped.expireSilences(NOW.plusSeconds(600)));
        assertEquals(1, capped.expireSilences(NOW.plusSeconds(600)));
        assertEquals(0, capped.expireSilences(NOW.plusSeconds(600)));
    }

    @Test
    void expiringSoonReturnsActiveSilencesEndingWithinWindowSoonestFirst() {
        Silence later = repository.createSilence(TestSilences.silence(
                NOW.minusSeconds(60), NOW.plusSeconds(600), Matcher.equal("a", "1")));
        Silence sooner = repository.createSilence(TestSilences.silence(
                NOW.minusSeconds(60), NOW.plusSeconds(120), Matcher.equal("a", "2")));
        repository.createSilence(TestSilences.silence(
                NOW.minusSeconds(60), NOW.plus(Duration.ofHours(2)), Matcher.equal("a", "3")));
        repository.createSilence(TestSilences.silence(
                NOW.plusSeconds(60), NOW.plusSeconds(300), Matcher.equal("a", "pending")));

        List<Silence> expiring = repository.getExpiringSoon(Duration.ofMinutes(15));

        assertEquals(List.of(sooner.getId(), later.getId()),
                expiring.stream().map(Silence::getId).toList());
        assertFalse(expiring.get(0).getMatchers().isEmpty());
    }

    @Test
    void bulkUpdateStatusIsAllOrNothing() {
        Silence a = repository.createSilence(TestSilences.activeAt(NOW));
        Silence b = repository.createSilence(TestSilences.activeAt(NOW));

        assertThrows(SilenceNotFoundException.class, () -> repository.bulkUpdateStatus(
                List.of(a.getId(), UUID.randomUUID().toString()), SilenceStatus.EXPIRED));
        assertEquals("active", storedStatus(a.getId()));

        assertEquals(2, repository.bulkUpdateStatus(List.of(a.getId(), b.getId()), SilenceStatus.EXPIRED));
        assertEquals("expired", storedStatus(a.getId()));
        assertEquals("expired", storedStatus(b.getId()));
        assertEquals(0, repository.bulkUpdateStatus(List.of(), SilenceStatus.EXPIRED));
    }

    @Test
    void listUnexpiredSkipsEndedSilences() {
        Silence live = repository.createSilence(TestSilences.activeAt(NOW));
        Silence pending = repository.createSilence(TestSilences.silence(
                NOW.plusSeconds(60), NOW.plusSeconds(120), Matcher.equal("a", "b")));
        repository.createSilence(TestSilences.silence(NOW.minusSeconds(60), NOW.plusSeconds(1),
                Matcher.equal("a", "b")));

        clock.set(NOW.plusSeconds(30));

        assertEquals(Set.of(live.getId(), pending.getId()), ids(repository.listUnexpiredSilences()));
    }

    @Test
    void statsCountByDerivedStatusAndCreator() {
        repository.createSilence(TestSilences.activeAt(NOW));
        repository.createSilence(TestSilences.activeAt(NOW));
        repository.createSilence(TestSilences.silence(NOW.plusSeconds(60), NOW.plusSeconds(120),
                Matcher.equal("a", "b")).toBuilder().createdBy("bob").build());

        SilenceStats stats = repository.getSilenceStats();

        assertEquals(3, stats.getTotal());
        assertEquals(2, stats.getActive());
        assertEquals(1, stats.getPending());
        assertEquals(0, stats.getExpired());
        assertEquals(2L, stats.getByCreator().get("alice"));
        assertEquals(1L, stats.getByCreator().get("bob"));
    }

    private String storedStatus(String id) {
        return database.jdbc().queryForObject("SELECT status FROM silences WHERE id = ?", String.class, id);
    }

    private static Set<String> ids(List<Silence> silences) {
        Set<String> ids = new HashSet<>();
        silences.forEach(s -> ids.add(s.getId()));
        return ids;
    }
}
