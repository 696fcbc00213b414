package com.repopulse.syncer.orchestrator;

import com.repopulse.syncer.client.FailFastSequence;
import com.repopulse.syncer.client.GitHubApiClient;
import com.repopulse.syncer.client.RemoteFetchException;
import com.repopulse.syncer.config.SyncOptions;
import com.repopulse.syncer.loader.InMemoryRepositoryStore;
import com.repopulse.syncer.model.DailyActivity;
import com.repopulse.syncer.model.RepositorySnapshot;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end test for the synchronization orchestrator. Mocks the GitHub API
 * client and runs against an in-memory store that counts written rows.
 */
@ExtendWith(MockitoExtension.class)
class SyncOrchestratorTest {

    private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);
    private static final LocalDate JAN_3 = LocalDate.of(2024, 1, 3);

    private static final RepositorySnapshot STORED = new RepositorySnapshot(
            900_000_000L, "o", "r", 5, 5, 1, 0, "Java");
    private static final RepositorySnapshot STORED_REMOTE = new RepositorySnapshot(
            900_000_000L, "o", "r", 6, 6, 1, 0, "Java");
    private static final RepositorySnapshot NEW_REMOTE = new RepositorySnapshot(
            900_000_001L, "n", "x", 3, 3, 0, 1, null);

    private static final DailyActivity DAY_3 = new DailyActivity(JAN_3, 2, Set.of("A", "B"));
    private static final DailyActivity DAY_2 = new DailyActivity(JAN_2, 1, Set.of("A"));

    @Mock
    private GitHubApiClient client;

    private InMemoryRepositoryStore store;
    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = new InMemoryRepositoryStore();
        orchestrator = new SyncOrchestrator(client, store);
    }

    @SafeVarargs
    private static <T> FailFastSequence<T> sequence(T... items) {
        return failingAfter(null, items);
    }

    /**
     * Yields {@code items}, then ends with {@code failure} if it is not null.
     */
    @SafeVarargs
    private static <T> FailFastSequence<T> failingAfter(RemoteFetchException failure, T... items) {
        Iterator<T> source = List.of(items).iterator();
        return new FailFastSequence<>() {
            @Override
            protected T computeNext() throws RemoteFetchException {
                if (source.hasNext()) {
                    return source.next();
                }
                if (failure != null) {
                    throw failure;
                }
                return null;
            }
        };
    }

    /**
     * Makes the listing yield {@code candidates}, honouring the exclusion set
     * the way the real client does.
     */
    private void listing(RepositorySnapshot... candidates) {
        when(client.fetchNewRepositories(anyLong(), anyLong(), anySet())).thenAnswer(invocation -> {
            Set<String> exclude = invocation.getArgument(2);
            RepositorySnapshot[] remaining = Arrays.stream(candidates)
                    .filter(c -> !exclude.contains(c.fullName()))
                    .toArray(RepositorySnapshot[]::new);
            return sequence(remaining);
        });
    }

    private void activity(String owner, String name, DailyActivity... days) {
        when(client.fetchCommitActivity(eq(owner), eq(name), any(LocalDate.class)))
                .thenAnswer(invocation -> sequence(days));
    }

    private static RemoteFetchException notFound() {
        return new RemoteFetchException(RemoteFetchException.Kind.TRANSPORT, "GitHub API error: 404", 404);
    }

    // =========================================================================
    // Full run tests
    // =========================================================================

    @Test
    @DisplayName("A run refreshes stored repositories and ingests new ones with their activity")
    void fullRun_endToEnd() throws Exception {
        long storedId = store.seed(STORED);
        when(client.fetchRepository("o", "r")).thenReturn(STORED_REMOTE);
        activity("o", "r", DAY_3);
        activity("n", "x", DAY_3, DAY_2);
        listing(NEW_REMOTE);

        SyncSummary summary = orchestrator.run(SyncOptions.defaults());

        assertFalse(summary.hasFailures());
        assertFalse(summary.discoveryStopped());
        assertEquals(6, store.repository("o/r").orElseThrow().stars());
        assertEquals(List.of(DAY_3), store.activityOf(storedId));

        long newId = store.idOf("n/x").orElseThrow();
        assertEquals(List.of(DAY_3, DAY_2), store.activityOf(newId));
        assertEquals(1L, store.ranks().get(storedId));

        assertEquals(1, summary.rowsWrittenForPhase(SyncOrchestrator.PHASE_RANKS));
        assertEquals(2, summary.rowsWrittenForPhase(SyncOrchestrator.PHASE_UPDATE));
        assertEquals(3, summary.rowsWrittenForPhase(SyncOrchestrator.PHASE_DISCOVER));

        verify(client).fetchCommitActivity("o", "r", RepositoryUpdater.NO_ACTIVITY_SINCE);
        verify(client).fetchNewRepositories(eq(STORED.githubId()), eq(Long.MAX_VALUE), anySet());
    }

    @Test
    @DisplayName("Third run over unchanged remote data writes nothing once new repositories have rank rows")
    void thirdRun_afterRankRowsSettle_writesNothing() throws Exception {
        store.seed(STORED);
        when(client.fetchRepository("o", "r")).thenReturn(STORED_REMOTE);
        when(client.fetchRepository("n", "x")).thenReturn(NEW_REMOTE);
        activity("o", "r", DAY_3);
        activity("n", "x", DAY_3, DAY_2);
        listing(NEW_REMOTE);

        // Run 1 inserts n/x after its rank snapshot, so run 2 still writes n/x's rank row.
        orchestrator.run(SyncOptions.defaults());
        orchestrator.run(SyncOptions.defaults());
        store.resetWrites();

        SyncSummary summary = orchestrator.run(SyncOptions.defaults());

        assertEquals(0, store.writes());
        assertEquals(0, summary.totalRowsWritten());
        assertFalse(summary.hasFailures());
    }

    @Test
    @DisplayName("Later runs resume discovery from the highest stored GitHub id and refetch from the latest stored day")
    void laterRun_usesHighWaterMarkAndLastActivity() throws Exception {
        long storedId = store.seed(STORED);
        store.seedActivity(storedId, DAY_2);
        when(client.fetchRepository("o", "r")).thenReturn(STORED);
        activity("o", "r", DAY_2);
        listing();

        orchestrator.run(SyncOptions.defaults().withNewRepoSince(0));

        verify(client).fetchCommitActivity("o", "r", JAN_2);
        verify(client).fetchNewRepositories(eq(STORED.githubId()), eq(Long.MAX_VALUE), anySet());
    }

    // =========================================================================
    // Ordering and skip flag tests
    // =========================================================================

    @Test
    @DisplayName("Rank snapshot is taken before any stored repository is refreshed")
    void rankSnapshot_beforeRefresh() throws Exception {
        InMemoryRepositoryStore spyStore = spy(store);
        spyStore.seed(STORED);
        when(client.fetchRepository("o", "r")).thenReturn(STORED_REMOTE);
        activity("o", "r");
        listing();

        new SyncOrchestrator(client, spyStore).run(SyncOptions.defaults());

        InOrder inOrder = inOrder(spyStore, client);
        inOrder.verify(spyStore).snapshotRanks();
        inOrder.verify(client).fetchRepository("o", "r");
        inOrder.verify(client).fetchNewRepositories(anyLong(), anyLong(), anySet());
    }

    @Test
    @DisplayName("Skip flags leave ranks and stored repositories untouched")
    void skipFlags_skipPhases() throws Exception {
        long storedId = store.seed(STORED);
        listing();

        SyncOptions options = SyncOptions.defaults().withSkipRankUpdate(true).withSkipRepoUpdate(true);
        SyncSummary summary = orchestrator.run(options);

        assertTrue(store.ranks().isEmpty());
        assertNull(store.ranks().get(storedId));
        verify(client, never()).fetchRepository(anyString(), anyString());
        assertEquals(0, summary.countForPhase(SyncOrchestrator.PHASE_UPDATE, true));
    }

    @Test
    @DisplayName("Every stored name is excluded from discovery even when refresh is skipped")
    void skippedRefresh_storedNamesStillExcluded() throws Exception {
        store.seed(STORED);
        listing(STORED_REMOTE);

        orchestrator.run(SyncOptions.defaults().withSkipRepoUpdate(true));

        ArgumentCaptor<Set<String>> exclude = ArgumentCaptor.forClass(Set.class);
        verify(client).fetchNewRepositories(anyLong(), anyLong(), exclude.capture());
        assertTrue(exclude.getValue().contains("o/r"));
        assertEquals(1, store.findAllFullNames().size());
    }

    @Test
    @DisplayName("Stored names outside the update bounds are still excluded from discovery")
    void updateBounds_storedNamesStillExcluded() throws Exception {
        store.seed(STORED);
        listing(STORED_REMOTE);

        orchestrator.run(SyncOptions.defaults().withUpdateBounds(100, 200));

        verify(client, never()).fetchRepository(anyString(), anyString());
        ArgumentCaptor<Set<String>> exclude = ArgumentCaptor.forClass(Set.class);
        verify(client).fetchNewRepositories(anyLong(), anyLong(), exclude.capture());
        assertTrue(exclude.getValue().contains("o/r"));
    }

    // =========================================================================
    // Failure isolation tests
    // =========================================================================

    @Test
    @DisplayName("A repository that cannot be fetched is reported and the run continues")
    void fetchFailure_isolated() throws Exception {
        store.seed(STORED);
        RepositorySnapshot other = new RepositorySnapshot(900_000_002L, "p", "q", 1, 1, 0, 0, "Go");
        store.seed(other);
        when(client.fetchRepository("o", "r")).thenThrow(notFound());
        when(client.fetchRepository("p", "q")).thenReturn(
                new RepositorySnapshot(900_000_002L, "p", "q", 9, 9, 0, 0, "Go"));
        activity("p", "q");
        listing();

        SyncSummary summary = orchestrator.run(SyncOptions.defaults().withSkipRankUpdate(true));

        assertEquals(1, summary.failureCount());
        assertEquals("o/r", summary.results().stream().filter(r -> !r.success()).findFirst()
                .orElseThrow().repoFullName());
        assertEquals(STORED, store.repository("o/r").orElseThrow());
        assertEquals(9, store.repository("p/q").orElseThrow().stars());
    }

    @Test
    @DisplayName("A failed activity fetch discards the whole refresh of that repository")
    void activityFailure_discardsUnit() throws Exception {
        long storedId = store.seed(STORED);
        when(client.fetchRepository("o", "r")).thenReturn(STORED_REMOTE);
        when(client.fetchCommitActivity(eq("o"), eq("r"), any(LocalDate.class)))
                .thenAnswer(invocation -> failingAfter(notFound(), DAY_3));
        listing();

        SyncSummary summary = orchestrator.run(SyncOptions.defaults().withSkipRankUpdate(true));

        assertTrue(summary.hasFailures());
        assertEquals(STORED, store.repository("o/r").orElseThrow());
        assertTrue(store.activityOf(storedId).isEmpty());
    }

    @Test
    @DisplayName("A new repository whose activity cannot be fetched is not inserted")
    void newRepositoryActivityFailure_notInserted() throws Exception {
        when(client.fetchCommitActivity(eq("n"), eq("x"), any(LocalDate.class)))
                .thenAnswer(invocation -> failingAfter(notFound()));
        listing(NEW_REMOTE);

        SyncSummary summary = orchestrator.run(SyncOptions.defaults());

        assertEquals(1, summary.countForPhase(SyncOrchestrator.PHASE_DISCOVER, false));
        assertTrue(store.repository("n/x").isEmpty());
    }

    @Test
    @DisplayName("A repository inserted concurrently is skipped along with its activity")
    void concurrentInsert_activitySkipped() throws Exception {
        long storedId = store.seed(STORED);
        activity("o", "r", DAY_3);
        // A listing that ignores exclusions stands in for another writer racing this run.
        when(client.fetchNewRepositories(anyLong(), anyLong(), anySet()))
                .thenAnswer(invocation -> sequence(STORED_REMOTE));

        SyncSummary summary = orchestrator.run(SyncOptions.defaults()
                .withSkipRankUpdate(true).withSkipRepoUpdate(true));

        assertFalse(summary.hasFailures());
        assertEquals(0, summary.rowsWrittenForPhase(SyncOrchestrator.PHASE_DISCOVER));
        assertTrue(store.activityOf(storedId).isEmpty());
        assertEquals(STORED, store.repository("o/r").orElseThrow());
    }

    @Test
    @DisplayName("A listing failure keeps what was ingested and is reported in the summary")
    void listingFailure_keepsIngested() throws Exception {
        activity("n", "x", DAY_3);
        when(client.fetchNewRepositories(anyLong(), anyLong(), anySet()))
                .thenAnswer(invocation -> failingAfter(notFound(), NEW_REMOTE));

        SyncSummary summary = orchestrator.run(SyncOptions.defaults());

        assertTrue(summary.discoveryStopped());
        assertTrue(store.repository("n/x").isPresent());
    }

    @Test
    @DisplayName("With an empty store discovery starts at the configured floor with the configured limit")
    void newRepoLimit_passedToListing() throws Exception {
        listing();

        orchestrator.run(SyncOptions.defaults().withNewRepoLimit(5));

        verify(client).fetchNewRepositories(eq(SyncOptions.DEFAULT_NEW_REPO_SINCE), eq(5L), anySet());
    }

    // =========================================================================
    // Worker pool tests
    // =========================================================================

    @Test
    @DisplayName("Refresh with several workers updates every stored repository")
    void parallelRefresh_updatesAll() throws Exception {
        List<String> names = List.of("a", "b", "c", "d", "e");
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            store.seed(new RepositorySnapshot(1_000L + i, "w", name, 0, 0, 0, 0, null));
            when(client.fetchRepository("w", name))
                    .thenReturn(new RepositorySnapshot(1_000L + i, "w", name, 10, 10, 0, 0, null));
            activity("w", name, DAY_3);
        }
        listing();

        SyncSummary summary = orchestrator.run(SyncOptions.defaults().withSkipRankUpdate(true).withWorkers(3));

        assertEquals(names.size(), summary.countForPhase(SyncOrchestrator.PHASE_UPDATE, true));
        for (String name : names) {
            assertEquals(10, store.repository("w/" + name).orElseThrow().stars());
        }
    }
}
