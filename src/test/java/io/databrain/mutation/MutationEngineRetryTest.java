package io.databrain.mutation;

import io.databrain.MutableClock;
import io.databrain.config.BrainProperties;
import io.databrain.error.ConflictException;
import io.databrain.error.ErrorKind;
import io.databrain.error.StoreUnavailableException;
import io.databrain.graph.GraphStore;
import io.databrain.graph.GraphStore.TransactionWork;
import io.databrain.graph.GraphTransaction;
import io.databrain.similarity.NGramSimilarityScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MutationEngineRetryTest {

    private GraphStore store;
    private MutationEngine engine;

    @BeforeEach
    void setUp() {
        store = mock(GraphStore.class);
        BrainProperties properties = new BrainProperties(null, null,
                new BrainProperties.Mutation(3, 1, 2), null, null, null);
        engine = new MutationEngine(store, new NGramSimilarityScorer(), properties,
                MutableClock.at("2025-03-10T12:00:00Z"));
    }

    @Test
    void shouldRetryConflictsAndGiveUpAfterMaxAttempts() {
        when(store.inTransaction(any())).thenThrow(new ConflictException("version moved"));

        MutationOutcome outcome = engine.apply(
                MutationRequest.of("UPDATE_MASS", Map.of("target_id", "n1")), MutationContext.agent("a", null));

        assertFalse(outcome.success());
        assertEquals(ErrorKind.CONFLICT, outcome.errorKind());
        assertTrue(outcome.retryable());
        assertEquals(3, outcome.attempts());
        // three attempts plus the failure log append
        verify(store, times(4)).inTransaction(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSucceedAfterTransientConflict() {
        AtomicInteger calls = new AtomicInteger();
        when(store.inTransaction(any())).thenAnswer(invocation -> {
            if (calls.incrementAndGet() == 1) {
                throw new ConflictException("version moved");
            }
            TransactionWork<Object> work = invocation.getArgument(0);
            GraphTransaction tx = mock(GraphTransaction.class);
            when(tx.insertNode(any())).thenAnswer(insert -> insert.getArgument(0));
            return work.execute(tx);
        });

        MutationOutcome outcome = engine.apply(
                MutationRequest.of("CREATE_NODE", Map.of("label", "Alpha")), MutationContext.agent("a", null));

        assertTrue(outcome.success(), outcome::error);
        assertEquals(2, outcome.attempts());
    }

    @Test
    void shouldNotRetryStoreFailures() {
        when(store.inTransaction(any())).thenThrow(new StoreUnavailableException("disk gone", null));

        MutationOutcome outcome = engine.apply(
                MutationRequest.of("UPDATE_MASS", Map.of("target_id", "n1")), MutationContext.agent("a", null));

        assertEquals(ErrorKind.STORE_UNAVAILABLE, outcome.errorKind());
        assertTrue(outcome.retryable());
        assertEquals(1, outcome.attempts());
    }

    @Test
    void shouldReportSkippedAccessBumpUnderContention() {
        when(store.inTransaction(any(Duration.class), any())).thenThrow(new StoreUnavailableException("busy", null));

        assertFalse(engine.recordAccess("n1", List.of(), Duration.ofMillis(10)));
    }
}
