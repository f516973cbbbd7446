package org.carball.compadvisor.repository;

import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ObjectRef;
import org.carball.compadvisor.model.ObjectType;
import org.carball.compadvisor.model.Recommendation;
import org.carball.compadvisor.model.RecommendationPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InMemoryRecommendationRepositoryTest {

    private InMemoryRecommendationRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRecommendationRepository();
    }

    @Test
    void shouldAssignIdsAndCreationTime() {
        Recommendation first = repository.save(recommendation(1, ObjectRef.table("APP", "A"), Encoding.OLTP, 100, 40));
        Recommendation second = repository.save(recommendation(1, ObjectRef.table("APP", "B"), Encoding.OLTP, 100, 40));

        assertThat(first.getId()).isEqualTo(1);
        assertThat(second.getId()).isEqualTo(2);
        assertThat(first.getCreatedAt()).isNotNull();
    }

    @Test
    void shouldRejectOverwritingExistingRecommendation() {
        Recommendation saved = repository.save(recommendation(1, ObjectRef.table("APP", "A"), Encoding.OLTP, 100, 40));

        assertThatThrownBy(() -> repository.save(saved.toBuilder().rationale("changed").build()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("append-only");
    }

    @Test
    void shouldOrderBySavingsThenPercentageThenId() {
        // Given
        repository.save(recommendation(1, ObjectRef.table("APP", "SMALL"), Encoding.OLTP, 10, 60));
        repository.save(recommendation(1, ObjectRef.table("APP", "BIG"), Encoding.OLTP, 500, 40));
        repository.save(recommendation(1, ObjectRef.table("APP", "TIE_LOW_PCT"), Encoding.OLTP, 200, 30));
        repository.save(recommendation(1, ObjectRef.table("APP", "TIE_HIGH_PCT"), Encoding.OLTP, 200, 55));

        // When
        List<Recommendation> result = repository.query(RecommendationFilter.actionable());

        // Then
        assertThat(result)
                .extracting(r -> r.getRef().objectName())
                .containsExactly("BIG", "TIE_HIGH_PCT", "TIE_LOW_PCT", "SMALL");
    }

    @Test
    void shouldExcludeNonActionableRecommendationsByDefault() {
        repository.save(recommendation(1, ObjectRef.table("APP", "FLAT"), Encoding.NONE, 0, 0));
        repository.save(recommendation(1, ObjectRef.table("APP", "GOOD"), Encoding.OLTP, 100, 50));

        assertThat(repository.query(RecommendationFilter.actionable()))
                .extracting(r -> r.getRef().objectName())
                .containsExactly("GOOD");
        assertThat(repository.query(RecommendationFilter.everything())).hasSize(2);
    }

    @Test
    void shouldExcludeAlreadyAppliedEncoding() {
        repository.save(recommendation(1, ObjectRef.table("APP", "DONE"), Encoding.OLTP, 100, 50)
                .toBuilder().currentEncoding(Encoding.OLTP).build());

        assertThat(repository.query(RecommendationFilter.actionable())).isEmpty();
    }

    @Test
    void shouldReturnOnlyLatestRunPerObject() {
        // Given two runs analyzing the same table; the second finds nothing worth doing
        ObjectRef orders = ObjectRef.table("APP", "ORDERS");
        repository.save(recommendation(1, orders, Encoding.OLTP, 100, 50).toBuilder().runId(1).build());
        repository.save(recommendation(1, orders, Encoding.NONE, 0, 0).toBuilder().runId(2).build());

        // Then the stale first-run recommendation is not offered
        assertThat(repository.query(RecommendationFilter.actionable())).isEmpty();
        assertThat(repository.query(RecommendationFilter.actionable().toBuilder().latestOnly(false).build()))
                .hasSize(1);
    }

    @Test
    void shouldKeepPartitionsApartWhenPickingLatest() {
        repository.save(recommendation(1, ObjectRef.partition("APP", "SALES", "P1"), Encoding.OLTP, 10, 50));
        repository.save(recommendation(1, ObjectRef.partition("APP", "SALES", "P2"), Encoding.OLTP, 20, 50));

        assertThat(repository.query(RecommendationFilter.actionable())).hasSize(2);
    }

    @Test
    void shouldFilterByCriteria() {
        repository.save(recommendation(1, ObjectRef.table("APP", "T1"), Encoding.OLTP, 100, 45));
        repository.save(recommendation(2, ObjectRef.table("APP", "T2"), Encoding.BASIC, 100, 25));
        repository.save(recommendation(1, ObjectRef.index("HR", "IX1"), Encoding.INDEX_ADVANCED_LOW, 50, 35));

        assertThat(repository.query(RecommendationFilter.builder().strategyId(1).build())).hasSize(2);
        assertThat(repository.query(RecommendationFilter.builder().minSavingsPct(30.0).build())).hasSize(2);
        assertThat(repository.query(RecommendationFilter.builder().objectType(ObjectType.INDEX).build())).hasSize(1);
        assertThat(repository.query(RecommendationFilter.builder().owner("hr").build())).hasSize(1);
        assertThat(repository.totalProjectedSavings(RecommendationFilter.builder().strategyId(1).build()))
                .isEqualTo(150);
    }

    @Test
    void shouldPurgeOnlyUnprotectedOldRecommendations() {
        // Given
        Instant old = Instant.now().minus(100, ChronoUnit.DAYS);
        Recommendation executed = repository.save(recommendation(1, ObjectRef.table("APP", "EXECUTED"), Encoding.OLTP, 1, 50)
                .toBuilder().runId(1).createdAt(old).build());
        repository.save(recommendation(1, ObjectRef.table("APP", "STALE"), Encoding.OLTP, 1, 50)
                .toBuilder().runId(1).createdAt(old).build());
        repository.save(recommendation(1, ObjectRef.table("APP", "LATEST_RUN"), Encoding.OLTP, 1, 50)
                .toBuilder().runId(2).createdAt(old).build());
        repository.save(recommendation(1, ObjectRef.table("APP", "FRESH"), Encoding.OLTP, 1, 50)
                .toBuilder().runId(1).build());

        // When
        int removed = repository.purgeOlderThan(Instant.now().minus(30, ChronoUnit.DAYS),
                Set.of(executed.getId()), Set.of(2L));

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(repository.findAll())
                .extracting(r -> r.getRef().objectName())
                .containsExactlyInAnyOrder("EXECUTED", "LATEST_RUN", "FRESH");
    }

    @Test
    void shouldContinueIdSequenceAfterRestore() {
        repository.restore(List.of(recommendation(1, ObjectRef.table("APP", "A"), Encoding.OLTP, 1, 50)
                .toBuilder().id(41).createdAt(Instant.now()).build()));

        Recommendation next = repository.save(recommendation(1, ObjectRef.table("APP", "B"), Encoding.OLTP, 1, 50));

        assertThat(next.getId()).isEqualTo(42);
        assertThat(repository.findById(41)).isPresent();
    }

    static Recommendation recommendation(int strategyId, ObjectRef ref, Encoding encoding, long savings, double pct) {
        return Recommendation.builder()
                .runId(1)
                .strategyId(strategyId)
                .ref(ref)
                .sizeBytes(1000)
                .currentEncoding(Encoding.NONE)
                .recommendedEncoding(encoding)
                .compressionRatio(encoding == Encoding.NONE ? 1.0 : 2.0)
                .projectedSavingsBytes(savings)
                .projectedSizeBytes(1000 - savings)
                .savingsPct(pct)
                .priority(RecommendationPriority.fromSavingsPct(pct))
                .rationale("test")
                .build();
    }
}
