package com.ofacwatch.screening.index;

import com.ofacwatch.screening.domain.EntityKind;
import com.ofacwatch.screening.domain.SanctionEntity;
import com.ofacwatch.screening.exception.SnapshotUnavailableException;
import com.ofacwatch.screening.normalize.NameNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IndexSnapshotManager")
class IndexSnapshotManagerTest {

    private final IndexSnapshotManager manager = new IndexSnapshotManager();

    private SanctionsIndex index(String... names) throws Exception {
        List<SanctionEntity> entities = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            entities.add(new SanctionEntity("E" + (i + 1), names[i], List.of(), EntityKind.PERSON, null));
        }
        return SanctionsIndex.build(entities, new NameNormalizer(), new TokenPhoneticBlockingKeyStrategy(),
                manager.nextGeneration());
    }

    @Test
    @DisplayName("Should refuse leases before the first install")
    void shouldRefuseBeforeFirstInstall() {
        assertThat(manager.current()).isEmpty();
        assertThatThrownBy(manager::acquire).isInstanceOf(SnapshotUnavailableException.class);
    }

    @Test
    @DisplayName("Should keep a leased generation readable after a newer one is installed")
    void shouldKeepLeasedGenerationAfterSwap() throws Exception {
        // Given
        SanctionsIndex first = index("John Smith");
        manager.install(first);
        IndexLease lease = manager.acquire();

        // When
        SanctionsIndex second = index("John Smith", "Maria Lopez");
        manager.install(second);

        // Then
        assertThat(lease.index()).isSameAs(first);
        assertThat(manager.current()).contains(second);
        assertThat(manager.pendingReleaseGenerations()).containsExactly(first.generation());

        lease.close();
        assertThat(manager.pendingReleaseGenerations()).isEmpty();
    }

    @Test
    @DisplayName("Should release a generation only once, however often its lease is closed")
    void shouldCloseLeaseIdempotently() throws Exception {
        manager.install(index("John Smith"));
        IndexLease first = manager.acquire();
        IndexLease second = manager.acquire();

        first.close();
        first.close();

        assertThat(manager.activeLeases()).isEqualTo(1);
        second.close();
        assertThat(manager.activeLeases()).isZero();
    }

    @Test
    @DisplayName("Should release an unleased generation as soon as it is replaced")
    void shouldReleaseUnleasedGenerationImmediately() throws Exception {
        manager.install(index("John Smith"));
        manager.install(index("Maria Lopez"));

        assertThat(manager.pendingReleaseGenerations()).isEmpty();
        try (IndexLease lease = manager.acquire()) {
            assertThat(lease.index().generation()).isEqualTo(2);
        }
    }
}
