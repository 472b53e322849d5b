package com.astradesk.helpdesk.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("QueueScope / QueueFilter")
class QueueScopeTest {

    @Nested
    @DisplayName("QueueScope")
    class Scope {

        @Test
        @DisplayName("Zakres nieograniczony dopuszcza każdą kolejkę, ale nie ma listy id")
        void unrestrictedScopePermitsEverything() {
            QueueScope all = QueueScope.all();

            assertThat(all.isUnrestricted()).isTrue();
            assertThat(all.isEmpty()).isFalse();
            assertThat(all.permits(12345L)).isTrue();
            assertThatThrownBy(all::queueIds).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Odfiltrowuje null i wartości niedodatnie, sortuje rosnąco")
        void normalizesIds() {
            QueueScope scope = QueueScope.of(Arrays.asList(30L, null, 10L, 0L, -4L, 10L));

            assertThat(scope.queueIds()).containsExactly(10L, 30L);
            assertThat(scope.permits(10L)).isTrue();
            assertThat(scope.permits(20L)).isFalse();
        }

        @Test
        @DisplayName("Pusta lista daje pusty zakres")
        void emptyIdsGiveEmptyScope() {
            assertThat(QueueScope.of(List.of()).isEmpty()).isTrue();
            assertThat(QueueScope.of(List.of(0L))).isEqualTo(QueueScope.none());
        }

        @Test
        @DisplayName("Zawężenie do kolejki spoza zakresu daje pusty zakres")
        void narrowingOutsideScopeIsEmpty() {
            QueueScope scope = QueueScope.of(List.of(1L, 3L));

            assertThat(scope.narrowTo(3L).queueIds()).containsExactly(3L);
            assertThat(scope.narrowTo(2L).isEmpty()).isTrue();
            assertThat(QueueScope.all().narrowTo(7L).queueIds()).containsExactly(7L);
        }
    }

    @Nested
    @DisplayName("QueueFilter")
    class Filter {

        @Test
        @DisplayName("Pusty zakres nie pasuje do niczego")
        void emptyScopeMatchesNothing() {
            assertThat(QueueFilter.clause(QueueScope.none(), "t.queue_id")).isEqualTo("1 = 0");
        }

        @Test
        @DisplayName("Zakres nieograniczony nie dodaje warunku")
        void unrestrictedScopeAddsNoConstraint() {
            assertThat(QueueFilter.clause(QueueScope.all(), "t.queue_id")).isEqualTo("1 = 1");
        }

        @Test
        @DisplayName("Zakres z kolejkami staje się warunkiem IN")
        void restrictedScopeBecomesInClause() {
            assertThat(QueueFilter.clause(QueueScope.of(List.of(1L, 2L)), "q.id"))
                .isEqualTo("q.id IN (:queueIds)");
        }
    }
}
