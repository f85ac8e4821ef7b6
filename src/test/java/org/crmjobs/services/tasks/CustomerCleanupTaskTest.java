package org.crmjobs.services.tasks;

import org.crmjobs.data.CustomerRepository;
import org.crmjobs.data.RepositoryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CustomerCleanupTaskTest {

    private static final Instant NOW = Instant.parse("2024-01-07T02:00:00Z");

    @Mock
    CustomerRepository repository;

    @Test
    @DisplayName("deletes the union of customers without orders and customers with a stale latest order")
    void deletesUnionOfBothSets() throws Exception {
        when(repository.listCustomersWithNoOrders()).thenReturn(Set.of(1L, 2L));
        when(repository.listCustomersWithStaleLatestOrder(any())).thenReturn(Set.of(2L, 3L));
        when(repository.deleteByIds(Set.of(1L, 2L, 3L))).thenReturn(3);

        String summary = new CustomerCleanupTask(repository).execute(NOW);

        assertThat(summary).isEqualTo("Successfully deleted 3 inactive customers");
        verify(repository).deleteByIds(Set.of(1L, 2L, 3L));
    }

    @Test
    @DisplayName("cutoff is now minus the inactivity window")
    void cutoffIsNowMinusWindow() throws Exception {
        when(repository.listCustomersWithNoOrders()).thenReturn(Set.of());
        when(repository.listCustomersWithStaleLatestOrder(any())).thenReturn(Set.of());

        new CustomerCleanupTask(repository).execute(NOW);

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(repository).listCustomersWithStaleLatestOrder(cutoff.capture());
        assertThat(cutoff.getValue()).isEqualTo(NOW.minus(Duration.ofDays(365)));
    }

    @Test
    @DisplayName("nothing to delete yields the empty summary and no delete call")
    void nothingToDelete() throws Exception {
        when(repository.listCustomersWithNoOrders()).thenReturn(Set.of());
        when(repository.listCustomersWithStaleLatestOrder(any())).thenReturn(Set.of());

        String summary = new CustomerCleanupTask(repository).execute(NOW);

        assertThat(summary).isEqualTo("No inactive customers found to delete");
        verify(repository, never()).deleteByIds(any());
    }

    @Test
    @DisplayName("summary counts requested deletions even when fewer rows were removed")
    void summaryUsesRequestedCount() throws Exception {
        when(repository.listCustomersWithNoOrders()).thenReturn(Set.of(4L, 5L));
        when(repository.listCustomersWithStaleLatestOrder(any())).thenReturn(Set.of());
        when(repository.deleteByIds(Set.of(4L, 5L))).thenReturn(1);

        assertThat(new CustomerCleanupTask(repository).execute(NOW))
                .isEqualTo("Successfully deleted 2 inactive customers");
    }

    @Test
    @DisplayName("repository failures propagate to the scheduler")
    void repositoryFailurePropagates() throws Exception {
        when(repository.listCustomersWithNoOrders()).thenThrow(new RepositoryException("connection refused", null));

        assertThatThrownBy(() -> new CustomerCleanupTask(repository).execute(NOW))
                .isInstanceOf(RepositoryException.class)
                .hasMessage("connection refused");
        verify(repository, never()).deleteByIds(any());
    }
}
