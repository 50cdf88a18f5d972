package net.ogimage.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import net.ogimage.domain.render.RenderTarget;
import net.ogimage.domain.render.RenderTask;
import net.ogimage.domain.render.TaskTransition;
import net.ogimage.exception.StorageUnavailableException;
import net.ogimage.test.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

@ExtendWith(MockitoExtension.class)
class JdbcTaskLedgerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcTaskLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new JdbcTaskLedger(jdbcTemplate, new MutableClock(NOW));
    }

    @Test
    void createIfAbsent_ReturnsTaskWhenRowInserted() {
        RenderTask task = pending();
        when(jdbcTemplate.update(contains("ON CONFLICT"), any(Object[].class))).thenReturn(1);

        assertThat(ledger.createIfAbsent(task)).contains(task);
    }

    @Test
    void createIfAbsent_ReturnsEmptyWhenActiveTaskHoldsFingerprint() {
        when(jdbcTemplate.update(contains("ON CONFLICT"), any(Object[].class))).thenReturn(0);

        assertThat(ledger.createIfAbsent(pending())).isEmpty();
    }

    @Test
    void createIfAbsent_TreatsDuplicateKeyAsLostRace() {
        when(jdbcTemplate.update(anyString(), any(Object[].class)))
            .thenThrow(new DuplicateKeyException("duplicate key value violates unique constraint"));

        assertThat(ledger.createIfAbsent(pending())).isEmpty();
    }

    @Test
    void createIfAbsent_TranslatesDataAccessFailureToStorageUnavailable() {
        when(jdbcTemplate.update(anyString(), any(Object[].class)))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> ledger.createIfAbsent(pending()))
            .isInstanceOf(StorageUnavailableException.class)
            .hasMessageContaining("render task");
    }

    @Test
    @SuppressWarnings("unchecked")
    void transition_ReturnsEmptyWhenGuardDoesNotMatch() {
        when(jdbcTemplate.query(contains("owner_id = ?"), any(RowMapper.class), any(Object[].class)))
            .thenReturn(List.of());

        assertThat(ledger.transition(TaskTransition.complete(UUID.randomUUID(), "worker-1", "https://cdn/x.png")))
            .isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void heartbeat_IsGuardedByProcessingStateAndOwner() {
        when(jdbcTemplate.query(contains("state = 'PROCESSING' AND owner_id = ?"), any(RowMapper.class), any(Object[].class)))
            .thenReturn(List.of());

        assertThat(ledger.heartbeat(UUID.randomUUID(), "worker-1")).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void get_TranslatesDataAccessFailureToStorageUnavailable() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class)))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> ledger.get(UUID.randomUUID()))
            .isInstanceOf(StorageUnavailableException.class);
    }

    private static RenderTask pending() {
        return RenderTask.pending(UUID.randomUUID(), "fp", new RenderTarget("https://example.com", 1200, 630), 3600, NOW);
    }
}
