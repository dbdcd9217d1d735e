package com.tapas.drivertips.repository;

import com.tapas.drivertips.domain.TipAggregate;
import com.tapas.drivertips.exception.StoreRejectedException;
import com.tapas.drivertips.exception.StoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementSetter;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcTipAggregateStoreTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @InjectMocks
    private JdbcTipAggregateStore store;

    @Test
    void increment_shouldUpsertWithAdditiveTotalAndUntouchedCreatedAt() throws Exception {
        Instant now = Instant.parse("2024-01-15T10:30:01Z");

        store.increment("d1", "DAY#2024-01-15", new BigDecimal("5.50"), now);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<PreparedStatementSetter> setter = ArgumentCaptor.forClass(PreparedStatementSetter.class);
        verify(jdbcTemplate).update(sql.capture(), setter.capture());

        assertThat(sql.getValue())
                .contains("ON CONFLICT (pk, sk)")
                .contains("total_amount = driver_tip_aggregates.total_amount + EXCLUDED.total_amount")
                .contains("updated_at   = EXCLUDED.updated_at");
        // created_at is only written by the INSERT branch
        String conflictBranch = sql.getValue().substring(sql.getValue().indexOf("DO UPDATE"));
        assertThat(conflictBranch).doesNotContain("created_at");

        PreparedStatement ps = mock(PreparedStatement.class);
        setter.getValue().setValues(ps);
        verify(ps).setString(1, "DRIVER#d1");
        verify(ps).setString(2, "DAY#2024-01-15");
        verify(ps).setBigDecimal(3, new BigDecimal("5.50"));
        verify(ps).setTimestamp(4, Timestamp.from(now));
        verify(ps).setTimestamp(5, Timestamp.from(now));
    }

    @Test
    void increment_shouldThrowStoreRejected_onLockContention() {
        when(jdbcTemplate.update(anyString(), any(PreparedStatementSetter.class)))
                .thenThrow(new CannotAcquireLockException("lock timeout"));

        assertThatThrownBy(() -> store.increment("d1", "DAY#2024-01-15", BigDecimal.ONE, Instant.now()))
                .isInstanceOf(StoreRejectedException.class)
                .hasMessageContaining("DRIVER#d1")
                .hasCauseInstanceOf(CannotAcquireLockException.class);
    }

    @Test
    void increment_shouldThrowStoreRejected_onStatementTimeout() {
        when(jdbcTemplate.update(anyString(), any(PreparedStatementSetter.class)))
                .thenThrow(new QueryTimeoutException("statement timeout"));

        assertThatThrownBy(() -> store.increment("d1", "WEEK#2024-W03", BigDecimal.ONE, Instant.now()))
                .isInstanceOf(StoreRejectedException.class);
    }

    @Test
    void increment_shouldThrowStoreUnavailable_whenDatabaseUnreachable() {
        when(jdbcTemplate.update(anyString(), any(PreparedStatementSetter.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> store.increment("d1", "DAY#2024-01-15", BigDecimal.ONE, Instant.now()))
                .isInstanceOf(StoreUnavailableException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void get_shouldMapRowAndStripPartitionPrefix() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("pk")).thenReturn("DRIVER#d1");
        when(rs.getString("sk")).thenReturn("WEEK#2024-W03");
        when(rs.getBigDecimal("total_amount")).thenReturn(new BigDecimal("11.5000"));
        when(rs.getTimestamp("created_at")).thenReturn(Timestamp.from(Instant.parse("2024-01-15T10:00:00Z")));
        when(rs.getTimestamp("updated_at")).thenReturn(Timestamp.from(Instant.parse("2024-01-16T09:00:00Z")));

        when(jdbcTemplate.query(anyString(), any(RowMapper.class), eq("DRIVER#d1"), eq("WEEK#2024-W03")))
                .thenAnswer(invocation -> {
                    RowMapper<TipAggregate> mapper = invocation.getArgument(1);
                    return List.of(mapper.mapRow(rs, 0));
                });

        Optional<TipAggregate> result = store.get("d1", "WEEK#2024-W03");

        assertThat(result).contains(new TipAggregate(
                "d1",
                "WEEK#2024-W03",
                new BigDecimal("11.5"),
                Instant.parse("2024-01-15T10:00:00Z"),
                Instant.parse("2024-01-16T09:00:00Z")));
    }

    @Test
    @SuppressWarnings("unchecked")
    void get_shouldReturnEmpty_whenNoRow() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), eq("DRIVER#d1"), eq("DAY#2024-01-15")))
                .thenReturn(List.of());

        assertThat(store.get("d1", "DAY#2024-01-15")).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void get_shouldThrowStoreUnavailable_whenQueryFails() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), eq("DRIVER#d1"), eq("DAY#2024-01-15")))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThatThrownBy(() -> store.get("d1", "DAY#2024-01-15"))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void plain_shouldDropColumnPaddingWithoutExponent() {
        assertThat(JdbcTipAggregateStore.plain(new BigDecimal("5.5000"))).isEqualTo(new BigDecimal("5.5"));
        assertThat(JdbcTipAggregateStore.plain(new BigDecimal("100.0000")))
                .isEqualTo(new BigDecimal("100"))
                .hasToString("100");
        assertThat(JdbcTipAggregateStore.plain(new BigDecimal("0.0001"))).isEqualTo(new BigDecimal("0.0001"));
    }
}
