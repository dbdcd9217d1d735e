package com.tapas.drivertips.repository;

import com.tapas.drivertips.domain.TipAggregate;
import com.tapas.drivertips.exception.StoreRejectedException;
import com.tapas.drivertips.exception.StoreUnavailableException;
import com.tapas.drivertips.exception.TipStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * PostgreSQL-backed store. The upsert adds to total_amount in a single statement,
 * so concurrent increments on one key serialize on the row lock and none is lost.
 */
@Repository
@ConditionalOnProperty(name = "tips.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcTipAggregateStore implements TipAggregateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTipAggregateStore.class);

    static final String PARTITION_PREFIX = "DRIVER#";

    private static final String INCREMENT_SQL = """
            INSERT INTO driver_tip_aggregates
            (pk, sk, total_amount, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (pk, sk)
            DO UPDATE SET
                total_amount = driver_tip_aggregates.total_amount + EXCLUDED.total_amount,
                updated_at   = EXCLUDED.updated_at
            """;

    private static final String SELECT_SQL = """
            SELECT pk, sk, total_amount, created_at, updated_at
            FROM driver_tip_aggregates
            WHERE pk = ? AND sk = ?
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcTipAggregateStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void increment(String driverId, String aggregationKey, BigDecimal amount, Instant now) {
        try {
            jdbcTemplate.update(INCREMENT_SQL, ps -> {
                ps.setString(1, partitionKey(driverId));
                ps.setString(2, aggregationKey);
                ps.setBigDecimal(3, amount);
                ps.setTimestamp(4, Timestamp.from(now));
                ps.setTimestamp(5, Timestamp.from(now));
            });
        } catch (DataAccessException e) {
            throw translate("increment", driverId, aggregationKey, e);
        }
    }

    @Override
    public Optional<TipAggregate> get(String driverId, String aggregationKey) {
        try {
            return jdbcTemplate.query(SELECT_SQL,
                            (rs, rowNum) -> toTipAggregate(rs),
                            partitionKey(driverId),
                            aggregationKey)
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            throw translate("get", driverId, aggregationKey, e);
        }
    }

    static String partitionKey(String driverId) {
        return PARTITION_PREFIX + driverId;
    }

    private static TipAggregate toTipAggregate(ResultSet rs) throws SQLException {
        return new TipAggregate(
                rs.getString("pk").substring(PARTITION_PREFIX.length()),
                rs.getString("sk"),
                plain(rs.getBigDecimal("total_amount")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
    }

    // the column pads to scale 4; 5.5000 reads back as 5.5 and 100.0000 as 100
    static BigDecimal plain(BigDecimal amount) {
        BigDecimal stripped = amount.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    private static TipStoreException translate(String operation, String driverId,
                                               String aggregationKey, DataAccessException e) {
        String message = String.format("%s failed for %s %s", operation, partitionKey(driverId), aggregationKey);
        // lock waits and statement timeouts mean the database is shedding load
        if (e instanceof ConcurrencyFailureException || e instanceof QueryTimeoutException) {
            log.warn("Store rejected {}: {}", message, e.getMessage());
            return new StoreRejectedException(message, e);
        }
        log.error("Store unavailable, {}", message, e);
        return new StoreUnavailableException(message, e);
    }
}
