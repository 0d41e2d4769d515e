package com.hubsync.ingestion.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubsync.domain.OnChainEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

/**
 * The append-only {@code onchain_events} table, keyed by (chain_id, tx_hash, log_index).
 */
@Repository
@RequiredArgsConstructor
public class OnChainEventStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Returns true if the event was inserted, false if it was already present.
     */
    public boolean insertIfAbsent(OnChainEvent event) {
        String body;
        try {
            body = event.body() == null ? "{}" : objectMapper.writeValueAsString(event.body());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable on-chain event body", e);
        }
        int rows = jdbcTemplate.update("""
                INSERT INTO onchain_events (chain_id, block_number, block_timestamp, log_index, tx_hash, type, fid, body)
                VALUES (:chainId, :blockNumber, :blockTimestamp, :logIndex, :txHash, :type, :fid, CAST(:body AS jsonb))
                ON CONFLICT (chain_id, tx_hash, log_index) DO NOTHING
                """,
                new MapSqlParameterSource()
                        .addValue("chainId", event.chainId())
                        .addValue("blockNumber", event.blockNumber())
                        .addValue("blockTimestamp", Timestamp.from(Instant.ofEpochSecond(event.blockTimestamp())))
                        .addValue("logIndex", event.logIndex())
                        .addValue("txHash", event.txHash())
                        .addValue("type", event.type().getCode())
                        .addValue("fid", event.fid())
                        .addValue("body", body));
        return rows > 0;
    }
}
