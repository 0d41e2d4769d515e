package com.hubsync.ingestion.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubsync.domain.FarcasterTime;
import com.hubsync.domain.Message;
import com.hubsync.domain.MessageType;
import com.hubsync.domain.StoredMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * The {@code messages} table: one row per (fid, hash). A row only ever moves from live to deleted.
 */
@Repository
@RequiredArgsConstructor
public class MessageStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Inserts the message as live. Returns false if a row for (fid, hash) already exists, deleted or not.
     */
    public boolean merge(Message message) {
        int rows = jdbcTemplate.update("""
                INSERT INTO messages (fid, hash, type, timestamp, signer, signature, body)
                VALUES (:fid, :hash, :type, :timestamp, :signer, :signature, CAST(:body AS jsonb))
                ON CONFLICT (fid, hash) DO NOTHING
                """,
                messageParams(message));
        return rows > 0;
    }

    /**
     * Marks the message deleted, inserting it first if it was never stored. Returns false if the row
     * was already deleted.
     */
    public boolean delete(Message message, MessageDeletion reason) {
        Timestamp now = Timestamp.from(Instant.now());
        MapSqlParameterSource params = messageParams(message)
                .addValue("deletedAt", now)
                .addValue("prunedAt", reason == MessageDeletion.PRUNED ? now : null)
                .addValue("revokedAt", reason == MessageDeletion.REVOKED ? now : null);
        int rows = jdbcTemplate.update("""
                INSERT INTO messages (fid, hash, type, timestamp, signer, signature, body, deleted_at, pruned_at, revoked_at)
                VALUES (:fid, :hash, :type, :timestamp, :signer, :signature, CAST(:body AS jsonb),
                        :deletedAt, :prunedAt, :revokedAt)
                ON CONFLICT (fid, hash) DO UPDATE
                SET deleted_at = EXCLUDED.deleted_at,
                    pruned_at = EXCLUDED.pruned_at,
                    revoked_at = EXCLUDED.revoked_at,
                    updated_at = now()
                WHERE messages.deleted_at IS NULL
                """,
                params);
        return rows > 0;
    }

    /**
     * Rows of the given types for a fid that reconciliation compares against the Hub: live rows plus rows
     * the Hub pruned or revoked. Rows removed by a remove message are left out, the Hub no longer lists them.
     *
     * @param fromInclusive lower bound on the message timestamp, may be null
     * @param toInclusive   upper bound on the message timestamp, may be null
     */
    public List<StoredMessage> findForReconciliation(long fid, Collection<MessageType> types,
                                                     Instant fromInclusive, Instant toInclusive) {
        if (types.isEmpty()) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder("""
                SELECT fid, hash, type, timestamp, signer, signature, body, deleted_at, pruned_at, revoked_at
                FROM messages
                WHERE fid = :fid
                  AND type IN (:types)
                  AND (deleted_at IS NULL OR pruned_at IS NOT NULL OR revoked_at IS NOT NULL)
                """);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("fid", fid)
                .addValue("types", types.stream().map(MessageType::getCode).toList());
        if (fromInclusive != null) {
            sql.append(" AND timestamp >= :from");
            params.addValue("from", Timestamp.from(fromInclusive));
        }
        if (toInclusive != null) {
            sql.append(" AND timestamp <= :to");
            params.addValue("to", Timestamp.from(toInclusive));
        }
        sql.append(" ORDER BY timestamp, hash");
        return jdbcTemplate.query(sql.toString(), params, storedMessageMapper());
    }

    private MapSqlParameterSource messageParams(Message message) {
        return new MapSqlParameterSource()
                .addValue("fid", message.fid())
                .addValue("hash", message.hash())
                .addValue("type", message.type().getCode())
                .addValue("timestamp", Timestamp.from(message.timestampInstant()))
                .addValue("signer", message.signer())
                .addValue("signature", message.signature())
                .addValue("body", writeBody(message.body()));
    }

    private String writeBody(JsonNode body) {
        if (body == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable message body", e);
        }
    }

    private RowMapper<StoredMessage> storedMessageMapper() {
        return (rs, rowNum) -> new StoredMessage(
                new Message(
                        rs.getString("hash"),
                        rs.getLong("fid"),
                        MessageType.fromCode(rs.getInt("type")),
                        FarcasterTime.fromInstant(rs.getTimestamp("timestamp").toInstant()),
                        rs.getString("signer"),
                        rs.getString("signature"),
                        readBody(rs)),
                instantOrNull(rs, "deleted_at"),
                instantOrNull(rs, "pruned_at"),
                instantOrNull(rs, "revoked_at"));
    }

    private JsonNode readBody(ResultSet rs) throws SQLException {
        String body = rs.getString("body");
        try {
            return body == null ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Corrupt body for message " + rs.getString("hash"), e);
        }
    }

    static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
