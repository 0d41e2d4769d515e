package com.hubsync.ingestion.store;

import com.hubsync.domain.HubEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Bookkeeping of applied Hub events ({@code hub_events}), keyed by Hub event id. Detects redelivery.
 */
@Repository
@RequiredArgsConstructor
public class HubEventLogStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    /**
     * Inserts the event id if absent. Returns true on first sight, false on redelivery.
     */
    public boolean recordEvent(long eventId, HubEventType type, long fid) {
        int rows = jdbcTemplate.update("""
                INSERT INTO hub_events (id, type, fid)
                VALUES (:id, :type, :fid)
                ON CONFLICT (id) DO NOTHING
                """,
                new MapSqlParameterSource()
                        .addValue("id", eventId)
                        .addValue("type", type.getCode())
                        .addValue("fid", fid));
        return rows > 0;
    }
}
