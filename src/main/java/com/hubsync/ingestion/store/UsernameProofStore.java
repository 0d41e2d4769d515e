package com.hubsync.ingestion.store;

import com.hubsync.domain.UserNameProof;
import com.hubsync.domain.UserNameType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * The {@code username_proofs} table, keyed by (name, fid). Proof timestamps are stored as Unix-second instants.
 */
@Repository
@RequiredArgsConstructor
public class UsernameProofStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    /**
     * Inserts the proof, or replaces the stored one when this proof is newer or the stored one was deleted.
     * Returns true if a row changed.
     */
    public boolean upsert(UserNameProof proof) {
        int rows = jdbcTemplate.update("""
                INSERT INTO username_proofs (name, fid, owner, type, proof_timestamp, signature)
                VALUES (:name, :fid, :owner, :type, :proofTimestamp, :signature)
                ON CONFLICT (name, fid) DO UPDATE
                SET owner = EXCLUDED.owner,
                    type = EXCLUDED.type,
                    proof_timestamp = EXCLUDED.proof_timestamp,
                    signature = EXCLUDED.signature,
                    deleted_at = NULL,
                    updated_at = now()
                WHERE username_proofs.proof_timestamp < EXCLUDED.proof_timestamp
                   OR (username_proofs.deleted_at IS NOT NULL AND username_proofs.proof_timestamp <= EXCLUDED.proof_timestamp)
                """,
                proofParams(proof));
        return rows > 0;
    }

    /**
     * Marks the stored proof deleted unless a newer proof for the same (name, fid) replaced it.
     */
    public boolean markDeleted(UserNameProof proof) {
        int rows = jdbcTemplate.update("""
                UPDATE username_proofs
                SET deleted_at = now(), updated_at = now()
                WHERE name = :name AND fid = :fid AND deleted_at IS NULL AND proof_timestamp <= :proofTimestamp
                """,
                proofParams(proof));
        return rows > 0;
    }

    /**
     * Live proofs of one type for a fid. Bounds are inclusive and may be null.
     */
    public List<UserNameProof> findByFid(long fid, UserNameType type, Instant fromInclusive, Instant toInclusive) {
        StringBuilder sql = new StringBuilder("""
                SELECT name, fid, owner, type, proof_timestamp, signature
                FROM username_proofs
                WHERE fid = :fid AND type = :type AND deleted_at IS NULL
                """);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("fid", fid)
                .addValue("type", type.getCode());
        if (fromInclusive != null) {
            sql.append(" AND proof_timestamp >= :from");
            params.addValue("from", Timestamp.from(fromInclusive));
        }
        if (toInclusive != null) {
            sql.append(" AND proof_timestamp <= :to");
            params.addValue("to", Timestamp.from(toInclusive));
        }
        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> new UserNameProof(
                rs.getString("name"),
                rs.getLong("fid"),
                rs.getString("owner"),
                UserNameType.fromCode(rs.getInt("type")),
                rs.getTimestamp("proof_timestamp").toInstant().getEpochSecond(),
                rs.getString("signature")));
    }

    private static MapSqlParameterSource proofParams(UserNameProof proof) {
        return new MapSqlParameterSource()
                .addValue("name", proof.name())
                .addValue("fid", proof.fid())
                .addValue("owner", proof.owner())
                .addValue("type", proof.type().getCode())
                .addValue("proofTimestamp", Timestamp.from(Instant.ofEpochSecond(proof.timestamp())))
                .addValue("signature", proof.signature());
    }
}
