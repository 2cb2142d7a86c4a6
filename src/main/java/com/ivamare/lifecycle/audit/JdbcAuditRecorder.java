package com.ivamare.lifecycle.audit;

import com.ivamare.lifecycle.version.EntityFamily;
import com.ivamare.lifecycle.version.SnapshotCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JDBC implementation of LifecycleAuditRecorder.
 *
 * <p>Writes to {@code lifecycle.audit}; details are stored as JSONB.
 */
public class JdbcAuditRecorder implements LifecycleAuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditRecorder.class);

    private static final String INSERT_SQL = """
        INSERT INTO lifecycle.audit (family, entity_id, version, action, actor_id, ts, details_json)
        VALUES (?, ?, ?, ?, ?, ?, ?::jsonb)
        """;

    private final JdbcTemplate jdbcTemplate;
    private final SnapshotCodec codec;
    private final RowMapper<LifecycleAuditEvent> eventMapper;

    public JdbcAuditRecorder(JdbcTemplate jdbcTemplate, SnapshotCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.eventMapper = (rs, rowNum) -> {
            Map<String, Object> details;
            try {
                details = this.codec.fromJson(rs.getString("details_json"));
            } catch (IllegalArgumentException e) {
                log.warn("Unreadable audit details for entity {}: {}", rs.getString("entity_id"), e.getMessage());
                details = Map.of();
            }
            String actorId = rs.getString("actor_id");
            return new LifecycleAuditEvent(
                EntityFamily.fromKey(rs.getString("family")),
                UUID.fromString(rs.getString("entity_id")),
                rs.getInt("version"),
                LifecycleAuditAction.valueOf(rs.getString("action")),
                actorId != null ? UUID.fromString(actorId) : null,
                rs.getTimestamp("ts").toInstant(),
                details
            );
        };
    }

    @Override
    public void record(LifecycleAuditEvent event) {
        jdbcTemplate.update(
            INSERT_SQL,
            event.family().key(),
            event.entityId(),
            event.version(),
            event.action().name(),
            event.actorId(),
            Timestamp.from(event.timestamp()),
            codec.toJson(event.details())
        );
    }

    /**
     * Get the audit trail of an entity, oldest first.
     *
     * @param family Entity family
     * @param entityId Entity ID
     * @return Recorded events
     */
    public List<LifecycleAuditEvent> findEvents(EntityFamily family, UUID entityId) {
        return jdbcTemplate.query(
            "SELECT * FROM lifecycle.audit WHERE family = ? AND entity_id = ? ORDER BY ts ASC, audit_id ASC",
            eventMapper,
            family.key(), entityId
        );
    }
}
