package com.ivamare.lifecycle.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.lifecycle.version.EntityFamily;
import com.ivamare.lifecycle.version.SnapshotCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcAuditRecorderTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcAuditRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new JdbcAuditRecorder(jdbcTemplate, new SnapshotCodec(new ObjectMapper()));
    }

    @Nested
    class RecordTests {

        @Test
        void shouldInsertAuditEvent() {
            UUID entityId = UUID.randomUUID();
            UUID actorId = UUID.randomUUID();

            recorder.record(new LifecycleAuditEvent(EntityFamily.PAGE, entityId, 3,
                LifecycleAuditAction.PUBLISHED, actorId, NOW, Map.of("previousVersion", 2)));

            verify(jdbcTemplate).update(
                contains("INSERT INTO lifecycle.audit"),
                eq("page"),
                eq(entityId),
                eq(3),
                eq("PUBLISHED"),
                eq(actorId),
                eq(Timestamp.from(NOW)),
                contains("previousVersion")
            );
        }

        @Test
        void shouldInsertNullDetailsWhenEmpty() {
            UUID entityId = UUID.randomUUID();

            recorder.record(new LifecycleAuditEvent(EntityFamily.BLOCK, entityId, 1,
                LifecycleAuditAction.UNPUBLISHED, null, NOW, null));

            verify(jdbcTemplate).update(
                contains("INSERT INTO lifecycle.audit"),
                eq("block"),
                eq(entityId),
                eq(1),
                eq("UNPUBLISHED"),
                isNull(),
                any(Timestamp.class),
                isNull()
            );
        }
    }

    @Nested
    class FindEventsTests {

        @Test
        @SuppressWarnings("unchecked")
        void shouldQueryByFamilyAndEntity() {
            UUID entityId = UUID.randomUUID();
            LifecycleAuditEvent expected = new LifecycleAuditEvent(EntityFamily.CONTENT, entityId, 1,
                LifecycleAuditAction.RESTORED, null, NOW, Map.of());

            when(jdbcTemplate.query(
                contains("FROM lifecycle.audit"),
                any(RowMapper.class),
                eq("content"), eq(entityId)
            )).thenReturn(List.of(expected));

            List<LifecycleAuditEvent> result = recorder.findEvents(EntityFamily.CONTENT, entityId);

            assertEquals(List.of(expected), result);
        }

        @Test
        @SuppressWarnings("unchecked")
        void shouldMapRows() throws Exception {
            UUID entityId = UUID.randomUUID();
            UUID actorId = UUID.randomUUID();
            when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(), any())).thenReturn(List.of());

            recorder.findEvents(EntityFamily.PAGE, entityId);

            ArgumentCaptor<RowMapper<LifecycleAuditEvent>> mapper = ArgumentCaptor.forClass(RowMapper.class);
            verify(jdbcTemplate).query(anyString(), mapper.capture(), any(), any());

            ResultSet rs = mock(ResultSet.class);
            when(rs.getString("family")).thenReturn("page");
            when(rs.getString("entity_id")).thenReturn(entityId.toString());
            when(rs.getInt("version")).thenReturn(4);
            when(rs.getString("action")).thenReturn("ARCHIVED");
            when(rs.getString("actor_id")).thenReturn(actorId.toString());
            when(rs.getTimestamp("ts")).thenReturn(Timestamp.from(NOW));
            when(rs.getString("details_json")).thenReturn("{\"fromStatus\":\"published\"}");

            LifecycleAuditEvent event = mapper.getValue().mapRow(rs, 0);

            assertEquals(EntityFamily.PAGE, event.family());
            assertEquals(entityId, event.entityId());
            assertEquals(4, event.version());
            assertEquals(LifecycleAuditAction.ARCHIVED, event.action());
            assertEquals(actorId, event.actorId());
            assertEquals(NOW, event.timestamp());
            assertEquals("published", event.details().get("fromStatus"));
        }
    }
}
