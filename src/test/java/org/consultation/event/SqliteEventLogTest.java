package org.consultation.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SqliteEventLogTest {

    @TempDir
    Path tempDir;

    private SqliteEventLog eventLog;

    @BeforeEach
    public void setup() {
        eventLog = new SqliteEventLog(tempDir.resolve("events.db").toString());
    }

    @Test
    public void testAppendAndReadInOrder() {
        GovernanceEvent created = GovernanceEvent.builder(EventType.TEMPERATURE_CHECK_CREATED, 100)
                .with("temperature_check_id", 0)
                .with("title", "Fund the <dev> team & more")
                .build();
        GovernanceEvent voted = GovernanceEvent.builder(EventType.TEMPERATURE_CHECK_VOTED, 101)
                .with("temperature_check_id", 0)
                .with("vote", "FOR")
                .build();

        eventLog.publish(created);
        eventLog.publish(voted);

        List<GovernanceEvent> all = eventLog.readAll();
        assertEquals(List.of(created, voted), all);
        assertEquals("Fund the <dev> team & more", all.get(0).get("title"));
    }

    @Test
    public void testReadByType() {
        eventLog.publish(GovernanceEvent.builder(EventType.DELEGATION_CREATED, 1).with("fraction", "0.5").build());
        eventLog.publish(GovernanceEvent.builder(EventType.DELEGATION_REMOVED, 2).build());
        eventLog.publish(GovernanceEvent.builder(EventType.DELEGATION_CREATED, 3).with("fraction", "0.2").build());

        List<GovernanceEvent> created = eventLog.readByType(EventType.DELEGATION_CREATED);
        assertEquals(2, created.size());
        assertEquals("0.5", created.get(0).get("fraction"));
        assertEquals(3, created.get(1).getTimestamp());
        assertTrue(eventLog.readByType(EventType.PROPOSAL_VOTED).isEmpty());
    }

    @Test
    public void testEventsSurviveReopen() {
        eventLog.publish(GovernanceEvent.builder(EventType.PROPOSAL_CREATED, 5).with("proposal_id", 0).build());

        SqliteEventLog reopened = new SqliteEventLog(tempDir.resolve("events.db").toString());

        assertEquals(1, reopened.readAll().size());
        assertEquals("0", reopened.readAll().get(0).get("proposal_id"));
    }
}
