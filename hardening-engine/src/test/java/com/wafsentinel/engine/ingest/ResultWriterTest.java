package com.wafsentinel.engine.ingest;

import com.wafsentinel.engine.classifier.Label;
import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.store.WriteOutcome;
import com.wafsentinel.engine.support.InMemoryClassifiedStore;
import com.wafsentinel.engine.support.Records;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ResultWriterTest {

    private static final Instant AT = Instant.parse("2025-06-19T06:00:00Z");

    private final InMemoryClassifiedStore store = new InMemoryClassifiedStore();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ResultWriter writer = new ResultWriter(store, registry);

    @Test
    void shouldWriteEachRecordOncePerModelVersion() {
        AuditRecord record = Records.record("tx-1", "942100");

        assertEquals(WriteOutcome.CREATED, writer.write(record, Records.verdict(record, Label.MALICIOUS, 0.93, "lr-1", AT)));
        assertEquals(WriteOutcome.ALREADY_PRESENT,
                writer.write(record, Records.verdict(record, Label.MALICIOUS, 0.93, "lr-1", AT.plusSeconds(5))));
        assertEquals(WriteOutcome.CREATED, writer.write(record, Records.verdict(record, Label.BENIGN, 0.2, "lr-2", AT)));

        assertEquals(2, store.all().size());
        assertEquals(1.0, registry.get("sentinel.writer.documents").tag("outcome", "already_present").counter().count());
    }

    @Test
    void shouldRefuseResultOfAnotherRecord() {
        AuditRecord record = Records.record("tx-1", "942100");
        AuditRecord other = Records.record("tx-2", "942100");

        assertThrows(IllegalArgumentException.class,
                () -> writer.write(record, Records.verdict(other, Label.BENIGN, 0.1, "lr-1", AT)));
        assertTrue(store.all().isEmpty());
    }
}
