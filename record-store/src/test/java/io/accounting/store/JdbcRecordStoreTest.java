package io.accounting.store;

import io.accounting.core.BulkOutcome;
import io.accounting.core.CloseOutcome;
import io.accounting.core.Component;
import io.accounting.core.CreateOutcome;
import io.accounting.core.Meta;
import io.accounting.core.Record;
import io.accounting.core.Score;
import io.accounting.error.ConflictException;
import io.accounting.error.ErrorKind;
import io.accounting.error.NotFoundException;
import io.accounting.error.ValidationException;
import io.accounting.jdbc.Database;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcRecordStoreTest {
    static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    static final Instant T1 = Instant.parse("2024-03-01T11:30:15Z");

    Database db;
    JdbcRecordStore strict;

    @BeforeEach
    void setUp() {
        db = TestStores.freshDatabase();
        strict = TestStores.store(db, false);
    }

    @Test
    void create_then_get_derives_runtime() {
        Record r = Record.builder("r-1", T0)
                .stopTime(T1)
                .meta(Meta.builder().put("site", "B", "A").put("group", "atlas").build())
                .component(Component.of("CPU", 8, new Score("hepspec", 10.5)))
                .component(Component.of("CPU", 2))
                .build();

        assertEquals(CreateOutcome.CREATED, strict.createOrOpen(r));
        Record got = strict.get("r-1");

        assertEquals(Optional.of(5415L), got.runtime());
        assertEquals(T1, got.stopTime().orElseThrow());
        assertEquals(List.of("B", "A"), got.meta().get("site"));
        assertEquals(List.of("site", "group"), List.copyOf(got.meta().keys()));
        assertEquals(r.components(), got.components());
        assertTrue(got.updatedAt().isPresent());
    }

    @Test
    void open_record_has_no_runtime() {
        strict.createOrOpen(Record.builder("open-1", T0).build());
        Record got = strict.get("open-1");
        assertTrue(got.isOpen());
        assertTrue(got.runtime().isEmpty());
    }

    @Test
    void duplicate_create_conflicts_in_strict_mode() {
        strict.createOrOpen(TestStores.record("dup", T0, null, "A", 1));
        assertThrows(ConflictException.class, () -> strict.createOrOpen(TestStores.record("dup", T0, T1, "B", 2)));
    }

    @Test
    void duplicate_create_is_noop_in_lenient_mode_and_first_write_wins() {
        JdbcRecordStore lenient = TestStores.store(db, true);
        lenient.createOrOpen(TestStores.record("dup", T0, null, "A", 1));
        assertEquals(CreateOutcome.ALREADY_EXISTS, lenient.createOrOpen(TestStores.record("dup", T0, T1, "B", 2)));

        Record got = lenient.get("dup");
        assertTrue(got.isOpen());
        assertEquals(List.of("A"), got.meta().get("site"));
        assertEquals(1, lenient.count());
    }

    @Test
    void close_unknown_record_is_not_found() {
        assertThrows(NotFoundException.class, () -> strict.close("missing", T1));
        assertThrows(NotFoundException.class, () -> strict.get("missing"));
    }

    @Test
    void close_sets_stop_time_and_repeating_it_changes_nothing() {
        strict.createOrOpen(Record.builder("job", T0).build());

        assertEquals(CloseOutcome.CLOSED, strict.close("job", T1));
        Record first = strict.get("job");
        assertEquals(CloseOutcome.UNCHANGED, strict.close("job", T1));
        Record second = strict.get("job");

        assertEquals(first, second);
        assertEquals(Optional.of(5415L), second.runtime());
    }

    @Test
    void close_with_other_stop_time_overwrites() {
        strict.createOrOpen(Record.builder("job", T0).build());
        strict.close("job", T1);
        Instant later = T1.plusSeconds(45);

        assertEquals(CloseOutcome.CLOSED, strict.close("job", later));
        assertEquals(later, strict.get("job").stopTime().orElseThrow());
        assertEquals(Optional.of(5460L), strict.get("job").runtime());
    }

    @Test
    void close_before_start_is_rejected() {
        strict.createOrOpen(Record.builder("job", T0).build());
        assertThrows(ValidationException.class, () -> strict.close("job", T0.minusSeconds(1)));
        assertTrue(strict.get("job").isOpen());
    }

    @Test
    void bulk_create_reports_each_element() {
        strict.createOrOpen(TestStores.record("b-2", T0, T1, "A", 1));
        List<BulkOutcome> out = strict.bulkCreate(List.of(
                TestStores.record("b-1", T0, T1, "A", 1),
                TestStores.record("b-2", T0, T1, "A", 1),
                TestStores.record("b-3", T0, null, "B", 4)));

        assertEquals(3, out.size());
        assertEquals(BulkOutcome.Status.CREATED, out.get(0).status());
        assertEquals(BulkOutcome.Status.REJECTED, out.get(1).status());
        assertEquals(ErrorKind.CONFLICT, out.get(1).errorKind());
        assertEquals(BulkOutcome.Status.CREATED, out.get(2).status());
        assertEquals(2, out.get(2).index());
        assertEquals(3, strict.count());
    }

    @Test
    void lenient_bulk_create_reports_duplicates_as_already_existing() {
        JdbcRecordStore lenient = TestStores.store(db, true);
        lenient.createOrOpen(TestStores.record("b-2", T0, T1, "A", 1));
        List<BulkOutcome> out = lenient.bulkCreate(List.of(
                TestStores.record("b-1", T0, T1, "A", 1),
                TestStores.record("b-2", T0, T1, "B", 7)));

        assertEquals(BulkOutcome.Status.CREATED, out.get(0).status());
        assertEquals(BulkOutcome.Status.ALREADY_EXISTS, out.get(1).status());
        assertNull(out.get(1).errorKind());
        assertEquals(List.of("A"), lenient.get("b-2").meta().get("site"));
    }

    @Test
    void concurrent_creates_of_same_id_yield_one_creation() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> calls = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                calls.add(() -> {
                    try {
                        return strict.createOrOpen(TestStores.record("race", T0, T1, "A", 1)).name();
                    } catch (ConflictException e) {
                        return e.kind().name();
                    }
                });
            }
            int created = 0;
            int conflicts = 0;
            for (Future<String> f : pool.invokeAll(calls)) {
                String outcome = f.get();
                if (outcome.equals("CREATED")) created++;
                if (outcome.equals(ErrorKind.CONFLICT.name())) conflicts++;
            }
            assertEquals(1, created);
            assertEquals(15, conflicts);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void counts_records_per_meta_value() {
        strict.createOrOpen(TestStores.record("c-1", T0, T1, "A", 1));
        strict.createOrOpen(TestStores.record("c-2", T0, T1, "A", 1));
        strict.createOrOpen(TestStores.record("c-3", T0, T1, "B", 1));

        assertEquals(Map.of("A", 2L, "B", 1L), strict.countByMetaValue("site"));
        assertEquals(Map.of("alice", 3L), strict.countByMetaValue("user"));
    }
}
