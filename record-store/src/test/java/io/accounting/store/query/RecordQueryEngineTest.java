package io.accounting.store.query;

import com.codahale.metrics.MetricRegistry;
import io.accounting.core.Component;
import io.accounting.core.Meta;
import io.accounting.core.Record;
import io.accounting.error.InvalidQueryException;
import io.accounting.jdbc.Database;
import io.accounting.metrics.Metrics;
import io.accounting.query.Clause;
import io.accounting.query.Operator;
import io.accounting.query.RecordQuery;
import io.accounting.query.SortField;
import io.accounting.query.SortSpec;
import io.accounting.store.JdbcRecordStore;
import io.accounting.store.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class RecordQueryEngineTest {
    static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    JdbcRecordStore store;
    RecordQueryEngine engine;

    @BeforeEach
    void setUp() {
        Database db = TestStores.freshDatabase();
        store = TestStores.store(db, false);
        engine = new RecordQueryEngine(db, new Metrics(new MetricRegistry()));

        store.createOrOpen(TestStores.record("a", T0, T0.plusSeconds(100), "A", 10));
        store.createOrOpen(TestStores.record("b", T0.plusSeconds(10), T0.plusSeconds(50), "B", 5));
        store.createOrOpen(Record.builder("c", T0.plusSeconds(20))
                .meta(Meta.builder().put("site", "B", "A").build())
                .component(Component.of("MEM", 2048))
                .build());
        store.createOrOpen(TestStores.record("d", T0.plusSeconds(30), T0.plusSeconds(400), "C", 1));
    }

    private List<String> ids(RecordQuery q) {
        try (Stream<Record> s = engine.stream(q)) {
            return s.map(Record::recordId).collect(Collectors.toList());
        }
    }

    private List<String> ids(String raw) {
        try (Stream<Record> s = engine.stream(raw)) {
            return s.map(Record::recordId).collect(Collectors.toList());
        }
    }

    @Test
    void component_threshold_matches_only_larger_amounts() {
        assertEquals(List.of("a"), ids("component[CPU][gte]=10"));
        assertEquals(List.of("b"), ids("component[CPU][equals]=5"));
    }

    @Test
    void records_without_the_component_never_match() {
        assertEquals(List.of("d"), ids("component[CPU][lt]=5"));
        assertEquals(List.of("c"), ids("component[MEM][gt]=0"));
    }

    @Test
    void meta_contains_tests_list_membership() {
        assertEquals(List.of("a", "c"), ids("meta[site][contains]=[A]&sort_by[asc]=record_id"));
        assertEquals(List.of("c"), ids("meta[site][c]=[A,B]"));
    }

    @Test
    void meta_does_not_contain_accepts_records_missing_the_key() {
        assertEquals(List.of("b", "d"), ids("meta[site][dnc]=[A]&sort_by[asc]=record_id"));
        assertEquals(List.of("a", "b", "c", "d"), ids("meta[group][dnc]=[atlas]&sort_by[asc]=record_id"));
    }

    @Test
    void time_clauses_combine_into_an_interval() {
        RecordQuery q = RecordQuery.builder()
                .where(Clause.startTime(Operator.GTE, T0.plusSeconds(10)))
                .where(Clause.startTime(Operator.LT, T0.plusSeconds(30)))
                .sortBy(SortSpec.asc(SortField.START_TIME))
                .build();
        assertEquals(List.of("b", "c"), ids(q));
    }

    @Test
    void open_records_are_excluded_by_stop_time_and_runtime_ranges() {
        assertEquals(List.of("b", "a", "d"), ids("stop_time[gt]=2024-05-01T00:00:00Z"));
        assertEquals(List.of("d", "a"), ids("runtime[gte]=100&sort_by[desc]=runtime"));
    }

    @Test
    void default_order_is_stop_time_with_open_records_last() {
        assertEquals(List.of("b", "a", "d", "c"), ids(RecordQuery.all()));
        assertEquals(List.of("b", "a", "d", "c"), ids(""));
    }

    @Test
    void sort_descending_and_limit() {
        assertEquals(List.of("d", "c"), ids("sort_by[desc]=start_time&limit=2"));
        assertEquals(List.of("d", "a", "b", "c"), ids("sort_by[desc]=runtime"));
    }

    @Test
    void record_id_lookup() {
        assertEquals(List.of("c"), ids("record_id=c"));
        assertEquals(List.of(), ids("record_id=zzz"));
    }

    @Test
    void injection_attempts_are_plain_values() {
        assertEquals(List.of(), ids("record_id=a' OR '1'='1"));
        assertEquals(List.of(), ids("meta[site' OR ''<>'][c]=[A]"));
        assertEquals(4, store.count());
    }

    @Test
    void bad_queries_fail_as_a_whole() {
        assertThrows(InvalidQueryException.class, () -> engine.stream("start_time[equals]=2024-05-01T00:00:00Z"));
        assertThrows(InvalidQueryException.class, () -> engine.stream("runtime[gt]=ten"));
        assertThrows(InvalidQueryException.class, () -> engine.stream("start_time[gt]=yesterday"));
        assertThrows(InvalidQueryException.class, () -> engine.stream("colour[gt]=1"));
        assertThrows(InvalidQueryException.class, () -> engine.stream("limit=0"));
        assertThrows(InvalidQueryException.class, () -> engine.stream("sort_by[asc]=meta"));
    }
}
