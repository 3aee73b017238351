package com.traffic.counts.sink;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.traffic.counts.common.BikePedCount;
import com.traffic.counts.common.CountDbException;
import com.traffic.counts.common.Direction;
import com.traffic.counts.common.VehicleClass;
import com.traffic.counts.count.VehicleClassCount;
import com.traffic.counts.pivot.NonNormalCountKey;
import com.traffic.counts.pivot.NonNormalVolCount;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MySqlBatchSinkTest {

    private static final LocalDateTime BIN = LocalDateTime.of(2023, 11, 7, 10, 15);

    private static VehicleClassCount classCount(int channel) {
        VehicleClassCount c = new VehicleClassCount(166905, BIN, channel, channel == 1 ? Direction.EAST : Direction.WEST);
        c.insert(VehicleClass.MOTORCYCLES);
        c.insert(VehicleClass.UNCLASSIFIED);
        return c;
    }

    @Test void testReplaceDeletesThenInsertsInBatches() throws CountDbException {
        RecordingConnection db = new RecordingConnection();
        MySqlBatchSink<VehicleClassCount> sink = CountTables.classCounts(db.connection(), 2);
        sink.replace(166905, List.of(classCount(1), classCount(2), classCount(1)));

        RecordingConnection.Statement delete = db.statement("delete from tc_clacount");
        assertEquals("delete from tc_clacount where recordnum = ?", delete.sql);
        assertEquals(166905, delete.rows.get(0).get(1));

        RecordingConnection.Statement insert = db.statement("insert into tc_clacount");
        assertEquals(3, insert.rows.size());
        assertEquals(2, insert.batches);
        assertEquals(1, db.commits);

        Map<Integer, Object> row = insert.rows.get(1);
        assertEquals(166905, row.get(1));
        assertEquals(Date.valueOf(BIN.toLocalDate()), row.get(2));
        assertEquals(Timestamp.valueOf(BIN), row.get(3));
        assertEquals(2, row.get(4));
        assertEquals(2, row.get(5));
        assertEquals("west", row.get(6));
        // bikes, cars_and_tlrs, ... unclassified
        assertEquals(1, row.get(7));
        assertEquals(1, row.get(8));
        assertEquals(0, row.get(9));
        assertEquals(1, row.get(20));
    }

    @Test void testFailedInsertRollsBack() {
        RecordingConnection db = new RecordingConnection();
        db.failOn = "insert";
        MySqlBatchSink<VehicleClassCount> sink = CountTables.classCounts(db.connection(), 500);
        CountDbException e = assertThrows(CountDbException.class, () -> sink.replace(166905, List.of(classCount(1))));
        assertTrue(e.getMessage().startsWith("Error replacing tc_clacount rows for 166905"), e.getMessage());
        assertEquals(1, db.rollbacks);
        assertEquals(0, db.commits);
    }

    @Test void testEmptyHoursStoredAsNull() throws CountDbException {
        RecordingConnection db = new RecordingConnection();
        NonNormalVolCount volume = new NonNormalVolCount(new NonNormalCountKey(101, LocalDate.of(2023, 11, 7), null, null));
        volume.add(0, 12);
        CountTables.volumeCounts(db.connection(), 500).replace(101, List.of(volume));

        Map<Integer, Object> row = db.statement("insert into tc_volcount").rows.get(0);
        assertTrue(db.statement("insert into tc_volcount").sql.contains("am12, am1"));
        assertNull(row.get(3));
        assertEquals(12, row.get(4));
        assertNull(row.get(5));
        assertNull(row.get(6));
        assertEquals(12, row.get(7));
        assertNull(row.get(8));
        assertTrue(row.containsKey(30));
    }

    @Test void testPedestrianColumnsQuoted() throws CountDbException {
        RecordingConnection db = new RecordingConnection();
        BikePedCount count = new BikePedCount(136271, LocalDate.of(2015, 10, 15), LocalTime.of(8, 15), 5, 3, 2);
        CountTables.pedestrianCounts(db.connection(), 500).replace(136271, List.of(count));

        RecordingConnection.Statement insert = db.statement("insert into tc_pedcount");
        assertEquals("insert into tc_pedcount (dvrpcnum, countdate, counttime, total, `in`, `out`) values (?, ?, ?, ?, ?, ?)",
                insert.sql);
        assertEquals(Timestamp.valueOf(LocalDateTime.of(2015, 10, 15, 8, 15)), insert.rows.get(0).get(3));
        assertEquals("delete from tc_pedcount where dvrpcnum = ?", db.statement("delete").sql);
    }

    @Test void testPlaceholders() {
        assertEquals("?", CountTables.placeholders(1));
        assertEquals("?, ?, ?", CountTables.placeholders(3));
    }
}
