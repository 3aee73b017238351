package com.traffic.counts.aadv;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.traffic.counts.common.CountDbException;
import com.traffic.counts.common.CountException;
import com.traffic.counts.common.Direction;
import com.traffic.counts.common.InvalidMcdException;
import com.traffic.counts.common.JsonUtils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AadvCalculatorTest {

    private static final double DELTA = 0.001;

    private FakeCountSource source;
    private AadvCalculator calculator;

    @BeforeEach void setUp() {
        source = new FakeCountSource();
        calculator = new AadvCalculator(source);
    }

    private static HeaderInfo header(int recordNum, String mcd, Integer fc, String countType) {
        HeaderInfo h = new HeaderInfo();
        h.recordNum = recordNum;
        h.mcd = mcd;
        h.fc = fc;
        h.countType = countType;
        return h;
    }

    private void loadBicycleCount() throws IOException {
        source.times = FullDayDetectorTest.times(
                LocalDateTime.of(2020, 11, 21, 12, 0), LocalDateTime.of(2020, 11, 29, 11, 45), 15, 1);
        source.inOutTotals = JsonUtils.readListFromClasspath("/fixtures/bike_156238_inout.json", InOutTotal.class);
        source.header = header(156238, "4210100000", null, "Bicycle 3");
        source.header.bikePedGroup = "2";
        source.header.inDir = "east";
        source.header.outDir = "west";
        source.equipmentFactors.put("Bicycle 3", 1.02);
        source.bicycleFactors.putAll(Map.of(1, 2.068, 2, 1.654, 3, 1.835, 4, 2.017, 5, 2.316, 6, 2.169, 7, 2.006));
    }

    private void loadClassCount() throws IOException {
        source.times = FullDayDetectorTest.times(
                LocalDateTime.of(2023, 3, 5, 0, 0), LocalDateTime.of(2023, 3, 8, 5, 45), 15, 2);
        source.directionTotals = JsonUtils.readListFromClasspath("/fixtures/class_direction_totals.json", DirectionTotal.class);
        source.header = header(171234, "4201700000", 14, "Class");
        source.seasonalFactor = 0.9;
        source.axleFactor = 0.95;
    }

    @Test void testBicycleAadv() throws Exception {
        loadBicycleCount();
        AadvResult result = calculator.calculate(BinnedTable.BICYCLE, 156238);

        assertEquals(122.343, result.overall(), DELTA);
        assertEquals(82.522, result.forDirection(Direction.EAST), DELTA);
        assertEquals(39.821, result.forDirection(Direction.WEST), DELTA);
        assertEquals(122, Math.round(result.overall()));
        assertEquals(83, Math.round(result.forDirection(Direction.EAST)));
        assertEquals(40, Math.round(result.forDirection(Direction.WEST)));
    }

    @Test void testPedestrianAadv() throws Exception {
        source.times = FullDayDetectorTest.times(
                LocalDateTime.of(2015, 10, 14, 12, 0), LocalDateTime.of(2015, 10, 22, 11, 45), 15, 1);
        source.inOutTotals = JsonUtils.readListFromClasspath("/fixtures/ped_136271_inout.json", InOutTotal.class);
        source.header = header(136271, "4201700000", null, "Pedestrian 2");
        source.header.inDir = "south";
        source.header.outDir = "north";
        source.equipmentFactors.put("Pedestrian 2", 1.0622);
        source.pedestrianFactors.put(10, 0.968);

        AadvResult result = calculator.calculate(BinnedTable.PEDESTRIAN, 136271);

        assertEquals(65, Math.round(result.overall()));
        assertEquals(42, Math.round(result.forDirection(Direction.SOUTH)));
        assertEquals(23, Math.round(result.forDirection(Direction.NORTH)));
    }

    @Test void testClassAadvUsesSeasonalFactorOnly() throws Exception {
        loadClassCount();
        AadvResult result = calculator.calculate(BinnedTable.CLASS, 171234);

        assertEquals(1890.0, result.overall(), DELTA);
        assertEquals(900.0, result.forDirection(Direction.NORTH), DELTA);
        assertEquals(990.0, result.forDirection(Direction.SOUTH), DELTA);
        assertNull(result.forDirection(Direction.EAST));
    }

    @Test void testFifteenMinuteAadvAddsAxleFactor() throws Exception {
        loadClassCount();
        AadvResult result = calculator.calculate(BinnedTable.FIFTEEN_MINUTE_VEHICLE, 171234);

        assertEquals(1795.5, result.overall(), DELTA);
        assertEquals(855.0, result.forDirection(Direction.NORTH), DELTA);
        assertEquals(940.5, result.forDirection(Direction.SOUTH), DELTA);
    }

    @Test void testUnequalFullDaysTruncateDivisor() throws Exception {
        loadClassCount();
        source.seasonalFactor = 1.0;
        source.directionTotals = new ArrayList<>();
        for (int day = 5; day <= 7; day++) {
            source.directionTotals.add(new DirectionTotal(LocalDate.of(2023, 3, day), 1000, "north"));
        }
        source.directionTotals.add(new DirectionTotal(LocalDate.of(2023, 3, 5), 1100, "south"));
        source.directionTotals.add(new DirectionTotal(LocalDate.of(2023, 3, 6), 1100, "south"));

        // 8 day totals over 3 direction keys divide by 2
        AadvResult result = calculator.calculate(BinnedTable.CLASS, 171234);
        assertEquals(2600.0, result.overall(), DELTA);
        assertEquals(1500.0, result.forDirection(Direction.NORTH), DELTA);
        assertEquals(1100.0, result.forDirection(Direction.SOUTH), DELTA);
    }

    @Test void testCountWithoutDirection() throws Exception {
        source.times = FullDayDetectorTest.times(
                LocalDateTime.of(2023, 3, 5, 0, 0), LocalDateTime.of(2023, 3, 8, 5, 45), 15, 1);
        source.directionTotals = JsonUtils.readListFromClasspath("/fixtures/undirected_totals.json", DirectionTotal.class);
        source.header = header(171240, "4201700000", 14, "Class");
        source.seasonalFactor = 1.0;

        AadvResult result = calculator.calculate(BinnedTable.CLASS, 171240);
        assertEquals(2200.0, result.overall(), DELTA);
        assertTrue(result.byDirection().isEmpty());
        assertEquals(1, result.asMap().size());
    }

    @Test void testEquipmentFactorApplied() throws Exception {
        loadClassCount();
        source.equipmentFactors.put("Class", 1.1);
        AadvResult result = calculator.calculate(BinnedTable.CLASS, 171234);
        assertEquals(2079.0, result.overall(), DELTA);
    }

    @Test void testPartialDaysIgnored() throws Exception {
        loadBicycleCount();
        Map<DayTotalKey, Long> totals = calculator.totalsByDate(BinnedTable.BICYCLE, 156238);
        assertEquals(21, totals.size());
        assertFalse(totals.containsKey(new DayTotalKey(LocalDate.of(2020, 11, 21), null)));
        assertFalse(totals.containsKey(new DayTotalKey(LocalDate.of(2020, 11, 29), null)));
        assertEquals(84L, totals.get(new DayTotalKey(LocalDate.of(2020, 11, 22), null)));
        assertEquals(50L, totals.get(new DayTotalKey(LocalDate.of(2020, 11, 22), Direction.EAST)));
        assertEquals(34L, totals.get(new DayTotalKey(LocalDate.of(2020, 11, 22), Direction.WEST)));
    }

    @Test void testExcludedDaysRemoved() throws Exception {
        loadClassCount();
        for (DirectionTotal t : source.directionTotals) {
            if (t.date.equals(LocalDate.of(2023, 3, 6))) {
                t.total = 5000;
            }
        }
        assertEquals(3090.0, calculator.calculate(BinnedTable.CLASS, 171234).overall(), DELTA);

        source.excluded.add(LocalDate.of(2023, 3, 6));
        Map<DayTotalKey, Long> totals = calculator.totalsByNonExcludedDate(BinnedTable.CLASS, 171234);
        assertEquals(6, totals.size());
        assertTrue(totals.keySet().stream().noneMatch(k -> k.date.equals(LocalDate.of(2023, 3, 6))));
        assertEquals(1890.0, calculator.calculate(BinnedTable.CLASS, 171234).overall(), DELTA);
    }

    @Test void testNoFullDays() {
        source.header = header(171234, "4201700000", 14, "Class");
        CountException e = assertThrows(CountException.class, () -> calculator.calculate(BinnedTable.CLASS, 171234));
        assertTrue(e.getMessage().startsWith("No full days"));
    }

    @Test void testUnknownStatePrefix() throws Exception {
        loadClassCount();
        source.header.mcd = "3601000000";
        InvalidMcdException e = assertThrows(InvalidMcdException.class,
                () -> calculator.calculate(BinnedTable.CLASS, 171234));
        assertEquals("3601000000", e.getMcd());
    }

    @Test void testNewJerseyCount() throws Exception {
        loadClassCount();
        source.header.mcd = "3400500000";
        assertEquals(1890.0, calculator.calculate(BinnedTable.CLASS, 171234).overall(), DELTA);
    }

    @Test void testHeaderMissing() throws Exception {
        loadClassCount();
        source.header.recordNum = 1;
        CountDbException e = assertThrows(CountDbException.class, () -> calculator.calculate(BinnedTable.CLASS, 171234));
        assertEquals("171234 not found in tc_header table", e.getMessage());
    }

    @Test void testInOutDirectionsRequired() throws Exception {
        loadBicycleCount();
        source.header.outDir = null;
        CountDbException e = assertThrows(CountDbException.class,
                () -> calculator.calculate(BinnedTable.BICYCLE, 156238));
        assertEquals("NULL value for 'indir' or 'outdir' field in tc_header table for 156238", e.getMessage());
    }

    @Test void testStoreReplacesPreviousResult() throws Exception {
        loadClassCount();
        FakeAadvStore store = new FakeAadvStore();
        LocalDate today = LocalDate.of(2023, 4, 1);

        calculator.calculateAndStore(BinnedTable.CLASS, 171234, store, today);
        source.seasonalFactor = 1.0;
        AadvResult second = calculator.calculateAndStore(BinnedTable.CLASS, 171234, store, today);

        assertEquals(2, store.writes);
        assertEquals(1, store.stored.size());
        assertEquals(2100.0, store.stored.get("171234/" + today).overall(), DELTA);
        assertEquals(second.asMap(), store.stored.get("171234/" + today).asMap());
    }

    @Test void testNothingStoredOnFailure() throws Exception {
        loadClassCount();
        source.header.mcd = null;
        FakeAadvStore store = new FakeAadvStore();
        assertThrows(InvalidMcdException.class,
                () -> calculator.calculateAndStore(BinnedTable.CLASS, 171234, store, LocalDate.of(2023, 4, 1)));
        assertEquals(0, store.writes);
    }

    @Test void testDayOfWeekFromSunday() {
        assertEquals(1, AadvCalculator.dayOfWeekFromSunday(LocalDate.of(2020, 11, 22)));
        assertEquals(2, AadvCalculator.dayOfWeekFromSunday(LocalDate.of(2020, 11, 23)));
        assertEquals(7, AadvCalculator.dayOfWeekFromSunday(LocalDate.of(2020, 11, 28)));
    }

    @Test void testResultAsMap() throws Exception {
        loadBicycleCount();
        Map<String, Double> values = calculator.calculate(BinnedTable.BICYCLE, 156238).asMap();
        assertEquals(3, values.size());
        assertTrue(values.containsKey("all"));
        assertTrue(values.containsKey("east"));
        assertTrue(values.containsKey("west"));
    }
}
