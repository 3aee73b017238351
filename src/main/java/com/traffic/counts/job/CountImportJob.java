package com.traffic.counts.job;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.traffic.counts.aadv.AadvCalculator;
import com.traffic.counts.aadv.AadvResult;
import com.traffic.counts.aadv.BinnedTable;
import com.traffic.counts.aadv.DateSelector;
import com.traffic.counts.check.CheckResult;
import com.traffic.counts.check.DataChecker;
import com.traffic.counts.common.BadIntervalCountException;
import com.traffic.counts.common.BikePedCount;
import com.traffic.counts.common.CountDbException;
import com.traffic.counts.common.CountException;
import com.traffic.counts.common.CountKind;
import com.traffic.counts.common.CountMetadata;
import com.traffic.counts.common.FifteenMinuteVehicle;
import com.traffic.counts.common.IndividualVehicle;
import com.traffic.counts.common.JsonUtils;
import com.traffic.counts.count.BinnedCountBuilder;
import com.traffic.counts.count.BinnedCounts;
import com.traffic.counts.extract.CountFileReader;
import com.traffic.counts.pivot.HourlyCount;
import com.traffic.counts.pivot.HourlyPivotBuilder;
import com.traffic.counts.pivot.NonNormalVolCount;
import com.traffic.counts.sink.CountTables;
import com.traffic.counts.sink.MySqlAadvStore;
import com.traffic.counts.sink.MySqlConnections;
import com.traffic.counts.sink.MySqlCountSource;
import com.traffic.counts.sink.MySqlHeaderTable;
import com.traffic.counts.sink.MySqlImportLog;
import com.traffic.counts.sink.MySqlImportLog.Level;
import com.traffic.counts.util.TimeInterval;

/**
 * Imports every count file found under the kind directories of the data
 * directory. A failing file is logged and skipped.
 */
public class CountImportJob {

    private static final Logger LOG = LoggerFactory.getLogger(CountImportJob.class);

    private static final String PROPS_FILE = "application.properties";

    private final MySqlHeaderTable headers;
    private final MySqlImportLog importLog;
    private final MySqlCountSource source;
    private final MySqlAadvStore aadvStore;
    private final Connection conn;
    private final DataChecker checker;
    private final int batchSize;
    private final boolean cleanup;

    public CountImportJob(Connection conn, Properties props) {
        this.conn = conn;
        this.headers = new MySqlHeaderTable(conn);
        this.importLog = new MySqlImportLog(conn);
        this.source = new MySqlCountSource(conn);
        this.aadvStore = new MySqlAadvStore(conn);
        this.checker = DataChecker.fromProperties(props);
        this.batchSize = JsonUtils.intProperty(props, "mysql.batch.size", 500);
        this.cleanup = JsonUtils.booleanProperty(props, "import.cleanup.files", false);
    }

    public static void main(String[] args) throws Exception {
        Properties props = JsonUtils.loadProperties(PROPS_FILE, "src/main/resources/" + PROPS_FILE);
        Path dataDir = Paths.get(JsonUtils.requireProperty(props, "import.data.dir"));

        try (Connection conn = MySqlConnections.open(props)) {
            int imported = new CountImportJob(conn, props).run(dataDir);
            LOG.info("Imported {} count file(s) from {}", imported, dataDir);
        } catch (SQLException e) {
            LOG.error("Could not connect to the count database", e);
            System.exit(1);
        }
    }

    /**
     * @return number of files imported without error
     */
    public int run(Path dataDir) throws IOException {
        int imported = 0;
        for (CountKind kind : CountKind.values()) {
            Path dir = dataDir.resolve(kind.directoryName());
            if (!Files.isDirectory(dir)) {
                continue;
            }
            for (Path file : listFiles(dir)) {
                if (importFile(file)) {
                    imported++;
                }
            }
        }
        return imported;
    }

    boolean importFile(Path file) {
        int recordNum = 0;
        try {
            CountKind kind = CountFileReader.detectKind(file);
            CountMetadata metadata = CountMetadata.fromPath(file);
            recordNum = metadata.recordNum;
            if (!headers.exists(recordNum)) {
                throw new CountDbException(recordNum + " not found in tc_header table");
            }
            LOG.info("{}: importing {} as {}", recordNum, file.getFileName(), kind);
            importLog.insert(recordNum, "Began import of " + file.getFileName(), Level.INFO);

            List<CheckResult> checks = store(kind, file, metadata);
            headers.updateMetadata(recordNum, metadata, LocalDate.now());

            BinnedTable table = BinnedTable.forKind(kind);
            if (kind != CountKind.FIFTEEN_MINUTE_BICYCLE) {
                calculateAadv(table, recordNum);
            }
            updateSetDate(table, recordNum);

            for (CheckResult warning : DataChecker.report(recordNum, checks)) {
                importLog.insert(recordNum, warning.message, Level.WARNING);
            }

            importLog.insert(recordNum, "Import of " + file.getFileName() + " complete", Level.INFO);
            if (cleanup) {
                Files.deleteIfExists(file);
            }
            return true;
        } catch (CountException | IOException | RuntimeException e) {
            LOG.error("{}: import of {} failed: {}", recordNum, file, e.getMessage(), e);
            if (recordNum != 0) {
                importLog.insert(recordNum, "Import failed: " + e.getMessage(), Level.ERROR);
            }
            return false;
        }
    }

    /**
     * Extract, derive and store the rows of one file.
     *
     * @return data check outcomes for the stored rows
     */
    private List<CheckResult> store(CountKind kind, Path file, CountMetadata metadata) throws CountException {
        int recordNum = metadata.recordNum;
        List<CheckResult> checks = new ArrayList<>();
        switch (kind) {
            case INDIVIDUAL_VEHICLE: {
                List<IndividualVehicle> vehicles = CountFileReader.readIndividualVehicles(file);
                BinnedCounts binned = BinnedCountBuilder.build(metadata, vehicles, TimeInterval.FIFTEEN_MIN);
                CountTables.classCounts(conn, batchSize).replace(recordNum, binned.vehicleClassCounts);
                CountTables.speedCounts(conn, batchSize).replace(recordNum, binned.speedRangeCounts);
                List<NonNormalVolCount> volumes = storeVolumes(BinnedTable.CLASS, recordNum);
                CountTables.avgSpeedCounts(conn, batchSize)
                        .replace(recordNum, HourlyPivotBuilder.avgSpeedFromVehicles(metadata, vehicles));

                checks.add(checker.checkClass2Share(binned.vehicleClassCounts));
                checks.add(checker.checkUnclassifiedShare(binned.vehicleClassCounts));
                checks.add(checker.checkDirectionProportions(volumes));
                checks.add(checker.checkConsecutiveZeroHours(source.hourlyCounts(BinnedTable.CLASS, recordNum)));
                break;
            }
            case FIFTEEN_MINUTE_VEHICLE: {
                List<FifteenMinuteVehicle> counts = CountFileReader.readFifteenMinuteVehicles(file, metadata);
                CountTables.fifteenMinuteVehicles(conn, batchSize).replace(recordNum, counts);
                List<NonNormalVolCount> volumes = storeVolumes(BinnedTable.FIFTEEN_MINUTE_VEHICLE, recordNum);

                checks.add(checker.checkDirectionProportions(volumes));
                checks.add(checker.checkConsecutiveZeroHours(
                        source.hourlyCounts(BinnedTable.FIFTEEN_MINUTE_VEHICLE, recordNum)));
                break;
            }
            case FIFTEEN_MINUTE_BICYCLE: {
                List<BikePedCount> counts = CountFileReader.readBikePedCounts(file, metadata);
                CountTables.bicycleCounts(conn, batchSize).replace(recordNum, counts);

                checks.add(checker.checkBikeDirectionProportions(counts,
                        metadata.directions.direction1, metadata.directions.direction2));
                checks.add(checker.checkExcessiveBicycles(counts));
                checks.add(checker.checkConsecutiveZeroHours(DataChecker.hourlyTotals(counts)));
                break;
            }
            case FIFTEEN_MINUTE_PEDESTRIAN: {
                List<BikePedCount> counts = CountFileReader.readBikePedCounts(file, metadata);
                CountTables.pedestrianCounts(conn, batchSize).replace(recordNum, counts);

                checks.add(checker.checkBikeDirectionProportions(counts,
                        metadata.directions.direction1, metadata.directions.direction2));
                checks.add(checker.checkConsecutiveZeroHours(DataChecker.hourlyTotals(counts)));
                break;
            }
            default:
                throw new IllegalStateException("Unhandled count kind " + kind);
        }
        return checks;
    }

    /**
     * Hourly volumes denormalized from the rows just stored in {@code table}.
     */
    private List<NonNormalVolCount> storeVolumes(BinnedTable table, int recordNum) throws CountException {
        List<HourlyCount> hourly = source.hourlyCounts(table, recordNum);
        List<NonNormalVolCount> volumes = HourlyPivotBuilder.volumeFromHourlyCounts(hourly);
        CountTables.volumeCounts(conn, batchSize).replace(recordNum, volumes);
        return volumes;
    }

    private void calculateAadv(BinnedTable table, int recordNum) throws IOException {
        AadvCalculator calculator = new AadvCalculator(source);
        try {
            AadvResult result = calculator.calculateAndStore(table, recordNum, aadvStore, LocalDate.now());
            String values = JsonUtils.toJson(result.asMap());
            LOG.info("{}: AADV {}", recordNum, values);
            importLog.insert(recordNum, "AADV calculated: " + values, Level.INFO);
        } catch (BadIntervalCountException e) {
            String msg = "AADV not calculated: " + e.getMessage()
                    + " (the first day of the stored count is incomplete; check the start of the file)";
            LOG.error("{}: {}", recordNum, msg);
            importLog.insert(recordNum, msg, Level.ERROR);
        } catch (CountException e) {
            // the counts are stored, only the AADV is missing
            LOG.error("{}: AADV not calculated: {}", recordNum, e.getMessage());
            importLog.insert(recordNum, "AADV not calculated: " + e.getMessage(), Level.ERROR);
        }
    }

    private void updateSetDate(BinnedTable table, int recordNum) throws CountDbException {
        TreeSet<LocalDate> dates = new TreeSet<>();
        for (LocalDateTime t : source.countTimes(table, recordNum)) {
            dates.add(t.toLocalDate());
        }
        Optional<LocalDate> setDate = DateSelector.determineDate(dates);
        if (setDate.isPresent()) {
            LOG.info("{}: count date {}", recordNum, setDate.get());
            headers.updateSetDate(recordNum, setDate.get());
        } else {
            LOG.warn("{}: no weekday to file the count under", recordNum);
        }
    }

    private static List<Path> listFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }
}
