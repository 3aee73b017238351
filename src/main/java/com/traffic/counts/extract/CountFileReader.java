package com.traffic.counts.extract;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.traffic.counts.common.BadHeaderException;
import com.traffic.counts.common.BadLocationException;
import com.traffic.counts.common.BadVehicleClassException;
import com.traffic.counts.common.BikePedCount;
import com.traffic.counts.common.CountException;
import com.traffic.counts.common.CountKind;
import com.traffic.counts.common.CountMetadata;
import com.traffic.counts.common.Direction;
import com.traffic.counts.common.FifteenMinuteVehicle;
import com.traffic.counts.common.IndividualVehicle;
import com.traffic.counts.common.VehicleClass;

/**
 * Reads counter exports. Vehicle files start with a block of metadata rows
 * followed by a header row; bicycle and pedestrian files with a few title rows.
 */
public final class CountFileReader {

    private static final Logger LOG = LoggerFactory.getLogger(CountFileReader.class);

    static final String INDIVIDUAL_VEHICLE_HEADER = "Veh.No.,Date,Time,Channel,Class,Speed";
    static final String FIFTEEN_MINUTE_VEHICLE_HEADER = "Number,Date,Time,Channel1";
    private static final int HEADER_SEARCH_LINES = 50;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US);
    private static final DateTimeFormatter TIME_SECONDS = new DateTimeFormatterBuilder()
            .parseCaseInsensitive().appendPattern("h:mm:ss a").toFormatter(Locale.US);
    private static final DateTimeFormatter TIME_MINUTES = new DateTimeFormatterBuilder()
            .parseCaseInsensitive().appendPattern("h:mm a").toFormatter(Locale.US);
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.US);

    private CountFileReader() {
    }

    /**
     * Kind of count from the directory the file was uploaded to.
     */
    public static CountKind kindFromLocation(Path path) throws BadLocationException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent == null || parent.getFileName() == null) {
            throw new BadLocationException(String.valueOf(parent));
        }
        return CountKind.fromDirectoryName(parent.getFileName().toString());
    }

    /**
     * Kind of count from the location, cross-checked against the header row
     * for vehicle files.
     */
    public static CountKind detectKind(Path path) throws CountException {
        CountKind kind = kindFromLocation(path);
        if (kind == CountKind.INDIVIDUAL_VEHICLE || kind == CountKind.FIFTEEN_MINUTE_VEHICLE) {
            HeaderMatch header = findHeader(path);
            if (header.kind != kind) {
                throw new BadHeaderException(path.getFileName() + " is in " + kind.directoryName()
                        + " but has a " + header.kind.directoryName() + " header");
            }
        }
        return kind;
    }

    /**
     * Number of rows before the data, header row included.
     */
    public static int nonDataRows(Path path) throws CountException {
        return findHeader(path).rows;
    }

    public static List<IndividualVehicle> readIndividualVehicles(Path path) throws CountException {
        List<IndividualVehicle> vehicles = new ArrayList<>();
        int skip = nonDataRows(path);
        try (CSVReader reader = open(path, skip)) {
            String[] row;
            int line = skip;
            while ((row = reader.readNext()) != null) {
                line++;
                if (isBlank(row)) {
                    continue;
                }
                requireColumns(path, line, row, 6);
                int classNum = parseInt(path, line, row[4]);
                VehicleClass vehicleClass;
                try {
                    vehicleClass = VehicleClass.fromNum(classNum);
                } catch (BadVehicleClassException e) {
                    LOG.error("{} line {}: {}", path.getFileName(), line, e.getMessage());
                    continue;
                }
                vehicles.add(new IndividualVehicle(
                        parseDate(path, line, row[1]),
                        parseTime(path, line, row[2], TIME_SECONDS),
                        parseInt(path, line, row[3]),
                        vehicleClass,
                        parseDouble(path, line, row[5])));
            }
        } catch (IOException | CsvValidationException e) {
            throw new CountException("Unable to read " + path, e);
        }
        return vehicles;
    }

    /**
     * One record per direction channel of each row.
     */
    public static List<FifteenMinuteVehicle> readFifteenMinuteVehicles(Path path, CountMetadata metadata) throws CountException {
        List<FifteenMinuteVehicle> counts = new ArrayList<>();
        List<Integer> channels = metadata.directions.channels();
        int skip = nonDataRows(path);
        try (CSVReader reader = open(path, skip)) {
            String[] row;
            int line = skip;
            while ((row = reader.readNext()) != null) {
                line++;
                if (isBlank(row)) {
                    continue;
                }
                if (row.length < 3 + channels.size()) {
                    throw new CountException(path.getFileName() + " line " + line
                            + ": fewer count columns than directions in file name");
                }
                LocalDate date = parseDate(path, line, row[1]);
                LocalTime time = parseTime(path, line, row[2], TIME_MINUTES);
                for (int channel : channels) {
                    Direction direction = metadata.directions.forChannel(channel);
                    int count = parseInt(path, line, row[2 + channel]);
                    counts.add(new FifteenMinuteVehicle(metadata.recordNum, date, time, count, direction, channel));
                }
            }
        } catch (IOException | CsvValidationException e) {
            throw new CountException("Unable to read " + path, e);
        }
        return counts;
    }

    /**
     * Bicycle and pedestrian files share one layout: timestamp, total, and
     * in/out columns when the count covers two directions.
     */
    public static List<BikePedCount> readBikePedCounts(Path path, CountMetadata metadata) throws CountException {
        List<BikePedCount> counts = new ArrayList<>();
        boolean twoWay = metadata.directions.direction2 != null;
        try (CSVReader reader = open(path, 0)) {
            String[] row;
            int line = 0;
            while ((row = reader.readNext()) != null) {
                line++;
                if (isBlank(row)) {
                    continue;
                }
                LocalDateTime dt;
                try {
                    dt = LocalDateTime.parse(row[0].trim(), DATE_TIME);
                } catch (DateTimeParseException e) {
                    // title and header rows
                    continue;
                }
                if (twoWay) {
                    requireColumns(path, line, row, 4);
                    counts.add(new BikePedCount(metadata.recordNum, dt.toLocalDate(), dt.toLocalTime(),
                            parseInt(path, line, row[1]), parseInt(path, line, row[2]), parseInt(path, line, row[3])));
                } else {
                    requireColumns(path, line, row, 2);
                    counts.add(new BikePedCount(metadata.recordNum, dt.toLocalDate(), dt.toLocalTime(),
                            parseInt(path, line, row[1]), null, null));
                }
            }
        } catch (IOException | CsvValidationException e) {
            throw new CountException("Unable to read " + path, e);
        }
        return counts;
    }

    private static HeaderMatch findHeader(Path path) throws CountException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
            String line;
            int rows = 0;
            while (rows < HEADER_SEARCH_LINES && (line = reader.readLine()) != null) {
                rows++;
                String stripped = line.replace("\"", "").replace(" ", "");
                if (stripped.contains(FIFTEEN_MINUTE_VEHICLE_HEADER)) {
                    return new HeaderMatch(CountKind.FIFTEEN_MINUTE_VEHICLE, rows);
                }
                if (stripped.contains(INDIVIDUAL_VEHICLE_HEADER)) {
                    return new HeaderMatch(CountKind.INDIVIDUAL_VEHICLE, rows);
                }
            }
        } catch (IOException e) {
            throw new CountException("Unable to read " + path, e);
        }
        throw new BadHeaderException("No recognized header in " + path.getFileName());
    }

    private static CSVReader open(Path path, int skipLines) throws IOException {
        Reader in = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1);
        return new CSVReaderBuilder(in)
                .withSkipLines(skipLines)
                .withCSVParser(new CSVParserBuilder().withIgnoreLeadingWhiteSpace(true).build())
                .build();
    }

    private static boolean isBlank(String[] row) {
        for (String field : row) {
            if (field != null && !field.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private static void requireColumns(Path path, int line, String[] row, int columns) throws CountException {
        if (row.length < columns) {
            throw new CountException(path.getFileName() + " line " + line + ": expected " + columns
                    + " columns, found " + row.length);
        }
    }

    private static LocalDate parseDate(Path path, int line, String value) throws CountException {
        try {
            return LocalDate.parse(value.trim(), DATE);
        } catch (DateTimeParseException e) {
            throw new CountException(path.getFileName() + " line " + line + ": bad date " + value, e);
        }
    }

    private static LocalTime parseTime(Path path, int line, String value, DateTimeFormatter format) throws CountException {
        try {
            return LocalTime.parse(value.trim(), format);
        } catch (DateTimeParseException e) {
            throw new CountException(path.getFileName() + " line " + line + ": bad time " + value, e);
        }
    }

    private static int parseInt(Path path, int line, String value) throws CountException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new CountException(path.getFileName() + " line " + line + ": bad number " + value, e);
        }
    }

    private static double parseDouble(Path path, int line, String value) throws CountException {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new CountException(path.getFileName() + " line " + line + ": bad speed " + value, e);
        }
    }

    private static final class HeaderMatch {

        final CountKind kind;
        final int rows;

        HeaderMatch(CountKind kind, int rows) {
            this.kind = kind;
            this.rows = rows;
        }
    }
}
