package com.so2flux.repository;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.so2flux.model.ScanFile;
import com.so2flux.model.ScanRecord;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.List;

/**
 * Reads scan result files (CSV with a header row) into {@link ScanRecord}s. Empty cells
 * become {@code NaN}.
 */
@Repository
public class ScanFileRepository {

    private static final List<String> REQUIRED_COLUMNS = List.of(
            ScanSample.ANGLE, ScanSample.SO2, ScanSample.SO2_ERR, ScanSample.INTENSITY);

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
            .build();
    private final CsvSchema schema = CsvSchema.emptySchema().withHeader();

    /**
     * @throws IOException if the file cannot be parsed or lacks one of the required columns
     */
    public ScanRecord read(ScanFile scanFile) throws IOException {
        List<ScanSample> samples;
        try (MappingIterator<ScanSample> it = csvMapper.readerFor(ScanSample.class)
                .with(schema)
                .readValues(scanFile.getPath().toFile())) {
            samples = it.readAll();
            checkColumns(scanFile, (CsvSchema) it.getParserSchema());
        }

        int n = samples.size();
        double[] angles = new double[n];
        double[] so2 = new double[n];
        double[] so2Err = new double[n];
        double[] intensity = new double[n];
        for (int i = 0; i < n; i++) {
            ScanSample sample = samples.get(i);
            angles[i] = valueOf(sample.getAngle());
            so2[i] = valueOf(sample.getSo2());
            so2Err[i] = valueOf(sample.getSo2Err());
            intensity[i] = valueOf(sample.getIntensity());
        }
        return new ScanRecord(scanFile.getFileName(), scanFile.getTimestamp(), angles, so2, so2Err, intensity);
    }

    private static void checkColumns(ScanFile scanFile, CsvSchema header) throws IOException {
        for (String column : REQUIRED_COLUMNS) {
            if (header == null || header.column(column) == null) {
                throw new IOException("Scan file " + scanFile + " has no '" + column + "' column");
            }
        }
    }

    private static double valueOf(Double value) {
        return value == null ? Double.NaN : value;
    }
}
