package com.so2flux.repository;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.so2flux.model.FluxRecord;
import com.so2flux.model.FluxTable;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Writes daily flux tables to {@code <dayRoot>/<station>/<date>_<station>_fluxes.csv}.
 * Existing tables are overwritten; missing station directories are not created.
 */
@Repository
public class FluxTableRepository {

    private final ObjectWriter writer;

    public FluxTableRepository() {
        CsvMapper csvMapper = new CsvMapper();
        csvMapper.registerModule(new JavaTimeModule());
        csvMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        CsvSchema schema = csvMapper.schemaFor(FluxRecord.class).withHeader();
        this.writer = csvMapper.writer(schema);
    }

    public Path save(FluxTable table, Path dayRoot, boolean reanalysis) throws IOException {
        Path target = tablePath(dayRoot, table.getStationName(), table.getDate(), reanalysis);
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.writeValues(out).writeAll(table.getRecords()).close();
        }
        return target;
    }

    public static Path tablePath(Path dayRoot, String stationName, LocalDate date, boolean reanalysis) {
        String suffix = reanalysis ? "_fluxes_reanalysed.csv" : "_fluxes.csv";
        return dayRoot.resolve(stationName).resolve(date + "_" + stationName + suffix);
    }
}
