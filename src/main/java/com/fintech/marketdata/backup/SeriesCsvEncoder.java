package com.fintech.marketdata.backup;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fintech.marketdata.domain.Observation;
import com.fintech.marketdata.domain.SeriesDataset;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

/**
 * Turns a dataset into the backup blob body: UTF-8 CSV, gzip-compressed.
 *
 * <p>Layout: a header row ({@value #DATE_COLUMN} followed by the series columns), then
 * one row per observation with the ISO date first. Missing values are empty fields.
 */
@Component
public class SeriesCsvEncoder {

    public static final String DATE_COLUMN = "Date";

    // Quote only fields containing a separator, quote or line break ("Adj Close" stays bare)
    private final CsvMapper csvMapper = CsvMapper.builder()
        .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
        .build();

    public byte[] encode(SeriesDataset dataset) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(512, dataset.size() * 48));
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            writeCsv(dataset, gzip);
        }
        return buffer.toByteArray();
    }

    public String toCsv(SeriesDataset dataset) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        writeCsv(dataset, buffer);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private void writeCsv(SeriesDataset dataset, OutputStream out) throws IOException {
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        try (SequenceWriter rows = csvMapper.writer().writeValues(writer)) {
            String[] header = new String[dataset.columns().size() + 1];
            header[0] = DATE_COLUMN;
            for (int i = 0; i < dataset.columns().size(); i++) {
                header[i + 1] = dataset.columns().get(i);
            }
            rows.write(header);

            for (Observation observation : dataset.observations()) {
                String[] row = new String[observation.width() + 1];
                row[0] = observation.date().toString();
                for (int i = 0; i < observation.width(); i++) {
                    row[i + 1] = format(observation.value(i));
                }
                rows.write(row);
            }
        }
    }

    // Plain decimal notation: 112117500 rather than 1.121175E8
    private static String format(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return "";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
