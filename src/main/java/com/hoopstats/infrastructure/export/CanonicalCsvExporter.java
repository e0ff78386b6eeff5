package com.hoopstats.infrastructure.export;

import com.hoopstats.domain.model.CanonicalField;
import com.hoopstats.domain.model.CanonicalRecord;
import com.opencsv.CSVWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Writes canonical records as a flat CSV: identity columns, then one column per statistic
 * (sorted), then the contributing sources.
 */
@Component
public class CanonicalCsvExporter {

    private static final List<String> IDENTITY_COLUMNS =
        List.of("entity_id", "player", "team", "season", "pos", "version");

    public void write(List<CanonicalRecord> records, Writer out) {
        Set<String> stats = new TreeSet<>();
        records.forEach(record -> stats.addAll(record.getFields().keySet()));
        stats.remove("team");
        stats.remove("pos");

        List<String> header = new ArrayList<>(IDENTITY_COLUMNS);
        header.addAll(stats);
        header.add("sources");

        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(header.toArray(new String[0]), false);
            for (CanonicalRecord record : records) {
                List<String> row = new ArrayList<>();
                row.add(record.getEntityId());
                row.add(record.getDisplayName());
                row.add(record.getTeam() != null ? record.getTeam().name() : "");
                row.add(String.valueOf(record.getSeason()));
                row.add(record.getPosition() != null ? record.getPosition().name() : "");
                row.add(record.getVersion() != null ? String.valueOf(record.getVersion()) : "");
                for (String stat : stats) {
                    row.add(format(record.getFields().get(stat)));
                }
                row.add(String.join(";", record.getSources()));
                writer.writeNext(row.toArray(new String[0]), false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write canonical CSV", e);
        }
    }

    private static String format(CanonicalField field) {
        if (field == null || field.getValue() == null) {
            return "";
        }
        Object value = field.getValue();
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
            return String.valueOf(d.longValue());
        }
        return value.toString();
    }
}
