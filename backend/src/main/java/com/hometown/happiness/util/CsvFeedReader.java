package com.hometown.happiness.util;

import com.hometown.happiness.exception.MissingInputException;
import com.hometown.happiness.exception.SchemaException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Opens headered CSV feeds and reads their cells leniently. Structural problems (no file, missing
 * columns) throw; content problems (blank or malformed cells) come back as null.
 */
public final class CsvFeedReader {

    private static final CSVFormat HEADERED = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private CsvFeedReader() {}

    /**
     * Opens {@code path} and verifies every required column is present in the header.
     * The caller owns the returned parser.
     */
    public static CSVParser open(Path path, String source, Collection<String> requiredColumns) throws IOException {
        if (path == null || !Files.exists(path)) {
            throw new MissingInputException(path);
        }
        BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        CSVParser parser;
        try {
            skipByteOrderMark(reader);
            parser = new CSVParser(reader, HEADERED);
        } catch (IOException | RuntimeException ex) {
            reader.close();
            throw ex;
        }
        Set<String> header = Set.copyOf(parser.getHeaderNames());
        List<String> missing = new ArrayList<>();
        for (String col : requiredColumns) {
            if (!header.contains(col)) missing.add(col);
        }
        if (!missing.isEmpty()) {
            parser.close();
            throw new SchemaException(source, missing);
        }
        return parser;
    }

    /** Trimmed cell value, or "" when the column is absent or unset for this record. */
    public static String value(CSVRecord rec, String column) {
        if (!rec.isMapped(column) || !rec.isSet(column)) return "";
        String v = rec.get(column);
        return v == null ? "" : v.trim();
    }

    /** Integer score, tolerating a trailing ".0"; null when blank, fractional, out of range or not a number. */
    public static Integer parseScore(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String t = raw.trim();
        try {
            return Integer.parseInt(t);
        } catch (NumberFormatException e) {
            try {
                double d = Double.parseDouble(t);
                if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) return null;
                return (int) d;
            } catch (NumberFormatException e2) {
                return null;
            }
        }
    }

    /** Parses the date part of a cell ("2023-03-01 19:00:00" -> 2023-03-01) with the first format that fits. */
    public static LocalDate parseDate(String raw, List<DateTimeFormatter> formats) {
        if (raw == null || raw.isBlank()) return null;
        String t = raw.trim();
        int cut = indexOfAny(t, ' ', 'T');
        if (cut > 0) t = t.substring(0, cut);
        for (DateTimeFormatter f : formats) {
            LocalDate d = tryParse(t, f);
            if (d != null) return d;
        }
        return null;
    }

    private static LocalDate tryParse(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    public static String payload(CSVRecord rec) {
        return String.valueOf(rec.toMap());
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) return i;
        }
        return -1;
    }

    private static void skipByteOrderMark(BufferedReader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != '\uFEFF') {
            reader.reset();
        }
    }
}
