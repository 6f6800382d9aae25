package com.hometown.happiness.service;

import com.hometown.happiness.dto.TeamReference;
import com.hometown.happiness.exception.MissingInputException;
import com.hometown.happiness.util.CsvFeedReader;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Service
public class ReferenceTableLoader {
    private static final Logger log = LoggerFactory.getLogger(ReferenceTableLoader.class);

    static final List<String> NBA_ROSTER_COLUMNS = List.of("teamId", "abbreviation", "teamName", "location");

    /**
     * Retrosheet "CurrentNames" file: no header; column 1 is the code used in game logs and the last
     * two columns are city and state. A missing file yields an empty table, so every MLB code
     * resolves to a placeholder city.
     */
    public TeamReferenceTable loadMlbCurrentNames(Path path) {
        TeamReferenceTable table = TeamReferenceTable.empty();
        if (path == null || !Files.exists(path)) {
            log.warn("[REFERENCE][MLB] CurrentNames not found at {}; MLB codes will resolve to placeholders", path);
            return table;
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, CSVFormat.DEFAULT.builder().setTrim(true).build())) {
            for (CSVRecord rec : parser) {
                if (rec.size() < 2) continue;
                String retro = rec.get(1);
                if (retro == null || retro.isBlank()) continue;
                String city = rec.get(rec.size() - 2);
                String state = rec.get(rec.size() - 1);
                table.put(new TeamReference(retro.trim(), city, state, null, retro.trim()));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed reading " + path, ex);
        }
        log.info("[REFERENCE][MLB] Loaded {} retro codes from {}", table.size(), path);
        return table;
    }

    /** NBA roster ({@code teamId,abbreviation,teamName,simpleName,location}); required for NBA ingestion. */
    public TeamReferenceTable loadNbaRoster(Path path) {
        if (path == null || !Files.exists(path)) {
            throw new MissingInputException(path, "Missing NBA roster table: " + path);
        }
        TeamReferenceTable table = TeamReferenceTable.empty();
        try (CSVParser parser = CsvFeedReader.open(path, "NBA roster", NBA_ROSTER_COLUMNS)) {
            for (CSVRecord rec : parser) {
                String abbrev = CsvFeedReader.value(rec, "abbreviation");
                String numericId = CsvFeedReader.value(rec, "teamId");
                String code = abbrev.isEmpty() ? numericId : abbrev;
                if (code.isEmpty()) continue;
                table.put(new TeamReference(code,
                        CsvFeedReader.value(rec, "location"),
                        "",
                        CsvFeedReader.value(rec, "teamName"),
                        numericId));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed reading " + path, ex);
        }
        log.info("[REFERENCE][NBA] Loaded {} roster rows from {}", table.size(), path);
        return table;
    }
}
