package com.hometown.happiness.util;

import com.hometown.happiness.exception.MissingInputException;
import com.hometown.happiness.exception.SchemaException;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvFeedReaderTest {

    @TempDir
    Path dir;

    @Test
    void missingFileIsMissingInput() {
        Path absent = dir.resolve("nope.csv");
        assertThatThrownBy(() -> CsvFeedReader.open(absent, "test", List.of("a")))
                .isInstanceOf(MissingInputException.class);
    }

    @Test
    void missingColumnsAreListed() throws Exception {
        Path f = dir.resolve("feed.csv");
        Files.writeString(f, "Date,Home\n2023-01-01,X\n", StandardCharsets.UTF_8);
        assertThatThrownBy(() -> CsvFeedReader.open(f, "NHL feed", List.of("Date", "Home", "Away", "HomeGoals")))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("Away")
                .hasMessageContaining("HomeGoals")
                .satisfies(ex -> assertThat(((SchemaException) ex).getMissingColumns()).containsExactly("Away", "HomeGoals"));
    }

    @Test
    void byteOrderMarkDoesNotHideFirstColumn() throws Exception {
        Path f = dir.resolve("bom.csv");
        Files.writeString(f, "\uFEFFDate,Home\n2023-01-01, Boston Bruins \n", StandardCharsets.UTF_8);
        try (CSVParser parser = CsvFeedReader.open(f, "test", List.of("Date", "Home"))) {
            List<CSVRecord> rows = parser.getRecords();
            assertThat(rows).hasSize(1);
            assertThat(CsvFeedReader.value(rows.get(0), "Date")).isEqualTo("2023-01-01");
            assertThat(CsvFeedReader.value(rows.get(0), "Home")).isEqualTo("Boston Bruins");
            assertThat(CsvFeedReader.value(rows.get(0), "NotThere")).isEmpty();
        }
    }

    @Test
    void scoresToleratePointZeroAndDegradeToNull() {
        assertThat(CsvFeedReader.parseScore("4")).isEqualTo(4);
        assertThat(CsvFeedReader.parseScore("4.0")).isEqualTo(4);
        assertThat(CsvFeedReader.parseScore("")).isNull();
        assertThat(CsvFeedReader.parseScore("abc")).isNull();
        assertThat(CsvFeedReader.parseScore("NaN")).isNull();
    }

    @Test
    void fractionalOrOversizedScoresAreAbsent() {
        assertThat(CsvFeedReader.parseScore("4.5")).isNull();
        assertThat(CsvFeedReader.parseScore("1e12")).isNull();
        assertThat(CsvFeedReader.parseScore("Infinity")).isNull();
        assertThat(CsvFeedReader.parseScore("-3.0")).isEqualTo(-3);
    }

    @Test
    void datesKeepOnlyTheDatePart() {
        List<DateTimeFormatter> formats = List.of(DateTimeFormatter.ISO_LOCAL_DATE, DateTimeFormatter.ofPattern("M/d/yyyy"));
        assertThat(CsvFeedReader.parseDate("2023-03-01 19:00:00", formats)).isEqualTo(LocalDate.of(2023, 3, 1));
        assertThat(CsvFeedReader.parseDate("2023-03-01T19:00:00", formats)).isEqualTo(LocalDate.of(2023, 3, 1));
        assertThat(CsvFeedReader.parseDate("9/10/2015", formats)).isEqualTo(LocalDate.of(2015, 9, 10));
        assertThat(CsvFeedReader.parseDate("not a date", formats)).isNull();
        assertThat(CsvFeedReader.parseDate(" ", formats)).isNull();
    }
}
