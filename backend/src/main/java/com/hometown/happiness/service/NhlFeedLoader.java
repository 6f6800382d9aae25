package com.hometown.happiness.service;

import com.hometown.happiness.model.Game;
import com.hometown.happiness.model.League;
import com.hometown.happiness.model.SeasonType;
import com.hometown.happiness.util.CsvFeedReader;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Service
public class NhlFeedLoader extends NameBasedFeedLoader {

    private static final List<String> COLUMNS = List.of("Date", "Away", "AwayGoals", "Home", "HomeGoals", "Type");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(DateTimeFormatter.ISO_LOCAL_DATE);

    public NhlFeedLoader(EntityResolver resolver) {
        super(resolver);
    }

    @Override
    public League league() { return League.NHL; }

    @Override
    public List<String> requiredColumns() { return COLUMNS; }

    @Override
    protected RowMapper rowMapper(ResolutionContext ctx) {
        return rec -> toGame(rec, ctx);
    }

    private Game toGame(CSVRecord rec, ResolutionContext ctx) {
        LocalDate date = requireDate(rec, "Date", DATE_FORMATS);
        String home = requireText(rec, "Home");
        String away = requireText(rec, "Away");
        return buildGame(date, SeasonType.fromLabel(CsvFeedReader.value(rec, "Type")),
                home, CsvFeedReader.parseScore(CsvFeedReader.value(rec, "HomeGoals")),
                away, CsvFeedReader.parseScore(CsvFeedReader.value(rec, "AwayGoals")),
                ctx);
    }
}
