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
import java.util.Locale;
import java.util.Set;

@Service
public class NflFeedLoader extends NameBasedFeedLoader {

    private static final List<String> COLUMNS = List.of("schedule_date", "team_home", "score_home", "team_away", "score_away");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/yyyy"));
    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes");

    public NflFeedLoader(EntityResolver resolver) {
        super(resolver);
    }

    @Override
    public League league() { return League.NFL; }

    @Override
    public List<String> requiredColumns() { return COLUMNS; }

    @Override
    protected RowMapper rowMapper(ResolutionContext ctx) {
        return rec -> toGame(rec, ctx);
    }

    private Game toGame(CSVRecord rec, ResolutionContext ctx) {
        LocalDate date = requireDate(rec, "schedule_date", DATE_FORMATS);
        String home = requireText(rec, "team_home");
        String away = requireText(rec, "team_away");
        // schedule_playoff is optional; without it every game counts as regular season
        boolean playoff = TRUE_VALUES.contains(CsvFeedReader.value(rec, "schedule_playoff").toLowerCase(Locale.ROOT));
        return buildGame(date, playoff ? SeasonType.PLAYOFF : SeasonType.REGULAR,
                home, CsvFeedReader.parseScore(CsvFeedReader.value(rec, "score_home")),
                away, CsvFeedReader.parseScore(CsvFeedReader.value(rec, "score_away")),
                ctx);
    }
}
