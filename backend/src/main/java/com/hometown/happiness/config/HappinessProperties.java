package com.hometown.happiness.config;

import com.hometown.happiness.model.League;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "happiness")
public class HappinessProperties {

    private final DataDirs data = new DataDirs();
    private final Feeds feeds = new Feeds();
    private final Reference reference = new Reference();
    private final Resolver resolver = new Resolver();
    private final Scoring scoring = new Scoring();
    private final Rollup rollup = new Rollup();
    private final Pipeline pipeline = new Pipeline();

    public DataDirs getData() { return data; }
    public Feeds getFeeds() { return feeds; }
    public Reference getReference() { return reference; }
    public Resolver getResolver() { return resolver; }
    public Scoring getScoring() { return scoring; }
    public Rollup getRollup() { return rollup; }
    public Pipeline getPipeline() { return pipeline; }

    public static class DataDirs {
        private String rawDir = "data";
        private String processedDir = "data/processed";
        private String outputsDir = "data/outputs";
        private String dailyDir = "data/daily";

        public String getRawDir() { return rawDir; }
        public void setRawDir(String rawDir) { this.rawDir = rawDir; }
        public String getProcessedDir() { return processedDir; }
        public void setProcessedDir(String processedDir) { this.processedDir = processedDir; }
        public String getOutputsDir() { return outputsDir; }
        public void setOutputsDir(String outputsDir) { this.outputsDir = outputsDir; }
        public String getDailyDir() { return dailyDir; }
        public void setDailyDir(String dailyDir) { this.dailyDir = dailyDir; }

        public Path raw(String fileName) { return Path.of(rawDir).resolve(fileName); }
        public Path processed(String fileName) { return Path.of(processedDir).resolve(fileName); }
        public Path outputs(String fileName) { return Path.of(outputsDir).resolve(fileName); }
    }

    /** Raw feed file names, relative to {@code happiness.data.raw-dir}. Blank disables a league. */
    public static class Feeds {
        private String nhl = "nhl_season_games_2018_2025.csv";
        private String nfl = "nfl_scores_2015_2025.csv";
        private String mlb = "MLB2020-2024GameInfo_small.csv";
        private String nba = "nba_regular_season_totals_2010_2024_small.csv";

        public String getNhl() { return nhl; }
        public void setNhl(String nhl) { this.nhl = nhl; }
        public String getNfl() { return nfl; }
        public void setNfl(String nfl) { this.nfl = nfl; }
        public String getMlb() { return mlb; }
        public void setMlb(String mlb) { this.mlb = mlb; }
        public String getNba() { return nba; }
        public void setNba(String nba) { this.nba = nba; }

        public String forLeague(League league) {
            return switch (league) {
                case NHL -> nhl;
                case NFL -> nfl;
                case MLB -> mlb;
                case NBA -> nba;
            };
        }
    }

    public static class Reference {
        private String mlbCurrentNames = "CurrentNames.csv";
        private String nbaTeams = "teams.csv";

        public String getMlbCurrentNames() { return mlbCurrentNames; }
        public void setMlbCurrentNames(String mlbCurrentNames) { this.mlbCurrentNames = mlbCurrentNames; }
        public String getNbaTeams() { return nbaTeams; }
        public void setNbaTeams(String nbaTeams) { this.nbaTeams = nbaTeams; }
    }

    public static class Resolver {
        // league code -> nicknames made of more than one word
        private Map<String, List<String>> multiwordNicknames = new LinkedHashMap<>(Map.of(
                "nhl", List.of("Maple Leafs", "Blue Jackets", "Golden Knights", "Red Wings"),
                "nfl", List.of("Football Team", "Commanders", "49ers")));

        public Map<String, List<String>> getMultiwordNicknames() { return multiwordNicknames; }
        public void setMultiwordNicknames(Map<String, List<String>> multiwordNicknames) { this.multiwordNicknames = multiwordNicknames; }

        public List<String> nicknamesFor(League league) {
            List<String> configured = multiwordNicknames.get(league.code());
            if (configured == null) {
                configured = multiwordNicknames.get(league.name().toLowerCase(Locale.ROOT));
            }
            return configured == null ? List.of() : new ArrayList<>(configured);
        }
    }

    public static class Scoring {
        private String path = "config/scoring.json";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    public static class Rollup {
        // yyyy-MM-dd; blank keeps the whole history
        private String dailyStartDate = "";
        // league code -> team id; the selected-teams table is written only when all four are set
        private Map<String, String> selectedTeams = new LinkedHashMap<>();

        public String getDailyStartDate() { return dailyStartDate; }
        public void setDailyStartDate(String dailyStartDate) { this.dailyStartDate = dailyStartDate; }
        public Map<String, String> getSelectedTeams() { return selectedTeams; }
        public void setSelectedTeams(Map<String, String> selectedTeams) { this.selectedTeams = selectedTeams; }
    }

    public static class Pipeline {
        private boolean runOnStartup = false;

        public boolean isRunOnStartup() { return runOnStartup; }
        public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }
    }
}
