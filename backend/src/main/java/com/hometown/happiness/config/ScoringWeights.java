package com.hometown.happiness.config;

import com.hometown.happiness.model.SeasonType;

import java.util.Map;

/**
 * Weights for the four (season type, outcome) combinations. Only magnitudes matter to the scorer;
 * the sign always comes from the outcome.
 */
public final class ScoringWeights {

    public static final String REGULAR_SEASON_WIN = "regular_season_win";
    public static final String REGULAR_SEASON_LOSS = "regular_season_loss";
    public static final String PLAYOFF_WIN = "playoff_win";
    public static final String PLAYOFF_LOSS = "playoff_loss";

    private final int regularWin;
    private final int regularLoss;
    private final int playoffWin;
    private final int playoffLoss;

    public ScoringWeights(int regularWin, int regularLoss, int playoffWin, int playoffLoss) {
        this.regularWin = regularWin;
        this.regularLoss = regularLoss;
        this.playoffWin = playoffWin;
        this.playoffLoss = playoffLoss;
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(1, -1, 3, -3);
    }

    /**
     * Keys absent from a supplied configuration fall back to a magnitude of one.
     *
     * @throws IllegalStateException if a key is present without a number
     */
    public static ScoringWeights fromMap(Map<String, Integer> raw) {
        return new ScoringWeights(
                weight(raw, REGULAR_SEASON_WIN, 1),
                weight(raw, REGULAR_SEASON_LOSS, -1),
                weight(raw, PLAYOFF_WIN, 1),
                weight(raw, PLAYOFF_LOSS, -1));
    }

    private static int weight(Map<String, Integer> raw, String key, int fallback) {
        if (!raw.containsKey(key)) return fallback;
        Integer value = raw.get(key);
        if (value == null) {
            throw new IllegalStateException("Scoring weight '" + key + "' must be a number");
        }
        return value;
    }

    public int magnitude(SeasonType seasonType, boolean win) {
        int w;
        if (seasonType == SeasonType.PLAYOFF) {
            w = win ? playoffWin : playoffLoss;
        } else {
            w = win ? regularWin : regularLoss;
        }
        return Math.abs(w);
    }

    public int getRegularWin() { return regularWin; }
    public int getRegularLoss() { return regularLoss; }
    public int getPlayoffWin() { return playoffWin; }
    public int getPlayoffLoss() { return playoffLoss; }

    @Override
    public String toString() {
        return "ScoringWeights{regularWin=" + regularWin + ", regularLoss=" + regularLoss
                + ", playoffWin=" + playoffWin + ", playoffLoss=" + playoffLoss + "}";
    }
}
