package com.hometown.happiness.dto;

/** One team's view of a game result: "W", "L" or "" with its base and weighted score. */
public record ScoredOutcome(String result, int indexScore, int weightedScore) {

    public static final ScoredOutcome NEUTRAL = new ScoredOutcome("", 0, 0);

    public boolean isWin() {
        return "W".equals(result);
    }

    public boolean isLoss() {
        return "L".equals(result);
    }
}
