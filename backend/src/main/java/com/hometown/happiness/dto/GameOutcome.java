package com.hometown.happiness.dto;

/** Both perspectives of a scored game. */
public record GameOutcome(ScoredOutcome home, ScoredOutcome away) {

    public static final GameOutcome INCOMPLETE = new GameOutcome(ScoredOutcome.NEUTRAL, ScoredOutcome.NEUTRAL);

    public boolean isDecisive() {
        return home.indexScore() != 0;
    }
}
