package com.hometown.happiness.service;

import com.hometown.happiness.config.ScoringWeights;
import com.hometown.happiness.dto.GameOutcome;
import com.hometown.happiness.dto.ScoredOutcome;
import com.hometown.happiness.model.Game;
import com.hometown.happiness.model.SeasonType;
import org.springframework.stereotype.Service;

/**
 * Turns a game result into a happiness contribution for each side: +1 for the winner, -1 for the
 * loser, scaled by the configured weight for the season type. Ties, missing scores and games without
 * a winner score zero for both sides.
 */
@Service
public class OutcomeScorer {

    public enum Winner { HOME, AWAY, NONE }

    private final ScoringWeights weights;

    public OutcomeScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    public GameOutcome score(SeasonType seasonType, Integer homeScore, Integer awayScore, Winner winner) {
        if (homeScore == null || awayScore == null || winner == null || winner == Winner.NONE) {
            return GameOutcome.INCOMPLETE;
        }
        // a tie wins nothing, whatever the winner flag says
        if (homeScore.equals(awayScore)) {
            return GameOutcome.INCOMPLETE;
        }
        SeasonType type = seasonType == null ? SeasonType.REGULAR : seasonType;
        ScoredOutcome win = new ScoredOutcome("W", 1, weights.magnitude(type, true));
        ScoredOutcome loss = new ScoredOutcome("L", -1, -weights.magnitude(type, false));
        return winner == Winner.HOME ? new GameOutcome(win, loss) : new GameOutcome(loss, win);
    }

    public GameOutcome score(Game game) {
        return score(game.getSeasonType(), game.getHomeScore(), game.getAwayScore(), winnerOf(game));
    }

    static Winner winnerOf(Game game) {
        if (!game.hasWinner()) return Winner.NONE;
        if (game.getWinningTeamId().equals(game.getHomeTeamId())) return Winner.HOME;
        if (game.getWinningTeamId().equals(game.getAwayTeamId())) return Winner.AWAY;
        return Winner.NONE;
    }
}
