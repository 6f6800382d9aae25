package com.hometown.happiness.dto;

import com.hometown.happiness.model.League;

import java.time.LocalDate;

public record TeamRollupRow(League league, String teamId, LocalDate periodStart,
                            long indexScoreSum, long weightedScoreSum, long games) {
}
