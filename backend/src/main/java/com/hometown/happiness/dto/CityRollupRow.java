package com.hometown.happiness.dto;

import java.time.LocalDate;

public record CityRollupRow(String cityId, LocalDate periodStart,
                            long indexScoreSum, long weightedScoreSum, long games) {
}
