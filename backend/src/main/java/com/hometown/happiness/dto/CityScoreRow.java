package com.hometown.happiness.dto;

import java.time.LocalDate;

public record CityScoreRow(LocalDate date, String cityId, String cityName, long score,
                           int wins, int losses, int playoffWins, int playoffLosses) {
}
