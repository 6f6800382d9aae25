package com.hometown.happiness.dto;

import java.time.LocalDate;

/** A city's calendar day, present even when no game was played; *7d columns cover the trailing seven days. */
public record CityDailyRollingRow(LocalDate date, String cityId,
                                  long indexSum, long weightedSum, long games,
                                  long indexSum7d, long weightedSum7d, long games7d) {
}
