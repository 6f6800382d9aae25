package com.hometown.happiness.dto;

import java.time.LocalDate;

public record SelectedTeamsMonthlyRow(LocalDate monthEnd, LocalDate month, long totalIndexScore, long games) {
}
