package com.hometown.happiness.dto;

/** One row of an external code -> team/city reference table. */
public record TeamReference(String code, String cityName, String state, String teamName, String altName) {
}
