package com.hometown.happiness.dto;

/** A "City Nickname" display name split into its two parts. Nickname is empty when nothing could be split off. */
public record CityTeamSplit(String city, String nickname) {
}
