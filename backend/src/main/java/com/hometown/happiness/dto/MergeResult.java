package com.hometown.happiness.dto;

public record MergeResult(int citiesAdded, int teamsAdded, int gamesAdded, int gamesDuplicate) {

    public static final MergeResult EMPTY = new MergeResult(0, 0, 0, 0);
}
