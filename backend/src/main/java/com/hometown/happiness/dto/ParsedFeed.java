package com.hometown.happiness.dto;

import com.hometown.happiness.model.Game;

import java.util.List;

/** Games read from one raw feed, before merging. Rows that could not be turned into a game are only counted. */
public record ParsedFeed(List<Game> games, int rowsTotal, int rowsSkipped) {

    public ParsedFeed {
        games = List.copyOf(games);
    }

    public int rowsAccepted() {
        return rowsTotal - rowsSkipped;
    }
}
