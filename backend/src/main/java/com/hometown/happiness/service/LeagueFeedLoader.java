package com.hometown.happiness.service;

import com.hometown.happiness.dto.ParsedFeed;
import com.hometown.happiness.model.League;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads one league's raw results file into canonical games. New cities and teams, unresolved
 * tokens and per-row issues are collected in the supplied {@link ResolutionContext}.
 */
public interface LeagueFeedLoader {

    League league();

    List<String> requiredColumns();

    /**
     * @throws com.hometown.happiness.exception.MissingInputException if the feed (or a reference table it needs) is absent
     * @throws com.hometown.happiness.exception.SchemaException if the header lacks a required column
     */
    ParsedFeed load(Path feed, ResolutionContext ctx);
}
