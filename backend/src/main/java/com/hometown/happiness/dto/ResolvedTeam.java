package com.hometown.happiness.dto;

/**
 * Outcome of resolving one raw team token. {@code PLACEHOLDER} means no mapping was found and the
 * raw token stands in for the city; the game is still kept.
 */
public record ResolvedTeam(String teamId, String cityId, String cityName, Status status) {

    public enum Status { RESOLVED, PLACEHOLDER }

    public boolean isPlaceholder() {
        return status == Status.PLACEHOLDER;
    }
}
