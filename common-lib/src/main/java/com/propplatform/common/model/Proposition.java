package com.propplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single candidate wager: one entity, one statistical line, one side.
 *
 * <p>Immutable for the duration of a scoring run. Two propositions with the same
 * {@code id} describe the same line; their sides may differ.
 */
public record Proposition(
    @JsonProperty("id")       String id,
    @JsonProperty("entity")   String entity,
    @JsonProperty("team")     String team,
    @JsonProperty("opponent") String opponent,
    @JsonProperty("position") Position position,
    @JsonProperty("category") StatCategory category,
    @JsonProperty("line")     double line,
    @JsonProperty("side")     Side side,
    @JsonProperty("home")     boolean home
) {
    public static Proposition over(String id, String entity, String team, String opponent,
                                   Position position, StatCategory category, double line) {
        return new Proposition(id, entity, team, opponent, position, category, line, Side.OVER, true);
    }

    /** Same line, opposite side. */
    public Proposition withSide(Side newSide) {
        return new Proposition(id, entity, team, opponent, position, category, line, newSide, home);
    }

    /**
     * Key of the game context shared by both teams, independent of which team
     * the entity plays for.
     */
    public String contextKey() {
        return team.compareTo(opponent) <= 0
            ? team + "@" + opponent
            : opponent + "@" + team;
    }

    /** Identity of one side of one line, used to keep a leg out of more than one bundle. */
    public String legKey() {
        return id + ":" + side.name();
    }
}
