package com.propplatform.common.model;

/**
 * Market expectations for the game.
 *
 * @param total  projected combined points
 * @param spread point spread from the entity's team perspective
 *               (negative = team is favoured)
 */
public record GameLine(double total, double spread) {

    public boolean teamFavoured() {
        return spread < 0.0;
    }
}
