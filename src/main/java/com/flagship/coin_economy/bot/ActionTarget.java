package com.flagship.coin_economy.bot;

import lombok.Value;

/**
 * The content or user a bot action was aimed at.
 */
@Value
public class ActionTarget {
    TargetType type;
    String id;

    public static ActionTarget of(TargetType type, String id) {
        if (type == null || id == null || id.isBlank()) {
            throw new IllegalArgumentException("Action target requires a type and an id");
        }
        return new ActionTarget(type, id);
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
