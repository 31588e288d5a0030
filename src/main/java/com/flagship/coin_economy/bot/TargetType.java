package com.flagship.coin_economy.bot;

public enum TargetType {
    THREAD,
    REPLY,
    USER,
    LISTING
}
