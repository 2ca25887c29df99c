package com.prediction.market.settlement_engine.entity;

public enum BetSide {
    UP,
    DOWN
}
