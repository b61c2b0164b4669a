package com.aiinpocket.encounter.model.dto;

public record ScaledStats(
        int hp,
        int attack,
        int defense,
        int xp,
        int initiative
) {}
