package com.aiinpocket.encounter.model.dto;

public record EliteStats(
        int hp,
        int attack,
        int defense,
        int xp
) {}
