package com.aiinpocket.encounter.model.dto;

import com.aiinpocket.encounter.model.SpawnedUnit;

import java.util.List;

public record RoomEncounter(
        int floor,
        String roomTag,
        String packId,
        List<SpawnedUnit> units,
        PackSynergy synergy,
        boolean unique
) {}
