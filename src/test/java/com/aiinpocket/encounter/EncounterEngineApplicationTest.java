package com.aiinpocket.encounter;

import com.aiinpocket.encounter.model.PartyType;
import com.aiinpocket.encounter.model.PlayerPartySnapshot;
import com.aiinpocket.encounter.model.RoamingParty;
import com.aiinpocket.encounter.model.SpawnedUnit;
import com.aiinpocket.encounter.model.dto.RoomEncounter;
import com.aiinpocket.encounter.model.enums.CombatRole;
import com.aiinpocket.encounter.model.enums.PartyAlignment;
import com.aiinpocket.encounter.registry.EncounterRegistry;
import com.aiinpocket.encounter.service.FloorEncounterService;
import com.aiinpocket.encounter.service.PartyBattleConversionService;
import com.aiinpocket.encounter.support.TestArchetypes;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "encounter.random.seed=42")
class EncounterEngineApplicationTest {

    @Autowired
    private EncounterRegistry registry;

    @Autowired
    private FloorEncounterService floorEncounterService;

    @Autowired
    private PartyBattleConversionService conversionService;

    @Test
    void startup_loads_and_seals_bundled_content() {
        assertTrue(registry.isSealed());
        assertEquals(88, registry.archetypeCount());
        assertEquals(73, registry.packCount());
        assertThrows(IllegalStateException.class,
                () -> registry.registerArchetype(TestArchetypes.archetype("late", CombatRole.BRUTE, 1, 1, 2, "x")));
    }

    @Test
    void every_floor_produces_a_room_encounter() {
        for (int floor = 1; floor <= 30; floor++) {
            RoomEncounter encounter = floorEncounterService.spawnRoomEncounter(floor, "lair", new HashSet<>());
            assertFalse(encounter.units().isEmpty(), "floor " + floor);
        }
    }

    @Test
    void roaming_party_converts_with_bundled_content() {
        PartyType orcs = new PartyType("orc", "Orc Warband", PartyAlignment.HOSTILE, 3, null);
        List<SpawnedUnit> enemies = conversionService.convertPartyToBattleUnits(
                new RoamingParty("p-9", "orc", "Orc Warband"), orcs, PlayerPartySnapshot.of(5, 2));

        assertTrue(enemies.size() >= 1 && enemies.size() <= 8);
        assertEquals("Orc 1", enemies.get(0).getName());
    }
}
