package com.aiinpocket.encounter.registry;

import com.aiinpocket.encounter.exception.DuplicateRegistrationException;
import com.aiinpocket.encounter.exception.NotFoundException;
import com.aiinpocket.encounter.model.EnemyArchetype;
import com.aiinpocket.encounter.model.enums.CombatRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.aiinpocket.encounter.support.TestArchetypes.archetype;
import static com.aiinpocket.encounter.support.TestArchetypes.base;
import static com.aiinpocket.encounter.support.TestArchetypes.pack;
import static org.junit.jupiter.api.Assertions.*;

class EncounterRegistryTest {

    private EncounterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new EncounterRegistry();
        registry.registerArchetype(archetype("zombie", CombatRole.BRUTE, 1, 1, 3, "undead", "early_game"));
        registry.registerArchetype(archetype("acolyte", CombatRole.INVOKER, 2, 3, 6, "cultist", "caster"));
        registry.registerArchetype(archetype("lich", CombatRole.ELITE_INVOKER, 3, 5, null, "undead", "caster"));
    }

    @Test
    void lookup_by_id_returns_registered_archetype() {
        assertEquals("acolyte", registry.getArchetype("acolyte").getId());
        assertTrue(registry.findArchetype("lich").isPresent());
        assertTrue(registry.findArchetype("missing").isEmpty());
        assertTrue(registry.findArchetype(null).isEmpty());
    }

    @Test
    void unknown_id_raises_not_found() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> registry.getArchetype("dragon"));
        assertEquals("dragon", e.getId());
        assertThrows(NotFoundException.class, () -> registry.getPack("nothing"));
    }

    @Test
    void duplicate_archetype_id_is_rejected() {
        assertThrows(DuplicateRegistrationException.class,
                () -> registry.registerArchetype(archetype("zombie", CombatRole.BRUTE, 1, 1, 3, "undead")));
        assertEquals(3, registry.archetypeCount());
    }

    @Test
    void duplicate_pack_id_is_rejected() {
        registry.registerPack(pack("horde", 1, null, "zombie", "zombie"));
        assertThrows(DuplicateRegistrationException.class,
                () -> registry.registerPack(pack("horde", 1, null, "zombie")));
    }

    @Test
    void pack_with_unknown_member_is_rejected() {
        assertThrows(NotFoundException.class,
                () -> registry.registerPack(pack("ghosts", 1, null, "zombie", "ghost")));
        assertEquals(0, registry.packCount());
    }

    @Test
    void registered_archetype_is_isolated_from_caller_collections() {
        List<String> skills = new ArrayList<>(List.of("bite"));
        Set<String> tags = new LinkedHashSet<>(List.of("beast"));
        EnemyArchetype stored = registry.registerArchetype(
                base("wolf", CombatRole.SKIRMISHER, 1).skillIds(skills).tags(tags).build());

        skills.add("howl");
        tags.add("undead");

        EnemyArchetype wolf = registry.getArchetype("wolf");
        assertSame(stored, wolf);
        assertEquals(List.of("bite"), wolf.getSkillIds());
        assertEquals(Set.of("beast"), wolf.getTags());
        assertThrows(UnsupportedOperationException.class, () -> wolf.getTags().add("undead"));
        assertTrue(registry.findByTag("undead").stream().noneMatch(a -> a.getId().equals("wolf")));
    }

    @Test
    void pack_without_members_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.registerPack(pack("empty", 1, null)));
        assertEquals(0, registry.packCount());
    }

    @Test
    void invalid_archetypes_are_rejected() {
        EnemyArchetype inverted = base("bad_range", CombatRole.BRUTE, 1).spawnMinFloor(5).spawnMaxFloor(2).build();
        EnemyArchetype noDifficulty = base("bad_level", CombatRole.BRUTE, 1).difficultyLevel(0).build();
        EnemyArchetype noHp = base("bad_hp", CombatRole.BRUTE, 1).baseHp(0).build();

        assertThrows(IllegalArgumentException.class, () -> registry.registerArchetype(inverted));
        assertThrows(IllegalArgumentException.class, () -> registry.registerArchetype(noDifficulty));
        assertThrows(IllegalArgumentException.class, () -> registry.registerArchetype(noHp));
    }

    @Test
    void registration_after_seal_fails() {
        registry.seal();
        assertTrue(registry.isSealed());
        assertThrows(IllegalStateException.class,
                () -> registry.registerArchetype(archetype("wolf", CombatRole.SKIRMISHER, 1, 1, 3, "beast")));
    }

    @Test
    void filters_follow_registration_order() {
        assertEquals(List.of("zombie", "lich"), ids(registry.findByTag("undead")));
        assertEquals(List.of("acolyte"), ids(registry.findByRole(CombatRole.INVOKER)));
        assertEquals(List.of("lich"), ids(registry.findByTier(3)));
    }

    @Test
    void difficulty_range_is_inclusive() {
        // 難度 = 20 × tier
        assertEquals(List.of("zombie", "acolyte"), ids(registry.findByDifficultyRange(20, 40)));
        assertEquals(List.of("lich"), ids(registry.findByDifficultyRange(60, 60)));
    }

    @Test
    void floor_range_uses_overlap_and_open_upper_bound() {
        assertEquals(List.of("zombie", "acolyte"), ids(registry.findByFloorRange(2, 4)));
        assertEquals(List.of("lich"), ids(registry.findByFloorRange(100, 200)));
        assertEquals(List.of("acolyte", "lich"), ids(registry.findEligibleForFloor(5)));
        assertTrue(registry.findEligibleForFloor(0).isEmpty());
    }

    @Test
    void packs_are_filtered_by_tier_and_room_tag() {
        registry.registerPack(pack("graveyard_shift", 1, "graveyard", "zombie", "zombie"));
        registry.registerPack(pack("dark_rite", 2, "event", "acolyte", "acolyte"));

        assertEquals("dark_rite", registry.findPacksByTier(2).get(0).getId());
        assertEquals("graveyard_shift", registry.findPacksByRoomTag("graveyard").get(0).getId());
        assertTrue(registry.findPacksByRoomTag(null).isEmpty());
        assertEquals(List.of("dark_rite", "graveyard_shift"), registry.listPackIds());
    }

    @Test
    void id_listing_is_sorted_and_role_distribution_counts() {
        assertEquals(List.of("acolyte", "lich", "zombie"), registry.listArchetypeIds());
        assertEquals(1, registry.roleDistribution().get(CombatRole.BRUTE));
        assertNull(registry.roleDistribution().get(CombatRole.SUPPORT));
    }

    private static List<String> ids(List<EnemyArchetype> archetypes) {
        return archetypes.stream().map(EnemyArchetype::getId).toList();
    }
}
