package com.aiinpocket.encounter.support;

import com.aiinpocket.encounter.model.EnemyArchetype;
import com.aiinpocket.encounter.model.EnemyPackTemplate;
import com.aiinpocket.encounter.model.enums.CombatRole;

import java.util.List;
import java.util.Set;

/**
 * 測試用原型與組合。
 */
public final class TestArchetypes {

    private TestArchetypes() {}

    public static EnemyArchetype.EnemyArchetypeBuilder base(String id, CombatRole role, int tier) {
        return EnemyArchetype.builder()
                .id(id)
                .name(id)
                .role(role)
                .tier(tier)
                .aiProfile(role.tag())
                .baseHp(10)
                .hpPerFloor(1.0)
                .baseAttack(4)
                .atkPerFloor(0.5)
                .baseDefense(1)
                .defPerFloor(0.2)
                .baseXp(6)
                .xpPerFloor(1.0)
                .difficultyLevel(20 * tier)
                .spawnMinFloor(1)
                .spawnMaxFloor(null);
    }

    public static EnemyArchetype archetype(String id, CombatRole role, int tier,
                                           int minFloor, Integer maxFloor, String... tags) {
        return base(id, role, tier)
                .spawnMinFloor(minFloor)
                .spawnMaxFloor(maxFloor)
                .tags(Set.of(tags))
                .build();
    }

    /** 與內容檔中 goblin_skirmisher 相同的成長值 */
    public static EnemyArchetype goblinSkirmisher() {
        return EnemyArchetype.builder()
                .id("goblin_skirmisher")
                .name("Goblin Skirmisher")
                .role(CombatRole.SKIRMISHER)
                .tier(1)
                .aiProfile("skirmisher")
                .baseHp(10).hpPerFloor(1.0)
                .baseAttack(4).atkPerFloor(0.7)
                .baseDefense(0).defPerFloor(0.2)
                .baseXp(6).xpPerFloor(1.0)
                .skillIds(List.of("poison_strike", "nimble_step"))
                .difficultyLevel(15)
                .spawnMinFloor(1)
                .spawnMaxFloor(4)
                .spawnWeight(1.5)
                .tags(Set.of("early_game", "goblin", "skirmisher", "common"))
                .build();
    }

    public static EnemyPackTemplate pack(String id, int tier, String preferredRoomTag, String... members) {
        return EnemyPackTemplate.builder()
                .id(id)
                .name(id)
                .tier(tier)
                .memberArchIds(List.of(members))
                .preferredRoomTag(preferredRoomTag)
                .build();
    }
}
