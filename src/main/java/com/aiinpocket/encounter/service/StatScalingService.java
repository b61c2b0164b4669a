package com.aiinpocket.encounter.service;

import com.aiinpocket.encounter.model.EnemyArchetype;
import com.aiinpocket.encounter.model.SpawnedUnit;
import com.aiinpocket.encounter.model.dto.DifficultyRange;
import com.aiinpocket.encounter.model.dto.ScaledStats;
import com.aiinpocket.encounter.registry.EncounterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;

/**
 * 依樓層計算原型的實際數值。
 * 每項數值 = 基礎值 + 每層成長 × (樓層 - 1)，一律截斷（非四捨五入）。
 */
@Service
@RequiredArgsConstructor
public class StatScalingService {

    /** 敵人先攻每層成長上限（主角每 2 級 +1，敵人不可超過） */
    static final double MAX_INITIATIVE_PER_FLOOR = 0.5;

    private static final int DEFAULT_DIFFICULTY_SPREAD = 15;

    private final EncounterRegistry registry;

    public ScaledStats computeScaledStats(String archetypeId, int floor) {
        return computeScaledStats(registry.getArchetype(archetypeId), floor);
    }

    /**
     * 計算指定樓層的 (hp, attack, defense, xp, initiative)。
     * 樓層小於 1 時以 1 計。
     */
    public static ScaledStats computeScaledStats(EnemyArchetype archetype, int floor) {
        int level = Math.max(1, floor);
        int steps = level - 1;

        int hp = (int) (archetype.getBaseHp() + archetype.getHpPerFloor() * steps);
        int attack = (int) (archetype.getBaseAttack() + archetype.getAtkPerFloor() * steps);
        int defense = (int) (archetype.getBaseDefense() + archetype.getDefPerFloor() * steps);
        int xp = (int) (archetype.getBaseXp() + archetype.getXpPerFloor() * steps);

        double rawInitiative = archetype.getBaseInitiative() + archetype.getInitPerFloor() * steps;
        double maxInitiative = archetype.getBaseInitiative() + steps * MAX_INITIATIVE_PER_FLOOR;
        int initiative = (int) Math.min(rawInitiative, maxInitiative);

        return new ScaledStats(hp, attack, defense, xp, initiative);
    }

    /**
     * 以原型在指定樓層的數值建立一個滿血的生成單位。
     */
    public static SpawnedUnit spawnUnit(EnemyArchetype archetype, int floor) {
        ScaledStats stats = computeScaledStats(archetype, floor);
        return SpawnedUnit.builder()
                .archetypeId(archetype.getId())
                .name(archetype.getName())
                .originalName(archetype.getName())
                .role(archetype.getRole())
                .aiProfile(archetype.getAiProfile())
                .level(Math.max(1, floor))
                .maxHp(stats.hp())
                .hp(stats.hp())
                .attack(stats.attack())
                .defense(stats.defense())
                .xp(stats.xp())
                .initiative(stats.initiative())
                .skillIds(new ArrayList<>(archetype.getSkillIds()))
                .tags(new LinkedHashSet<>(archetype.getTags()))
                .resistances(new HashMap<>(archetype.getResistances()))
                .uniqueMechanics(new ArrayList<>(archetype.getUniqueMechanics()))
                .build();
    }

    /**
     * 樓層對應的難度等級區間。
     * 線性換算：第 1 層 ≈ 10，第 10 層 ≈ 91，上下各延伸 spread，夾在 [1, 100]。
     */
    public static DifficultyRange floorToDifficultyRange(int floor, int spread) {
        // 以 long 計算，極高樓層不會溢位
        long base = 10L + (floor - 1L) * 9L;
        return new DifficultyRange(
                (int) Math.min(100, Math.max(1, base - spread)),
                (int) Math.min(100, base + spread));
    }

    public static DifficultyRange floorToDifficultyRange(int floor) {
        return floorToDifficultyRange(floor, DEFAULT_DIFFICULTY_SPREAD);
    }
}
