package com.aiinpocket.encounter.service;

import com.aiinpocket.encounter.config.EncounterProperties;
import com.aiinpocket.encounter.model.SpawnedUnit;
import com.aiinpocket.encounter.model.dto.EliteStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Random;

/**
 * 菁英敵人變體。
 * 負責：
 * 1. 依樓層分段判定是否生成菁英
 * 2. 套用菁英數值倍率
 * 3. 就地把生成單位改造成菁英（名稱前綴、補滿血、顏色加亮）
 */
@Service
@Slf4j
public class EliteVariantService {

    public static final String ELITE_PREFIX = "Elite ";

    // 菁英數值倍率
    static final double HP_MULTIPLIER = 1.5;
    static final double ATTACK_MULTIPLIER = 1.25;
    static final double DEFENSE_MULTIPLIER = 1.2;
    static final double XP_MULTIPLIER = 2.0;

    // 顏色各通道加亮倍率
    private static final double RED_TINT = 1.2;
    private static final double GREEN_TINT = 1.15;
    private static final double BLUE_TINT = 1.10;

    private final Random random;
    private final double baseChance;

    public EliteVariantService(Random random, EncounterProperties properties) {
        this.random = random;
        this.baseChance = properties.elite().baseChance();
    }

    public boolean isEliteSpawn(int floor) {
        return isEliteSpawn(floor, baseChance);
    }

    /**
     * 菁英判定，機率依樓層分段（非連續）：
     * 1-2 層 = 基礎機率，3-4 層 +5%，5 層以上 +10%。
     */
    public boolean isEliteSpawn(int floor, double baseChance) {
        return random.nextDouble() < eliteChanceForFloor(floor, baseChance);
    }

    /** 以設定的基礎機率計算指定樓層的菁英機率 */
    public double eliteChanceForFloor(int floor) {
        return eliteChanceForFloor(floor, baseChance);
    }

    static double eliteChanceForFloor(int floor, double baseChance) {
        if (floor <= 2) return baseChance;
        if (floor <= 4) return baseChance + 0.05;
        return baseChance + 0.10;
    }

    /**
     * 各數值先乘倍率再各自截斷。
     */
    public static EliteStats applyEliteModifiers(int hp, int attack, int defense, int xp) {
        return new EliteStats(
                (int) (hp * HP_MULTIPLIER),
                (int) (attack * ATTACK_MULTIPLIER),
                (int) (defense * DEFENSE_MULTIPLIER),
                (int) (xp * XP_MULTIPLIER));
    }

    /**
     * 就地將單位改造為菁英：重算數值、補滿血量、加名稱前綴（只加一次）、顏色加亮。
     */
    public void makeEnemyElite(SpawnedUnit unit) {
        unit.setElite(true);

        EliteStats stats = applyEliteModifiers(unit.getMaxHp(), unit.getAttack(), unit.getDefense(), unit.getXp());
        unit.setMaxHp(stats.hp());
        unit.setHp(stats.hp());
        unit.setAttack(stats.attack());
        unit.setDefense(stats.defense());
        unit.setXp(stats.xp());

        String name = unit.getName() != null ? unit.getName() : "Enemy";
        if (!name.startsWith(ELITE_PREFIX)) {
            unit.setOriginalName(name);
            unit.setName(ELITE_PREFIX + name);
        }

        unit.setColor(unit.getColor().scale(RED_TINT, GREEN_TINT, BLUE_TINT));

        log.debug("[菁英] {} → HP {} / ATK {} / DEF {} / XP {}",
                unit.getName(), stats.hp(), stats.attack(), stats.defense(), stats.xp());
    }
}
