package com.aiinpocket.encounter.service;

import com.aiinpocket.encounter.config.EncounterProperties;
import com.aiinpocket.encounter.model.EnemyArchetype;
import com.aiinpocket.encounter.model.PartyType;
import com.aiinpocket.encounter.model.PlayerPartySnapshot;
import com.aiinpocket.encounter.model.RgbColor;
import com.aiinpocket.encounter.model.RoamingParty;
import com.aiinpocket.encounter.model.SpawnedUnit;
import com.aiinpocket.encounter.model.enums.PartyAlignment;
import com.aiinpocket.encounter.registry.EncounterRegistry;
import com.aiinpocket.encounter.service.support.FallbackChain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * 大地圖隊伍 → 戰鬥單位轉換服務。
 * 敵方隊伍的人數依玩家隊伍大小動態調整（每多一位成員約多 1~2 名敵人），
 * 友方隊伍固定轉換為 1~2 名友軍。
 * 任何單一原型缺漏都不能讓戰鬥無法開始：選擇失敗時依序退回舊版對照表與任意原型。
 */
@Service
@Slf4j
public class PartyBattleConversionService {

    static final int MIN_ENEMIES = 1;
    static final int MAX_ENEMIES = 8;
    // 基礎敵人數上限 = 3 + (戰力 - 1)
    private static final int BASE_ENEMIES_MAX = 3;
    private static final double SCALING_MIN = 1.0;
    private static final double SCALING_MAX = 2.0;
    private static final double SCALING_VARIATION = 0.3;

    private static final double SWARM_MULTIPLIER = 1.5;
    private static final double ELITE_MULTIPLIER = 0.75;

    // 多名敵人時每人 XP 遞減，讓整場總 XP 大致不變
    private static final double XP_SPLIT_FACTOR = 0.3;

    /** 陣營關係門檻（低於 -50 敵對，高於 50 友好） */
    private static final int HOSTILE_RELATION = -50;
    private static final int FRIENDLY_RELATION = 50;

    /** 舊版戰力 → 原型對照表（選擇引擎失敗時使用） */
    private static final Map<Integer, String> STRENGTH_ARCHETYPES = Map.of(
            1, "goblin_skirmisher",
            2, "bandit_cutthroat",
            3, "orc_raider",
            4, "dread_knight",
            5, "dragonkin"
    );
    private static final String DEFAULT_STRENGTH_ARCHETYPE = "bandit_cutthroat";
    private static final String LAST_RESORT_ARCHETYPE = "goblin_skirmisher";

    // 友軍係數：戰力 1 → 下限，戰力 5 → 上限
    private static final double[] ALLY_HP_FACTOR = {0.7, 1.2};
    private static final double[] ALLY_ATTACK_FACTOR = {0.6, 1.1};
    private static final double[] ALLY_DEFENSE_FACTOR = {0.8, 1.3};
    private static final int MAX_ALLIES = 2;
    private static final String ALLY_SKILL = "guard";

    private final EncounterRegistry registry;
    private final EncounterSelectionService selectionService;
    private final Random random;
    private final Set<String> swarmTypes;
    private final Set<String> eliteTypes;

    public PartyBattleConversionService(EncounterRegistry registry,
                                        EncounterSelectionService selectionService,
                                        Random random,
                                        EncounterProperties properties) {
        this.registry = registry;
        this.selectionService = selectionService;
        this.random = random;
        this.swarmTypes = Set.copyOf(properties.party().swarmTypes());
        this.eliteTypes = Set.copyOf(properties.party().eliteTypes());
    }

    /**
     * 依隊伍陣營轉換：友方 → 友軍單位，其餘 → 敵人。
     */
    public List<SpawnedUnit> convertPartyToBattleUnits(RoamingParty party, PartyType partyType,
                                                       PlayerPartySnapshot snapshot) {
        if (partyType.alignment() == PartyAlignment.FRIENDLY) {
            return alliedPartyToBattleUnits(party, partyType, snapshot);
        }
        return partyToBattleEnemies(party, partyType, snapshot);
    }

    /**
     * 考慮陣營關係後的實際傾向。
     *
     * @param factionRelation 玩家陣營與隊伍陣營的關係值（-100~100），null 表示無陣營資料
     */
    public static PartyAlignment effectiveAlignment(PartyType partyType, Integer factionRelation) {
        PartyAlignment declared = partyType.alignment();
        if (declared == PartyAlignment.HOSTILE || factionRelation == null) {
            return declared;
        }
        if (factionRelation < HOSTILE_RELATION) {
            return PartyAlignment.HOSTILE;
        }
        if (factionRelation > FRIENDLY_RELATION) {
            return PartyAlignment.FRIENDLY;
        }
        return PartyAlignment.NEUTRAL;
    }

    // ===== 敵方 =====

    /**
     * 將敵方隊伍轉為敵人清單。
     * 數值以玩家等級當作樓層計算；每位敵人的 XP 依總人數遞減。
     */
    public List<SpawnedUnit> partyToBattleEnemies(RoamingParty party, PartyType partyType,
                                                  PlayerPartySnapshot snapshot) {
        int count = calculateEnemyCount(snapshot.partySize(), partyType.combatStrength(), partyType.id());
        EnemyArchetype archetype = resolveArchetype(partyType, snapshot.playerLevel());
        int floor = Math.max(1, snapshot.playerLevel());

        List<SpawnedUnit> enemies = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            SpawnedUnit enemy = StatScalingService.spawnUnit(archetype, floor);
            enemy.setXp(splitXp(enemy.getXp(), count));
            enemy.setName(enemyName(party, i));
            enemy.setPartyId(party.partyId());
            enemy.setPartyName(party.partyName());
            enemy.setPartyTypeId(party.partyTypeId());
            enemies.add(enemy);
        }

        log.info("[隊伍轉換] 隊伍 {}（{}）→ {} 名「{}」(Lv.{})，玩家隊伍 {} 人",
                party.partyId(), partyType.id(), count, archetype.getName(), floor, snapshot.partySize());
        return enemies;
    }

    /**
     * 計算敵人數量。
     * 1. 基礎 = randint(1, 3 + (戰力 - 1))
     * 2. 玩家隊伍每超過 2 人一位，追加 U(1.0, 2.0) + U(-0.3, 0.3) 名（截斷，不為負）
     * 3. 夾在 [1, 8]，再套用群聚型 ×1.5 / 精銳型 ×0.75，最後再夾一次
     */
    public int calculateEnemyCount(int playerPartySize, int combatStrength, String partyTypeId) {
        int effectiveSize = Math.max(PlayerPartySnapshot.MIN_PARTY_SIZE, playerPartySize);
        int strength = Math.max(PartyType.MIN_STRENGTH, Math.min(PartyType.MAX_STRENGTH, combatStrength));

        int baseMax = BASE_ENEMIES_MAX + (strength - 1);
        int baseCount = MIN_ENEMIES + random.nextInt(baseMax);

        int additionalMembers = effectiveSize - PlayerPartySnapshot.MIN_PARTY_SIZE;
        int additionalEnemies = 0;
        if (additionalMembers > 0) {
            double scalingPerMember = SCALING_MIN + random.nextDouble() * (SCALING_MAX - SCALING_MIN);
            double variation = -SCALING_VARIATION + random.nextDouble() * (2 * SCALING_VARIATION);
            additionalEnemies = Math.max(0, (int) (additionalMembers * (scalingPerMember + variation)));
        }

        int total = clampEnemyCount(baseCount + additionalEnemies);
        total = clampEnemyCount(applyPartyTypeScaling(total, partyTypeId));
        return total;
    }

    /**
     * 隊伍類型特殊規則：群聚型（哥布林、狼群）人多，精銳型（騎士、首領）人少。
     */
    int applyPartyTypeScaling(int count, String partyTypeId) {
        if (swarmTypes.contains(partyTypeId)) {
            return (int) (count * SWARM_MULTIPLIER);
        }
        if (eliteTypes.contains(partyTypeId)) {
            return Math.max(1, (int) (count * ELITE_MULTIPLIER));
        }
        return count;
    }

    private static int clampEnemyCount(int count) {
        return Math.max(MIN_ENEMIES, Math.min(MAX_ENEMIES, count));
    }

    /** 多名敵人時每人 XP = xp / (1 + (n-1) × 0.3)，至少 1 */
    static int splitXp(int xp, int totalEnemies) {
        if (totalEnemies <= 1) {
            return xp;
        }
        return Math.max(1, (int) (xp / (1.0 + (totalEnemies - 1) * XP_SPLIT_FACTOR)));
    }

    private static String enemyName(RoamingParty party, int index) {
        String base;
        if (party.partyName() != null && !party.partyName().isBlank()) {
            base = party.partyName().trim().split("\\s+")[0];
        } else {
            base = titleCase(party.partyTypeId());
        }
        return base + " " + (index + 1);
    }

    private static String titleCase(String id) {
        if (id == null || id.isEmpty()) {
            return "Enemy";
        }
        StringBuilder sb = new StringBuilder(id.length());
        boolean upperNext = true;
        for (char c : id.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(upperNext ? Character.toUpperCase(c) : Character.toLowerCase(c));
                upperNext = false;
            } else {
                sb.append(c);
                upperNext = true;
            }
        }
        return sb.toString();
    }

    /**
     * 決定敵人原型：指定模板 → 依玩家等級選擇 → 舊版戰力對照表 → 任意已註冊原型。
     *
     * @throws IllegalStateException 目錄中完全沒有原型
     */
    EnemyArchetype resolveArchetype(PartyType partyType, int playerLevel) {
        return FallbackChain.<EnemyArchetype>firstPresent(List.of(
                () -> fromTemplate(partyType),
                () -> fromLevelSelection(playerLevel),
                () -> fromStrengthTable(partyType.combatStrength()),
                () -> registry.getArchetypes().stream().findFirst()
        )).orElseThrow(() -> new IllegalStateException(
                "隊伍類型 " + partyType.id() + " 找不到任何可用的敵人原型"));
    }

    private Optional<EnemyArchetype> fromTemplate(PartyType partyType) {
        if (!partyType.hasBattleUnitTemplate()) {
            return Optional.empty();
        }
        Optional<EnemyArchetype> template = registry.findArchetype(partyType.battleUnitTemplate());
        if (template.isEmpty()) {
            log.warn("[隊伍轉換] 隊伍類型 {} 的戰鬥模板 {} 不存在，改用等級選擇",
                    partyType.id(), partyType.battleUnitTemplate());
        }
        return template;
    }

    private Optional<EnemyArchetype> fromLevelSelection(int playerLevel) {
        try {
            return Optional.of(selectionService.chooseArchetypeForPlayerLevel(playerLevel, null, null));
        } catch (RuntimeException e) {
            log.warn("[隊伍轉換] 依等級選擇原型失敗 (Lv.{}): {}，改用戰力對照表", playerLevel, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<EnemyArchetype> fromStrengthTable(int strength) {
        String archetypeId = STRENGTH_ARCHETYPES.getOrDefault(strength, DEFAULT_STRENGTH_ARCHETYPE);
        Optional<EnemyArchetype> archetype = registry.findArchetype(archetypeId)
                .or(() -> registry.findArchetype(LAST_RESORT_ARCHETYPE));
        if (archetype.isEmpty()) {
            log.warn("[隊伍轉換] 戰力對照表原型 {} 不存在，改用任意原型", archetypeId);
        }
        return archetype;
    }

    // ===== 友方 =====

    /**
     * 將友方隊伍轉為友軍：人數 = min(2, max(1, 戰力))，
     * 數值以主角為基準，係數隨戰力線性提高（生命 0.7~1.2、攻擊 0.6~1.1、防禦 0.8~1.3）。
     */
    public List<SpawnedUnit> alliedPartyToBattleUnits(RoamingParty party, PartyType partyType,
                                                      PlayerPartySnapshot snapshot) {
        int strength = partyType.combatStrength();
        int count = Math.min(MAX_ALLIES, Math.max(1, strength));

        double hpFactor = allyFactor(ALLY_HP_FACTOR, strength);
        double attackFactor = allyFactor(ALLY_ATTACK_FACTOR, strength);
        double defenseFactor = allyFactor(ALLY_DEFENSE_FACTOR, strength);

        int maxHp = Math.max(1, (int) (snapshot.heroMaxHp() * hpFactor));
        int attack = Math.max(1, (int) (snapshot.heroAttack() * attackFactor));
        int defense = Math.max(0, (int) (snapshot.heroDefense() * defenseFactor));

        List<SpawnedUnit> allies = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            SpawnedUnit ally = SpawnedUnit.builder()
                    .name(partyType.name() + " Ally " + (i + 1))
                    .originalName(partyType.name())
                    .level(Math.max(1, snapshot.playerLevel()))
                    .maxHp(maxHp)
                    .hp(maxHp)
                    .attack(attack)
                    .defense(defense)
                    .skillPower(snapshot.heroSkillPower())
                    .skillIds(new ArrayList<>(List.of(ALLY_SKILL)))
                    .ally(true)
                    .color(RgbColor.ALLY_DEFAULT)
                    .partyId(party.partyId())
                    .partyName(party.partyName())
                    .partyTypeId(party.partyTypeId())
                    .build();
            allies.add(ally);
        }

        log.info("[隊伍轉換] 友方隊伍 {}（{}）→ {} 名友軍 (HP {} / ATK {} / DEF {})",
                party.partyId(), partyType.id(), count, maxHp, attack, defense);
        return allies;
    }

    /** 戰力 1..5 線性對應到 [下限, 上限] */
    static double allyFactor(double[] range, int strength) {
        double t = (double) (strength - PartyType.MIN_STRENGTH) / (PartyType.MAX_STRENGTH - PartyType.MIN_STRENGTH);
        return range[0] + (range[1] - range[0]) * t;
    }
}
