package com.aiinpocket.encounter.model;

import com.aiinpocket.encounter.model.enums.CombatRole;
import lombok.*;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 敵人原型定義（全域資料，啟動時註冊一次後不可變）。
 * 每個原型有基礎數值與每層成長率，
 * 出現樓層區間與權重決定在哪些樓層、以多高機率被選中。
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@ToString(of = {"id", "name", "role", "difficultyLevel"})
public class EnemyArchetype {

    /** 穩定的內部 ID（查詢用） */
    @NonNull
    private final String id;

    /** 顯示名稱（如「Goblin Skirmisher」） */
    @NonNull
    private final String name;

    @NonNull
    private final CombatRole role;

    /** 舊版難度分段（1=前期, 2=中期, 3=後期），僅作顯示與最終退路使用 */
    private final int tier;

    /** AI 行為提示（如 "skirmisher"、"caster"） */
    private final String aiProfile;

    private final int baseHp;
    private final double hpPerFloor;
    private final int baseAttack;
    private final double atkPerFloor;
    private final int baseDefense;
    private final double defPerFloor;
    private final int baseXp;
    private final double xpPerFloor;

    /** 先攻值，越高越早行動 */
    @Builder.Default
    private final int baseInitiative = 10;

    @Builder.Default
    private final double initPerFloor = 0.0;

    @Builder.Default
    private final List<String> skillIds = List.of();

    /** 難度等級（1-100+），取代 tier 作為主要難度依據 */
    private final int difficultyLevel;

    /** 最早出現樓層 */
    private final int spawnMinFloor;

    /** 最晚出現樓層，null 表示無上限 */
    private final Integer spawnMaxFloor;

    /** 在可出現樓層內的相對權重 */
    @Builder.Default
    private final double spawnWeight = 1.0;

    @Builder.Default
    private final Set<String> tags = Set.of();

    /** 傷害類型抗性倍率（0.0=免疫, 0.5=半傷, 1.5=弱點） */
    @Builder.Default
    private final Map<String, Double> resistances = Map.of();

    /** 特殊機制標籤（如 "regeneration"、"death_explosion"） */
    @Builder.Default
    private final List<String> uniqueMechanics = List.of();

    /** 此原型是否可出現在指定樓層 */
    public boolean spawnsOnFloor(int floor) {
        return spawnMinFloor <= floor && (spawnMaxFloor == null || spawnMaxFloor >= floor);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public boolean hasAnyTag(Collection<String> candidates) {
        for (String tag : candidates) {
            if (tags.contains(tag)) return true;
        }
        return false;
    }
}
