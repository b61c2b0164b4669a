package com.aiinpocket.encounter.model;

import com.aiinpocket.encounter.model.enums.CombatRole;
import lombok.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一場遭遇中實際生成的戰鬥單位。
 * 由呼叫端（戰鬥準備流程）獨佔持有，戰鬥結束即丟棄。
 * 菁英化與隊伍加成會直接修改此物件。
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(of = {"name", "archetypeId", "hp", "maxHp", "attack", "defense", "elite"})
public class SpawnedUnit {

    /** 來源原型 ID，友軍後備單位為 null */
    private String archetypeId;

    /** 顯示名稱（菁英會加上 "Elite " 前綴） */
    private String name;

    /** 菁英化前的名稱 */
    private String originalName;

    private CombatRole role;

    private String aiProfile;

    /** 單位等級（樓層或玩家等級） */
    @Builder.Default
    private int level = 1;

    @Builder.Default
    private int maxHp = 1;

    @Builder.Default
    private int hp = 1;

    private int attack;

    private int defense;

    private int xp;

    @Builder.Default
    private int initiative = 10;

    /** 技能威力倍率，隊伍加成以浮點數累乘 */
    @Builder.Default
    private double skillPower = 1.0;

    @Builder.Default
    private List<String> skillIds = new ArrayList<>();

    private boolean elite;

    /** 房間專屬的獨特敵人 */
    private boolean unique;

    /** 友軍單位（站在玩家這一側） */
    private boolean ally;

    @Builder.Default
    private RgbColor color = RgbColor.ENEMY_DEFAULT;

    /** 繼承自原型的標籤，隊伍加成依此計數 */
    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    @Builder.Default
    private Map<String, Double> resistances = new HashMap<>();

    @Builder.Default
    private List<String> uniqueMechanics = new ArrayList<>();

    /** 所屬大地圖隊伍（戰後更新用），樓層生成的單位為 null */
    private String partyId;

    private String partyName;

    private String partyTypeId;

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
