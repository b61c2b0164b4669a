package com.aiinpocket.encounter.model;

import com.aiinpocket.encounter.model.enums.PartyAlignment;

/**
 * 大地圖隊伍類型定義（外部提供，唯讀）。
 *
 * @param id                 類型 ID
 * @param name               顯示名稱
 * @param alignment          陣營傾向，null 視為 HOSTILE
 * @param combatStrength     相對戰力（1-5），超出範圍時夾回
 * @param battleUnitTemplate 指定的戰鬥單位原型 ID，null 表示依玩家等級挑選
 */
public record PartyType(String id, String name, PartyAlignment alignment,
                        int combatStrength, String battleUnitTemplate) {

    public static final int MIN_STRENGTH = 1;
    public static final int MAX_STRENGTH = 5;

    public PartyType {
        if (alignment == null) {
            alignment = PartyAlignment.HOSTILE;
        }
        combatStrength = Math.max(MIN_STRENGTH, Math.min(MAX_STRENGTH, combatStrength));
    }

    public boolean hasBattleUnitTemplate() {
        return battleUnitTemplate != null && !battleUnitTemplate.isBlank();
    }
}
