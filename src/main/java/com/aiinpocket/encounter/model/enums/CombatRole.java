package com.aiinpocket.encounter.model.enums;

/**
 * 敵人戰鬥定位。
 * 影響房間標籤的權重加成（巢穴偏好重擊型、事件房偏好施法/輔助型）。
 */
public enum CombatRole {
    SKIRMISHER,
    BRUTE,
    ELITE_BRUTE,
    INVOKER,
    ELITE_INVOKER,
    SUPPORT,
    ELITE_SUPPORT;

    /** 重擊系（含菁英重擊） */
    public boolean isBruteFamily() {
        return this == BRUTE || this == ELITE_BRUTE;
    }

    /** 事件房加權對象：僅一般施法者與輔助者，菁英版不算 */
    public boolean isEventRoomFavored() {
        return this == INVOKER || this == SUPPORT;
    }

    /** 定位標籤（如 ELITE_BRUTE → "elite_brute"），用於未設定標籤時的自動補齊 */
    public String tag() {
        return name().toLowerCase();
    }
}
