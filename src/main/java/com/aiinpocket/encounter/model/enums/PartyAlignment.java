package com.aiinpocket.encounter.model.enums;

/**
 * 大地圖隊伍陣營傾向。
 * FRIENDLY 隊伍轉換為友軍單位，其餘轉換為敵人。
 */
public enum PartyAlignment {
    HOSTILE,
    NEUTRAL,
    FRIENDLY
}
