package com.aiinpocket.encounter.model;

/**
 * 大地圖上遊蕩的隊伍（外部提供，唯讀）。
 *
 * @param partyId     穩定的隊伍 ID
 * @param partyTypeId 隊伍類型 ID（如 "goblin"、"bandit"）
 * @param partyName   顯示名稱，可為 null
 */
public record RoamingParty(String partyId, String partyTypeId, String partyName) {
}
