package com.aiinpocket.encounter.model;

/**
 * 玩家隊伍快照（戰鬥準備時取得，唯讀）。
 * 友軍轉換以主角數值為基準乘上係數。
 *
 * @param playerLevel    主角等級
 * @param companionCount 目前同伴人數（不含主角）
 * @param heroMaxHp      主角最大生命值
 * @param heroAttack     主角攻擊力
 * @param heroDefense    主角防禦力
 * @param heroSkillPower 主角技能威力倍率
 */
public record PlayerPartySnapshot(int playerLevel, int companionCount,
                                  int heroMaxHp, int heroAttack, int heroDefense,
                                  double heroSkillPower) {

    /** 開局即為主角 + 1 位同伴，隊伍人數最少以 2 計 */
    public static final int MIN_PARTY_SIZE = 2;

    public static PlayerPartySnapshot of(int playerLevel, int companionCount) {
        return new PlayerPartySnapshot(playerLevel, companionCount, 30, 5, 0, 1.0);
    }

    public int partySize() {
        return Math.max(MIN_PARTY_SIZE, 1 + companionCount);
    }
}
