package com.aiinpocket.encounter.model.dto;

/**
 * 隊伍組合加成倍率（1.0 = 無加成）。
 */
public record PackSynergy(
        double attackMult,
        double hpMult,
        double defenseMult,
        double skillPowerMult
) {
    public static final PackSynergy NONE = new PackSynergy(1.0, 1.0, 1.0, 1.0);

    public boolean isNone() {
        return attackMult == 1.0 && hpMult == 1.0 && defenseMult == 1.0 && skillPowerMult == 1.0;
    }
}
