package com.aiinpocket.encounter.service;

import com.aiinpocket.encounter.model.SpawnedUnit;
import com.aiinpocket.encounter.model.dto.PackSynergy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 隊伍組合加成。
 * 同場敵人的標籤組成決定整組的倍率加成，讓組合本身帶有戰術意義。
 * 各規則互相獨立，加成以加法累計。
 */
@Service
@Slf4j
public class PackSynergyService {

    /**
     * 計算一組單位的加成倍率，空清單回傳全 1.0。
     */
    public PackSynergy calculateSynergies(List<SpawnedUnit> units) {
        if (units == null || units.isEmpty()) {
            return PackSynergy.NONE;
        }

        int goblins = 0;
        int undead = 0;
        int cultists = 0;
        int beasts = 0;
        int elementals = 0;
        int casters = 0;
        int tanks = 0;

        for (SpawnedUnit unit : units) {
            if (unit.hasTag("goblin")) goblins++;
            if (unit.hasTag("undead")) undead++;
            if (unit.hasTag("cultist")) cultists++;
            if (unit.hasTag("beast")) beasts++;
            if (unit.hasTag("elemental")) elementals++;
            if (unit.hasTag("caster") || unit.hasTag("invoker")) casters++;
            if (unit.hasTag("brute") || unit.hasTag("tank")) tanks++;
        }

        double attackMult = 1.0;
        double hpMult = 1.0;
        double defenseMult = 1.0;
        double skillPowerMult = 1.0;

        // 哥布林群：3 隻以上攻擊 +10%
        if (goblins >= 3) {
            attackMult += 0.10;
        }
        // 不死大軍：每隻 +5% 生命，上限 +25%
        if (undead >= 2) {
            hpMult += Math.min(0.25, 0.05 * undead);
        }
        // 邪教法陣：每位教徒 +5% 技能威力（無上限）
        if (cultists >= 2) {
            skillPowerMult += 0.05 * cultists;
        }
        // 元素風暴
        if (elementals >= 2) {
            skillPowerMult += 0.20;
        }
        // 坦克陣線：每位 +10% 防禦（無上限）
        if (tanks >= 2) {
            defenseMult += 0.10 * tanks;
        }
        // 施法支援
        if (casters >= 2) {
            skillPowerMult += 0.10;
        }

        if (beasts >= 2) {
            log.debug("[隊伍加成] 野獸 {} 隻（速度加成尚未實作）", beasts);
        }

        return new PackSynergy(attackMult, hpMult, defenseMult, skillPowerMult);
    }

    /**
     * 計算並就地套用加成。
     * 生命值按比例縮放：先放大最大生命，再依原本的血量比例換算目前生命，不會補滿。
     */
    public PackSynergy applySynergies(List<SpawnedUnit> units) {
        PackSynergy synergy = calculateSynergies(units);
        if (synergy.isNone()) {
            return synergy;
        }

        for (SpawnedUnit unit : units) {
            if (synergy.attackMult() != 1.0) {
                unit.setAttack((int) (unit.getAttack() * synergy.attackMult()));
            }

            if (synergy.hpMult() != 1.0) {
                int oldMax = unit.getMaxHp();
                int newMax = (int) (oldMax * synergy.hpMult());
                double ratio = oldMax > 0 ? (double) unit.getHp() / oldMax : 1.0;
                unit.setMaxHp(newMax);
                unit.setHp((int) (newMax * ratio));
            }

            if (synergy.defenseMult() != 1.0) {
                unit.setDefense((int) (unit.getDefense() * synergy.defenseMult()));
            }

            if (synergy.skillPowerMult() != 1.0) {
                unit.setSkillPower(unit.getSkillPower() * synergy.skillPowerMult());
            }
        }

        log.debug("[隊伍加成] {} 個單位套用加成 {}", units.size(), synergy);
        return synergy;
    }
}
