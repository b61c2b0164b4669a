package com.aiinpocket.encounter.model.dto;

import com.aiinpocket.encounter.model.enums.CombatRole;

import java.util.List;
import java.util.Map;

/**
 * 內容檔中的原型定義。
 * 可省略的欄位使用包裝型別，null 代表「依 tier 推導預設值」。
 */
public record ArchetypeDefinition(
        String id,
        String name,
        CombatRole role,
        int tier,
        String aiProfile,
        int baseHp,
        double hpPerFloor,
        int baseAttack,
        double atkPerFloor,
        int baseDefense,
        double defPerFloor,
        int baseXp,
        double xpPerFloor,
        Integer baseInitiative,
        Double initPerFloor,
        List<String> skillIds,
        Integer difficultyLevel,
        Integer spawnMinFloor,
        Integer spawnMaxFloor,
        Double spawnWeight,
        List<String> tags,
        Map<String, Double> resistances,
        List<String> uniqueMechanics
) {}
