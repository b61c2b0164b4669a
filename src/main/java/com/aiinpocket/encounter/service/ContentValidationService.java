package com.aiinpocket.encounter.service;

import com.aiinpocket.encounter.model.EnemyArchetype;
import com.aiinpocket.encounter.model.EnemyPackTemplate;
import com.aiinpocket.encounter.model.dto.ValidationReport;
import com.aiinpocket.encounter.registry.EncounterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 遭遇內容檢查。
 * 註冊時已擋下的硬性錯誤之外，再列出值得人工確認的項目（無標籤、組合跨 tier 等），
 * 以及沒有出現在任何組合中的原型。
 */
@Service
@RequiredArgsConstructor
public class ContentValidationService {

    private final EncounterRegistry registry;

    public ValidationReport validate() {
        return validate(registry.getArchetypes(), registry.getPacks());
    }

    public static ValidationReport validate(Collection<EnemyArchetype> archetypes,
                                            Collection<EnemyPackTemplate> packs) {
        Map<String, EnemyArchetype> byId = new HashMap<>();
        for (EnemyArchetype a : archetypes) {
            byId.put(a.getId(), a);
        }

        Map<String, List<String>> archetypeIssues = new LinkedHashMap<>();
        for (EnemyArchetype a : archetypes) {
            List<String> issues = checkArchetype(a);
            if (!issues.isEmpty()) {
                archetypeIssues.put(a.getId(), issues);
            }
        }

        Map<String, List<String>> packIssues = new LinkedHashMap<>();
        Set<String> usedIds = new HashSet<>();
        for (EnemyPackTemplate p : packs) {
            usedIds.addAll(p.getMemberArchIds());
            List<String> issues = checkPack(p, byId);
            if (!issues.isEmpty()) {
                packIssues.put(p.getId(), issues);
            }
        }

        Set<String> orphaned = new TreeSet<>(byId.keySet());
        orphaned.removeAll(usedIds);

        return new ValidationReport(archetypes.size(), archetypeIssues,
                packs.size(), packIssues, List.copyOf(orphaned));
    }

    static List<String> checkArchetype(EnemyArchetype a) {
        List<String> issues = new ArrayList<>();
        if (a.getName() == null || a.getName().isBlank()) {
            issues.add("名稱為空");
        }
        if (a.getBaseHp() <= 0) {
            issues.add("基礎生命必須 > 0: " + a.getBaseHp());
        }
        if (a.getBaseAttack() <= 0) {
            issues.add("基礎攻擊必須 > 0: " + a.getBaseAttack());
        }
        if (a.getDifficultyLevel() <= 0) {
            issues.add("難度等級必須 > 0: " + a.getDifficultyLevel());
        }
        if (a.getSpawnMinFloor() < 1) {
            issues.add("最早出現樓層必須 >= 1: " + a.getSpawnMinFloor());
        }
        if (a.getSpawnMaxFloor() != null && a.getSpawnMaxFloor() < a.getSpawnMinFloor()) {
            issues.add("最晚出現樓層 (" + a.getSpawnMaxFloor() + ") 小於最早出現樓層 (" + a.getSpawnMinFloor() + ")");
        }
        if (a.getHpPerFloor() < 0) {
            issues.add("每層生命成長不可為負: " + a.getHpPerFloor());
        }
        if (a.getAtkPerFloor() < 0) {
            issues.add("每層攻擊成長不可為負: " + a.getAtkPerFloor());
        }
        if (a.getTags().isEmpty()) {
            issues.add("沒有任何標籤（篩選時找不到）");
        }
        return issues;
    }

    static List<String> checkPack(EnemyPackTemplate p, Map<String, EnemyArchetype> byId) {
        List<String> issues = new ArrayList<>();
        if (p.getMemberArchIds().isEmpty()) {
            issues.add("組合沒有任何成員");
        }

        int minTier = Integer.MAX_VALUE;
        int maxTier = Integer.MIN_VALUE;
        for (String memberId : p.getMemberArchIds()) {
            EnemyArchetype member = byId.get(memberId);
            if (member == null) {
                issues.add("成員原型不存在: " + memberId);
                continue;
            }
            minTier = Math.min(minTier, member.getTier());
            maxTier = Math.max(maxTier, member.getTier());
        }

        if (p.getWeight() <= 0) {
            issues.add("組合權重必須 > 0: " + p.getWeight());
        }
        // 跨 tier 不一定是錯，僅提示檢查
        if (minTier != Integer.MAX_VALUE && maxTier - minTier > 1) {
            issues.add("成員 tier 跨度過大: " + minTier + "~" + maxTier);
        }
        return issues;
    }
}
