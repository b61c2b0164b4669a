package com.aiinpocket.encounter.registry;

import com.aiinpocket.encounter.exception.DuplicateRegistrationException;
import com.aiinpocket.encounter.exception.NotFoundException;
import com.aiinpocket.encounter.model.EnemyArchetype;
import com.aiinpocket.encounter.model.EnemyPackTemplate;
import com.aiinpocket.encounter.model.enums.CombatRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 敵人原型與組合的目錄。
 * 啟動階段寫入一次，{@link #seal()} 之後唯讀，讀取端不需任何鎖。
 * 迭代順序即註冊順序，固定種子才能重現相同的生成序列。
 */
@Component
@Slf4j
public class EncounterRegistry {

    private final Map<String, EnemyArchetype> archetypes = new LinkedHashMap<>();
    private final Map<String, EnemyPackTemplate> packs = new LinkedHashMap<>();

    private volatile boolean sealed = false;

    // ===== 註冊（僅限啟動階段） =====

    /**
     * 註冊原型；集合欄位複製為不可變副本，回傳實際存入目錄的原型。
     */
    public EnemyArchetype registerArchetype(EnemyArchetype archetype) {
        ensureWritable();
        validateArchetype(archetype);
        if (archetypes.containsKey(archetype.getId())) {
            throw new DuplicateRegistrationException("原型", archetype.getId());
        }
        EnemyArchetype stored = archetype.toBuilder()
                .skillIds(List.copyOf(archetype.getSkillIds()))
                .tags(Collections.unmodifiableSet(new LinkedHashSet<>(archetype.getTags())))
                .resistances(Map.copyOf(archetype.getResistances()))
                .uniqueMechanics(List.copyOf(archetype.getUniqueMechanics()))
                .build();
        archetypes.put(stored.getId(), stored);
        return stored;
    }

    /**
     * 註冊組合；至少一名成員，且所有成員原型必須已註冊。
     */
    public EnemyPackTemplate registerPack(EnemyPackTemplate pack) {
        ensureWritable();
        if (packs.containsKey(pack.getId())) {
            throw new DuplicateRegistrationException("組合", pack.getId());
        }
        if (pack.getMemberArchIds().isEmpty()) {
            throw new IllegalArgumentException("組合 " + pack.getId() + " 沒有任何成員");
        }
        for (String memberId : pack.getMemberArchIds()) {
            if (!archetypes.containsKey(memberId)) {
                throw new NotFoundException("組合 " + pack.getId() + " 的成員原型", memberId);
            }
        }
        packs.put(pack.getId(), pack);
        return pack;
    }

    /** 結束寫入階段 */
    public void seal() {
        if (!sealed) {
            sealed = true;
            log.info("[遭遇內容] 註冊完成並封存：{} 個原型, {} 個組合", archetypes.size(), packs.size());
        }
    }

    public boolean isSealed() {
        return sealed;
    }

    private void ensureWritable() {
        if (sealed) {
            throw new IllegalStateException("遭遇目錄已封存，啟動後不可再註冊");
        }
    }

    private static void validateArchetype(EnemyArchetype a) {
        if (a.getSpawnMaxFloor() != null && a.getSpawnMinFloor() > a.getSpawnMaxFloor()) {
            throw new IllegalArgumentException("原型 " + a.getId() + " 出現樓層區間無效: "
                    + a.getSpawnMinFloor() + " > " + a.getSpawnMaxFloor());
        }
        if (a.getDifficultyLevel() <= 0) {
            throw new IllegalArgumentException("原型 " + a.getId() + " 難度等級必須 > 0: " + a.getDifficultyLevel());
        }
        if (a.getBaseHp() <= 0 || a.getBaseAttack() <= 0) {
            throw new IllegalArgumentException("原型 " + a.getId() + " 基礎生命與攻擊必須 > 0");
        }
    }

    // ===== 查詢 =====

    public EnemyArchetype getArchetype(String id) {
        EnemyArchetype archetype = archetypes.get(id);
        if (archetype == null) {
            throw new NotFoundException("原型", id);
        }
        return archetype;
    }

    public Optional<EnemyArchetype> findArchetype(String id) {
        return Optional.ofNullable(id).map(archetypes::get);
    }

    public EnemyPackTemplate getPack(String id) {
        EnemyPackTemplate pack = packs.get(id);
        if (pack == null) {
            throw new NotFoundException("組合", id);
        }
        return pack;
    }

    public Collection<EnemyArchetype> getArchetypes() {
        return Collections.unmodifiableCollection(archetypes.values());
    }

    public Collection<EnemyPackTemplate> getPacks() {
        return Collections.unmodifiableCollection(packs.values());
    }

    public int archetypeCount() {
        return archetypes.size();
    }

    public int packCount() {
        return packs.size();
    }

    public boolean isEmpty() {
        return archetypes.isEmpty();
    }

    public List<String> listArchetypeIds() {
        return archetypes.keySet().stream().sorted().toList();
    }

    public List<String> listPackIds() {
        return packs.keySet().stream().sorted().toList();
    }

    // ===== 篩選 =====

    public List<EnemyArchetype> findByTag(String tag) {
        return archetypes.values().stream().filter(a -> a.hasTag(tag)).toList();
    }

    public List<EnemyArchetype> findByRole(CombatRole role) {
        return archetypes.values().stream().filter(a -> a.getRole() == role).toList();
    }

    public List<EnemyArchetype> findByTier(int tier) {
        return archetypes.values().stream().filter(a -> a.getTier() == tier).toList();
    }

    /** 難度等級落在 [minLevel, maxLevel]（含） */
    public List<EnemyArchetype> findByDifficultyRange(int minLevel, int maxLevel) {
        return archetypes.values().stream()
                .filter(a -> a.getDifficultyLevel() >= minLevel && a.getDifficultyLevel() <= maxLevel)
                .toList();
    }

    /** 出現區間與 [minFloor, maxFloor] 有交集 */
    public List<EnemyArchetype> findByFloorRange(int minFloor, int maxFloor) {
        return archetypes.values().stream()
                .filter(a -> a.getSpawnMinFloor() <= maxFloor
                        && (a.getSpawnMaxFloor() == null || a.getSpawnMaxFloor() >= minFloor))
                .toList();
    }

    /** 可出現在指定樓層的原型 */
    public List<EnemyArchetype> findEligibleForFloor(int floor) {
        return archetypes.values().stream().filter(a -> a.spawnsOnFloor(floor)).toList();
    }

    public List<EnemyArchetype> findBySkill(String skillId) {
        return archetypes.values().stream().filter(a -> a.getSkillIds().contains(skillId)).toList();
    }

    public List<EnemyPackTemplate> findPacksByTier(int tier) {
        return packs.values().stream().filter(p -> p.getTier() == tier).toList();
    }

    public List<EnemyPackTemplate> findPacksByRoomTag(String roomTag) {
        return packs.values().stream()
                .filter(p -> roomTag != null && roomTag.equals(p.getPreferredRoomTag()))
                .toList();
    }

    /** 各定位的原型數量 */
    public Map<CombatRole, Integer> roleDistribution() {
        Map<CombatRole, Integer> counts = new LinkedHashMap<>();
        for (EnemyArchetype a : archetypes.values()) {
            counts.merge(a.getRole(), 1, Integer::sum);
        }
        return counts;
    }
}
