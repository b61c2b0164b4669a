package com.aiinpocket.encounter.service;

import com.aiinpocket.encounter.model.EnemyArchetype;
import com.aiinpocket.encounter.model.EnemyPackTemplate;
import com.aiinpocket.encounter.registry.EncounterRegistry;
import com.aiinpocket.encounter.service.support.FallbackChain;
import com.aiinpocket.encounter.service.support.WeightedPicker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;

/**
 * 遭遇選擇引擎。
 * 負責：
 * 1. 依樓層 + 房間標籤挑選敵人原型
 * 2. 依樓層挑選敵人組合（無合格組合時包成單一原型臨時組合）
 * 3. 依玩家等級挑選大地圖敵人原型（可指定偏好/排除標籤）
 *
 * 候選清單依序經過：出現樓層區間 → 舊版 tier 分段 → 全部原型。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EncounterSelectionService {

    // 房間標籤權重加成
    static final double LAIR_BRUTE_BONUS = 1.0;
    static final double EVENT_CASTER_BONUS = 0.7;
    static final double THEMED_ROOM_TAG_BONUS = 1.5;
    static final double LAIR_BEAST_BONUS = 1.0;
    static final double PREFERRED_ROOM_PACK_BONUS = 1.0;

    /** 主題房間 → 對應的原型標籤 */
    private static final Map<String, String> THEMED_ROOM_TAGS = Map.of(
            "graveyard", "undead",
            "sanctum", "holy"
    );

    private final EncounterRegistry registry;
    private final Random random;

    /**
     * 舊版樓層分段：1-2 層 = tier 1，3-4 層 = tier 2，其餘 tier 3。
     */
    public static int tierForFloor(int floor) {
        if (floor <= 2) return 1;
        if (floor <= 4) return 2;
        return 3;
    }

    /**
     * 依樓層與房間標籤挑選原型。房間標籤只調整權重，不會排除任何候選。
     *
     * @throws IllegalStateException 目錄中完全沒有原型
     */
    public EnemyArchetype chooseArchetypeForFloor(int floor, String roomTag) {
        List<EnemyArchetype> candidates = FallbackChain.<List<EnemyArchetype>>firstPresent(List.of(
                () -> FallbackChain.nonEmpty(registry.findEligibleForFloor(floor)),
                () -> FallbackChain.nonEmpty(registry.findByTier(tierForFloor(floor))),
                () -> FallbackChain.nonEmpty(List.copyOf(registry.getArchetypes()))
        )).orElseThrow(EncounterSelectionService::emptyRegistry);

        double[] weights = new double[candidates.size()];
        for (int i = 0; i < candidates.size(); i++) {
            weights[i] = roomWeight(candidates.get(i), roomTag);
        }

        EnemyArchetype chosen = WeightedPicker.pick(candidates, weights, random);
        log.debug("[遭遇選擇] 第 {} 層 ({}) → {}（候選 {} 個）", floor, roomTag, chosen.getId(), candidates.size());
        return chosen;
    }

    /**
     * 原型在指定房間的權重：出現權重 + 各項房間加成（可疊加）。
     */
    static double roomWeight(EnemyArchetype archetype, String roomTag) {
        double weight = archetype.getSpawnWeight();
        if (roomTag == null) {
            return weight;
        }

        // 巢穴偏好重擊型
        if (roomTag.equals("lair") && archetype.getRole().isBruteFamily()) {
            weight += LAIR_BRUTE_BONUS;
        }
        // 事件房偏好施法/輔助型
        if (roomTag.equals("event") && archetype.getRole().isEventRoomFavored()) {
            weight += EVENT_CASTER_BONUS;
        }
        String themedTag = THEMED_ROOM_TAGS.get(roomTag);
        if (themedTag != null && archetype.hasTag(themedTag)) {
            weight += THEMED_ROOM_TAG_BONUS;
        }
        if (roomTag.equals("lair") && archetype.hasTag("beast")) {
            weight += LAIR_BEAST_BONUS;
        }
        return weight;
    }

    /**
     * 依樓層挑選組合。
     * 候選組合須符合樓層分段，且每位成員都能各自出現在此樓層。
     * 沒有候選時回傳單一原型臨時組合，即使完全沒註冊組合也不會失敗。
     */
    public EnemyPackTemplate choosePackForFloor(int floor, String roomTag) {
        int tier = tierForFloor(floor);

        List<EnemyPackTemplate> candidates = new ArrayList<>();
        for (EnemyPackTemplate pack : registry.findPacksByTier(tier)) {
            if (allMembersSpawnOnFloor(pack, floor)) {
                candidates.add(pack);
            }
        }

        if (candidates.isEmpty()) {
            EnemyArchetype archetype = chooseArchetypeForFloor(floor, roomTag);
            log.debug("[遭遇選擇] 第 {} 層沒有合格組合，改用單一原型 {}", floor, archetype.getId());
            return EnemyPackTemplate.single(archetype, roomTag);
        }

        double[] weights = new double[candidates.size()];
        for (int i = 0; i < candidates.size(); i++) {
            EnemyPackTemplate pack = candidates.get(i);
            double weight = pack.getWeight();
            if (Objects.equals(pack.getPreferredRoomTag(), roomTag)) {
                weight += PREFERRED_ROOM_PACK_BONUS;
            }
            weights[i] = weight;
        }

        EnemyPackTemplate chosen = WeightedPicker.pick(candidates, weights, random);
        log.debug("[遭遇選擇] 第 {} 層 ({}) → 組合 {}（候選 {} 個）", floor, roomTag, chosen.getId(), candidates.size());
        return chosen;
    }

    private boolean allMembersSpawnOnFloor(EnemyPackTemplate pack, int floor) {
        if (pack.getMemberArchIds().isEmpty()) {
            return false;
        }
        for (String memberId : pack.getMemberArchIds()) {
            Optional<EnemyArchetype> member = registry.findArchetype(memberId);
            if (member.isEmpty() || !member.get().spawnsOnFloor(floor)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 依玩家等級挑選大地圖敵人（以等級當作樓層篩選出現區間）。
     * 順序：符合等級且帶偏好標籤 → 符合等級 → tier 分段 → 全部原型。
     * 排除標籤只作用在符合等級的候選上。
     *
     * @param preferredTags 偏好標籤，可為 null
     * @param excludedTags  排除標籤，可為 null
     */
    public EnemyArchetype chooseArchetypeForPlayerLevel(int playerLevel,
                                                        Collection<String> preferredTags,
                                                        Collection<String> excludedTags) {
        List<EnemyArchetype> levelEligible = registry.findEligibleForFloor(playerLevel);

        Supplier<Optional<List<EnemyArchetype>>> preferred = () -> {
            if (preferredTags == null || preferredTags.isEmpty()) {
                return Optional.empty();
            }
            return FallbackChain.nonEmpty(withoutExcluded(
                    levelEligible.stream().filter(a -> a.hasAnyTag(preferredTags)).toList(), excludedTags));
        };

        List<EnemyArchetype> candidates = FallbackChain.<List<EnemyArchetype>>firstPresent(List.of(
                preferred,
                () -> FallbackChain.nonEmpty(withoutExcluded(levelEligible, excludedTags)),
                () -> FallbackChain.nonEmpty(registry.findByTier(tierForFloor(playerLevel))),
                () -> FallbackChain.nonEmpty(List.copyOf(registry.getArchetypes()))
        )).orElseThrow(EncounterSelectionService::emptyRegistry);

        double[] weights = candidates.stream().mapToDouble(EnemyArchetype::getSpawnWeight).toArray();
        EnemyArchetype chosen = WeightedPicker.pick(candidates, weights, random);
        log.debug("[遭遇選擇] 玩家 Lv.{} → {}（候選 {} 個）", playerLevel, chosen.getId(), candidates.size());
        return chosen;
    }

    private static List<EnemyArchetype> withoutExcluded(List<EnemyArchetype> candidates,
                                                        Collection<String> excludedTags) {
        if (excludedTags == null || excludedTags.isEmpty()) {
            return candidates;
        }
        return candidates.stream().filter(a -> !a.hasAnyTag(excludedTags)).toList();
    }

    private static IllegalStateException emptyRegistry() {
        return new IllegalStateException("尚未註冊任何敵人原型");
    }
}
