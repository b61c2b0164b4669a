package com.aiinpocket.encounter.service;

import com.aiinpocket.encounter.config.EncounterProperties;
import com.aiinpocket.encounter.model.EnemyArchetype;
import com.aiinpocket.encounter.model.EnemyPackTemplate;
import com.aiinpocket.encounter.model.SpawnedUnit;
import com.aiinpocket.encounter.model.dto.PackSynergy;
import com.aiinpocket.encounter.model.dto.RoomEncounter;
import com.aiinpocket.encounter.registry.EncounterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * 樓層房間遭遇組裝。
 * 每個房間錨點：先判定是否生成房間專屬的獨特敵人，否則生成一組敵人組合，
 * 成員各自依樓層縮放並判定菁英，最後套用隊伍加成。
 */
@Service
@Slf4j
public class FloorEncounterService {

    private final EncounterRegistry registry;
    private final EncounterSelectionService selectionService;
    private final EliteVariantService eliteVariantService;
    private final PackSynergyService packSynergyService;
    private final Random random;
    private final EncounterProperties.Spawning spawning;

    public FloorEncounterService(EncounterRegistry registry,
                                 EncounterSelectionService selectionService,
                                 EliteVariantService eliteVariantService,
                                 PackSynergyService packSynergyService,
                                 Random random,
                                 EncounterProperties properties) {
        this.registry = registry;
        this.selectionService = selectionService;
        this.eliteVariantService = eliteVariantService;
        this.packSynergyService = packSynergyService;
        this.random = random;
        this.spawning = properties.spawning();
    }

    /**
     * 生成一個房間的遭遇。
     *
     * @param spawnedUniqueIds 本層已生成的獨特敵人 ID，生成新的獨特敵人時會寫入
     */
    public RoomEncounter spawnRoomEncounter(int floor, String roomTag, Set<String> spawnedUniqueIds) {
        List<String> uniqueCandidates = availableUniques(roomTag, spawnedUniqueIds);
        if (!uniqueCandidates.isEmpty() && random.nextDouble() < spawning.uniqueChance()) {
            String uniqueId = uniqueCandidates.get(random.nextInt(uniqueCandidates.size()));
            SpawnedUnit unique = spawnMember(uniqueId, floor, roomTag);
            unique.setUnique(true);
            eliteVariantService.makeEnemyElite(unique);
            spawnedUniqueIds.add(uniqueId);

            log.info("[房間遭遇] 第 {} 層 {} 出現獨特敵人 {}", floor, roomTag, unique.getName());
            return new RoomEncounter(floor, roomTag, null, List.of(unique), PackSynergy.NONE, true);
        }

        EnemyPackTemplate pack = selectionService.choosePackForFloor(floor, roomTag);
        List<SpawnedUnit> units = new ArrayList<>(pack.getMemberArchIds().size());
        for (String memberId : pack.getMemberArchIds()) {
            SpawnedUnit unit = spawnMember(memberId, floor, roomTag);
            if (eliteVariantService.isEliteSpawn(floor)) {
                eliteVariantService.makeEnemyElite(unit);
            }
            units.add(unit);
        }

        PackSynergy synergy = packSynergyService.applySynergies(units);
        log.debug("[房間遭遇] 第 {} 層 ({}) 組合 {} → {} 名敵人", floor, roomTag, pack.getId(), units.size());
        return new RoomEncounter(floor, roomTag, pack.getId(), List.copyOf(units), synergy, false);
    }

    /** 此房間標籤還能出現的獨特敵人（已達每層上限時為空） */
    private List<String> availableUniques(String roomTag, Set<String> spawnedUniqueIds) {
        if (roomTag == null || spawnedUniqueIds.size() >= spawning.maxUniquePerFloor()) {
            return List.of();
        }
        Map<String, List<String>> byRoom = spawning.uniqueRoomEnemies();
        if (byRoom == null || !byRoom.containsKey(roomTag)) {
            return List.of();
        }
        return byRoom.get(roomTag).stream()
                .filter(id -> !spawnedUniqueIds.contains(id))
                .toList();
    }

    // 原型不存在時改用樓層選擇的原型
    private SpawnedUnit spawnMember(String archetypeId, int floor, String roomTag) {
        EnemyArchetype archetype = registry.findArchetype(archetypeId).orElseGet(() -> {
            log.warn("[房間遭遇] 原型 {} 不存在，改用第 {} 層隨機原型", archetypeId, floor);
            return selectionService.chooseArchetypeForFloor(floor, roomTag);
        });
        return StatScalingService.spawnUnit(archetype, floor);
    }
}
