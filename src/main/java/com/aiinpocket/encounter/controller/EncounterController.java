package com.aiinpocket.encounter.controller;

import com.aiinpocket.encounter.model.EnemyArchetype;
import com.aiinpocket.encounter.model.EnemyPackTemplate;
import com.aiinpocket.encounter.model.RgbColor;
import com.aiinpocket.encounter.model.SpawnedUnit;
import com.aiinpocket.encounter.model.dto.DifficultyRange;
import com.aiinpocket.encounter.model.dto.EliteStats;
import com.aiinpocket.encounter.model.dto.PackSynergy;
import com.aiinpocket.encounter.model.dto.RoomEncounter;
import com.aiinpocket.encounter.model.dto.ScaledStats;
import com.aiinpocket.encounter.model.dto.ValidationReport;
import com.aiinpocket.encounter.model.enums.CombatRole;
import com.aiinpocket.encounter.registry.EncounterRegistry;
import com.aiinpocket.encounter.service.ContentValidationService;
import com.aiinpocket.encounter.service.EliteVariantService;
import com.aiinpocket.encounter.service.EncounterSelectionService;
import com.aiinpocket.encounter.service.FloorEncounterService;
import com.aiinpocket.encounter.service.StatScalingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 遭遇內容查詢 REST API（唯讀）。
 * 提供原型/組合目錄、樓層數值試算、內容檢查與房間遭遇預覽，供內容設計與除錯使用。
 */
@RestController
@RequestMapping("/api/encounter")
@RequiredArgsConstructor
public class EncounterController {

    private final EncounterRegistry registry;
    private final StatScalingService statScalingService;
    private final EliteVariantService eliteVariantService;
    private final ContentValidationService validationService;
    private final FloorEncounterService floorEncounterService;

    /** 目錄摘要：數量與各定位分布 */
    @GetMapping("/summary")
    public ResponseEntity<SummaryDto> getSummary() {
        return ResponseEntity.ok(new SummaryDto(
                registry.archetypeCount(), registry.packCount(), registry.roleDistribution()));
    }

    /**
     * 原型清單，可用標籤、定位、技能、難度區間、樓層區間篩選（多個條件取交集）。
     */
    @GetMapping("/archetypes")
    public ResponseEntity<List<ArchetypeDto>> getArchetypes(
            @RequestParam(required = false) String tag,
            @RequestParam(required = false) CombatRole role,
            @RequestParam(required = false) String skill,
            @RequestParam(required = false) Integer minDifficulty,
            @RequestParam(required = false) Integer maxDifficulty,
            @RequestParam(required = false) Integer minFloor,
            @RequestParam(required = false) Integer maxFloor) {
        List<EnemyArchetype> result = List.copyOf(registry.getArchetypes());
        if (tag != null) {
            result = retain(result, registry.findByTag(tag));
        }
        if (role != null) {
            result = retain(result, registry.findByRole(role));
        }
        if (skill != null) {
            result = retain(result, registry.findBySkill(skill));
        }
        if (minDifficulty != null || maxDifficulty != null) {
            int min = minDifficulty != null ? minDifficulty : 1;
            int max = maxDifficulty != null ? maxDifficulty : Integer.MAX_VALUE;
            requireOrdered("minDifficulty", min, "maxDifficulty", max);
            result = retain(result, registry.findByDifficultyRange(min, max));
        }
        if (minFloor != null || maxFloor != null) {
            int min = minFloor != null ? minFloor : 1;
            int max = maxFloor != null ? maxFloor : Integer.MAX_VALUE;
            requireOrdered("minFloor", min, "maxFloor", max);
            result = retain(result, registry.findByFloorRange(min, max));
        }
        return ResponseEntity.ok(result.stream().map(EncounterController::toArchetypeDto).toList());
    }

    @GetMapping("/archetypes/{id}")
    public ResponseEntity<ArchetypeDto> getArchetype(@PathVariable String id) {
        return ResponseEntity.ok(toArchetypeDto(registry.getArchetype(id)));
    }

    /** 指定樓層的縮放後數值（含菁英版本） */
    @GetMapping("/archetypes/{id}/stats")
    public ResponseEntity<ScaledStatsDto> getScaledStats(@PathVariable String id,
                                                         @RequestParam(defaultValue = "1") int floor) {
        requirePositiveFloor(floor);
        ScaledStats stats = statScalingService.computeScaledStats(id, floor);
        return ResponseEntity.ok(new ScaledStatsDto(id, floor, stats,
                EliteVariantService.applyEliteModifiers(stats.hp(), stats.attack(), stats.defense(), stats.xp())));
    }

    @GetMapping("/packs")
    public ResponseEntity<List<PackDto>> getPacks(
            @RequestParam(required = false) Integer tier,
            @RequestParam(required = false) String roomTag) {
        List<EnemyPackTemplate> result = List.copyOf(registry.getPacks());
        if (tier != null) {
            result = retain(result, registry.findPacksByTier(tier));
        }
        if (roomTag != null) {
            result = retain(result, registry.findPacksByRoomTag(roomTag));
        }
        return ResponseEntity.ok(result.stream().map(EncounterController::toPackDto).toList());
    }

    @GetMapping("/packs/{id}")
    public ResponseEntity<PackDto> getPack(@PathVariable String id) {
        return ResponseEntity.ok(toPackDto(registry.getPack(id)));
    }

    /** 樓層資訊：舊版分段、難度區間、菁英機率與可出現原型 */
    @GetMapping("/floors/{floor}")
    public ResponseEntity<FloorInfoDto> getFloorInfo(@PathVariable int floor) {
        requirePositiveFloor(floor);
        List<String> eligible = registry.findEligibleForFloor(floor).stream()
                .map(EnemyArchetype::getId)
                .toList();
        return ResponseEntity.ok(new FloorInfoDto(
                floor,
                EncounterSelectionService.tierForFloor(floor),
                StatScalingService.floorToDifficultyRange(floor),
                eliteVariantService.eliteChanceForFloor(floor),
                eligible));
    }

    @GetMapping("/validation")
    public ResponseEntity<ValidationDto> getValidation() {
        ValidationReport report = validationService.validate();
        return ResponseEntity.ok(new ValidationDto(
                report.overallValid(),
                report.issueCount(),
                report.totalArchetypes(),
                report.totalPacks(),
                report.archetypeIssues(),
                report.packIssues(),
                report.orphanedArchetypes()));
    }

    /** 試產生一個房間遭遇（不保留獨特敵人紀錄） */
    @GetMapping("/preview")
    public ResponseEntity<RoomEncounterDto> preview(@RequestParam(defaultValue = "1") int floor,
                                                    @RequestParam(required = false) String roomTag) {
        requirePositiveFloor(floor);
        RoomEncounter encounter = floorEncounterService.spawnRoomEncounter(floor, roomTag, new HashSet<>());
        return ResponseEntity.ok(new RoomEncounterDto(
                encounter.floor(),
                encounter.roomTag(),
                encounter.packId(),
                encounter.unique(),
                encounter.synergy(),
                encounter.units().stream().map(EncounterController::toUnitDto).toList()));
    }

    // ===== 參數檢查 =====

    private static void requirePositiveFloor(int floor) {
        if (floor < 1) {
            throw new IllegalArgumentException("樓層必須 >= 1: " + floor);
        }
    }

    private static void requireOrdered(String minName, int min, String maxName, int max) {
        if (min > max) {
            throw new IllegalArgumentException(minName + " 不可大於 " + maxName);
        }
    }

    private static <T> List<T> retain(List<T> current, Collection<T> filter) {
        Set<T> allowed = new HashSet<>(filter);
        return current.stream().filter(allowed::contains).toList();
    }

    // ===== DTO =====

    private static ArchetypeDto toArchetypeDto(EnemyArchetype a) {
        return new ArchetypeDto(
                a.getId(),
                a.getName(),
                a.getRole().name(),
                a.getTier(),
                a.getAiProfile(),
                a.getDifficultyLevel(),
                a.getSpawnMinFloor(),
                a.getSpawnMaxFloor(),
                a.getSpawnWeight(),
                a.getBaseHp(),
                a.getBaseAttack(),
                a.getBaseDefense(),
                a.getBaseXp(),
                a.getBaseInitiative(),
                a.getSkillIds(),
                List.copyOf(a.getTags()),
                a.getResistances(),
                a.getUniqueMechanics()
        );
    }

    private static PackDto toPackDto(EnemyPackTemplate p) {
        return new PackDto(p.getId(), p.getName(), p.getTier(), p.getMemberArchIds(),
                p.getPreferredRoomTag(), p.getWeight());
    }

    private static UnitDto toUnitDto(SpawnedUnit u) {
        RgbColor c = u.getColor();
        return new UnitDto(
                u.getArchetypeId(),
                u.getName(),
                u.getRole() != null ? u.getRole().name() : null,
                u.getLevel(),
                u.getHp(),
                u.getMaxHp(),
                u.getAttack(),
                u.getDefense(),
                u.getXp(),
                u.getInitiative(),
                u.getSkillPower(),
                u.isElite(),
                u.isUnique(),
                new int[]{c.red(), c.green(), c.blue()},
                List.copyOf(u.getTags())
        );
    }

    public record SummaryDto(int archetypes, int packs, Map<CombatRole, Integer> roles) {}

    public record ArchetypeDto(
            String id, String name, String role, int tier, String aiProfile,
            int difficultyLevel, int spawnMinFloor, Integer spawnMaxFloor, double spawnWeight,
            int baseHp, int baseAttack, int baseDefense, int baseXp, int baseInitiative,
            List<String> skillIds, List<String> tags,
            Map<String, Double> resistances, List<String> uniqueMechanics
    ) {}

    public record ScaledStatsDto(String archetypeId, int floor, ScaledStats normal,
                                 EliteStats elite) {}

    public record PackDto(String id, String name, int tier, List<String> memberArchIds,
                          String preferredRoomTag, double weight) {}

    public record ValidationDto(boolean overallValid, int issueCount, int totalArchetypes, int totalPacks,
                                Map<String, List<String>> archetypeIssues,
                                Map<String, List<String>> packIssues,
                                List<String> orphanedArchetypes) {}

    public record FloorInfoDto(int floor, int tier, DifficultyRange difficultyRange,
                               double eliteChance, List<String> eligibleArchetypes) {}

    public record RoomEncounterDto(int floor, String roomTag, String packId, boolean unique,
                                   PackSynergy synergy, List<UnitDto> units) {}

    public record UnitDto(
            String archetypeId, String name, String role, int level,
            int hp, int maxHp, int attack, int defense, int xp, int initiative,
            double skillPower, boolean elite, boolean unique, int[] color, List<String> tags
    ) {}
}
