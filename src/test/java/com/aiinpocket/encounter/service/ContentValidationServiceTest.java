package com.aiinpocket.encounter.service;

import com.aiinpocket.encounter.config.EncounterProperties;
import com.aiinpocket.encounter.model.EnemyArchetype;
import com.aiinpocket.encounter.model.EnemyPackTemplate;
import com.aiinpocket.encounter.model.dto.ValidationReport;
import com.aiinpocket.encounter.model.enums.CombatRole;
import com.aiinpocket.encounter.registry.EncounterRegistry;
import com.aiinpocket.encounter.support.TestArchetypes;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Set;

import static com.aiinpocket.encounter.support.TestArchetypes.archetype;
import static com.aiinpocket.encounter.support.TestArchetypes.pack;
import static org.junit.jupiter.api.Assertions.*;

class ContentValidationServiceTest {

    @Test
    void clean_content_is_valid() {
        List<EnemyArchetype> archetypes = List.of(
                archetype("goblin", CombatRole.SKIRMISHER, 1, 1, 3, "goblin"),
                archetype("ogre", CombatRole.BRUTE, 1, 1, 3, "brute"));
        List<EnemyPackTemplate> packs = List.of(pack("camp", 1, "lair", "goblin", "ogre"));

        ValidationReport report = ContentValidationService.validate(archetypes, packs);

        assertTrue(report.overallValid());
        assertEquals(0, report.issueCount());
        assertEquals(2, report.totalArchetypes());
        assertEquals(1, report.totalPacks());
        assertTrue(report.orphanedArchetypes().isEmpty());
    }

    @Test
    void soft_archetype_problems_are_reported() {
        EnemyArchetype untagged = TestArchetypes.base("blob", CombatRole.BRUTE, 1)
                .hpPerFloor(-1.0)
                .spawnMinFloor(0)
                .tags(Set.of())
                .build();

        ValidationReport report = ContentValidationService.validate(List.of(untagged), List.of());

        assertFalse(report.overallValid());
        assertEquals(3, report.archetypeIssues().get("blob").size());
        assertEquals(List.of("blob"), report.orphanedArchetypes());
    }

    @Test
    void pack_problems_are_reported() {
        List<EnemyArchetype> archetypes = List.of(
                archetype("rat", CombatRole.SKIRMISHER, 1, 1, 3, "beast"),
                archetype("dragon", CombatRole.ELITE_BRUTE, 3, 5, null, "dragon"),
                archetype("hermit", CombatRole.SUPPORT, 2, 3, 6, "human"));
        EnemyPackTemplate weird = EnemyPackTemplate.builder()
                .id("weird")
                .tier(1)
                .memberArchIds(List.of("rat", "dragon", "phantom"))
                .weight(0.0)
                .build();
        EnemyPackTemplate empty = pack("empty", 1, null);

        ValidationReport report = ContentValidationService.validate(archetypes, List.of(weird, empty));

        // 成員不存在、權重、tier 跨度
        assertEquals(3, report.packIssues().get("weird").size());
        assertEquals(1, report.packIssues().get("empty").size());
        assertEquals(List.of("hermit"), report.orphanedArchetypes());
        assertEquals(4, report.issueCount());
    }

    @Test
    void bundled_content_has_no_archetype_issues() {
        EncounterRegistry registry = new EncounterRegistry();
        new EncounterContentLoader(registry, JsonMapper.builder().build(),
                new DefaultResourceLoader(), EncounterProperties.defaults()).load();

        ValidationReport report = new ContentValidationService(registry).validate();

        assertEquals(88, report.totalArchetypes());
        assertTrue(report.archetypeIssues().isEmpty(), report.archetypeIssues().toString());
        assertEquals(10, report.orphanedArchetypes().size());
    }
}
