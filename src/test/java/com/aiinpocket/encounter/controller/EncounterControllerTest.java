package com.aiinpocket.encounter.controller;

import com.aiinpocket.encounter.config.EncounterProperties;
import com.aiinpocket.encounter.model.enums.CombatRole;
import com.aiinpocket.encounter.registry.EncounterRegistry;
import com.aiinpocket.encounter.service.ContentValidationService;
import com.aiinpocket.encounter.service.EliteVariantService;
import com.aiinpocket.encounter.service.EncounterSelectionService;
import com.aiinpocket.encounter.service.FloorEncounterService;
import com.aiinpocket.encounter.service.PackSynergyService;
import com.aiinpocket.encounter.service.StatScalingService;
import com.aiinpocket.encounter.support.TestArchetypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Random;

import static com.aiinpocket.encounter.support.TestArchetypes.archetype;
import static com.aiinpocket.encounter.support.TestArchetypes.pack;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class EncounterControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        EncounterRegistry registry = new EncounterRegistry();
        registry.registerArchetype(TestArchetypes.goblinSkirmisher());
        registry.registerArchetype(archetype("ogre", CombatRole.BRUTE, 1, 1, 3, "brute", "early_game"));
        registry.registerArchetype(archetype("wight", CombatRole.INVOKER, 2, 3, 6, "undead", "caster"));
        registry.registerPack(pack("goblin_pair", 1, "lair", "goblin_skirmisher", "goblin_skirmisher"));
        registry.registerPack(pack("crypt", 2, "graveyard", "wight", "wight"));
        registry.seal();

        Random random = new Random(42);
        EncounterProperties properties = EncounterProperties.defaults();
        EncounterSelectionService selection = new EncounterSelectionService(registry, random);
        EliteVariantService elite = new EliteVariantService(random, properties);
        FloorEncounterService floorEncounters = new FloorEncounterService(registry, selection, elite,
                new PackSynergyService(), random, properties);

        EncounterController controller = new EncounterController(registry, new StatScalingService(registry),
                elite, new ContentValidationService(registry), floorEncounters);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void archetype_by_id() throws Exception {
        mockMvc.perform(get("/api/encounter/archetypes/goblin_skirmisher"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("goblin_skirmisher"))
                .andExpect(jsonPath("$.role").value("SKIRMISHER"))
                .andExpect(jsonPath("$.spawnMaxFloor").value(4));
    }

    @Test
    void unknown_archetype_is_404_with_error_body() throws Exception {
        mockMvc.perform(get("/api/encounter/archetypes/dragon"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").exists());
        mockMvc.perform(get("/api/encounter/packs/nothing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void archetype_filters_intersect() throws Exception {
        mockMvc.perform(get("/api/encounter/archetypes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)));
        mockMvc.perform(get("/api/encounter/archetypes").param("tag", "early_game").param("role", "BRUTE"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("ogre"));
        mockMvc.perform(get("/api/encounter/archetypes").param("minFloor", "5").param("maxFloor", "9"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("wight"));
        mockMvc.perform(get("/api/encounter/archetypes").param("skill", "nimble_step"))
                .andExpect(jsonPath("$[0].id").value("goblin_skirmisher"));
    }

    @Test
    void inverted_range_is_a_bad_request() throws Exception {
        mockMvc.perform(get("/api/encounter/archetypes").param("minDifficulty", "50").param("maxDifficulty", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void scaled_stats_include_elite_version() throws Exception {
        mockMvc.perform(get("/api/encounter/archetypes/goblin_skirmisher/stats").param("floor", "4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.normal.hp").value(13))
                .andExpect(jsonPath("$.normal.attack").value(6))
                .andExpect(jsonPath("$.elite.hp").value(19))
                .andExpect(jsonPath("$.elite.attack").value(7));
    }

    @Test
    void floor_must_be_positive() throws Exception {
        mockMvc.perform(get("/api/encounter/archetypes/goblin_skirmisher/stats").param("floor", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/encounter/preview").param("floor", "abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void packs_filter_by_tier_and_room() throws Exception {
        mockMvc.perform(get("/api/encounter/packs").param("tier", "2"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("crypt"));
        mockMvc.perform(get("/api/encounter/packs").param("roomTag", "lair"))
                .andExpect(jsonPath("$[0].id").value("goblin_pair"));
    }

    @Test
    void floor_info_reports_band_and_eligible_archetypes() throws Exception {
        mockMvc.perform(get("/api/encounter/floors/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value(2))
                .andExpect(jsonPath("$.difficultyRange.min").value(13))
                .andExpect(jsonPath("$.difficultyRange.max").value(43))
                .andExpect(jsonPath("$.eligibleArchetypes", hasSize(3)));
    }

    @Test
    void summary_and_validation() throws Exception {
        mockMvc.perform(get("/api/encounter/summary"))
                .andExpect(jsonPath("$.archetypes").value(3))
                .andExpect(jsonPath("$.packs").value(2));
        mockMvc.perform(get("/api/encounter/validation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallValid").value(true))
                .andExpect(jsonPath("$.orphanedArchetypes[0]").value("ogre"));
    }

    @Test
    void preview_rolls_a_room() throws Exception {
        mockMvc.perform(get("/api/encounter/preview").param("floor", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.floor").value(1))
                .andExpect(jsonPath("$.units").isNotEmpty());
    }
}
