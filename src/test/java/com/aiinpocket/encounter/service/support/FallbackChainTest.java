package com.aiinpocket.encounter.service.support;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FallbackChainTest {

    @Test
    void first_present_wins_and_later_strategies_are_skipped() {
        List<String> called = new ArrayList<>();
        Optional<String> result = FallbackChain.<String>firstPresent(List.of(
                () -> { called.add("one"); return Optional.empty(); },
                () -> { called.add("two"); return Optional.of("second"); },
                () -> { called.add("three"); return Optional.of("third"); }
        ));

        assertEquals(Optional.of("second"), result);
        assertEquals(List.of("one", "two"), called);
    }

    @Test
    void all_empty_yields_empty() {
        assertTrue(FallbackChain.<String>firstPresent(List.of(Optional::empty, Optional::empty)).isEmpty());
    }

    @Test
    void empty_list_counts_as_no_result() {
        assertTrue(FallbackChain.nonEmpty(List.of()).isEmpty());
        assertEquals(Optional.of(List.of(1)), FallbackChain.nonEmpty(List.of(1)));
    }
}
