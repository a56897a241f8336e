package me.golemcore.webai.domain.service;

import me.golemcore.webai.domain.model.ConversationTurn;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HistoryCondenserTest {

    private static final int CHAR_LIMIT = 800;

    @Test
    void shouldKeepOnlyLastTurnsWithinLimit() {
        List<ConversationTurn> history = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            history.add(ConversationTurn.user("m" + i));
        }

        List<String> condensed = HistoryCondenser.condense(history, 4, CHAR_LIMIT);

        assertEquals(List.of("m3", "m4", "m5", "m6"), condensed);
    }

    @Test
    void shouldKeepAllTurnsWhenHistoryIsShorterThanLimit() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("hello"),
                ConversationTurn.assistant("hi"));

        assertEquals(List.of("hello", "hi"), HistoryCondenser.condense(history, 10, CHAR_LIMIT));
    }

    @Test
    void shouldTruncateLongTurnsWithMarker() {
        String longText = "x".repeat(900);

        List<String> condensed = HistoryCondenser.condense(List.of(ConversationTurn.user(longText)), 4, CHAR_LIMIT);

        assertEquals(1, condensed.size());
        assertEquals(CHAR_LIMIT + 1, condensed.get(0).length());
        assertTrue(condensed.get(0).endsWith(HistoryCondenser.TRUNCATION_MARKER));
        assertEquals("x".repeat(CHAR_LIMIT), condensed.get(0).substring(0, CHAR_LIMIT));
    }

    @Test
    void shouldBeStableWhenCondensingCondensedHistory() {
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("z".repeat(900)),
                ConversationTurn.assistant("short reply"));

        List<String> once = HistoryCondenser.condense(history, 4, CHAR_LIMIT);
        List<ConversationTurn> condensedTurns = once.stream().map(ConversationTurn::user).toList();
        List<String> twice = HistoryCondenser.condense(condensedTurns, 4, CHAR_LIMIT);

        assertEquals(once, twice);
    }

    @Test
    void shouldNotMarkTurnOfExactlyCharLimit() {
        String exact = "y".repeat(CHAR_LIMIT);

        List<String> condensed = HistoryCondenser.condense(List.of(ConversationTurn.user(exact)), 4, CHAR_LIMIT);

        assertEquals(exact, condensed.get(0));
    }

    @Test
    void shouldReturnEmptyForMissingHistory() {
        assertTrue(HistoryCondenser.condense(null, 4, CHAR_LIMIT).isEmpty());
        assertTrue(HistoryCondenser.condense(List.of(), 4, CHAR_LIMIT).isEmpty());
    }

    @Test
    void shouldReturnEmptyWhenLimitIsZero() {
        assertTrue(HistoryCondenser.condense(List.of(ConversationTurn.user("a")), 0, CHAR_LIMIT).isEmpty());
    }

    @Test
    void shouldMapMissingContentToEmptyString() {
        ConversationTurn blank = new ConversationTurn(ConversationTurn.Role.USER, null, null);

        assertEquals(List.of(""), HistoryCondenser.condense(List.of(blank), 4, CHAR_LIMIT));
    }
}
