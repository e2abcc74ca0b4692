package com.dcruver.vaultdrift.function;

import com.dcruver.vaultdrift.domain.Link;
import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.session.NoteGraph;
import com.dcruver.vaultdrift.session.ScoredNote;
import com.dcruver.vaultdrift.session.SessionHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.dcruver.vaultdrift.VaultFixtures.note;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FunctionRegistryTest {

    private FunctionRegistry registry;
    private SessionHandle session;

    @BeforeEach
    void setUp() {
        registry = new FunctionRegistry();
        List<Note> notes = List.of(
            note("a.md", "Alpha", LocalDateTime.of(2024, 1, 1, 9, 0)).toBuilder().title("Alpha").build(),
            note("b.md", "Beta", LocalDateTime.of(2024, 6, 1, 9, 0)).toBuilder().title("Beta").build(),
            note("c.md", "Gamma", LocalDateTime.of(2024, 3, 1, 9, 0)).toBuilder().title("Gamma").build());
        Map<String, Note> byId = notes.stream().collect(Collectors.toMap(Note::getId, Function.identity()));

        session = mock(SessionHandle.class);
        when(session.notes()).thenReturn(notes);
        when(session.noteIds()).thenReturn(List.of("a.md", "b.md", "c.md"));
        when(session.note(anyString())).thenAnswer(inv -> Optional.ofNullable(byId.get(inv.<String>getArgument(0))));
        when(session.graph()).thenReturn(new NoteGraph(byId.keySet(),
            List.of(Link.of("a.md", "b.md")), Map.of("c.md", LocalDateTime.of(2024, 3, 1, 9, 0))));
        when(session.sample(anyList(), anyInt(), anyString())).thenAnswer(inv -> {
            List<?> items = inv.getArgument(0);
            int k = inv.getArgument(1);
            return items.subList(0, Math.min(k, items.size()));
        });
    }

    @Test
    void testBuiltInsAreRegistered() {
        assertTrue(registry.names().containsAll(
            List.of("sample_notes", "old_notes", "recent_notes", "orphans", "hubs", "neighbours")));
    }

    @Test
    void testNotesByAge() {
        assertEquals(List.of("Alpha", "Gamma"), registry.call("old_notes", session, List.of("2")));
        assertEquals(List.of("Beta"), registry.call("recent_notes", session, List.of("1")));
    }

    @Test
    void testGraphFunctions() {
        assertEquals(List.of("Gamma"), registry.call("orphans", session, List.of()));
        assertEquals(List.of("Beta"), registry.call("hubs", session, List.of("3")));
        assertEquals(2, registry.call("sample_notes", session, List.of("2")).size());
    }

    @Test
    void testNeighboursByTitle() {
        when(session.neighbours(eq("c.md"), eq(1))).thenReturn(List.of(new ScoredNote("a.md", 0.7)));

        assertEquals(List.of("Alpha"), registry.call("neighbours", session, List.of("gamma", "1")));
        assertTrue(registry.call("neighbours", session, List.of("Nothing")).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> registry.call("neighbours", session, List.of()));
    }

    @Test
    void testBadCalls() {
        assertThrows(IllegalArgumentException.class, () -> registry.call("no_such_function", session, List.of()));
        assertThrows(IllegalArgumentException.class, () -> registry.call("hubs", session, List.of("many")));
        assertThrows(IllegalStateException.class, () -> registry.register("hubs", (s, args) -> List.of()));
    }

    @Test
    void testCustomFunction() {
        registry.register("everything", (s, args) -> s.noteIds());

        assertTrue(registry.has("everything"));
        assertEquals(List.of("a.md", "b.md", "c.md"), registry.call("everything", session, List.of()));
    }
}
