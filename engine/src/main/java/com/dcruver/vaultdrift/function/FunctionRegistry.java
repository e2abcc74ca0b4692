package com.dcruver.vaultdrift.function;

import com.dcruver.vaultdrift.domain.Note;
import com.dcruver.vaultdrift.session.ScoredNote;
import com.dcruver.vaultdrift.session.SessionHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Vault functions by name. The built-ins are registered on construction, everything else by explicit
 * {@link #register} calls. Functions return note titles.
 */
@Component
@Slf4j
public class FunctionRegistry {

    private static final int DEFAULT_COUNT = 5;

    private final Map<String, VaultFunction> functions = new LinkedHashMap<>();

    public FunctionRegistry() {
        register("sample_notes", (session, args) ->
            titles(session, session.sample(session.noteIds(), intArg(args, 0, DEFAULT_COUNT), "sample_notes")));
        register("old_notes", (session, args) ->
            titles(session, byModified(session, false, intArg(args, 0, DEFAULT_COUNT))));
        register("recent_notes", (session, args) ->
            titles(session, byModified(session, true, intArg(args, 0, DEFAULT_COUNT))));
        register("orphans", (session, args) ->
            titles(session, session.graph().orphans(intArg(args, 0, DEFAULT_COUNT))));
        register("hubs", (session, args) ->
            titles(session, session.graph().hubs(intArg(args, 0, DEFAULT_COUNT))));
        register("neighbours", (session, args) -> {
            if (args.isEmpty()) {
                throw new IllegalArgumentException("neighbours needs a note title");
            }
            Optional<String> noteId = resolve(session, args.get(0));
            if (noteId.isEmpty()) {
                return List.of();
            }
            return titles(session, session.neighbours(noteId.get(), intArg(args, 1, 3)).stream()
                .map(ScoredNote::getNoteId)
                .collect(Collectors.toList()));
        });
    }

    public synchronized void register(String name, VaultFunction function) {
        if (functions.containsKey(name)) {
            throw new IllegalStateException("Vault function already registered: " + name);
        }
        functions.put(name, function);
        log.debug("Registered vault function {}", name);
    }

    /**
     * @throws IllegalArgumentException for an unknown function or bad arguments
     */
    public List<String> call(String name, SessionHandle session, List<String> args) {
        VaultFunction function = functions.get(name);
        if (function == null) {
            throw new IllegalArgumentException("Unknown vault function: " + name);
        }
        return function.apply(session, args);
    }

    public boolean has(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    private static List<String> byModified(SessionHandle session, boolean newestFirst, int k) {
        Comparator<Note> order = Comparator.comparing(Note::getModified, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()));
        if (newestFirst) {
            order = order.reversed();
        }
        return session.notes().stream()
            .sorted(order.thenComparing(Note::getId))
            .limit(k)
            .map(Note::getId)
            .collect(Collectors.toList());
    }

    private static Optional<String> resolve(SessionHandle session, String titleOrId) {
        if (session.note(titleOrId).isPresent()) {
            return Optional.of(titleOrId);
        }
        return session.notes().stream()
            .filter(n -> titleOrId.equalsIgnoreCase(n.getTitle()))
            .map(Note::getId)
            .sorted()
            .findFirst();
    }

    private static List<String> titles(SessionHandle session, List<String> noteIds) {
        return noteIds.stream()
            .map(id -> session.note(id).map(Note::getTitle).orElse(id))
            .collect(Collectors.toList());
    }

    private static int intArg(List<String> args, int index, int defaultValue) {
        if (args.size() <= index || args.get(index).isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(args.get(index).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number but got '" + args.get(index) + "'", e);
        }
    }
}
