package com.dcruver.vaultdrift.session;

import com.dcruver.vaultdrift.domain.Link;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Link graph of one session. Path queries never throw: unknown or disconnected notes give
 * {@link #UNREACHABLE}. Breadth-first distance maps are memoized per source for the life of the graph.
 */
public class NoteGraph {

    public static final int UNREACHABLE = -1;

    private final Map<String, Set<String>> outgoing = new TreeMap<>();
    private final Map<String, Set<String>> incoming = new TreeMap<>();
    private final Map<String, LocalDateTime> modified;

    private final Map<String, Map<String, Integer>> directedDistances = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Integer>> undirectedDistances = new ConcurrentHashMap<>();

    public NoteGraph(Collection<String> noteIds, Collection<Link> links, Map<String, LocalDateTime> modified) {
        for (String id : noteIds) {
            outgoing.put(id, new TreeSet<>());
            incoming.put(id, new TreeSet<>());
        }
        for (Link link : links) {
            if (outgoing.containsKey(link.getSourceId()) && outgoing.containsKey(link.getTargetId())
                && !link.getSourceId().equals(link.getTargetId())) {
                outgoing.get(link.getSourceId()).add(link.getTargetId());
                incoming.get(link.getTargetId()).add(link.getSourceId());
            }
        }
        this.modified = modified;
    }

    public boolean contains(String noteId) {
        return outgoing.containsKey(noteId);
    }

    public Set<String> outgoingLinks(String noteId) {
        return Collections.unmodifiableSet(outgoing.getOrDefault(noteId, Set.of()));
    }

    public Set<String> backlinks(String noteId) {
        return Collections.unmodifiableSet(incoming.getOrDefault(noteId, Set.of()));
    }

    /**
     * Directed: true when {@code source} links to {@code target}.
     */
    public boolean hasLink(String source, String target) {
        return outgoing.getOrDefault(source, Set.of()).contains(target);
    }

    /**
     * Linked in either direction.
     */
    public boolean isLinked(String a, String b) {
        return hasLink(a, b) || hasLink(b, a);
    }

    public int outDegree(String noteId) {
        return outgoing.getOrDefault(noteId, Set.of()).size();
    }

    public int inDegree(String noteId) {
        return incoming.getOrDefault(noteId, Set.of()).size();
    }

    public int degree(String noteId) {
        return inDegree(noteId) + outDegree(noteId);
    }

    public int linkCount() {
        return outgoing.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Number of directed hops from a to b; 0 for a note to itself, UNREACHABLE when there is no path.
     */
    public int shortestPathLength(String from, String to) {
        if (!contains(from) || !contains(to)) {
            return UNREACHABLE;
        }
        return directedDistances.computeIfAbsent(from, s -> breadthFirst(s, false)).getOrDefault(to, UNREACHABLE);
    }

    /**
     * Hops ignoring link direction.
     */
    public int undirectedDistance(String a, String b) {
        if (!contains(a) || !contains(b)) {
            return UNREACHABLE;
        }
        return undirectedDistances.computeIfAbsent(a, s -> breadthFirst(s, true)).getOrDefault(b, UNREACHABLE);
    }

    /**
     * Notes within k undirected hops, excluding the note itself.
     */
    public Set<String> kHopNeighbourhood(String noteId, int k) {
        if (!contains(noteId)) {
            return Set.of();
        }
        Map<String, Integer> distances = undirectedDistances.computeIfAbsent(noteId, s -> breadthFirst(s, true));
        return distances.entrySet().stream()
            .filter(e -> e.getValue() > 0 && e.getValue() <= k)
            .map(Map.Entry::getKey)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Most linked-to notes, by number of distinct backlinks.
     */
    public List<String> hubs(int k) {
        return incoming.entrySet().stream()
            .filter(e -> !e.getValue().isEmpty())
            .sorted(Comparator.<Map.Entry<String, Set<String>>>comparingInt(e -> e.getValue().size()).reversed()
                .thenComparing(Map.Entry::getKey))
            .limit(k)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    /**
     * Notes with no links in or out, most recently modified first. k &lt;= 0 returns all of them.
     */
    public List<String> orphans(int k) {
        List<String> orphans = outgoing.keySet().stream()
            .filter(id -> outgoing.get(id).isEmpty() && incoming.get(id).isEmpty())
            .sorted(Comparator.<String, LocalDateTime>comparing(id -> modified.getOrDefault(id, LocalDateTime.MIN))
                .reversed()
                .thenComparing(Comparator.naturalOrder()))
            .collect(Collectors.toList());
        return k > 0 && orphans.size() > k ? orphans.subList(0, k) : orphans;
    }

    /**
     * Weakly connected components, largest first.
     */
    public List<Set<String>> connectedComponents() {
        Set<String> seen = new LinkedHashSet<>();
        List<Set<String>> components = new ArrayList<>();
        for (String id : outgoing.keySet()) {
            if (seen.contains(id)) {
                continue;
            }
            Set<String> component = new TreeSet<>(breadthFirst(id, true).keySet());
            seen.addAll(component);
            components.add(component);
        }
        components.sort(Comparator.<Set<String>>comparingInt(Set::size).reversed()
            .thenComparing(c -> c.iterator().next()));
        return components;
    }

    private Map<String, Integer> breadthFirst(String source, boolean undirected) {
        Map<String, Integer> distances = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        distances.put(source, 0);
        queue.add(source);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = distances.get(current) + 1;
            List<String> neighbours = new ArrayList<>(outgoing.get(current));
            if (undirected) {
                neighbours.addAll(incoming.get(current));
            }
            for (String neighbour : neighbours) {
                if (!distances.containsKey(neighbour)) {
                    distances.put(neighbour, next);
                    queue.add(neighbour);
                }
            }
        }
        return distances;
    }
}
