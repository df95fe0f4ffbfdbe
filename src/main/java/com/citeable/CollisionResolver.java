package com.citeable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns citations contributed independently into a duplicate-free list with unique keys.
 *
 * <p>Dedup policy: first occurrence wins. Two citations are duplicates when they are
 * {@link Citation#equals(Object) equal}, i.e. identical apart from {@code key} and {@code app}.
 *
 * <p>Key policy: each retained citation has a base key, its explicit key if it has one and the
 * generated {@code Surname.Year} otherwise. A base key held by one citation is used as is. A base
 * key shared by several gets {@code .a}, {@code .b}, ... in input order; past {@code .z} the
 * suffixes continue {@code .aa}, {@code .ab}, ... A suffix whose key is already held by another
 * citation is skipped, so no two results share a key.
 *
 * <p>The input is never mutated: the result holds copies with their keys set. Resolving a
 * resolved list again changes nothing.
 */
public final class CollisionResolver {

    private static final Logger log = LoggerFactory.getLogger(CollisionResolver.class);

    private CollisionResolver() {
    }

    /**
     * A dropped duplicate.
     *
     * @param droppedIndex position of the dropped citation in the input
     * @param keptIndex    position of the earlier, equal citation that was retained
     * @param dropped      the dropped citation itself
     */
    public record DuplicateRecord(int droppedIndex, int keptIndex, Citation dropped) {}

    public record Result(List<Citation> citations, int totalEntries, List<DuplicateRecord> duplicates) {

        public int uniqueCount() {
            return citations.size();
        }

        public int duplicateCount() {
            return duplicates.size();
        }
    }

    public static List<Citation> assignUniqueKeys(List<? extends Citation> citations) {
        return resolve(citations).citations();
    }

    public static Result resolve(List<? extends Citation> citations) {
        Map<Citation, Integer> firstSeen = new HashMap<>();
        List<Citation> retained = new ArrayList<>();
        List<DuplicateRecord> duplicates = new ArrayList<>();

        for (int i = 0; i < citations.size(); i++) {
            Citation c = Objects.requireNonNull(citations.get(i), "citation at index " + i);
            Integer kept = firstSeen.get(c);
            if (kept != null) {
                log.debug("Dropping citation {} ({}): duplicates citation {}", i, c.key(), kept);
                duplicates.add(new DuplicateRecord(i, kept, c));
                continue;
            }
            firstSeen.put(c, i);
            retained.add(c.copy());
        }

        Map<String, List<Citation>> groups = new LinkedHashMap<>();
        for (Citation c : retained) {
            groups.computeIfAbsent(baseKey(c), k -> new ArrayList<>()).add(c);
        }

        // Unshared base keys are final; suffixed keys must not land on one of them.
        Set<String> taken = new HashSet<>();
        for (Map.Entry<String, List<Citation>> group : groups.entrySet()) {
            if (group.getValue().size() == 1) {
                group.getValue().get(0).assignKey(group.getKey());
                taken.add(group.getKey());
            }
        }

        for (Map.Entry<String, List<Citation>> group : groups.entrySet()) {
            List<Citation> members = group.getValue();
            if (members.size() == 1) continue;
            log.debug("Key {} is shared by {} citations; suffixing", group.getKey(), members.size());
            int next = 0;
            for (Citation member : members) {
                String candidate = group.getKey() + "." + suffix(next++);
                while (!taken.add(candidate)) {
                    log.debug("Suffixed key {} is already taken; skipping", candidate);
                    candidate = group.getKey() + "." + suffix(next++);
                }
                member.assignKey(candidate);
            }
        }

        return new Result(List.copyOf(retained), citations.size(), List.copyOf(duplicates));
    }

    static String baseKey(Citation c) {
        String explicit = c.explicitKey();
        return explicit != null ? explicit : KeyGenerator.generateKey(c);
    }

    /**
     * Letter suffix for the {@code index}-th member of a collision group: a..z, then aa..az, ba..
     */
    static String suffix(int index) {
        StringBuilder sb = new StringBuilder();
        int n = index;
        do {
            sb.append((char) ('a' + n % 26));
            n = n / 26 - 1;
        } while (n >= 0);
        return sb.reverse().toString();
    }
}
