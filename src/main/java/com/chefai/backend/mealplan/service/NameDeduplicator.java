package com.chefai.backend.mealplan.service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run-scoped recipe-name bookkeeping shared by all generation tasks of one run.
 * <p>
 * Two sets are kept apart:
 * <ul>
 *   <li>history: names the user already has. Handed to the generator as excludeNames only;
 *       a draft that still comes back with one of them is accepted.</li>
 *   <li>claimed: names taken by this run. {@link #claim(String)} is a single add-if-absent
 *       step on this set, so two tasks that finish with the same name cannot both win.</li>
 * </ul>
 * {@link #strict(Collection)} builds a deduplicator that also refuses history names
 * (single-slot regeneration). Names compare trimmed and case-insensitively.
 */
public class NameDeduplicator {

    /** key = normalized name, value = name as first seen */
    private final Map<String, String> history = new LinkedHashMap<>();
    private final Map<String, String> claimed = new ConcurrentHashMap<>();

    public NameDeduplicator(Collection<String> historicalNames) {
        this(historicalNames, false);
    }

    private NameDeduplicator(Collection<String> historicalNames, boolean rejectHistory) {
        if (historicalNames != null) {
            for (String n : historicalNames) {
                if (n == null || n.isBlank()) continue;
                history.putIfAbsent(key(n), n.trim());
                if (rejectHistory) claimed.putIfAbsent(key(n), n.trim());
            }
        }
    }

    /** History names are rejected on claim as well, not only excluded. */
    public static NameDeduplicator strict(Collection<String> historicalNames) {
        return new NameDeduplicator(historicalNames, true);
    }

    /** @return true if this call took the name, false if this run already holds it */
    public boolean claim(String name) {
        if (name == null || name.isBlank()) return false;
        return claimed.putIfAbsent(key(name), name.trim()) == null;
    }

    public boolean isClaimed(String name) {
        return name != null && claimed.containsKey(key(name));
    }

    /** Point-in-time copy (history + claimed) handed to the generator as excludeNames. */
    public List<String> snapshot() {
        Map<String, String> all = new LinkedHashMap<>(history);
        claimed.forEach(all::putIfAbsent);
        return List.copyOf(all.values());
    }

    /** Names claimed so far (history excluded unless strict). */
    public int claimedCount() {
        return claimed.size();
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
