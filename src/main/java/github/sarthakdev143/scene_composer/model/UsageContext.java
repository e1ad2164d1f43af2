package github.sarthakdev143.scene_composer.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Counts of assets already placed earlier in the current composition run. Instances are
 * immutable; {@link #withUse(String)} returns a new context.
 */
public final class UsageContext {

    private static final UsageContext EMPTY = new UsageContext(Map.of());

    private final Map<String, Integer> usesInRun;

    private UsageContext(Map<String, Integer> usesInRun) {
        this.usesInRun = usesInRun;
    }

    public static UsageContext empty() {
        return EMPTY;
    }

    public int usesInRun(String assetId) {
        return usesInRun.getOrDefault(assetId, 0);
    }

    public UsageContext withUse(String assetId) {
        Map<String, Integer> next = new HashMap<>(usesInRun);
        next.merge(assetId, 1, Integer::sum);
        return new UsageContext(Collections.unmodifiableMap(next));
    }
}
