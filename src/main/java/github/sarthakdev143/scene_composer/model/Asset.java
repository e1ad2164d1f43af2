package github.sarthakdev143.scene_composer.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Candidate visual owned by an external material store. Tags are normalised to lower case;
 * malformed metadata is kept as-is and simply earns no score.
 */
public record Asset(
        String id,
        AssetKind kind,
        Set<String> tags,
        Integer rating,
        int usageCount,
        String location,
        String description) {

    public Asset {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("asset id is required.");
        }
        id = id.trim();
        tags = normalizeTags(tags);
    }

    public Asset(String id, AssetKind kind, Set<String> tags, Integer rating, int usageCount) {
        this(id, kind, tags, rating, usageCount, null, null);
    }

    public boolean isStillImage() {
        return kind == AssetKind.IMAGE;
    }

    private static Set<String> normalizeTags(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                normalized.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(normalized);
    }
}
