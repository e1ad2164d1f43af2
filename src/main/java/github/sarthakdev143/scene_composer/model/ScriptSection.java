package github.sarthakdev143.scene_composer.model;

/**
 * One narrated beat of a script. Structural checks (unique indexes, positive durations) happen
 * in the script validator so that a whole script can be rejected with a single message.
 */
public record ScriptSection(
        int index,
        SectionLabel label,
        String name,
        String narration,
        String visualHint,
        double targetDuration,
        boolean staticVisual) {

    public ScriptSection {
        label = label == null ? SectionLabel.CUSTOM : label;
        narration = narration == null ? "" : narration;
        visualHint = visualHint == null || visualHint.isBlank() ? null : visualHint;
    }

    public ScriptSection(int index, SectionLabel label, String narration, double targetDuration) {
        this(index, label, null, narration, null, targetDuration, false);
    }
}
