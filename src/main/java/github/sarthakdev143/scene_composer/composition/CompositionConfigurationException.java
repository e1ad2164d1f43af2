package github.sarthakdev143.scene_composer.composition;

/**
 * Raised before any processing when a script is structurally unusable.
 */
public class CompositionConfigurationException extends IllegalArgumentException {

    public CompositionConfigurationException(String message) {
        super(message);
    }
}
