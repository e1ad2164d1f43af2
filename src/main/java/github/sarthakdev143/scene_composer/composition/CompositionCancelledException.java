package github.sarthakdev143.scene_composer.composition;

public class CompositionCancelledException extends RuntimeException {

    public CompositionCancelledException(String message) {
        super(message);
    }
}
