package github.sarthakdev143.scene_composer.service;

public class AssetSearchException extends RuntimeException {

    public AssetSearchException(String message) {
        super(message);
    }

    public AssetSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
