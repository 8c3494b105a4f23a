package org.cfnrefactor.assets;

public class AssetStagingException extends RuntimeException {
    public AssetStagingException(String message, Throwable cause) {
        super(message, cause);
    }

    public AssetStagingException(String message) {
        super(message);
    }
}
