package org.tlin.minilogic;

public class MiniLogicException extends RuntimeException {

    public MiniLogicException(String message) {
        super(message);
    }

    public MiniLogicException(String message, Throwable cause) {
        super(message, cause);
    }

    public MiniLogicException(Throwable cause) {
        super(cause);
    }
}
