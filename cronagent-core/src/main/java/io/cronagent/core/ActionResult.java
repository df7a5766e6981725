package io.cronagent.core;

/**
 * Reply of the external action runtime.
 */
public record ActionResult(boolean ok, String error) {

    public static ActionResult success() {
        return new ActionResult(true, null);
    }

    public static ActionResult failure(String error) {
        return new ActionResult(false, error);
    }
}
