package fun.fengwk.ttp.core.service.browser.runtime;

/**
 * Outcome of one navigation in a browser handle.
 *
 * @param status navigation status
 * @param html rendered document, only present when loaded
 * @param message failure message, empty when loaded
 * @param cause underlying engine failure, may be null
 * @author fengwk
 */
public record NavigationResult(Status status, String html, String message, Throwable cause) {

    public enum Status {

        LOADED,

        /**
         * Navigation or load-state wait exceeded the handle timeout.
         */
        TIMEOUT,

        /**
         * Engine reported an error: crash, closed target, network failure.
         */
        ENGINE_FAILURE,

        /**
         * Failure outside the engine's own error types.
         */
        UNEXPECTED

    }

    public static NavigationResult loaded(String html) {
        return new NavigationResult(Status.LOADED, html == null ? "" : html, "", null);
    }

    public static NavigationResult timeout(String message, Throwable cause) {
        return new NavigationResult(Status.TIMEOUT, null, message, cause);
    }

    public static NavigationResult engineFailure(String message, Throwable cause) {
        return new NavigationResult(Status.ENGINE_FAILURE, null, message, cause);
    }

    public static NavigationResult unexpected(String message, Throwable cause) {
        return new NavigationResult(Status.UNEXPECTED, null, message, cause);
    }

    public boolean isLoaded() {
        return status == Status.LOADED;
    }

}
