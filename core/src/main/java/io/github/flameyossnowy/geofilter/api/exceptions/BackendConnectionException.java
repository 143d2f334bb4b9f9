package io.github.flameyossnowy.geofilter.api.exceptions;

/**
 * A store could not be reached, or the connection dropped while a statement was running.
 * Executors retry once with a fresh connection before raising this.
 */
public class BackendConnectionException extends FilterException {
    private final String backendName;

    public BackendConnectionException(String backendName, String message, Throwable cause) {
        super(message, cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
