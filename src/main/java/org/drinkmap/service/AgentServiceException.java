package org.drinkmap.service;

/**
 * Thrown when the agent runtime cannot be reached or answers with an unusable response.
 */
public class AgentServiceException extends RuntimeException {

    private final int status;

    public AgentServiceException(final String message, final int status) {
        super(message);
        this.status = status;
    }

    public AgentServiceException(final String message, final Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /**
     * @return The HTTP status the agent runtime answered with, or -1 if it never answered.
     */
    public int getStatus() {
        return status;
    }
}
