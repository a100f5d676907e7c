package jibe.tools.asyncfsm.api;

/**
 * Thrown when a transition table is rejected at build time. The machine is never returned in that case.
 */
public class ConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Reason reason;

    public ConfigurationException(Reason reason, String machineName) {
        super(reason.getDescription() + ": " + machineName);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        EMPTY_TABLE("No transitions found for state machine"),
        NO_FINISH_TRANSITION("No transition finishes state machine");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}
