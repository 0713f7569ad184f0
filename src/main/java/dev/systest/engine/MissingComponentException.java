package dev.systest.engine;

/**
 * A step asked for a component the system does not have.
 */
public class MissingComponentException extends RuntimeException {

    private final String componentKey;

    public MissingComponentException(String componentKey) {
        super("No component '" + componentKey + "' in system");
        this.componentKey = componentKey;
    }

    public String componentKey() {
        return componentKey;
    }
}
