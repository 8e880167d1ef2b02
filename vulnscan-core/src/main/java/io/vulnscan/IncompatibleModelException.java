package io.vulnscan;

/**
 * Exception thrown when a persisted index was built by a different embedding
 * model, or at a different width, than the one currently configured.
 */
public class IncompatibleModelException extends RuntimeException {

    private final String expectedModel;
    private final String actualModel;

    public IncompatibleModelException(String expectedModel, int expectedDimensions,
                                      String actualModel, int actualDimensions) {
        super(String.format(
            "Index was built with '%s' (%dd) but '%s' (%dd) is configured",
            actualModel, actualDimensions, expectedModel, expectedDimensions
        ));
        this.expectedModel = expectedModel;
        this.actualModel = actualModel;
    }

    public String getExpectedModel() {
        return expectedModel;
    }

    public String getActualModel() {
        return actualModel;
    }
}
