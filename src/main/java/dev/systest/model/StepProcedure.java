package dev.systest.model;

import java.util.Map;

/**
 * The test logic of a step.
 */
@FunctionalInterface
public interface StepProcedure {

    /**
     * @param inputs resolved inputs, keyed as declared; values may be null
     * @param scope  assertion recorder and cleanup handle for this step
     * @return the step result, folded into the context by the step's output spec
     */
    Object run(Map<String, Object> inputs, StepScope scope) throws Exception;
}
