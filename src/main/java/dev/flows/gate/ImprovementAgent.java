package dev.flows.gate;

/**
 * Produces a revised version of content from evaluation feedback.
 */
@FunctionalInterface
public interface ImprovementAgent {

    /**
     * @param iteration one-based feedback loop iteration that produced the feedback
     */
    String improve(String originalRequest, String currentContent, String feedback, int iteration) throws Exception;
}
