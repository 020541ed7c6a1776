package uk.gegc.planconfigurator.features.workflow.domain.model;

/**
 * Outcome of a next-step resolver: another step, or the "done" marker.
 */
public record NextStep(String stepId, boolean done) {

    private static final NextStep DONE = new NextStep(null, true);

    public static NextStep to(String stepId) {
        return new NextStep(stepId, false);
    }

    public static NextStep finished() {
        return DONE;
    }
}
