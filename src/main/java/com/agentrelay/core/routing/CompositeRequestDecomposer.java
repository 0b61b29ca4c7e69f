package com.agentrelay.core.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Tries each decomposer in order. The first one that yields tasks wins; otherwise the first
 * rejection is reported.
 */
public class CompositeRequestDecomposer implements RequestDecomposer {

    private static final Logger log = LoggerFactory.getLogger(CompositeRequestDecomposer.class);

    public static final String NO_TARGETS = "Could not determine any worker targets for the request.";

    private final List<RequestDecomposer> delegates;

    public CompositeRequestDecomposer(List<RequestDecomposer> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public Decomposition decompose(SupervisorRequest request) {
        Decomposition firstRejection = null;
        for (RequestDecomposer delegate : delegates) {
            Decomposition d = delegate.decompose(request);
            if (d.hasTasks()) {
                log.debug("{} claimed request with {} task(s)", delegate.getClass().getSimpleName(), d.tasks().size());
                return d;
            }
            if (d.isRejected() && firstRejection == null) {
                firstRejection = d;
            }
        }
        return firstRejection != null ? firstRejection : Decomposition.rejected(null, NO_TARGETS);
    }
}
