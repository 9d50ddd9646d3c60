package org.Aayush.roadnet.route;

import lombok.Value;

/**
 * Primary/alternate route pair between two sampled network nodes.
 */
@Value
public class AlternativeRouteSample {
    String originNodeId;
    String destinationNodeId;
    RouteResult primaryRoute;
    RouteResult alternativeRoute;

    /**
     * Extra travel time of the alternate over the primary route.
     */
    public double timeDifferenceSeconds() {
        return alternativeRoute.getTravelTimeSeconds() - primaryRoute.getTravelTimeSeconds();
    }
}
