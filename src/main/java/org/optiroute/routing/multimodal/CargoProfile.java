package org.optiroute.routing.multimodal;

import lombok.Builder;
import lombok.Value;

/**
 * Physical profile of a point-to-point shipment.
 */
@Value
@Builder
public class CargoProfile {
    double weightKg;
    double volumeM3;
    String description;

    public double weightTonnes() {
        return weightKg / 1_000.0d;
    }
}
