package org.optiroute.routing.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.optiroute.routing.model.FuelType;

import java.util.Map;

/**
 * Unit fuel prices per fuel type for one region.
 *
 * <p>Liquid fuels are priced per liter, electricity per kWh.</p>
 */
@Value
@Builder(toBuilder = true)
public class FuelPrices {
    String region;
    @Singular
    Map<FuelType, Double> prices;

    /**
     * Returns the unit price for a fuel type.
     *
     * @throws IllegalStateException when the snapshot carries no price for {@code fuelType}.
     */
    public double price(FuelType fuelType) {
        Double price = prices.get(fuelType);
        if (price == null) {
            throw new IllegalStateException("no fuel price for " + fuelType + " in region " + region);
        }
        return price;
    }

    /**
     * Returns a copy with every price multiplied by {@code factor}.
     */
    public FuelPrices scaled(double factor) {
        FuelPricesBuilder builder = FuelPrices.builder().region(region);
        for (Map.Entry<FuelType, Double> entry : prices.entrySet()) {
            builder.price(entry.getKey(), entry.getValue() * factor);
        }
        return builder.build();
    }
}
