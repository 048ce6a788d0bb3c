package com.costwatch.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a recurring business cost. Comparisons between records are always
 * scoped to a single cost type.
 */
public enum CostType {
    ELECTRICITY("electricity"),
    NATURAL_GAS("natural_gas"),
    HEATING_OIL("heating_oil"),
    DISTRICT_HEATING("district_heating"),
    DISTRICT_COOLING("district_cooling"),
    WATER("water"),
    SEWAGE("sewage"),
    WASTE("waste"),
    FUEL_DIESEL("fuel_diesel"),
    FUEL_PETROL("fuel_petrol"),
    FUEL_LPG("fuel_lpg"),
    FUEL_ELECTRIC("fuel_electric"),
    TELECOM_MOBILE("telecom_mobile"),
    TELECOM_LANDLINE("telecom_landline"),
    TELECOM_INTERNET("telecom_internet"),
    RENT("rent"),
    OPERATING_COSTS("operating_costs"),
    MAINTENANCE("maintenance"),
    INSURANCE("insurance"),
    IT_LICENSES("it_licenses"),
    IT_CLOUD("it_cloud"),
    IT_HARDWARE("it_hardware"),
    SUPPLIER_RECURRING("supplier_recurring"),
    OTHER("other");

    private final String id;

    CostType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static CostType fromId(String id) {
        for (CostType type : values()) {
            if (type.id.equalsIgnoreCase(id) || type.name().equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown cost type: " + id);
    }
}
