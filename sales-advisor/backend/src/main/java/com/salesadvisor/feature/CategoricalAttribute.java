package com.salesadvisor.feature;

import java.util.function.Function;

public enum CategoricalAttribute {
    STORE_TYPE("StoreType", DerivedFeatures::storeType),
    ASSORTMENT("Assortment", DerivedFeatures::assortment),
    STATE_HOLIDAY("StateHoliday", DerivedFeatures::stateHoliday);

    private final String columnPrefix;
    private final Function<DerivedFeatures, String> extractor;

    CategoricalAttribute(String columnPrefix, Function<DerivedFeatures, String> extractor) {
        this.columnPrefix = columnPrefix;
        this.extractor = extractor;
    }

    public String columnPrefix() {
        return columnPrefix;
    }

    public String valueOf(DerivedFeatures features) {
        return extractor.apply(features);
    }

    public String columnName(String level) {
        return columnPrefix + "_" + level;
    }
}
