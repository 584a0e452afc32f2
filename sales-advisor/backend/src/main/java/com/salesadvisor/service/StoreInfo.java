package com.salesadvisor.service;

import com.salesadvisor.entity.StoreProfile;

public record StoreInfo(int storeId, String storeType, String assortment) {

    public static StoreInfo of(StoreProfile profile) {
        return new StoreInfo(profile.getStoreId(), profile.getStoreType(), profile.getAssortment());
    }
}
