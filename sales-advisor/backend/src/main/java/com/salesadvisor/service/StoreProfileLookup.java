package com.salesadvisor.service;

import com.salesadvisor.entity.StoreProfile;

import java.util.Optional;

public interface StoreProfileLookup {

    Optional<StoreProfile> findStore(int storeId);
}
