package com.salesadvisor.repository;

import com.salesadvisor.entity.StoreProfile;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StoreProfileRepository extends JpaRepository<StoreProfile, Integer> {
}
