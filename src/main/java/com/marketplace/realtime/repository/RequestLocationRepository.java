package com.marketplace.realtime.repository;

import com.marketplace.realtime.model.RequestLocation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RequestLocationRepository extends JpaRepository<RequestLocation, Long> {

    List<RequestLocation> findByRequestIdAndActiveTrue(String requestId);
}
