package com.marketplace.realtime.repository;

import com.marketplace.realtime.model.Listing;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ListingRepository extends JpaRepository<Listing, String> {
}
