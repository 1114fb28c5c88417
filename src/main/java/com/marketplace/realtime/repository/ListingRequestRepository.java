package com.marketplace.realtime.repository;

import com.marketplace.realtime.model.ListingRequest;
import com.marketplace.realtime.model.RequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface ListingRequestRepository extends JpaRepository<ListingRequest, String> {

    @Query("select new com.marketplace.realtime.repository.ExpirationCandidate("
            + "r.id, r.clientId, r.providerId, l.title, r.preferredDate, r.preferredTime) "
            + "from ListingRequest r left join Listing l on l.id = r.listingId "
            + "where r.status = :status and r.createdAt < :cutoff")
    List<ExpirationCandidate> findCandidatesCreatedBefore(@Param("status") RequestStatus status,
                                                          @Param("cutoff") Instant cutoff);

    @Query("select new com.marketplace.realtime.repository.ExpirationCandidate("
            + "r.id, r.clientId, r.providerId, l.title, r.preferredDate, r.preferredTime) "
            + "from ListingRequest r left join Listing l on l.id = r.listingId "
            + "where r.status = :status and r.preferredDate is not null")
    List<ExpirationCandidate> findCandidatesWithPreferredDate(@Param("status") RequestStatus status);

    /**
     * Bulk status change for the given ids. Rows are not re-checked or locked
     * between the candidate read and this update.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ListingRequest r set r.status = :status, r.providerResponse = :response, "
            + "r.updatedAt = :updatedAt where r.id in :ids")
    int updateStatus(@Param("ids") Collection<String> ids,
                     @Param("status") RequestStatus status,
                     @Param("response") String response,
                     @Param("updatedAt") Instant updatedAt);
}
