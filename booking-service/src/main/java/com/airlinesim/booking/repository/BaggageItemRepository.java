package com.airlinesim.booking.repository;

import com.airlinesim.booking.model.BaggageItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BaggageItemRepository extends JpaRepository<BaggageItem, Long> {

    Optional<BaggageItem> findByTrackingNumber(String trackingNumber);

    boolean existsByTrackingNumber(String trackingNumber);
}
