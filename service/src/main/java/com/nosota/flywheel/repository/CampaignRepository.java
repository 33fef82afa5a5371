package com.nosota.flywheel.repository;

import com.nosota.flywheel.model.Campaign;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, String> {

    /**
     * Loads a campaign holding a write lock on its row until the surrounding transaction ends.
     *
     * <p>Every ledger operation goes through this lookup, so operations on the same
     * campaign are serialized.
     *
     * @param address Campaign address
     * @return The locked campaign, or empty if none exists
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Campaign c WHERE c.address = :address")
    Optional<Campaign> findByAddressForUpdate(@Param("address") String address);

    /**
     * Inserts an INACTIVE campaign unless one already lives at the address.
     *
     * <p>A concurrent creator of the same address waits for the first one to commit
     * and then inserts nothing.
     *
     * @return 1 if this call created the campaign, 0 if it already existed
     */
    @Modifying
    @Query(value = """
    INSERT INTO campaign (address, hooks, status, created_at, updated_at)
    VALUES (:address, :hooks, 'INACTIVE', :now, :now)
    ON CONFLICT DO NOTHING
    """, nativeQuery = true)
    int insertIfAbsent(@Param("address") String address,
                       @Param("hooks") String hooks,
                       @Param("now") LocalDateTime now);
}
