package com.nosota.flywheel.repository;

import com.nosota.flywheel.model.AssetHolding;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.Optional;

@Repository
public interface AssetHoldingRepository extends JpaRepository<AssetHolding, Long> {

    /**
     * Reads a balance without loading the entity, so a later locked read returns fresh state.
     */
    @Query("SELECT h.balance FROM AssetHolding h WHERE h.holder = :holder AND h.asset = :asset")
    Optional<BigInteger> findBalance(@Param("holder") String holder, @Param("asset") String asset);

    /**
     * Loads a holding with a write lock on its row until the surrounding transaction ends.
     * Every balance change goes through this method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM AssetHolding h WHERE h.holder = :holder AND h.asset = :asset")
    Optional<AssetHolding> findForUpdate(@Param("holder") String holder, @Param("asset") String asset);

    /**
     * Creates an empty holding unless one exists. Concurrent callers never fail on the
     * unique (holder, asset) key.
     *
     * @return 1 if a row was inserted, 0 if it already existed
     */
    @Modifying
    @Query(value = """
    INSERT INTO asset_holding (holder, asset, balance, updated_at)
    VALUES (:holder, :asset, 0, CURRENT_TIMESTAMP)
    ON CONFLICT DO NOTHING
    """, nativeQuery = true)
    int insertIfAbsent(@Param("holder") String holder, @Param("asset") String asset);
}
