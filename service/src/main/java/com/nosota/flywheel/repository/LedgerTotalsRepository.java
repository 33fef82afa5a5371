package com.nosota.flywheel.repository;

import com.nosota.flywheel.model.LedgerTotals;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LedgerTotalsRepository extends JpaRepository<LedgerTotals, Long> {
    Optional<LedgerTotals> findByCampaignAndAsset(String campaign, String asset);
}
