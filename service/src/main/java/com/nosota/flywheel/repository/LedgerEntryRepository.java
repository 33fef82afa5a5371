package com.nosota.flywheel.repository;

import com.nosota.flywheel.model.LedgerEntry;
import com.nosota.flywheel.model.LedgerEntryKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.Optional;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    Optional<LedgerEntry> findByCampaignAndAssetAndKindAndRecipientKey(
            String campaign, String asset, LedgerEntryKind kind, String recipientKey);

    /**
     * Sums all entries of one kind for a campaign and asset. Used for reconciliation
     * against {@link com.nosota.flywheel.model.LedgerTotals}.
     *
     * @return The sum, or {@code null} when there are no entries
     */
    @Query("SELECT SUM(e.amount) FROM LedgerEntry e " +
            "WHERE e.campaign = :campaign AND e.asset = :asset AND e.kind = :kind")
    BigInteger sumAmounts(@Param("campaign") String campaign,
                          @Param("asset") String asset,
                          @Param("kind") LedgerEntryKind kind);
}
