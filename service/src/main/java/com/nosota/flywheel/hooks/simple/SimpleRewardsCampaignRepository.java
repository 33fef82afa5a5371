package com.nosota.flywheel.hooks.simple;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SimpleRewardsCampaignRepository extends JpaRepository<SimpleRewardsCampaign, String> {
}
