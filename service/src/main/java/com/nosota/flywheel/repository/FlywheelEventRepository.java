package com.nosota.flywheel.repository;

import com.nosota.flywheel.api.model.FlywheelEventType;
import com.nosota.flywheel.model.FlywheelEvent;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FlywheelEventRepository extends JpaRepository<FlywheelEvent, Long> {

    Page<FlywheelEvent> findByCampaignOrderByIdAsc(String campaign, Pageable pageable);

    List<FlywheelEvent> findByCampaignAndTypeOrderByIdAsc(String campaign, FlywheelEventType type);

    long countByCampaign(String campaign);
}
