package com.donorline.dispatch.repository;

import com.donorline.dispatch.model.LinkTracker;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LinkTrackerRepository extends JpaRepository<LinkTracker, String> {
}
