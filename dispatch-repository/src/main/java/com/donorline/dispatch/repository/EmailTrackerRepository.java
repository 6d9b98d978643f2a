package com.donorline.dispatch.repository;

import com.donorline.dispatch.model.EmailTracker;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmailTrackerRepository extends JpaRepository<EmailTracker, String> {
}
