package com.leadnurture.repository;

import com.leadnurture.model.Lead;
import com.leadnurture.model.LeadStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Database access for Lead entities.
 *
 * findByStatusInAndOptedOutFalse([NEW, CONTACTED])
 * → SELECT * FROM leads WHERE status IN (?, ?) AND opted_out = false
 */
public interface LeadRepository extends JpaRepository<Lead, UUID> {

    List<Lead> findByStatusInAndOptedOutFalse(Collection<LeadStatus> statuses);

    List<Lead> findByStatusIn(Collection<LeadStatus> statuses);
}
