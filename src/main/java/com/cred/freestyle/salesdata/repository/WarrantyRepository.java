package com.cred.freestyle.salesdata.repository;

import com.cred.freestyle.salesdata.domain.model.Warranty;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Warranty entity.
 *
 * @author Sales Data Team
 */
@Repository
public interface WarrantyRepository extends JpaRepository<Warranty, String> {

    Optional<Warranty> findByName(String name);
}
