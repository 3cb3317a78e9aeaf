package com.cred.freestyle.salesdata.repository;

import com.cred.freestyle.salesdata.domain.model.Brand;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Brand entity.
 *
 * @author Sales Data Team
 */
@Repository
public interface BrandRepository extends JpaRepository<Brand, String> {

    Optional<Brand> findByName(String name);
}
