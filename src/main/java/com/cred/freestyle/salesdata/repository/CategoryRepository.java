package com.cred.freestyle.salesdata.repository;

import com.cred.freestyle.salesdata.domain.model.Category;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Category entity.
 *
 * @author Sales Data Team
 */
@Repository
public interface CategoryRepository extends JpaRepository<Category, String> {

    /**
     * Find category by slug (natural key).
     *
     * @param slug Category slug
     * @return Optional containing the category if found
     */
    Optional<Category> findBySlug(String slug);
}
