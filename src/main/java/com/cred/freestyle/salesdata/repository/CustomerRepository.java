package com.cred.freestyle.salesdata.repository;

import com.cred.freestyle.salesdata.domain.model.Customer;
import com.cred.freestyle.salesdata.domain.model.Customer.CustomerRole;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Customer entity.
 *
 * @author Sales Data Team
 */
@Repository
public interface CustomerRepository extends JpaRepository<Customer, String> {

    /**
     * Find customer by username (natural key).
     *
     * @param username Username
     * @return Optional containing the customer if found
     */
    Optional<Customer> findByUsername(String username);

    /**
     * Find customers with a role, one page at a time.
     *
     * @param role Customer role
     * @param pageable Page request (size caps the pool)
     * @return List of customers
     */
    List<Customer> findByRole(CustomerRole role, Pageable pageable);

    long countByRole(CustomerRole role);
}
