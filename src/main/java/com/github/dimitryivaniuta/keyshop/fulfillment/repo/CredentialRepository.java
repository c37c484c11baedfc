package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Credential;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link Credential}.
 */
public interface CredentialRepository extends JpaRepository<Credential, Long> {

    List<Credential> findByOwnerIdOrderById(Long ownerId);

    boolean existsByUniqueIdentity(String uniqueIdentity);

    @Query("select c.id from Credential c order by c.id")
    List<Long> findAllIds();

    /**
     * Sets {@code missing_since} only if it is still unset.
     *
     * @return rows changed
     */
    @Modifying
    @Query(value = "update credentials set missing_since = :now where id = :id and missing_since is null", nativeQuery = true)
    int markMissing(@Param("id") Long id, @Param("now") Instant now);

    /**
     * Clears {@code missing_since}.
     *
     * @return rows changed
     */
    @Modifying
    @Query(value = "update credentials set missing_since = null where id = :id and missing_since is not null", nativeQuery = true)
    int clearMissing(@Param("id") Long id);
}
