package com.myscrollr.delivery.repository;

import com.myscrollr.delivery.model.domain.LinkedAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LinkedAccountRepository extends JpaRepository<LinkedAccount, String> {

    /**
     * Resolves the owning user of an external account guid.
     */
    @Query("select a.userId from LinkedAccount a where a.guid = :guid")
    Optional<String> findOwnerByGuid(@Param("guid") String guid);
}
