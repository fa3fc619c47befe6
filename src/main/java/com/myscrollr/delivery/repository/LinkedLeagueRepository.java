package com.myscrollr.delivery.repository;

import com.myscrollr.delivery.model.domain.LinkedLeague;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LinkedLeagueRepository extends JpaRepository<LinkedLeague, String> {

    /**
     * Resolves the user owning a league by joining through the linked account.
     *
     * @param leagueKey league key such as {@code nfl.l.12345}
     * @return the owner's user id if the league is linked
     */
    @Query("""
            select a.userId from LinkedLeague l
            join LinkedAccount a on l.accountGuid = a.guid
            where l.leagueKey = :leagueKey
            """)
    Optional<String> findOwnerByLeagueKey(@Param("leagueKey") String leagueKey);
}
