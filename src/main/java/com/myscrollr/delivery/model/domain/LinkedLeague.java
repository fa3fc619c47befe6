package com.myscrollr.delivery.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "LINKED_LEAGUE")
public class LinkedLeague {

    @Id
    @Column(name = "league_key", length = 64)
    private String leagueKey;

    @Column(name = "account_guid", nullable = false, length = 64)
    private String accountGuid;

    public LinkedLeague(String leagueKey, String accountGuid) {
        this.leagueKey = leagueKey;
        this.accountGuid = accountGuid;
    }
}
