package com.myscrollr.delivery.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Links an external provider account (identified by its guid) to the user that owns it.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "LINKED_ACCOUNT")
public class LinkedAccount {

    @Id
    @Column(name = "guid", length = 64)
    private String guid;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    public LinkedAccount(String guid, String userId) {
        this.guid = guid;
        this.userId = userId;
    }
}
