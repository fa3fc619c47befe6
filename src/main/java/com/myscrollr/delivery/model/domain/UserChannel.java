package com.myscrollr.delivery.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A user's configured channel. The authoritative subscription state lives here;
 * the subscriber sets are derived from it.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "USER_CHANNEL",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "channel_type"}))
public class UserChannel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "channel_type", nullable = false, length = 32)
    private String channelType;

    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    // Raw JSON config as stored by the channel CRUD endpoints
    @Column(name = "config", length = 8000)
    private String config;

    public UserChannel(String userId, String channelType, boolean enabled, String config) {
        this.userId = userId;
        this.channelType = channelType;
        this.enabled = enabled;
        this.config = config;
    }
}
