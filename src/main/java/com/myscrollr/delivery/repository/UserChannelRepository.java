package com.myscrollr.delivery.repository;

import com.myscrollr.delivery.model.domain.UserChannel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserChannelRepository extends JpaRepository<UserChannel, Long> {

    List<UserChannel> findByUserId(String userId);

    List<UserChannel> findByEnabledTrue();
}
