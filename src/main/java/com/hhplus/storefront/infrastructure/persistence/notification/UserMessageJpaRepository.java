package com.hhplus.storefront.infrastructure.persistence.notification;

import com.hhplus.storefront.domain.notification.UserMessage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UserMessageJpaRepository extends JpaRepository<UserMessage, Long> {

    List<UserMessage> findByUserIdOrderByCreatedAtDescMessageIdDesc(Long userId);
}
