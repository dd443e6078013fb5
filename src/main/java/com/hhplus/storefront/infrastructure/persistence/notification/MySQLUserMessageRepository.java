package com.hhplus.storefront.infrastructure.persistence.notification;

import com.hhplus.storefront.domain.notification.UserMessage;
import com.hhplus.storefront.domain.notification.UserMessageRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 UserMessage Repository 구현
 */
@Repository
@Primary
public class MySQLUserMessageRepository implements UserMessageRepository {

    private final UserMessageJpaRepository userMessageJpaRepository;

    public MySQLUserMessageRepository(UserMessageJpaRepository userMessageJpaRepository) {
        this.userMessageJpaRepository = userMessageJpaRepository;
    }

    @Override
    public UserMessage save(UserMessage message) {
        return userMessageJpaRepository.save(message);
    }

    @Override
    public Optional<UserMessage> findById(Long messageId) {
        return userMessageJpaRepository.findById(messageId);
    }

    @Override
    public List<UserMessage> findByUserId(Long userId) {
        return userMessageJpaRepository.findByUserIdOrderByCreatedAtDescMessageIdDesc(userId);
    }
}
