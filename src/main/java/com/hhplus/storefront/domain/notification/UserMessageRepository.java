package com.hhplus.storefront.domain.notification;

import java.util.List;
import java.util.Optional;

/**
 * UserMessage Repository Interface (Port)
 */
public interface UserMessageRepository {

    UserMessage save(UserMessage message);

    Optional<UserMessage> findById(Long messageId);

    /**
     * 사용자 알림 목록 (최신순)
     */
    List<UserMessage> findByUserId(Long userId);
}
