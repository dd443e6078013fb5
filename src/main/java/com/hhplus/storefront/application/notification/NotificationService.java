package com.hhplus.storefront.application.notification;

import com.hhplus.storefront.application.notification.dto.UserMessageResponse;
import com.hhplus.storefront.domain.notification.UserMessage;
import com.hhplus.storefront.domain.notification.UserMessageNotFoundException;
import com.hhplus.storefront.domain.notification.UserMessageRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 사용자 알림함 조회/읽음 처리
 */
@Service
public class NotificationService {

    private final UserMessageRepository userMessageRepository;

    public NotificationService(UserMessageRepository userMessageRepository) {
        this.userMessageRepository = userMessageRepository;
    }

    @Transactional(readOnly = true)
    public List<UserMessageResponse> getMessages(Long userId) {
        return userMessageRepository.findByUserId(userId).stream()
                .map(UserMessageResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public UserMessageResponse markAsRead(Long userId, Long messageId) {
        UserMessage message = userMessageRepository.findById(messageId)
                .filter(m -> m.getUserId().equals(userId))
                .orElseThrow(() -> new UserMessageNotFoundException(messageId));
        message.markAsRead();
        return UserMessageResponse.from(userMessageRepository.save(message));
    }
}
