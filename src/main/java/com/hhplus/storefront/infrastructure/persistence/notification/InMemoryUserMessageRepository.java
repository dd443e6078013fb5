package com.hhplus.storefront.infrastructure.persistence.notification;

import com.hhplus.storefront.domain.notification.UserMessage;
import com.hhplus.storefront.domain.notification.UserMessageRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemory UserMessage Repository 구현
 */
@Repository
public class InMemoryUserMessageRepository implements UserMessageRepository {

    private final ConcurrentHashMap<Long, UserMessage> messages = new ConcurrentHashMap<>();
    private final AtomicLong messageIdSequence = new AtomicLong(0);

    @Override
    public UserMessage save(UserMessage message) {
        UserMessage saved = message.getMessageId() == null
                ? message.toBuilder().messageId(messageIdSequence.incrementAndGet()).build()
                : message;
        messages.put(saved.getMessageId(), saved);
        return saved;
    }

    @Override
    public Optional<UserMessage> findById(Long messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public List<UserMessage> findByUserId(Long userId) {
        return messages.values().stream()
                .filter(message -> message.getUserId().equals(userId))
                .sorted(Comparator.comparing(UserMessage::getMessageId).reversed())
                .collect(Collectors.toList());
    }
}
