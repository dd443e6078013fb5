package com.hhplus.storefront.infrastructure.persistence.product;

import com.hhplus.storefront.domain.product.Size;
import com.hhplus.storefront.domain.product.SizeRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemory Size Repository 구현
 */
@Repository
public class InMemorySizeRepository implements SizeRepository {

    private final ConcurrentHashMap<Long, Size> sizes = new ConcurrentHashMap<>();
    private final AtomicLong sizeIdSequence = new AtomicLong(0);

    @Override
    public Optional<Size> findById(Long sizeId) {
        return Optional.ofNullable(sizes.get(sizeId));
    }

    @Override
    public List<Size> findAllOrdered() {
        return sizes.values().stream()
                .sorted(Comparator.comparing(Size::getSortOrder).thenComparing(Size::getName))
                .collect(Collectors.toList());
    }

    @Override
    public Size save(Size size) {
        Size saved = size.getSizeId() == null
                ? size.toBuilder().sizeId(sizeIdSequence.incrementAndGet()).build()
                : size;
        sizes.put(saved.getSizeId(), saved);
        return saved;
    }
}
