package com.itemhub.backend.item.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.itemhub.backend.global.ApiException;
import com.itemhub.backend.global.ErrorCode;
import com.itemhub.backend.global.page.PageResponse;
import com.itemhub.backend.item.domain.Item;
import com.itemhub.backend.item.dto.ItemCreateRequest;
import com.itemhub.backend.item.dto.ItemResponse;
import com.itemhub.backend.item.dto.ItemUpdateRequest;
import com.itemhub.backend.item.repo.ItemRepository;
import com.itemhub.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 아이템 CRUD
 *
 * 정책:
 * - 생성한 사용자가 소유자가 된다.
 * - 조회/수정/삭제: 소유자 또는 superuser. 그 외 403 ITEM_ACCESS_DENIED
 * - 없는 아이템은 권한 검사보다 먼저 404 ITEM_NOT_FOUND
 * - 목록: 일반 사용자는 자기 것만, superuser는 전체
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ItemService {

    private final ItemRepository itemRepository;
    private final Clock clock;

    @Transactional
    public ItemResponse create(AuthPrincipal actor, ItemCreateRequest req) {
        Item item = Item.create(req.title(), req.description(), actor.userId(), LocalDateTime.now(clock));
        Item saved = itemRepository.save(item);

        log.debug("item created: itemId={}, ownerId={}", saved.getId(), actor.userId());
        return ItemResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public PageResponse<ItemResponse> list(AuthPrincipal actor, int skip, int limit) {
        if (actor.superuser()) {
            return PageResponse.of(itemRepository.findSlice(skip, limit), itemRepository.count(), skip, limit, ItemResponse::from);
        }
        return PageResponse.of(
                itemRepository.findSliceByOwner(actor.userId(), skip, limit),
                itemRepository.countByOwnerId(actor.userId()),
                skip,
                limit,
                ItemResponse::from
        );
    }

    @Transactional(readOnly = true)
    public ItemResponse get(AuthPrincipal actor, Long itemId) {
        return ItemResponse.from(loadAccessibleOrThrow(actor, itemId));
    }

    @Transactional
    public ItemResponse update(AuthPrincipal actor, Long itemId, ItemUpdateRequest req) {
        Item item = loadAccessibleOrThrow(actor, itemId);
        LocalDateTime now = LocalDateTime.now(clock);

        if (req.title() != null) item.rename(req.title(), now);
        if (req.description() != null) item.describe(req.description(), now);

        return ItemResponse.from(item);
    }

    @Transactional
    public void delete(AuthPrincipal actor, Long itemId) {
        Item item = loadAccessibleOrThrow(actor, itemId);
        itemRepository.delete(item);
        log.debug("item deleted: itemId={}, by={}", itemId, actor.userId());
    }

    private Item loadAccessibleOrThrow(AuthPrincipal actor, Long itemId) {
        Item item = itemRepository.findById(itemId)
                .orElseThrow(() -> new ApiException(ErrorCode.ITEM_NOT_FOUND));

        if (!item.isOwnedBy(actor.userId()) && !actor.superuser())
            throw new ApiException(ErrorCode.ITEM_ACCESS_DENIED);

        return item;
    }
}
