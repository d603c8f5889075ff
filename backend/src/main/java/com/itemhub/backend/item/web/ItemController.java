package com.itemhub.backend.item.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.itemhub.backend.global.MessageResponse;
import com.itemhub.backend.global.page.PageResponse;
import com.itemhub.backend.item.dto.ItemCreateRequest;
import com.itemhub.backend.item.dto.ItemResponse;
import com.itemhub.backend.item.dto.ItemUpdateRequest;
import com.itemhub.backend.item.service.ItemService;
import com.itemhub.backend.security.AuthPrincipal;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/items")
public class ItemController {

    private final ItemService itemService;

    @GetMapping
    public PageResponse<ItemResponse> list(
            @AuthenticationPrincipal AuthPrincipal principal,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit
    ) {
        return itemService.list(principal, skip, limit);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ItemResponse create(@AuthenticationPrincipal AuthPrincipal principal, @Valid @RequestBody ItemCreateRequest req) {
        return itemService.create(principal, req);
    }

    @GetMapping("/{itemId}")
    public ItemResponse get(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable Long itemId) {
        return itemService.get(principal, itemId);
    }

    @PatchMapping("/{itemId}")
    public ItemResponse update(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long itemId,
            @Valid @RequestBody ItemUpdateRequest req
    ) {
        return itemService.update(principal, itemId, req);
    }

    @DeleteMapping("/{itemId}")
    public MessageResponse delete(@AuthenticationPrincipal AuthPrincipal principal, @PathVariable Long itemId) {
        itemService.delete(principal, itemId);
        return new MessageResponse("Item deleted successfully");
    }
}
