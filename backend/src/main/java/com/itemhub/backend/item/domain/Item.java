package com.itemhub.backend.item.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * items 테이블 매핑 엔티티
 *
 * - owner_id는 users.id FK (ON DELETE CASCADE). 사용자 삭제 시 DB가 같이 지운다.
 * - 접근 권한: 소유자 또는 superuser (ItemService)
 */
@Getter
@Entity
@Table(
    name = "items",
    indexes = {
        @Index(name = "idx_items_title", columnList = "title"),
        @Index(name = "idx_items_owner_id", columnList = "owner_id")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Item {

    public static final int TITLE_MAX = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = TITLE_MAX)
    private String title;

    @Column(columnDefinition = "text")
    private String description;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Item create(String title, String description, Long ownerId, LocalDateTime now) {
        require(title != null && !title.isBlank(), "title must not be blank");
        require(ownerId != null, "ownerId must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Item item = new Item();
        item.title = title;
        item.description = description;
        item.ownerId = ownerId;
        item.createdAt = now;
        item.updatedAt = now;
        return item;
    }

    public void rename(String title, LocalDateTime now) {
        require(title != null && !title.isBlank(), "title must not be blank");
        this.title = title;
        this.updatedAt = Objects.requireNonNull(now, "now must not be null");
    }

    public void describe(String description, LocalDateTime now) {
        this.description = description;
        this.updatedAt = Objects.requireNonNull(now, "now must not be null");
    }

    public boolean isOwnedBy(Long userId) {
        return ownerId.equals(userId);
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
