package com.itemhub.backend.user.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * users 테이블 = "회원 저장소"
 *
 * 가입 흐름:
 * - UserService.register()에서 insert (active=true, superuser=false)
 *
 * 인증 흐름:
 * - AuthService.login()에서 email로 조회 후 hashed_password 비교
 * - IdentityResolver가 매 요청마다 id로 다시 조회해서 active/superuser 정책 적용
 */
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_email", columnNames = "email")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id; // PK. JWT의 sub(subject)로 쓰임

    @Column(nullable = false, length = 255)
    private String email; // 로그인 ID (Unique, 소문자 정규화)

    @Column(name = "hashed_password", nullable = false, length = 255)
    private String hashedPassword; // BCrypt 해시 (원문 저장 금지)

    @Column(name = "full_name", length = 255)
    private String fullName;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "is_superuser", nullable = false)
    private boolean superuser;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static User create(String email, String hashedPassword, String fullName, LocalDateTime now) {
        Objects.requireNonNull(email, "email must not be null");
        Objects.requireNonNull(hashedPassword, "hashedPassword must not be null");
        Objects.requireNonNull(now, "now must not be null");

        User u = new User();
        u.email = email;
        u.hashedPassword = hashedPassword;
        u.fullName = fullName;

        // 기본 정책값
        u.active = true;
        u.superuser = false;
        u.createdAt = now;
        u.updatedAt = now;
        return u;
    }

    public void changeEmail(String email, LocalDateTime now) {
        this.email = Objects.requireNonNull(email, "email must not be null");
        touch(now);
    }

    public void changeFullName(String fullName, LocalDateTime now) {
        this.fullName = fullName;
        touch(now);
    }

    public void changePassword(String hashedPassword, LocalDateTime now) {
        this.hashedPassword = Objects.requireNonNull(hashedPassword, "hashedPassword must not be null");
        touch(now);
    }

    public void changeActive(boolean active, LocalDateTime now) {
        this.active = active;
        touch(now);
    }

    private void touch(LocalDateTime now) {
        this.updatedAt = Objects.requireNonNull(now, "now must not be null");
    }

    public Long getId() {return id;}
    public String getEmail() {return email;}
    public String getHashedPassword() {return hashedPassword;}
    public String getFullName() {return fullName;}
    public boolean isActive() {return active;}
    public boolean isSuperuser() {return superuser;}
    public LocalDateTime getCreatedAt() {return createdAt;}
    public LocalDateTime getUpdatedAt() {return updatedAt;}
}
