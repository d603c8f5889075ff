package com.itemhub.backend.user.repo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.itemhub.backend.user.domain.User;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    boolean existsByEmail(String email);

    Optional<User> findByEmail(String email);

    /**
     * skip/limit 그대로 쓰는 오프셋 페이징 (skip이 limit의 배수가 아닐 수 있어서 Pageable 대신 native)
     */
    @Query(value = "SELECT * FROM users ORDER BY id LIMIT :limit OFFSET :skip", nativeQuery = true)
    List<User> findSlice(@Param("skip") int skip, @Param("limit") int limit);
}
