package com.itemhub.backend.item.repo;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.itemhub.backend.item.domain.Item;

@Repository
public interface ItemRepository extends JpaRepository<Item, Long> {

    long countByOwnerId(Long ownerId);

    @Query(value = "SELECT * FROM items WHERE owner_id = :ownerId ORDER BY id LIMIT :limit OFFSET :skip", nativeQuery = true)
    List<Item> findSliceByOwner(@Param("ownerId") Long ownerId, @Param("skip") int skip, @Param("limit") int limit);

    @Query(value = "SELECT * FROM items ORDER BY id LIMIT :limit OFFSET :skip", nativeQuery = true)
    List<Item> findSlice(@Param("skip") int skip, @Param("limit") int limit);
}
