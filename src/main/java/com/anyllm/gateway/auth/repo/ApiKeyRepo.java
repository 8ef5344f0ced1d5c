package com.anyllm.gateway.auth.repo;

import com.anyllm.gateway.auth.entity.ApiKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ApiKeyRepo extends JpaRepository<ApiKey, String> {

    Optional<ApiKey> findByKeyHash(String keyHash);

    List<ApiKey> findByUserIdOrderByCreatedAtAsc(String userId);

    /** 主要 key = 最早建立、仍有效的那把 */
    @Query("""
           select k from ApiKey k
            where k.userId = :userId
              and k.active = true
              and (k.expiresAt is null or k.expiresAt > :now)
            order by k.createdAt asc
           """)
    List<ApiKey> findUsableByUserId(@Param("userId") String userId, @Param("now") Instant now);

    long countByUserId(String userId);

    @Transactional
    @Modifying
    @Query("update ApiKey k set k.lastUsedAt = :at where k.id = :id and (k.lastUsedAt is null or k.lastUsedAt < :at)")
    int touchLastUsed(@Param("id") String id, @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ApiKey k set k.active = false where k.id = :id and k.active = true")
    int deactivate(@Param("id") String id);
}
