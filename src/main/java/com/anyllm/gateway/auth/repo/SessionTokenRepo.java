package com.anyllm.gateway.auth.repo;

import com.anyllm.gateway.auth.entity.SessionToken;
import com.anyllm.gateway.auth.entity.SessionToken.RevokeReason;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SessionTokenRepo extends JpaRepository<SessionToken, String> {

    Optional<SessionToken> findByJti(String jti);

    List<SessionToken> findByFamilyIdOrderByCreatedAtAsc(String familyId);

    /** 旋轉時鎖住這一列，同一把 refresh token 的第二個請求會在這裡排隊 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from SessionToken s where s.refreshTokenHash = :hash")
    Optional<SessionToken> findByRefreshTokenHashForUpdate(@Param("hash") String hash);

    /** CAS：只有仍未撤銷時才會改到，回傳 0 代表已被別人旋轉/撤銷 */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update SessionToken s
              set s.revokedAt = :now,
                  s.revokeReason = :reason,
                  s.replacedByJti = :replacedBy
            where s.id = :id
              and s.revokedAt is null
           """)
    int markRotated(@Param("id") String id,
                    @Param("reason") RevokeReason reason,
                    @Param("replacedBy") String replacedByJti,
                    @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update SessionToken s
              set s.revokedAt = :now, s.revokeReason = :reason
            where s.jti = :jti and s.revokedAt is null
           """)
    int revokeByJti(@Param("jti") String jti, @Param("reason") RevokeReason reason, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update SessionToken s
              set s.revokedAt = :now, s.revokeReason = :reason
            where s.refreshTokenHash = :hash and s.revokedAt is null
           """)
    int revokeByRefreshTokenHash(@Param("hash") String hash, @Param("reason") RevokeReason reason, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update SessionToken s
              set s.revokedAt = :now, s.revokeReason = :reason
            where s.familyId = :familyId and s.revokedAt is null
           """)
    int revokeActiveByFamily(@Param("familyId") String familyId, @Param("reason") RevokeReason reason, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update SessionToken s
              set s.revokedAt = :now, s.revokeReason = :reason
            where s.userId = :userId and s.apiKeyId = :apiKeyId and s.revokedAt is null
           """)
    int revokeActiveByUserAndKey(@Param("userId") String userId,
                                 @Param("apiKeyId") String apiKeyId,
                                 @Param("reason") RevokeReason reason,
                                 @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update SessionToken s
              set s.revokedAt = :now, s.revokeReason = :reason
            where s.userId = :userId and s.revokedAt is null
           """)
    int revokeActiveByUser(@Param("userId") String userId, @Param("reason") RevokeReason reason, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("update SessionToken s set s.lastUsedAt = :at where s.jti = :jti and (s.lastUsedAt is null or s.lastUsedAt < :at)")
    int touchLastUsed(@Param("jti") String jti, @Param("at") Instant at);

    @Query("select count(s) from SessionToken s where s.userId = :userId and s.revokedAt is null")
    long countActiveByUserId(@Param("userId") String userId);
}
