package com.anyllm.gateway.auth.repo;

import com.anyllm.gateway.auth.entity.GatewayUser;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public interface GatewayUserRepo extends JpaRepository<GatewayUser, String> {

    /** 原子累加，不做 read-modify-write */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update GatewayUser u
              set u.spend = u.spend + :cost,
                  u.updatedAt = :now
            where u.userId = :userId
           """)
    int accrueSpend(@Param("userId") String userId,
                    @Param("cost") BigDecimal cost,
                    @Param("now") Instant now);

    /** 只有到期的那一次會成功（where 條件兼當 CAS） */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update GatewayUser u
              set u.spend = 0,
                  u.budgetStartedAt = :now,
                  u.nextBudgetResetAt = :nextReset,
                  u.updatedAt = :now
            where u.userId = :userId
              and u.nextBudgetResetAt is not null
              and u.nextBudgetResetAt <= :now
           """)
    int resetSpendIfDue(@Param("userId") String userId,
                        @Param("now") Instant now,
                        @Param("nextReset") Instant nextReset);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update GatewayUser u set u.blocked = :blocked, u.updatedAt = :now where u.userId = :userId")
    int updateBlocked(@Param("userId") String userId,
                      @Param("blocked") boolean blocked,
                      @Param("now") Instant now);

    @Query("""
           select u.userId from GatewayUser u
            where u.nextBudgetResetAt is not null
              and u.nextBudgetResetAt <= :now
            order by u.nextBudgetResetAt asc
           """)
    List<String> findIdsDueForReset(@Param("now") Instant now, Pageable pageable);
}
