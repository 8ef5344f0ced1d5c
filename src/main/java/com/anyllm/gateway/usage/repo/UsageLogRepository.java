package com.anyllm.gateway.usage.repo;

import com.anyllm.gateway.usage.entity.UsageLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface UsageLogRepository extends JpaRepository<UsageLog, String> {

    /** 沒有資料時 sum 會是 null，由呼叫端補 0 */
    interface UsageTotals {
        Number getRequests();
        Number getPromptTokens();
        Number getCompletionTokens();
        Number getTotalTokens();
        Number getCost();
    }

    @Query("""
           select count(u) as requests,
                  sum(u.promptTokens) as promptTokens,
                  sum(u.completionTokens) as completionTokens,
                  sum(u.totalTokens) as totalTokens,
                  sum(u.cost) as cost
             from UsageLog u
            where u.userId = :userId
              and u.timestamp >= :since
           """)
    UsageTotals aggregateSince(@Param("userId") String userId, @Param("since") Instant since);

    List<UsageLog> findByUserIdOrderByTimestampDesc(String userId, Pageable pageable);

    long countByUserId(String userId);
}
