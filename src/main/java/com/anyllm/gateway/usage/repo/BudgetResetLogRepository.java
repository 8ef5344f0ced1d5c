package com.anyllm.gateway.usage.repo;

import com.anyllm.gateway.usage.entity.BudgetResetLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BudgetResetLogRepository extends JpaRepository<BudgetResetLog, String> {

    List<BudgetResetLog> findByUserIdOrderByResetAtDesc(String userId);
}
