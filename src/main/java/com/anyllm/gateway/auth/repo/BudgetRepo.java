package com.anyllm.gateway.auth.repo;

import com.anyllm.gateway.auth.entity.Budget;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BudgetRepo extends JpaRepository<Budget, String> {
}
