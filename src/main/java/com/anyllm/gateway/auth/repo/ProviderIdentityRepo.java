package com.anyllm.gateway.auth.repo;

import com.anyllm.gateway.auth.entity.ProviderIdentity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ProviderIdentityRepo extends JpaRepository<ProviderIdentity, String> {

    Optional<ProviderIdentity> findByProviderAndProviderUserId(String provider, String providerUserId);

    Optional<ProviderIdentity> findByUserId(String userId);

    long countByProviderAndProviderUserId(String provider, String providerUserId);
}
