package com.kestrel.core.repository;

import com.kestrel.core.domain.WalletEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface WalletRepository extends JpaRepository<WalletEntity, UUID> {

    Optional<WalletEntity> findByName(String name);

    @Modifying
    @Query("DELETE FROM WalletEntity w WHERE w.name = :name")
    int deleteByName(@Param("name") String name);
}
