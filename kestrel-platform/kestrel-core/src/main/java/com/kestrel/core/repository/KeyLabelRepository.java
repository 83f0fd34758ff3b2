package com.kestrel.core.repository;

import com.kestrel.core.domain.KeyLabel;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for key-label pointers.
 */
@Repository
public interface KeyLabelRepository extends JpaRepository<KeyLabel, String> {

    /**
     * Loads the pointer row with a write lock so concurrent rotations of one label serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT k FROM KeyLabel k WHERE k.label = :label")
    Optional<KeyLabel> findForUpdate(@Param("label") String label);
}
