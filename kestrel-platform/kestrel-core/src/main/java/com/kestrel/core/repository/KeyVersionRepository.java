package com.kestrel.core.repository;

import com.kestrel.core.domain.KeyVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for key versions, keyed by (label, version).
 */
@Repository
public interface KeyVersionRepository extends JpaRepository<KeyVersion, KeyVersion.KeyVersionId> {

    List<KeyVersion> findByLabelOrderByVersionAsc(String label);

    Optional<KeyVersion> findByLabelAndVersion(String label, int version);

    /**
     * Increments usage on a version only while it is not retired.
     */
    @Modifying
    @Query("UPDATE KeyVersion v SET v.usageCount = v.usageCount + 1 "
            + "WHERE v.label = :label AND v.version = :version AND v.retired = false")
    int incrementUsage(@Param("label") String label, @Param("version") int version);

    @Modifying
    @Query("DELETE FROM KeyVersion v WHERE v.label = :label")
    int deleteByLabel(@Param("label") String label);
}
