package com.tarifftracker.notifier.infrastructure.db.pending;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface PendingUpdateJpaRepository extends JpaRepository<PendingUpdateEntity, String> {

    @Modifying
    @Query(
            value =
                    "INSERT INTO pending_updates (user_id, fragment_id, fragment, created_at) VALUES"
                        + " (:#{#row.userId}, :#{#row.fragmentId}, :#{#row.fragment}, :#{#row.createdAt})"
                        + " ON CONFLICT (user_id) DO UPDATE SET fragment_id = EXCLUDED.fragment_id,"
                        + " fragment = EXCLUDED.fragment, created_at = EXCLUDED.created_at",
            nativeQuery = true)
    void upsert(PendingUpdateEntity row);

    @Modifying
    @Query(value = "DELETE FROM pending_updates WHERE user_id = :userId", nativeQuery = true)
    int deleteByUserIdNative(String userId);
}
