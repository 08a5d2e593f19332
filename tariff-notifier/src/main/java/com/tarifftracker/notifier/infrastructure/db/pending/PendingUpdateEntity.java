package com.tarifftracker.notifier.infrastructure.db.pending;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "pending_updates")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingUpdateEntity {

    @Id
    @Column(name = "user_id", length = 32)
    private String userId;

    @Column(name = "fragment_id", nullable = false, length = 26)
    private String fragmentId;

    @Column(name = "fragment", nullable = false, columnDefinition = "text")
    private String fragment;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
