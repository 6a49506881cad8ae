package com.intteq.broker.rpc.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Ledger row: the encoded response of a request that reached a terminal outcome.
 *
 * <p>Implements {@link Persistable} so that {@code save} always issues an INSERT.
 * A second insert for the same id fails on the primary key instead of silently
 * merging over the first.
 */
@Entity
@Table(name = "processed_requests")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedRequest implements Persistable<String> {

    @Id
    @Column(name = "id", length = 64, nullable = false, updatable = false)
    private String id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "response_json", nullable = false, updatable = false, length = 1_048_576)
    private String responseJson;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean isNew = true;

    public ProcessedRequest(String id, String responseJson, Instant createdAt) {
        this.id = id;
        this.responseJson = responseJson;
        this.createdAt = createdAt;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }
}
