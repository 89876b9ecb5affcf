package com.example.scheduler.api;

import java.time.Instant;

/**
 * Body of a successful {@code DELETE /events/{id}}.
 */
public final class DeletedEventResponse {
    private final long id;
    private final String status;
    private final Instant deletedAt;

    private DeletedEventResponse(long id, Instant deletedAt) {
        this.id = id;
        this.status = "deleted";
        this.deletedAt = deletedAt;
    }

    public static DeletedEventResponse of(long id) {
        return new DeletedEventResponse(id, Instant.now());
    }

    public long getId() {
        return id;
    }

    public String getStatus() {
        return status;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }
}
