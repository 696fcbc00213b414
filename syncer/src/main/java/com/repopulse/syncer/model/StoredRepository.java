package com.repopulse.syncer.model;

import java.time.LocalDate;

/**
 * A repository row as currently stored, joined with the latest activity date.
 *
 * @param lastActivityDate most recent stored activity date, {@code null} if none
 */
public record StoredRepository(
        long id,
        String owner,
        String name,
        LocalDate lastActivityDate
) {

    public String fullName() {
        return owner + "/" + name;
    }
}
