package com.vigil.service.core.cache;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/** The recording hour a point in time falls into, for one camera, in the backend's timezone. */
public record HourId(String cameraId, LocalDate day, int hour) {

    public static HourId of(String cameraId, Instant instant, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        return new HourId(cameraId, local.toLocalDate(), local.getHour());
    }
}
