/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.tripquery.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Typed view of one trip event as found in a daily shard.
 *
 * <p>The record pipeline works on {@link Row}s so that plans can reference raw and derived fields by
 * name; {@link #toRow()} produces the row form with the shard's field names. Timestamps are kept as the
 * shard's fixed-format strings ({@code "2023-01-03 23:14:52.325"}).</p>
 */
public record TripRecord(
    @JsonProperty("ride_id") String rideId,
    @JsonProperty("rideable_type") RideableType rideableType,
    @JsonProperty("started_at") String startedAt,
    @JsonProperty("ended_at") String endedAt,
    @JsonProperty("start_station_name") String startStationName,
    @JsonProperty("start_station_id") String startStationId,
    @JsonProperty("end_station_name") String endStationName,
    @JsonProperty("end_station_id") String endStationId,
    @JsonProperty("start_lat") double startLat,
    @JsonProperty("start_lng") double startLng,
    @JsonProperty("end_lat") double endLat,
    @JsonProperty("end_lng") double endLng,
    @JsonProperty("member_casual") MemberType memberCasual
) {

    public static final String RIDE_ID = "ride_id";
    public static final String RIDEABLE_TYPE = "rideable_type";
    public static final String STARTED_AT = "started_at";
    public static final String ENDED_AT = "ended_at";
    public static final String START_STATION_NAME = "start_station_name";
    public static final String START_STATION_ID = "start_station_id";
    public static final String END_STATION_NAME = "end_station_name";
    public static final String END_STATION_ID = "end_station_id";
    public static final String START_LAT = "start_lat";
    public static final String START_LNG = "start_lng";
    public static final String END_LAT = "end_lat";
    public static final String END_LNG = "end_lng";
    public static final String MEMBER_CASUAL = "member_casual";

    /**
     * Row form of this trip, with enum values written as their shard strings.
     *
     * @return a row with every trip field, in shard order
     */
    public Row toRow() {
        return Row.builder()
            .put(RIDE_ID, rideId)
            .put(RIDEABLE_TYPE, rideableType == null ? null : rideableType.getValue())
            .put(STARTED_AT, startedAt)
            .put(ENDED_AT, endedAt)
            .put(START_STATION_NAME, startStationName)
            .put(START_STATION_ID, startStationId)
            .put(END_STATION_NAME, endStationName)
            .put(END_STATION_ID, endStationId)
            .put(START_LAT, startLat)
            .put(START_LNG, startLng)
            .put(END_LAT, endLat)
            .put(END_LNG, endLng)
            .put(MEMBER_CASUAL, memberCasual == null ? null : memberCasual.getValue())
            .build();
    }
}
