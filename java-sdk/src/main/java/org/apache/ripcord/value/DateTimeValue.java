/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.apache.ripcord.value;

import org.apache.ripcord.exception.CodecException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * The timestamp value type, carried on the wire as an ISO 8601 basic date time
 * ({@code 20100429T12:30:00}). Times without an offset are interpreted as UTC.
 *
 * @param iso8601 the lexical form of the value
 */
public record DateTimeValue(String iso8601) {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HH:mm:ss");

    public DateTimeValue {
        iso8601 = iso8601.trim();
    }

    /**
     * Creates a timestamp value from seconds since the epoch.
     *
     * @param epochSeconds unix timestamp
     * @return the value
     */
    public static DateTimeValue ofEpochSecond(long epochSeconds) {
        return new DateTimeValue(FORMAT.format(LocalDateTime.ofEpochSecond(epochSeconds, 0, ZoneOffset.UTC)));
    }

    public static DateTimeValue of(Instant instant) {
        return ofEpochSecond(instant.getEpochSecond());
    }

    /**
     * Returns this value as seconds since the epoch.
     *
     * @return unix timestamp
     * @throws CodecException if the lexical form is not a supported date time
     */
    public long epochSecond() {
        try {
            return LocalDateTime.parse(iso8601, FORMAT).toEpochSecond(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(iso8601).getEpochSecond();
            } catch (DateTimeParseException ex) {
                throw new CodecException("Invalid dateTime.iso8601 value: " + iso8601, ex);
            }
        }
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(epochSecond());
    }
}
