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

import org.apache.ripcord.exception.RipcordErrorCode;
import org.apache.ripcord.exception.RipcordException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A protocol fault: the structured error value answered in place of a result.
 *
 * @param faultCode the numeric fault code
 * @param faultString the human readable message
 */
public record Fault(int faultCode, String faultString) {

    public static final String FAULT_CODE = "faultCode";
    public static final String FAULT_STRING = "faultString";

    public Fault {
        faultString = faultString == null ? "" : faultString;
    }

    public static Fault of(RipcordErrorCode errorCode, String message) {
        return new Fault(errorCode.getCode(), message);
    }

    public static Fault of(RipcordException exception) {
        return new Fault(exception.getFaultCode(), exception.getMessage());
    }

    /**
     * Checks whether the value has the shape of a fault struct, a map holding {@code faultCode} and
     * {@code faultString}.
     *
     * @param value any decoded value
     * @return true for a {@link Fault} or a fault-shaped map
     */
    public static boolean isFault(Object value) {
        if (value instanceof Fault) {
            return true;
        }
        return value instanceof Map<?, ?> map
                && map.get(FAULT_CODE) instanceof Number
                && map.containsKey(FAULT_STRING);
    }

    /**
     * Converts a fault-shaped value into a Fault.
     *
     * @param value a {@link Fault} or a fault-shaped map
     * @return the fault
     * @throws IllegalArgumentException if the value is not fault-shaped
     */
    public static Fault from(Object value) {
        if (value instanceof Fault fault) {
            return fault;
        }
        if (!isFault(value)) {
            throw new IllegalArgumentException("Not a fault: " + value);
        }
        Map<?, ?> map = (Map<?, ?>) value;
        Object faultString = map.get(FAULT_STRING);
        return new Fault(((Number) map.get(FAULT_CODE)).intValue(), faultString == null ? "" : faultString.toString());
    }

    /**
     * Returns the struct encoding of this fault.
     *
     * @return a map with {@code faultCode} and {@code faultString}
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(FAULT_CODE, faultCode);
        map.put(FAULT_STRING, faultString);
        return map;
    }
}
