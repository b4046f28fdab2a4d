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

package org.apache.ripcord.exception;

import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Map;

public enum RipcordErrorCode {
    // Procedure errors
    PROCEDURE_FAILED(0),
    METHOD_NOT_FOUND(-1),

    // Batch errors
    NOT_RIPCORD_CALL(-2),
    CANNOT_RECURSE(-3),
    ILLEGAL_BATCH_PARAMS(-11),

    // Transport errors
    CANNOT_ACCESS_URL(-4),

    // Configuration errors
    CODEC_NOT_AVAILABLE(-5),
    UNKNOWN_SERVICE_TYPE(-8),

    // Value errors
    NOT_DATETIME(-6),
    NOT_BASE64(-7),

    // Payload errors
    NO_REQUEST_PAYLOAD(-9),
    MALFORMED_PAYLOAD(-10),

    // Unknown error code
    UNKNOWN(Integer.MIN_VALUE);

    private static final Map<Integer, RipcordErrorCode> CODE_MAP = new HashMap<>();

    static {
        for (RipcordErrorCode errorCode : values()) {
            CODE_MAP.put(errorCode.code, errorCode);
        }
    }

    private final int code;

    RipcordErrorCode(int code) {
        this.code = code;
    }

    /**
     * Returns the numeric error code, as it appears in the {@code faultCode} of a fault.
     *
     * @return the error code
     */
    public int getCode() {
        return code;
    }

    /**
     * Returns the RipcordErrorCode for the given numeric code.
     *
     * @param code the numeric error code
     * @return the corresponding RipcordErrorCode, or UNKNOWN if not found
     */
    public static RipcordErrorCode fromCode(int code) {
        return CODE_MAP.getOrDefault(code, UNKNOWN);
    }

    /**
     * Returns the RipcordErrorCode for the given string code.
     *
     * @param code the string error code (can be numeric or enum name)
     * @return the corresponding RipcordErrorCode, or UNKNOWN if not found
     */
    public static RipcordErrorCode fromString(String code) {
        if (StringUtils.isBlank(code)) {
            return UNKNOWN;
        }
        try {
            int numericCode = Integer.parseInt(code.trim());
            return fromCode(numericCode);
        } catch (NumberFormatException e) {
            try {
                return valueOf(code.trim().toUpperCase().replace(".", "_").replace(" ", "_"));
            } catch (IllegalArgumentException ex) {
                return UNKNOWN;
            }
        }
    }
}
