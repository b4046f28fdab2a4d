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

/**
 * Base class of every exception raised by Ripcord. Each exception carries the {@link RipcordErrorCode}
 * that is used as the {@code faultCode} when the exception crosses the wire.
 */
public abstract class RipcordException extends RuntimeException {

    private final RipcordErrorCode errorCode;

    /**
     * Constructs a new RipcordException with the specified code and message.
     *
     * @param errorCode the error code
     * @param message the detail message
     */
    protected RipcordException(RipcordErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Constructs a new RipcordException with the specified code, message and cause.
     *
     * @param errorCode the error code
     * @param message the detail message
     * @param cause the cause of the exception
     */
    protected RipcordException(RipcordErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Returns the error code enum.
     *
     * @return the error code
     */
    public RipcordErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Returns the numeric code reported in a fault for this exception.
     *
     * @return the fault code
     */
    public int getFaultCode() {
        return errorCode.getCode();
    }
}
