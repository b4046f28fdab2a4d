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

public class TransportException extends RipcordException {

    private final String url;

    /**
     * Constructs a new TransportException for the given endpoint.
     *
     * @param url the url that could not be accessed
     */
    public TransportException(String url) {
        super(RipcordErrorCode.CANNOT_ACCESS_URL, "Could not access " + url);
        this.url = url;
    }

    /**
     * Constructs a new TransportException wrapping the transport specific failure.
     *
     * @param url the url that could not be accessed
     * @param cause the underlying failure
     */
    public TransportException(String url, Throwable cause) {
        super(RipcordErrorCode.CANNOT_ACCESS_URL, "Could not access " + url, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
