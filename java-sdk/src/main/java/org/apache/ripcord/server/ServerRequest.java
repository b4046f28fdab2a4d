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

package org.apache.ripcord.server;

/**
 * A request received by the server: the raw payload and the query string of the request URL.
 *
 * @param body the request payload, empty when none was sent
 * @param query the query string without the leading {@code ?}, or null
 */
public record ServerRequest(byte[] body, String query) {

    public ServerRequest {
        body = body == null ? new byte[0] : body;
    }

    public static ServerRequest of(byte[] body) {
        return new ServerRequest(body, null);
    }

    public boolean hasPayload() {
        return body.length > 0;
    }
}
