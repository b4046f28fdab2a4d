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

import java.nio.charset.Charset;

/**
 * The answer of the server to a {@link ServerRequest}.
 *
 * @param body the response payload
 * @param contentType the media type of the payload, including its charset
 */
public record ServerResponse(byte[] body, String contentType) {

    public static ServerResponse xml(byte[] body, Charset charset) {
        return new ServerResponse(body, "text/xml; charset=" + charset.name().toLowerCase());
    }

    public static ServerResponse html(String body, Charset charset) {
        return new ServerResponse(body.getBytes(charset), "text/html; charset=" + charset.name().toLowerCase());
    }

    public static ServerResponse json(String body, Charset charset) {
        return new ServerResponse(body.getBytes(charset), "application/json; charset=" + charset.name().toLowerCase());
    }

    public String text(Charset charset) {
        return new String(body, charset);
    }
}
