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

import org.apache.commons.lang3.StringUtils;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpException;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.io.HttpRequestHandler;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.protocol.HttpContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Serves a {@link RipcordServer} from an HttpCore 5 classic server.
 *
 * <pre>{@code
 * HttpServer http = ServerBootstrap.bootstrap()
 *     .setListenerPort(8080)
 *     .register("/rpc", new RipcordHttpHandler(server))
 *     .create();
 * http.start();
 * }</pre>
 */
public class RipcordHttpHandler implements HttpRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(RipcordHttpHandler.class);

    private final RipcordServer server;

    public RipcordHttpHandler(RipcordServer server) {
        this.server = server;
    }

    @Override
    public void handle(ClassicHttpRequest request, ClassicHttpResponse response, HttpContext context)
            throws HttpException, IOException {
        byte[] body = request.getEntity() == null ? new byte[0] : EntityUtils.toByteArray(request.getEntity());
        String query = StringUtils.substringAfter(request.getPath(), "?");
        log.debug("{} {} with {} bytes", request.getMethod(), request.getPath(), body.length);
        ServerResponse result = server.run(new ServerRequest(body, StringUtils.isEmpty(query) ? null : query));
        response.setCode(HttpStatus.SC_OK);
        response.setEntity(new ByteArrayEntity(result.body(), ContentType.parse(result.contentType())));
    }
}
