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

package org.apache.ripcord.transport;

import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.apache.ripcord.RipcordVersion;
import org.apache.ripcord.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * {@link Transport} posting {@code text/xml} requests with Apache HttpClient.
 */
public class HttpTransport implements Transport, Closeable {

    private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);
    private static final String CONTENT_TYPE = "text/xml";

    private final CloseableHttpClient client;
    private final Charset charset;
    private volatile List<Header> responseHeaders = List.of();

    public HttpTransport() {
        this(Optional.empty(), Optional.empty(), StandardCharsets.UTF_8);
    }

    /**
     * Creates a transport with the given deadlines.
     *
     * @param connectionTimeout the connect deadline, the HttpClient default when empty
     * @param requestTimeout the response deadline, the HttpClient default when empty
     * @param charset the charset announced in the content type of requests
     */
    public HttpTransport(Optional<Duration> connectionTimeout, Optional<Duration> requestTimeout, Charset charset) {
        this.charset = charset;
        var connectionConfig = ConnectionConfig.custom();
        connectionTimeout.ifPresent(timeout -> connectionConfig.setConnectTimeout(toTimeout(timeout)));
        var requestConfig = RequestConfig.custom();
        requestTimeout.ifPresent(timeout -> requestConfig.setResponseTimeout(toTimeout(timeout)));
        this.client = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig.build())
                        .build())
                .setDefaultRequestConfig(requestConfig.build())
                .setUserAgent(RipcordVersion.getInstance().getUserAgent())
                .build();
    }

    @Override
    public byte[] post(String url, byte[] request) {
        HttpPost post;
        try {
            post = new HttpPost(url);
        } catch (IllegalArgumentException e) {
            throw new TransportException(url, e);
        }
        post.setHeader(HttpHeaders.ACCEPT, CONTENT_TYPE);
        post.setEntity(new ByteArrayEntity(request, ContentType.create(CONTENT_TYPE, charset)));
        log.debug("Posting {} bytes to {}", request.length, url);
        byte[] body;
        try {
            body = client.execute(post, response -> {
                responseHeaders = List.of(response.getHeaders());
                if (response.getCode() >= 400) {
                    EntityUtils.consume(response.getEntity());
                    throw new IOException("HTTP status " + response.getCode());
                }
                return response.getEntity() == null ? null : EntityUtils.toByteArray(response.getEntity());
            });
        } catch (IOException e) {
            throw new TransportException(url, e);
        }
        if (body == null || body.length == 0) {
            throw new TransportException(url);
        }
        return body;
    }

    /**
     * Returns the headers of the last response received.
     *
     * @return the response headers
     */
    public List<Header> getResponseHeaders() {
        return responseHeaders;
    }

    @Override
    public void close() throws IOException {
        client.close();
    }

    private static Timeout toTimeout(Duration duration) {
        return Timeout.ofMilliseconds(duration.toMillis());
    }
}
