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

import org.apache.commons.lang3.StringUtils;
import org.apache.ripcord.exception.InvalidArgumentException;
import org.apache.ripcord.exception.RipcordErrorCode;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Checks endpoint URLs before a client is created, so that a typo fails at build time instead of on the
 * first call.
 */
public final class UrlValidator {

    private static final Set<String> SCHEMES = Set.of("http", "https");

    private UrlValidator() {}

    /**
     * Validates an endpoint URL.
     *
     * @param url the URL
     * @return the URL without surrounding whitespace
     * @throws InvalidArgumentException if the URL is blank, malformed, not http or https, or has no host
     */
    public static String requireEndpoint(String url) {
        String endpoint = StringUtils.trimToNull(url);
        if (endpoint == null) {
            throw invalid("Endpoint URL is blank");
        }
        URI uri;
        try {
            uri = new URI(endpoint);
        } catch (URISyntaxException e) {
            throw invalid("Malformed endpoint URL " + endpoint + ": " + e.getReason());
        }
        if (uri.getScheme() == null || !SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))) {
            throw invalid("Unsupported scheme in endpoint URL " + endpoint);
        }
        if (StringUtils.isBlank(uri.getHost())) {
            throw invalid("Missing host in endpoint URL " + endpoint);
        }
        return endpoint;
    }

    private static InvalidArgumentException invalid(String message) {
        return new InvalidArgumentException(RipcordErrorCode.CANNOT_ACCESS_URL, message);
    }
}
