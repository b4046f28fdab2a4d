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

import org.apache.ripcord.exception.InvalidArgumentException;
import org.apache.ripcord.exception.RipcordErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlValidatorTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "http://localhost:8080/rpc",
        "http://www.moviemeter.nl/ws",
        "https://example.com/xmlrpc.php?debug=1",
        "HTTP://127.0.0.1/RPC2"
    })
    void shouldAcceptHttpEndpoints(String url) {
        assertThat(UrlValidator.requireEndpoint(url)).isEqualTo(url);
    }

    @Test
    void shouldTrimEndpoint() {
        assertThat(UrlValidator.requireEndpoint("  http://localhost/rpc\n")).isEqualTo("http://localhost/rpc");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t"})
    void shouldRejectBlankEndpoint(String url) {
        assertThatThrownBy(() -> UrlValidator.requireEndpoint(url))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessage("Endpoint URL is blank")
                .extracting("errorCode")
                .isEqualTo(RipcordErrorCode.CANNOT_ACCESS_URL);
    }

    @ParameterizedTest
    @ValueSource(strings = {"ftp://example.com/rpc", "file:///var/rpc", "localhost", "localhost:8080"})
    void shouldRejectOtherSchemes(String url) {
        assertThatThrownBy(() -> UrlValidator.requireEndpoint(url))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessage("Unsupported scheme in endpoint URL " + url);
    }

    @ParameterizedTest
    @ValueSource(strings = {"http://", "http:// bad host", "http://[::1"})
    void shouldRejectMalformedEndpoint(String url) {
        assertThatThrownBy(() -> UrlValidator.requireEndpoint(url))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageStartingWith("Malformed endpoint URL " + url.trim());
    }

    @Test
    void shouldRejectEndpointWithoutHost() {
        assertThatThrownBy(() -> UrlValidator.requireEndpoint("http:///rpc"))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessage("Missing host in endpoint URL http:///rpc");
    }
}
