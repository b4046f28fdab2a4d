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

package org.apache.ripcord;

import org.apache.ripcord.client.Call;
import org.apache.ripcord.client.RipcordClient;
import org.apache.ripcord.client.RipcordClientBuilder;
import org.apache.ripcord.exception.ConfigurationException;
import org.apache.ripcord.exception.InvalidArgumentException;
import org.apache.ripcord.exception.RipcordErrorCode;
import org.apache.ripcord.server.RipcordServer;
import org.apache.ripcord.server.RipcordServerBuilder;
import org.apache.ripcord.server.RpcService;
import org.apache.ripcord.value.Base64Value;
import org.apache.ripcord.value.DateTimeValue;
import org.apache.ripcord.value.Fault;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RipcordTest {

    @Nested
    class Factories {

        @Test
        void clientBuilderReturnsCorrectType() {
            RipcordClientBuilder builder = Ripcord.clientBuilder();
            assertThat(builder).isNotNull();
        }

        @Test
        void clientBuilderHasFluentApi() {
            RipcordClientBuilder builder = Ripcord.clientBuilder();

            // Verify fluent API returns same builder
            assertThat(builder.url("http://localhost:8080")).isSameAs(builder);
            assertThat(builder.throwExceptions(false)).isSameAs(builder);
            assertThat(builder.autoDecode(false)).isSameAs(builder);
            assertThat(builder.outputOption("verbosity", "pretty")).isSameAs(builder);
        }

        @Test
        void clientHasNoNamespace() throws Exception {
            try (RipcordClient client = Ripcord.client("http://localhost:8080/rpc")) {
                assertThat(client.path()).isEmpty();
            }
        }

        @Test
        void clientRejectsInvalidUrl() {
            assertThatThrownBy(() -> Ripcord.client("localhost"))
                    .isInstanceOf(InvalidArgumentException.class);
        }

        @Test
        void soapClientRequiresSoapCodec() {
            assertThatThrownBy(() -> Ripcord.soapClient("http://localhost:8080/rpc"))
                    .isInstanceOf(ConfigurationException.class)
                    .extracting("errorCode")
                    .isEqualTo(RipcordErrorCode.CODEC_NOT_AVAILABLE);
        }

        @Test
        void simpleClientRequiresSimpleCodec() {
            assertThatThrownBy(() -> Ripcord.simpleClient("http://localhost:8080/rpc"))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        void serverRegistersServicesByNamespace() {
            // given
            RpcService math = RpcService.builder().method("add", params -> 3).build();

            // when
            RipcordServer server = Ripcord.server(Map.of("math", math));

            // then
            assertThat(server.getMethods()).extracting("name").containsExactly("math.add");
        }

        @Test
        void serverBuilderHasFluentApi() {
            RipcordServerBuilder builder = Ripcord.serverBuilder();

            assertThat(builder.name("Test")).isSameAs(builder);
            assertThat(builder.disableDocumentor()).isSameAs(builder);
        }

        @Test
        void versionMethodsReturnValues() {
            assertThat(Ripcord.version()).isNotEmpty();
            assertThat(Ripcord.versionInfo()).isSameAs(RipcordVersion.getInstance());
        }
    }

    @Nested
    class Values {

        @Test
        void shouldCreateAndRecognizeFaults() {
            // when
            Fault fault = Ripcord.fault(-1, "Procedure nope not found.");

            // then
            assertThat(Ripcord.isFault(fault)).isTrue();
            assertThat(Ripcord.isFault(Map.of("faultCode", 4, "faultString", "Too many parameters."))).isTrue();
            assertThat(Ripcord.isFault(Map.of("faultCode", 4))).isFalse();
            assertThat(Ripcord.isFault("faultCode")).isFalse();
            assertThat(Ripcord.isFault(null)).isFalse();
        }

        @Test
        void shouldConvertBetweenTimestampAndDatetime() {
            // when
            DateTimeValue value = Ripcord.datetime(1272544200L);

            // then
            assertThat(value.iso8601()).isEqualTo("20100429T12:30:00");
            assertThat(Ripcord.timestamp(value)).isEqualTo(1272544200L);
        }

        @Test
        void shouldRejectTimestampOfNonDatetime() {
            assertThatThrownBy(() -> Ripcord.timestamp("20100429T12:30:00"))
                    .isInstanceOf(InvalidArgumentException.class)
                    .extracting("errorCode")
                    .isEqualTo(RipcordErrorCode.NOT_DATETIME);
        }

        @Test
        void shouldConvertBetweenBytesAndBase64() {
            // given
            byte[] data = "Ripcord".getBytes(StandardCharsets.UTF_8);

            // when
            Base64Value value = Ripcord.base64(data);

            // then
            assertThat(value.encoded()).isEqualTo("UmlwY29yZA==");
            assertThat(Ripcord.binary(value)).isEqualTo(data);
        }

        @Test
        void shouldRejectBinaryOfNonBase64() {
            assertThatThrownBy(() -> Ripcord.binary("UmlwY29yZA=="))
                    .isInstanceOf(InvalidArgumentException.class)
                    .extracting("errorCode")
                    .isEqualTo(RipcordErrorCode.NOT_BASE64);
        }

        @Test
        void shouldEncodeCallOutsideBatchScope() {
            // when
            Call call = Ripcord.encodeCall("math.add", 1, 2);

            // then
            assertThat(call.methodName()).isEqualTo("math.add");
            assertThat(call.params()).containsExactly(1, 2);
            assertThat(call.index()).isEmpty();
            assertThat(call.encode()).isEqualTo(Map.of("methodName", "math.add", "params", List.of(1, 2)));
        }
    }
}
