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

import org.apache.ripcord.codec.OutputOptions;
import org.apache.ripcord.codec.Verbosity;
import org.apache.ripcord.codec.XmlRpcCodec;
import org.apache.ripcord.documentor.Documentor;
import org.apache.ripcord.exception.InvalidArgumentException;
import org.apache.ripcord.exception.ProcedureNotFoundException;
import org.apache.ripcord.exception.RecursiveBatchException;
import org.apache.ripcord.exception.RemoteProcedureException;
import org.apache.ripcord.exception.RipcordErrorCode;
import org.apache.ripcord.value.Fault;
import org.apache.ripcord.value.RpcResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.LIST;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

class RipcordServerTest {

    private final XmlRpcCodec codec = new XmlRpcCodec();
    private RipcordServer server;

    @BeforeEach
    void setUp() {
        server = RipcordServer.builder()
                .method("echo", params -> params.get(0), "Echoes.\n\nReturns the argument.")
                .service("math", RpcService.builder()
                        .method(new MethodDescriptor("add",
                                params -> (Integer) params.get(0) + (Integer) params.get(1),
                                "Adds two integers.",
                                List.of(List.of("int", "int", "int"))))
                        .method("_reset", params -> null)
                        .build())
                .method("silent", params -> "quiet")
                .method("boom", params -> {
                    throw new IllegalStateException("boom");
                })
                .method("custom", params -> {
                    throw new RemoteProcedureException(42, "custom failure");
                })
                .method("io", params -> {
                    throw new IOException("disk unavailable");
                })
                .build();
    }

    private Object send(String methodName, Object... params) {
        byte[] request = codec.encodeRequest(methodName, List.of(params), OutputOptions.clientDefaults());
        return codec.decodeResponse(server.handle(request));
    }

    private static Map<String, Object> call(String methodName, Object... params) {
        Map<String, Object> call = new LinkedHashMap<>();
        call.put("methodName", methodName);
        call.put("params", List.of(params));
        return call;
    }

    @Nested
    class Registration {

        @Test
        void shouldQualifyServiceMethodsWithNamespace() {
            // when
            List<String> names = server.getMethods().stream().map(MethodDescriptor::name).toList();

            // then
            assertThat(names).containsExactly("echo", "math.add", "silent", "boom", "custom", "io");
        }

        @Test
        void shouldNotRegisterUnderscoreMethods() {
            assertThatThrownBy(() -> server.call("math._reset", List.of()))
                    .isInstanceOf(ProcedureNotFoundException.class);
        }

        @Test
        void shouldRegisterNumericKeysWithoutNamespace() {
            // given
            Map<String, Object> services = new LinkedHashMap<>();
            services.put("0", RpcService.builder().method("ping", params -> "pong").build());
            services.put("text", RpcService.builder().method("upper", params -> params.get(0).toString().toUpperCase()).build());
            services.put("now", (RpcProcedure) params -> 1272544200);
            RipcordServer target = RipcordServer.builder().services(services).disableDocumentor().build();

            // when
            List<String> names = target.getMethods().stream().map(MethodDescriptor::name).toList();

            // then
            assertThat(names).containsExactly("ping", "text.upper", "now");
            assertThat(target.call("text.upper", List.of("abc"))).isEqualTo("ABC");
        }

        @Test
        void shouldReplaceMethodWithSameName() {
            // given
            server.addMethod("echo", params -> "second");

            // when
            Object result = server.call("echo", List.of("first"));

            // then
            assertThat(result).isEqualTo("second");
            assertThat(server.getMethods()).hasSize(6);
        }

        @Test
        void shouldRejectUnknownServiceType() {
            assertThatThrownBy(() -> server.addService("broken", "not a service"))
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessage("Unknown service type broken")
                    .extracting("errorCode")
                    .isEqualTo(RipcordErrorCode.UNKNOWN_SERVICE_TYPE);
        }

        @Test
        void shouldRejectProcedureWithoutNamespace() {
            assertThatThrownBy(() -> server.addService((RpcProcedure) params -> null))
                    .isInstanceOf(InvalidArgumentException.class);
        }
    }

    @Nested
    class DirectCalls {

        @Test
        void shouldCallRegisteredProcedure() {
            assertThat(server.call("math.add", List.of(2, 3))).isEqualTo(5);
        }

        @Test
        void shouldRejectUnknownProcedure() {
            assertThatThrownBy(() -> server.call("nope", List.of()))
                    .isInstanceOf(ProcedureNotFoundException.class)
                    .hasMessage("Procedure nope not found.");
        }

        @Test
        void shouldRejectDirectBatch() {
            assertThatThrownBy(() -> server.call("system.multiCall", List.of(List.of())))
                    .isInstanceOf(RecursiveBatchException.class);
        }

        @Test
        void shouldReportUnknownSystemProcedureAsFault() {
            assertThatThrownBy(() -> server.call("system.nope", List.of()))
                    .isInstanceOf(RemoteProcedureException.class)
                    .extracting("faultCode")
                    .isEqualTo(-1);
        }

        @Test
        void shouldWrapCheckedFailures() {
            assertThatThrownBy(() -> server.call("io", List.of()))
                    .isInstanceOf(RemoteProcedureException.class)
                    .hasMessage("disk unavailable")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        void shouldDispatchFailureAsFault() {
            // when
            RpcResult result = server.dispatch("boom", List.of());

            // then
            assertThat(result.isFault()).isTrue();
            assertThat(result.fault()).isEqualTo(new Fault(0, "boom"));
        }
    }

    @Nested
    class SingleRequests {

        @Test
        void shouldAnswerWithResult() {
            assertThat(send("echo", "hello")).isEqualTo("hello");
        }

        @Test
        void shouldAnswerUnknownProcedureWithFault() {
            assertThat(send("nope")).isEqualTo(new Fault(-1, "Procedure nope not found."));
        }

        @Test
        void shouldAnswerFailuresWithFaultCodes() {
            assertThat(send("boom")).isEqualTo(new Fault(0, "boom"));
            assertThat(send("custom")).isEqualTo(new Fault(42, "custom failure"));
            assertThat(send("io")).isEqualTo(new Fault(0, "disk unavailable"));
        }

        @Test
        void shouldAnswerMalformedPayloadWithFault() {
            // when
            Object response = codec.decodeResponse(server.handle("<methodCall><params>".getBytes(StandardCharsets.UTF_8)));

            // then
            assertThat(response).isInstanceOf(Fault.class);
            assertThat(((Fault) response).faultCode()).isEqualTo(RipcordErrorCode.MALFORMED_PAYLOAD.getCode());
        }
    }

    @Nested
    class Batches {

        @Test
        void shouldWrapResultsAndIsolateFaults() {
            // when
            Object response = send("system.multiCall", List.of(call("echo", 1), call("noSuchOp")));

            // then
            assertThat(response).isEqualTo(List.of(
                    List.of(1),
                    Map.of("faultCode", -1, "faultString", "Procedure noSuchOp not found.")));
        }

        @Test
        void shouldIsolateResultThatCannotBeEncoded() {
            // given
            server.addMethod("nan", params -> Double.NaN);

            // when
            Object response = send("system.multiCall", List.of(call("echo", 1), call("nan"), call("math.add", 1, 2)));

            // then
            assertThat(response).isEqualTo(List.of(
                    List.of(1),
                    Map.of("faultCode", -10, "faultString", "Cannot encode non-finite double NaN"),
                    List.of(3)));
        }

        @Test
        void shouldRunBuiltinsInsideBatch() {
            // when
            Object response = send("system.multiCall", List.of(call("system.listMethods"), call("math.add", 1, 2)));

            // then
            List<?> results = (List<?>) response;
            assertThat(results.get(0)).asInstanceOf(LIST).singleElement().asInstanceOf(LIST).contains("echo");
            assertThat(results.get(1)).isEqualTo(List.of(3));
        }

        @Test
        void shouldRejectNestedBatchAsWhole() {
            // when
            Object response = send("system.multiCall", List.of(call("echo", 1), call("system.multiCall", List.of())));

            // then
            assertThat(response).isEqualTo(new Fault(-3, "Cannot recurse system.multiCall"));
        }

        @Test
        void shouldRejectMissingCallList() {
            assertThat(send("system.multiCall"))
                    .isEqualTo(new Fault(-11, "Illegal or no params set for system.multiCall"));
        }

        @Test
        void shouldReportInvalidEntryAtItsPosition() {
            // when
            Object response = send("system.multiCall", List.of("not a call", call("echo", 1)));

            // then
            assertThat(response).isEqualTo(List.of(
                    Map.of("faultCode", -2, "faultString", "Argument 0 is not a valid Ripcord call"),
                    List.of(1)));
        }
    }

    @Nested
    class Introspection {

        @Test
        void shouldListRegisteredAndBuiltinMethods() {
            // when
            Object names = server.call("system.listMethods", List.of());

            // then
            assertThat(names).asInstanceOf(LIST)
                    .startsWith("echo", "math.add")
                    .contains("system.listMethods", "system.methodHelp", "system.multiCall")
                    .doesNotContain("math._reset");
        }

        @Test
        void shouldSeeMethodsAddedAfterBuild() {
            // given
            server.addMethod("late", params -> null);

            // when
            Object names = server.call("system.listMethods", List.of());

            // then
            assertThat(names).asInstanceOf(LIST).contains("late");
        }

        @Test
        void shouldWrapHelpInParagraphs() {
            assertThat(server.call("system.methodHelp", List.of("echo")))
                    .isEqualTo("<p>Echoes.</p><p>Returns the argument.</p>");
            assertThat(server.call("system.methodHelp", List.of("silent"))).isEqualTo("");
        }

        @Test
        void shouldFaultHelpOfUnknownMethod() {
            assertThatThrownBy(() -> server.call("system.methodHelp", List.of("nope")))
                    .isInstanceOf(RemoteProcedureException.class)
                    .hasMessage("Procedure nope not found.");
        }

        @Test
        void shouldFaultHelpWithoutName() {
            assertThatThrownBy(() -> server.call("system.methodHelp", List.of()))
                    .isInstanceOf(RemoteProcedureException.class)
                    .hasMessage("system.methodHelp expects a procedure name");
        }

        @Test
        void shouldReturnKnownSignatures() {
            assertThat(server.call("system.methodSignature", List.of("math.add")))
                    .isEqualTo(List.of(List.of("int", "int", "int")));
            assertThat(server.call("system.methodSignature", List.of("echo"))).isEqualTo("undef");
        }

        @Test
        void shouldDescribeMethods() {
            // when
            Object description = server.call("system.describeMethods", List.of());

            // then
            assertThat(description).asInstanceOf(MAP).containsKey("methodList");
            Map<?, ?> map = (Map<?, ?>) description;
            assertThat(map.get("version")).isEqualTo("1.0");
            Map<?, ?> first = (Map<?, ?>) ((List<?>) map.get("methodList")).get(0);
            assertThat(first.get("name")).isEqualTo("echo");
            assertThat(first.get("purpose")).isEqualTo("<p>Echoes.</p><p>Returns the argument.</p>");
        }

        @Test
        void shouldListCapabilities() {
            // when
            Object capabilities = server.call("system.getCapabilities", List.of());

            // then
            Map<?, ?> map = (Map<?, ?>) capabilities;
            assertThat(List.<Object>copyOf(map.keySet())).containsExactlyInAnyOrder("xmlrpc", "introspect", "system.multicall", "nil");
            assertThat(((Map<?, ?>) map.get("xmlrpc")).get("specVersion")).isEqualTo(1);
        }
    }

    @Nested
    class Run {

        @Test
        void shouldAnswerPayloadAsXml() {
            // given
            byte[] request = codec.encodeRequest("echo", List.of(7), OutputOptions.clientDefaults());

            // when
            ServerResponse response = server.run(ServerRequest.of(request));

            // then
            assertThat(response.contentType()).isEqualTo("text/xml; charset=utf-8");
            assertThat(codec.decodeResponse(response.body())).isEqualTo(7);
        }

        @Test
        void shouldDocumentServerWithoutPayload() {
            // when
            ServerResponse response = server.run(new ServerRequest(new byte[0], null));

            // then
            String html = response.text(StandardCharsets.UTF_8);
            assertThat(response.contentType()).isEqualTo("text/html; charset=utf-8");
            assertThat(html)
                    .contains("<title>Ripcord: Simple RPC Server</title>")
                    .contains("<h2>math.add( int , int , int )</h2><p>Adds two integers.</p>")
                    .contains("<h2>echo(  )</h2><p>Echoes.</p><p>Returns the argument.</p>");
        }

        @Test
        void shouldServeManifestQuery() {
            // given
            server.addMethod("late", params -> null);

            // when
            ServerResponse response = server.run(new ServerRequest(null, "manifest"));

            // then
            String json = response.text(StandardCharsets.UTF_8);
            assertThat(response.contentType()).isEqualTo("application/json; charset=utf-8");
            assertThat(json).contains("\"methodList\"", "\"math.add\"", "\"late\"");
        }

        @Test
        void shouldSnapshotMethodsForDocumentor() {
            // given
            server.addMethod("late", params -> null);
            Documentor documentor = server.getDocumentor().orElseThrow();
            assertThat(documentor.getIntrospection().names()).isEmpty();

            // when
            server.run(ServerRequest.of(codec.encodeRequest("echo", List.of(1), OutputOptions.clientDefaults())));

            // then
            assertThat(documentor.getIntrospection().names()).contains("echo", "late");
        }

        @Test
        void shouldFaultMissingPayloadWithoutDocumentor() {
            // given
            RipcordServer bare = RipcordServer.builder().method("echo", params -> params.get(0)).disableDocumentor().build();

            // when
            ServerResponse response = bare.run(ServerRequest.of(new byte[0]));

            // then
            assertThat(bare.getDocumentor()).isEmpty();
            assertThat(codec.decodeResponse(response.body())).isEqualTo(new Fault(-9, "No request payload found."));
        }
    }

    @Nested
    class OutputOptionChanges {

        @Test
        void shouldChangeKnownOption() {
            // when
            boolean changed = server.setOutputOption("verbosity", "no_white_space");

            // then
            assertThat(changed).isTrue();
            assertThat(server.getOutputOptions().verbosity()).isEqualTo(Verbosity.NO_WHITE_SPACE);
            String response = new String(
                    server.handle(codec.encodeRequest("echo", List.of(1), OutputOptions.clientDefaults())),
                    StandardCharsets.UTF_8);
            assertThat(response).doesNotContain("\n");
        }

        @Test
        void shouldIgnoreUnknownOption() {
            assertThat(server.setOutputOption("colour", "blue")).isFalse();
        }
    }
}
