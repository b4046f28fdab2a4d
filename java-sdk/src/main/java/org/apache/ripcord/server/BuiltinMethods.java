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
import org.apache.ripcord.codec.RpcCodec;
import org.apache.ripcord.codec.RpcRequest;
import org.apache.ripcord.documentor.IntrospectionManifest;
import org.apache.ripcord.documentor.MethodDescription;
import org.apache.ripcord.exception.ProcedureNotFoundException;
import org.apache.ripcord.exception.RemoteProcedureException;
import org.apache.ripcord.exception.RipcordErrorCode;
import org.apache.ripcord.exception.RipcordException;
import org.apache.ripcord.value.Fault;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The {@code system.*} procedures provided by the protocol runtime rather than registered by the
 * application: introspection and capabilities. They speak the wire format, answering an encoded request
 * with an encoded response.
 *
 * <p>{@code system.multiCall} is listed here but dispatched by {@link RipcordServer}.
 */
final class BuiltinMethods {

    static final String LIST_METHODS = "system.listMethods";
    static final String METHOD_HELP = "system.methodHelp";
    static final String METHOD_SIGNATURE = "system.methodSignature";
    static final String DESCRIBE_METHODS = "system.describeMethods";
    static final String GET_CAPABILITIES = "system.getCapabilities";
    static final String MULTI_CALL = "system.multiCall";

    static final String UNDEFINED_SIGNATURE = "undef";

    private static final List<MethodDescription> DESCRIPTIONS = List.of(
            new MethodDescription(LIST_METHODS, "<p>Lists the procedures of this server.</p>",
                    List.of(List.of("array"))),
            new MethodDescription(METHOD_HELP, "<p>Returns the help text of a procedure.</p>",
                    List.of(List.of("string", "string"))),
            new MethodDescription(METHOD_SIGNATURE, "<p>Returns the known signatures of a procedure.</p>",
                    List.of(List.of("array", "string"))),
            new MethodDescription(DESCRIBE_METHODS, "<p>Describes every procedure of this server.</p>",
                    List.of(List.of("struct"))),
            new MethodDescription(GET_CAPABILITIES, "<p>Lists the protocol extensions of this server.</p>",
                    List.of(List.of("struct"))),
            new MethodDescription(MULTI_CALL, "<p>Calls several procedures in one request.</p>",
                    List.of(List.of("array", "array"))));

    private final RpcCodec codec;
    private final Supplier<IntrospectionManifest> introspection;

    BuiltinMethods(RpcCodec codec, Supplier<IntrospectionManifest> introspection) {
        this.codec = codec;
        this.introspection = introspection;
    }

    /**
     * Answers an encoded {@code system.*} request.
     *
     * @param request the encoded request
     * @param options the output options of the response
     * @return the encoded response, a fault envelope if the call failed
     */
    byte[] handle(byte[] request, OutputOptions options) {
        Object result;
        try {
            RpcRequest decoded = codec.decodeRequest(request);
            result = call(decoded.methodName(), decoded.params());
        } catch (RipcordException e) {
            result = Fault.of(e);
        }
        return codec.encodeResponse(result, options);
    }

    private Object call(String methodName, List<Object> params) {
        return switch (methodName) {
            case LIST_METHODS -> listMethods();
            case METHOD_HELP -> methodHelp(requireMethodName(methodName, params));
            case METHOD_SIGNATURE -> methodSignature(requireMethodName(methodName, params));
            case DESCRIBE_METHODS -> describeMethods();
            case GET_CAPABILITIES -> capabilities();
            default -> throw new ProcedureNotFoundException(methodName);
        };
    }

    private List<String> listMethods() {
        List<String> names = new ArrayList<>(introspection.get().names());
        DESCRIPTIONS.forEach(method -> names.add(method.name()));
        return names;
    }

    private String methodHelp(String name) {
        return describe(name).map(MethodDescription::purpose).orElseGet(() -> {
            requireKnown(name);
            return "";
        });
    }

    private Object methodSignature(String name) {
        Optional<MethodDescription> description = describe(name);
        if (description.isEmpty()) {
            requireKnown(name);
        }
        List<List<String>> signatures = description.map(MethodDescription::signatures).orElse(List.of());
        return signatures.isEmpty() ? UNDEFINED_SIGNATURE : signatures;
    }

    private Map<String, Object> describeMethods() {
        List<Object> methodList = new ArrayList<>();
        List<MethodDescription> all = new ArrayList<>(introspection.get().methodList());
        all.addAll(DESCRIPTIONS);
        for (MethodDescription method : all) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", method.name());
            entry.put("purpose", method.purpose());
            entry.put("signatures", method.signatures());
            methodList.add(entry);
        }
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("version", IntrospectionManifest.VERSION);
        description.put("methodList", methodList);
        return description;
    }

    private static Map<String, Object> capabilities() {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("xmlrpc", capability("http://www.xmlrpc.com/spec", 1));
        capabilities.put("introspect", capability("http://xmlrpc-epi.sourceforge.net/specs/rfc.introspection.php", 2));
        capabilities.put("system.multicall", capability("http://www.xmlrpc.com/discuss/msgReader$1208", 1));
        capabilities.put("nil", capability("http://www.ontosys.com/xml-rpc/extensions.php", 20010516));
        return capabilities;
    }

    private static Map<String, Object> capability(String specUrl, int specVersion) {
        Map<String, Object> capability = new LinkedHashMap<>();
        capability.put("specUrl", specUrl);
        capability.put("specVersion", specVersion);
        return capability;
    }

    private Optional<MethodDescription> describe(String name) {
        return introspection.get().find(name)
                .or(() -> DESCRIPTIONS.stream().filter(method -> method.name().equals(name)).findFirst());
    }

    private void requireKnown(String name) {
        if (!introspection.get().names().contains(name)) {
            throw new ProcedureNotFoundException(name);
        }
    }

    private static String requireMethodName(String methodName, List<Object> params) {
        if (params.isEmpty() || !(params.get(0) instanceof String name)) {
            throw new RemoteProcedureException(
                    RipcordErrorCode.PROCEDURE_FAILED.getCode(), methodName + " expects a procedure name");
        }
        return name;
    }
}
