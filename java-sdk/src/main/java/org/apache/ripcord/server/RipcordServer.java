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
import org.apache.ripcord.codec.OutputOptions;
import org.apache.ripcord.codec.RpcCodec;
import org.apache.ripcord.codec.RpcRequest;
import org.apache.ripcord.documentor.Documentor;
import org.apache.ripcord.documentor.IntrospectionManifest;
import org.apache.ripcord.exception.CodecException;
import org.apache.ripcord.exception.InvalidArgumentException;
import org.apache.ripcord.exception.ProcedureNotFoundException;
import org.apache.ripcord.exception.RecursiveBatchException;
import org.apache.ripcord.exception.RemoteProcedureException;
import org.apache.ripcord.exception.RipcordErrorCode;
import org.apache.ripcord.exception.RipcordException;
import org.apache.ripcord.value.Fault;
import org.apache.ripcord.value.RpcResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An RPC server dispatching requests to registered procedures.
 *
 * <p>Example usage:
 * <pre>{@code
 * var server = RipcordServer.builder()
 *     .service("math", RpcService.builder()
 *         .method("add", params -> (Integer) params.get(0) + (Integer) params.get(1))
 *         .build())
 *     .build();
 * ServerResponse response = server.run(new ServerRequest(body, query));
 * }</pre>
 *
 * <p>Batch requests ({@code system.multiCall}) are dispatched here, each call in isolation: a failing call
 * yields a fault at its position and does not affect the others. Other {@code system.*} procedures are
 * answered by the built-in introspection methods.
 *
 * <p>Requests are independent; a server can serve several threads once its procedures are registered.
 */
public class RipcordServer {

    private static final Logger log = LoggerFactory.getLogger(RipcordServer.class);

    public static final String SYSTEM_PREFIX = "system.";
    public static final String MULTI_CALL = BuiltinMethods.MULTI_CALL;

    private static final String METHOD_NAME = "methodName";
    private static final String PARAMS = "params";

    private final MethodRegistry registry = new MethodRegistry();
    private final RpcCodec codec;
    private final Documentor documentor;
    private final BuiltinMethods builtins;
    private volatile OutputOptions outputOptions;

    RipcordServer(RpcCodec codec, Documentor documentor, OutputOptions outputOptions) {
        this.codec = codec;
        this.documentor = documentor;
        this.outputOptions = outputOptions;
        this.builtins = new BuiltinMethods(codec, () -> IntrospectionManifest.of(registry.snapshot()));
    }

    /**
     * Creates a new builder for configuring RipcordServer.
     *
     * @return a new builder instance
     */
    public static RipcordServerBuilder builder() {
        return new RipcordServerBuilder();
    }

    /**
     * Registers the public methods of a service without a namespace.
     *
     * @param service an {@link RpcService}
     * @throws InvalidArgumentException if the service is of an unknown type
     */
    public void addService(Object service) {
        addService(null, service);
    }

    /**
     * Registers a service under a namespace. The public methods of an {@link RpcService} are registered
     * as {@code namespace.method}; an {@link RpcProcedure} is registered under the namespace itself. A
     * blank or numeric namespace registers the methods without a prefix.
     *
     * @param namespace the namespace, may be null
     * @param service an {@link RpcService} or an {@link RpcProcedure}
     * @throws InvalidArgumentException if the service is of an unknown type
     */
    public void addService(String namespace, Object service) {
        boolean named = StringUtils.isNotBlank(namespace) && !StringUtils.isNumeric(namespace);
        if (service instanceof RpcService rpcService) {
            String prefix = named ? namespace + "." : "";
            rpcService.publicMethods().forEach(method -> registry.register(method.withName(prefix + method.name())));
        } else if (service instanceof RpcProcedure procedure && named) {
            addMethod(namespace, procedure);
        } else {
            throw new InvalidArgumentException(
                    RipcordErrorCode.UNKNOWN_SERVICE_TYPE, "Unknown service type " + StringUtils.defaultString(namespace));
        }
    }

    /**
     * Registers several services, keyed by namespace.
     *
     * @param services the services; numeric keys register without a namespace
     * @throws InvalidArgumentException if a service is of an unknown type
     */
    public void addServices(Map<String, ?> services) {
        services.forEach(this::addService);
    }

    public void addMethod(String name, RpcProcedure procedure) {
        addMethod(new MethodDescriptor(name, procedure));
    }

    public void addMethod(String name, RpcProcedure procedure, String description) {
        addMethod(new MethodDescriptor(name, procedure, description));
    }

    /**
     * Registers a method, replacing any method registered under the same name.
     *
     * @param method the method
     */
    public void addMethod(MethodDescriptor method) {
        registry.register(method);
    }

    /**
     * Calls a procedure.
     *
     * @param methodName the public procedure name
     * @param params the positional arguments
     * @return the result of the procedure
     * @throws ProcedureNotFoundException if no such procedure is registered
     * @throws RecursiveBatchException for {@code system.multiCall}
     * @throws RemoteProcedureException if the procedure or a built-in answers with a fault
     */
    public Object call(String methodName, List<?> params) {
        Optional<MethodDescriptor> method = registry.find(methodName);
        if (method.isPresent()) {
            try {
                return method.get().procedure().invoke(new ArrayList<>(params));
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new RemoteProcedureException(RipcordErrorCode.PROCEDURE_FAILED.getCode(), e.getMessage(), e);
            }
        }
        if (!methodName.startsWith(SYSTEM_PREFIX)) {
            throw new ProcedureNotFoundException(methodName);
        }
        if (MULTI_CALL.equals(methodName)) {
            throw new RecursiveBatchException();
        }
        // built-ins only speak the wire format
        OutputOptions options = outputOptions;
        byte[] request = codec.encodeRequest(methodName, params, options);
        Object result = codec.decodeResponse(builtins.handle(request, options));
        if (result instanceof Fault fault) {
            throw new RemoteProcedureException(fault);
        }
        return result;
    }

    /**
     * Calls a procedure, turning any failure into a fault.
     *
     * @param methodName the public procedure name
     * @param params the positional arguments
     * @return the result or the fault
     */
    public RpcResult dispatch(String methodName, List<?> params) {
        try {
            return RpcResult.success(call(methodName, params));
        } catch (RipcordException e) {
            log.debug("Procedure {} answered with fault {}: {}", methodName, e.getFaultCode(), e.getMessage());
            return RpcResult.failure(Fault.of(e));
        } catch (RuntimeException e) {
            log.warn("Procedure {} failed", methodName, e);
            return RpcResult.failure(new Fault(RipcordErrorCode.PROCEDURE_FAILED.getCode(), e.getMessage()));
        }
    }

    /**
     * Answers an encoded request.
     *
     * @param payload the encoded request
     * @return the encoded response, a fault envelope when the request failed as a whole
     */
    public byte[] handle(byte[] payload) {
        OutputOptions options = outputOptions;
        Object response;
        try {
            RpcRequest request = codec.decodeRequest(payload);
            log.debug("Dispatching {}", request.methodName());
            response = MULTI_CALL.equals(request.methodName())
                    ? handleBatch(request.params(), options)
                    : dispatch(request.methodName(), request.params()).toWireValue();
            return codec.encodeResponse(response, options);
        } catch (CodecException e) {
            log.debug("Cannot answer request: {}", e.getMessage());
            return codec.encodeResponse(Fault.of(e), options);
        }
    }

    /**
     * Runs one request: answers the payload, or documents the server when there is none.
     *
     * @param request the request
     * @return the response
     */
    public ServerResponse run(ServerRequest request) {
        if (documentor != null) {
            documentor.setMethodData(registry.snapshot());
        }
        OutputOptions options = outputOptions;
        if (!request.hasPayload()) {
            if (documentor != null) {
                return documentor.handle(this, request.query());
            }
            Fault fault = Fault.of(RipcordErrorCode.NO_REQUEST_PAYLOAD, "No request payload found.");
            return ServerResponse.xml(codec.encodeResponse(fault, options), options.encoding());
        }
        return ServerResponse.xml(handle(request.body()), options.encoding());
    }

    /**
     * Changes one output option of the responses.
     *
     * @param name the option name
     * @param value the option value
     * @return false if there is no option with that name
     * @throws IllegalArgumentException if the value is not valid for the option
     */
    public boolean setOutputOption(String name, Object value) {
        if (!OutputOptions.isOptionName(name)) {
            return false;
        }
        synchronized (this) {
            outputOptions = outputOptions.toBuilder().option(name, value).build();
        }
        return true;
    }

    public OutputOptions getOutputOptions() {
        return outputOptions;
    }

    /**
     * Returns the registered methods.
     *
     * @return a snapshot in registration order
     */
    public List<MethodDescriptor> getMethods() {
        return registry.snapshot();
    }

    public Optional<Documentor> getDocumentor() {
        return Optional.ofNullable(documentor);
    }

    private Object handleBatch(List<Object> params, OutputOptions options) {
        if (params.isEmpty() || !(params.get(0) instanceof List<?> calls)) {
            return Fault.of(RipcordErrorCode.ILLEGAL_BATCH_PARAMS, "Illegal or no params set for " + MULTI_CALL);
        }
        if (calls.stream().anyMatch(call -> call instanceof Map<?, ?> map && MULTI_CALL.equals(map.get(METHOD_NAME)))) {
            return Fault.of(new RecursiveBatchException());
        }
        List<Object> results = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            if (!(calls.get(i) instanceof Map<?, ?> call) || !(call.get(METHOD_NAME) instanceof String methodName)) {
                results.add(Fault.of(RipcordErrorCode.NOT_RIPCORD_CALL, "Argument " + i + " is not a valid Ripcord call"));
                continue;
            }
            RpcResult result = dispatch(methodName, toParams(call.get(PARAMS)));
            // non-fault results of a multiCall are wrapped in a single item array
            results.add(result.isFault() ? result.fault() : encodable(methodName, result.value(), options));
        }
        return results;
    }

    private Object encodable(String methodName, Object value, OutputOptions options) {
        try {
            codec.encodeResponse(value, options);
            return Collections.singletonList(value);
        } catch (CodecException e) {
            log.debug("Cannot encode result of {}: {}", methodName, e.getMessage());
            return Fault.of(e);
        }
    }

    private static List<?> toParams(Object params) {
        if (params == null) {
            return List.of();
        }
        if (params instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (params instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return Collections.singletonList(params);
    }
}
