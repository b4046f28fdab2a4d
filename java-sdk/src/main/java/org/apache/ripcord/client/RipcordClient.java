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

package org.apache.ripcord.client;

import org.apache.commons.lang3.StringUtils;
import org.apache.ripcord.exception.CodecException;
import org.apache.ripcord.exception.InvalidArgumentException;
import org.apache.ripcord.exception.RemoteProcedureException;
import org.apache.ripcord.value.Base64Value;
import org.apache.ripcord.value.DateTimeValue;
import org.apache.ripcord.value.Fault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A client for an XML-RPC server. Remote procedures are called by name, optionally inside namespaces:
 *
 * <pre>{@code
 * var client = RipcordClient.builder().url("http://www.moviemeter.nl/ws").build();
 * Object score = client.child("film").invoke("getScore", "e3dee9d19a8c3af7c92f9067d2945b59", 500);
 * }</pre>
 *
 * <p>Entering the {@code system} namespace opens a batch scope: calls made while it is open are not sent
 * but returned as {@link Call}s, which {@code system.multiCall} then sends in one request:
 *
 * <pre>{@code
 * List<?> results = (List<?>) client.system().multiCall(
 *     client.system().invoke("listMethods"),
 *     client.invoke("getFoo"));
 * }</pre>
 *
 * <p>A plain call in the {@code system} namespace, such as {@code client.system().invoke("listMethods")},
 * closes the scope it opened and is sent immediately.
 *
 * <p>All namespace nodes of a client share its transport, its batch scope and the diagnostic
 * request/response buffers of the root node. A client is not thread-safe.
 */
public class RipcordClient implements Namespace, Closeable {

    private static final Logger log = LoggerFactory.getLogger(RipcordClient.class);

    public static final String SYSTEM = "system";
    public static final String MULTI_CALL = "system.multiCall";

    private final ClientSession session;
    private final RipcordClient root;
    private final Optional<String> namespace;
    private final Map<String, RipcordClient> children = new HashMap<>();
    private String lastRequest = "";
    private String lastResponse = "";

    RipcordClient(ClientSession session) {
        this.session = session;
        this.root = this;
        this.namespace = Optional.empty();
    }

    private RipcordClient(RipcordClient parent, String name) {
        this.session = parent.session;
        this.root = parent.root;
        this.namespace = Optional.of(parent.namespace.map(path -> path + "." + name).orElse(name));
    }

    /**
     * Creates a new builder for configuring RipcordClient.
     *
     * @return a new builder instance
     */
    public static RipcordClientBuilder builder() {
        return new RipcordClientBuilder();
    }

    @Override
    public RipcordClient child(String name) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Namespace name cannot be blank");
        }
        RipcordClient child = children.computeIfAbsent(name, segment -> new RipcordClient(this, segment));
        if (child.isSystemNamespace()) {
            session.enterBatchScope();
        }
        return child;
    }

    /**
     * Returns the {@code system} namespace, opening a batch scope.
     *
     * @return the system namespace
     */
    public RipcordClient system() {
        return child(SYSTEM);
    }

    @Override
    public Optional<String> path() {
        return namespace;
    }

    @Override
    public Object invoke(String name, Object... args) {
        String methodName = namespace.map(path -> path + "." + name).orElse(name);
        Object[] arguments = args == null ? new Object[0] : args;

        if (session.batchDepth() > 0 && isSystemNamespace()) {
            session.leaveBatchScope();
        }
        if (MULTI_CALL.equals(methodName)) {
            session.resetBatchScope();
            return executeBatch(arguments);
        }
        if (session.batchDepth() > 0) {
            log.debug("Deferring {} for a batch", methodName);
            return new Call(methodName, Arrays.asList(arguments));
        }
        return execute(methodName, Arrays.asList(arguments));
    }

    /**
     * Sends the given calls with {@code system.multiCall}.
     *
     * <p>Accepts {@link Call}s and maps holding a {@code methodName} and optional {@code params}, either
     * as arguments or as a single collection.
     *
     * @param calls the calls to send
     * @return the unwrapped results aligned with the calls, or the {@link Fault} answered for the whole
     *         batch when the client does not throw exceptions
     * @throws InvalidArgumentException if an argument is not a call, before anything is sent
     */
    public Object multiCall(Object... calls) {
        if (isSystemNamespace()) {
            return invoke("multiCall", calls);
        }
        return root.system().multiCall(calls);
    }

    /**
     * Returns the last request sent by any namespace of this client. For debugging purposes.
     *
     * @return the request payload as text
     */
    public String getLastRequest() {
        return root.lastRequest;
    }

    /**
     * Returns the last response received by any namespace of this client. For debugging purposes.
     *
     * @return the response payload as text
     */
    public String getLastResponse() {
        return root.lastResponse;
    }

    /**
     * Closes the transport shared by all namespaces of this client, if it can be closed.
     */
    @Override
    public void close() throws IOException {
        if (session.transport() instanceof Closeable closeable) {
            closeable.close();
        }
    }

    @Override
    public String toString() {
        return "RipcordClient{url=" + session.url() + namespace.map(path -> ", namespace=" + path).orElse("") + "}";
    }

    private boolean isSystemNamespace() {
        return namespace.filter(SYSTEM::equals).isPresent();
    }

    private Object execute(String methodName, List<?> params) {
        byte[] request = session.codec().encodeRequest(methodName, params, session.outputOptions());
        log.debug("Calling {} on {}", methodName, session.url());
        byte[] response = session.transport().post(session.url(), request);
        root.lastRequest = new String(request, session.outputOptions().encoding());
        root.lastResponse = new String(response, session.outputOptions().encoding());
        Object result = session.codec().decodeResponse(response);
        if (result instanceof Fault fault && session.throwExceptions()) {
            throw new RemoteProcedureException(fault);
        }
        return result;
    }

    private Object executeBatch(Object[] arguments) {
        List<?> entries = batchEntries(arguments);
        Object batch = new Object();
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            if (entry instanceof Call call) {
                if (call.isEnrolled()) {
                    throw new InvalidArgumentException(
                            "Argument " + i + " has already been sent with another system.multiCall");
                }
            } else if (!isCallShaped(entry)) {
                throw new InvalidArgumentException("Argument " + i + " is not a valid Ripcord call");
            }
        }

        List<Object> requests = new ArrayList<>();
        List<Integer> positions = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            if (entry instanceof Call call) {
                if (!call.isEnrolledIn(batch)) {
                    call.enroll(batch, requests.size());
                    requests.add(call.encode());
                }
                positions.add(call.index().getAsInt());
            } else {
                positions.add(requests.size());
                requests.add(encodeCallShaped((Map<?, ?>) entry));
            }
        }

        Object result = execute(MULTI_CALL, List.of(requests));
        if (result instanceof Fault) {
            return result;
        }
        if (!(result instanceof List<?> results) || results.size() != requests.size()) {
            throw new CodecException("Expected " + requests.size() + " results from " + MULTI_CALL + " but got "
                    + (result instanceof List<?> list ? list.size() : result));
        }

        List<Object> values = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Object value = unwrap(results.get(positions.get(i)));
            if (entries.get(i) instanceof Call call) {
                call.bindResult(value);
            }
            values.add(value);
        }
        return values;
    }

    private static List<?> batchEntries(Object[] arguments) {
        if (arguments.length == 1 && arguments[0] instanceof Collection<?> calls) {
            return new ArrayList<>(calls);
        }
        if (arguments.length == 1 && arguments[0] instanceof Object[] calls) {
            return Arrays.asList(calls);
        }
        return Arrays.asList(arguments);
    }

    private static boolean isCallShaped(Object entry) {
        return entry instanceof Map<?, ?> map
                && map.get(Call.METHOD_NAME) instanceof String methodName
                && StringUtils.isNotBlank(methodName);
    }

    private static Map<String, Object> encodeCallShaped(Map<?, ?> entry) {
        Object params = entry.get(Call.PARAMS);
        List<?> list;
        if (params == null) {
            list = List.of();
        } else if (params instanceof Collection<?> collection) {
            list = new ArrayList<>(collection);
        } else if (params instanceof Object[] array) {
            list = Arrays.asList(array);
        } else {
            list = List.of(params);
        }
        return new Call((String) entry.get(Call.METHOD_NAME), list).encode();
    }

    private Object unwrap(Object value) {
        Object result = value;
        if (result instanceof List<?> list && list.size() == 1) {
            // non-fault results of a multiCall are wrapped in a single item array
            result = list.get(0);
        } else if (Fault.isFault(result)) {
            return Fault.from(result);
        }
        if (session.autoDecode()) {
            if (result instanceof Base64Value blob) {
                result = blob.bytes();
            } else if (result instanceof DateTimeValue dateTime) {
                result = dateTime.epochSecond();
            }
        }
        return result;
    }
}
