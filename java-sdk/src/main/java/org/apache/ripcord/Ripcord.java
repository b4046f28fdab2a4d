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
import org.apache.ripcord.codec.ProtocolVersion;
import org.apache.ripcord.exception.InvalidArgumentException;
import org.apache.ripcord.exception.RipcordErrorCode;
import org.apache.ripcord.server.RipcordServer;
import org.apache.ripcord.server.RipcordServerBuilder;
import org.apache.ripcord.transport.Transport;
import org.apache.ripcord.value.Base64Value;
import org.apache.ripcord.value.DateTimeValue;
import org.apache.ripcord.value.Fault;

import java.util.Map;

/**
 * Main entry point for creating Ripcord clients and servers, and for converting protocol values.
 *
 * <h2>Clients</h2>
 * <pre>{@code
 * var client = Ripcord.client("http://www.moviemeter.nl/ws");
 * Object score = client.child("film").invoke("getScore", "e3dee9d19a8c3af7c92f9067d2945b59", 500);
 *
 * var configured = Ripcord.clientBuilder()
 *     .url("http://localhost:8080/rpc")
 *     .throwExceptions(true)
 *     .build();
 * }</pre>
 *
 * <h2>Servers</h2>
 * <pre>{@code
 * var server = Ripcord.server(Map.of("math", mathService));
 * }</pre>
 *
 * <h2>Values</h2>
 * <pre>{@code
 * DateTimeValue when = Ripcord.datetime(1272544200L);
 * long seconds = Ripcord.timestamp(when);
 * Base64Value blob = Ripcord.base64(bytes);
 * byte[] data = Ripcord.binary(blob);
 * }</pre>
 *
 * @see RipcordClient
 * @see RipcordServer
 */
public final class Ripcord {

    private Ripcord() {}

    /**
     * Creates a client for the given endpoint with the default options.
     *
     * @param url the endpoint URL
     * @return a new client
     */
    public static RipcordClient client(String url) {
        return clientBuilder().url(url).build();
    }

    /**
     * Creates a client for the given endpoint.
     *
     * @param url the endpoint URL
     * @param outputOptions output options keyed by wire name
     * @return a new client
     */
    public static RipcordClient client(String url, Map<String, ?> outputOptions) {
        return clientBuilder().url(url).outputOptions(outputOptions).build();
    }

    /**
     * Creates a client for the given endpoint posting through the given transport.
     *
     * @param url the endpoint URL
     * @param outputOptions output options keyed by wire name
     * @param transport the transport
     * @return a new client
     */
    public static RipcordClient client(String url, Map<String, ?> outputOptions, Transport transport) {
        return clientBuilder()
                .url(url)
                .outputOptions(outputOptions)
                .transport(transport)
                .build();
    }

    /**
     * Creates a client speaking XML-RPC.
     *
     * @param url the endpoint URL
     * @return a new client
     */
    public static RipcordClient xmlrpcClient(String url) {
        return clientBuilder().url(url).version(ProtocolVersion.XMLRPC).build();
    }

    /**
     * Creates a client speaking SOAP 1.1. Requires a SOAP codec, see {@link RipcordClientBuilder#codec}.
     *
     * @param url the endpoint URL
     * @return a new client
     * @throws org.apache.ripcord.exception.ConfigurationException as no SOAP codec is bundled
     */
    public static RipcordClient soapClient(String url) {
        return clientBuilder().url(url).version(ProtocolVersion.SOAP_1_1).build();
    }

    /**
     * Creates a client speaking Simple RPC. Requires a Simple RPC codec, see
     * {@link RipcordClientBuilder#codec}.
     *
     * @param url the endpoint URL
     * @return a new client
     * @throws org.apache.ripcord.exception.ConfigurationException as no Simple RPC codec is bundled
     */
    public static RipcordClient simpleClient(String url) {
        return clientBuilder().url(url).version(ProtocolVersion.SIMPLE).build();
    }

    public static RipcordClientBuilder clientBuilder() {
        return RipcordClient.builder();
    }

    /**
     * Creates a server for the given services, keyed by namespace.
     *
     * @param services the services; numeric keys register without a namespace
     * @return a new server
     */
    public static RipcordServer server(Map<String, ?> services) {
        return serverBuilder().services(services).build();
    }

    public static RipcordServerBuilder serverBuilder() {
        return RipcordServer.builder();
    }

    /**
     * Creates a fault value.
     *
     * @param code the fault code
     * @param message the fault string
     * @return the fault
     */
    public static Fault fault(int code, String message) {
        return new Fault(code, message);
    }

    /**
     * Checks whether a result is a fault.
     *
     * @param value a result
     * @return true for a {@link Fault} or a fault-shaped struct
     */
    public static boolean isFault(Object value) {
        return Fault.isFault(value);
    }

    /**
     * Converts seconds since the epoch to a timestamp value.
     *
     * @param epochSeconds unix timestamp
     * @return the timestamp value
     */
    public static DateTimeValue datetime(long epochSeconds) {
        return DateTimeValue.ofEpochSecond(epochSeconds);
    }

    /**
     * Converts a timestamp value to seconds since the epoch.
     *
     * @param value a {@link DateTimeValue}
     * @return unix timestamp
     * @throws InvalidArgumentException if the value is not a timestamp value
     */
    public static long timestamp(Object value) {
        if (!(value instanceof DateTimeValue dateTime)) {
            throw new InvalidArgumentException(RipcordErrorCode.NOT_DATETIME, "Argument is not a valid datetime");
        }
        return dateTime.epochSecond();
    }

    /**
     * Wraps bytes in a binary-blob value.
     *
     * @param data the bytes
     * @return the binary-blob value
     */
    public static Base64Value base64(byte[] data) {
        return new Base64Value(data);
    }

    /**
     * Unwraps a binary-blob value.
     *
     * @param value a {@link Base64Value}
     * @return the bytes
     * @throws InvalidArgumentException if the value is not a binary-blob value
     */
    public static byte[] binary(Object value) {
        if (!(value instanceof Base64Value blob)) {
            throw new InvalidArgumentException(RipcordErrorCode.NOT_BASE64, "Argument is not a valid base64 value");
        }
        return blob.bytes();
    }

    /**
     * Creates a call descriptor outside of a batch scope, to be passed to {@code system.multiCall}.
     *
     * @param methodName the procedure name
     * @param params the positional arguments
     * @return the call
     */
    public static Call encodeCall(String methodName, Object... params) {
        return new Call(methodName, params);
    }

    /**
     * Returns the SDK version string.
     *
     * @return the version string (e.g., "0.3.0")
     */
    public static String version() {
        return RipcordVersion.getInstance().getVersion();
    }

    /**
     * Returns detailed version information.
     *
     * @return the version information object
     */
    public static RipcordVersion versionInfo() {
        return RipcordVersion.getInstance();
    }
}
