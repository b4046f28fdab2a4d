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

import org.apache.ripcord.codec.OutputOptions;
import org.apache.ripcord.codec.ProtocolVersion;
import org.apache.ripcord.codec.RpcCodec;
import org.apache.ripcord.codec.XmlRpcCodec;
import org.apache.ripcord.exception.ConfigurationException;
import org.apache.ripcord.exception.InvalidArgumentException;
import org.apache.ripcord.transport.HttpTransport;
import org.apache.ripcord.transport.Transport;
import org.apache.ripcord.transport.UrlValidator;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Builder for creating configured RipcordClient instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Basic usage
 * var client = RipcordClient.builder()
 *     .url("http://localhost:8080/rpc")
 *     .build();
 *
 * // Throwing faults instead of returning them as values
 * var client = RipcordClient.builder()
 *     .url("http://localhost:8080/rpc")
 *     .throwExceptions(true)
 *     .requestTimeout(Duration.ofSeconds(5))
 *     .build();
 *
 * // Compact output
 * var client = RipcordClient.builder()
 *     .url("http://localhost:8080/rpc")
 *     .outputOption("verbosity", "no_white_space")
 *     .build();
 * }</pre>
 *
 * @see RipcordClient#builder()
 */
public final class RipcordClientBuilder {

    private String url;
    private Transport transport;
    private RpcCodec codec;
    private OutputOptions.Builder outputOptions = OutputOptions.clientDefaults().toBuilder();
    private Duration connectionTimeout;
    private Duration requestTimeout;
    private boolean throwExceptions;
    private boolean autoDecode = true;

    RipcordClientBuilder() {}

    /**
     * Sets the URL of the RPC endpoint.
     *
     * @param url the full URL (e.g., "http://localhost:8080/rpc")
     * @return this builder
     */
    public RipcordClientBuilder url(String url) {
        this.url = url;
        return this;
    }

    /**
     * Sets the transport used to post requests. Defaults to an {@link HttpTransport}.
     *
     * @param transport the transport
     * @return this builder
     */
    public RipcordClientBuilder transport(Transport transport) {
        this.transport = transport;
        return this;
    }

    /**
     * Sets the codec used for requests and responses. Defaults to the codec of the protocol version.
     *
     * @param codec the codec
     * @return this builder
     */
    public RipcordClientBuilder codec(RpcCodec codec) {
        this.codec = codec;
        return this;
    }

    /**
     * Replaces all output options.
     *
     * @param outputOptions the output options
     * @return this builder
     */
    public RipcordClientBuilder outputOptions(OutputOptions outputOptions) {
        this.outputOptions = outputOptions.toBuilder();
        return this;
    }

    /**
     * Sets one output option by its wire name.
     *
     * @param name the option name
     * @param value the option value
     * @return this builder
     * @throws IllegalArgumentException if the option is not recognised
     */
    public RipcordClientBuilder outputOption(String name, Object value) {
        this.outputOptions.option(name, value);
        return this;
    }

    /**
     * Merges the given output options, keyed by wire name.
     *
     * @param options the options to set
     * @return this builder
     */
    public RipcordClientBuilder outputOptions(Map<String, ?> options) {
        options.forEach(this.outputOptions::option);
        return this;
    }

    /**
     * Sets the protocol version.
     *
     * @param version the protocol version
     * @return this builder
     */
    public RipcordClientBuilder version(ProtocolVersion version) {
        this.outputOptions.version(version);
        return this;
    }

    /**
     * Sets the connection timeout of the default transport.
     *
     * @param connectionTimeout the connection timeout duration
     * @return this builder
     */
    public RipcordClientBuilder connectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    /**
     * Sets the request timeout of the default transport.
     *
     * @param requestTimeout the request timeout duration
     * @return this builder
     */
    public RipcordClientBuilder requestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    /**
     * Sets whether faults answered by the server are thrown as
     * {@link org.apache.ripcord.exception.RemoteProcedureException}. Disabled by default, in which case
     * faults are returned as {@link org.apache.ripcord.value.Fault} values.
     *
     * @param throwExceptions whether to throw faults
     * @return this builder
     */
    public RipcordClientBuilder throwExceptions(boolean throwExceptions) {
        this.throwExceptions = throwExceptions;
        return this;
    }

    /**
     * Sets whether base64 and dateTime results of a multiCall are converted to {@code byte[]} and epoch
     * seconds. Enabled by default.
     *
     * @param autoDecode whether to decode
     * @return this builder
     */
    public RipcordClientBuilder autoDecode(boolean autoDecode) {
        this.autoDecode = autoDecode;
        return this;
    }

    /**
     * Builds and returns a configured RipcordClient instance.
     *
     * @return a new RipcordClient instance
     * @throws InvalidArgumentException if the url is not a valid http or https URL
     * @throws ConfigurationException if no codec is available for the protocol version
     */
    public RipcordClient build() {
        String endpoint = UrlValidator.requireEndpoint(url);
        OutputOptions options = outputOptions.build();
        RpcCodec finalCodec = codec != null ? codec : XmlRpcCodec.forOptions(options);
        Transport finalTransport = transport != null
                ? transport
                : new HttpTransport(
                        Optional.ofNullable(connectionTimeout), Optional.ofNullable(requestTimeout), options.encoding());
        return new RipcordClient(
                new ClientSession(endpoint, finalTransport, finalCodec, options, throwExceptions, autoDecode));
    }
}
