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
import org.apache.ripcord.codec.XmlRpcCodec;
import org.apache.ripcord.documentor.DefaultDocumentor;
import org.apache.ripcord.documentor.Documentor;
import org.apache.ripcord.exception.ConfigurationException;
import org.apache.ripcord.exception.InvalidArgumentException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Builder for creating configured RipcordServer instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * var server = RipcordServer.builder()
 *     .method("echo", params -> params.get(0))
 *     .service("math", mathService)
 *     .name("Calculator")
 *     .build();
 *
 * // Without documentation page
 * var server = RipcordServer.builder()
 *     .services(Map.of("math", mathService))
 *     .disableDocumentor()
 *     .build();
 * }</pre>
 *
 * @see RipcordServer#builder()
 */
public final class RipcordServerBuilder {

    private final List<Consumer<RipcordServer>> registrations = new ArrayList<>();
    private OutputOptions.Builder outputOptions = OutputOptions.serverDefaults().toBuilder();
    private RpcCodec codec;
    private Documentor documentor;
    private boolean documentorEnabled = true;
    private String name;
    private String css;

    RipcordServerBuilder() {}

    /**
     * Registers a service without a namespace.
     *
     * @param service an {@link RpcService}
     * @return this builder
     */
    public RipcordServerBuilder service(Object service) {
        registrations.add(server -> server.addService(service));
        return this;
    }

    /**
     * Registers a service under a namespace.
     *
     * @param namespace the namespace
     * @param service an {@link RpcService} or an {@link RpcProcedure}
     * @return this builder
     */
    public RipcordServerBuilder service(String namespace, Object service) {
        registrations.add(server -> server.addService(namespace, service));
        return this;
    }

    /**
     * Registers services keyed by namespace; numeric keys register without a namespace.
     *
     * @param services the services
     * @return this builder
     */
    public RipcordServerBuilder services(Map<String, ?> services) {
        registrations.add(server -> server.addServices(services));
        return this;
    }

    public RipcordServerBuilder method(String name, RpcProcedure procedure) {
        registrations.add(server -> server.addMethod(name, procedure));
        return this;
    }

    public RipcordServerBuilder method(String name, RpcProcedure procedure, String description) {
        registrations.add(server -> server.addMethod(name, procedure, description));
        return this;
    }

    public RipcordServerBuilder method(MethodDescriptor method) {
        registrations.add(server -> server.addMethod(method));
        return this;
    }

    /**
     * Replaces the default documentor.
     *
     * @param documentor the documentor
     * @return this builder
     */
    public RipcordServerBuilder documentor(Documentor documentor) {
        this.documentor = documentor;
        this.documentorEnabled = true;
        return this;
    }

    /**
     * Disables documentation: requests without payload are answered with a fault.
     *
     * @return this builder
     */
    public RipcordServerBuilder disableDocumentor() {
        this.documentor = null;
        this.documentorEnabled = false;
        return this;
    }

    /**
     * Sets the title of the default documentation page.
     *
     * @param name the server name
     * @return this builder
     */
    public RipcordServerBuilder name(String name) {
        this.name = name;
        return this;
    }

    /**
     * Sets the stylesheet of the default documentation page.
     *
     * @param css the stylesheet URL
     * @return this builder
     */
    public RipcordServerBuilder css(String css) {
        this.css = css;
        return this;
    }

    public RipcordServerBuilder outputOptions(OutputOptions outputOptions) {
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
    public RipcordServerBuilder outputOption(String name, Object value) {
        this.outputOptions.option(name, value);
        return this;
    }

    public RipcordServerBuilder codec(RpcCodec codec) {
        this.codec = codec;
        return this;
    }

    /**
     * Builds the server and registers the services and methods in the order they were given.
     *
     * @return a new RipcordServer instance
     * @throws ConfigurationException if no codec is available for the protocol version
     * @throws InvalidArgumentException if a service is of an unknown type
     */
    public RipcordServer build() {
        OutputOptions options = outputOptions.build();
        RpcCodec finalCodec = codec != null ? codec : XmlRpcCodec.forOptions(options);
        Documentor finalDocumentor = null;
        if (documentorEnabled) {
            finalDocumentor = documentor != null
                    ? documentor
                    : DefaultDocumentor.builder()
                            .name(name)
                            .css(css)
                            .version(options.version())
                            .charset(options.encoding())
                            .build();
        }
        RipcordServer server = new RipcordServer(finalCodec, finalDocumentor, options);
        registrations.forEach(registration -> registration.accept(server));
        return server;
    }
}
