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

package org.apache.ripcord.documentor;

import org.apache.commons.lang3.StringUtils;
import org.apache.ripcord.codec.ProtocolVersion;
import org.apache.ripcord.server.MethodDescriptor;
import org.apache.ripcord.server.RipcordServer;
import org.apache.ripcord.server.ServerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Renders an HTML page listing the procedures of a server with their signatures and help, or the JSON
 * introspection manifest when requested with the {@code manifest} query.
 */
public class DefaultDocumentor implements Documentor {

    private static final Logger log = LoggerFactory.getLogger(DefaultDocumentor.class);

    public static final String DEFAULT_NAME = "Ripcord: Simple RPC Server";
    public static final String MANIFEST_QUERY = "manifest";

    private static final String XMLRPC_LINK = "<a href=\"http://www.xmlrpc.com/spec\">XML-RPC</a>";
    private static final String SIMPLE_LINK =
            "<a href=\"http://sites.google.com/a/simplerpc.org/simplerpc/Home/simplerpc-specification-v09\">"
                    + "SimpleRPC 1.0</a>";
    private static final String SOAP_LINK = "<a href=\"http://www.w3.org/TR/2000/NOTE-SOAP-20000508/\">SOAP 1.1</a>";

    private final String name;
    private final String css;
    private final ProtocolVersion version;
    private final Charset charset;
    private volatile List<MethodDescriptor> methods = List.of();

    private DefaultDocumentor(Builder builder) {
        this.name = builder.name;
        this.css = builder.css;
        this.version = builder.version;
        this.charset = builder.charset;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public ProtocolVersion getVersion() {
        return version;
    }

    @Override
    public void setMethodData(List<MethodDescriptor> methods) {
        this.methods = List.copyOf(methods);
    }

    @Override
    public IntrospectionManifest getIntrospection() {
        return IntrospectionManifest.of(methods);
    }

    @Override
    public ServerResponse handle(RipcordServer server, String query) {
        if (MANIFEST_QUERY.equals(query)) {
            log.debug("Rendering introspection manifest of {} procedures", methods.size());
            return ServerResponse.json(
                    ObjectMapperFactory.getInstance().writeValueAsString(getIntrospection()), charset);
        }
        return ServerResponse.html(renderHtml(server), charset);
    }

    private String renderHtml(RipcordServer server) {
        StringBuilder html = new StringBuilder();
        html.append("<html><head><title>").append(escape(name)).append("</title>");
        if (StringUtils.isNotBlank(css)) {
            html.append("<link rel=\"stylesheet\" type=\"text/css\" href=\"").append(escape(css)).append("\">");
        }
        html.append("</head><body>");
        html.append("<h1>").append(escape(name)).append("</h1>");
        html.append("<p>").append(describeVersion()).append("</p>");
        for (Object method : (List<?>) server.call("system.listMethods", List.of())) {
            html.append("<h2>").append(escape(String.valueOf(method))).append("( ");
            Object signatures = server.call("system.methodSignature", List.of(method));
            if (signatures instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof List<?> types) {
                html.append(escape(StringUtils.join(types, " , ")));
            }
            html.append(" )</h2>");
            html.append(server.call("system.methodHelp", List.of(method)));
        }
        html.append("</body></html>");
        return html.toString();
    }

    private String describeVersion() {
        return switch (version) {
            case XMLRPC -> "This server implements the " + XMLRPC_LINK + " specification.";
            case SIMPLE -> "This server implements the " + SIMPLE_LINK + " specification.";
            case SOAP_1_1 -> "This server implements the " + SOAP_LINK + " specification.";
            case AUTO -> "This server implements the " + SOAP_LINK + ", " + XMLRPC_LINK + " and " + SIMPLE_LINK
                    + " specification.";
        };
    }

    private static String escape(String text) {
        return StringUtils.replaceEach(
                text, new String[] {"&", "<", ">", "\""}, new String[] {"&amp;", "&lt;", "&gt;", "&quot;"});
    }

    public static final class Builder {

        private String name = DEFAULT_NAME;
        private String css;
        private ProtocolVersion version = ProtocolVersion.AUTO;
        private Charset charset = StandardCharsets.UTF_8;

        private Builder() {}

        public Builder name(String name) {
            this.name = StringUtils.defaultIfBlank(name, DEFAULT_NAME);
            return this;
        }

        /**
         * Sets the URL of a stylesheet linked from the documentation page.
         *
         * @param css the stylesheet URL
         * @return this builder
         */
        public Builder css(String css) {
            this.css = css;
            return this;
        }

        public Builder version(ProtocolVersion version) {
            this.version = version;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public DefaultDocumentor build() {
            return new DefaultDocumentor(this);
        }
    }
}
