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

package org.apache.ripcord.codec;


import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Protocol encoding options shared by the client and the server.
 *
 * <p>Options can be set by their wire names through {@link Builder#option(String, Object)}:
 * <ul>
 *   <li>{@code verbosity}: {@code no_white_space}, {@code newlines_only} or {@code pretty}</li>
 *   <li>{@code escaping}: one or more of {@code markup}, {@code non-ascii}, {@code non-print}, {@code cdata}</li>
 *   <li>{@code version}: {@code xmlrpc}, {@code soap 1.1}, {@code simple} or {@code auto}</li>
 *   <li>{@code encoding}: any supported character encoding</li>
 * </ul>
 */
public final class OutputOptions {

    public static final String VERBOSITY = "verbosity";
    public static final String ESCAPING = "escaping";
    public static final String VERSION = "version";
    public static final String ENCODING = "encoding";

    private static final Set<String> OPTION_NAMES = Set.of(VERBOSITY, ESCAPING, VERSION, ENCODING);

    private final Verbosity verbosity;
    private final Set<Escaping> escaping;
    private final ProtocolVersion version;
    private final Charset encoding;

    private OutputOptions(Builder builder) {
        this.verbosity = builder.verbosity;
        this.escaping = Collections.unmodifiableSet(
                builder.escaping.isEmpty() ? EnumSet.noneOf(Escaping.class) : EnumSet.copyOf(builder.escaping));
        this.version = builder.version;
        this.encoding = builder.encoding;
    }

    /**
     * Returns the default client options: pretty printed XML-RPC, markup escaping, UTF-8.
     *
     * @return the client defaults
     */
    public static OutputOptions clientDefaults() {
        return builder().build();
    }

    /**
     * Returns the default server options, which differ from the client ones only in answering in the
     * version of the request.
     *
     * @return the server defaults
     */
    public static OutputOptions serverDefaults() {
        return builder().version(ProtocolVersion.AUTO).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static boolean isOptionName(String name) {
        return name != null && OPTION_NAMES.contains(name.toLowerCase(Locale.ROOT));
    }

    public Verbosity verbosity() {
        return verbosity;
    }

    public Set<Escaping> escaping() {
        return escaping;
    }

    public boolean escapes(Escaping rule) {
        return escaping.contains(rule);
    }

    public ProtocolVersion version() {
        return version;
    }

    public Charset encoding() {
        return encoding;
    }

    public Builder toBuilder() {
        return new Builder()
                .verbosity(verbosity)
                .escaping(escaping)
                .version(version)
                .encoding(encoding);
    }

    @Override
    public String toString() {
        return "OutputOptions{verbosity=" + verbosity.optionValue()
                + ", escaping=" + escaping
                + ", version=" + version.optionValue()
                + ", encoding=" + encoding.name() + "}";
    }

    public static final class Builder {

        private Verbosity verbosity = Verbosity.PRETTY;
        private Set<Escaping> escaping = EnumSet.of(Escaping.MARKUP);
        private ProtocolVersion version = ProtocolVersion.XMLRPC;
        private Charset encoding = StandardCharsets.UTF_8;

        private Builder() {}

        public Builder verbosity(Verbosity verbosity) {
            this.verbosity = verbosity;
            return this;
        }

        public Builder escaping(Escaping... escaping) {
            return escaping(Arrays.asList(escaping));
        }

        public Builder escaping(Collection<Escaping> escaping) {
            this.escaping = escaping.isEmpty() ? EnumSet.noneOf(Escaping.class) : EnumSet.copyOf(escaping);
            return this;
        }

        public Builder version(ProtocolVersion version) {
            this.version = version;
            return this;
        }

        public Builder encoding(Charset encoding) {
            this.encoding = encoding;
            return this;
        }

        /**
         * Sets an option by its wire name.
         *
         * @param name one of {@code verbosity}, {@code escaping}, {@code version}, {@code encoding}
         * @param value the option value, as an enum, a string, or for escaping a collection of either
         * @return this builder
         * @throws IllegalArgumentException if the name or value is not recognised
         */
        public Builder option(String name, Object value) {
            if (!isOptionName(name)) {
                throw new IllegalArgumentException("Unknown output option: " + name);
            }
            switch (name.toLowerCase(Locale.ROOT)) {
                case VERBOSITY -> verbosity(value instanceof Verbosity v ? v : Verbosity.fromOptionValue(value.toString()));
                case VERSION -> version(
                        value instanceof ProtocolVersion v ? v : ProtocolVersion.fromOptionValue(value.toString()));
                case ENCODING -> encoding(value instanceof Charset c ? c : Charset.forName(value.toString()));
                default -> escaping(toEscaping(value));
            }
            return this;
        }

        private static Set<Escaping> toEscaping(Object value) {
            Set<Escaping> rules = EnumSet.noneOf(Escaping.class);
            if (value instanceof Collection<?> values) {
                for (Object rule : values) {
                    rules.add(rule instanceof Escaping e ? e : Escaping.fromOptionValue(rule.toString()));
                }
            } else if (value instanceof Escaping e) {
                rules.add(e);
            } else {
                rules.add(Escaping.fromOptionValue(value.toString()));
            }
            return rules;
        }

        public OutputOptions build() {
            return new OutputOptions(this);
        }
    }
}
