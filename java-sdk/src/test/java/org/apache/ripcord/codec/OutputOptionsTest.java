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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputOptionsTest {

    @Test
    void shouldDefaultToPrettyMarkupEscapedXmlRpc() {
        // when
        OutputOptions options = OutputOptions.clientDefaults();

        // then
        assertThat(options.verbosity()).isEqualTo(Verbosity.PRETTY);
        assertThat(options.escaping()).containsExactly(Escaping.MARKUP);
        assertThat(options.version()).isEqualTo(ProtocolVersion.XMLRPC);
        assertThat(options.encoding()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(OutputOptions.serverDefaults().version()).isEqualTo(ProtocolVersion.AUTO);
    }

    @Test
    void shouldSetOptionsByWireName() {
        // when
        OutputOptions options = OutputOptions.builder()
                .option("verbosity", "newlines_only")
                .option("escaping", List.of("markup", "non-ascii"))
                .option("version", "xmlrpc")
                .option("encoding", "iso-8859-1")
                .build();

        // then
        assertThat(options.verbosity()).isEqualTo(Verbosity.NEWLINES_ONLY);
        assertThat(options.escaping()).containsExactlyInAnyOrder(Escaping.MARKUP, Escaping.NON_ASCII);
        assertThat(options.encoding()).isEqualTo(StandardCharsets.ISO_8859_1);
    }

    @Test
    void shouldAcceptEnumValues() {
        // when
        OutputOptions options = OutputOptions.builder()
                .option("VERBOSITY", Verbosity.NO_WHITE_SPACE)
                .option("escaping", Escaping.CDATA)
                .build();

        // then
        assertThat(options.verbosity()).isEqualTo(Verbosity.NO_WHITE_SPACE);
        assertThat(options.escaping()).containsExactly(Escaping.CDATA);
    }

    @Test
    void shouldKeepOptionsWhenCopied() {
        // given
        OutputOptions original = OutputOptions.builder().escaping(Escaping.NON_PRINT, Escaping.NON_PRINT).build();

        // when
        OutputOptions copy = original.toBuilder().verbosity(Verbosity.NO_WHITE_SPACE).build();

        // then
        assertThat(copy.escaping()).containsExactly(Escaping.NON_PRINT);
        assertThat(original.verbosity()).isEqualTo(Verbosity.PRETTY);
    }

    @ParameterizedTest
    @ValueSource(strings = {"verbosity", "Escaping", "version", "encoding"})
    void shouldRecognizeOptionNames(String name) {
        assertThat(OutputOptions.isOptionName(name)).isTrue();
    }

    @Test
    void shouldRejectUnknownOption() {
        assertThatThrownBy(() -> OutputOptions.builder().option("colour", "blue"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown output option: colour");
    }

    @Test
    void shouldRejectUnknownValue() {
        assertThatThrownBy(() -> OutputOptions.builder().option("verbosity", "loud"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown verbosity: loud");
    }
}
