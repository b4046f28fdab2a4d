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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.apache.commons.lang3.StringUtils;
import org.apache.ripcord.server.MethodDescriptor;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Machine readable description of the procedures of a server, one entry per registered procedure.
 *
 * @param version the manifest format version
 * @param methodList the procedure descriptions in registration order
 */
@JsonPropertyOrder({"version", "methodList"})
public record IntrospectionManifest(String version, List<MethodDescription> methodList) {

    public static final String VERSION = "1.0";

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\R[ \\t]*\\R");

    public IntrospectionManifest {
        methodList = List.copyOf(methodList);
    }

    /**
     * Builds the manifest of the given methods.
     *
     * @param methods the registered methods
     * @return the manifest
     */
    public static IntrospectionManifest of(List<MethodDescriptor> methods) {
        return new IntrospectionManifest(VERSION, methods.stream()
                .map(method -> new MethodDescription(method.name(), toPurpose(method.description()), method.signatures()))
                .toList());
    }

    public Optional<MethodDescription> find(String name) {
        return methodList.stream().filter(method -> method.name().equals(name)).findFirst();
    }

    @JsonIgnore
    public List<String> names() {
        return methodList.stream().map(MethodDescription::name).toList();
    }

    /**
     * Wraps a description in HTML paragraphs, a blank line starting a new paragraph.
     *
     * @param description the plain description
     * @return the purpose, or an empty string for a blank description
     */
    static String toPurpose(String description) {
        if (StringUtils.isBlank(description)) {
            return "";
        }
        return "<p>" + PARAGRAPH_BREAK.matcher(description.trim()).replaceAll("</p><p>") + "</p>";
    }
}
